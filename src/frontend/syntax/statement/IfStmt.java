package frontend.syntax.statement;

import frontend.Token.Token;
import frontend.syntax.Block;
import frontend.syntax.expression.Cond;

import java.util.Objects;

// 'if' '(' Cond ')' 'then' Block 'else' Block ，else 块可以为空

public class IfStmt extends Stmt {
    private final Token ifToken;
    private final Cond cond;
    private final Block ifBlock;
    private final Block elseBlock;

    public IfStmt(Token ifToken, Cond cond, Block ifBlock, Block elseBlock) {
        this.ifToken = ifToken;
        this.cond = cond;
        this.ifBlock = ifBlock;
        this.elseBlock = elseBlock;
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        indent(sb, indent);
        sb.append("if (");
        cond.print(sb, indent);
        sb.append(") then ");
        ifBlock.print(sb, indent);
        sb.append(" else ");
        elseBlock.print(sb, indent);
        sb.append('\n');
    }

    public Cond getCond() {
        return cond;
    }

    public Block getIfBlock() {
        return ifBlock;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    @Override
    public Token getStartToken() {
        return ifToken;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IfStmt)) return false;
        IfStmt other = (IfStmt) o;
        return cond.equals(other.cond) && ifBlock.equals(other.ifBlock) && elseBlock.equals(other.elseBlock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cond, ifBlock, elseBlock);
    }
}
