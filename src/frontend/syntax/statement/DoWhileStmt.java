package frontend.syntax.statement;

import frontend.Token.Token;
import frontend.syntax.Block;
import frontend.syntax.expression.Cond;

import java.util.Objects;

// 'do' Block 'while' '(' Cond ')' ';'

public class DoWhileStmt extends Stmt {
    private final Token doToken;
    private final Block body;
    private final Cond cond;

    public DoWhileStmt(Token doToken, Block body, Cond cond) {
        this.doToken = doToken;
        this.body = body;
        this.cond = cond;
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        indent(sb, indent);
        sb.append("do ");
        body.print(sb, indent);
        sb.append(" while (");
        cond.print(sb, indent);
        sb.append(");\n");
    }

    public Block getBody() {
        return body;
    }

    public Cond getCond() {
        return cond;
    }

    @Override
    public Token getStartToken() {
        return doToken;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DoWhileStmt)) return false;
        DoWhileStmt other = (DoWhileStmt) o;
        return body.equals(other.body) && cond.equals(other.cond);
    }

    @Override
    public int hashCode() {
        return Objects.hash(body, cond);
    }
}
