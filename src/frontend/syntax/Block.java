package frontend.syntax;

import frontend.Token.Token;
import frontend.syntax.statement.Stmt;

import java.util.ArrayList;

//语句块 Block → '{' { Stmt } '}'

public class Block extends SyntaxNode {
    private final ArrayList<Stmt> stmts;
    private final Token finalToken; //标注结尾的}的行号

    public Block(ArrayList<Stmt> stmts, Token finalToken) {
        this.stmts = stmts;
        this.finalToken = finalToken;
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append("{\n");
        for (Stmt stmt : stmts) {
            stmt.print(sb, indent + 1);
        }
        indent(sb, indent);
        sb.append("}");
    }

    public ArrayList<Stmt> getStmts() {
        return stmts;
    }

    public Token getFinalToken() {
        return finalToken;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        return stmts.equals(((Block) o).stmts);
    }

    @Override
    public int hashCode() {
        return stmts.hashCode();
    }
}
