package frontend.syntax.statement;

import frontend.Token.Token;
import frontend.syntax.expression.Exp;

import java.util.ArrayList;

// 'output' '(' Exp { ',' Exp } ')' ';'

public class OutputStmt extends Stmt {
    private final Token outputToken;
    private final ArrayList<Exp> exps;

    public OutputStmt(Token outputToken, ArrayList<Exp> exps) {
        this.outputToken = outputToken;
        this.exps = exps;
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        indent(sb, indent);
        sb.append("output(");
        for (int i = 0; i < exps.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            exps.get(i).print(sb);
        }
        sb.append(");\n");
    }

    public ArrayList<Exp> getExps() {
        return exps;
    }

    @Override
    public Token getStartToken() {
        return outputToken;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutputStmt)) return false;
        return exps.equals(((OutputStmt) o).exps);
    }

    @Override
    public int hashCode() {
        return exps.hashCode() + 11;
    }
}
