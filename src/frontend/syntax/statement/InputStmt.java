package frontend.syntax.statement;

import frontend.Token.Token;
import frontend.syntax.expression.Variable;

// 'input' '(' Variable ')' ';'

public class InputStmt extends Stmt {
    private final Token inputToken;
    private final Variable target;

    public InputStmt(Token inputToken, Variable target) {
        this.inputToken = inputToken;
        this.target = target;
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        indent(sb, indent);
        sb.append("input(");
        target.print(sb, indent);
        sb.append(");\n");
    }

    public Variable getTarget() {
        return target;
    }

    @Override
    public Token getStartToken() {
        return inputToken;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InputStmt)) return false;
        return target.equals(((InputStmt) o).target);
    }

    @Override
    public int hashCode() {
        return target.hashCode() + 7;
    }
}
