package frontend.syntax.expression;

import frontend.Token.Token;

// '!' UnaryExp

public class NotExp extends Exp {
    private final Token notToken;
    private final Exp operand;

    public NotExp(Token notToken, Exp operand) {
        this.notToken = notToken;
        this.operand = operand;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append('!');
        operand.print(sb);
    }

    public Exp getOperand() {
        return operand;
    }

    @Override
    public Token getToken() {
        return notToken;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotExp)) return false;
        return operand.equals(((NotExp) o).operand);
    }

    @Override
    public int hashCode() {
        return 31 * operand.hashCode() + 1;
    }
}
