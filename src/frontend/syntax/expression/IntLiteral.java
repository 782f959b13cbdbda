package frontend.syntax.expression;

import frontend.Token.Token;

public class IntLiteral extends Exp {
    private final Token token;
    private final int value;

    public IntLiteral(Token token, int value) {
        this.token = token;
        this.value = value;
    }

    @Override
    public void print(StringBuilder sb) {
        if (value < 0) {
            sb.append('(').append(value).append(')');
        } else {
            sb.append(value);
        }
    }

    public int getValue() {
        return value;
    }

    @Override
    public Token getToken() {
        return token;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntLiteral)) return false;
        return value == ((IntLiteral) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }
}
