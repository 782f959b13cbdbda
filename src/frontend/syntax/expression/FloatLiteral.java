package frontend.syntax.expression;

import frontend.Token.Token;

import java.math.BigDecimal;

public class FloatLiteral extends Exp {
    private final Token token;
    private final float value;

    public FloatLiteral(Token token, float value) {
        this.token = token;
        this.value = value;
    }

    @Override
    public void print(StringBuilder sb) {
        // 词法上浮点数只有 digits.digits 一种写法，不能出现指数
        String text = new BigDecimal(Float.toString(Math.abs(value))).toPlainString();
        if (text.indexOf('.') < 0) {
            text = text + ".0";
        }
        if (value < 0 || (value == 0.0f && 1.0f / value < 0)) {
            sb.append("(-").append(text).append(')');
        } else {
            sb.append(text);
        }
    }

    public float getValue() {
        return value;
    }

    @Override
    public Token getToken() {
        return token;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FloatLiteral)) return false;
        return Float.compare(value, ((FloatLiteral) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Float.hashCode(value);
    }
}
