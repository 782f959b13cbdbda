package frontend.syntax.expression;

import frontend.Token.Token;

// 字符串只能出现在 output 和赋值右侧（后者是类型错误）

public class StringLiteral extends Exp {
    private final Token token;

    public StringLiteral(Token token) {
        this.token = token;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append('"').append(token.getContent()).append('"');
    }

    public String getText() {
        return token.getContent();
    }

    @Override
    public Token getToken() {
        return token;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StringLiteral)) return false;
        return getText().equals(((StringLiteral) o).getText());
    }

    @Override
    public int hashCode() {
        return getText().hashCode();
    }
}
