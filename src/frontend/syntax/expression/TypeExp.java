package frontend.syntax.expression;

import frontend.Token.Token;

// 标量类型 'Int' | 'Float'，只出现在声明里

public class TypeExp extends Exp {
    private final Token typeToken;

    public TypeExp(Token typeToken) {
        this.typeToken = typeToken;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append(getTypeName());
    }

    public String getTypeName() {
        return typeToken.getContent();
    }

    @Override
    public Token getToken() {
        return typeToken;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeExp)) return false;
        return getTypeName().equals(((TypeExp) o).getTypeName());
    }

    @Override
    public int hashCode() {
        return getTypeName().hashCode();
    }
}
