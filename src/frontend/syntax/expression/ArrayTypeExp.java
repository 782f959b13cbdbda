package frontend.syntax.expression;

import frontend.Token.Token;

import java.util.Objects;

// 数组类型 '[' ('Int' | 'Float') ';' IntConst ']'，只出现在声明里

public class ArrayTypeExp extends Exp {
    private final Token typeToken;
    private final int size;

    public ArrayTypeExp(Token typeToken, int size) {
        this.typeToken = typeToken;
        this.size = size;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append('[').append(getTypeName()).append("; ").append(size).append(']');
    }

    public String getTypeName() {
        return typeToken.getContent();
    }

    public int getSize() {
        return size;
    }

    @Override
    public Token getToken() {
        return typeToken;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayTypeExp)) return false;
        ArrayTypeExp other = (ArrayTypeExp) o;
        return size == other.size && getTypeName().equals(other.getTypeName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getTypeName(), size);
    }
}
