package frontend.syntax.expression;

import frontend.Token.Token;

import java.util.Objects;

public class ArrayVariable extends Variable {
    private final Exp index;

    public ArrayVariable(Token ident, Exp index) {
        super(ident);
        this.index = index;
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append(getName()).append('[');
        index.print(sb);
        sb.append(']');
    }

    public Exp getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayVariable)) return false;
        ArrayVariable other = (ArrayVariable) o;
        return getName().equals(other.getName()) && index.equals(other.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), index);
    }
}
