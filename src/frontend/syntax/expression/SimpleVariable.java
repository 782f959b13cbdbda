package frontend.syntax.expression;

import frontend.Token.Token;

public class SimpleVariable extends Variable {

    public SimpleVariable(Token ident) {
        super(ident);
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append(getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimpleVariable)) return false;
        return getName().equals(((SimpleVariable) o).getName());
    }

    @Override
    public int hashCode() {
        return getName().hashCode();
    }
}
