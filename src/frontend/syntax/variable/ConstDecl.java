package frontend.syntax.variable;

import frontend.Token.Token;
import frontend.syntax.expression.Exp;

import java.util.Objects;

// 常量声明 ConstDecl → '@define' 'Const' Ident ':' ('Int' | 'Float') '=' Literal ';'

public class ConstDecl extends Decl {
    private final Token ident;
    private final Token typeName;
    private final Exp value;

    public ConstDecl(Token ident, Token typeName, Exp value) {
        this.ident = ident;
        this.typeName = typeName;
        this.value = value;
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        indent(sb, indent);
        sb.append("@define Const ").append(getName()).append(": ").append(getTypeName()).append(" = ");
        value.print(sb);
        sb.append(";\n");
    }

    public Token getIdent() {
        return ident;
    }

    public String getName() {
        return ident.getContent();
    }

    public String getTypeName() {
        return typeName.getContent();
    }

    public Exp getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstDecl)) return false;
        ConstDecl other = (ConstDecl) o;
        return getName().equals(other.getName()) && getTypeName().equals(other.getTypeName())
                && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), getTypeName(), value);
    }
}
