package frontend.syntax.variable;

import frontend.Token.Token;
import frontend.syntax.expression.Exp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

//变量声明 VarDecl → 'let' Ident { ',' Ident } ':' TypeSpec ';'
// TypeSpec 是 TypeExp 或 ArrayTypeExp

public class VarDecl extends Decl {
    private final ArrayList<Token> idents;
    private final Exp typeSpec;

    public VarDecl(ArrayList<Token> idents, Exp typeSpec) {
        this.idents = idents;
        this.typeSpec = typeSpec;
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        indent(sb, indent);
        sb.append("let ").append(String.join(", ", getNames())).append(": ");
        typeSpec.print(sb);
        sb.append(";\n");
    }

    public ArrayList<Token> getIdents() {
        return idents;
    }

    public List<String> getNames() {
        List<String> names = new ArrayList<>();
        for (Token ident : idents) {
            names.add(ident.getContent());
        }
        return names;
    }

    public Exp getTypeSpec() {
        return typeSpec;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VarDecl)) return false;
        VarDecl other = (VarDecl) o;
        return getNames().equals(other.getNames()) && typeSpec.equals(other.typeSpec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getNames(), typeSpec);
    }
}
