package frontend.syntax;

import frontend.Token.Token;
import frontend.syntax.variable.Decl;

import java.util.ArrayList;
import java.util.Objects;

// 程序 Program → 'MainPrgm' Ident ';' 'Var' {Decl} 'BeginPg' Block 'EndPg' ';'

public class Program extends SyntaxNode {
    private final Token name;
    private final ArrayList<Decl> decls;
    private final Block block;

    public Program(Token name, ArrayList<Decl> decls, Block block) {
        this.name = name;
        this.decls = decls;
        this.block = block;
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        sb.append("MainPrgm ").append(name.getContent()).append(";\n");
        sb.append("Var\n");
        for (Decl decl : decls) {
            decl.print(sb, indent);
        }
        sb.append("BeginPg\n");
        block.print(sb, indent);
        sb.append("\nEndPg;\n");
    }

    public String getName() {
        return name.getContent();
    }

    public Token getNameToken() {
        return name;
    }

    public ArrayList<Decl> getDecls() {
        return decls;
    }

    public Block getBlock() {
        return block;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Program)) return false;
        Program other = (Program) o;
        return getName().equals(other.getName()) && decls.equals(other.decls) && block.equals(other.block);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), decls, block);
    }
}
