package frontend.syntax.expression;

import frontend.syntax.SyntaxNode;

//条件表达式 Cond → Exp，要求结果是布尔值

public class Cond extends SyntaxNode {
    private final Exp exp;

    public Cond(Exp exp) {
        this.exp = exp;
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        exp.print(sb);
    }

    public Exp getExp() {
        return exp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cond)) return false;
        return exp.equals(((Cond) o).exp);
    }

    @Override
    public int hashCode() {
        return exp.hashCode();
    }
}
