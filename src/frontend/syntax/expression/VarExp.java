package frontend.syntax.expression;

import frontend.Token.Token;

// 表达式中出现的变量引用

public class VarExp extends Exp {
    private final Variable variable;

    public VarExp(Variable variable) {
        this.variable = variable;
    }

    @Override
    public void print(StringBuilder sb) {
        variable.print(sb, 0);
    }

    public Variable getVariable() {
        return variable;
    }

    @Override
    public Token getToken() {
        return variable.getIdent();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VarExp)) return false;
        return variable.equals(((VarExp) o).variable);
    }

    @Override
    public int hashCode() {
        return variable.hashCode();
    }
}
