package frontend.syntax.statement;

import frontend.Token.Token;
import frontend.syntax.expression.Exp;
import frontend.syntax.expression.Variable;

import java.util.Objects;

// Variable ':=' Exp ';'

public class AssignStmt extends Stmt {
    private final Variable target;
    private final Exp value;

    public AssignStmt(Variable target, Exp value) {
        this.target = target;
        this.value = value;
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        indent(sb, indent);
        target.print(sb, indent);
        sb.append(" := ");
        value.print(sb);
        sb.append(";\n");
    }

    public Variable getTarget() {
        return target;
    }

    public Exp getValue() {
        return value;
    }

    @Override
    public Token getStartToken() {
        return target.getIdent();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssignStmt)) return false;
        AssignStmt other = (AssignStmt) o;
        return target.equals(other.target) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, value);
    }
}
