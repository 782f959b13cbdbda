package frontend.syntax.statement;

import frontend.Token.Token;
import frontend.syntax.Block;
import frontend.syntax.expression.Exp;

import java.util.Objects;

// 'for' Ident 'from' Exp 'to' Exp 'step' Exp Block
// 循环变量只在循环体内可见

public class ForStmt extends Stmt {
    private final Token forToken;
    private final Token loopVar;
    private final Exp start;
    private final Exp end;
    private final Exp step;
    private final Block body;

    public ForStmt(Token forToken, Token loopVar, Exp start, Exp end, Exp step, Block body) {
        this.forToken = forToken;
        this.loopVar = loopVar;
        this.start = start;
        this.end = end;
        this.step = step;
        this.body = body;
    }

    @Override
    public void print(StringBuilder sb, int indent) {
        indent(sb, indent);
        sb.append("for ").append(getLoopVarName()).append(" from ");
        start.print(sb);
        sb.append(" to ");
        end.print(sb);
        sb.append(" step ");
        step.print(sb);
        sb.append(' ');
        body.print(sb, indent);
        sb.append('\n');
    }

    public Token getLoopVar() {
        return loopVar;
    }

    public String getLoopVarName() {
        return loopVar.getContent();
    }

    public Exp getStart() {
        return start;
    }

    public Exp getEnd() {
        return end;
    }

    public Exp getStep() {
        return step;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public Token getStartToken() {
        return forToken;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ForStmt)) return false;
        ForStmt other = (ForStmt) o;
        return getLoopVarName().equals(other.getLoopVarName()) && start.equals(other.start)
                && end.equals(other.end) && step.equals(other.step) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLoopVarName(), start, end, step, body);
    }
}
