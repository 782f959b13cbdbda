package frontend.syntax.expression;

import frontend.Token.Token;

import java.util.Objects;

// Exp op Exp，左结合；一元负号也被改写成 0 - Exp

public class BinaryExp extends Exp {
    private final Exp left;
    private final BinaryOp op;
    private final Token opToken;
    private final Exp right;

    public BinaryExp(Exp left, Token opToken, Exp right) {
        this(left, BinaryOp.fromTokenType(opToken.getType()), opToken, right);
    }

    public BinaryExp(Exp left, BinaryOp op, Token opToken, Exp right) {
        this.left = left;
        this.op = op;
        this.opToken = opToken;
        this.right = right;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append('(');
        left.print(sb);
        sb.append(' ').append(op).append(' ');
        right.print(sb);
        sb.append(')');
    }

    public Exp getLeft() {
        return left;
    }

    public BinaryOp getOp() {
        return op;
    }

    public Exp getRight() {
        return right;
    }

    @Override
    public Token getToken() {
        return opToken;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryExp)) return false;
        BinaryExp other = (BinaryExp) o;
        return op == other.op && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, op, right);
    }
}
