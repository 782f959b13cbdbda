package frontend.syntax.expression;

import frontend.Token.TokenType;

public enum BinaryOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    EQ("=="),
    NE("!="),
    AND("AND"),
    OR("OR");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    public static BinaryOp fromTokenType(TokenType type) {
        switch (type) {
            case PLUS: return ADD;
            case MINU: return SUB;
            case MULT: return MUL;
            case DIV: return DIV;
            case LSS: return LT;
            case GRE: return GT;
            case LEQ: return LE;
            case GEQ: return GE;
            case EQL: return EQ;
            case NEQ: return NE;
            case AND: return AND;
            case OR: return OR;
            default:
                throw new IllegalArgumentException("Not a binary operator: " + type);
        }
    }

    public boolean isArithmetic() {
        return this == ADD || this == SUB || this == MUL || this == DIV;
    }

    public boolean isRelational() {
        return this == LT || this == GT || this == LE || this == GE || this == EQ || this == NE;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
