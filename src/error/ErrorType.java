package error;

public enum ErrorType {
    UndefinedIdentifier("undefined identifier"),
    TypeMismatch("type mismatch"),
    IndexOutOfBounds("index out of bounds"),
    DivisionByZero("division by zero"),
    ConstantMutation("constant mutation"),
    ArrayUsedAsScalar("array used as scalar"),
    InvalidIndexType("invalid index type"),
    DuplicateDeclaration("duplicate declaration");

    private final String name;

    ErrorType(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
