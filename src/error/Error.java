package error;

import java.util.Objects;

// 一条语义诊断：种类 + 位置 + 说明
public class Error {
    private final ErrorType type;
    private final int line;
    private final int column;
    private final String message;

    Error(ErrorType type, int line, int column, String message) {
        this.type = type;
        this.line = line;
        this.column = column;
        this.message = message;
    }

    public ErrorType getType() {
        return type;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Error)) return false;
        Error other = (Error) o;
        return type == other.type && line == other.line && column == other.column
                && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, line, column, message);
    }

    @Override
    public String toString() {
        return "Line " + line + ", Column " + column + ": " + message;
    }
}
