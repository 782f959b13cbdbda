package frontend.Token;

public class Token {
    private final TokenType tokenType;
    private final String content;
    private final int line;  //记录报错信息
    private final int column;

    public Token(TokenType tokenType, String content, int line, int column) {
        this.tokenType = tokenType;
        this.content = content;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return tokenType;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getContent() {
        return content;
    }

    @Override
    public String toString() {
        return tokenType.name() + " " + content;
    }
}
