package error;

import frontend.Token.Token;

/**
 * 语法错误。解析器遇到第一个无法匹配的 Token 时抛出，不做恢复。
 */
public class SyntaxException extends RuntimeException {
    private final Token token;

    public SyntaxException(Token token, String expected) {
        super("Syntax error at line " + token.getLine() + ", column " + token.getColumn()
                + ": expected " + expected + " but found " + describe(token));
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    public int getLine() {
        return token.getLine();
    }

    public int getColumn() {
        return token.getColumn();
    }

    private static String describe(Token token) {
        if (token.getContent().isEmpty()) {
            return token.getType().name();
        }
        return "'" + token.getContent() + "'";
    }
}
