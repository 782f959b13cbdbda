package frontend.syntax.statement;

import frontend.Token.Token;
import frontend.syntax.SyntaxNode;

public abstract class Stmt extends SyntaxNode {

    // 语句的第一个 Token，用于定位
    public abstract Token getStartToken();

    public int getLine() {
        return getStartToken().getLine();
    }
}
