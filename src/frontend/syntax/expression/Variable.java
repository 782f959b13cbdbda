package frontend.syntax.expression;

import frontend.Token.Token;
import frontend.syntax.SyntaxNode;

//左值 Variable → Ident | Ident '[' Exp ']'

public abstract class Variable extends SyntaxNode {
    protected final Token ident;

    protected Variable(Token ident) {
        this.ident = ident;
    }

    public Token getIdent() {
        return ident;
    }

    public String getName() {
        return ident.getContent();
    }
}
