package frontend.syntax.variable;

import frontend.syntax.SyntaxNode;

// 声明 Decl → VarDecl | ConstDecl

public abstract class Decl extends SyntaxNode {
}
