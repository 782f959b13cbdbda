package frontend.syntax.expression;

import frontend.Token.Token;
import frontend.syntax.SyntaxNode;

/**
 * 表达式基类。表达式不换行，打印时忽略缩进。
 * 位置取自 {@link #getToken()}：变量取名字，二元运算取运算符，字面量取自身。
 */
public abstract class Exp extends SyntaxNode {

    public abstract Token getToken();

    public abstract void print(StringBuilder sb);

    @Override
    public final void print(StringBuilder sb, int indent) {
        print(sb);
    }

    public int getLine() {
        return getToken().getLine();
    }

    public int getColumn() {
        return getToken().getColumn();
    }
}
