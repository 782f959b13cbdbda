package frontend.syntax;

/**
 * 所有语法树节点的基类。
 * 每个节点都能把自己打印回源程序形式，重新解析打印结果会得到结构相同的树。
 */
public abstract class SyntaxNode {
    protected static final String INDENT = "    ";

    public abstract void print(StringBuilder sb, int indent);

    protected static void indent(StringBuilder sb, int indent) {
        for (int i = 0; i < indent; i++) {
            sb.append(INDENT);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb, 0);
        return sb.toString();
    }
}
