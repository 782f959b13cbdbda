package frontend.Token;

public enum TokenType {
    // 标识符 & 字面量
    IDENFR("Ident"),
    INTCON("IntConst"),
    SIGNED_INTCON("SignedIntConst"),
    FLOATCON("FloatConst"),
    SIGNED_FLOATCON("SignedFloatConst"),
    STRCON("StringConst"),

    // 关键字
    MAINPRGMTK("MainPrgm"),
    VARTK("Var"),
    BEGINPGTK("BeginPg"),
    ENDPGTK("EndPg"),
    LETTK("let"),
    INTTK("Int"),
    FLOATTK("Float"),
    DEFINETK("@define"),
    CONSTTK("Const"),
    INPUTTK("input"),
    OUTPUTTK("output"),
    IFTK("if"),
    THENTK("then"),
    ELSETK("else"),
    DOTK("do"),
    WHILETK("while"),
    FORTK("for"),
    FROMTK("from"),
    TOTK("to"),
    STEPTK("step"),

    // 运算符
    NOT("!"),
    AND("AND"),
    OR("OR"),
    PLUS("+"),
    MINU("-"),
    MULT("*"),
    DIV("/"),
    LSS("<"),
    LEQ("<="),
    GRE(">"),
    GEQ(">="),
    EQL("=="),
    NEQ("!="),
    ASSIGN(":="),
    DEFEQ("="),

    // 分隔符
    SEMICN(";"),
    COLON(":"),
    COMMA(","),
    LPARENT("("),
    RPARENT(")"),
    LBRACK("["),
    RBRACK("]"),
    LBRACE("{"),
    RBRACE("}"),

    // 解析器在输入末尾补上的哨兵
    EOF("end of input");

    private final String name;
    TokenType(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
