package frontend;

import error.SyntaxException;
import frontend.Token.Token;
import frontend.Token.TokenType;
import frontend.syntax.Block;
import frontend.syntax.Program;
import frontend.syntax.expression.*;
import frontend.syntax.statement.*;
import frontend.syntax.variable.ConstDecl;
import frontend.syntax.variable.Decl;
import frontend.syntax.variable.VarDecl;

import java.util.ArrayList;
import java.util.List;

/**
 * 递归下降解析器。遇到第一个无法匹配的 Token 就抛出 {@link SyntaxException}，不做错误恢复。
 * <p>
 * 表达式优先级（由低到高）：逻辑 AND/OR → 关系 → 加减 → 乘除 → 一元 ! 和 - → 基本项，全部左结合。
 */
public class Parser {
    private final List<Token> tokens;
    private final Token eofToken;
    private int pos = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
        if (tokens.isEmpty()) {
            this.eofToken = new Token(TokenType.EOF, "", 1, 1);
        } else {
            Token last = tokens.get(tokens.size() - 1);
            this.eofToken = new Token(TokenType.EOF, "", last.getLine(),
                    last.getColumn() + last.getContent().length());
        }
    }

    // --- 核心辅助方法 ---

    /**
     * 查看当前位置的 Token，但不消耗它。越过末尾时返回 EOF 哨兵。
     * @param offset 偏移量，0 代表当前 Token，1 代表下一个，-1 代表上一个。
     */
    private Token peekToken(int offset) {
        int index = pos + offset;
        if (index >= tokens.size()) {
            return eofToken;
        }
        return tokens.get(index);
    }

    private Token curToken() {
        return peekToken(0);
    }

    private TokenType curTokenType() {
        return curToken().getType();
    }

    private void move() {
        pos++;
    }

    /**
     * 当前 Token 类型与 type 匹配时消耗它并返回 true，否则不消耗，返回 false。
     */
    private boolean match(TokenType type) {
        if (curTokenType() == type) {
            pos++;
            return true;
        }
        return false;
    }

    /**
     * 强制消耗一个 type 类型的 Token 并返回它。
     */
    private Token consume(TokenType type) {
        Token token = curToken();
        if (match(type)) {
            return token;
        }
        throw new SyntaxException(token, "'" + type + "'");
    }

    /**
     * 公共入口方法
     */
    public Program parse() {
        return parseProgram();
    }

    /**
     * 解析程序 Program → 'MainPrgm' Ident ';' 'Var' {Decl} 'BeginPg' Block 'EndPg' ';'
     */
    private Program parseProgram() {
        consume(TokenType.MAINPRGMTK);
        Token name = consume(TokenType.IDENFR);
        consume(TokenType.SEMICN);
        consume(TokenType.VARTK);

        ArrayList<Decl> decls = new ArrayList<>();
        while (curTokenType() == TokenType.LETTK || curTokenType() == TokenType.DEFINETK) {
            decls.add(parseDecl());
        }

        consume(TokenType.BEGINPGTK);
        Block block = parseBlock();
        consume(TokenType.ENDPGTK);
        consume(TokenType.SEMICN);
        // 程序之后不能再有东西
        consume(TokenType.EOF);
        return new Program(name, decls, block);
    }

    /**
     * 解析声明 Decl → VarDecl | ConstDecl
     */
    private Decl parseDecl() {
        if (curTokenType() == TokenType.DEFINETK) {
            return parseConstDecl();
        }
        return parseVarDecl();
    }

    /**
     * 变量声明 VarDecl → 'let' Ident { ',' Ident } ':' TypeSpec ';'
     */
    private VarDecl parseVarDecl() {
        consume(TokenType.LETTK);
        ArrayList<Token> idents = new ArrayList<>();
        do {
            idents.add(consume(TokenType.IDENFR));
        } while (match(TokenType.COMMA));
        consume(TokenType.COLON);
        Exp typeSpec = parseTypeSpec();
        consume(TokenType.SEMICN);
        return new VarDecl(idents, typeSpec);
    }

    /**
     * TypeSpec → BaseType | '[' BaseType ';' IntConst ']'
     */
    private Exp parseTypeSpec() {
        if (match(TokenType.LBRACK)) {
            Token baseType = parseBaseType();
            consume(TokenType.SEMICN);
            Token sizeToken = curToken();
            if (curTokenType() != TokenType.INTCON) {
                throw new SyntaxException(sizeToken, "array size");
            }
            move();
            int size = parseIntContent(sizeToken);
            if (size <= 0) {
                throw new SyntaxException(sizeToken, "positive array size");
            }
            consume(TokenType.RBRACK);
            return new ArrayTypeExp(baseType, size);
        }
        return new TypeExp(parseBaseType());
    }

    /**
     * BaseType → 'Int' | 'Float'
     */
    private Token parseBaseType() {
        Token token = curToken();
        if (match(TokenType.INTTK) || match(TokenType.FLOATTK)) {
            return token;
        }
        throw new SyntaxException(token, "'Int' or 'Float'");
    }

    /**
     * 常量声明 ConstDecl → '@define' 'Const' Ident ':' BaseType '=' Literal ';'
     */
    private ConstDecl parseConstDecl() {
        consume(TokenType.DEFINETK);
        consume(TokenType.CONSTTK);
        Token ident = consume(TokenType.IDENFR);
        consume(TokenType.COLON);
        Token typeName = parseBaseType();
        consume(TokenType.DEFEQ);
        Exp value = parseNumber();
        if (value == null) {
            throw new SyntaxException(curToken(), "numeric literal");
        }
        consume(TokenType.SEMICN);
        return new ConstDecl(ident, typeName, value);
    }

    /**
     * 解析语句块 Block → '{' { Stmt } '}'
     */
    private Block parseBlock() {
        ArrayList<Stmt> stmts = new ArrayList<>();
        consume(TokenType.LBRACE);
        while (curTokenType() != TokenType.RBRACE) {
            stmts.add(parseStmt());
        }
        Token finalToken = consume(TokenType.RBRACE);
        return new Block(stmts, finalToken);
    }

    /**
     * 解析语句 Stmt，根据第一个 Token 分派
     */
    private Stmt parseStmt() {
        Token startToken = curToken();
        if (match(TokenType.IFTK)) {
            consume(TokenType.LPARENT);
            Cond cond = parseCond();
            consume(TokenType.RPARENT);
            consume(TokenType.THENTK);
            Block ifBlock = parseBlock();
            consume(TokenType.ELSETK);
            Block elseBlock = parseBlock();
            return new IfStmt(startToken, cond, ifBlock, elseBlock);
        }
        else if (match(TokenType.DOTK)) {
            Block body = parseBlock();
            consume(TokenType.WHILETK);
            consume(TokenType.LPARENT);
            Cond cond = parseCond();
            consume(TokenType.RPARENT);
            consume(TokenType.SEMICN);
            return new DoWhileStmt(startToken, body, cond);
        }
        else if (match(TokenType.FORTK)) {
            Token loopVar = consume(TokenType.IDENFR);
            consume(TokenType.FROMTK);
            Exp start = parseExp();
            consume(TokenType.TOTK);
            Exp end = parseExp();
            consume(TokenType.STEPTK);
            Exp step = parseExp();
            Block body = parseBlock();
            return new ForStmt(startToken, loopVar, start, end, step, body);
        }
        else if (match(TokenType.INPUTTK)) {
            consume(TokenType.LPARENT);
            Variable target = parseVariable();
            consume(TokenType.RPARENT);
            consume(TokenType.SEMICN);
            return new InputStmt(startToken, target);
        }
        else if (match(TokenType.OUTPUTTK)) {
            consume(TokenType.LPARENT);
            ArrayList<Exp> exps = new ArrayList<>();
            do {
                exps.add(parseExp());
            } while (match(TokenType.COMMA));
            consume(TokenType.RPARENT);
            consume(TokenType.SEMICN);
            return new OutputStmt(startToken, exps);
        }
        else if (curTokenType() == TokenType.IDENFR) {
            Variable target = parseVariable();
            consume(TokenType.ASSIGN);
            Exp value = parseExp();
            consume(TokenType.SEMICN);
            return new AssignStmt(target, value);
        }
        throw new SyntaxException(startToken, "statement");
    }

    /**
     * 解析左值 Variable → Ident ['[' Exp ']']
     */
    private Variable parseVariable() {
        Token ident = consume(TokenType.IDENFR);
        if (match(TokenType.LBRACK)) {
            Exp index = parseExp();
            consume(TokenType.RBRACK);
            return new ArrayVariable(ident, index);
        }
        return new SimpleVariable(ident);
    }

    /**
     * 解析条件表达式 Cond → Exp
     */
    private Cond parseCond() {
        return new Cond(parseExp());
    }

    /**
     * 表达式入口 Exp → LogicExp
     */
    private Exp parseExp() {
        return parseLogicExp();
    }

    /**
     * 逻辑表达式 LogicExp → RelExp { ('AND' | 'OR') RelExp }
     */
    private Exp parseLogicExp() {
        Exp left = parseRelExp();
        while (curTokenType() == TokenType.AND || curTokenType() == TokenType.OR) {
            Token op = curToken();
            move();
            left = new BinaryExp(left, op, parseRelExp());
        }
        return left;
    }

    /**
     * 关系表达式 RelExp → AddExp { ('<' | '>' | '<=' | '>=' | '==' | '!=') AddExp }
     */
    private Exp parseRelExp() {
        Exp left = parseAddExp();
        while (curTokenType() == TokenType.LSS || curTokenType() == TokenType.GRE
                || curTokenType() == TokenType.LEQ || curTokenType() == TokenType.GEQ
                || curTokenType() == TokenType.EQL || curTokenType() == TokenType.NEQ) {
            Token op = curToken();
            move();
            left = new BinaryExp(left, op, parseAddExp());
        }
        return left;
    }

    /**
     * 加减表达式 AddExp → MulExp { ('+' | '-') MulExp }
     */
    private Exp parseAddExp() {
        Exp left = parseMulExp();
        while (curTokenType() == TokenType.PLUS || curTokenType() == TokenType.MINU) {
            Token op = curToken();
            move();
            left = new BinaryExp(left, op, parseMulExp());
        }
        return left;
    }

    /**
     * 乘除表达式 MulExp → UnaryExp { ('*' | '/') UnaryExp }
     */
    private Exp parseMulExp() {
        Exp left = parseUnaryExp();
        while (curTokenType() == TokenType.MULT || curTokenType() == TokenType.DIV) {
            Token op = curToken();
            move();
            left = new BinaryExp(left, op, parseUnaryExp());
        }
        return left;
    }

    /**
     * 一元表达式 UnaryExp → '!' UnaryExp | '-' UnaryExp | PrimaryExp
     * 一元负号改写为 0 - UnaryExp
     */
    private Exp parseUnaryExp() {
        Token opToken = curToken();
        if (match(TokenType.NOT)) {
            return new NotExp(opToken, parseUnaryExp());
        }
        if (match(TokenType.MINU)) {
            Exp operand = parseUnaryExp();
            Token zeroToken = new Token(TokenType.INTCON, "0", opToken.getLine(), opToken.getColumn());
            return new BinaryExp(new IntLiteral(zeroToken, 0), BinaryOp.SUB, opToken, operand);
        }
        return parsePrimaryExp();
    }

    /**
     * 基本表达式 PrimaryExp → '(' Exp ')' | Variable | Number | StringConst
     */
    private Exp parsePrimaryExp() {
        if (match(TokenType.LPARENT)) {
            Exp exp = parseExp();
            consume(TokenType.RPARENT);
            return exp;
        }
        if (curTokenType() == TokenType.IDENFR) {
            return new VarExp(parseVariable());
        }
        Token token = curToken();
        if (match(TokenType.STRCON)) {
            return new StringLiteral(token);
        }
        Exp number = parseNumber();
        if (number != null) {
            return number;
        }
        throw new SyntaxException(token, "expression");
    }

    /**
     * 数字字面量，带符号的 (+5) (-2.5) 也在这里；不是数字时返回 null 且不消耗 Token。
     */
    private Exp parseNumber() {
        Token token = curToken();
        switch (token.getType()) {
            case INTCON:
            case SIGNED_INTCON:
                move();
                return new IntLiteral(token, parseIntContent(token));
            case FLOATCON:
            case SIGNED_FLOATCON:
                move();
                return new FloatLiteral(token, Float.parseFloat(token.getContent()));
            default:
                return null;
        }
    }

    private int parseIntContent(Token token) {
        try {
            return Integer.parseInt(token.getContent());
        } catch (NumberFormatException e) {
            throw new SyntaxException(token, "integer literal within Int range");
        }
    }
}
