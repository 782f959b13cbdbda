package frontend;

import error.SyntaxException;
import frontend.Token.Token;
import frontend.Token.TokenType;
import frontend.syntax.Program;
import frontend.syntax.expression.*;
import frontend.syntax.statement.*;
import frontend.syntax.variable.ConstDecl;
import frontend.syntax.variable.VarDecl;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    static Program parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    static Program parseBody(String body) {
        return parse("MainPrgm T;\nVar\nlet a, b, c, x: Int;\nBeginPg\n{\n" + body + "\n}\nEndPg;\n");
    }

    // 取出 "x := <exp>;" 右侧的表达式
    static Exp parseExp(String exp) {
        AssignStmt stmt = (AssignStmt) parseBody("x := " + exp + ";").getBlock().getStmts().get(0);
        return stmt.getValue();
    }

    private static Token tok(TokenType type, String content) {
        return new Token(type, content, 0, 0);
    }

    private static Exp var(String name) {
        return new VarExp(new SimpleVariable(tok(TokenType.IDENFR, name)));
    }

    private static Exp num(int value) {
        return new IntLiteral(tok(TokenType.INTCON, String.valueOf(value)), value);
    }

    private static Exp bin(Exp left, BinaryOp op, Exp right) {
        return new BinaryExp(left, op, tok(TokenType.EOF, op.toString()), right);
    }

    @Test
    void multiplicationBindsTighterThanAddition() {
        assertEquals(bin(num(1), BinaryOp.ADD, bin(num(2), BinaryOp.MUL, num(3))), parseExp("1 + 2 * 3"));
    }

    @Test
    void subtractionIsLeftAssociative() {
        assertEquals(bin(bin(var("a"), BinaryOp.SUB, var("b")), BinaryOp.SUB, var("c")), parseExp("a - b - c"));
    }

    @Test
    void notBindsTighterThanAnd() {
        Exp expected = bin(new NotExp(tok(TokenType.NOT, "!"), var("a")), BinaryOp.AND, var("b"));
        assertEquals(expected, parseExp("!a AND b"));
    }

    @Test
    void relationalBindsTighterThanLogicalAndLooserThanArithmetic() {
        Exp expected = bin(
                bin(bin(var("a"), BinaryOp.ADD, num(1)), BinaryOp.LT, var("b")),
                BinaryOp.OR,
                bin(var("c"), BinaryOp.NE, num(0)));
        assertEquals(expected, parseExp("a + 1 < b OR c != 0"));
    }

    @Test
    void logicalOperatorsShareOneLeftAssociativeLevel() {
        assertEquals(bin(bin(var("a"), BinaryOp.AND, var("b")), BinaryOp.OR, var("c")), parseExp("a AND b OR c"));
        assertEquals(bin(bin(var("a"), BinaryOp.OR, var("b")), BinaryOp.AND, var("c")), parseExp("a OR b AND c"));
    }

    @Test
    void parenthesesOverridePrecedence() {
        assertEquals(bin(bin(num(1), BinaryOp.ADD, num(2)), BinaryOp.MUL, num(3)), parseExp("(1 + 2) * 3"));
    }

    @Test
    void unaryMinusIsDesugaredToSubtractionFromZero() {
        assertEquals(bin(num(0), BinaryOp.SUB, var("a")), parseExp("-a"));
        assertEquals(bin(bin(num(0), BinaryOp.SUB, var("a")), BinaryOp.MUL, var("b")), parseExp("-a * b"));
    }

    @Test
    void signedLiteralsAreSingleLiterals() {
        assertEquals(num(-5), parseExp("(-5)"));
        assertEquals(new FloatLiteral(tok(TokenType.FLOATCON, "2.5"), 2.5f), parseExp("(+2.5)"));
    }

    @Test
    void arrayAccessAndStringLiterals() {
        Exp expected = new VarExp(new ArrayVariable(tok(TokenType.IDENFR, "a"), bin(var("b"), BinaryOp.ADD, num(1))));
        assertEquals(expected, parseExp("a[b + 1]"));
        assertEquals(new StringLiteral(tok(TokenType.STRCON, "hello")), parseExp("\"hello\""));
    }

    @Test
    void declarations() {
        Program program = parse("MainPrgm Decls;\nVar\nlet x, y: Int;\nlet arr: [Float; 8];\n"
                + "@define Const MAX: Int = 100;\nBeginPg\n{\n}\nEndPg;\n");
        assertEquals("Decls", program.getName());
        assertEquals(3, program.getDecls().size());

        VarDecl scalars = (VarDecl) program.getDecls().get(0);
        assertEquals(List.of("x", "y"), scalars.getNames());
        assertEquals("Int", ((TypeExp) scalars.getTypeSpec()).getTypeName());

        ArrayTypeExp arrayType = (ArrayTypeExp) ((VarDecl) program.getDecls().get(1)).getTypeSpec();
        assertEquals("Float", arrayType.getTypeName());
        assertEquals(8, arrayType.getSize());

        ConstDecl constant = (ConstDecl) program.getDecls().get(2);
        assertEquals("MAX", constant.getName());
        assertEquals("Int", constant.getTypeName());
        assertEquals(num(100), constant.getValue());
        assertTrue(program.getBlock().getStmts().isEmpty());
    }

    @Test
    void nestedControlStatements() {
        Program program = parseBody(
                "if (a < b) then {\n"
                + "  for c from 0 to 10 step 1 {\n"
                + "    do { x := x + c; } while (x < 100);\n"
                + "  }\n"
                + "} else {\n"
                + "}\n"
                + "input(a);\n"
                + "output(\"x=\", x, a[1]);");
        List<Stmt> stmts = program.getBlock().getStmts();
        assertEquals(3, stmts.size());

        IfStmt ifStmt = (IfStmt) stmts.get(0);
        assertEquals(bin(var("a"), BinaryOp.LT, var("b")), ifStmt.getCond().getExp());
        assertTrue(ifStmt.getElseBlock().getStmts().isEmpty());

        ForStmt forStmt = (ForStmt) ifStmt.getIfBlock().getStmts().get(0);
        assertEquals("c", forStmt.getLoopVarName());
        assertEquals(num(0), forStmt.getStart());
        assertEquals(num(10), forStmt.getEnd());
        assertEquals(num(1), forStmt.getStep());

        DoWhileStmt doWhile = (DoWhileStmt) forStmt.getBody().getStmts().get(0);
        assertEquals(1, doWhile.getBody().getStmts().size());
        assertEquals(bin(var("x"), BinaryOp.LT, num(100)), doWhile.getCond().getExp());

        assertEquals("a", ((InputStmt) stmts.get(1)).getTarget().getName());
        assertEquals(3, ((OutputStmt) stmts.get(2)).getExps().size());
    }

    @Test
    void syntaxErrorReportsOffendingToken() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parseBody("x := 1 +;"));
        assertEquals(6, e.getLine());
        assertEquals(9, e.getColumn());
        assertEquals(TokenType.SEMICN, e.getToken().getType());
        assertTrue(e.getMessage().contains("expected expression"));
    }

    @Test
    void missingDelimitingKeywordsAreSyntaxErrors() {
        assertThrows(SyntaxException.class, () -> parseBody("if (a < b) { }"));
        assertThrows(SyntaxException.class, () -> parseBody("if (a < b) then { }"));
        assertThrows(SyntaxException.class, () -> parseBody("for c from 0 to 10 { }"));
        assertThrows(SyntaxException.class, () -> parseBody("do { } (a < b);"));
        assertThrows(SyntaxException.class, () -> parseBody("x := 1"));
    }

    @Test
    void arraySizeMustBePositiveLiteral() {
        assertThrows(SyntaxException.class, () -> parse("MainPrgm T; Var let a: [Int; 0]; BeginPg { } EndPg;"));
        assertThrows(SyntaxException.class, () -> parse("MainPrgm T; Var let a: [Int; n]; BeginPg { } EndPg;"));
    }

    @Test
    void trailingInputAfterProgramIsRejected() {
        SyntaxException e = assertThrows(SyntaxException.class,
                () -> parse("MainPrgm T; Var BeginPg { } EndPg; x"));
        assertEquals(TokenType.IDENFR, e.getToken().getType());
    }

    @Test
    void truncatedInputReportsEndOfInput() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("MainPrgm T; Var BeginPg {"));
        assertEquals(TokenType.EOF, e.getToken().getType());
    }

    @Test
    void printedProgramReparsesToEqualTree() throws IOException {
        for (String file : new String[]{"testfiles/valid_program.txt", "testfiles/error_test.txt"}) {
            String source = new String(Files.readAllBytes(Paths.get(file)), StandardCharsets.UTF_8);
            Program original = parse(source);
            Program reparsed = parse(original.toString());
            assertEquals(original, reparsed, file);
            assertEquals(original.toString(), reparsed.toString());
        }
    }

    @Test
    void printedExpressionsKeepStructure() {
        String body = "x := !(-a) AND (-1.5) < 2.25 * b[(-1)] - (0 - c) / 3;\n"
                + "if (!!a) then { output(\"s\"); } else { input(b[2]); }";
        Program original = parseBody(body);
        assertEquals(original, parse(original.toString()));
    }
}
