package frontend;

import frontend.Token.Token;
import frontend.Token.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LexerTest {

    private static List<TokenType> types(List<Token> tokens) {
        List<TokenType> types = new ArrayList<>();
        for (Token token : tokens) {
            types.add(token.getType());
        }
        return types;
    }

    @Test
    void keywordsAndPunctuation() {
        Lexer lexer = new Lexer("MainPrgm T; Var let x: Int; @define Const C: Float = 1.5;");
        assertEquals(List.of(
                TokenType.MAINPRGMTK, TokenType.IDENFR, TokenType.SEMICN, TokenType.VARTK,
                TokenType.LETTK, TokenType.IDENFR, TokenType.COLON, TokenType.INTTK, TokenType.SEMICN,
                TokenType.DEFINETK, TokenType.CONSTTK, TokenType.IDENFR, TokenType.COLON, TokenType.FLOATTK,
                TokenType.DEFEQ, TokenType.FLOATCON, TokenType.SEMICN), types(lexer.tokenize()));
        assertTrue(lexer.getErrors().isEmpty());
    }

    @Test
    void operatorsArePairedGreedily() {
        Lexer lexer = new Lexer("x := a <= b >= c == d != e < f > g ! h AND i OR j");
        List<TokenType> types = types(lexer.tokenize());
        assertEquals(List.of(
                TokenType.IDENFR, TokenType.ASSIGN, TokenType.IDENFR, TokenType.LEQ, TokenType.IDENFR,
                TokenType.GEQ, TokenType.IDENFR, TokenType.EQL, TokenType.IDENFR, TokenType.NEQ,
                TokenType.IDENFR, TokenType.LSS, TokenType.IDENFR, TokenType.GRE, TokenType.IDENFR,
                TokenType.NOT, TokenType.IDENFR, TokenType.AND, TokenType.IDENFR, TokenType.OR,
                TokenType.IDENFR), types);
    }

    @Test
    void parenthesizedSignedLiterals() {
        List<Token> tokens = new Lexer("(-5) (+2.5) (5) (-x)").tokenize();
        assertEquals(List.of(
                TokenType.SIGNED_INTCON, TokenType.SIGNED_FLOATCON,
                TokenType.LPARENT, TokenType.INTCON, TokenType.RPARENT,
                TokenType.LPARENT, TokenType.MINU, TokenType.IDENFR, TokenType.RPARENT), types(tokens));
        assertEquals("-5", tokens.get(0).getContent());
        assertEquals("+2.5", tokens.get(1).getContent());
    }

    @Test
    void commentsAreSkippedAndPositionsTracked() {
        String source = "<!- one line -!>\n{-- two\nlines --} x\n  := \"hi\";";
        List<Token> tokens = new Lexer(source).tokenize();
        assertEquals(List.of(TokenType.IDENFR, TokenType.ASSIGN, TokenType.STRCON, TokenType.SEMICN), types(tokens));
        assertEquals(3, tokens.get(0).getLine());
        assertEquals(11, tokens.get(0).getColumn());
        assertEquals(4, tokens.get(1).getLine());
        assertEquals(3, tokens.get(1).getColumn());
        assertEquals("hi", tokens.get(2).getContent());
    }

    @Test
    void malformedIdentifiersAreReportedButStillEmitted() {
        Lexer lexer = new Lexer("abcdefghijklmno bad_ a__b ok_1");
        List<Token> tokens = lexer.tokenize();
        assertEquals(4, tokens.size());
        assertEquals(3, lexer.getErrors().size());
        assertTrue(lexer.getErrors().get(0).contains("longer than 14"));
        assertTrue(lexer.getErrors().get(1).contains("ends with '_'"));
        assertTrue(lexer.getErrors().get(2).contains("contains '__'"));
    }

    @Test
    void illegalCharactersAndOverflowAreLexicalErrors() {
        Lexer lexer = new Lexer("x := 99999999999 # 1;");
        List<Token> tokens = lexer.tokenize();
        assertEquals(List.of(TokenType.IDENFR, TokenType.ASSIGN, TokenType.INTCON, TokenType.INTCON, TokenType.SEMICN),
                types(tokens));
        assertEquals(2, lexer.getErrors().size());
        assertTrue(lexer.getErrors().get(0).contains("integer literal out of range"));
        assertTrue(lexer.getErrors().get(1).startsWith("Lexical error at line 1, column 18"));
    }

    @Test
    void unterminatedStringIsReported() {
        Lexer lexer = new Lexer("output(\"abc);");
        lexer.tokenize();
        assertEquals(1, lexer.getErrors().size());
        assertTrue(lexer.getErrors().get(0).contains("unterminated string"));
    }

    @Test
    void nonZeroFloatThatRoundsToZeroIsReported() {
        String tiny = "0." + "0".repeat(45) + "1";
        Lexer lexer = new Lexer("f := f / " + tiny + ";");
        List<Token> tokens = lexer.tokenize();
        assertEquals(TokenType.FLOATCON, tokens.get(4).getType());
        assertEquals(1, lexer.getErrors().size());
        assertTrue(lexer.getErrors().get(0).startsWith("Lexical error at line 1, column 10"));
        assertTrue(lexer.getErrors().get(0).contains("too small"));

        Lexer zero = new Lexer("f := 0.000;");
        zero.tokenize();
        assertTrue(zero.getErrors().isEmpty());
    }

    @Test
    void onlyAsciiLettersAndDigitsFormWords() {
        // U+0663 是阿拉伯-印度数字 3，U+00E9 是 é
        Lexer lexer = new Lexer("x := \u0663; caf\u00e9 := 1;");
        List<Token> tokens = lexer.tokenize();
        assertEquals(List.of(
                TokenType.IDENFR, TokenType.ASSIGN, TokenType.SEMICN,
                TokenType.IDENFR, TokenType.ASSIGN, TokenType.INTCON, TokenType.SEMICN), types(tokens));
        assertEquals("caf", tokens.get(3).getContent());
        assertEquals(2, lexer.getErrors().size());
        assertTrue(lexer.getErrors().get(0).startsWith("Lexical error at line 1, column 6"));
        assertTrue(lexer.getErrors().get(1).startsWith("Lexical error at line 1, column 12"));
    }
}
