package frontend;

import frontend.Token.Token;
import frontend.Token.TokenType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Lexer {
    private static final int MAX_IDENT_LENGTH = 14;

    private final String inputString;
    private int curPos = 0;
    private StringBuilder curToken = new StringBuilder();
    private TokenType curType = null;
    private int line = 1;
    private int lineStart = 0;   // 当前行第一个字符的位置，用于计算列号
    private int tokenLine;
    private int tokenColumn;
    private final List<String> errors = new ArrayList<>();
    private static final Map<String, TokenType> reservedMap = new HashMap<>(); //关键词（字符串）
    private static final Map<Character, TokenType> reservedSingleCharMap = new HashMap<>();

    static {
        // 关键字
        reservedMap.put("MainPrgm", TokenType.MAINPRGMTK);
        reservedMap.put("Var", TokenType.VARTK);
        reservedMap.put("BeginPg", TokenType.BEGINPGTK);
        reservedMap.put("EndPg", TokenType.ENDPGTK);
        reservedMap.put("let", TokenType.LETTK);
        reservedMap.put("Int", TokenType.INTTK);
        reservedMap.put("Float", TokenType.FLOATTK);
        reservedMap.put("Const", TokenType.CONSTTK);
        reservedMap.put("input", TokenType.INPUTTK);
        reservedMap.put("output", TokenType.OUTPUTTK);
        reservedMap.put("if", TokenType.IFTK);
        reservedMap.put("then", TokenType.THENTK);
        reservedMap.put("else", TokenType.ELSETK);
        reservedMap.put("do", TokenType.DOTK);
        reservedMap.put("while", TokenType.WHILETK);
        reservedMap.put("for", TokenType.FORTK);
        reservedMap.put("from", TokenType.FROMTK);
        reservedMap.put("to", TokenType.TOTK);
        reservedMap.put("step", TokenType.STEPTK);
        reservedMap.put("AND", TokenType.AND);
        reservedMap.put("OR", TokenType.OR);

        // 单字符运算符
        reservedSingleCharMap.put('+', TokenType.PLUS);
        reservedSingleCharMap.put('-', TokenType.MINU);
        reservedSingleCharMap.put('*', TokenType.MULT);
        reservedSingleCharMap.put('/', TokenType.DIV);

        // 单字符分隔符
        reservedSingleCharMap.put(';', TokenType.SEMICN);
        reservedSingleCharMap.put(',', TokenType.COMMA);
        reservedSingleCharMap.put(')', TokenType.RPARENT);
        reservedSingleCharMap.put('[', TokenType.LBRACK);
        reservedSingleCharMap.put(']', TokenType.RBRACK);
        reservedSingleCharMap.put('}', TokenType.RBRACE);
    }

    public Lexer(String inputString) {
        this.inputString = inputString;
    }

    public ArrayList<Token> tokenize() {
        ArrayList<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(new Token(curType, curToken.toString(), tokenLine, tokenColumn));
        }
        return tokens;
    }

    /**
     * 词法错误，按出现顺序。词法分析不会因为它们停下来。
     */
    public List<String> getErrors() {
        return errors;
    }

    private boolean hasNext() {
        skip(); //跳过空白字符和注释
        if (reachEnd()) {
            return false;
        }

        updateCurToken();
        char c = nowChar();

        if (isDigit(c)) { //处理整数和浮点数
            readNumber(false);
        }

        else if (isLetter(c)) { //IDFR
            while (!reachEnd() && (isLetter(nowChar()) || isDigit(nowChar()) || nowChar() == '_')) {
                curToken.append(nowChar());
                curPos++;
            }
            String word = curToken.toString();
            curType = reservedMap.getOrDefault(word, TokenType.IDENFR);
            if (curType == TokenType.IDENFR) {
                checkIdentifier(word);
            }
        }

        else if (c == '(') {
            // (+5) (-2.5) 形式的带符号字面量；(5) 仍然是三个 Token
            if (isSignedLiteralAhead()) {
                curPos++;
                curToken.append(nowChar()); // 符号
                curPos++;
                readNumber(true);
                curPos++; // ')'
            } else {
                curType = TokenType.LPARENT;
                curToken.append(c);
                curPos++;
            }
        }

        else if (c == '{') {
            curType = TokenType.LBRACE;
            curToken.append(c);
            curPos++;
        }

        else if (c == '@') {
            if (inputString.startsWith("@define", curPos)) {
                curType = TokenType.DEFINETK;
                curToken.append("@define");
                curPos += "@define".length();
            } else {
                reportError("illegal character '@'");
                curPos++;
                return hasNext();
            }
        }

        else if (c == '"') {
            curType = TokenType.STRCON;
            curPos++;
            while (!reachEnd() && nowChar() != '"' && nowChar() != '\n') {
                curToken.append(nowChar());
                curPos++;
            }
            if (!reachEnd() && nowChar() == '"') {
                curPos++;
            } else {
                reportError("unterminated string literal");
            }
        }

        else if (reservedSingleCharMap.containsKey(c)) { //单个保留字符
            curToken.append(c);
            curType = reservedSingleCharMap.get(c);
            curPos++;
        }

        else if (c == ':') {
            readOperator(':', '=', TokenType.COLON, TokenType.ASSIGN);
        }

        else if (c == '>') {
            readOperator('>', '=', TokenType.GRE, TokenType.GEQ);
        }

        else if (c == '<') {
            readOperator('<', '=', TokenType.LSS, TokenType.LEQ);
        }

        else if (c == '=') {
            readOperator('=', '=', TokenType.DEFEQ, TokenType.EQL);
        }

        else if (c == '!') {
            readOperator('!', '=', TokenType.NOT, TokenType.NEQ);
        }

        else {
            // 处理非法字符，报告错误并继续
            reportError("illegal character '" + c + "'");
            curPos++;
            return hasNext();
        }

        return curType != null;
    }

    private void readOperator(char first, char second, TokenType single, TokenType pair) {
        curToken.append(first);
        curPos++;
        if (!reachEnd() && nowChar() == second) {
            curToken.append(second);
            curType = pair;
            curPos++;
        } else {
            curType = single;
        }
    }

    // 读入 digits [ '.' digits ]，curToken 中可能已经有符号
    private void readNumber(boolean signed) {
        while (!reachEnd() && isDigit(nowChar())) {
            curToken.append(nowChar());
            curPos++;
        }
        boolean isFloat = false;
        if (curPos + 1 < inputString.length() && nowChar() == '.'
                && isDigit(inputString.charAt(curPos + 1))) {
            isFloat = true;
            curToken.append('.');
            curPos++;
            while (!reachEnd() && isDigit(nowChar())) {
                curToken.append(nowChar());
                curPos++;
            }
        }
        String text = curToken.toString();
        if (isFloat) {
            curType = signed ? TokenType.SIGNED_FLOATCON : TokenType.FLOATCON;
            float value = Float.parseFloat(text);
            if (Float.isInfinite(value)) {
                reportError("float literal out of range: " + text);
            } else if (value == 0.0f && hasNonZeroDigit(text)) {
                reportError("float literal too small: " + text);
            }
        } else {
            curType = signed ? TokenType.SIGNED_INTCON : TokenType.INTCON;
            try {
                Integer.parseInt(text);
            } catch (NumberFormatException e) {
                reportError("integer literal out of range: " + text);
            }
        }
    }

    private boolean isSignedLiteralAhead() {
        int p = curPos + 1;
        if (p >= inputString.length() || (inputString.charAt(p) != '+' && inputString.charAt(p) != '-')) {
            return false;
        }
        p++;
        int digitsStart = p;
        while (p < inputString.length() && isDigit(inputString.charAt(p))) {
            p++;
        }
        if (p == digitsStart) {
            return false;
        }
        if (p + 1 < inputString.length() && inputString.charAt(p) == '.'
                && isDigit(inputString.charAt(p + 1))) {
            p++;
            while (p < inputString.length() && isDigit(inputString.charAt(p))) {
                p++;
            }
        }
        return p < inputString.length() && inputString.charAt(p) == ')';
    }

    private void checkIdentifier(String word) {
        if (word.length() > MAX_IDENT_LENGTH) {
            reportError("identifier '" + word + "' is longer than " + MAX_IDENT_LENGTH + " characters");
        } else if (word.endsWith("_")) {
            reportError("identifier '" + word + "' ends with '_'");
        } else if (word.contains("__")) {
            reportError("identifier '" + word + "' contains '__'");
        }
    }

    private void reportError(String message) {
        errors.add("Lexical error at line " + tokenLine + ", column " + tokenColumn + ": " + message);
    }

    private char nowChar() {
        return inputString.charAt(curPos);
    }

    // 只接受 ASCII 字母和数字
    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean hasNonZeroDigit(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '1' && c <= '9') {
                return true;
            }
        }
        return false;
    }

    private boolean isBlank(char c) {
        return c == '\n' || c == '\t' || c == '\r' || c == ' ' || c == '\f';
    }

    private void advance() {
        if (nowChar() == '\n') {
            line++;
            lineStart = curPos + 1;
        }
        curPos++;
    }

    private void skip() {
        while (!reachEnd()) {
            if (isBlank(nowChar())) {
                advance();
            } else if (inputString.startsWith("<!-", curPos)) { // 单行注释 <!- ... -!>
                skipComment("<!-", "-!>");
            } else if (inputString.startsWith("{--", curPos)) { // 多行注释 {-- ... --}
                skipComment("{--", "--}");
            } else {
                break;
            }
        }
    }

    private void skipComment(String open, String close) {
        markTokenStart();
        curPos += open.length();
        while (!reachEnd() && !inputString.startsWith(close, curPos)) {
            advance();
        }
        if (reachEnd()) {
            reportError("unterminated comment");
        } else {
            curPos += close.length();
        }
    }

    private void markTokenStart() {
        tokenLine = line;
        tokenColumn = curPos - lineStart + 1;
    }

    private void updateCurToken() {
        curToken = new StringBuilder();
        curType = null;
        markTokenStart();
    }

    private boolean reachEnd() {
        return curPos >= inputString.length();
    }
}
