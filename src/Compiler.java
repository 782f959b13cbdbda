import error.Error;
import error.SyntaxException;
import frontend.Lexer;
import frontend.Parser;
import frontend.Token.Token;
import frontend.syntax.Program;
import middle.SemanticAnalyzer;
import middle.symbol.SymbolRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class Compiler {
    // 默认的输入输出文件名
    private static final String INPUT_FILE = "testfile.txt";
    private static final String ERROR_OUTPUT_FILE = "error.txt";
    private static final String SYMBOL_OUTPUT_FILE = "symbol.txt";
    private static final String AST_OUTPUT_FILE = "ast.txt";

    public static void main(String[] args) {
        Path input = Paths.get(args.length > 0 ? args[0] : INPUT_FILE);
        Path outDir = Paths.get(args.length > 1 ? args[1] : ".");
        try {
            int errorCount = run(input, outDir);
            if (errorCount > 0) {
                System.exit(1);
            }
        } catch (IOException e) {
            System.err.println("Error reading or writing files: " + e.getMessage());
            e.printStackTrace();
            System.exit(2);
        }
    }

    /**
     * 编译一个源文件。有错误时只写 error.txt，否则写 symbol.txt 和 ast.txt。
     * @return 错误总数
     */
    public static int run(Path input, Path outDir) throws IOException {
        // 1. 读取源程序
        String sourceCode = new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
        Files.createDirectories(outDir);

        // 2. 词法分析
        Lexer lexer = new Lexer(sourceCode);
        ArrayList<Token> tokens = lexer.tokenize();
        List<String> errorLines = new ArrayList<>(lexer.getErrors());

        // 上一次运行留下的输出先清掉
        for (String name : new String[]{ERROR_OUTPUT_FILE, SYMBOL_OUTPUT_FILE, AST_OUTPUT_FILE}) {
            Files.deleteIfExists(outDir.resolve(name));
        }

        // 3. 语法分析，出错立即停止
        Program program;
        try {
            program = new Parser(tokens).parse();
        } catch (SyntaxException e) {
            errorLines.add(e.getMessage());
            writeLines(outDir.resolve(ERROR_OUTPUT_FILE), errorLines);
            return errorLines.size();
        }

        // 4. 语义分析
        SemanticAnalyzer analyzer = new SemanticAnalyzer();
        for (Error error : analyzer.analyze(program)) {
            errorLines.add(error.toString());
        }

        // 5. 检查最终结果并输出
        if (!errorLines.isEmpty()) {
            writeLines(outDir.resolve(ERROR_OUTPUT_FILE), errorLines);
            return errorLines.size();
        }

        List<String> symbolLines = new ArrayList<>();
        for (SymbolRecord record : analyzer.getSymbolRecords()) {
            symbolLines.add(record.toString());
        }
        writeLines(outDir.resolve(SYMBOL_OUTPUT_FILE), symbolLines);
        try (BufferedWriter writer = Files.newBufferedWriter(outDir.resolve(AST_OUTPUT_FILE), StandardCharsets.UTF_8)) {
            writer.write(program.toString());
        }
        return 0;
    }

    private static void writeLines(Path filePath, List<String> lines) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(filePath, StandardCharsets.UTF_8)) {
            for (String line : lines) {
                writer.write(line);
                writer.newLine();
            }
        }
    }
}
