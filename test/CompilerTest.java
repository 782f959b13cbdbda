import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompilerTest {

    private static Path write(Path dir, String source) throws IOException {
        Path input = dir.resolve("testfile.txt");
        Files.write(input, source.getBytes(StandardCharsets.UTF_8));
        return input;
    }

    @Test
    void validProgramWritesSymbolsAndAst(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("out");
        assertEquals(0, Compiler.run(Paths.get("testfiles/valid_program.txt"), out));

        assertFalse(Files.exists(out.resolve("error.txt")));
        List<String> symbols = Files.readAllLines(out.resolve("symbol.txt"), StandardCharsets.UTF_8);
        assertEquals(9, symbols.size());
        assertEquals("1 a Int", symbols.get(0));
        assertEquals("2 i Int", symbols.get(8));

        String ast = new String(Files.readAllBytes(out.resolve("ast.txt")), StandardCharsets.UTF_8);
        assertTrue(ast.startsWith("MainPrgm SimpleTest;"));
        assertTrue(ast.contains("(0 - a)"));
    }

    @Test
    void semanticErrorsGoToErrorFile(@TempDir Path dir) throws IOException {
        assertEquals(7, Compiler.run(Paths.get("testfiles/error_test.txt"), dir));

        List<String> lines = Files.readAllLines(dir.resolve("error.txt"), StandardCharsets.UTF_8);
        assertEquals(7, lines.size());
        assertEquals("Line 10, Column 10: Undeclared identifier: 'a'", lines.get(0));
        assertFalse(Files.exists(dir.resolve("symbol.txt")));
        assertFalse(Files.exists(dir.resolve("ast.txt")));
    }

    @Test
    void syntaxErrorStopsBeforeAnalysis(@TempDir Path dir) throws IOException {
        Path input = write(dir, "MainPrgm T;\nVar\nBeginPg\n{\n  x := ;\n}\nEndPg;\n");
        assertEquals(1, Compiler.run(input, dir));

        List<String> lines = Files.readAllLines(dir.resolve("error.txt"), StandardCharsets.UTF_8);
        assertEquals(List.of("Syntax error at line 5, column 8: expected expression but found ';'"), lines);
    }

    @Test
    void lexicalErrorsComeFirst(@TempDir Path dir) throws IOException {
        Path input = write(dir, "MainPrgm T;\nVar\nlet x: Int;\nBeginPg\n{\n  x := 1 $ ;\n  y := 2;\n}\nEndPg;\n");
        assertEquals(2, Compiler.run(input, dir));

        List<String> lines = Files.readAllLines(dir.resolve("error.txt"), StandardCharsets.UTF_8);
        assertTrue(lines.get(0).startsWith("Lexical error at line 6, column 10"));
        assertEquals("Line 7, Column 3: Undeclared identifier: 'y'", lines.get(1));
    }

    @Test
    void rerunRemovesOutputsOfPreviousRun(@TempDir Path dir) throws IOException {
        assertEquals(7, Compiler.run(Paths.get("testfiles/error_test.txt"), dir));
        assertTrue(Files.exists(dir.resolve("error.txt")));

        assertEquals(0, Compiler.run(Paths.get("testfiles/valid_program.txt"), dir));
        assertFalse(Files.exists(dir.resolve("error.txt")));
        assertTrue(Files.exists(dir.resolve("symbol.txt")));
        assertTrue(Files.exists(dir.resolve("ast.txt")));

        assertEquals(7, Compiler.run(Paths.get("testfiles/error_test.txt"), dir));
        assertFalse(Files.exists(dir.resolve("symbol.txt")));
        assertFalse(Files.exists(dir.resolve("ast.txt")));
    }
}
