package middle;

import error.Error;
import error.ErrorHandler;
import frontend.syntax.Program;
import middle.symbol.SymbolRecord;

import java.util.Collections;
import java.util.List;

/**
 * 语义分析入口：第一遍收集声明，第二遍检查语句。
 * 每次 analyze 都使用全新的符号表和错误列表，同一棵树分析多次结果相同。
 */
public class SemanticAnalyzer {
    private List<SymbolRecord> symbolRecords = Collections.emptyList();

    /**
     * @return 按发现顺序排列的全部语义错误；为空表示程序通过检查
     */
    public List<Error> analyze(Program program) {
        ErrorHandler errorHandler = new ErrorHandler();
        ScopeManager scopeManager = new ScopeManager(errorHandler);

        // 第一遍：符号收集
        SymbolCollector collector = new SymbolCollector(scopeManager, errorHandler);
        collector.visit(program);

        // 第二遍：语义验证
        SemanticValidator validator = new SemanticValidator(scopeManager, errorHandler);
        validator.visit(program);

        symbolRecords = scopeManager.getLogger().getRecords();
        return errorHandler.getErrors();
    }

    /**
     * 上一次 analyze 登记过的所有符号，按定义顺序
     */
    public List<SymbolRecord> getSymbolRecords() {
        return symbolRecords;
    }
}
