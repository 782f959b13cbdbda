package middle;

import middle.symbol.SymbolRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 符号记录器
 * 职责：按定义顺序记录所有被定义的符号（包括循环变量），以便在编译成功时输出。
 */
public class SymbolLogger {
    private final List<SymbolRecord> records = new ArrayList<>();

    /**
     * 记录一个新发现的符号。
     * @param record 包含作用域ID、名称和类型名称的记录对象。
     */
    public void record(SymbolRecord record) {
        records.add(record);
    }

    /**
     * 因为我们是按声明顺序记录的，所以这个列表自然满足了排序要求。
     */
    public List<SymbolRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }
}
