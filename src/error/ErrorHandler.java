package error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次语义分析对应一个 ErrorHandler。
 * 错误按记录顺序保存，不排序。
 */
public class ErrorHandler {
    private final List<Error> errors = new ArrayList<>();

    // 记录一个错误
    public void addError(ErrorType type, int line, int column, String message) {
        errors.add(new Error(type, line, column, message));
    }

    public List<Error> getErrors() {
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }
}
