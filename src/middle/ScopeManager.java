package middle;

import error.ErrorHandler;
import error.ErrorType;
import middle.symbol.SymbolRecord;
import middle.symbol.VarSymbol;

/**
 * 作用域栈。进入 for 循环体时压栈，退出时弹栈，符号随之消失。
 */
public class ScopeManager {
    private final ErrorHandler errorHandler;
    private final SymbolLogger logger = new SymbolLogger();

    private Scope globalScope;      // 栈底
    private Scope currentScope;     // 栈顶
    private int nextScopeId = 1;  // 用于分配ID

    public ScopeManager(ErrorHandler errorHandler) {
        this.errorHandler = errorHandler;
    }

    /**
     * 进入一个新作用域。第一次调用创建的是全局作用域。
     */
    public Scope enterScope() {
        Scope newScope = new Scope(nextScopeId++, currentScope);
        if (currentScope == null) {
            globalScope = newScope;
        }
        currentScope = newScope;
        return newScope;
    }

    /**
     * 退出当前作用域（指针回到父节点）。
     */
    public void exitScope() {
        if (currentScope != null) {
            currentScope = currentScope.getParent();
        }
    }

    /**
     * 在【当前】作用域定义一个新符号。同一作用域内重名时报 DuplicateDeclaration 并返回 false。
     */
    public boolean define(VarSymbol symbol) {
        if (currentScope == null) {
            throw new IllegalStateException("define() called before enterScope()");
        }

        VarSymbol existing = currentScope.lookupLocally(symbol.getName());
        if (existing != null) {
            errorHandler.addError(ErrorType.DuplicateDeclaration, symbol.getDefineLine(), symbol.getDefineColumn(),
                    "Double declaration of '" + symbol.getName() + "' (first declared at line "
                            + existing.getDefineLine() + ", column " + existing.getDefineColumn() + ")");
            return false;
        }
        currentScope.addSymbol(symbol);
        logger.record(new SymbolRecord(currentScope.getId(), symbol.getName(), symbol.getTypeName()));
        return true;
    }

    /**
     * 从【当前】开始，向【外层】查找一个符号。找不到返回 null。
     */
    public VarSymbol resolve(String name) {
        Scope scope = currentScope;
        while (scope != null) {
            VarSymbol symbol = scope.lookupLocally(name);
            if (symbol != null) {
                return symbol;
            }
            scope = scope.getParent(); // 向上查找
        }
        return null;
    }

    public void setCurrentScope(Scope scope) {
        this.currentScope = scope;
    }

    public int getCurrentDepth() {
        return currentScope == null ? 0 : currentScope.getDepth();
    }

    public Scope getGlobalScope() {
        return globalScope;
    }

    public SymbolLogger getLogger() {
        return logger;
    }
}
