package middle;

import middle.symbol.VarSymbol;

import java.util.LinkedHashMap;

/**
 * 作用域链上的一帧。全局作用域保存所有声明，每个 for 循环体再压一帧。
 */
public class Scope {
    private final int id;                  // 作用域的唯一ID (用于 symbol.txt 输出)
    private final Scope parent;            // 指向父作用域 (null 代表全局作用域)
    private final int depth;               // 全局作用域深度为 0
    private final LinkedHashMap<String, VarSymbol> symbols; // 当前作用域【本地】定义的符号

    public Scope(int id, Scope parent) {
        this.id = id;
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
        this.symbols = new LinkedHashMap<>();
    }

    // --- Getters ---
    public int getId() { return id; }
    public Scope getParent() { return parent; }
    public int getDepth() { return depth; }

    /**
     * 在当前作用域【本地】定义一个符号
     */
    public void addSymbol(VarSymbol symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    /**
     * 在当前作用域【本地】查找一个符号
     */
    public VarSymbol lookupLocally(String name) {
        return symbols.get(name);
    }
}
