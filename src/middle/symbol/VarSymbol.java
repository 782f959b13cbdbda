package middle.symbol;

import middle.component.type.ArrayType;
import middle.component.type.BasicType;
import middle.component.type.Type;

/**
 * 变量、常量和循环变量共用的符号表项。
 * 常量只是 isConstant 为 true 的 VarSymbol，赋值检查统一看 {@link #isMutable()}。
 */
public class VarSymbol extends Symbol {
    private final boolean isConstant;
    private final Number constValue;   // 只有常量才有，Integer 或 Float
    private final int scopeDepth;

    public VarSymbol(String name, Type type, boolean isConstant, Number constValue,
                     int scopeDepth, int defineLine, int defineColumn) {
        super(name, type, defineLine, defineColumn);
        this.isConstant = isConstant;
        this.constValue = constValue;
        this.scopeDepth = scopeDepth;
    }

    public boolean isConstant() {
        return isConstant;
    }

    public boolean isMutable() {
        return !isConstant;
    }

    public boolean isArray() {
        return getType() instanceof ArrayType;
    }

    public Number getConstValue() {
        return constValue;
    }

    public int getScopeDepth() {
        return scopeDepth;
    }

    /**
     * 符号表输出里的类型名，例如 Int、ConstFloat、IntArray[5]
     */
    public String getTypeName() {
        Type type = getType();
        if (type instanceof ArrayType) {
            ArrayType arrayType = (ArrayType) type;
            return arrayType.getElementType() + "Array[" + arrayType.getNumElements() + "]";
        }
        String base = ((BasicType) type).toString();
        return isConstant ? "Const" + base : base;
    }
}
