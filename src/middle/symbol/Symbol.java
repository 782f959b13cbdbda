package middle.symbol;

import middle.component.type.Type;

public abstract class Symbol {
    private final String name;
    private final Type type;
    protected final int defineLine;
    protected final int defineColumn;

    public Symbol(String name, Type type, int defineLine, int defineColumn) {
        this.name = name;
        this.type = type;
        this.defineLine = defineLine;
        this.defineColumn = defineColumn;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public int getDefineLine() {
        return defineLine;
    }

    public int getDefineColumn() {
        return defineColumn;
    }
}
