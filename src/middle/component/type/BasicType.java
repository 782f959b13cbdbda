package middle.component.type;

/**
 * 标量类型，以及语义分析中间用到的几种类型。
 * BOOL 只由关系/逻辑运算和 ! 产生；ERROR 是出错子表达式的占位类型，用来防止错误连锁。
 */
public enum BasicType implements Type {
    INT("Int"),
    FLOAT("Float"),
    BOOL("Bool"),
    STRING("String"),
    ERROR("<error>");

    private final String name;

    BasicType(String name) {
        this.name = name;
    }

    public static BasicType fromName(String typeName) {
        switch (typeName) {
            case "Int": return INT;
            case "Float": return FLOAT;
            default:
                throw new IllegalArgumentException("Unknown type name: " + typeName);
        }
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    @Override
    public String toString() {
        return name;
    }
}
