package middle.component.type;

import java.util.HashMap;
import java.util.Map;

public class ArrayType implements Type {

    /**
     * 数组元素类型，只能是 INT 或 FLOAT
     */
    private final BasicType elementType;

    /**
     * 数组长度，声明时就固定
     */
    private final int numElements;

    /**
     * 缓存：Map<ElementType, Map<NumElements, ArrayType>>
     * 保证 [Int; 5] 永远是同一个对象
     */
    private static final Map<BasicType, Map<Integer, ArrayType>> cache = new HashMap<>();

    private ArrayType(BasicType elementType, int numElements) {
        this.elementType = elementType;
        this.numElements = numElements;
    }

    /**
     * 静态工厂方法：获取 ArrayType 实例
     */
    public static synchronized ArrayType get(BasicType elementType, int numElements) {
        Map<Integer, ArrayType> innerMap = cache.computeIfAbsent(
            elementType,
            k -> new HashMap<>()
        );
        return innerMap.computeIfAbsent(
            numElements,
            k -> new ArrayType(elementType, numElements)
        );
    }

    public BasicType getElementType() {
        return elementType;
    }

    public int getNumElements() {
        return numElements;
    }

    @Override
    public String toString() {
        return "[" + elementType + "; " + numElements + "]";
    }
}
