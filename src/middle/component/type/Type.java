package middle.component.type;

// 这是一个标记接口，所有类型都必须实现它
public interface Type {
    String toString();
}
