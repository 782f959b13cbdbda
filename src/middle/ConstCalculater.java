package middle;

import frontend.syntax.expression.*;
import middle.symbol.VarSymbol;

/**
 * 辅助类：编译时常量求值器
 * 职责：折叠整数/浮点字面量、已声明的常量，以及它们之间的 + - * /。
 * 变量永远不折叠。无法在编译时确定时返回 null。
 */
public class ConstCalculater {

    private final ScopeManager scopeManager;

    public ConstCalculater(ScopeManager scopeManager) {
        this.scopeManager = scopeManager;
    }

    /**
     * @return Integer 或 Float；不是编译时常量时返回 null
     */
    public Number calculate(Exp exp) {
        if (exp instanceof IntLiteral) {
            return ((IntLiteral) exp).getValue();
        }
        if (exp instanceof FloatLiteral) {
            return ((FloatLiteral) exp).getValue();
        }
        if (exp instanceof VarExp) {
            return visitVarAsConst(((VarExp) exp).getVariable());
        }
        if (exp instanceof BinaryExp) {
            return visitBinaryExp((BinaryExp) exp);
        }
        // 字符串、! 和关系/逻辑运算都不参与折叠
        return null;
    }

    public static boolean isZero(Number value) {
        if (value instanceof Integer) {
            return value.intValue() == 0;
        }
        return value.floatValue() == 0.0f;
    }

    private Number visitVarAsConst(Variable variable) {
        if (!(variable instanceof SimpleVariable)) {
            return null;
        }
        VarSymbol symbol = scopeManager.resolve(variable.getName());
        if (symbol == null || !symbol.isConstant()) {
            return null;
        }
        return symbol.getConstValue();
    }

    private Number visitBinaryExp(BinaryExp binaryExp) {
        if (!binaryExp.getOp().isArithmetic()) {
            return null;
        }
        Number lhs = calculate(binaryExp.getLeft());
        Number rhs = calculate(binaryExp.getRight());
        if (lhs == null || rhs == null) {
            return null;
        }

        if (lhs instanceof Integer && rhs instanceof Integer) {
            return foldInt(binaryExp.getOp(), lhs.intValue(), rhs.intValue());
        }

        // 有一边是 Float 时按 Float 计算
        return foldFloat(binaryExp.getOp(), lhs.floatValue(), rhs.floatValue());
    }

    /**
     * 上溢为无穷或非零操作数下溢为 0 时同样不算常量
     */
    private static Float foldFloat(BinaryOp op, float l, float r) {
        float result;
        switch (op) {
            case ADD: result = l + r; break;
            case SUB: result = l - r; break;
            case MUL: result = l * r; break;
            default:
                if (r == 0.0f) { return null; }
                result = l / r;
        }
        if (Float.isInfinite(result) || Float.isNaN(result)) {
            return null;
        }
        if (result == 0.0f && l != 0.0f && (op == BinaryOp.MUL || op == BinaryOp.DIV)) {
            return null;
        }
        return result;
    }

    /**
     * 溢出的整数运算不算编译时常量，返回 null
     */
    private static Integer foldInt(BinaryOp op, int l, int r) {
        try {
            switch (op) {
                case ADD: return Math.addExact(l, r);
                case SUB: return Math.subtractExact(l, r);
                case MUL: return Math.multiplyExact(l, r);
                default:
                    // 除以零由语义检查报告
                    if (r == 0 || (l == Integer.MIN_VALUE && r == -1)) {
                        return null;
                    }
                    return l / r;
            }
        } catch (ArithmeticException e) {
            return null;
        }
    }
}
