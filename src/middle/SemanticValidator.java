package middle;

import error.ErrorHandler;
import error.ErrorType;
import frontend.Token.Token;
import frontend.syntax.Block;
import frontend.syntax.Program;
import frontend.syntax.expression.*;
import frontend.syntax.statement.*;
import middle.component.type.ArrayType;
import middle.component.type.BasicType;
import middle.component.type.Type;
import middle.symbol.VarSymbol;

/**
 * 语义分析第二遍：语义验证器
 * <p>
 * 职责：
 * 1. 按源程序顺序遍历语句，为每个表达式推导类型。
 * 2. 检查未定义、类型不匹配、数组用法、常量赋值、除以零。
 * 3. 只为 for 循环变量新建作用域，离开循环体时弹出。
 * <p>
 * 出错的子表达式得到 {@link BasicType#ERROR}，上层遇到 ERROR 不再重复报错，
 * 同一语句里互不相关的错误仍然都会报告。
 */
public class SemanticValidator {

    private final ScopeManager scopeManager;
    private final ErrorHandler errorHandler;
    private final ConstCalculater constCalculator;

    public SemanticValidator(ScopeManager scopeManager, ErrorHandler errorHandler) {
        this.scopeManager = scopeManager;
        this.errorHandler = errorHandler;
        this.constCalculator = new ConstCalculater(scopeManager);
    }

    /**
     * 遍历的入口
     */
    public void visit(Program program) {
        // 全局作用域已在第一遍中建好
        scopeManager.setCurrentScope(scopeManager.getGlobalScope());
        visitBlock(program.getBlock());
    }

    private void visitBlock(Block block) {
        for (Stmt stmt : block.getStmts()) {
            visitStmt(stmt);
        }
    }

    // -----------------------------------------------------------------
    // 语句检查
    // -----------------------------------------------------------------

    /**
     * 语句分配器
     */
    private void visitStmt(Stmt stmt) {
        if (stmt instanceof AssignStmt)        visitAssignStmt((AssignStmt) stmt);
        else if (stmt instanceof IfStmt)       visitIfStmt((IfStmt) stmt);
        else if (stmt instanceof DoWhileStmt)  visitDoWhileStmt((DoWhileStmt) stmt);
        else if (stmt instanceof ForStmt)      visitForStmt((ForStmt) stmt);
        else if (stmt instanceof InputStmt)    visitInputStmt((InputStmt) stmt);
        else if (stmt instanceof OutputStmt)   visitOutputStmt((OutputStmt) stmt);
        else throw new IllegalStateException("Unknown statement node: " + stmt.getClass().getSimpleName());
    }

    /**
     * 检查点：左值合法、右值类型与左值一致
     */
    private void visitAssignStmt(AssignStmt stmt) {
        Type targetType = visitTarget(stmt.getTarget());
        Exp value = stmt.getValue();
        Type valueType = visitExp(value);

        if (targetType == BasicType.ERROR || valueType == BasicType.ERROR) {
            return;
        }
        if (valueType instanceof ArrayType) {
            addError(ErrorType.TypeMismatch, value.getToken(),
                    "Cannot assign array '" + arrayName(value) + "' to scalar '" + stmt.getTarget().getName() + "'");
        } else if (valueType != targetType) {
            addError(ErrorType.TypeMismatch, value.getToken(),
                    "Cannot assign " + valueType + " value to '" + stmt.getTarget().getName()
                            + "' of type " + targetType);
        }
    }

    private void visitIfStmt(IfStmt ifStmt) {
        visitCond(ifStmt.getCond());
        visitBlock(ifStmt.getIfBlock());
        visitBlock(ifStmt.getElseBlock());
    }

    private void visitDoWhileStmt(DoWhileStmt doWhileStmt) {
        // 按源程序顺序：先循环体，后条件
        visitBlock(doWhileStmt.getBody());
        visitCond(doWhileStmt.getCond());
    }

    /**
     * 起点、终点、步长在外层作用域求类型；循环变量只在循环体的新作用域内可见。
     */
    private void visitForStmt(ForStmt forStmt) {
        checkLoopBound(forStmt.getStart(), "start");
        checkLoopBound(forStmt.getEnd(), "end");
        checkLoopBound(forStmt.getStep(), "step");

        scopeManager.enterScope();
        Token loopVar = forStmt.getLoopVar();
        scopeManager.define(new VarSymbol(
                loopVar.getContent(),
                BasicType.INT,
                false,
                null,
                scopeManager.getCurrentDepth(),
                loopVar.getLine(),
                loopVar.getColumn()));
        visitBlock(forStmt.getBody());
        scopeManager.exitScope();
    }

    private void checkLoopBound(Exp bound, String role) {
        BasicType type = visitScalarExp(bound);
        if (type != BasicType.ERROR && type != BasicType.INT) {
            addError(ErrorType.TypeMismatch, bound.getToken(),
                    "For-loop " + role + " must be Int, got " + type);
        }
    }

    private void visitInputStmt(InputStmt inputStmt) {
        visitTarget(inputStmt.getTarget());
    }

    private void visitOutputStmt(OutputStmt outputStmt) {
        for (Exp exp : outputStmt.getExps()) {
            visitScalarExp(exp);
        }
    }

    /**
     * 条件必须是关系/逻辑运算或 ! 的结果
     */
    private void visitCond(Cond cond) {
        Exp exp = cond.getExp();
        BasicType type = visitScalarExp(exp);
        if (type != BasicType.ERROR && type != BasicType.BOOL) {
            addError(ErrorType.TypeMismatch, exp.getToken(),
                    "Condition must be a boolean expression, got " + type);
        }
    }

    // -----------------------------------------------------------------
    // 左值与数组访问
    // -----------------------------------------------------------------

    /**
     * 赋值或 input 的目标。常量、未定义名字和整个数组都不能作为目标，此时返回 ERROR。
     */
    private Type visitTarget(Variable target) {
        VarSymbol symbol = scopeManager.resolve(target.getName());
        if (symbol == null) {
            addError(ErrorType.UndefinedIdentifier, target.getIdent(),
                    "Undeclared identifier: '" + target.getName() + "'");
            visitIndexIfAny(target);
            return BasicType.ERROR;
        }
        if (!symbol.isMutable()) {
            addError(ErrorType.ConstantMutation, target.getIdent(),
                    "Cannot modify constant: '" + target.getName() + "'");
            visitIndexIfAny(target);
            return BasicType.ERROR;
        }

        Type type = visitVariableAccess(target, symbol);
        if (type instanceof ArrayType) {
            addError(ErrorType.TypeMismatch, target.getIdent(),
                    "Cannot assign to array '" + target.getName() + "' as a whole");
            return BasicType.ERROR;
        }
        return type;
    }

    /**
     * 已解析名字的访问。简单变量返回声明类型（可能是数组类型），下标访问返回元素类型。
     */
    private Type visitVariableAccess(Variable variable, VarSymbol symbol) {
        if (variable instanceof SimpleVariable) {
            return symbol.getType();
        }
        if (!(variable instanceof ArrayVariable)) {
            throw new IllegalStateException("Unknown variable node: " + variable.getClass().getSimpleName());
        }

        ArrayVariable arrayVariable = (ArrayVariable) variable;
        if (!symbol.isArray()) {
            addError(ErrorType.TypeMismatch, variable.getIdent(),
                    "'" + variable.getName() + "' is not an array");
            visitScalarExp(arrayVariable.getIndex());
            return BasicType.ERROR;
        }
        ArrayType arrayType = (ArrayType) symbol.getType();
        checkIndex(arrayVariable, arrayType);
        return arrayType.getElementType();
    }

    /**
     * 检查点：下标必须是 Int；能在编译时求值的下标必须在 [0, size) 内
     */
    private void checkIndex(ArrayVariable arrayVariable, ArrayType arrayType) {
        Exp index = arrayVariable.getIndex();
        BasicType indexType = visitScalarExp(index);
        if (indexType == BasicType.ERROR) {
            return;
        }
        if (indexType != BasicType.INT) {
            addError(ErrorType.InvalidIndexType, index.getToken(),
                    "Index of array '" + arrayVariable.getName() + "' must be Int, got " + indexType);
            return;
        }

        Number value = constCalculator.calculate(index);
        if (value instanceof Integer) {
            int idx = value.intValue();
            int size = arrayType.getNumElements();
            if (idx < 0 || idx >= size) {
                addError(ErrorType.IndexOutOfBounds, index.getToken(),
                        "Array index out of bounds: '" + arrayVariable.getName() + "[" + idx + "]', size is " + size);
            }
        }
    }

    private void visitIndexIfAny(Variable variable) {
        if (variable instanceof ArrayVariable) {
            visitScalarExp(((ArrayVariable) variable).getIndex());
        }
    }

    // -----------------------------------------------------------------
    // 表达式类型推导
    // -----------------------------------------------------------------

    /**
     * 要求标量的位置。裸数组名在这里报 ArrayUsedAsScalar。
     */
    private BasicType visitScalarExp(Exp exp) {
        Type type = visitExp(exp);
        if (type instanceof ArrayType) {
            addError(ErrorType.ArrayUsedAsScalar, exp.getToken(),
                    "Array '" + arrayName(exp) + "' used as a scalar value");
            return BasicType.ERROR;
        }
        return (BasicType) type;
    }

    private Type visitExp(Exp exp) {
        if (exp instanceof IntLiteral)        return BasicType.INT;
        if (exp instanceof FloatLiteral)      return BasicType.FLOAT;
        if (exp instanceof StringLiteral)     return BasicType.STRING;
        if (exp instanceof VarExp)            return visitVarExp((VarExp) exp);
        if (exp instanceof BinaryExp)         return visitBinaryExp((BinaryExp) exp);
        if (exp instanceof NotExp)            return visitNotExp((NotExp) exp);
        if (exp instanceof TypeExp || exp instanceof ArrayTypeExp) {
            throw new IllegalStateException("Type specification in executable position: " + exp);
        }
        throw new IllegalStateException("Unknown expression node: " + exp.getClass().getSimpleName());
    }

    /**
     * 检查点：未定义的名字
     */
    private Type visitVarExp(VarExp varExp) {
        Variable variable = varExp.getVariable();
        VarSymbol symbol = scopeManager.resolve(variable.getName());
        if (symbol == null) {
            addError(ErrorType.UndefinedIdentifier, variable.getIdent(),
                    "Undeclared identifier: '" + variable.getName() + "'");
            visitIndexIfAny(variable);
            return BasicType.ERROR;
        }
        return visitVariableAccess(variable, symbol);
    }

    private Type visitBinaryExp(BinaryExp binaryExp) {
        BasicType left = visitScalarExp(binaryExp.getLeft());
        BasicType right = visitScalarExp(binaryExp.getRight());
        BinaryOp op = binaryExp.getOp();

        // 除数在编译时为零，与操作数类型无关
        if (op == BinaryOp.DIV) {
            Number divisor = constCalculator.calculate(binaryExp.getRight());
            if (divisor != null && ConstCalculater.isZero(divisor)) {
                addError(ErrorType.DivisionByZero, binaryExp.getRight().getToken(), "Division by zero");
            }
        }

        if (left == BasicType.ERROR || right == BasicType.ERROR) {
            return BasicType.ERROR;
        }

        if (op.isArithmetic()) {
            if (!left.isNumeric() || !right.isNumeric()) {
                return operatorMismatch(binaryExp, left, right);
            }
            return (left == BasicType.FLOAT || right == BasicType.FLOAT) ? BasicType.FLOAT : BasicType.INT;
        }
        if (op.isRelational()) {
            if (!left.isNumeric() || !right.isNumeric()) {
                return operatorMismatch(binaryExp, left, right);
            }
            return BasicType.BOOL;
        }
        // AND / OR
        if (!isTruthy(left) || !isTruthy(right)) {
            return operatorMismatch(binaryExp, left, right);
        }
        return BasicType.BOOL;
    }

    private Type visitNotExp(NotExp notExp) {
        BasicType operand = visitScalarExp(notExp.getOperand());
        if (operand == BasicType.ERROR) {
            return BasicType.ERROR;
        }
        if (!isTruthy(operand)) {
            addError(ErrorType.TypeMismatch, notExp.getToken(),
                    "Operator '!' cannot be applied to " + operand);
            return BasicType.ERROR;
        }
        return BasicType.BOOL;
    }

    private BasicType operatorMismatch(BinaryExp binaryExp, BasicType left, BasicType right) {
        addError(ErrorType.TypeMismatch, binaryExp.getToken(),
                "Operator '" + binaryExp.getOp() + "' cannot be applied to " + left + " and " + right);
        return BasicType.ERROR;
    }

    // 逻辑运算接受布尔值和数值
    private static boolean isTruthy(BasicType type) {
        return type == BasicType.BOOL || type.isNumeric();
    }

    private static String arrayName(Exp exp) {
        if (exp instanceof VarExp) {
            return ((VarExp) exp).getVariable().getName();
        }
        return exp.toString();
    }

    private void addError(ErrorType type, Token at, String message) {
        errorHandler.addError(type, at.getLine(), at.getColumn(), message);
    }
}
