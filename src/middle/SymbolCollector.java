package middle;

import error.ErrorHandler;
import error.ErrorType;
import frontend.Token.Token;
import frontend.syntax.Program;
import frontend.syntax.expression.ArrayTypeExp;
import frontend.syntax.expression.Exp;
import frontend.syntax.expression.FloatLiteral;
import frontend.syntax.expression.TypeExp;
import frontend.syntax.variable.ConstDecl;
import frontend.syntax.variable.Decl;
import frontend.syntax.variable.VarDecl;
import middle.component.type.ArrayType;
import middle.component.type.BasicType;
import middle.component.type.Type;
import middle.symbol.VarSymbol;

/**
 * 语义分析第一遍：符号收集器
 * <p>
 * 职责：
 * 1. 创建全局作用域。
 * 2. 按声明顺序把所有变量和常量注册进去，重名报 DuplicateDeclaration。
 * 3. 检查常量值与声明类型是否一致。
 */
public class SymbolCollector {

    private final ScopeManager scopeManager;
    private final ErrorHandler errorHandler;
    private final ConstCalculater constCalculator; // 用于计算常量的值

    public SymbolCollector(ScopeManager scopeManager, ErrorHandler errorHandler) {
        this.scopeManager = scopeManager;
        this.errorHandler = errorHandler;
        this.constCalculator = new ConstCalculater(this.scopeManager);
    }

    public void visit(Program program) {
        scopeManager.enterScope();

        for (Decl decl : program.getDecls()) {
            visitDecl(decl);
        }

        // 第一遍结束后指针回到 null，第二遍从全局作用域重新开始
        scopeManager.exitScope();
    }

    private void visitDecl(Decl decl) {
        if (decl instanceof ConstDecl) {
            visitConstDecl((ConstDecl) decl);
        } else if (decl instanceof VarDecl) {
            visitVarDecl((VarDecl) decl);
        } else {
            throw new IllegalStateException("Unknown declaration node: " + decl.getClass().getSimpleName());
        }
    }

    private void visitVarDecl(VarDecl varDecl) {
        Type symbolType = parseTypeSpec(varDecl.getTypeSpec());
        for (Token ident : varDecl.getIdents()) {
            VarSymbol varSymbol = new VarSymbol(
                    ident.getContent(),
                    symbolType,
                    false,
                    null,
                    scopeManager.getCurrentDepth(),
                    ident.getLine(),
                    ident.getColumn());
            scopeManager.define(varSymbol);
        }
    }

    private void visitConstDecl(ConstDecl constDecl) {
        BasicType declaredType = BasicType.fromName(constDecl.getTypeName());
        Exp value = constDecl.getValue();
        Number constValue = constCalculator.calculate(value);
        BasicType valueType = value instanceof FloatLiteral ? BasicType.FLOAT : BasicType.INT;

        if (valueType != declaredType) {
            errorHandler.addError(ErrorType.TypeMismatch, value.getLine(), value.getColumn(),
                    "Type mismatch for constant '" + constDecl.getName() + "': expected "
                            + declaredType + ", got " + valueType);
            // 仍然按声明类型登记，后面的使用不会再报未定义
            constValue = null;
        }

        Token ident = constDecl.getIdent();
        VarSymbol varSymbol = new VarSymbol(
                constDecl.getName(),
                declaredType,
                true,           // isConstant
                constValue,
                scopeManager.getCurrentDepth(),
                ident.getLine(),
                ident.getColumn());
        scopeManager.define(varSymbol);
    }

    private Type parseTypeSpec(Exp typeSpec) {
        if (typeSpec instanceof TypeExp) {
            return BasicType.fromName(((TypeExp) typeSpec).getTypeName());
        }
        if (typeSpec instanceof ArrayTypeExp) {
            ArrayTypeExp arrayTypeExp = (ArrayTypeExp) typeSpec;
            return ArrayType.get(BasicType.fromName(arrayTypeExp.getTypeName()), arrayTypeExp.getSize());
        }
        throw new IllegalStateException("Not a type specification: " + typeSpec);
    }
}
