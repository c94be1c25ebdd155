package org.symproof.expressions;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.symproof.symbolic.Z3VariableManager;

/**
 * 定义将 Java 对象转换为 Z3 表达式的接口。
 */
public interface ToZ3Expr {

    /**
     * 将此对象转换为 Z3 表达式。
     * 子表达式应通过 {@link Z3VariableManager#encode} 转换，以便共享子项只编码一次。
     * @param ctx Z3 Context 实例。
     * @param varManager Z3VariableManager 实例，用于管理符号变量到 Z3 常量的映射。
     * @return 对应的 Z3 Expr。
     */
    Expr<?> toZ3Expr(Context ctx, Z3VariableManager varManager);
}
