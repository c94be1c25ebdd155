package org.symproof.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symproof.core.Sort;
import org.symproof.expressions.FunctionSymbol;
import org.symproof.expressions.SortMismatchException;
import org.symproof.expressions.terms.Term;
import org.symproof.expressions.terms.Variable;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 负责管理符号变量和函数符号到 Z3 常量、函数声明的映射。
 * 确保每个名字在 Z3 Context 中有唯一的对应 Z3 常量。
 * 对 term 的编码按对象身份记忆化：翻译器产生的表达式是共享子项的 DAG，
 * 逐节点只编码一次可以避免展开成指数规模的树。
 * 每个实例只服务于一次验证，不需要考虑并发。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    private final Map<String, Expr<?>> variableZ3Consts;
    private final Map<String, Sort> variableSorts;
    private final Map<FunctionSymbol, FuncDecl<?>> functionDecls;
    private final Map<Term, Expr<?>> encoded;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     */
    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.variableZ3Consts = new HashMap<>();
        this.variableSorts = new HashMap<>();
        this.functionDecls = new HashMap<>();
        this.encoded = new IdentityHashMap<>();
        logger.debug("Z3VariableManager 初始化完成。");
    }

    /**
     * 获取指定 Variable 对应的 Z3 常量。
     * 如果常量尚未创建，则会创建并缓存。
     * @param variable 符号变量。
     * @return 对应的 Z3 常量。
     * @throws IllegalStateException 同名变量以不同 sort 出现。
     */
    public Expr<?> getZ3Var(Variable variable) {
        Sort known = variableSorts.putIfAbsent(variable.getName(), variable.getSort());
        if (known != null && known != variable.getSort()) {
            logger.error("变量 {} 同时以 {} 和 {} 出现", variable.getName(), known, variable.getSort());
            throw new IllegalStateException("Variable '" + variable.getName() + "' used with sorts "
                    + known + " and " + variable.getSort());
        }
        return variableZ3Consts.computeIfAbsent(variable.getName(), name -> {
            logger.debug("创建 Z3 变量: {} : {}", name, variable.getSort());
            return ctx.mkConst(name, variable.getSort().toZ3Sort(ctx));
        });
    }

    /**
     * 获取指定函数符号对应的 Z3 函数声明。
     * @param symbol 未解释函数符号。
     * @return 对应的 Z3 FuncDecl。
     */
    public FuncDecl<?> getZ3Function(FunctionSymbol symbol) {
        return functionDecls.computeIfAbsent(symbol, s -> {
            com.microsoft.z3.Sort[] domain = s.getDomain().stream()
                    .map(sort -> sort.toZ3Sort(ctx))
                    .toArray(com.microsoft.z3.Sort[]::new);
            logger.debug("创建 Z3 函数声明: {}", s);
            return ctx.mkFuncDecl(s.getName(), domain, s.getRange().toZ3Sort(ctx));
        });
    }

    /**
     * 将 term 编码为 Z3 表达式，相同对象只编码一次。
     */
    public Expr<?> encode(Term term) {
        Expr<?> cached = encoded.get(term);
        if (cached != null) {
            return cached;
        }
        Expr<?> result = term.toZ3Expr(ctx, this);
        encoded.put(term, result);
        return result;
    }

    /**
     * 将公式编码为 Z3 布尔表达式。
     * @throws SortMismatchException term 不是公式。
     */
    public BoolExpr encodeFormula(Term formula) {
        if (!formula.isFormula()) {
            throw new SortMismatchException("Expected a formula, got a term of sort " + formula.getSort());
        }
        return (BoolExpr) encode(formula);
    }
}
