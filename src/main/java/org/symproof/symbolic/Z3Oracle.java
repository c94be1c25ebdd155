package org.symproof.symbolic;

import com.microsoft.z3.AlgebraicNum;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symproof.expressions.terms.Term;
import org.symproof.expressions.terms.TupleValue;
import org.symproof.utils.Rational;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * 求解器边界。每个实例持有一个独立的 Z3 Context，用完必须 close。
 * @author Ayalyt
 */
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    private final Context ctx;
    private final Z3VariableManager varManager;

    public Z3Oracle() {
        this.ctx = new Context();
        this.varManager = new Z3VariableManager(ctx);
    }

    /**
     * 底层求解器的版本字符串。
     */
    public static String solverVersion() {
        return "z3-" + Version.getString();
    }

    /**
     * 检查 assumptions ∧ negatedGoal 是否可满足。
     * @param assumptions 作为前提的公式。
     * @param negatedGoal 已取反的目标公式。
     * @param timeoutMs 求解时间预算（毫秒）。
     * @param watched SAT 时需要从模型中读出的项，键为展示名。
     * @return 三值结果；SAT 时带有各被关注项的具体值。
     */
    public OracleOutcome check(List<Term> assumptions, Term negatedGoal, int timeoutMs, Map<String, Term> watched) {
        Solver solver = ctx.mkSolver();
        Params params = ctx.mkParams();
        params.add("timeout", timeoutMs);
        solver.setParameters(params);

        for (Term assumption : assumptions) {
            solver.add(varManager.encodeFormula(assumption));
        }
        BoolExpr goal = varManager.encodeFormula(negatedGoal);
        solver.add(goal);
        logger.debug("向求解器提交 {} 条前提与取反目标，预算 {}ms", assumptions.size(), timeoutMs);

        long start = System.nanoTime();
        Status status = solver.check();
        double elapsed = (System.nanoTime() - start) / 1_000_000.0;
        logger.info("求解结果: {}，耗时 {}ms", status, String.format("%.2f", elapsed));

        if (status == Status.UNSATISFIABLE) {
            return OracleOutcome.unsat(elapsed);
        } else if (status == Status.UNKNOWN) {
            return OracleOutcome.unknown(solver.getReasonUnknown(), elapsed);
        }
        Model model = solver.getModel();
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, Term> entry : watched.entrySet()) {
            values.put(entry.getKey(), valueOf(model, entry.getValue()));
        }
        return OracleOutcome.sat(values, elapsed);
    }

    private Object valueOf(Model model, Term term) {
        if (term instanceof TupleValue tuple) {
            StringJoiner joiner = new StringJoiner(", ", "(", ")");
            for (Term element : tuple.getElements()) {
                joiner.add(String.valueOf(valueOf(model, element)));
            }
            return joiner.toString();
        }
        return toScalar(model.eval(varManager.encode(term), true));
    }

    /**
     * 将模型中的值转换为 Java 标量：整数为 Long（溢出时为 BigInteger），
     * 有理数为 Double，布尔为 Boolean，其余退化为文本。
     */
    static Object toScalar(Expr<?> value) {
        if (value instanceof IntNum intNum) {
            BigInteger big = intNum.getBigInteger();
            return big.bitLength() < Long.SIZE ? (Object) big.longValue() : big;
        }
        if (value instanceof RatNum ratNum) {
            return Rational.fromZ3(ratNum).doubleValue();
        }
        if (value.isTrue()) {
            return Boolean.TRUE;
        }
        if (value.isFalse()) {
            return Boolean.FALSE;
        }
        if (value instanceof AlgebraicNum algebraic) {
            return algebraic.toDecimal(10);
        }
        return value.toString();
    }

    @Override
    public void close() {
        ctx.close();
    }
}
