package org.symproof.translate;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symproof.contract.Contract;
import org.symproof.contract.ContractPredicate;
import org.symproof.core.Sort;
import org.symproof.expressions.Coercions;
import org.symproof.expressions.Formulas;
import org.symproof.expressions.FunctionSymbol;
import org.symproof.expressions.RelationType;
import org.symproof.expressions.SortMismatchException;
import org.symproof.expressions.terms.Numeral;
import org.symproof.expressions.terms.Term;
import org.symproof.expressions.terms.TupleValue;
import org.symproof.expressions.terms.Variable;
import org.symproof.lang.ast.AnnAssign;
import org.symproof.lang.ast.Assert;
import org.symproof.lang.ast.Assign;
import org.symproof.lang.ast.Attribute;
import org.symproof.lang.ast.AugAssign;
import org.symproof.lang.ast.BinaryOp;
import org.symproof.lang.ast.BinaryOperator;
import org.symproof.lang.ast.BoolOp;
import org.symproof.lang.ast.BoolOperator;
import org.symproof.lang.ast.Call;
import org.symproof.lang.ast.Compare;
import org.symproof.lang.ast.CompareOperator;
import org.symproof.lang.ast.Expr;
import org.symproof.lang.ast.ExprStmt;
import org.symproof.lang.ast.ExprVisitor;
import org.symproof.lang.ast.For;
import org.symproof.lang.ast.FunctionDef;
import org.symproof.lang.ast.If;
import org.symproof.lang.ast.IfExp;
import org.symproof.lang.ast.Name;
import org.symproof.lang.ast.NamedExpr;
import org.symproof.lang.ast.NumberLiteral;
import org.symproof.lang.ast.Pass;
import org.symproof.lang.ast.Return;
import org.symproof.lang.ast.Starred;
import org.symproof.lang.ast.Stmt;
import org.symproof.lang.ast.StmtVisitor;
import org.symproof.lang.ast.StringLiteral;
import org.symproof.lang.ast.Subscript;
import org.symproof.lang.ast.TupleExpr;
import org.symproof.lang.ast.UnaryOp;
import org.symproof.lang.ast.UnaryOperator;
import org.symproof.lang.ast.UnsupportedExpr;
import org.symproof.lang.ast.UnsupportedStmt;
import org.symproof.lang.ast.While;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 对受限子集做符号执行，把函数体翻译为返回值表达式、假设和证明义务。
 *
 * <p>语句按顺序处理，环境在语句间传递。if 语句的两个分支各自接上其后的语句（continuation），
 * 从而把落空的控制流线性化为两条完整路径。返回是带守卫的：每个块结果记录它在什么条件下已经返回，
 * 后续语句只在未返回的路径上生效，展开循环时遇到有条件的 return 也会继续展开，
 * 只有无条件 return 才停止。</p>
 *
 * <p>路径条件贯穿整个翻译：证明义务形如 pc ⇒ φ，assert 的事实以 pc ⇒ φ 的形式被假设。</p>
 */
public class Translator {

    private static final Logger logger = LoggerFactory.getLogger(Translator.class);

    public static final int DEFAULT_MAX_UNROLL = 256;

    private final Map<String, Contract> contracts;
    private final Map<String, Term> externalConstants;
    private final int maxUnroll;

    /**
     * @param contracts 可调用函数的契约，按函数名索引。
     * @param externalConstants 闭包与模块级常量。
     * @param maxUnroll 循环展开的上限。
     */
    public Translator(Map<String, Contract> contracts, Map<String, Term> externalConstants, int maxUnroll) {
        this.contracts = Map.copyOf(Objects.requireNonNull(contracts, "Contracts cannot be null"));
        this.externalConstants = Map.copyOf(Objects.requireNonNull(externalConstants, "External constants cannot be null"));
        if (maxUnroll < 0) {
            throw new IllegalArgumentException("Unroll ceiling must be non-negative: " + maxUnroll);
        }
        this.maxUnroll = maxUnroll;
    }

    /**
     * 翻译函数体。
     * @param function 函数定义。
     * @param paramBindings 参数名到符号变量的绑定。
     * @throws TranslationException 函数体使用了子集外的构造。
     */
    public TranslationResult translate(FunctionDef function, Map<String, ? extends Term> paramBindings) {
        if (function.isAsync()) {
            throw new TranslationException("Async functions cannot be translated", function.getLine());
        }
        logger.info("翻译函数 {}", function.getName());
        Walker walker = new Walker();
        BlockResult result;
        try {
            result = walker.block(function.getBody(), SymbolicEnvironment.of(paramBindings), Formulas.TRUE);
        } catch (SortMismatchException e) {
            throw new TranslationException("Ill-sorted expression in '" + function.getName() + "': " + e.getMessage(), e);
        }
        TranslationState state = walker.state;
        logger.debug("函数 {} 翻译完成：{} 条假设，{} 条义务，{} 条安全义务",
                function.getName(), state.assumptions.size(), state.obligations.size(), state.safetyObligations.size());
        return new TranslationResult(result.value, result.guard, state.assumptions, state.obligations,
                state.safetyObligations, state.warnings, new ArrayList<>(state.caveats), result.env);
    }

    /**
     * 一个语句块的翻译结果：出口环境、已返回的条件以及返回值（无返回时为 null）。
     * coversRest 表示该结果已经包含了块中其后所有语句的效果。
     */
    private static final class BlockResult {
        final SymbolicEnvironment env;
        final Term guard;
        final Term value;
        final boolean coversRest;

        BlockResult(SymbolicEnvironment env, Term guard, Term value, boolean coversRest) {
            this.env = env;
            this.guard = guard;
            this.value = value;
            this.coversRest = coversRest;
        }

        static BlockResult fallThrough(SymbolicEnvironment env) {
            return new BlockResult(env, Formulas.FALSE, null, false);
        }

        boolean alwaysReturns() {
            return guard.equals(Formulas.TRUE);
        }
    }

    /**
     * 语句的上下文：当前环境、路径条件、块中其后的语句。
     */
    private static final class Frame {
        final SymbolicEnvironment env;
        final Term pathCondition;
        final List<Stmt> rest;

        Frame(SymbolicEnvironment env, Term pathCondition, List<Stmt> rest) {
            this.env = env;
            this.pathCondition = pathCondition;
            this.rest = rest;
        }
    }

    private final class Walker implements StmtVisitor<BlockResult, Frame> {

        private final TranslationState state = new TranslationState();
        private final Builtins builtins = new Builtins(state);
        private final MathLibrary math = new MathLibrary(state);

        BlockResult block(List<Stmt> stmts, SymbolicEnvironment env, Term pathCondition) {
            BlockResult acc = BlockResult.fallThrough(env);
            for (int i = 0; i < stmts.size(); i++) {
                Term here = Formulas.and(pathCondition, Formulas.not(acc.guard));
                Frame frame = new Frame(acc.env, here, stmts.subList(i + 1, stmts.size()));
                BlockResult step = stmts.get(i).accept(this, frame);
                acc = sequence(acc, step);
                if (acc.alwaysReturns() || step.coversRest) {
                    break;
                }
            }
            return acc;
        }

        /**
         * 顺序组合：先执行 first，未返回时再执行 second。
         */
        private BlockResult sequence(BlockResult first, BlockResult second) {
            Term guard = Formulas.or(first.guard, second.guard);
            Term value;
            if (first.value == null) {
                value = second.value;
            } else if (second.value == null) {
                value = first.value;
            } else {
                value = mergeValues(first.guard, first.value, second.value);
            }
            return new BlockResult(second.env, guard, value, false);
        }

        /**
         * 按条件合并两个分支的结果。
         */
        private BlockResult combine(Term condition, BlockResult whenTrue, BlockResult whenFalse,
                                    boolean coversRest, int line) {
            Term guard = Formulas.ite(condition, whenTrue.guard, whenFalse.guard);
            Term value;
            if (whenTrue.value == null) {
                value = whenFalse.value;
            } else if (whenFalse.value == null) {
                value = whenTrue.value;
            } else {
                value = mergeValues(condition, whenTrue.value, whenFalse.value);
            }
            SymbolicEnvironment env;
            if (whenTrue.alwaysReturns()) {
                env = whenFalse.env;
            } else if (whenFalse.alwaysReturns()) {
                env = whenTrue.env;
            } else {
                env = mergeEnvironments(condition, whenTrue.env, whenFalse.env, line);
            }
            return new BlockResult(env, guard, value, coversRest);
        }

        private SymbolicEnvironment mergeEnvironments(Term condition, SymbolicEnvironment whenTrue,
                                                      SymbolicEnvironment whenFalse, int line) {
            return whenTrue.merge(condition, whenFalse, this::mergeValues, name -> {
                String warning = "Variable '" + name + "' is bound on only one branch of the conditional at line " + line;
                if (!state.warnings.contains(warning)) {
                    logger.warn("变量 {} 只在第 {} 行条件语句的一个分支上绑定，合并时保留该值", name, line);
                    state.warnings.add(warning);
                }
            });
        }

        /**
         * phi 值。等长元组逐元素合并。
         */
        private Term mergeValues(Term condition, Term whenTrue, Term whenFalse) {
            if (whenTrue instanceof TupleValue a && whenFalse instanceof TupleValue b && a.size() == b.size()) {
                List<Term> elements = new ArrayList<>(a.size());
                for (int i = 0; i < a.size(); i++) {
                    elements.add(Formulas.ite(condition, a.get(i), b.get(i)));
                }
                return makeTuple(elements);
            }
            return Formulas.ite(condition, whenTrue, whenFalse);
        }

        /**
         * 新建元组：新的 Int 身份常量，并假设访问器公理 tuple_get_i(id) == element_i。
         */
        private TupleValue makeTuple(List<Term> elements) {
            Variable identity = state.fresh("tuple", Sort.INT);
            for (int i = 0; i < elements.size(); i++) {
                Term accessor = Formulas.apply(Formulas.tupleAccessor(i), identity);
                state.assume(Formulas.eq(accessor, Formulas.toReal(elements.get(i))));
            }
            return TupleValue.of(identity, elements);
        }

        /**
         * 条件语境下的真值；非空元组恒为真。
         */
        private Term truthy(Term value) {
            return value instanceof TupleValue ? Formulas.TRUE : Formulas.truthy(value);
        }

        Pair<Term, SymbolicEnvironment> evaluate(Expr expr, SymbolicEnvironment env, Term pathCondition) {
            ExpressionTranslator translator = new ExpressionTranslator(env, pathCondition);
            Term term = expr.accept(translator);
            return Pair.of(term, translator.env);
        }

        // ========== 语句 ==========

        @Override
        public BlockResult visitReturn(Return stmt, Frame frame) {
            if (stmt.getValue() == null) {
                throw new TranslationException("Bare return without a value is not supported", stmt.getLine());
            }
            Pair<Term, SymbolicEnvironment> r = evaluate(stmt.getValue(), frame.env, frame.pathCondition);
            return new BlockResult(r.getRight(), Formulas.TRUE, r.getLeft(), false);
        }

        @Override
        public BlockResult visitAssign(Assign stmt, Frame frame) {
            if (stmt.getTargets().size() != 1) {
                throw new TranslationException("Multiple assignment targets not supported", stmt.getLine());
            }
            Pair<Term, SymbolicEnvironment> r = evaluate(stmt.getValue(), frame.env, frame.pathCondition);
            return BlockResult.fallThrough(assignTarget(stmt.getTargets().get(0), r.getLeft(), r.getRight(), stmt.getLine()));
        }

        @Override
        public BlockResult visitAnnAssign(AnnAssign stmt, Frame frame) {
            if (stmt.getValue() == null) {
                return BlockResult.fallThrough(frame.env);
            }
            Pair<Term, SymbolicEnvironment> r = evaluate(stmt.getValue(), frame.env, frame.pathCondition);
            Term value = r.getLeft();
            if (stmt.getAnnotation() instanceof Name type && type.getId().equals("float") && !(value instanceof TupleValue)) {
                value = Formulas.toReal(value);
            }
            return BlockResult.fallThrough(assignTarget(stmt.getTarget(), value, r.getRight(), stmt.getLine()));
        }

        private SymbolicEnvironment assignTarget(Expr target, Term value, SymbolicEnvironment env, int line) {
            if (target instanceof Name name) {
                return env.bind(name.getId(), value);
            }
            if (target instanceof TupleExpr tuple) {
                if (!(value instanceof TupleValue tv)) {
                    throw new TranslationException("Cannot unpack a non-tuple value", line);
                }
                if (tv.size() != tuple.getElements().size()) {
                    throw new TranslationException("Cannot unpack " + tv.size() + " values into "
                            + tuple.getElements().size() + " targets", line);
                }
                SymbolicEnvironment result = env;
                for (int i = 0; i < tv.size(); i++) {
                    result = assignTarget(tuple.getElements().get(i), tv.get(i), result, line);
                }
                return result;
            }
            throw new TranslationException("Unsupported assignment target: " + target.getClass().getSimpleName(), line);
        }

        @Override
        public BlockResult visitAugAssign(AugAssign stmt, Frame frame) {
            if (!(stmt.getTarget() instanceof Name name)) {
                throw new TranslationException("Unsupported aug-assign target: "
                        + stmt.getTarget().getClass().getSimpleName(), stmt.getLine());
            }
            Term current = frame.env.lookup(name.getId());
            if (current == null) {
                throw new TranslationException("Undefined variable in aug-assign: " + name.getId(), stmt.getLine());
            }
            Pair<Term, SymbolicEnvironment> r = evaluate(stmt.getValue(), frame.env, frame.pathCondition);
            Term updated = binary(stmt.getOperator(), current, r.getLeft(), frame.pathCondition, stmt.getLine());
            return BlockResult.fallThrough(r.getRight().bind(name.getId(), updated));
        }

        @Override
        public BlockResult visitIf(If stmt, Frame frame) {
            Pair<Term, SymbolicEnvironment> t = evaluate(stmt.getTest(), frame.env, frame.pathCondition);
            Term condition = truthy(t.getLeft());
            SymbolicEnvironment env = t.getRight();
            Term pc = frame.pathCondition;
            boolean returns = ReturnFinder.containsReturn(stmt.getBody()) || ReturnFinder.containsReturn(stmt.getOrelse());

            List<Stmt> thenPath = stmt.getBody();
            List<Stmt> elsePath = stmt.getOrelse();
            if (returns) {
                thenPath = concat(thenPath, frame.rest);
                elsePath = concat(elsePath, frame.rest);
            }
            if (condition.equals(Formulas.TRUE)) {
                return withCoversRest(block(thenPath, env, pc), returns);
            }
            if (condition.equals(Formulas.FALSE)) {
                return withCoversRest(block(elsePath, env, pc), returns);
            }
            BlockResult whenTrue = block(thenPath, env, Formulas.and(pc, condition));
            BlockResult whenFalse = block(elsePath, env, Formulas.and(pc, Formulas.not(condition)));
            return combine(condition, whenTrue, whenFalse, returns, stmt.getLine());
        }

        private BlockResult withCoversRest(BlockResult r, boolean coversRest) {
            return new BlockResult(r.env, r.guard, r.value, coversRest);
        }

        private List<Stmt> concat(List<Stmt> a, List<Stmt> b) {
            List<Stmt> all = new ArrayList<>(a.size() + b.size());
            all.addAll(a);
            all.addAll(b);
            return all;
        }

        @Override
        public BlockResult visitFor(For stmt, Frame frame) {
            int line = stmt.getLine();
            if (!(stmt.getTarget() instanceof Name loopVar)) {
                throw new TranslationException("For-loop target must be a simple name, got "
                        + stmt.getTarget().getClass().getSimpleName(), line);
            }
            if (!(stmt.getIterable() instanceof Call call) || !(call.getFunction() instanceof Name fn)
                    || !fn.getId().equals("range")) {
                throw new TranslationException("Only 'for i in range(N)' loops are supported", line);
            }
            if (call.getArguments().isEmpty() || call.getArguments().size() > 3 || !call.getKeywords().isEmpty()) {
                throw new TranslationException("range() requires 1-3 positional arguments", line);
            }
            SymbolicEnvironment env = frame.env;
            List<BigInteger> bounds = new ArrayList<>();
            for (Expr arg : call.getArguments()) {
                Pair<Term, SymbolicEnvironment> r = evaluate(arg, env, frame.pathCondition);
                env = r.getRight();
                Term bound = Coercions.toNumeric(r.getLeft());
                if (!(bound instanceof Numeral n) || n.getSort() != Sort.INT) {
                    throw new TranslationException("For-loop bound must be a constant integer", line);
                }
                bounds.add(n.getValue().getNumerator());
            }
            BigInteger start = bounds.size() > 1 ? bounds.get(0) : BigInteger.ZERO;
            BigInteger stop = bounds.size() > 1 ? bounds.get(1) : bounds.get(0);
            BigInteger step = bounds.size() > 2 ? bounds.get(2) : BigInteger.ONE;
            if (step.signum() == 0) {
                throw new TranslationException("For-loop step cannot be zero", line);
            }
            BigInteger count = iterationCount(start, stop, step);
            if (count.compareTo(BigInteger.valueOf(maxUnroll)) > 0) {
                throw new TranslationException("For-loop would unroll " + count + " iterations, max is " + maxUnroll, line);
            }
            logger.debug("展开第 {} 行的 for 循环，共 {} 次迭代", line, count);

            BlockResult acc = BlockResult.fallThrough(env);
            for (int i = 0; i < count.intValue(); i++) {
                BigInteger index = start.add(step.multiply(BigInteger.valueOf(i)));
                Term here = Formulas.and(frame.pathCondition, Formulas.not(acc.guard));
                BlockResult iteration = block(stmt.getBody(), acc.env.bind(loopVar.getId(), Formulas.num(index)), here);
                acc = sequence(acc, iteration);
                if (acc.alwaysReturns()) {
                    return acc;
                }
            }
            Term here = Formulas.and(frame.pathCondition, Formulas.not(acc.guard));
            return sequence(acc, block(stmt.getOrelse(), acc.env, here));
        }

        private BigInteger iterationCount(BigInteger start, BigInteger stop, BigInteger step) {
            BigInteger span = stop.subtract(start);
            if (span.signum() == 0 || span.signum() != step.signum()) {
                return BigInteger.ZERO;
            }
            BigInteger magnitude = step.abs();
            return span.abs().add(magnitude).subtract(BigInteger.ONE).divide(magnitude);
        }

        @Override
        public BlockResult visitWhile(While stmt, Frame frame) {
            int line = stmt.getLine();
            BlockResult acc = BlockResult.fallThrough(frame.env);
            for (int k = 0; k < maxUnroll; k++) {
                Term here = Formulas.and(frame.pathCondition, Formulas.not(acc.guard));
                Pair<Term, SymbolicEnvironment> t = evaluate(stmt.getTest(), acc.env, here);
                Term guard = truthy(t.getLeft());
                if (guard.equals(Formulas.FALSE)) {
                    logger.debug("第 {} 行的 while 循环在第 {} 次迭代前结构上终止", line, k);
                    return finishWhile(stmt, frame, acc, t.getRight());
                }
                BlockResult body = block(stmt.getBody(), t.getRight(), Formulas.and(here, guard));
                BlockResult iteration = combine(guard, body, BlockResult.fallThrough(t.getRight()), false, line);
                acc = sequence(acc, iteration);
                if (acc.alwaysReturns()) {
                    return acc;
                }
            }
            Term here = Formulas.and(frame.pathCondition, Formulas.not(acc.guard));
            Pair<Term, SymbolicEnvironment> t = evaluate(stmt.getTest(), acc.env, here);
            Term guard = truthy(t.getLeft());
            if (!guard.equals(Formulas.FALSE)) {
                String caveat = "while-loop at line " + line + " assumed to terminate within " + maxUnroll + " iterations";
                logger.warn("第 {} 行的 while 循环达到展开上限 {}，假设其已终止", line, maxUnroll);
                state.assume(Formulas.implies(here, Formulas.not(guard)));
                state.caveats.add(caveat);
            }
            return finishWhile(stmt, frame, acc, t.getRight());
        }

        private BlockResult finishWhile(While stmt, Frame frame, BlockResult acc, SymbolicEnvironment env) {
            BlockResult exited = new BlockResult(env, acc.guard, acc.value, false);
            Term here = Formulas.and(frame.pathCondition, Formulas.not(acc.guard));
            return sequence(exited, block(stmt.getOrelse(), env, here));
        }

        @Override
        public BlockResult visitAssert(Assert stmt, Frame frame) {
            Pair<Term, SymbolicEnvironment> r = evaluate(stmt.getTest(), frame.env, frame.pathCondition);
            state.assume(Formulas.implies(frame.pathCondition, truthy(r.getLeft())));
            return BlockResult.fallThrough(r.getRight());
        }

        @Override
        public BlockResult visitPass(Pass stmt, Frame frame) {
            return BlockResult.fallThrough(frame.env);
        }

        @Override
        public BlockResult visitExprStmt(ExprStmt stmt, Frame frame) {
            if (stmt.getValue() instanceof StringLiteral) {
                // 文档字符串
                return BlockResult.fallThrough(frame.env);
            }
            Pair<Term, SymbolicEnvironment> r = evaluate(stmt.getValue(), frame.env, frame.pathCondition);
            return BlockResult.fallThrough(r.getRight());
        }

        @Override
        public BlockResult visitUnsupported(UnsupportedStmt stmt, Frame frame) {
            throw new TranslationException("Unsupported statement: '" + stmt.getKeyword() + "'", stmt.getLine());
        }

        // ========== 运算 ==========

        private Term binary(BinaryOperator op, Term left, Term right, Term pc, int line) {
            if (left instanceof TupleValue || right instanceof TupleValue) {
                throw new TranslationException("Arithmetic on tuples is not supported", line);
            }
            switch (op) {
                case ADD:
                    return Formulas.add(left, right);
                case SUB:
                    return Formulas.sub(left, right);
                case MUL:
                    return Formulas.mul(left, right);
                case DIV:
                    requireNonZero(right, pc);
                    return Formulas.div(left, right);
                case FLOOR_DIV:
                    requireIntegers(left, right, "Floor division only supported for integers", line);
                    requireNonZero(right, pc);
                    return Formulas.floorDiv(left, right);
                case MOD:
                    requireIntegers(left, right, "Modulo only supported for integers", line);
                    requireNonZero(right, pc);
                    return Formulas.mod(left, right);
                case POW:
                    return Formulas.pow(left, Builtins.constantExponent(Coercions.toNumeric(right), line));
                default:
                    throw new TranslationException("Unsupported operator: " + op.getSymbol(), line);
            }
        }

        private void requireIntegers(Term left, Term right, String message, int line) {
            if (Coercions.toNumeric(left).getSort() != Sort.INT || Coercions.toNumeric(right).getSort() != Sort.INT) {
                throw new TranslationException(message, line);
            }
        }

        private void requireNonZero(Term divisor, Term pc) {
            Term d = Coercions.toNumeric(divisor);
            state.requireSafe(Formulas.implies(pc, Formulas.ne(d, Formulas.zero(d.getSort()))));
        }

        private Term callContract(String name, Contract contract, List<Term> args, Term pc, int line) {
            int arity = contract.declaredArity();
            if (arity >= 0 && arity != args.size()) {
                throw new TranslationException("Function '" + name + "' expects " + arity
                        + " argument(s), got " + args.size(), line);
            }
            List<Sort> sorts = contract.parameterSortsFor(args.size());
            List<Term> coerced = new ArrayList<>(args.size());
            for (int i = 0; i < args.size(); i++) {
                Term arg = args.get(i);
                if (arg instanceof TupleValue) {
                    throw new TranslationException("Passing a tuple to '" + name + "' is not supported", line);
                }
                try {
                    coerced.add(Coercions.coerceTo(arg, sorts.get(i)));
                } catch (SortMismatchException e) {
                    throw new TranslationException("Argument " + i + " of '" + name + "' has sort "
                            + arg.getSort() + ", expected " + sorts.get(i), line);
                }
            }
            FunctionSymbol symbol = FunctionSymbol.of(name, sorts, contract.getReturnSort());
            Term result = Formulas.apply(symbol, coerced);
            Term pre = Formulas.TRUE;
            if (contract.getPrecondition() != null) {
                pre = applyPredicate(contract.getPrecondition(), coerced, "Precondition of '" + name + "'", line);
                state.oblige(Formulas.implies(pc, pre));
            }
            if (contract.getPostcondition() != null) {
                List<Term> withResult = new ArrayList<>(coerced);
                withResult.add(result);
                Term post = applyPredicate(contract.getPostcondition(), withResult, "Postcondition of '" + name + "'", line);
                state.assume(Formulas.implies(pre, post));
            }
            logger.debug("调用 {} 按契约建模", name);
            return result;
        }

        private Term applyPredicate(ContractPredicate predicate, List<Term> args, String what, int line) {
            Term formula;
            try {
                formula = predicate.apply(args);
            } catch (RuntimeException e) {
                throw new TranslationException(what + " raised " + e.getClass().getSimpleName() + ": " + e.getMessage(), line);
            }
            if (formula == null || !formula.isFormula()) {
                throw new TranslationException(what + " did not return a formula", line);
            }
            return formula;
        }

        /**
         * 表达式翻译。海象运算符会更新 env，调用方在翻译后读回。
         */
        private final class ExpressionTranslator implements ExprVisitor<Term> {

            private SymbolicEnvironment env;
            private final Term pc;

            ExpressionTranslator(SymbolicEnvironment env, Term pc) {
                this.env = env;
                this.pc = pc;
            }

            @Override
            public Term visitNumber(NumberLiteral expr) {
                if (expr.isFloating()) {
                    return Formulas.real(expr.getValue());
                }
                return Formulas.num(expr.getValue().getNumerator());
            }

            @Override
            public Term visitString(StringLiteral expr) {
                throw new TranslationException("String literals are not supported", expr.getLine());
            }

            @Override
            public Term visitName(Name expr) {
                String id = expr.getId();
                Term bound = env.lookup(id);
                if (bound != null) {
                    return bound;
                }
                Term external = externalConstants.get(id);
                if (external != null) {
                    return external;
                }
                switch (id) {
                    case "True":
                        return Formulas.TRUE;
                    case "False":
                        return Formulas.FALSE;
                    case "None":
                        throw new TranslationException("None is not supported", expr.getLine());
                    default:
                        throw new TranslationException("Undefined variable: " + id, expr.getLine());
                }
            }

            @Override
            public Term visitBinary(BinaryOp expr) {
                Term left = expr.getLeft().accept(this);
                Term right = expr.getRight().accept(this);
                return binary(expr.getOperator(), left, right, pc, expr.getLine());
            }

            @Override
            public Term visitUnary(UnaryOp expr) {
                Term operand = expr.getOperand().accept(this);
                if (operand instanceof TupleValue && expr.getOperator() != UnaryOperator.NOT) {
                    throw new TranslationException("Arithmetic on tuples is not supported", expr.getLine());
                }
                return switch (expr.getOperator()) {
                    case NEG -> Formulas.neg(operand);
                    case POS -> Coercions.toNumeric(operand);
                    case NOT -> Formulas.not(truthy(operand));
                    case INVERT -> throw new TranslationException("Unsupported unary op: ~", expr.getLine());
                };
            }

            @Override
            public Term visitBoolOp(BoolOp expr) {
                List<Term> operands = new ArrayList<>();
                for (Expr value : expr.getValues()) {
                    operands.add(truthy(value.accept(this)));
                }
                return expr.getOperator() == BoolOperator.AND ? Formulas.and(operands) : Formulas.or(operands);
            }

            @Override
            public Term visitCompare(Compare expr) {
                List<Term> operands = new ArrayList<>();
                operands.add(expr.getLeft().accept(this));
                for (Expr comparator : expr.getComparators()) {
                    operands.add(comparator.accept(this));
                }
                List<Term> parts = new ArrayList<>();
                for (int i = 0; i < expr.getOperators().size(); i++) {
                    RelationType relation = relationOf(expr.getOperators().get(i), expr.getLine());
                    Term a = operands.get(i);
                    Term b = operands.get(i + 1);
                    if (a instanceof TupleValue || b instanceof TupleValue) {
                        throw new TranslationException("Comparison of tuples is not supported", expr.getLine());
                    }
                    parts.add(Formulas.compare(relation, a, b));
                }
                return Formulas.and(parts);
            }

            private RelationType relationOf(CompareOperator op, int line) {
                return switch (op) {
                    case LT -> RelationType.LT;
                    case LE -> RelationType.LE;
                    case GT -> RelationType.GT;
                    case GE -> RelationType.GE;
                    case EQ -> RelationType.EQ;
                    case NE -> RelationType.NE;
                    default -> throw new TranslationException("Unsupported comparison: " + op.getSymbol(), line);
                };
            }

            @Override
            public Term visitIfExp(IfExp expr) {
                Term condition = truthy(expr.getTest().accept(this));
                if (condition.equals(Formulas.TRUE)) {
                    return expr.getBody().accept(this);
                }
                if (condition.equals(Formulas.FALSE)) {
                    return expr.getOrelse().accept(this);
                }
                ExpressionTranslator whenTrue = new ExpressionTranslator(env, Formulas.and(pc, condition));
                Term a = expr.getBody().accept(whenTrue);
                ExpressionTranslator whenFalse = new ExpressionTranslator(env, Formulas.and(pc, Formulas.not(condition)));
                Term b = expr.getOrelse().accept(whenFalse);
                env = mergeEnvironments(condition, whenTrue.env, whenFalse.env, expr.getLine());
                return mergeValues(condition, a, b);
            }

            @Override
            public Term visitCall(Call expr) {
                int line = expr.getLine();
                if (!expr.getKeywords().isEmpty()) {
                    throw new TranslationException("Keyword arguments are not supported in call to '"
                            + expr.getFunction() + "'", line);
                }
                List<Term> args = new ArrayList<>();
                for (Expr arg : expr.getArguments()) {
                    args.add(arg.accept(this));
                }
                if (expr.getFunction() instanceof Name fn) {
                    String name = fn.getId();
                    if (Builtins.isBuiltin(name)) {
                        return builtins.call(name, args, line);
                    }
                    Contract contract = contracts.get(name);
                    if (contract != null) {
                        return callContract(name, contract, args, pc, line);
                    }
                    throw new TranslationException("Unknown function '" + name
                            + "'. Supply a contract for it to call it from verified code", line);
                }
                if (expr.getFunction() instanceof Attribute attribute) {
                    String path = attribute.dottedPath();
                    if (path != null && path.startsWith("math.")) {
                        return math.call(path, args, pc, line);
                    }
                }
                throw new TranslationException("Only simple function calls supported, got: " + expr.getFunction(), line);
            }

            @Override
            public Term visitAttribute(Attribute expr) {
                String path = expr.dottedPath();
                if (path != null && path.startsWith("math.")) {
                    return math.constant(path, expr.getLine());
                }
                throw new TranslationException("Unsupported attribute access '" + expr + "'", expr.getLine());
            }

            @Override
            public Term visitSubscript(Subscript expr) {
                Term base = expr.getValue().accept(this);
                if (!(base instanceof TupleValue tuple)) {
                    throw new TranslationException("Subscript of non-tuple value is not supported", expr.getLine());
                }
                int index = constantIndex(expr.getIndex(), expr.getLine());
                int normalized = index < 0 ? tuple.size() + index : index;
                if (normalized < 0 || normalized >= tuple.size()) {
                    throw new TranslationException("Tuple index " + index + " out of range for tuple of size "
                            + tuple.size(), expr.getLine());
                }
                return tuple.get(normalized);
            }

            private int constantIndex(Expr index, int line) {
                if (index instanceof NumberLiteral literal && !literal.isFloating()) {
                    return literal.getValue().getNumerator().intValueExact();
                }
                if (index instanceof UnaryOp unary && unary.getOperator() == UnaryOperator.NEG
                        && unary.getOperand() instanceof NumberLiteral literal && !literal.isFloating()) {
                    return -literal.getValue().getNumerator().intValueExact();
                }
                throw new TranslationException("Tuple index must be a constant integer", line);
            }

            @Override
            public Term visitTuple(TupleExpr expr) {
                if (expr.getElements().isEmpty()) {
                    throw new TranslationException("Empty tuple is not supported", expr.getLine());
                }
                List<Term> elements = new ArrayList<>();
                for (Expr element : expr.getElements()) {
                    elements.add(element.accept(this));
                }
                if (elements.size() == 1) {
                    return elements.get(0);
                }
                return makeTuple(elements);
            }

            @Override
            public Term visitStarred(Starred expr) {
                throw new TranslationException("Star-args are not supported", expr.getLine());
            }

            @Override
            public Term visitNamedExpr(NamedExpr expr) {
                Term value = expr.getValue().accept(this);
                env = env.bind(expr.getTarget(), value);
                return value;
            }

            @Override
            public Term visitUnsupported(UnsupportedExpr expr) {
                throw new TranslationException("Unsupported expression: " + expr.getKind(), expr.getLine());
            }
        }
    }
}
