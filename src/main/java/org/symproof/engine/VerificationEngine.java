package org.symproof.engine;

import com.microsoft.z3.Z3Exception;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symproof.cache.CacheKeys;
import org.symproof.cache.DiskProofStore;
import org.symproof.contract.Contract;
import org.symproof.contract.ContractPredicate;
import org.symproof.contract.TypeAnnotation;
import org.symproof.contract.TypeResolver;
import org.symproof.core.Counterexample;
import org.symproof.core.Parameter;
import org.symproof.core.Sort;
import org.symproof.expressions.Formulas;
import org.symproof.expressions.terms.Term;
import org.symproof.expressions.terms.TupleValue;
import org.symproof.expressions.terms.Variable;
import org.symproof.lang.ast.FunctionDef;
import org.symproof.lang.ast.Param;
import org.symproof.lang.ast.ReferencedNames;
import org.symproof.lang.parser.Parser;
import org.symproof.lang.parser.SourceSyntaxException;
import org.symproof.symbolic.OracleOutcome;
import org.symproof.symbolic.Z3Oracle;
import org.symproof.translate.TranslationException;
import org.symproof.translate.TranslationResult;
import org.symproof.translate.Translator;
import org.symproof.utils.Fingerprints;
import org.symproof.utils.Rational;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

/**
 * 验证流程的编排：解析、类型解析、翻译、组装验证条件、调用求解器、生成证书并写入缓存。
 *
 * <p>验证条件为 前置条件 ∧ 参数细化 ∧ 翻译假设 ⇒ 后置条件 ∧ 返回值细化 ∧ 被调函数的前置义务。
 * 目标非空时还要证明除零与数学函数定义域等安全义务，以及每条路径都返回。
 * 对目标取反后交给求解器：UNSAT 即为证明。</p>
 *
 * <p>{@link #verify} 从不抛出异常，所有失败都体现为证书状态。</p>
 */
public class VerificationEngine {

    private static final Logger logger = LoggerFactory.getLogger(VerificationEngine.class);

    /** 证书中公式展示的节点上限 */
    private static final int DISPLAY_LIMIT = 400;
    private static final String RESULT_NAME = "result";
    private static final String RETURNS_KEY = "__returns__";
    private static final Set<String> RESERVED_NAMES = Set.of("True", "False", "None");

    private final VerifierContext context;

    public VerificationEngine(VerifierContext context) {
        this.context = Objects.requireNonNull(context, "Verifier context cannot be null");
    }

    public ProofCertificate verify(VerifiableFunction function, ContractPredicate pre, ContractPredicate post) {
        return verify(function, pre, post, context.getTimeoutMs(), Map.of());
    }

    public ProofCertificate verify(VerifiableFunction function, ContractPredicate pre, ContractPredicate post,
                                   Map<String, Contract> contracts) {
        return verify(function, pre, post, context.getTimeoutMs(), contracts);
    }

    /**
     * 验证函数满足契约。
     * @param pre 前置条件，参数个数与函数相同；null 表示无。
     * @param post 后置条件，参数为函数参数加返回值；null 表示无。
     * @param timeoutMs 求解时间预算。
     * @param contracts 函数体中可调用的已验证函数的契约。
     */
    public ProofCertificate verify(VerifiableFunction function, ContractPredicate pre, ContractPredicate post,
                                   int timeoutMs, Map<String, Contract> contracts) {
        Objects.requireNonNull(function, "Function cannot be null");
        logger.info("开始验证 {}", function.getName());
        ProofCertificate certificate;
        try {
            certificate = run(function, pre, post, timeoutMs, contracts == null ? Map.of() : contracts);
        } catch (Z3Exception | LinkageError e) {
            logger.warn("求解器不可用或调用失败: {}", e.toString());
            certificate = ProofCertificate.builder(function.getName(), Status.UNKNOWN)
                    .sourceHash(function.hasSource() ? Fingerprints.shortHash(function.getSource()) : "")
                    .message("Solver failure: " + e.getMessage())
                    .build();
        } catch (RuntimeException e) {
            logger.error("验证 {} 时出现内部错误", function.getName(), e);
            certificate = ProofCertificate.builder(function.getName(), Status.UNKNOWN)
                    .sourceHash(function.hasSource() ? Fingerprints.shortHash(function.getSource()) : "")
                    .message("Internal error: " + e)
                    .build();
        }
        logger.info("验证结束: {}", certificate);
        return certificate;
    }

    public ProofCertificate verifyOrThrow(VerifiableFunction function, ContractPredicate pre, ContractPredicate post) {
        return verifyOrThrow(function, pre, post, Map.of());
    }

    /**
     * 与 {@link #verify} 相同，但证书不是 VERIFIED 时抛出。
     * @throws VerificationException 携带未通过的证书。
     */
    public ProofCertificate verifyOrThrow(VerifiableFunction function, ContractPredicate pre, ContractPredicate post,
                                          Map<String, Contract> contracts) {
        ProofCertificate certificate = verify(function, pre, post, contracts);
        if (!certificate.isVerified()) {
            throw new VerificationException(certificate);
        }
        return certificate;
    }

    /**
     * 清空内存缓存层。持久层不受影响。
     */
    public void clearCache() {
        context.getMemoryCache().clear();
    }

    private ProofCertificate run(VerifiableFunction function, ContractPredicate pre, ContractPredicate post,
                                 int timeoutMs, Map<String, Contract> contracts) {
        String name = function.getName();
        if (!function.hasSource()) {
            return skipped(name, "", "Cannot get source: " + function.getUnavailableReason());
        }
        String source = function.getSource();
        String sourceHash = Fingerprints.shortHash(source);

        FunctionDef def;
        try {
            def = Parser.parseFunction(source);
        } catch (SourceSyntaxException e) {
            return error(name, sourceHash, "Syntax error: " + e.getMessage());
        }
        if (def.isAsync()) {
            return skipped(name, sourceHash, "Async functions are not verified: suspension points have no model");
        }

        // 参数与返回值的类型
        TypeResolver resolver = new TypeResolver(function.getTypeAliases());
        List<Parameter> parameters = new ArrayList<>();
        Map<String, TypeAnnotation> annotations = new LinkedHashMap<>();
        TypeAnnotation returnType = null;
        try {
            for (Param param : def.getParams()) {
                if (param.getKind() != Param.Kind.POSITIONAL) {
                    return error(name, sourceHash, "Variadic parameter '" + param + "' is not supported");
                }
                TypeAnnotation type = resolver.resolve(param.getAnnotation());
                annotations.put(param.getName(), type);
                parameters.add(Parameter.of(param.getName(), parameters.size(), type.getSort()));
            }
            if (def.getReturns() != null) {
                returnType = resolver.resolve(def.getReturns());
            }
        } catch (TranslationException e) {
            return error(name, sourceHash, e.describe());
        }
        Map<String, Variable> bindings = new LinkedHashMap<>();
        List<Term> paramVars = new ArrayList<>();
        for (Parameter parameter : parameters) {
            Variable v = parameter.toVariable();
            bindings.put(parameter.getName(), v);
            paramVars.add(v);
        }
        Map<String, Term> externals = resolveExternals(function, def, bindings.keySet());

        Sort resultSort = returnType == null ? Sort.REAL : returnType.getSort();
        Variable resultVar = Variable.of(RESULT_NAME, resultSort);
        String key = cacheKey(source, pre, post, paramVars, resultVar, contracts, ReferencedNames.callArities(def),
                externals, annotations, returnType);

        Optional<ProofCertificate> hit = context.getMemoryCache().get(key);
        if (hit.isPresent()) {
            logger.info("{} 命中内存缓存", name);
            return hit.get();
        }
        Optional<DiskProofStore> disk = context.getDiskStore();
        if (disk.isPresent()) {
            Optional<ProofCertificate> stored = disk.get().load(key);
            if (stored.isPresent()) {
                logger.info("{} 命中持久缓存", name);
                context.getMemoryCache().put(key, stored.get());
                return stored.get();
            }
        }

        ProofCertificate certificate = prove(name, sourceHash, def, pre, post, timeoutMs, contracts, externals,
                parameters, annotations, returnType, bindings, paramVars, resultVar);
        context.getMemoryCache().put(key, certificate);
        disk.ifPresent(store -> store.store(key, certificate));
        return certificate;
    }

    private ProofCertificate prove(String name, String sourceHash, FunctionDef def,
                                   ContractPredicate pre, ContractPredicate post, int timeoutMs,
                                   Map<String, Contract> contracts, Map<String, Term> externals,
                                   List<Parameter> parameters, Map<String, TypeAnnotation> annotations,
                                   TypeAnnotation returnType, Map<String, Variable> bindings,
                                   List<Term> paramVars, Variable resultVar) {
        int n = parameters.size();
        if (pre != null && !pre.isVariadic() && pre.arity() != n) {
            return error(name, sourceHash, "pre contract for '" + name + "' takes " + pre.arity()
                    + " argument(s), expected " + n);
        }
        if (post != null && !post.isVariadic() && post.arity() != n + 1) {
            return error(name, sourceHash, "post contract for '" + name + "' takes " + post.arity()
                    + " argument(s), expected " + (n + 1));
        }

        TranslationResult result;
        try {
            result = new Translator(contracts, externals, context.getMaxUnroll()).translate(def, bindings);
        } catch (TranslationException e) {
            String message = e.hasLine() ? e.describe()
                    : e.getMessage() + " (in '" + name + "', near line " + def.getLine() + ")";
            return error(name, sourceHash, message);
        }
        if (result.getReturnExpr().isEmpty()) {
            return error(name, sourceHash, "Function has no return value on all paths");
        }
        Term returnExpr = result.getReturnExpr().get();

        // 前提
        List<Term> assumptions = new ArrayList<>();
        List<String> preStrings = new ArrayList<>();
        if (pre != null) {
            PredicateOutcome outcome = applyPredicate(pre, paramVars, "Precondition");
            if (outcome.isFailure()) {
                return error(name, sourceHash, outcome.error);
            }
            assumptions.add(outcome.formula);
            preStrings.add(display(outcome.formula));
        }
        try {
            for (Parameter parameter : parameters) {
                for (Term constraint : annotations.get(parameter.getName()).constraintsOn(bindings.get(parameter.getName()))) {
                    assumptions.add(constraint);
                    preStrings.add(display(constraint));
                }
            }
        } catch (TranslationException e) {
            return error(name, sourceHash, e.describe());
        }
        assumptions.addAll(result.getAssumptions());

        // 目标
        List<Term> goal = new ArrayList<>();
        List<String> postStrings = new ArrayList<>();
        if (post != null) {
            List<Term> args = new ArrayList<>(paramVars);
            args.add(returnExpr);
            PredicateOutcome outcome = applyPredicate(post, args, "Postcondition");
            if (outcome.isFailure()) {
                return error(name, sourceHash, outcome.error);
            }
            goal.add(outcome.formula);
            postStrings.add(displayOnResult(post, paramVars, resultVar, outcome.formula));
        }
        if (returnType != null && returnType.isRefined() && !(returnExpr instanceof TupleValue)) {
            try {
                goal.addAll(returnType.constraintsOn(returnExpr));
                for (Term constraint : returnType.constraintsOn(resultVar)) {
                    postStrings.add(display(constraint));
                }
            } catch (TranslationException e) {
                return error(name, sourceHash, e.describe());
            }
        }
        for (Term obligation : result.getObligations()) {
            goal.add(obligation);
            postStrings.add("obligation: " + display(obligation));
        }
        if (goal.isEmpty()) {
            return ProofCertificate.builder(name, Status.SKIPPED)
                    .sourceHash(sourceHash)
                    .preconditions(preStrings)
                    .message("No postcondition: nothing to prove")
                    .build();
        }
        boolean guardedReturn = !result.getReturnGuard().equals(Formulas.TRUE);
        if (guardedReturn) {
            goal.add(result.getReturnGuard());
            postStrings.add("returns on every path: " + display(result.getReturnGuard()));
        }

        Map<String, Term> watched = new LinkedHashMap<>(bindings);
        watched.put(Counterexample.RETURN_KEY, returnExpr);
        if (guardedReturn) {
            watched.put(RETURNS_KEY, result.getReturnGuard());
        }
        List<String> caveats = new ArrayList<>(result.getCaveats());
        OracleOutcome outcome;
        double solverTime;
        try (Z3Oracle oracle = new Z3Oracle()) {
            outcome = oracle.check(assumptions, Formulas.not(Formulas.and(goal)), timeoutMs, watched);
            solverTime = outcome.getElapsedMs();
            if (outcome.getResult() != OracleOutcome.Result.UNKNOWN && !result.getSafetyObligations().isEmpty()) {
                solverTime += checkSafety(oracle, assumptions, result.getSafetyObligations(), timeoutMs, caveats);
            }
        }

        ProofCertificate.Builder builder;
        switch (outcome.getResult()) {
            case UNSAT:
                builder = ProofCertificate.builder(name, Status.VERIFIED);
                break;
            case SAT:
                Map<String, Object> values = new LinkedHashMap<>(outcome.getModelValues());
                boolean returned = !Boolean.FALSE.equals(values.remove(RETURNS_KEY));
                if (!returned) {
                    values.remove(Counterexample.RETURN_KEY);
                }
                Counterexample counterexample = Counterexample.of(values);
                String message = "Counterexample: " + counterexample;
                if (!returned) {
                    message += " (no return on this path: 'returns on every path' violated)";
                }
                builder = ProofCertificate.builder(name, Status.COUNTEREXAMPLE)
                        .counterexample(counterexample)
                        .message(message);
                break;
            default:
                String reason = "Z3 returned unknown (timeout " + timeoutMs + "ms?)";
                if (StringUtils.isNotBlank(outcome.getReasonUnknown())) {
                    reason += ": " + outcome.getReasonUnknown();
                }
                builder = ProofCertificate.builder(name, Status.UNKNOWN).message(reason);
                break;
        }
        return builder.sourceHash(sourceHash)
                .preconditions(preStrings)
                .postconditions(postStrings)
                .solverTimeMs(solverTime)
                .solverVersion(Z3Oracle.solverVersion())
                .caveats(caveats)
                .build();
    }

    /**
     * 除零与数学函数定义域等安全条件单独检查，不影响结论；
     * 可能不成立的条件作为 caveat 记录。
     * @return 求解耗时（毫秒）。
     */
    private double checkSafety(Z3Oracle oracle, List<Term> assumptions, List<Term> safety, int timeoutMs,
                               List<String> caveats) {
        Map<String, Term> watched = new LinkedHashMap<>();
        for (Term obligation : safety) {
            watched.putIfAbsent(display(obligation), obligation);
        }
        OracleOutcome outcome = oracle.check(assumptions, Formulas.not(Formulas.and(safety)), timeoutMs, watched);
        switch (outcome.getResult()) {
            case SAT:
                outcome.getModelValues().forEach((shown, value) -> {
                    if (Boolean.FALSE.equals(value)) {
                        caveats.add("safety obligation may fail: " + shown);
                    }
                });
                break;
            case UNKNOWN:
                caveats.add("safety obligations not checked: solver returned unknown");
                break;
            default:
                break;
        }
        logger.debug("安全条件检查: {}", outcome.getResult());
        return outcome.getElapsedMs();
    }

    /**
     * 函数体引用到的外部名字中，可以转为数值或布尔常量的那些。闭包优先于模块级。
     */
    private Map<String, Term> resolveExternals(VerifiableFunction function, FunctionDef def, Set<String> params) {
        Map<String, Term> externals = new LinkedHashMap<>();
        for (String ref : ReferencedNames.of(def)) {
            if (params.contains(ref) || RESERVED_NAMES.contains(ref)) {
                continue;
            }
            Optional<Object> value = function.lookupExternal(ref);
            if (value.isEmpty()) {
                continue;
            }
            if (isScalar(value.get())) {
                externals.put(ref, Formulas.constant(value.get()));
            } else {
                logger.debug("外部名字 {} 不是数值或布尔值，忽略", ref);
            }
        }
        return externals;
    }

    private static boolean isScalar(Object value) {
        return value instanceof Boolean || value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte || value instanceof BigInteger
                || value instanceof BigDecimal || value instanceof Double || value instanceof Float
                || value instanceof Rational || value instanceof Term;
    }

    private String cacheKey(String source, ContractPredicate pre, ContractPredicate post, List<Term> paramVars,
                            Variable resultVar, Map<String, Contract> contracts,
                            Map<String, SortedSet<Integer>> callArities, Map<String, Term> externals,
                            Map<String, TypeAnnotation> annotations, TypeAnnotation returnType) {
        List<Term> postArgs = new ArrayList<>(paramVars);
        postArgs.add(resultVar);
        Map<String, String> contractPrints = new LinkedHashMap<>();
        contracts.forEach((callee, contract) -> contractPrints.put(callee,
                contract.fingerprint(callArities.getOrDefault(callee, Collections.emptySortedSet()))));
        Map<String, String> externalPrints = new LinkedHashMap<>();
        externals.forEach((ref, term) -> externalPrints.put(ref, term.getSort() + ":" + term));
        List<String> annotationPrints = new ArrayList<>();
        annotations.forEach((param, type) -> annotationPrints.add(param + ":" + type));
        return CacheKeys.newKey()
                .part("source", source)
                .part("pre", fingerprint(pre, paramVars))
                .part("post", fingerprint(post, postArgs))
                .parts("contract", contractPrints)
                .parts("external", externalPrints)
                .parts("annotation", annotationPrints)
                .part("returns", returnType == null ? "-" : returnType.toString())
                .part("max-unroll", context.getMaxUnroll())
                .build();
    }

    /**
     * 谓词的结构指纹：作用于带类型的参数变量后的渲染结果。
     * 值相同但分别创建的闭包得到相同指纹。
     */
    static String fingerprint(ContractPredicate predicate, List<Term> args) {
        if (predicate == null) {
            return "-";
        }
        if (!predicate.isVariadic() && predicate.arity() != args.size()) {
            return "arity:" + predicate.arity();
        }
        try {
            return String.valueOf(predicate.apply(args));
        } catch (RuntimeException e) {
            return "error:" + e.getClass().getName() + ":" + e.getMessage();
        }
    }

    private PredicateOutcome applyPredicate(ContractPredicate predicate, List<Term> args, String what) {
        Term formula;
        try {
            formula = predicate.apply(args);
        } catch (RuntimeException e) {
            logger.debug("{} 求值失败", what, e);
            return PredicateOutcome.failure(what + " error: " + e.getMessage());
        }
        if (formula == null) {
            return PredicateOutcome.failure(what + " returned null, expected a formula");
        }
        if (!formula.isFormula()) {
            return PredicateOutcome.failure(what + " returned a term of sort " + formula.getSort()
                    + ", expected a formula. Build predicates with the Formulas combinators");
        }
        return PredicateOutcome.success(formula);
    }

    private String displayOnResult(ContractPredicate post, List<Term> paramVars, Variable resultVar, Term applied) {
        List<Term> args = new ArrayList<>(paramVars);
        args.add(resultVar);
        try {
            Term onResult = post.apply(args);
            if (onResult != null) {
                return display(onResult);
            }
        } catch (RuntimeException e) {
            logger.debug("后置条件无法作用于占位变量 {}，改为展示实际公式", RESULT_NAME, e);
        }
        return display(applied);
    }

    private static String display(Term term) {
        return term.render(DISPLAY_LIMIT);
    }

    private static ProofCertificate error(String name, String sourceHash, String message) {
        logger.info("{} 翻译失败: {}", name, message);
        return ProofCertificate.builder(name, Status.TRANSLATION_ERROR)
                .sourceHash(sourceHash)
                .message(message)
                .build();
    }

    private static ProofCertificate skipped(String name, String sourceHash, String message) {
        return ProofCertificate.builder(name, Status.SKIPPED)
                .sourceHash(sourceHash)
                .message(message)
                .build();
    }

    /**
     * 谓词求值的结果：公式，或者错误消息。
     */
    private static final class PredicateOutcome {
        final Term formula;
        final String error;

        private PredicateOutcome(Term formula, String error) {
            this.formula = formula;
            this.error = error;
        }

        static PredicateOutcome success(Term formula) {
            return new PredicateOutcome(formula, null);
        }

        static PredicateOutcome failure(String error) {
            return new PredicateOutcome(null, error);
        }

        boolean isFailure() {
            return error != null;
        }
    }
}
