package org.symproof.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symproof.contract.ContractPredicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.symproof.expressions.Formulas.abs;
import static org.symproof.expressions.Formulas.add;
import static org.symproof.expressions.Formulas.and;
import static org.symproof.expressions.Formulas.eq;
import static org.symproof.expressions.Formulas.ge;
import static org.symproof.expressions.Formulas.implies;
import static org.symproof.expressions.Formulas.le;
import static org.symproof.expressions.Formulas.lt;
import static org.symproof.expressions.Formulas.mul;
import static org.symproof.expressions.Formulas.neg;
import static org.symproof.expressions.Formulas.or;

/**
 * 验证器对自身内建编码的证明：min、max、abs、clamp、relu、整除与取模的界、
 * 恒等、双重取负、while 倒计数、平方、海象运算符与 float 转换。
 * 每个条目是一段受限子集的源码加上前置/后置条件，全部应当得到 VERIFIED。
 */
public final class SelfProofs {

    private static final Logger logger = LoggerFactory.getLogger(SelfProofs.class);

    private static final List<Entry> ENTRIES = List.of(
            new Entry("def builtin_min(a: float, b: float) -> float:\n"
                    + "    return min(a, b)\n",
                    null,
                    ContractPredicate.of((a, b, r) -> and(le(r, a), le(r, b), or(eq(r, a), eq(r, b))))),
            new Entry("def builtin_max(a: float, b: float) -> float:\n"
                    + "    return max(a, b)\n",
                    null,
                    ContractPredicate.of((a, b, r) -> and(ge(r, a), ge(r, b), or(eq(r, a), eq(r, b))))),
            new Entry("def builtin_abs(x: float) -> float:\n"
                    + "    return abs(x)\n",
                    null,
                    ContractPredicate.of((x, r) -> and(ge(r, 0), or(eq(r, x), eq(r, neg(x)))))),
            new Entry("def clamp(val: float, lo: float, hi: float) -> float:\n"
                    + "    if val < lo:\n"
                    + "        return lo\n"
                    + "    elif val > hi:\n"
                    + "        return hi\n"
                    + "    else:\n"
                    + "        return val\n",
                    ContractPredicate.of((v, lo, hi) -> le(lo, hi)),
                    ContractPredicate.of((v, lo, hi, r) -> and(le(lo, r), le(r, hi)))),
            new Entry("def relu(x: float) -> float:\n"
                    + "    if x > 0:\n"
                    + "        return x\n"
                    + "    return 0.0\n",
                    null,
                    ContractPredicate.of((x, r) -> and(ge(r, 0), ge(r, x)))),
            new Entry("def bounded_increment(x: int, limit: int) -> int:\n"
                    + "    if x < limit:\n"
                    + "        return x + 1\n"
                    + "    return limit\n",
                    ContractPredicate.of((x, limit) -> le(x, limit)),
                    ContractPredicate.of((x, limit, r) -> and(le(r, limit), ge(r, x)))),
            new Entry("def floor_div_bounds(a: int) -> int:\n"
                    + "    return a // 4\n",
                    null,
                    ContractPredicate.of((a, r) -> and(le(mul(r, 4), a), lt(a, add(mul(r, 4), 4))))),
            new Entry("def mod_bounds(a: int) -> int:\n"
                    + "    return a % 5\n",
                    null,
                    ContractPredicate.of((a, r) -> and(ge(r, 0), lt(r, 5)))),
            new Entry("def safe_divide(a: float, b: float) -> float:\n"
                    + "    if b == 0:\n"
                    + "        return 0.0\n"
                    + "    return a / b\n",
                    null,
                    ContractPredicate.of((a, b, r) -> implies(eq(b, 0), eq(r, 0)))),
            new Entry("def identity(x: float) -> float:\n"
                    + "    return x\n",
                    null,
                    ContractPredicate.of((x, r) -> eq(r, x))),
            new Entry("def negate_negate(x: float) -> float:\n"
                    + "    return -(-x)\n",
                    null,
                    ContractPredicate.of((x, r) -> eq(r, x))),
            new Entry("def max_of_abs(a: float, b: float) -> float:\n"
                    + "    return max(abs(a), abs(b))\n",
                    null,
                    ContractPredicate.of((a, b, r) -> and(ge(r, 0), ge(r, abs(a)), ge(r, abs(b))))),
            new Entry("def countdown(n: int) -> int:\n"
                    + "    while n > 0:\n"
                    + "        n = n - 1\n"
                    + "    return n\n",
                    ContractPredicate.of(n -> and(ge(n, 0), le(n, 10))),
                    ContractPredicate.of((n, r) -> eq(r, 0))),
            new Entry("def square(x: float) -> float:\n"
                    + "    return x ** 2\n",
                    null,
                    ContractPredicate.of((x, r) -> ge(r, 0))),
            new Entry("def walrus_abs(x: int) -> int:\n"
                    + "    if (y := x) < 0:\n"
                    + "        return -y\n"
                    + "    return y\n",
                    null,
                    ContractPredicate.of((x, r) -> and(ge(r, 0), or(eq(r, x), eq(r, neg(x)))))),
            new Entry("def to_float(n: int) -> float:\n"
                    + "    return float(n)\n",
                    null,
                    ContractPredicate.of((n, r) -> eq(r, n))));

    private SelfProofs() {
    }

    /**
     * 全部自证函数的源码，按定义顺序。
     */
    public static List<VerifiableFunction> functions() {
        List<VerifiableFunction> functions = new ArrayList<>();
        for (Entry entry : ENTRIES) {
            functions.add(entry.function());
        }
        return Collections.unmodifiableList(functions);
    }

    /**
     * 依次验证每个条目，返回函数名到证书的映射。
     */
    public static Map<String, ProofCertificate> verifyAll(VerificationEngine engine) {
        Map<String, ProofCertificate> certificates = new LinkedHashMap<>();
        for (Entry entry : ENTRIES) {
            VerifiableFunction function = entry.function();
            ProofCertificate certificate = engine.verify(function, entry.pre, entry.post);
            if (!certificate.isVerified()) {
                logger.warn("自证失败: {}", certificate);
            }
            certificates.put(function.getName(), certificate);
        }
        logger.info("自证完成，共 {} 个，通过 {} 个", certificates.size(),
                certificates.values().stream().filter(ProofCertificate::isVerified).count());
        return certificates;
    }

    private static final class Entry {
        final String source;
        final ContractPredicate pre;
        final ContractPredicate post;

        Entry(String source, ContractPredicate pre, ContractPredicate post) {
            this.source = source;
            this.pre = pre;
            this.post = post;
        }

        VerifiableFunction function() {
            return VerifiableFunction.fromSource(source);
        }
    }
}
