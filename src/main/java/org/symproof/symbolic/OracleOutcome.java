package org.symproof.symbolic;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 一次可满足性检查的结果：三值判定、SAT 时被关注项的取值、UNKNOWN 时的原因和耗时。
 */
@Getter
public final class OracleOutcome {

    public enum Result {
        SAT,
        UNSAT,
        UNKNOWN
    }

    private final Result result;
    private final Map<String, Object> modelValues;
    private final String reasonUnknown;
    private final double elapsedMs;

    private OracleOutcome(Result result, Map<String, Object> modelValues, String reasonUnknown, double elapsedMs) {
        this.result = result;
        this.modelValues = Collections.unmodifiableMap(new LinkedHashMap<>(modelValues));
        this.reasonUnknown = reasonUnknown;
        this.elapsedMs = elapsedMs;
    }

    public static OracleOutcome sat(Map<String, Object> modelValues, double elapsedMs) {
        return new OracleOutcome(Result.SAT, Objects.requireNonNull(modelValues), null, elapsedMs);
    }

    public static OracleOutcome unsat(double elapsedMs) {
        return new OracleOutcome(Result.UNSAT, Map.of(), null, elapsedMs);
    }

    public static OracleOutcome unknown(String reason, double elapsedMs) {
        return new OracleOutcome(Result.UNKNOWN, Map.of(), reason, elapsedMs);
    }

    @Override
    public String toString() {
        return result + (result == Result.SAT ? " " + modelValues : "")
                + (reasonUnknown != null ? " (" + reasonUnknown + ")" : "");
    }
}
