package org.symproof.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.symproof.core.Counterexample;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * 一次验证的不可变结果记录，可以通过 Jackson 与 JSON 互相转换。
 */
public final class ProofCertificate {

    private static final String PROP_FUNCTION_NAME = "function_name";
    private static final String PROP_SOURCE_HASH = "source_hash";
    private static final String PROP_STATUS = "status";
    private static final String PROP_PRECONDITIONS = "preconditions";
    private static final String PROP_POSTCONDITIONS = "postconditions";
    private static final String PROP_COUNTEREXAMPLE = "counterexample";
    private static final String PROP_MESSAGE = "message";
    private static final String PROP_SOLVER_TIME_MS = "solver_time_ms";
    private static final String PROP_SOLVER_VERSION = "solver_version";
    private static final String PROP_CAVEATS = "caveats";

    private final String functionName;
    private final String sourceHash;
    private final Status status;
    private final List<String> preconditions;
    private final List<String> postconditions;
    private final Counterexample counterexample;
    private final String message;
    private final double solverTimeMs;
    private final String solverVersion;
    private final List<String> caveats;

    @JsonCreator
    public ProofCertificate(
            @JsonProperty(PROP_FUNCTION_NAME) String functionName,
            @JsonProperty(PROP_SOURCE_HASH) String sourceHash,
            @JsonProperty(PROP_STATUS) Status status,
            @JsonProperty(PROP_PRECONDITIONS) List<String> preconditions,
            @JsonProperty(PROP_POSTCONDITIONS) List<String> postconditions,
            @JsonProperty(PROP_COUNTEREXAMPLE) Counterexample counterexample,
            @JsonProperty(PROP_MESSAGE) String message,
            @JsonProperty(PROP_SOLVER_TIME_MS) double solverTimeMs,
            @JsonProperty(PROP_SOLVER_VERSION) String solverVersion,
            @JsonProperty(PROP_CAVEATS) List<String> caveats) {
        this.functionName = Objects.requireNonNull(functionName, "Function name cannot be null");
        this.sourceHash = sourceHash == null ? "" : sourceHash;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
        this.postconditions = postconditions == null ? List.of() : List.copyOf(postconditions);
        this.counterexample = counterexample;
        this.message = message == null ? "" : message;
        this.solverTimeMs = solverTimeMs;
        this.solverVersion = solverVersion == null ? "" : solverVersion;
        this.caveats = caveats == null ? List.of() : List.copyOf(caveats);
    }

    public static Builder builder(String functionName, Status status) {
        return new Builder(functionName, status);
    }

    @JsonProperty(PROP_FUNCTION_NAME)
    public String getFunctionName() {
        return functionName;
    }

    @JsonProperty(PROP_SOURCE_HASH)
    public String getSourceHash() {
        return sourceHash;
    }

    @JsonProperty(PROP_STATUS)
    public Status getStatus() {
        return status;
    }

    @JsonProperty(PROP_PRECONDITIONS)
    public List<String> getPreconditions() {
        return preconditions;
    }

    @JsonProperty(PROP_POSTCONDITIONS)
    public List<String> getPostconditions() {
        return postconditions;
    }

    @JsonProperty(PROP_COUNTEREXAMPLE)
    public Counterexample getCounterexample() {
        return counterexample;
    }

    @JsonProperty(PROP_MESSAGE)
    public String getMessage() {
        return message;
    }

    @JsonProperty(PROP_SOLVER_TIME_MS)
    public double getSolverTimeMs() {
        return solverTimeMs;
    }

    @JsonProperty(PROP_SOLVER_VERSION)
    public String getSolverVersion() {
        return solverVersion;
    }

    @JsonProperty(PROP_CAVEATS)
    public List<String> getCaveats() {
        return caveats;
    }

    @JsonIgnore
    public boolean isVerified() {
        return status == Status.VERIFIED;
    }

    private String tag() {
        return switch (status) {
            case VERIFIED -> "Q.E.D.";
            case COUNTEREXAMPLE -> "DISPROVED";
            case UNKNOWN -> "?";
            default -> status.name();
        };
    }

    /**
     * 多行的人类可读说明：结论、反例及其对应的调用、被违反的后置条件、附注。
     */
    public String explain() {
        List<String> lines = new ArrayList<>();
        lines.add((isVerified() ? "Q.E.D." : status.name()) + ": " + functionName);
        if (counterexample != null) {
            Map<String, Object> arguments = counterexample.getArguments();
            lines.add("  Counterexample: " + Counterexample.render(arguments));
            if (counterexample.hasReturnValue()) {
                StringJoiner call = new StringJoiner(", ", functionName + "(", ")");
                arguments.forEach((name, value) -> call.add(name + "=" + Counterexample.renderScalar(value)));
                lines.add("  " + call + " = " + Counterexample.renderScalar(counterexample.getReturnValue()));
            }
            for (String post : postconditions) {
                lines.add("  Postcondition: " + post);
            }
        }
        if (!message.isEmpty() && status != Status.COUNTEREXAMPLE) {
            lines.add("  " + message);
        }
        for (String caveat : caveats) {
            lines.add("  Caveat: " + caveat);
        }
        return String.join("\n", lines);
    }

    /**
     * 单段文本，用于放进修复循环的提示词。
     */
    public String toPrompt() {
        if (isVerified()) {
            String prompt = "Function `" + functionName + "` VERIFIED. "
                    + "All inputs satisfying preconditions produce valid outputs.";
            return caveats.isEmpty() ? prompt : prompt + " Caveats: " + String.join("; ", caveats) + ".";
        }
        if (status == Status.COUNTEREXAMPLE && counterexample != null) {
            List<String> parts = new ArrayList<>();
            parts.add("Function `" + functionName + "` DISPROVED.");
            parts.add("Counterexample: " + Counterexample.render(counterexample.getArguments())
                    + (counterexample.hasReturnValue()
                    ? " -> result=" + Counterexample.renderScalar(counterexample.getReturnValue())
                    : " -> no return"));
            if (!postconditions.isEmpty()) {
                parts.add("Violated: " + postconditions.get(0));
            }
            parts.add("Fix the implementation or strengthen the precondition.");
            return String.join(" ", parts);
        }
        return "Function `" + functionName + "`: " + status.getValue() + ". " + message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProofCertificate that)) {
            return false;
        }
        return Double.compare(solverTimeMs, that.solverTimeMs) == 0
                && functionName.equals(that.functionName)
                && sourceHash.equals(that.sourceHash)
                && status == that.status
                && preconditions.equals(that.preconditions)
                && postconditions.equals(that.postconditions)
                && Objects.equals(counterexample, that.counterexample)
                && message.equals(that.message)
                && solverVersion.equals(that.solverVersion)
                && caveats.equals(that.caveats);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, sourceHash, status, preconditions, postconditions,
                counterexample, message, solverTimeMs, solverVersion, caveats);
    }

    @Override
    public String toString() {
        String out = "[" + tag() + "] " + functionName;
        if (!message.isEmpty()) {
            out += " (" + message + ")";
        }
        return out;
    }

    public static final class Builder {

        private final String functionName;
        private final Status status;
        private String sourceHash = "";
        private List<String> preconditions = List.of();
        private List<String> postconditions = List.of();
        private Counterexample counterexample;
        private String message = "";
        private double solverTimeMs;
        private String solverVersion = "";
        private List<String> caveats = List.of();

        private Builder(String functionName, Status status) {
            this.functionName = functionName;
            this.status = status;
        }

        public Builder sourceHash(String sourceHash) {
            this.sourceHash = sourceHash;
            return this;
        }

        public Builder preconditions(List<String> preconditions) {
            this.preconditions = preconditions;
            return this;
        }

        public Builder postconditions(List<String> postconditions) {
            this.postconditions = postconditions;
            return this;
        }

        public Builder counterexample(Counterexample counterexample) {
            this.counterexample = counterexample;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder solverTimeMs(double solverTimeMs) {
            this.solverTimeMs = solverTimeMs;
            return this;
        }

        public Builder solverVersion(String solverVersion) {
            this.solverVersion = solverVersion;
            return this;
        }

        public Builder caveats(List<String> caveats) {
            this.caveats = caveats;
            return this;
        }

        public ProofCertificate build() {
            return new ProofCertificate(functionName, sourceHash, status, preconditions, postconditions,
                    counterexample, message, solverTimeMs, solverVersion, caveats);
        }
    }
}
