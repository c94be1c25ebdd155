package org.symproof.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 验证结果状态。序列化为小写名称。
 */
public enum Status {

    VERIFIED("verified"),
    COUNTEREXAMPLE("counterexample"),
    UNKNOWN("unknown"),
    TRANSLATION_ERROR("translation_error"),
    SKIPPED("skipped");

    private final String value;

    Status(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Status fromValue(String value) {
        for (Status status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown status: " + value);
    }
}
