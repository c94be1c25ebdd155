package org.symproof.lang.ast;

import lombok.Getter;

/**
 * 函数形参。annotation 与 defaultValue 可以为 null。
 */
@Getter
public final class Param {

    public enum Kind {
        POSITIONAL,
        VAR_POSITIONAL,
        VAR_KEYWORD
    }

    private final String name;
    private final Expr annotation;
    private final Expr defaultValue;
    private final Kind kind;

    public Param(String name, Expr annotation, Expr defaultValue, Kind kind) {
        this.name = name;
        this.annotation = annotation;
        this.defaultValue = defaultValue;
        this.kind = kind;
    }

    @Override
    public String toString() {
        String prefix = kind == Kind.VAR_POSITIONAL ? "*" : kind == Kind.VAR_KEYWORD ? "**" : "";
        return prefix + name + (annotation != null ? ": " + annotation : "");
    }
}
