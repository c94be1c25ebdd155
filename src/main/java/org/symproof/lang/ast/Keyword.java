package org.symproof.lang.ast;

import lombok.Getter;

/**
 * 调用中的关键字实参。name 为 null 表示 **kwargs 展开。
 */
@Getter
public final class Keyword {

    private final String name;
    private final Expr value;

    public Keyword(String name, Expr value) {
        this.name = name;
        this.value = value;
    }

    @Override
    public String toString() {
        return name == null ? "**" + value : name + "=" + value;
    }
}
