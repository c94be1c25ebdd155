package org.symproof.lang.ast;

import lombok.Getter;

import java.util.List;

/**
 * 一个函数定义：名字、形参、返回注解、函数体。
 */
@Getter
public final class FunctionDef extends Node {

    private final String name;
    private final List<Param> params;
    private final Expr returns;
    private final List<Stmt> body;
    private final boolean async;

    public FunctionDef(String name, List<Param> params, Expr returns, List<Stmt> body, boolean async, int line) {
        super(line);
        this.name = name;
        this.params = List.copyOf(params);
        this.returns = returns;
        this.body = List.copyOf(body);
        this.async = async;
    }

    @Override
    public String toString() {
        return (async ? "async def " : "def ") + name + params;
    }
}
