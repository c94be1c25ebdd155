package org.symproof.lang.ast;

/**
 * 语法树节点的公共部分：1 起始的源码行号。
 */
public abstract class Node {

    private final int line;

    protected Node(int line) {
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
