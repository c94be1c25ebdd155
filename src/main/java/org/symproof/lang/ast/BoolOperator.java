package org.symproof.lang.ast;

public enum BoolOperator {
    AND,
    OR
}
