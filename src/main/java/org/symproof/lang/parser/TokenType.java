package org.symproof.lang.parser;

public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF
}
