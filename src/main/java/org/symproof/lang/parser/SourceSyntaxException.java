package org.symproof.lang.parser;

import lombok.Getter;

/**
 * 源码不在可解析子集内时抛出，携带 1 起始的行号。
 */
@Getter
public class SourceSyntaxException extends RuntimeException {

    private final int line;

    public SourceSyntaxException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }
}
