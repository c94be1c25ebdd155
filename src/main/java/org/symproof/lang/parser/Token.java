package org.symproof.lang.parser;

import lombok.Getter;

@Getter
public final class Token {

    private final TokenType type;
    private final String text;
    private final int line;

    public Token(TokenType type, String text, int line) {
        this.type = type;
        this.text = text;
        this.line = line;
    }

    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isOp(String op) {
        return is(TokenType.OP, op);
    }

    public boolean isName(String name) {
        return is(TokenType.NAME, name);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case EOF -> "end of input";
            default -> "'" + text + "'";
        };
    }
}
