package org.symproof.translate;

/**
 * 源码使用了无法翻译的构造、未定义的名字、不合法的循环界等。
 * line 为 1 起始的源码行号，未知时为 0。
 */
public class TranslationException extends RuntimeException {

    private final int line;

    public TranslationException(String message) {
        this(message, 0);
    }

    public TranslationException(String message, int line) {
        super(message);
        this.line = line;
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
    }

    public int getLine() {
        return line;
    }

    public boolean hasLine() {
        return line > 0;
    }

    /**
     * 带行号的消息；行号已知时追加 "(line N)"。
     */
    public String describe() {
        return hasLine() ? getMessage() + " (line " + line + ")" : getMessage();
    }
}
