package org.symproof.lang.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 基于缩进的词法分析器。括号内不产生 NEWLINE/INDENT/DEDENT，
 * 行尾反斜杠续行，注释和空行被忽略。
 */
public final class Lexer {

    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    };

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int pos;
    private int line = 1;
    private int depth;
    private boolean atLineStart = true;

    private Lexer(String src) {
        this.src = src;
        this.indents.push(0);
    }

    public static List<Token> tokenize(String source) {
        Lexer lexer = new Lexer(source);
        lexer.run();
        logger.debug("词法分析完成，共 {} 个 token", lexer.tokens.size());
        return lexer.tokens;
    }

    private void run() {
        while (pos < src.length()) {
            if (atLineStart && depth == 0) {
                if (!readIndentation()) {
                    continue;
                }
            }
            char c = src.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\' && pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
                pos += 2;
                line++;
            } else if (c == '\n') {
                if (depth == 0) {
                    add(TokenType.NEWLINE, "\n");
                    atLineStart = true;
                }
                pos++;
                line++;
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))) {
                readNumber();
            } else if (c == '"' || c == '\'') {
                readString(0);
            } else if (Character.isLetter(c) || c == '_') {
                readName();
            } else {
                readOperator();
            }
        }
        if (!atLineStart) {
            add(TokenType.NEWLINE, "\n");
        }
        while (indents.peek() > 0) {
            indents.pop();
            add(TokenType.DEDENT, "");
        }
        add(TokenType.EOF, "");
    }

    /**
     * 处理逻辑行开头的缩进。空行或纯注释行返回 false 并跳过整行。
     */
    private boolean readIndentation() {
        int width = 0;
        int p = pos;
        while (p < src.length() && (src.charAt(p) == ' ' || src.charAt(p) == '\t' || src.charAt(p) == '\f')) {
            width = src.charAt(p) == '\t' ? (width / 8 + 1) * 8 : width + 1;
            p++;
        }
        if (p >= src.length() || src.charAt(p) == '\n' || src.charAt(p) == '#') {
            pos = p;
            if (pos < src.length() && src.charAt(pos) == '#') {
                skipComment();
            }
            if (pos < src.length()) {
                pos++;
                line++;
            }
            return false;
        }
        pos = p;
        atLineStart = false;
        if (width > indents.peek()) {
            indents.push(width);
            add(TokenType.INDENT, "");
        } else {
            while (width < indents.peek()) {
                indents.pop();
                add(TokenType.DEDENT, "");
            }
            if (width != indents.peek()) {
                throw new SourceSyntaxException("Inconsistent dedent", line);
            }
        }
        return true;
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void readNumber() {
        int start = pos;
        if (src.charAt(pos) == '0' && pos + 1 < src.length() && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            digits();
            if (pos < src.length() && src.charAt(pos) == '.') {
                pos++;
                digits();
            }
            if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                    digits();
                } else {
                    pos = mark;
                }
            }
            if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) {
                pos++;
            }
        }
        add(TokenType.NUMBER, src.substring(start, pos));
    }

    private void digits() {
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void readName() {
        int start = pos;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        String word = src.substring(start, pos);
        if (pos < src.length() && (src.charAt(pos) == '"' || src.charAt(pos) == '\'') && isStringPrefix(word)) {
            readString(word.length());
            return;
        }
        add(TokenType.NAME, word);
    }

    private static boolean isStringPrefix(String word) {
        if (word.length() > 2) {
            return false;
        }
        for (char ch : word.toLowerCase().toCharArray()) {
            if ("rbuf".indexOf(ch) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * 读取字符串字面量。prefixLength 为已经读过的前缀长度。
     */
    private void readString(int prefixLength) {
        boolean raw = src.substring(pos - prefixLength, pos).toLowerCase().contains("r");
        int startLine = line;
        char quote = src.charAt(pos);
        boolean triple = src.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= src.length()) {
                throw new SourceSyntaxException("Unterminated string literal", startLine);
            }
            char c = src.charAt(pos);
            if (triple && src.startsWith(String.valueOf(quote).repeat(3), pos)) {
                pos += 3;
                break;
            }
            if (!triple && c == quote) {
                pos++;
                break;
            }
            if (!triple && c == '\n') {
                throw new SourceSyntaxException("Unterminated string literal", startLine);
            }
            if (c == '\\' && pos + 1 < src.length()) {
                char next = src.charAt(pos + 1);
                if (next == '\n') {
                    line++;
                    if (raw) {
                        value.append(c).append(next);
                    }
                } else if (raw) {
                    value.append(c).append(next);
                } else {
                    value.append(unescape(next));
                }
                pos += 2;
                continue;
            }
            if (c == '\n') {
                line++;
            }
            value.append(c);
            pos++;
        }
        tokens.add(new Token(TokenType.STRING, value.toString(), startLine));
    }

    private static String unescape(char c) {
        return switch (c) {
            case 'n' -> "\n";
            case 't' -> "\t";
            case 'r' -> "\r";
            case '0' -> "\0";
            case '\\' -> "\\";
            case '\'' -> "'";
            case '"' -> "\"";
            default -> "\\" + c;
        };
    }

    private void readOperator() {
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                switch (op) {
                    case "(", "[", "{" -> depth++;
                    case ")", "]", "}" -> depth = Math.max(0, depth - 1);
                    default -> {
                    }
                }
                add(TokenType.OP, op);
                pos += op.length();
                return;
            }
        }
        throw new SourceSyntaxException("Unexpected character '" + src.charAt(pos) + "'", line);
    }

    private void add(TokenType type, String text) {
        tokens.add(new Token(type, text, line));
    }
}
