package org.symproof.lang.ast;

import lombok.Getter;

/**
 * 可以解析但不可翻译的语句：try、with、class、raise、break、continue、del、
 * import、global、nonlocal、嵌套 def 等。keyword 为引导该语句的关键字。
 */
@Getter
public final class UnsupportedStmt extends Stmt {

    private final String keyword;

    public UnsupportedStmt(String keyword, int line) {
        super(line);
        this.keyword = keyword;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitUnsupported(this, context);
    }
}
