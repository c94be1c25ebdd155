package org.symproof.lang.ast;

import lombok.Getter;

/**
 * return 语句。value 为 null 表示裸 return。
 */
@Getter
public final class Return extends Stmt {

    private final Expr value;

    public Return(Expr value, int line) {
        super(line);
        this.value = value;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitReturn(this, context);
    }
}
