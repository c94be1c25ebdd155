package org.symproof.translate;

import org.symproof.lang.ast.AnnAssign;
import org.symproof.lang.ast.Assert;
import org.symproof.lang.ast.Assign;
import org.symproof.lang.ast.AugAssign;
import org.symproof.lang.ast.ExprStmt;
import org.symproof.lang.ast.For;
import org.symproof.lang.ast.If;
import org.symproof.lang.ast.Pass;
import org.symproof.lang.ast.Return;
import org.symproof.lang.ast.Stmt;
import org.symproof.lang.ast.StmtVisitor;
import org.symproof.lang.ast.UnsupportedStmt;
import org.symproof.lang.ast.While;

import java.util.List;

/**
 * 判断语句列表中（含嵌套块）是否出现 return。
 * 不含 return 的 if 不需要 continuation，直接合并环境即可。
 */
final class ReturnFinder implements StmtVisitor<Boolean, Void> {

    private static final ReturnFinder INSTANCE = new ReturnFinder();

    private ReturnFinder() {
    }

    static boolean containsReturn(List<Stmt> stmts) {
        for (Stmt stmt : stmts) {
            if (stmt.accept(INSTANCE, null)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Boolean visitReturn(Return stmt, Void context) {
        return true;
    }

    @Override
    public Boolean visitAssign(Assign stmt, Void context) {
        return false;
    }

    @Override
    public Boolean visitAnnAssign(AnnAssign stmt, Void context) {
        return false;
    }

    @Override
    public Boolean visitAugAssign(AugAssign stmt, Void context) {
        return false;
    }

    @Override
    public Boolean visitIf(If stmt, Void context) {
        return containsReturn(stmt.getBody()) || containsReturn(stmt.getOrelse());
    }

    @Override
    public Boolean visitFor(For stmt, Void context) {
        return containsReturn(stmt.getBody()) || containsReturn(stmt.getOrelse());
    }

    @Override
    public Boolean visitWhile(While stmt, Void context) {
        return containsReturn(stmt.getBody()) || containsReturn(stmt.getOrelse());
    }

    @Override
    public Boolean visitAssert(Assert stmt, Void context) {
        return false;
    }

    @Override
    public Boolean visitPass(Pass stmt, Void context) {
        return false;
    }

    @Override
    public Boolean visitExprStmt(ExprStmt stmt, Void context) {
        return false;
    }

    @Override
    public Boolean visitUnsupported(UnsupportedStmt stmt, Void context) {
        // 让 continuation 路径去报告它
        return true;
    }
}
