package org.symproof.lang.ast;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 收集函数体中读取或绑定的所有标识符，按首次出现的顺序；
 * 同时记录以名字直接调用的函数在各调用点的位置实参个数。
 */
public final class ReferencedNames implements ExprVisitor<Void>, StmtVisitor<Void, Void> {

    private final Set<String> names = new LinkedHashSet<>();
    private final Map<String, SortedSet<Integer>> callArities = new TreeMap<>();

    private ReferencedNames() {
    }

    private static ReferencedNames collect(FunctionDef function) {
        ReferencedNames collector = new ReferencedNames();
        collector.statements(function.getBody());
        return collector;
    }

    public static Set<String> of(FunctionDef function) {
        return collect(function).names;
    }

    /**
     * 被调用函数名到其调用点实参个数（升序）的映射。
     */
    public static Map<String, SortedSet<Integer>> callArities(FunctionDef function) {
        return collect(function).callArities;
    }

    private void statements(List<Stmt> stmts) {
        for (Stmt stmt : stmts) {
            stmt.accept(this, null);
        }
    }

    private void expr(Expr expr) {
        if (expr != null) {
            expr.accept(this);
        }
    }

    private void exprs(List<Expr> exprs) {
        exprs.forEach(this::expr);
    }

    @Override
    public Void visitNumber(NumberLiteral expr) {
        return null;
    }

    @Override
    public Void visitString(StringLiteral expr) {
        return null;
    }

    @Override
    public Void visitName(Name expr) {
        names.add(expr.getId());
        return null;
    }

    @Override
    public Void visitBinary(BinaryOp expr) {
        expr(expr.getLeft());
        expr(expr.getRight());
        return null;
    }

    @Override
    public Void visitUnary(UnaryOp expr) {
        expr(expr.getOperand());
        return null;
    }

    @Override
    public Void visitBoolOp(BoolOp expr) {
        exprs(expr.getValues());
        return null;
    }

    @Override
    public Void visitCompare(Compare expr) {
        expr(expr.getLeft());
        exprs(expr.getComparators());
        return null;
    }

    @Override
    public Void visitIfExp(IfExp expr) {
        expr(expr.getTest());
        expr(expr.getBody());
        expr(expr.getOrelse());
        return null;
    }

    @Override
    public Void visitCall(Call expr) {
        if (expr.getFunction() instanceof Name callee) {
            callArities.computeIfAbsent(callee.getId(), k -> new TreeSet<>()).add(expr.getArguments().size());
        }
        expr(expr.getFunction());
        exprs(expr.getArguments());
        expr.getKeywords().forEach(k -> expr(k.getValue()));
        return null;
    }

    @Override
    public Void visitAttribute(Attribute expr) {
        expr(expr.getValue());
        return null;
    }

    @Override
    public Void visitSubscript(Subscript expr) {
        expr(expr.getValue());
        expr(expr.getIndex());
        return null;
    }

    @Override
    public Void visitTuple(TupleExpr expr) {
        exprs(expr.getElements());
        return null;
    }

    @Override
    public Void visitStarred(Starred expr) {
        expr(expr.getValue());
        return null;
    }

    @Override
    public Void visitNamedExpr(NamedExpr expr) {
        names.add(expr.getTarget());
        expr(expr.getValue());
        return null;
    }

    @Override
    public Void visitUnsupported(UnsupportedExpr expr) {
        return null;
    }

    @Override
    public Void visitReturn(Return stmt, Void context) {
        expr(stmt.getValue());
        return null;
    }

    @Override
    public Void visitAssign(Assign stmt, Void context) {
        exprs(stmt.getTargets());
        expr(stmt.getValue());
        return null;
    }

    @Override
    public Void visitAnnAssign(AnnAssign stmt, Void context) {
        expr(stmt.getTarget());
        expr(stmt.getValue());
        return null;
    }

    @Override
    public Void visitAugAssign(AugAssign stmt, Void context) {
        expr(stmt.getTarget());
        expr(stmt.getValue());
        return null;
    }

    @Override
    public Void visitIf(If stmt, Void context) {
        expr(stmt.getTest());
        statements(stmt.getBody());
        statements(stmt.getOrelse());
        return null;
    }

    @Override
    public Void visitFor(For stmt, Void context) {
        expr(stmt.getTarget());
        expr(stmt.getIterable());
        statements(stmt.getBody());
        statements(stmt.getOrelse());
        return null;
    }

    @Override
    public Void visitWhile(While stmt, Void context) {
        expr(stmt.getTest());
        statements(stmt.getBody());
        statements(stmt.getOrelse());
        return null;
    }

    @Override
    public Void visitAssert(Assert stmt, Void context) {
        expr(stmt.getTest());
        expr(stmt.getMessage());
        return null;
    }

    @Override
    public Void visitPass(Pass stmt, Void context) {
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt stmt, Void context) {
        expr(stmt.getValue());
        return null;
    }

    @Override
    public Void visitUnsupported(UnsupportedStmt stmt, Void context) {
        return null;
    }
}
