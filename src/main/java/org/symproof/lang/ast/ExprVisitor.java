package org.symproof.lang.ast;

public interface ExprVisitor<R> {

    R visitNumber(NumberLiteral expr);

    R visitString(StringLiteral expr);

    R visitName(Name expr);

    R visitBinary(BinaryOp expr);

    R visitUnary(UnaryOp expr);

    R visitBoolOp(BoolOp expr);

    R visitCompare(Compare expr);

    R visitIfExp(IfExp expr);

    R visitCall(Call expr);

    R visitAttribute(Attribute expr);

    R visitSubscript(Subscript expr);

    R visitTuple(TupleExpr expr);

    R visitStarred(Starred expr);

    R visitNamedExpr(NamedExpr expr);

    R visitUnsupported(UnsupportedExpr expr);
}
