package org.symproof.expressions.terms;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import lombok.Getter;
import org.symproof.expressions.FunctionSymbol;
import org.symproof.symbolic.Z3VariableManager;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 未解释函数的应用 f(args)。
 */
@Getter
public final class Application extends Term {

    private final FunctionSymbol symbol;
    private final List<Term> arguments;

    private Application(FunctionSymbol symbol, List<Term> arguments) {
        super(symbol.getRange(), Objects.hash("Application", symbol, arguments));
        this.symbol = symbol;
        this.arguments = arguments;
    }

    public static Application of(FunctionSymbol symbol, List<Term> arguments) {
        Objects.requireNonNull(symbol, "Function symbol cannot be null");
        List<Term> copy = List.copyOf(arguments);
        if (copy.size() != symbol.arity()) {
            throw new IllegalArgumentException(symbol.getName() + " expects " + symbol.arity()
                    + " arguments, got " + copy.size());
        }
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i).getSort() != symbol.getDomain().get(i)) {
                throw new IllegalArgumentException(symbol.getName() + " argument " + i + " must be "
                        + symbol.getDomain().get(i) + ", got " + copy.get(i).getSort());
            }
        }
        return new Application(symbol, copy);
    }

    @Override
    public List<Term> children() {
        return arguments;
    }

    @Override
    protected boolean isAtomic() {
        return true;
    }

    @Override
    public Expr<?> toZ3Expr(Context ctx, Z3VariableManager varManager) {
        FuncDecl decl = varManager.getZ3Function(symbol);
        Expr[] args = new Expr[arguments.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = varManager.encode(arguments.get(i));
        }
        return ctx.mkApp(decl, args);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Application that)) {
            return false;
        }
        return hashCode() == that.hashCode() && symbol.equals(that.symbol) && arguments.equals(that.arguments);
    }

    @Override
    public String toString() {
        return arguments.stream().map(Term::toString)
                .collect(Collectors.joining(", ", symbol.getName() + "(", ")"));
    }
}
