package org.symproof.lang.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symproof.lang.ast.AnnAssign;
import org.symproof.lang.ast.Assert;
import org.symproof.lang.ast.Assign;
import org.symproof.lang.ast.Attribute;
import org.symproof.lang.ast.AugAssign;
import org.symproof.lang.ast.BinaryOp;
import org.symproof.lang.ast.BinaryOperator;
import org.symproof.lang.ast.BoolOp;
import org.symproof.lang.ast.BoolOperator;
import org.symproof.lang.ast.Call;
import org.symproof.lang.ast.Compare;
import org.symproof.lang.ast.CompareOperator;
import org.symproof.lang.ast.Expr;
import org.symproof.lang.ast.ExprStmt;
import org.symproof.lang.ast.For;
import org.symproof.lang.ast.FunctionDef;
import org.symproof.lang.ast.If;
import org.symproof.lang.ast.IfExp;
import org.symproof.lang.ast.Keyword;
import org.symproof.lang.ast.Name;
import org.symproof.lang.ast.NamedExpr;
import org.symproof.lang.ast.NumberLiteral;
import org.symproof.lang.ast.Param;
import org.symproof.lang.ast.Pass;
import org.symproof.lang.ast.Return;
import org.symproof.lang.ast.Starred;
import org.symproof.lang.ast.Stmt;
import org.symproof.lang.ast.StringLiteral;
import org.symproof.lang.ast.Subscript;
import org.symproof.lang.ast.TupleExpr;
import org.symproof.lang.ast.UnaryOp;
import org.symproof.lang.ast.UnaryOperator;
import org.symproof.lang.ast.UnsupportedExpr;
import org.symproof.lang.ast.UnsupportedStmt;
import org.symproof.lang.ast.While;
import org.symproof.utils.Rational;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 递归下降语法分析器，输入为单个（可带装饰器的）函数定义。
 * 运算符优先级与结合性遵循 Python：条件表达式、or、and、not、比较链、|、^、&、移位、
 * 加减、乘除、一元运算、右结合的 **。
 * 子集外的复合语句同样被完整解析，但只留下 UnsupportedStmt 供翻译器报告。
 */
public final class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private static final Set<String> AUGMENTED = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", "@=", "&=", "|=", "^=", "<<=", ">>=");

    private static final Set<String> SIMPLE_UNSUPPORTED = Set.of(
            "raise", "del", "import", "from", "global", "nonlocal", "break", "continue");

    private static final Set<String> COMPOUND_UNSUPPORTED = Set.of("try", "with", "class", "def");

    private final List<Token> tokens;
    private int index;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * 解析一个函数定义。source 应已经过 {@link SourceText#canonicalize} 规范化。
     * @throws SourceSyntaxException 源码不可解析或不是单个函数定义。
     */
    public static FunctionDef parseFunction(String source) {
        Parser parser = new Parser(Lexer.tokenize(source));
        FunctionDef function = parser.functionDefinition();
        logger.debug("解析得到函数 {}，函数体 {} 条语句", function.getName(), function.getBody().size());
        return function;
    }

    // ========== 函数定义 ==========

    private FunctionDef functionDefinition() {
        skipNewlines();
        while (peek().isOp("@")) {
            skipToNewline();
            expect(TokenType.NEWLINE);
            skipNewlines();
        }
        boolean async = false;
        if (peek().isName("async")) {
            next();
            async = true;
        }
        Token def = peek();
        if (!def.isName("def")) {
            throw error("Expected a function definition", def);
        }
        next();
        String name = expect(TokenType.NAME).getText();
        expectOp("(");
        List<Param> params = parameters();
        expectOp(")");
        Expr returns = null;
        if (acceptOp("->")) {
            returns = test();
        }
        expectOp(":");
        List<Stmt> body = suite();
        skipNewlines();
        if (peek().getType() != TokenType.EOF) {
            throw error("Unexpected content after the function definition", peek());
        }
        return new FunctionDef(name, params, returns, body, async, def.getLine());
    }

    private List<Param> parameters() {
        List<Param> params = new ArrayList<>();
        while (!peek().isOp(")")) {
            if (acceptOp("/")) {
                // 仅位置参数的分隔符
            } else if (acceptOp("**")) {
                String name = expect(TokenType.NAME).getText();
                params.add(new Param(name, optionalAnnotation(), null, Param.Kind.VAR_KEYWORD));
            } else if (acceptOp("*")) {
                if (peek().getType() == TokenType.NAME) {
                    String name = next().getText();
                    params.add(new Param(name, optionalAnnotation(), null, Param.Kind.VAR_POSITIONAL));
                }
            } else {
                String name = expect(TokenType.NAME).getText();
                Expr annotation = optionalAnnotation();
                Expr defaultValue = acceptOp("=") ? test() : null;
                params.add(new Param(name, annotation, defaultValue, Param.Kind.POSITIONAL));
            }
            if (!acceptOp(",")) {
                break;
            }
        }
        return params;
    }

    private Expr optionalAnnotation() {
        return acceptOp(":") ? test() : null;
    }

    // ========== 语句 ==========

    private List<Stmt> suite() {
        if (peek().getType() != TokenType.NEWLINE) {
            return simpleStatements();
        }
        next();
        skipNewlines();
        expect(TokenType.INDENT);
        List<Stmt> body = new ArrayList<>();
        while (peek().getType() != TokenType.DEDENT && peek().getType() != TokenType.EOF) {
            body.addAll(statement());
            skipNewlines();
        }
        expect(TokenType.DEDENT);
        return body;
    }

    private List<Stmt> statement() {
        Token t = peek();
        if (t.getType() == TokenType.NAME) {
            switch (t.getText()) {
                case "if":
                    return List.of(ifStatement());
                case "for":
                    return List.of(forStatement());
                case "while":
                    return List.of(whileStatement());
                case "async":
                    next();
                    return List.of(unsupportedCompound("async " + peek().getText(), t.getLine()));
                default:
                    if (COMPOUND_UNSUPPORTED.contains(t.getText())) {
                        return List.of(unsupportedCompound(t.getText(), t.getLine()));
                    }
            }
        }
        if (t.isOp("@")) {
            skipToNewline();
            expect(TokenType.NEWLINE);
            skipNewlines();
            return statement();
        }
        return simpleStatements();
    }

    private If ifStatement() {
        int line = next().getLine();
        Expr test = namedTest();
        expectOp(":");
        List<Stmt> body = suite();
        skipNewlines();
        List<Stmt> orelse = List.of();
        if (peek().isName("elif")) {
            orelse = List.of(ifStatement());
        } else if (peek().isName("else")) {
            next();
            expectOp(":");
            orelse = suite();
        }
        return new If(test, body, orelse, line);
    }

    private For forStatement() {
        int line = next().getLine();
        Expr target = targetList();
        Token in = next();
        if (!in.isName("in")) {
            throw error("Expected 'in'", in);
        }
        Expr iterable = testList();
        expectOp(":");
        List<Stmt> body = suite();
        return new For(target, iterable, body, elseClause(), line);
    }

    private While whileStatement() {
        int line = next().getLine();
        Expr test = namedTest();
        expectOp(":");
        List<Stmt> body = suite();
        return new While(test, body, elseClause(), line);
    }

    private List<Stmt> elseClause() {
        skipNewlines();
        if (peek().isName("else")) {
            next();
            expectOp(":");
            return suite();
        }
        return List.of();
    }

    /**
     * 解析并丢弃子集外的复合语句（含 try 的 except/else/finally 子句）。
     */
    private Stmt unsupportedCompound(String keyword, int line) {
        skipHeader();
        suite();
        skipNewlines();
        while (peek().isName("except") || peek().isName("finally") || peek().isName("else")) {
            skipHeader();
            suite();
            skipNewlines();
        }
        return new UnsupportedStmt(keyword, line);
    }

    private void skipHeader() {
        int nesting = 0;
        while (true) {
            Token t = next();
            if (t.getType() == TokenType.EOF || t.getType() == TokenType.NEWLINE) {
                throw error("Expected ':'", t);
            }
            if (t.isOp("(") || t.isOp("[") || t.isOp("{")) {
                nesting++;
            } else if (t.isOp(")") || t.isOp("]") || t.isOp("}")) {
                nesting--;
            } else if (t.isOp(":") && nesting == 0) {
                return;
            }
        }
    }

    private List<Stmt> simpleStatements() {
        List<Stmt> stmts = new ArrayList<>();
        stmts.add(smallStatement());
        while (acceptOp(";")) {
            if (peek().getType() == TokenType.NEWLINE) {
                break;
            }
            stmts.add(smallStatement());
        }
        Token end = peek();
        if (end.getType() != TokenType.NEWLINE && end.getType() != TokenType.EOF) {
            throw error("Unexpected " + end, end);
        }
        if (end.getType() == TokenType.NEWLINE) {
            next();
        }
        return stmts;
    }

    private Stmt smallStatement() {
        Token t = peek();
        int line = t.getLine();
        if (t.getType() == TokenType.NAME) {
            switch (t.getText()) {
                case "return": {
                    next();
                    Expr value = atStatementEnd() ? null : testList();
                    return new Return(value, line);
                }
                case "pass":
                    next();
                    return new Pass(line);
                case "assert": {
                    next();
                    Expr test = test();
                    Expr message = acceptOp(",") ? test() : null;
                    return new Assert(test, message, line);
                }
                default:
                    if (SIMPLE_UNSUPPORTED.contains(t.getText())) {
                        next();
                        while (!atStatementEnd()) {
                            next();
                        }
                        return new UnsupportedStmt(t.getText(), line);
                    }
            }
        }
        Expr first = testList();
        if (acceptOp(":")) {
            Expr annotation = test();
            Expr value = acceptOp("=") ? testList() : null;
            return new AnnAssign(first, annotation, value, line);
        }
        if (peek().getType() == TokenType.OP && AUGMENTED.contains(peek().getText())) {
            String op = next().getText();
            BinaryOperator operator = BinaryOperator.fromSymbol(op.substring(0, op.length() - 1));
            return new AugAssign(first, operator, testList(), line);
        }
        if (peek().isOp("=")) {
            List<Expr> targets = new ArrayList<>();
            Expr value = first;
            while (acceptOp("=")) {
                targets.add(value);
                value = testList();
            }
            return new Assign(targets, value, line);
        }
        return new ExprStmt(first, line);
    }

    private boolean atStatementEnd() {
        Token t = peek();
        return t.getType() == TokenType.NEWLINE || t.getType() == TokenType.EOF || t.isOp(";");
    }

    // ========== 表达式 ==========

    /**
     * 逗号分隔的表达式列表，出现逗号时为元组。
     */
    private Expr testList() {
        int line = peek().getLine();
        if (peek().isName("yield")) {
            return yieldExpression();
        }
        Expr first = starOrTest();
        if (!peek().isOp(",")) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (atExpressionEnd()) {
                break;
            }
            elements.add(starOrTest());
        }
        return new TupleExpr(elements, line);
    }

    /**
     * for 的目标列表：不能包含比较运算，否则会吞掉 in。
     */
    private Expr targetList() {
        int line = peek().getLine();
        List<Expr> elements = new ArrayList<>();
        elements.add(bitOr());
        boolean tuple = false;
        while (acceptOp(",")) {
            tuple = true;
            if (peek().isName("in")) {
                break;
            }
            elements.add(bitOr());
        }
        return tuple ? new TupleExpr(elements, line) : elements.get(0);
    }

    private boolean atExpressionEnd() {
        Token t = peek();
        return atStatementEnd() || t.isOp("=") || t.isOp(")") || t.isOp("]") || t.isOp("}")
                || t.isOp(":") || (t.getType() == TokenType.OP && AUGMENTED.contains(t.getText()));
    }

    private Expr starOrTest() {
        if (peek().isOp("*")) {
            int line = next().getLine();
            return new Starred(bitOr(), line);
        }
        return namedTest();
    }

    private Expr yieldExpression() {
        int line = next().getLine();
        acceptName("from");
        if (!atExpressionEnd()) {
            testList();
        }
        return new UnsupportedExpr("yield", line);
    }

    /**
     * 允许 name := value 的位置。
     */
    private Expr namedTest() {
        if (peek().getType() == TokenType.NAME && peekAt(1).isOp(":=")) {
            Token name = next();
            next();
            return new NamedExpr(name.getText(), test(), name.getLine());
        }
        return test();
    }

    private Expr test() {
        Token t = peek();
        if (t.isName("lambda")) {
            next();
            while (!peek().isOp(":")) {
                if (peek().getType() == TokenType.EOF || peek().getType() == TokenType.NEWLINE) {
                    throw error("Expected ':' in lambda", peek());
                }
                next();
            }
            next();
            test();
            return new UnsupportedExpr("lambda", t.getLine());
        }
        Expr body = orTest();
        if (peek().isName("if")) {
            next();
            Expr condition = orTest();
            Token elseToken = next();
            if (!elseToken.isName("else")) {
                throw error("Expected 'else' in conditional expression", elseToken);
            }
            Expr orelse = test();
            return new IfExp(condition, body, orelse, t.getLine());
        }
        return body;
    }

    private Expr orTest() {
        int line = peek().getLine();
        Expr first = andTest();
        if (!peek().isName("or")) {
            return first;
        }
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (acceptName("or")) {
            values.add(andTest());
        }
        return new BoolOp(BoolOperator.OR, values, line);
    }

    private Expr andTest() {
        int line = peek().getLine();
        Expr first = notTest();
        if (!peek().isName("and")) {
            return first;
        }
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (acceptName("and")) {
            values.add(notTest());
        }
        return new BoolOp(BoolOperator.AND, values, line);
    }

    private Expr notTest() {
        if (peek().isName("not")) {
            int line = next().getLine();
            return new UnaryOp(UnaryOperator.NOT, notTest(), line);
        }
        return comparison();
    }

    private Expr comparison() {
        int line = peek().getLine();
        Expr left = bitOr();
        List<CompareOperator> operators = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        CompareOperator op;
        while ((op = compareOperator()) != null) {
            operators.add(op);
            comparators.add(bitOr());
        }
        return operators.isEmpty() ? left : new Compare(left, operators, comparators, line);
    }

    private CompareOperator compareOperator() {
        Token t = peek();
        if (t.getType() == TokenType.OP) {
            CompareOperator op = switch (t.getText()) {
                case "<" -> CompareOperator.LT;
                case "<=" -> CompareOperator.LE;
                case ">" -> CompareOperator.GT;
                case ">=" -> CompareOperator.GE;
                case "==" -> CompareOperator.EQ;
                case "!=" -> CompareOperator.NE;
                default -> null;
            };
            if (op != null) {
                next();
            }
            return op;
        }
        if (t.isName("in")) {
            next();
            return CompareOperator.IN;
        }
        if (t.isName("not") && peekAt(1).isName("in")) {
            next();
            next();
            return CompareOperator.NOT_IN;
        }
        if (t.isName("is")) {
            next();
            return acceptName("not") ? CompareOperator.IS_NOT : CompareOperator.IS;
        }
        return null;
    }

    private Expr bitOr() {
        Expr left = bitXor();
        while (peek().isOp("|")) {
            int line = next().getLine();
            left = new BinaryOp(BinaryOperator.BIT_OR, left, bitXor(), line);
        }
        return left;
    }

    private Expr bitXor() {
        Expr left = bitAnd();
        while (peek().isOp("^")) {
            int line = next().getLine();
            left = new BinaryOp(BinaryOperator.BIT_XOR, left, bitAnd(), line);
        }
        return left;
    }

    private Expr bitAnd() {
        Expr left = shift();
        while (peek().isOp("&")) {
            int line = next().getLine();
            left = new BinaryOp(BinaryOperator.BIT_AND, left, shift(), line);
        }
        return left;
    }

    private Expr shift() {
        Expr left = arith();
        while (peek().isOp("<<") || peek().isOp(">>")) {
            Token op = next();
            left = new BinaryOp(BinaryOperator.fromSymbol(op.getText()), left, arith(), op.getLine());
        }
        return left;
    }

    private Expr arith() {
        Expr left = term();
        while (peek().isOp("+") || peek().isOp("-")) {
            Token op = next();
            left = new BinaryOp(BinaryOperator.fromSymbol(op.getText()), left, term(), op.getLine());
        }
        return left;
    }

    private Expr term() {
        Expr left = factor();
        while (peek().isOp("*") || peek().isOp("/") || peek().isOp("//") || peek().isOp("%") || peek().isOp("@")) {
            Token op = next();
            left = new BinaryOp(BinaryOperator.fromSymbol(op.getText()), left, factor(), op.getLine());
        }
        return left;
    }

    private Expr factor() {
        Token t = peek();
        if (t.isOp("-") || t.isOp("+") || t.isOp("~")) {
            next();
            UnaryOperator op = switch (t.getText()) {
                case "-" -> UnaryOperator.NEG;
                case "+" -> UnaryOperator.POS;
                default -> UnaryOperator.INVERT;
            };
            return new UnaryOp(op, factor(), t.getLine());
        }
        return power();
    }

    private Expr power() {
        Expr base;
        if (peek().isName("await")) {
            int line = next().getLine();
            primary();
            base = new UnsupportedExpr("await", line);
        } else {
            base = primary();
        }
        if (peek().isOp("**")) {
            int line = next().getLine();
            return new BinaryOp(BinaryOperator.POW, base, factor(), line);
        }
        return base;
    }

    private Expr primary() {
        Expr expr = atom();
        while (true) {
            Token t = peek();
            if (t.isOp("(")) {
                next();
                expr = callArguments(expr, t.getLine());
            } else if (t.isOp("[")) {
                next();
                expr = new Subscript(expr, subscriptIndex(t.getLine()), t.getLine());
                expectOp("]");
            } else if (t.isOp(".")) {
                next();
                expr = new Attribute(expr, expect(TokenType.NAME).getText(), t.getLine());
            } else {
                return expr;
            }
        }
    }

    private Expr callArguments(Expr function, int line) {
        List<Expr> args = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        while (!peek().isOp(")")) {
            if (acceptOp("**")) {
                keywords.add(new Keyword(null, test()));
            } else if (peek().isOp("*")) {
                int starLine = next().getLine();
                args.add(new Starred(test(), starLine));
            } else if (peek().getType() == TokenType.NAME && peekAt(1).isOp("=")) {
                String name = next().getText();
                next();
                keywords.add(new Keyword(name, test()));
            } else {
                Expr arg = namedTest();
                if (peek().isName("for") || peek().isName("async")) {
                    // skipUntilClose 已消费右括号
                    skipUntilClose(")");
                    args.add(new UnsupportedExpr("generator expression", arg.getLine()));
                    return new Call(function, args, keywords, line);
                }
                args.add(arg);
            }
            if (!acceptOp(",")) {
                break;
            }
        }
        expectOp(")");
        return new Call(function, args, keywords, line);
    }

    private Expr subscriptIndex(int line) {
        List<Expr> items = new ArrayList<>();
        boolean slice = false;
        boolean tuple = false;
        while (!peek().isOp("]")) {
            Expr item = null;
            if (!peek().isOp(":")) {
                item = namedTest();
            }
            if (peek().isOp(":")) {
                slice = true;
                while (acceptOp(":")) {
                    if (!peek().isOp(":") && !peek().isOp("]") && !peek().isOp(",")) {
                        test();
                    }
                }
            }
            items.add(item);
            if (!acceptOp(",")) {
                break;
            }
            tuple = true;
        }
        if (slice) {
            return new UnsupportedExpr("slice", line);
        }
        if (items.isEmpty()) {
            throw error("Empty subscript", peek());
        }
        return tuple ? new TupleExpr(items, line) : items.get(0);
    }

    private Expr atom() {
        Token t = next();
        int line = t.getLine();
        switch (t.getType()) {
            case NAME:
                if (isReserved(t.getText())) {
                    throw error("Unexpected keyword '" + t.getText() + "'", t);
                }
                return new Name(t.getText(), line);
            case NUMBER:
                return number(t);
            case STRING: {
                StringBuilder sb = new StringBuilder(t.getText());
                while (peek().getType() == TokenType.STRING) {
                    sb.append(next().getText());
                }
                return new StringLiteral(sb.toString(), line);
            }
            case OP:
                return bracketAtom(t);
            default:
                throw error("Unexpected " + t, t);
        }
    }

    private Expr bracketAtom(Token t) {
        int line = t.getLine();
        switch (t.getText()) {
            case "(": {
                if (acceptOp(")")) {
                    return new TupleExpr(List.of(), line);
                }
                if (peek().isName("yield")) {
                    Expr yield = yieldExpression();
                    expectOp(")");
                    return yield;
                }
                Expr first = starOrTest();
                if (peek().isName("for") || peek().isName("async")) {
                    skipUntilClose(")");
                    return new UnsupportedExpr("generator expression", line);
                }
                if (acceptOp(")")) {
                    return first;
                }
                List<Expr> elements = new ArrayList<>();
                elements.add(first);
                while (acceptOp(",")) {
                    if (peek().isOp(")")) {
                        break;
                    }
                    elements.add(starOrTest());
                }
                expectOp(")");
                return new TupleExpr(elements, line);
            }
            case "[":
                return new UnsupportedExpr(skipUntilClose("]") ? "list comprehension" : "list", line);
            case "{":
                return new UnsupportedExpr(skipUntilClose("}") ? "dict or set comprehension" : "dict or set", line);
            case "...":
                return new UnsupportedExpr("Ellipsis", line);
            default:
                throw error("Unexpected " + t, t);
        }
    }

    /**
     * 跳过直到与已消费的开括号配对的 close，返回其间是否出现了顶层的 for。
     */
    private boolean skipUntilClose(String close) {
        int nesting = 0;
        boolean comprehension = false;
        while (true) {
            Token t = next();
            if (t.getType() == TokenType.EOF) {
                throw error("Unclosed bracket", t);
            }
            if (t.isOp("(") || t.isOp("[") || t.isOp("{")) {
                nesting++;
            } else if (t.isOp(")") || t.isOp("]") || t.isOp("}")) {
                if (nesting == 0) {
                    if (!t.getText().equals(close)) {
                        throw error("Mismatched bracket " + t, t);
                    }
                    return comprehension;
                }
                nesting--;
            } else if (nesting == 0 && t.isName("for")) {
                comprehension = true;
            }
        }
    }

    private Expr number(Token t) {
        String text = t.getText().replace("_", "");
        String lower = text.toLowerCase();
        try {
            if (lower.endsWith("j")) {
                return new UnsupportedExpr("complex literal", t.getLine());
            }
            if (lower.startsWith("0x") || lower.startsWith("0o") || lower.startsWith("0b")) {
                int radix = lower.charAt(1) == 'x' ? 16 : lower.charAt(1) == 'o' ? 8 : 2;
                return new NumberLiteral(t.getText(), Rational.valueOf(new BigInteger(text.substring(2), radix)),
                        false, t.getLine());
            }
            boolean floating = lower.contains(".") || lower.contains("e");
            return new NumberLiteral(t.getText(), Rational.valueOf(text), floating, t.getLine());
        } catch (NumberFormatException e) {
            throw new SourceSyntaxException("Invalid number literal '" + t.getText() + "'", t.getLine());
        }
    }

    private static boolean isReserved(String word) {
        return switch (word) {
            case "if", "else", "elif", "for", "while", "def", "return", "pass", "in", "and", "or", "not",
                    "is", "lambda", "class", "try", "except", "finally", "with", "as", "import", "from",
                    "global", "nonlocal", "raise", "del", "assert", "break", "continue", "yield" -> true;
            default -> false;
        };
    }

    // ========== token 工具 ==========

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(index);
        if (t.getType() != TokenType.EOF) {
            index++;
        }
        return t;
    }

    private boolean acceptOp(String op) {
        if (peek().isOp(op)) {
            next();
            return true;
        }
        return false;
    }

    private boolean acceptName(String name) {
        if (peek().isName(name)) {
            next();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type) {
        Token t = peek();
        if (t.getType() != type) {
            throw error("Expected " + type.name().toLowerCase() + " but found " + t, t);
        }
        return next();
    }

    private void expectOp(String op) {
        Token t = peek();
        if (!t.isOp(op)) {
            throw error("Expected '" + op + "' but found " + t, t);
        }
        next();
    }

    private void skipNewlines() {
        while (peek().getType() == TokenType.NEWLINE) {
            next();
        }
    }

    private void skipToNewline() {
        while (peek().getType() != TokenType.NEWLINE && peek().getType() != TokenType.EOF) {
            next();
        }
    }

    private SourceSyntaxException error(String message, Token at) {
        return new SourceSyntaxException(message, at.getLine());
    }
}
