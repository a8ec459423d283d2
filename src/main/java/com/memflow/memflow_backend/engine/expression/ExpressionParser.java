package com.memflow.memflow_backend.engine.expression;

import com.memflow.memflow_backend.exception.InvalidExpressionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the restricted expression grammar.
 *
 * <pre>
 * expression  := or ['if' or 'else' expression]
 * or          := and ('or' and)*
 * and         := not ('and' not)*
 * not         := 'not' not | comparison
 * comparison  := arith (relop arith)*
 * arith       := term (('+' | '-') term)*
 * term        := unary (('*' | '/' | '//' | '%') unary)*
 * unary       := ('-' | '+') unary | power
 * power       := postfix ['**' unary]
 * postfix     := primary ('.' NAME | '[' expression ']' | '|' NAME ['(' arguments ')'])*
 * primary     := NUMBER | STRING | NAME | '(' expression ')' | list | map
 * </pre>
 *
 * Calls, lambdas, comprehensions, imports and assignment are rejected while parsing,
 * so no rejected construct ever reaches evaluation. The only parenthesised argument
 * lists are those of filters, and filter names come from the fixed set in {@link Filters}.
 */
final class ExpressionParser {

    private static final int MAX_DEPTH = 100;

    private static final Set<String> FORBIDDEN_WORDS = Set.of(
            "import", "from", "lambda", "def", "class", "for", "while", "yield", "await", "async",
            "return", "del", "global", "nonlocal", "with", "try", "except", "raise", "assert", "pass");

    private static final Set<String> KEYWORDS = Set.of("and", "or", "not", "in", "is", "if", "else");

    private final String source;
    private final List<Token> tokens;
    private int index;
    private int depth;

    ExpressionParser(String source) {
        this.source = source;
        this.tokens = new ExpressionLexer(source).tokenize();
    }

    Expression parse() {
        Expression expression = parseExpression();
        Token trailing = peek();
        if (trailing.type() != TokenType.END) {
            throw unexpected(trailing);
        }
        return expression;
    }

    private Expression parseExpression() {
        enter();
        try {
            Expression expression = parseOr();
            if (peek().isKeyword("if")) {
                advance();
                Expression condition = parseOr();
                if (!peek().isKeyword("else")) {
                    throw error("Conditional expression needs an 'else' branch", peek());
                }
                advance();
                Expression otherwise = parseExpression();
                expression = new Expression.Conditional(condition, expression, otherwise);
            }
            return expression;
        } finally {
            depth--;
        }
    }

    private Expression parseOr() {
        List<Expression> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (peek().isKeyword("or")) {
            advance();
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new Expression.Logical(false, operands);
    }

    private Expression parseAnd() {
        List<Expression> operands = new ArrayList<>();
        operands.add(parseNot());
        while (peek().isKeyword("and")) {
            advance();
            operands.add(parseNot());
        }
        return operands.size() == 1 ? operands.get(0) : new Expression.Logical(true, operands);
    }

    private Expression parseNot() {
        if (peek().isKeyword("not")) {
            advance();
            enter();
            try {
                return new Expression.Unary(UnaryOperator.NOT, parseNot());
            } finally {
                depth--;
            }
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression first = parseArith();
        List<RelationalOperator> operators = new ArrayList<>();
        List<Expression> operands = new ArrayList<>();
        RelationalOperator operator;
        while ((operator = matchRelational()) != null) {
            operators.add(operator);
            operands.add(parseArith());
        }
        return operators.isEmpty() ? first : new Expression.Comparison(first, operators, operands);
    }

    private RelationalOperator matchRelational() {
        Token token = peek();
        RelationalOperator operator = null;
        if (token.type() == TokenType.OPERATOR) {
            operator = switch (token.text()) {
                case "==" -> RelationalOperator.EQ;
                case "!=" -> RelationalOperator.NE;
                case "<" -> RelationalOperator.LT;
                case "<=" -> RelationalOperator.LE;
                case ">" -> RelationalOperator.GT;
                case ">=" -> RelationalOperator.GE;
                default -> null;
            };
            if (operator != null) advance();
            return operator;
        }
        if (token.isKeyword("in")) {
            advance();
            return RelationalOperator.IN;
        }
        if (token.isKeyword("not") && peekAhead(1).isKeyword("in")) {
            advance();
            advance();
            return RelationalOperator.NOT_IN;
        }
        if (token.isKeyword("is")) {
            advance();
            if (peek().isKeyword("not")) {
                advance();
                return RelationalOperator.IS_NOT;
            }
            return RelationalOperator.IS;
        }
        return null;
    }

    private Expression parseArith() {
        Expression left = parseTerm();
        while (true) {
            Token token = peek();
            if (token.isOperator("+")) {
                advance();
                left = new Expression.Binary(BinaryOperator.ADD, left, parseTerm());
            } else if (token.isOperator("-")) {
                advance();
                left = new Expression.Binary(BinaryOperator.SUBTRACT, left, parseTerm());
            } else {
                return left;
            }
        }
    }

    private Expression parseTerm() {
        Expression left = parseUnary();
        while (true) {
            Token token = peek();
            BinaryOperator operator = null;
            if (token.isOperator("*")) operator = BinaryOperator.MULTIPLY;
            else if (token.isOperator("/")) operator = BinaryOperator.DIVIDE;
            else if (token.isOperator("//")) operator = BinaryOperator.FLOOR_DIVIDE;
            else if (token.isOperator("%")) operator = BinaryOperator.MODULO;
            if (operator == null) {
                return left;
            }
            advance();
            left = new Expression.Binary(operator, left, parseUnary());
        }
    }

    private Expression parseUnary() {
        Token token = peek();
        if (token.isOperator("-") || token.isOperator("+")) {
            advance();
            enter();
            try {
                UnaryOperator operator = token.isOperator("-") ? UnaryOperator.NEGATE : UnaryOperator.PLUS;
                return new Expression.Unary(operator, parseUnary());
            } finally {
                depth--;
            }
        }
        return parsePower();
    }

    private Expression parsePower() {
        Expression base = parsePostfix();
        if (peek().isOperator("**")) {
            advance();
            enter();
            try {
                return new Expression.Binary(BinaryOperator.POWER, base, parseUnary());
            } finally {
                depth--;
            }
        }
        return base;
    }

    private Expression parsePostfix() {
        Expression expression = parsePrimary();
        while (true) {
            Token token = peek();
            if (token.isOperator(".")) {
                advance();
                Token name = advance();
                if (name.type() != TokenType.NAME) {
                    throw error("Expected attribute name after '.'", name);
                }
                if (name.text().startsWith("_")) {
                    throw error("Access to private attribute '" + name.text() + "' is not allowed", name);
                }
                expression = new Expression.Attribute(expression, name.text());
            } else if (token.isOperator("[")) {
                advance();
                Expression key = parseExpression();
                if (peek().isOperator(":")) {
                    throw error("Slices are not supported", peek());
                }
                expect("]");
                expression = new Expression.Subscript(expression, key);
            } else if (token.isOperator("|")) {
                advance();
                expression = filter(expression);
            } else if (token.isOperator("(")) {
                throw error("Function calls are not allowed", token);
            } else {
                return expression;
            }
        }
    }

    private Expression parsePrimary() {
        Token token = advance();
        switch (token.type()) {
            case NUMBER, STRING:
                return new Expression.Literal(token.value());
            case NAME:
                return nameOrConstant(token);
            case END:
                throw error("Unexpected end of expression", token);
            default:
                break;
        }
        if (token.isOperator("(")) {
            Expression inner = parseExpression();
            if (peek().isOperator(",")) {
                throw error("Tuples are not supported", peek());
            }
            expect(")");
            return inner;
        }
        if (token.isOperator("[")) {
            return listLiteral();
        }
        if (token.isOperator("{")) {
            return mapLiteral();
        }
        throw unexpected(token);
    }

    private Expression nameOrConstant(Token token) {
        String name = token.text();
        switch (name) {
            case "True", "true":
                return new Expression.Literal(Boolean.TRUE);
            case "False", "false":
                return new Expression.Literal(Boolean.FALSE);
            case "None", "null":
                return new Expression.Literal(null);
            default:
                break;
        }
        if (FORBIDDEN_WORDS.contains(name)) {
            throw error("'" + name + "' is not allowed in expressions", token);
        }
        if (KEYWORDS.contains(name)) {
            throw unexpected(token);
        }
        if (name.startsWith("__")) {
            throw error("Access to '" + name + "' is not allowed", token);
        }
        return new Expression.Name(name);
    }

    private Expression filter(Expression target) {
        Token name = advance();
        if (name.type() != TokenType.NAME) {
            throw error("Expected filter name after '|'", name);
        }
        if (!Filters.isKnown(name.text())) {
            throw error("Unknown filter '" + name.text() + "'", name);
        }
        List<Expression> arguments = new ArrayList<>();
        if (peek().isOperator("(")) {
            advance();
            while (!peek().isOperator(")")) {
                arguments.add(parseExpression());
                if (!peek().isOperator(",")) break;
                advance();
            }
            expect(")");
        }
        return new Expression.Filter(target, name.text(), arguments);
    }

    private Expression listLiteral() {
        List<Expression> items = new ArrayList<>();
        while (!peek().isOperator("]")) {
            items.add(parseExpression());
            if (peek().isKeyword("for")) {
                throw error("Comprehensions are not allowed", peek());
            }
            if (!peek().isOperator(",")) break;
            advance();
        }
        expect("]");
        return new Expression.ListLiteral(items);
    }

    private Expression mapLiteral() {
        List<Expression> keys = new ArrayList<>();
        List<Expression> values = new ArrayList<>();
        while (!peek().isOperator("}")) {
            keys.add(parseExpression());
            expect(":");
            values.add(parseExpression());
            if (peek().isKeyword("for")) {
                throw error("Comprehensions are not allowed", peek());
            }
            if (!peek().isOperator(",")) break;
            advance();
        }
        expect("}");
        return new Expression.MapLiteral(keys, values);
    }

    // ── Token helpers ────────────────────────────────────────────────────────

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (token.type() != TokenType.END) index++;
        return token;
    }

    private void expect(String op) {
        Token token = advance();
        if (!token.isOperator(op)) {
            throw error("Expected '" + op + "'", token);
        }
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw error("Expression is nested too deeply", peek());
        }
    }

    private InvalidExpressionException unexpected(Token token) {
        if (token.type() == TokenType.END) {
            return error("Unexpected end of expression", token);
        }
        if (token.type() == TokenType.NAME && FORBIDDEN_WORDS.contains(token.text())) {
            return error("'" + token.text() + "' is not allowed in expressions", token);
        }
        return error("Unexpected token '" + token.text() + "'", token);
    }

    private InvalidExpressionException error(String message, Token token) {
        return new InvalidExpressionException(message, source, token.position());
    }
}
