package org.dxworks.logframe.calc;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Evaluates a fully substituted column expression and renders the result as text.
 *
 * <p>Supported: decimal numbers, single-quoted strings ({@code ''} escapes a quote),
 * parentheses, unary minus, {@code + - * /} on numbers and {@code &} for string
 * concatenation. Binding, weakest first: {@code &}, {@code + -}, {@code * /},
 * unary {@code -}. Binary operators are left-associative.
 *
 * <p>Instances hold no state and may be shared.
 */
public class Calculator {

    static final int CONCAT_PRECEDENCE = 5;
    static final int ADDITIVE_PRECEDENCE = 10;
    static final int MULTIPLICATIVE_PRECEDENCE = 30;

    private static final MathContext DIVISION_CONTEXT = MathContext.DECIMAL64;

    public String compute(String expression) {
        Parser parser = new Parser(expression);
        return parser.parse().render();
    }

    enum TokType {
        NUMBER, STRING,
        PLUS, MINUS, STAR, SLASH, AMPERSAND,
        LPAREN, RPAREN,
        EOF
    }

    static final class Token {
        final TokType type;
        final String text;
        final int position;

        Token(TokType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }

        @Override
        public String toString() {
            return type + (text != null ? "(" + text + ")" : "");
        }
    }

    static final class Lexer {
        private final String source;
        private int i = 0;

        Lexer(String source) {
            this.source = source;
        }

        Token next() {
            skipWhitespace();
            if (i >= source.length()) {
                return new Token(TokType.EOF, null, i);
            }
            int start = i;
            char c = source.charAt(i);
            if (Character.isDigit(c) || (c == '.' && i + 1 < source.length() && Character.isDigit(source.charAt(i + 1)))) {
                return number(start);
            }
            if (c == '\'') {
                return string(start);
            }
            i++;
            switch (c) {
                case '+': return new Token(TokType.PLUS, "+", start);
                case '-': return new Token(TokType.MINUS, "-", start);
                case '*': return new Token(TokType.STAR, "*", start);
                case '/': return new Token(TokType.SLASH, "/", start);
                case '&': return new Token(TokType.AMPERSAND, "&", start);
                case '(': return new Token(TokType.LPAREN, "(", start);
                case ')': return new Token(TokType.RPAREN, ")", start);
                default:
                    throw new ExpressionParseException("Unexpected character '" + c + "'", source, start);
            }
        }

        private Token number(int start) {
            while (i < source.length() && Character.isDigit(source.charAt(i))) i++;
            if (i < source.length() && source.charAt(i) == '.') {
                i++;
                while (i < source.length() && Character.isDigit(source.charAt(i))) i++;
            }
            return new Token(TokType.NUMBER, source.substring(start, i), start);
        }

        private Token string(int start) {
            StringBuilder sb = new StringBuilder();
            i++;
            while (i < source.length()) {
                char ch = source.charAt(i++);
                if (ch != '\'') {
                    sb.append(ch);
                } else if (i < source.length() && source.charAt(i) == '\'') {
                    sb.append('\'');
                    i++;
                } else {
                    return new Token(TokType.STRING, sb.toString(), start);
                }
            }
            throw new ExpressionParseException("Unterminated string literal", source, start);
        }

        private void skipWhitespace() {
            while (i < source.length() && Character.isWhitespace(source.charAt(i))) i++;
        }
    }

    static final class Parser {
        private final String source;
        private final Lexer lexer;
        private Token la;

        Parser(String source) {
            this.source = source;
            this.lexer = new Lexer(source);
            this.la = lexer.next();
        }

        Value parse() {
            Value result = parseBinary(CONCAT_PRECEDENCE);
            if (la.type != TokType.EOF) {
                throw new ExpressionParseException("Unexpected token " + la, source, la.position);
            }
            return result;
        }

        private Value parseBinary(int minPrecedence) {
            Value left = parseUnary();
            while (true) {
                int precedence = precedenceOf(la.type);
                if (precedence < minPrecedence) {
                    return left;
                }
                TokType operator = la.type;
                advance();
                Value right = parseBinary(precedence + 1);
                left = apply(operator, left, right);
            }
        }

        private Value parseUnary() {
            if (la.type == TokType.MINUS) {
                advance();
                return parseUnary().negate();
            }
            return parsePrimary();
        }

        private Value parsePrimary() {
            Token token = la;
            switch (token.type) {
                case NUMBER:
                    advance();
                    return Value.literal(new BigDecimal(token.text), token.text);
                case STRING:
                    advance();
                    return Value.of(token.text);
                case LPAREN: {
                    advance();
                    Value inner = parseBinary(CONCAT_PRECEDENCE);
                    expect(TokType.RPAREN);
                    return inner;
                }
                case EOF:
                    throw new ExpressionParseException("Unexpected end of expression", source, token.position);
                default:
                    throw new ExpressionParseException("Unexpected token " + token, source, token.position);
            }
        }

        private void expect(TokType type) {
            if (la.type != type) {
                throw new ExpressionParseException("Expected " + type + " but got " + la, source, la.position);
            }
            advance();
        }

        private void advance() {
            la = lexer.next();
        }

        private static int precedenceOf(TokType type) {
            switch (type) {
                case AMPERSAND: return CONCAT_PRECEDENCE;
                case PLUS:
                case MINUS: return ADDITIVE_PRECEDENCE;
                case STAR:
                case SLASH: return MULTIPLICATIVE_PRECEDENCE;
                default: return -1;
            }
        }

        private static Value apply(TokType operator, Value left, Value right) {
            switch (operator) {
                case AMPERSAND:
                    return Value.of(left.render() + right.render());
                case PLUS:
                    return Value.of(left.asNumber().add(right.asNumber()));
                case MINUS:
                    return Value.of(left.asNumber().subtract(right.asNumber()));
                case STAR:
                    return Value.of(left.asNumber().multiply(right.asNumber()));
                case SLASH:
                    return divide(left.asNumber(), right.asNumber());
                default:
                    throw new IllegalStateException("Not a binary operator: " + operator);
            }
        }

        private static Value divide(BigDecimal dividend, BigDecimal divisor) {
            if (divisor.signum() == 0) {
                throw new ExpressionEvaluationException("Division by zero: " + dividend.toPlainString() + " / 0");
            }
            return Value.of(dividend.divide(divisor, DIVISION_CONTEXT));
        }
    }

    /**
     * Either a number or a piece of text. Text is coerced to a number when an
     * arithmetic operator needs one. A number literal keeps its source text, so
     * {@code 007 & '_'} renders as written; only computed numbers are normalized.
     */
    static final class Value {
        private final BigDecimal number;
        private final String text;

        private Value(BigDecimal number, String text) {
            this.number = number;
            this.text = text;
        }

        static Value of(BigDecimal number) {
            return new Value(number, null);
        }

        static Value of(String text) {
            return new Value(null, text);
        }

        static Value literal(BigDecimal number, String text) {
            return new Value(number, text);
        }

        Value negate() {
            BigDecimal negated = asNumber().negate();
            if (number == null || text == null) {
                return of(negated);
            }
            return literal(negated, text.startsWith("-") ? text.substring(1) : "-" + text);
        }

        BigDecimal asNumber() {
            if (number != null) {
                return number;
            }
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                throw new ExpressionEvaluationException("Not a number: '" + text + "'", e);
            }
        }

        String render() {
            if (text != null) {
                return text;
            }
            return number.stripTrailingZeros().toPlainString();
        }
    }
}
