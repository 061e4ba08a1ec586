package com.medwatch.anomaly.engine.rules.condition;

import com.medwatch.anomaly.exception.InvalidRuleException;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles condition expressions into {@link RuleCondition} trees.
 *
 * Grammar:
 * <pre>
 *   expr       := and ( "||" and )*
 *   and        := unary ( "&amp;&amp;" unary )*
 *   unary      := "!" unary | "(" expr ")" | comparison
 *   comparison := operand [ op operand ]
 *               | path "." method "(" operand ")"
 *   op         := == | === | != | !== | &gt; | &gt;= | &lt; | &lt;= | contains | startsWith | endsWith | matches
 *   operand    := number | 'string' | "string" | true | false | null | path
 * </pre>
 * A bare path is shorthand for {@code path == true}. At least one side of a comparison must be a path.
 */
public final class ConditionExpressionParser {

    private final List<Token> tokens;
    private final String source;
    private int pos;

    private ConditionExpressionParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    public static RuleCondition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidRuleException("Expression is empty");
        }
        ConditionExpressionParser parser = new ConditionExpressionParser(expression);
        RuleCondition condition = parser.parseOr();
        if (parser.peek().kind != Kind.END) {
            throw parser.error("Unexpected '" + parser.peek().text + "'");
        }
        condition.validate();
        return condition;
    }

    private RuleCondition parseOr() {
        List<RuleCondition> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (accept(Kind.OR)) {
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new LogicalCondition(LogicalOperator.OR, operands);
    }

    private RuleCondition parseAnd() {
        List<RuleCondition> operands = new ArrayList<>();
        operands.add(parseUnary());
        while (accept(Kind.AND)) {
            operands.add(parseUnary());
        }
        return operands.size() == 1 ? operands.get(0) : new LogicalCondition(LogicalOperator.AND, operands);
    }

    private RuleCondition parseUnary() {
        if (accept(Kind.NOT)) {
            return new NotCondition(parseUnary());
        }
        if (accept(Kind.LPAREN)) {
            RuleCondition inner = parseOr();
            expect(Kind.RPAREN, "')'");
            return inner;
        }
        return parseComparison();
    }

    private RuleCondition parseComparison() {
        Token first = next();

        if (first.kind == Kind.PATH && peek().kind == Kind.LPAREN) {
            return parseMethodCall(first);
        }
        if (!isOperand(first)) {
            throw error("Expected a field or value but found '" + first.text + "'");
        }

        if (peek().kind != Kind.OPERATOR) {
            if (first.kind != Kind.PATH) {
                throw error("A literal cannot stand alone as a condition: '" + first.text + "'");
            }
            return ComparisonCondition.of(fieldPath(first), ComparisonOperator.EQ, Boolean.TRUE);
        }

        ComparisonOperator operator = ComparisonOperator.fromSymbol(next().text);
        Token second = next();
        if (!isOperand(second)) {
            throw error("Expected a field or value after '" + operator.symbol() + "'");
        }
        return comparison(first, operator, second);
    }

    private RuleCondition parseMethodCall(Token target) {
        String text = target.text;
        int dot = text.lastIndexOf('.');
        if (dot <= 0) {
            throw error("Function calls are not supported: '" + text + "'");
        }
        String field = text.substring(0, dot);
        String method = text.substring(dot + 1);
        if (field.equals("helpers") || field.startsWith("helpers.")) {
            throw error("Helper calls are not supported in expressions: '" + text + "'");
        }
        ComparisonOperator operator;
        switch (method) {
            case "contains": operator = ComparisonOperator.CONTAINS; break;
            case "startsWith": operator = ComparisonOperator.STARTS_WITH; break;
            case "endsWith": operator = ComparisonOperator.ENDS_WITH; break;
            case "matches": operator = ComparisonOperator.REGEX; break;
            default: throw error("Unsupported method '" + method + "'");
        }
        expect(Kind.LPAREN, "'('");
        Token argument = next();
        if (!isOperand(argument)) {
            throw error("Expected an argument for '" + method + "'");
        }
        expect(Kind.RPAREN, "')'");
        return comparison(new Token(Kind.PATH, field), operator, argument);
    }

    private RuleCondition comparison(Token left, ComparisonOperator operator, Token right) {
        if (left.kind == Kind.PATH) {
            ComparisonCondition.ComparisonConditionBuilder b = ComparisonCondition.builder()
                    .field(fieldPath(left))
                    .operator(operator);
            if (right.kind == Kind.PATH) {
                b.valueField(fieldPath(right));
            } else {
                b.value(right.literal);
            }
            return b.build();
        }
        if (right.kind != Kind.PATH) {
            throw error("A comparison needs at least one field");
        }
        ComparisonOperator mirrored = operator.mirrored();
        if (mirrored == null) {
            throw error("'" + operator.symbol() + "' needs the field on its left side");
        }
        return ComparisonCondition.of(fieldPath(right), mirrored, left.literal);
    }

    private static String fieldPath(Token token) {
        String path = token.text;
        return path.startsWith("data.") ? path.substring(5) : path;
    }

    private static boolean isOperand(Token token) {
        return token.kind == Kind.PATH || token.kind == Kind.LITERAL;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token token = tokens.get(pos);
        if (token.kind != Kind.END) pos++;
        return token;
    }

    private boolean accept(Kind kind) {
        if (peek().kind == kind) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(Kind kind, String description) {
        if (!accept(kind)) {
            throw error("Expected " + description + " but found '" + peek().text + "'");
        }
    }

    private InvalidRuleException error(String message) {
        return new InvalidRuleException(message + " in expression: " + source);
    }

    // Tokenizer

    private enum Kind { PATH, LITERAL, OPERATOR, AND, OR, NOT, LPAREN, RPAREN, END }

    private static final class Token {
        final Kind kind;
        final String text;
        final Object literal;

        Token(Kind kind, String text) {
            this(kind, text, null);
        }

        Token(Kind kind, String text, Object literal) {
            this.kind = kind;
            this.text = text;
            this.literal = literal;
        }
    }

    private static List<Token> tokenize(String s) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = s.length();
        while (i < n) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, ")"));
                i++;
            } else if (s.startsWith("&&", i)) {
                tokens.add(new Token(Kind.AND, "&&"));
                i += 2;
            } else if (s.startsWith("||", i)) {
                tokens.add(new Token(Kind.OR, "||"));
                i += 2;
            } else if (s.startsWith("===", i) || s.startsWith("!==", i)) {
                tokens.add(new Token(Kind.OPERATOR, s.substring(i, i + 3)));
                i += 3;
            } else if (s.startsWith("==", i) || s.startsWith("!=", i)
                    || s.startsWith(">=", i) || s.startsWith("<=", i)) {
                tokens.add(new Token(Kind.OPERATOR, s.substring(i, i + 2)));
                i += 2;
            } else if (c == '>' || c == '<') {
                tokens.add(new Token(Kind.OPERATOR, String.valueOf(c)));
                i++;
            } else if (c == '!') {
                tokens.add(new Token(Kind.NOT, "!"));
                i++;
            } else if (c == '\'' || c == '"') {
                int end = i + 1;
                StringBuilder text = new StringBuilder();
                while (end < n && s.charAt(end) != c) {
                    if (s.charAt(end) == '\\' && end + 1 < n) end++;
                    text.append(s.charAt(end));
                    end++;
                }
                if (end >= n) {
                    throw new InvalidRuleException("Unterminated string in expression: " + s);
                }
                tokens.add(new Token(Kind.LITERAL, text.toString(), text.toString()));
                i = end + 1;
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < n && Character.isDigit(s.charAt(i + 1)))) {
                int end = i + 1;
                while (end < n && (Character.isDigit(s.charAt(end)) || s.charAt(end) == '.')) end++;
                String text = s.substring(i, end);
                try {
                    tokens.add(new Token(Kind.LITERAL, text, Double.parseDouble(text)));
                } catch (NumberFormatException e) {
                    throw new InvalidRuleException("Invalid number '" + text + "' in expression: " + s, e);
                }
                i = end;
            } else if (Character.isLetter(c) || c == '_' || c == '$') {
                int end = i + 1;
                while (end < n && (Character.isLetterOrDigit(s.charAt(end))
                        || s.charAt(end) == '_' || s.charAt(end) == '.')) end++;
                String word = s.substring(i, end);
                tokens.add(word(word));
                i = end;
            } else {
                throw new InvalidRuleException("Unexpected character '" + c + "' in expression: " + s);
            }
        }
        tokens.add(new Token(Kind.END, "<end>"));
        return tokens;
    }

    private static Token word(String word) {
        switch (word) {
            case "true": return new Token(Kind.LITERAL, word, Boolean.TRUE);
            case "false": return new Token(Kind.LITERAL, word, Boolean.FALSE);
            case "null": return new Token(Kind.LITERAL, word, null);
            case "and": return new Token(Kind.AND, word);
            case "or": return new Token(Kind.OR, word);
            case "not": return new Token(Kind.NOT, word);
            case "contains":
            case "startsWith":
            case "endsWith":
            case "matches":
                return new Token(Kind.OPERATOR, word);
            default: return new Token(Kind.PATH, word);
        }
    }
}
