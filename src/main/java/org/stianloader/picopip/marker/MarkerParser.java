package org.stianloader.picopip.marker;

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.RequirementParseException.Kind;

/**
 * Recursive descent parser for marker expressions.
 *
 * <pre>
 * expression := operand (("and" | "or") operand)*
 * operand    := "(" expression ")" | value operator value
 * value      := variable | quoted string
 * </pre>
 */
final class MarkerParser {

    private enum TokenType {
        CLOSE_PAREN,
        CONNECTIVE,
        END,
        IDENTIFIER,
        OPEN_PAREN,
        OPERATOR,
        STRING;
    }

    private static final class Token {
        private final int position;
        @NotNull
        private final TokenType type;
        @NotNull
        private final String value;

        Token(@NotNull TokenType type, @NotNull String value, int position) {
            this.type = type;
            this.value = value;
            this.position = position;
        }
    }

    @NotNull
    private final String source;
    @NotNull
    private final List<@NotNull Token> tokens;
    private int index;

    private MarkerParser(@NotNull String source) {
        this.source = source;
        this.tokens = MarkerParser.tokenize(source);
    }

    @NotNull
    static MarkerGroup parse(@NotNull String source) {
        MarkerParser parser = new MarkerParser(source);
        MarkerGroup group = parser.parseExpression();
        Token trailing = parser.peek();
        if (trailing.type != TokenType.END) {
            throw parser.error("Unexpected token '" + trailing.value + "' at position " + trailing.position);
        }
        return group;
    }

    @NotNull
    private static List<@NotNull Token> tokenize(@NotNull String source) {
        List<Token> tokens = new ArrayList<>();
        int length = source.length();
        int i = 0;
        while (i < length) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.OPEN_PAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.CLOSE_PAREN, ")", i++));
            } else if (c == '\'' || c == '"') {
                int end = source.indexOf(c, i + 1);
                if (end == -1) {
                    throw new RequirementParseException(Kind.MALFORMED_MARKER, source, "Unterminated string literal at position " + i);
                }
                tokens.add(new Token(TokenType.STRING, source.substring(i + 1, end), i));
                i = end + 1;
            } else if (c == '=' || c == '!' || c == '<' || c == '>' || c == '~') {
                int start = i;
                while (i < length && "=!<>~".indexOf(source.charAt(i)) != -1) {
                    i++;
                }
                String symbol = source.substring(start, i);
                if (MarkerOperator.fromSymbol(symbol) == null) {
                    throw new RequirementParseException(Kind.MALFORMED_MARKER, source, "Unknown operator '" + symbol + "' at position " + start);
                }
                tokens.add(new Token(TokenType.OPERATOR, symbol, start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < length && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_' || source.charAt(i) == '.')) {
                    i++;
                }
                String word = source.substring(start, i);
                if (word.equals("and") || word.equals("or")) {
                    tokens.add(new Token(TokenType.CONNECTIVE, word, start));
                } else if (word.equals("in")) {
                    tokens.add(new Token(TokenType.OPERATOR, "in", start));
                } else if (word.equals("not")) {
                    int afterNot = i;
                    while (afterNot < length && Character.isWhitespace(source.charAt(afterNot))) {
                        afterNot++;
                    }
                    if (!source.startsWith("in", afterNot) || (afterNot + 2 < length && Character.isLetterOrDigit(source.charAt(afterNot + 2)))) {
                        throw new RequirementParseException(Kind.MALFORMED_MARKER, source, "Expected 'in' after 'not' at position " + start);
                    }
                    tokens.add(new Token(TokenType.OPERATOR, "not in", start));
                    i = afterNot + 2;
                } else {
                    tokens.add(new Token(TokenType.IDENTIFIER, word, start));
                }
            } else {
                throw new RequirementParseException(Kind.MALFORMED_MARKER, source, "Unexpected character '" + c + "' at position " + i);
            }
        }
        tokens.add(new Token(TokenType.END, "<end>", length));
        return tokens;
    }

    @NotNull
    private RequirementParseException error(@NotNull String message) {
        return new RequirementParseException(Kind.MALFORMED_MARKER, this.source, message);
    }

    @NotNull
    private Token next() {
        Token token = this.tokens.get(this.index);
        if (token.type != TokenType.END) {
            this.index++;
        }
        return token;
    }

    @NotNull
    private MarkerComparison parseComparison() {
        Token lhs = this.next();
        Token op = this.next();
        Token rhs = this.next();
        if (lhs.type != TokenType.IDENTIFIER && lhs.type != TokenType.STRING) {
            throw this.error("Expected a variable or a string at position " + lhs.position + ", got '" + lhs.value + "'");
        }
        if (op.type != TokenType.OPERATOR) {
            throw this.error("Expected a comparison operator at position " + op.position + ", got '" + op.value + "'");
        }
        if (rhs.type != TokenType.IDENTIFIER && rhs.type != TokenType.STRING) {
            throw this.error("Expected a variable or a string at position " + rhs.position + ", got '" + rhs.value + "'");
        }
        if (lhs.type == rhs.type) {
            throw this.error("A comparison needs exactly one variable and one string literal, at position " + lhs.position);
        }

        MarkerOperator operator = MarkerOperator.fromSymbol(op.value);
        if (operator == null) {
            throw this.error("Unknown operator '" + op.value + "'");
        }

        boolean variableOnLeft = lhs.type == TokenType.IDENTIFIER;
        Token variableToken = variableOnLeft ? lhs : rhs;
        Token literalToken = variableOnLeft ? rhs : lhs;
        MarkerVariable variable = MarkerVariable.fromIdentifier(variableToken.value);
        if (variable == null) {
            throw this.error("Unknown marker variable '" + variableToken.value + "' at position " + variableToken.position);
        }

        try {
            return new MarkerComparison(variable, operator, literalToken.value, variableOnLeft);
        } catch (RequirementParseException e) {
            throw new RequirementParseException(Kind.MALFORMED_MARKER, this.source, e.getMessage(), e);
        }
    }

    @NotNull
    private MarkerGroup parseExpression() {
        List<MarkerNode> operands = new ArrayList<>();
        List<MarkerConnective> connectives = new ArrayList<>();
        operands.add(this.parseOperand());
        while (this.peek().type == TokenType.CONNECTIVE) {
            Token connective = this.next();
            connectives.add(connective.value.equals("and") ? MarkerConnective.AND : MarkerConnective.OR);
            operands.add(this.parseOperand());
        }
        return new MarkerGroup(operands, connectives);
    }

    @NotNull
    private MarkerNode parseOperand() {
        Token token = this.peek();
        if (token.type == TokenType.OPEN_PAREN) {
            this.next();
            MarkerGroup group = this.parseExpression();
            Token closing = this.next();
            if (closing.type != TokenType.CLOSE_PAREN) {
                throw this.error("Expected ')' at position " + closing.position + ", got '" + closing.value + "'");
            }
            return group;
        } else if (token.type == TokenType.END) {
            throw this.error("Unexpected end of marker");
        }
        return this.parseComparison();
    }

    @NotNull
    private Token peek() {
        return this.tokens.get(this.index);
    }
}
