package com.memflow.memflow_backend.engine.expression;

import com.memflow.memflow_backend.exception.InvalidExpressionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression source into tokens. Anything outside the small operator set
 * (assignment, bitwise operators, statement separators) is rejected here.
 */
final class ExpressionLexer {

    // Longest first so "**" wins over "*"
    private static final String[] OPERATORS = {
            "**", "//", "==", "!=", "<=", ">=",
            "+", "-", "*", "/", "%", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", "|"
    };

    private final String source;
    private int pos;

    ExpressionLexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.END, "", null, pos));
                return tokens;
            }
            char c = source.charAt(pos);
            if (Character.isDigit(c)) {
                tokens.add(readNumber());
            } else if (c == '\'' || c == '"') {
                tokens.add(readString(c));
            } else if (Character.isLetter(c) || c == '_') {
                tokens.add(readName());
            } else {
                tokens.add(readOperator());
            }
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private Token readNumber() {
        int start = pos;
        boolean floating = false;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            floating = true;
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) pos++;
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                floating = true;
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
            } else {
                pos = mark;
            }
        }
        String text = source.substring(start, pos);
        try {
            Object value = floating ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
            return new Token(TokenType.NUMBER, text, value, start);
        } catch (NumberFormatException e) {
            throw new InvalidExpressionException("Number out of range: " + text, source, start);
        }
    }

    private Token readString(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == quote) {
                pos++;
                return new Token(TokenType.STRING, source.substring(start, pos), sb.toString(), start);
            }
            if (c == '\\' && pos + 1 < source.length()) {
                char next = source.charAt(pos + 1);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '\\' -> sb.append('\\');
                    case '\'' -> sb.append('\'');
                    case '"' -> sb.append('"');
                    default -> sb.append('\\').append(next);
                }
                pos += 2;
                continue;
            }
            sb.append(c);
            pos++;
        }
        throw new InvalidExpressionException("Unterminated string literal", source, start);
    }

    private Token readName() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        String text = source.substring(start, pos);
        return new Token(TokenType.NAME, text, text, start);
    }

    private Token readOperator() {
        int start = pos;
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                pos += op.length();
                return new Token(TokenType.OPERATOR, op, op, start);
            }
        }
        char c = source.charAt(pos);
        if (c == '=' || source.startsWith(":=", pos)) {
            throw new InvalidExpressionException("Assignment is not allowed", source, start);
        }
        if (c == ';') {
            throw new InvalidExpressionException("Multiple statements are not allowed", source, start);
        }
        throw new InvalidExpressionException("Unexpected character '" + c + "'", source, start);
    }
}
