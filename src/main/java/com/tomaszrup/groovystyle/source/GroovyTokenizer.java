////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovystyle.source;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits Groovy source into tokens.
 *
 * <p>The Groovy compiler does not expose its token stream, so this lexer
 * recognises just enough of the language to give every operator, delimiter
 * and literal a precise range. String literals of every flavour (single,
 * double, triple-quoted, slashy and dollar-slashy) become a single
 * {@link TokenType#STRING} token, including any {@code ${...}}
 * interpolation they contain. The lexer never fails: a character it does
 * not understand becomes a one-character punctuator and an unterminated
 * literal runs to the end of its line (or of the text, for multi-line
 * forms).</p>
 */
public final class GroovyTokenizer {

    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
            "abstract", "as", "assert", "boolean", "break", "byte", "case", "catch", "char", "class",
            "const", "continue", "def", "default", "do", "double", "else", "enum", "extends", "false",
            "final", "finally", "float", "for", "goto", "if", "implements", "import", "in", "instanceof",
            "int", "interface", "long", "native", "new", "non-sealed", "null", "package", "permits",
            "private", "protected", "public", "record", "return", "sealed", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "threadsafe", "throw", "throws", "trait",
            "transient", "true", "try", "var", "void", "volatile", "while", "yield"));

    /** Keywords after which a {@code /} is a division, not a slashy string. */
    private static final Set<String> VALUE_KEYWORDS = new HashSet<>(Arrays.asList(
            "this", "super", "true", "false", "null"));

    /** Multi-character operators, longest first so the first match wins. */
    private static final List<String> OPERATORS;

    static {
        List<String> operators = new ArrayList<>(Arrays.asList(
                ">>>=", "<=>", "===", "!==", "**=", "<<=", ">>=", ">>>", "..<", "==~",
                "?.", "*.", ".&", ".@", "::", "?:", "?=", "=~", "->", "++", "--", "&&", "||",
                "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "**",
                "<<", ">>", ".."));
        operators.sort((a, b) -> Integer.compare(b.length(), a.length()));
        OPERATORS = Collections.unmodifiableList(operators);
    }

    private final SourceText source;
    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private Token lastCodeToken;

    private GroovyTokenizer(SourceText source) {
        this.source = source;
        this.text = source.getText();
    }

    public static TokenStream tokenize(SourceText source) {
        GroovyTokenizer tokenizer = new GroovyTokenizer(source);
        tokenizer.run();
        return new TokenStream(tokenizer.tokens);
    }

    private void run() {
        int pos = 0;
        int length = text.length();
        if (text.startsWith("#!")) {
            pos = emit(TokenType.LINE_COMMENT, 0, lineEnd(0));
        }
        while (pos < length) {
            char c = text.charAt(pos);
            char next = charAt(pos + 1);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && next == '/') {
                pos = emit(TokenType.LINE_COMMENT, pos, lineEnd(pos));
            } else if (c == '/' && next == '*') {
                int close = text.indexOf("*/", pos + 2);
                pos = emit(TokenType.BLOCK_COMMENT, pos, close < 0 ? length : close + 2);
            } else if (c == '$' && next == '/') {
                pos = emit(TokenType.STRING, pos, scanDollarSlashy(pos));
            } else if (Character.isJavaIdentifierStart(c)) {
                pos = scanWord(pos);
            } else if (Character.isDigit(c)) {
                pos = emit(TokenType.NUMBER, pos, scanNumber(pos));
            } else if (c == '\'' || c == '"') {
                pos = emit(TokenType.STRING, pos, scanQuoted(pos));
            } else if (c == '/' && slashyAllowed()) {
                pos = emit(TokenType.STRING, pos, scanSlashy(pos));
            } else {
                pos = emit(TokenType.PUNCTUATOR, pos, scanOperator(pos));
            }
        }
    }

    private int scanWord(int pos) {
        int end = pos + 1;
        while (end < text.length() && Character.isJavaIdentifierPart(text.charAt(end))) {
            end++;
        }
        String word = text.substring(pos, end);
        if ("non".equals(word) && text.startsWith("-sealed", end)
                && !isIdentifierPart(end + "-sealed".length())) {
            return emit(TokenType.KEYWORD, pos, end + "-sealed".length());
        }
        return emit(KEYWORDS.contains(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER, pos, end);
    }

    private int scanNumber(int pos) {
        int end = pos;
        char first = text.charAt(pos);
        char second = charAt(pos + 1);
        if (first == '0' && (second == 'x' || second == 'X' || second == 'b' || second == 'B')) {
            end = pos + 2;
            while (end < text.length() && (Character.digit(text.charAt(end), 16) >= 0 || text.charAt(end) == '_')) {
                end++;
            }
        } else {
            end = skipDigits(pos);
            // a single '.' followed by a digit is a fraction; ".." is a range
            if (charAt(end) == '.' && Character.isDigit(charAt(end + 1))) {
                end = skipDigits(end + 1);
            }
            char e = charAt(end);
            if (e == 'e' || e == 'E') {
                int exponent = end + 1;
                if (charAt(exponent) == '+' || charAt(exponent) == '-') {
                    exponent++;
                }
                if (Character.isDigit(charAt(exponent))) {
                    end = skipDigits(exponent);
                }
            }
        }
        if ("lLiIgGdDfF".indexOf(charAt(end)) >= 0 && charAt(end) != 0) {
            end++;
        }
        return end;
    }

    private int skipDigits(int pos) {
        int end = pos;
        while (end < text.length() && (Character.isDigit(text.charAt(end)) || text.charAt(end) == '_')) {
            end++;
        }
        return end;
    }

    /**
     * Scans a quoted literal starting at {@code pos} and returns the offset
     * just past it.
     */
    private int scanQuoted(int pos) {
        char quote = text.charAt(pos);
        boolean interpolated = quote == '"';
        if (charAt(pos + 1) == quote && charAt(pos + 2) == quote) {
            String delimiter = String.valueOf(quote).repeat(3);
            int i = pos + 3;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '\\') {
                    i += 2;
                } else if (interpolated && c == '$' && charAt(i + 1) == '{') {
                    i = scanInterpolation(i + 2);
                } else if (text.startsWith(delimiter, i)) {
                    return i + 3;
                } else {
                    i++;
                }
            }
            return text.length();
        }
        int i = pos + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (interpolated && c == '$' && charAt(i + 1) == '{') {
                i = scanInterpolation(i + 2);
            } else if (c == quote) {
                return i + 1;
            } else if (c == '\n') {
                return i;
            } else {
                i++;
            }
        }
        return text.length();
    }

    private int scanSlashy(int pos) {
        int i = pos + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && charAt(i + 1) == '/') {
                i += 2;
            } else if (c == '$' && charAt(i + 1) == '{') {
                i = scanInterpolation(i + 2);
            } else if (c == '/') {
                return i + 1;
            } else {
                i++;
            }
        }
        return text.length();
    }

    private int scanDollarSlashy(int pos) {
        int i = pos + 2;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '$' && (charAt(i + 1) == '$' || charAt(i + 1) == '/')) {
                i += 2;
            } else if (c == '$' && charAt(i + 1) == '{') {
                i = scanInterpolation(i + 2);
            } else if (c == '/' && charAt(i + 1) == '$') {
                return i + 2;
            } else {
                i++;
            }
        }
        return text.length();
    }

    /**
     * Skips the body of a {@code ${...}} placeholder; {@code pos} is just
     * after the opening brace. Nested braces and strings are balanced.
     */
    private int scanInterpolation(int pos) {
        int depth = 1;
        int i = pos;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
                i++;
            } else if (c == '}') {
                depth--;
                i++;
                if (depth == 0) {
                    return i;
                }
            } else if (c == '\'' || c == '"') {
                i = scanQuoted(i);
            } else {
                i++;
            }
        }
        return text.length();
    }

    private int scanOperator(int pos) {
        if (text.charAt(pos) == '!') {
            for (String word : new String[] {"instanceof", "in"}) {
                int end = pos + 1 + word.length();
                if (text.startsWith(word, pos + 1) && !isIdentifierPart(end)) {
                    return end;
                }
            }
        }
        for (String operator : OPERATORS) {
            if (text.startsWith(operator, pos)) {
                return pos + operator.length();
            }
        }
        return pos + 1;
    }

    /**
     * A {@code /} opens a slashy string only where an operand is expected,
     * i.e. not after a value-like token.
     */
    private boolean slashyAllowed() {
        if (lastCodeToken == null) {
            return true;
        }
        switch (lastCodeToken.getType()) {
            case IDENTIFIER:
            case NUMBER:
            case STRING:
                return false;
            case KEYWORD:
                return !VALUE_KEYWORDS.contains(lastCodeToken.getText());
            default:
                String last = lastCodeToken.getText();
                return !(")".equals(last) || "]".equals(last) || "}".equals(last)
                        || "++".equals(last) || "--".equals(last));
        }
    }

    private int emit(TokenType type, int start, int end) {
        SourcePosition startPosition = source.positionOf(start);
        SourcePosition endPosition = source.positionOf(end);
        Token token = new Token(type, text.substring(start, end), start, end,
                startPosition.getLine(), startPosition.getColumn(),
                endPosition.getLine(), endPosition.getColumn());
        tokens.add(token);
        if (!type.isComment()) {
            lastCodeToken = token;
        }
        return end;
    }

    private int lineEnd(int pos) {
        int newline = text.indexOf('\n', pos);
        if (newline < 0) {
            return text.length();
        }
        return newline > pos && text.charAt(newline - 1) == '\r' ? newline - 1 : newline;
    }

    private boolean isIdentifierPart(int pos) {
        return pos < text.length() && Character.isJavaIdentifierPart(text.charAt(pos));
    }

    private char charAt(int pos) {
        return pos >= 0 && pos < text.length() ? text.charAt(pos) : 0;
    }
}
