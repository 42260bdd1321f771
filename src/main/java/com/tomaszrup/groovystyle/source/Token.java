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

/**
 * A lexical token with its half-open offset range and line/column bounds.
 * Lines are 1-based, columns 0-based; the end position is exclusive.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int start;
    private final int end;
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;

    public Token(TokenType type, String text, int start, int end,
            int startLine, int startColumn, int endLine, int endColumn) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.end = end;
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public TextRange getRange() {
        return new TextRange(start, end);
    }

    /**
     * {@code true} for a punctuator or keyword with exactly this text.
     * Identifier, number and string tokens never match.
     */
    public boolean is(String value) {
        return (type == TokenType.PUNCTUATOR || type == TokenType.KEYWORD) && text.equals(value);
    }

    public boolean isComment() {
        return type.isComment();
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + startLine + ":" + startColumn;
    }
}
