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

import java.util.Arrays;

/**
 * Immutable view of one file's text with a line index.
 *
 * <p>Lines are 1-based, columns and offsets are 0-based. Line strings never
 * include their terminator; a trailing {@code \r} before {@code \n} is
 * treated as part of the terminator.</p>
 */
public final class SourceText {

    private final String text;
    private final int[] lineStarts;

    public SourceText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
        this.text = text;
        this.lineStarts = computeLineStarts(text);
    }

    private static int[] computeLineStarts(String text) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    public String getText() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public int getLineCount() {
        return lineStarts.length;
    }

    /**
     * Offset of the first character of the given 1-based line.
     */
    public int getLineStart(int line) {
        checkLine(line);
        return lineStarts[line - 1];
    }

    /**
     * Offset just past the last content character of the given line, i.e.
     * before its {@code \r\n} or {@code \n} terminator.
     */
    public int getLineEnd(int line) {
        checkLine(line);
        int end = line < lineStarts.length ? lineStarts[line] - 1 : text.length();
        if (end > lineStarts[line - 1] && text.charAt(end - 1) == '\r' && line < lineStarts.length) {
            end--;
        }
        return end;
    }

    public String getLine(int line) {
        return text.substring(getLineStart(line), getLineEnd(line));
    }

    /**
     * The literal run of spaces and tabs at the start of the given line.
     */
    public String lineIndent(int line) {
        int start = getLineStart(line);
        int end = getLineEnd(line);
        int i = start;
        while (i < end) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t') {
                break;
            }
            i++;
        }
        return text.substring(start, i);
    }

    /**
     * 1-based line containing the given offset. An offset equal to the text
     * length belongs to the last line.
     */
    public int lineOf(int offset) {
        checkOffset(offset);
        int index = Arrays.binarySearch(lineStarts, offset);
        if (index >= 0) {
            return index + 1;
        }
        return -index - 1;
    }

    public int columnOf(int offset) {
        return offset - lineStarts[lineOf(offset) - 1];
    }

    public SourcePosition positionOf(int offset) {
        return new SourcePosition(lineOf(offset), columnOf(offset));
    }

    /**
     * Offset of a 1-based line and 0-based column. Columns past the end of
     * the line are clamped to the line's end.
     */
    public int offsetOf(int line, int column) {
        int start = getLineStart(line);
        int limit = line < lineStarts.length ? lineStarts[line] - 1 : text.length();
        return Math.min(start + Math.max(column, 0), limit);
    }

    public String slice(int start, int end) {
        checkOffset(start);
        checkOffset(end);
        return text.substring(start, end);
    }

    public boolean containsNewline(int start, int end) {
        checkOffset(start);
        checkOffset(end);
        for (int i = start; i < end; i++) {
            if (text.charAt(i) == '\n') {
                return true;
            }
        }
        return false;
    }

    private void checkLine(int line) {
        if (line < 1 || line > lineStarts.length) {
            throw new IllegalArgumentException("Line " + line + " is outside 1.." + lineStarts.length);
        }
    }

    private void checkOffset(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("Offset " + offset + " is outside 0.." + text.length());
        }
    }
}
