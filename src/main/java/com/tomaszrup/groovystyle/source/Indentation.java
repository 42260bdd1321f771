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
 * Normalizes leading whitespace to an integer depth and back.
 *
 * <p>One tab is one unit. A run of spaces contributes
 * {@code run / width} units; a remainder that does not fill a whole unit is
 * truncated, so two or six leading spaces count as zero and one unit with a
 * width of four.</p>
 */
public final class Indentation {

    public static final int DEFAULT_WIDTH = 4;

    private static final Indentation DEFAULT = new Indentation(IndentStyle.TAB, DEFAULT_WIDTH);

    private final IndentStyle style;
    private final int width;
    private final String unit;

    public Indentation(IndentStyle style, int width) {
        if (style == null) {
            throw new IllegalArgumentException("style must not be null");
        }
        if (width < 1) {
            throw new IllegalArgumentException("width must be positive: " + width);
        }
        this.style = style;
        this.width = width;
        this.unit = style == IndentStyle.TAB ? "\t" : " ".repeat(width);
    }

    /** Tabs, with four spaces counting as one unit. */
    public static Indentation defaults() {
        return DEFAULT;
    }

    public IndentStyle getStyle() {
        return style;
    }

    public int getWidth() {
        return width;
    }

    public String unit() {
        return unit;
    }

    public int depth(String indent) {
        int depth = 0;
        int spaces = 0;
        for (int i = 0; i < indent.length(); i++) {
            char c = indent.charAt(i);
            if (c == '\t') {
                depth += spaces / width + 1;
                spaces = 0;
            } else if (c == ' ') {
                spaces++;
            }
        }
        return depth + spaces / width;
    }

    public String expectedIndentString(int depth) {
        if (depth <= 0) {
            return "";
        }
        return unit.repeat(depth);
    }

    /**
     * {@code base} followed by {@code units} indentation units. The base is
     * kept verbatim even when it uses the other whitespace character.
     */
    public String indentFrom(String base, int units) {
        return base + expectedIndentString(units);
    }

    @Override
    public String toString() {
        return style == IndentStyle.TAB ? "tab" : width + " spaces";
    }
}
