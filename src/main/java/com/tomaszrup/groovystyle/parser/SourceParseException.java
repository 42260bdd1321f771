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
package com.tomaszrup.groovystyle.parser;

/**
 * Thrown when a source file does not get through the Groovy compiler's
 * conversion phase. Carries the first reported error's position when the
 * compiler provides one ({@code -1} otherwise).
 */
public class SourceParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String sourceName;
    private final int line;
    private final int column;

    public SourceParseException(String sourceName, String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }

    public String getSourceName() {
        return sourceName;
    }

    /** 1-based line, or {@code -1}. */
    public int getLine() {
        return line;
    }

    /** 1-based column, or {@code -1}. */
    public int getColumn() {
        return column;
    }
}
