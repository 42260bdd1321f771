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
package com.tomaszrup.groovystyle.providers;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

import com.tomaszrup.groovystyle.source.SourcePosition;
import com.tomaszrup.groovystyle.source.SourceText;
import com.tomaszrup.groovystyle.source.TextRange;

/**
 * Conversions between source offsets and LSP positions (0-based lines).
 */
final class LspPositions {

    private LspPositions() {
    }

    static Position toPosition(SourcePosition position) {
        return new Position(position.getLine() - 1, position.getColumn());
    }

    static Position toPosition(SourceText source, int offset) {
        return toPosition(source.positionOf(offset));
    }

    static Range toRange(SourceText source, TextRange range) {
        return new Range(toPosition(source, range.getStart()), toPosition(source, range.getEnd()));
    }
}
