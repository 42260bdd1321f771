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
package com.tomaszrup.groovystyle.tree;

import com.tomaszrup.groovystyle.source.SourceText;
import com.tomaszrup.groovystyle.source.TokenStream;

/**
 * Everything rules get to see of one file: its text, tokens and syntax tree.
 * Built once per check pass and discarded afterwards.
 */
public final class ParsedSource {

    private final String name;
    private final SourceText sourceText;
    private final TokenStream tokens;
    private final SyntaxTree tree;

    public ParsedSource(String name, SourceText sourceText, TokenStream tokens, SyntaxTree tree) {
        this.name = name;
        this.sourceText = sourceText;
        this.tokens = tokens;
        this.tree = tree;
    }

    public String getName() {
        return name;
    }

    public SourceText getSourceText() {
        return sourceText;
    }

    public TokenStream getTokens() {
        return tokens;
    }

    public SyntaxTree getTree() {
        return tree;
    }
}
