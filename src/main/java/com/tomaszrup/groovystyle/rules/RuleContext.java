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
package com.tomaszrup.groovystyle.rules;

import java.util.function.Consumer;

import com.tomaszrup.groovystyle.source.Indentation;
import com.tomaszrup.groovystyle.source.SourceText;
import com.tomaszrup.groovystyle.source.TextRange;
import com.tomaszrup.groovystyle.source.Token;
import com.tomaszrup.groovystyle.source.TokenStream;
import com.tomaszrup.groovystyle.tree.ChainAnalyzer;
import com.tomaszrup.groovystyle.tree.ParsedSource;
import com.tomaszrup.groovystyle.tree.SyntaxNode;
import com.tomaszrup.groovystyle.tree.SyntaxTree;

/**
 * Per-file, per-rule view handed to {@link StyleRule#createHandlers}: read
 * access to the text, tokens and tree, plus the violation sink.
 */
public final class RuleContext {

    private final String ruleId;
    private final ParsedSource source;
    private final Indentation indentation;
    private final RuleOptions options;
    private final ChainAnalyzer chains;
    private final Consumer<Violation> sink;
    private final Fixer fixer;

    public RuleContext(String ruleId, ParsedSource source, Indentation indentation, RuleOptions options,
            ChainAnalyzer chains, Consumer<Violation> sink) {
        this.ruleId = ruleId;
        this.source = source;
        this.indentation = indentation;
        this.options = options;
        this.chains = chains;
        this.sink = sink;
        this.fixer = new Fixer(source.getSourceText());
    }

    public String getRuleId() {
        return ruleId;
    }

    public SourceText getSourceText() {
        return source.getSourceText();
    }

    public TokenStream getTokens() {
        return source.getTokens();
    }

    public SyntaxTree getTree() {
        return source.getTree();
    }

    public Indentation getIndentation() {
        return indentation;
    }

    public RuleOptions getOptions() {
        return options;
    }

    public ChainAnalyzer getChains() {
        return chains;
    }

    /** First code token inside the node's span, or {@code null}. */
    public Token firstTokenOf(SyntaxNode node) {
        return getTokens().firstTokenIn(node.getStart(), node.getEnd());
    }

    /** Last code token inside the node's span, or {@code null}. */
    public Token lastTokenOf(SyntaxNode node) {
        return getTokens().lastTokenIn(node.getStart(), node.getEnd());
    }

    public String lineIndent(int line) {
        return getSourceText().lineIndent(line);
    }

    public int lineOf(int offset) {
        return getSourceText().lineOf(offset);
    }

    public void report(SyntaxNode anchor, String message, FixFunction fix) {
        report(anchor.getRange(), message, fix);
    }

    public void report(Token anchor, String message, FixFunction fix) {
        report(anchor.getRange(), message, fix);
    }

    /**
     * Records a violation. The fix, if any, is computed right away against
     * the text the violation was found in.
     */
    public void report(TextRange anchor, String message, FixFunction fix) {
        SourceText text = getSourceText();
        Fix computed = fix == null ? null : fix.apply(fixer);
        sink.accept(new Violation(ruleId, anchor, text.positionOf(anchor.getStart()),
                text.positionOf(anchor.getEnd()), message, computed));
    }
}
