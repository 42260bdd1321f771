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

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.tomaszrup.groovystyle.source.Indentation;
import com.tomaszrup.groovystyle.source.TextRange;
import com.tomaszrup.groovystyle.source.Token;
import com.tomaszrup.groovystyle.tree.ChildRole;
import com.tomaszrup.groovystyle.tree.SyntaxKind;
import com.tomaszrup.groovystyle.tree.SyntaxNode;

/**
 * Moves a long lambda's expression body onto its own line.
 *
 * <pre>
 * source.switchMap((username) -&gt;
 *     from(checkAvailability(username)))
 * </pre>
 *
 * <p>Only expression bodies are checked; blocks and map/list literal bodies
 * are left alone. A body that already starts below the arrow is never
 * reported, whatever its length.</p>
 */
public class LambdaBodyNewlineRule implements StyleRule {

    public static final String ID = "lambda-body-newline";
    public static final String MAX_LENGTH_OPTION = "maxLength";
    public static final int DEFAULT_MAX_LENGTH = 40;

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Put a lambda's expression body on a new line when the lambda is longer than maxLength";
    }

    @Override
    public List<RuleOptionSpec> getOptionSpecs() {
        return Collections.singletonList(RuleOptionSpec.positiveInteger(MAX_LENGTH_OPTION, DEFAULT_MAX_LENGTH,
                "Longest lambda (or body) in characters that may stay on the arrow's line"));
    }

    @Override
    public Map<SyntaxKind, NodeHandler> createHandlers(RuleContext context) {
        int maxLength = context.getOptions().getInt(MAX_LENGTH_OPTION);
        Map<SyntaxKind, NodeHandler> handlers = new EnumMap<>(SyntaxKind.class);
        handlers.put(SyntaxKind.LAMBDA, node -> checkLambda(context, node, maxLength));
        return handlers;
    }

    private void checkLambda(RuleContext context, SyntaxNode lambda, int maxLength) {
        SyntaxNode body = context.getTree().child(lambda, ChildRole.BODY);
        if (body == null || body.is(SyntaxKind.BLOCK) || body.getKind().isCollectionLiteral()) {
            return;
        }
        Token bodyStart = context.firstTokenOf(body);
        if (bodyStart == null) {
            return;
        }
        Token arrow = context.getTokens().findBefore(bodyStart.getStart(), lambda.getStart(), t -> t.is("->"));
        if (arrow == null || bodyStart.getStartLine() > arrow.getEndLine()) {
            return;
        }
        int effectiveLength = Math.max(lambda.length(), body.length());
        if (effectiveLength <= maxLength) {
            return;
        }
        boolean commented = context.getTokens().hasCommentBetween(arrow.getEnd(), bodyStart.getStart());
        Indentation indentation = context.getIndentation();
        String message = "Lambda body should start on a new line (" + effectiveLength + " > " + maxLength
                + " characters)";
        context.report(body, message, commented ? null : fixer -> {
            int depth = indentation.depth(context.lineIndent(arrow.getStartLine())) + 1;
            TextRange gap = new TextRange(arrow.getEnd(), bodyStart.getStart());
            // the depth is stale if another fix re-indents or splits the arrow's line
            TextRange arrowLine = new TextRange(context.getSourceText().getLineStart(arrow.getStartLine()),
                    arrow.getStart());
            return fixer.replaceRange(gap, "\n" + indentation.expectedIndentString(depth)).dependingOn(arrowLine);
        });
    }
}
