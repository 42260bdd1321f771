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
package com.tomaszrup.groovystyle.engine;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovystyle.config.StyleConfiguration;
import com.tomaszrup.groovystyle.rules.NodeHandler;
import com.tomaszrup.groovystyle.rules.RuleContext;
import com.tomaszrup.groovystyle.rules.StyleRule;
import com.tomaszrup.groovystyle.rules.Violation;
import com.tomaszrup.groovystyle.source.SourcePosition;
import com.tomaszrup.groovystyle.tree.ChainAnalyzer;
import com.tomaszrup.groovystyle.tree.ParsedSource;
import com.tomaszrup.groovystyle.tree.SyntaxKind;
import com.tomaszrup.groovystyle.tree.SyntaxNode;

/**
 * Runs the enabled rules over one parsed file.
 *
 * <p>Handlers of all rules are merged into one kind-to-handlers table and
 * the tree is walked once in pre-order. A handler that throws is logged and
 * skipped so the rest of the file is still checked.</p>
 */
public class StyleEngine {

    private static final Logger logger = LoggerFactory.getLogger(StyleEngine.class);

    private final RuleRegistry registry;
    private final StyleConfiguration configuration;

    public StyleEngine(RuleRegistry registry, StyleConfiguration configuration) {
        this.registry = registry;
        this.configuration = configuration;
    }

    public StyleConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * @return violations sorted in document order
     */
    public List<Violation> lint(ParsedSource source) {
        List<Violation> violations = new ArrayList<>();
        ChainAnalyzer chains = new ChainAnalyzer(source.getTree());
        Map<SyntaxKind, List<Registration>> dispatch = new EnumMap<>(SyntaxKind.class);
        for (StyleRule rule : registry.getRules()) {
            if (!configuration.isRuleEnabled(rule.getId())) {
                continue;
            }
            RuleContext context = new RuleContext(rule.getId(), source, configuration.getIndentation(),
                    configuration.getRuleOptions(rule), chains, violations::add);
            for (Map.Entry<SyntaxKind, NodeHandler> entry : rule.createHandlers(context).entrySet()) {
                dispatch.computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
                        .add(new Registration(rule.getId(), entry.getValue()));
            }
        }
        if (dispatch.isEmpty()) {
            return violations;
        }
        for (SyntaxNode node : source.getTree().preOrder()) {
            List<Registration> registrations = dispatch.get(node.getKind());
            if (registrations == null) {
                continue;
            }
            for (Registration registration : registrations) {
                try {
                    registration.handler.handle(node);
                } catch (RuntimeException e) {
                    SourcePosition position = source.getSourceText().positionOf(node.getStart());
                    logger.warn("Rule {} failed on {} at {}:{}, skipping node: {}", registration.ruleId,
                            node.getKind(), source.getName(), position, e.getMessage(), e);
                }
            }
        }
        violations.sort(Violation.DOCUMENT_ORDER);
        logger.debug("{}: {} violation(s)", source.getName(), violations.size());
        return violations;
    }

    private static final class Registration {
        final String ruleId;
        final NodeHandler handler;

        Registration(String ruleId, NodeHandler handler) {
            this.ruleId = ruleId;
            this.handler = handler;
        }
    }
}
