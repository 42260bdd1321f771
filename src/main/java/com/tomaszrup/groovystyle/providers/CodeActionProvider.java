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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.CodeActionKind;
import org.eclipse.lsp4j.CodeActionParams;
import org.eclipse.lsp4j.Command;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;

import com.tomaszrup.groovystyle.engine.CheckResult;
import com.tomaszrup.groovystyle.engine.StyleChecker;
import com.tomaszrup.groovystyle.rules.Violation;
import com.tomaszrup.groovystyle.source.SourceText;

/**
 * Quick fixes for style diagnostics, plus a {@code source.fixAll} action.
 *
 * <p>Diagnostics are matched back to violations of a fresh check by rule id
 * and range, so stale diagnostics from an older document version produce no
 * action.</p>
 */
public class CodeActionProvider {

	static final String FIX_ALL_TITLE = "Fix all Groovy style issues";

	private final StyleChecker checker;

	public CodeActionProvider(StyleChecker checker) {
		this.checker = checker;
	}

	public List<Either<Command, CodeAction>> provideCodeActions(CodeActionParams params, String sourceText) {
		List<Either<Command, CodeAction>> actions = new ArrayList<>();
		if (sourceText == null) {
			return actions;
		}
		String uri = params.getTextDocument().getUri();
		CheckResult result = checker.check(uri, sourceText);
		if (!result.isParsed() || !result.hasFixableViolations()) {
			return actions;
		}
		if (isKindRequested(params, CodeActionKind.QuickFix)) {
			SourceText source = new SourceText(sourceText);
			List<Diagnostic> diagnostics = params.getContext() != null
					? params.getContext().getDiagnostics() : Collections.emptyList();
			for (Diagnostic diagnostic : diagnostics) {
				Violation violation = findViolation(result, diagnostic);
				if (violation != null && violation.isFixable()) {
					actions.add(Either.forRight(quickFix(uri, source, diagnostic, violation)));
				}
			}
		}
		if (isKindRequested(params, CodeActionKind.SourceFixAll)) {
			CodeAction fixAll = fixAll(uri, sourceText);
			if (fixAll != null) {
				actions.add(Either.forRight(fixAll));
			}
		}
		return actions;
	}

	private CodeAction quickFix(String uri, SourceText source, Diagnostic diagnostic, Violation violation) {
		TextEdit edit = new TextEdit(LspPositions.toRange(source, violation.getFix().getRange()),
				violation.getFix().getReplacement());
		CodeAction action = new CodeAction("Fix: " + violation.getMessage());
		action.setKind(CodeActionKind.QuickFix);
		action.setDiagnostics(Collections.singletonList(diagnostic));
		action.setIsPreferred(true);
		action.setEdit(workspaceEdit(uri, Collections.singletonList(edit)));
		return action;
	}

	private CodeAction fixAll(String uri, String sourceText) {
		List<TextEdit> edits = new FormattingProvider(checker).provideFormatting(uri, sourceText);
		if (edits.isEmpty()) {
			return null;
		}
		CodeAction action = new CodeAction(FIX_ALL_TITLE);
		action.setKind(CodeActionKind.SourceFixAll);
		action.setEdit(workspaceEdit(uri, edits));
		return action;
	}

	private static WorkspaceEdit workspaceEdit(String uri, List<TextEdit> edits) {
		Map<String, List<TextEdit>> changes = new HashMap<>();
		changes.put(uri, edits);
		return new WorkspaceEdit(changes);
	}

	private static Violation findViolation(CheckResult result, Diagnostic diagnostic) {
		if (!DiagnosticsProvider.SOURCE.equals(diagnostic.getSource()) || diagnostic.getCode() == null
				|| !diagnostic.getCode().isLeft()) {
			return null;
		}
		String ruleId = diagnostic.getCode().getLeft();
		for (Violation violation : result.getViolations()) {
			if (violation.getRuleId().equals(ruleId)
					&& DiagnosticsProvider.toDiagnostic(violation).getRange().equals(diagnostic.getRange())) {
				return violation;
			}
		}
		return null;
	}

	private static boolean isKindRequested(CodeActionParams params, String kind) {
		if (params.getContext() == null || params.getContext().getOnly() == null
				|| params.getContext().getOnly().isEmpty()) {
			return true;
		}
		for (String only : params.getContext().getOnly()) {
			if (kind.equals(only) || kind.startsWith(only + ".")) {
				return true;
			}
		}
		return false;
	}
}
