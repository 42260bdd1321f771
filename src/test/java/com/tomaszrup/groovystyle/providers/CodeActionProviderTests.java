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

import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.CodeActionContext;
import org.eclipse.lsp4j.CodeActionKind;
import org.eclipse.lsp4j.CodeActionParams;
import org.eclipse.lsp4j.Command;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovystyle.StyleTestSupport;
import com.tomaszrup.groovystyle.config.StyleConfiguration;
import com.tomaszrup.groovystyle.engine.StyleChecker;

class CodeActionProviderTests {

	private static final String URI = "file:///workspace/Test.groovy";
	private static final String TEXT = "def user = repo.getById(id)";

	private final StyleChecker checker = StyleTestSupport.checker(StyleConfiguration.defaults());
	private final CodeActionProvider provider = new CodeActionProvider(checker);

	private List<Diagnostic> diagnostics(String text) {
		return new DiagnosticsProvider().provideDiagnostics(checker.check(URI, text));
	}

	private static CodeActionParams params(List<Diagnostic> diagnostics, List<String> only) {
		CodeActionContext context = new CodeActionContext(diagnostics);
		context.setOnly(only);
		return new CodeActionParams(new TextDocumentIdentifier(URI),
				new Range(new Position(0, 0), new Position(0, 0)), context);
	}

	@Test
	void testQuickFixAndFixAll() {
		List<Diagnostic> diagnostics = diagnostics(TEXT);
		List<Either<Command, CodeAction>> actions = provider.provideCodeActions(params(diagnostics, null), TEXT);
		Assertions.assertEquals(2, actions.size());

		CodeAction quickFix = actions.get(0).getRight();
		Assertions.assertEquals(CodeActionKind.QuickFix, quickFix.getKind());
		Assertions.assertEquals("Fix: Expected newline after '='", quickFix.getTitle());
		Assertions.assertTrue(quickFix.getIsPreferred());
		Assertions.assertEquals(diagnostics, quickFix.getDiagnostics());
		List<TextEdit> edits = quickFix.getEdit().getChanges().get(URI);
		Assertions.assertEquals(1, edits.size());
		Assertions.assertEquals(new Position(0, 10), edits.get(0).getRange().getStart());
		Assertions.assertEquals(new Position(0, 11), edits.get(0).getRange().getEnd());
		Assertions.assertEquals("\n\t", edits.get(0).getNewText());

		CodeAction fixAll = actions.get(1).getRight();
		Assertions.assertEquals(CodeActionKind.SourceFixAll, fixAll.getKind());
		Assertions.assertEquals(CodeActionProvider.FIX_ALL_TITLE, fixAll.getTitle());
		Assertions.assertEquals("def user =\n\trepo.getById(id)",
				fixAll.getEdit().getChanges().get(URI).get(0).getNewText());
	}

	@Test
	void testOnlyQuickFixesRequested() {
		List<Either<Command, CodeAction>> actions = provider.provideCodeActions(
				params(diagnostics(TEXT), Collections.singletonList(CodeActionKind.QuickFix)), TEXT);
		Assertions.assertEquals(1, actions.size());
		Assertions.assertEquals(CodeActionKind.QuickFix, actions.get(0).getRight().getKind());
	}

	@Test
	void testOnlySourceActionsRequested() {
		List<Either<Command, CodeAction>> actions = provider.provideCodeActions(
				params(diagnostics(TEXT), Collections.singletonList(CodeActionKind.Source)), TEXT);
		Assertions.assertEquals(1, actions.size());
		Assertions.assertEquals(CodeActionKind.SourceFixAll, actions.get(0).getRight().getKind());
	}

	@Test
	void testStaleDiagnosticHasNoQuickFix() {
		Diagnostic stale = diagnostics(TEXT).get(0);
		stale.setRange(new Range(new Position(3, 0), new Position(3, 4)));
		List<Either<Command, CodeAction>> actions = provider.provideCodeActions(
				params(Collections.singletonList(stale), null), TEXT);
		Assertions.assertEquals(1, actions.size());
		Assertions.assertEquals(CodeActionKind.SourceFixAll, actions.get(0).getRight().getKind());
	}

	@Test
	void testCleanDocumentHasNoActions() {
		String clean = "def user =\n\trepo.getById(id)";
		Assertions.assertTrue(provider.provideCodeActions(params(diagnostics(clean), null), clean).isEmpty());
	}

	@Test
	void testMissingTextHasNoActions() {
		Assertions.assertTrue(provider.provideCodeActions(params(Collections.emptyList(), null), null).isEmpty());
	}
}
