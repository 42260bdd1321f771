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
package com.tomaszrup.groovystyle;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.CodeActionContext;
import org.eclipse.lsp4j.CodeActionParams;
import org.eclipse.lsp4j.Command;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.FileChangeType;
import org.eclipse.lsp4j.FileEvent;
import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonParser;
import com.tomaszrup.groovystyle.config.StyleConfigurationLoader;
import com.tomaszrup.groovystyle.engine.RuleRegistry;
import com.tomaszrup.groovystyle.rules.AssignmentNewlineRule;

/**
 * Tests for {@link StyleServices}: document lifecycle, debounced linting,
 * configuration layering and the code action and formatting requests.
 */
class StyleServicesTests {

	private static final String URI = "file:///workspace/Build.groovy";
	private static final String DIRTY = "def user = repo.getById(id)\n";
	private static final String CLEAN = "def user =\n\trepo.getById(id)\n";

	private ExecutorPools pools;
	private StyleServices services;
	private List<PublishDiagnosticsParams> published;

	@TempDir
	Path workspace;

	@BeforeEach
	void setup() {
		pools = new ExecutorPools(1);
		services = new StyleServices(RuleRegistry.builtIn(), pools);
		services.setDebounceDelayMs(0);
		published = new CopyOnWriteArrayList<>();
		services.connect(new TestLanguageClient(published::add));
	}

	@AfterEach
	void tearDown() {
		services.shutdown();
		pools.shutdownAll();
	}

	private void open(String text) {
		DidOpenTextDocumentParams params = new DidOpenTextDocumentParams();
		params.setTextDocument(new TextDocumentItem(URI, "groovy", 1, text));
		services.didOpen(params);
	}

	private void change(String text) {
		TextDocumentContentChangeEvent event = new TextDocumentContentChangeEvent();
		event.setText(text);
		DidChangeTextDocumentParams params = new DidChangeTextDocumentParams();
		params.setTextDocument(new VersionedTextDocumentIdentifier(URI, 2));
		params.setContentChanges(Collections.singletonList(event));
		services.didChange(params);
	}

	private PublishDiagnosticsParams lastPublished() {
		Assertions.assertFalse(published.isEmpty(), "Diagnostics should have been published");
		return published.get(published.size() - 1);
	}

	private void writeConfig(String json) throws IOException {
		Files.write(workspace.resolve(StyleConfigurationLoader.CONFIG_FILE_NAME),
				json.getBytes(StandardCharsets.UTF_8));
	}

	// --- document lifecycle

	@Test
	void testDidOpenPublishesDiagnostics() {
		open(DIRTY);
		PublishDiagnosticsParams params = lastPublished();
		Assertions.assertEquals(URI, params.getUri());
		Assertions.assertEquals(1, params.getDiagnostics().size());
		Assertions.assertEquals(AssignmentNewlineRule.ID, params.getDiagnostics().get(0).getCode().getLeft());
	}

	@Test
	void testDidChangeRelints() {
		open(DIRTY);
		change(CLEAN);
		Assertions.assertTrue(lastPublished().getDiagnostics().isEmpty());
	}

	@Test
	void testDidChangeIsDebounced() throws Exception {
		services.setDebounceDelayMs(50);
		open(CLEAN);
		published.clear();
		change(DIRTY);
		change(CLEAN);
		change(DIRTY);
		long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(5);
		while (published.isEmpty() && System.currentTimeMillis() < deadline) {
			Thread.sleep(10);
		}
		Thread.sleep(200);
		Assertions.assertEquals(1, published.size(), "Rapid changes should produce a single lint");
		Assertions.assertEquals(1, published.get(0).getDiagnostics().size());
	}

	@Test
	void testUnparseableDocumentPublishesNoDiagnostics() {
		open("def x = (");
		Assertions.assertTrue(lastPublished().getDiagnostics().isEmpty());
	}

	@Test
	void testDidSaveWithTextRelints() {
		open(CLEAN);
		DidSaveTextDocumentParams params = new DidSaveTextDocumentParams(new TextDocumentIdentifier(URI), DIRTY);
		services.didSave(params);
		Assertions.assertEquals(1, lastPublished().getDiagnostics().size());
	}

	@Test
	void testDidCloseClearsDiagnostics() {
		open(DIRTY);
		DidCloseTextDocumentParams params = new DidCloseTextDocumentParams();
		params.setTextDocument(new TextDocumentIdentifier(URI));
		services.didClose(params);
		PublishDiagnosticsParams last = lastPublished();
		Assertions.assertEquals(URI, last.getUri());
		Assertions.assertTrue(last.getDiagnostics().isEmpty());
	}

	// --- configuration

	@Test
	void testDidChangeConfigurationRelintsOpenDocuments() {
		open(DIRTY);
		services.didChangeConfiguration(new DidChangeConfigurationParams(JsonParser.parseString(
				"{\"groovyStyle\": {\"rules\": {\"assignment-newline\": false}}}").getAsJsonObject()));
		Assertions.assertFalse(services.getConfiguration().isRuleEnabled(AssignmentNewlineRule.ID));
		Assertions.assertTrue(lastPublished().getDiagnostics().isEmpty());
	}

	@Test
	void testWorkspaceConfigurationFile() throws IOException {
		writeConfig("{\"rules\": {\"assignment-newline\": false}}");
		services.setWorkspaceRoot(workspace);
		Assertions.assertFalse(services.getConfiguration().isRuleEnabled(AssignmentNewlineRule.ID));
	}

	@Test
	void testClientSettingsOverrideConfigurationFile() throws IOException {
		writeConfig("{\"rules\": {\"assignment-newline\": false}}");
		services.setWorkspaceRoot(workspace);
		services.applyClientSettings(JsonParser.parseString(
				"{\"groovyStyle\": {\"rules\": {\"assignment-newline\": true}}}").getAsJsonObject());
		Assertions.assertTrue(services.getConfiguration().isRuleEnabled(AssignmentNewlineRule.ID));
	}

	@Test
	void testWatchedConfigurationFileIsReloaded() throws IOException {
		services.setWorkspaceRoot(workspace);
		open(DIRTY);
		Assertions.assertEquals(1, lastPublished().getDiagnostics().size());

		writeConfig("{\"rules\": {\"assignment-newline\": false}}");
		String configUri = workspace.resolve(StyleConfigurationLoader.CONFIG_FILE_NAME).toUri().toString();
		services.didChangeWatchedFiles(new DidChangeWatchedFilesParams(
				Collections.singletonList(new FileEvent(configUri, FileChangeType.Created))));
		Assertions.assertFalse(services.getConfiguration().isRuleEnabled(AssignmentNewlineRule.ID));
		Assertions.assertTrue(lastPublished().getDiagnostics().isEmpty());
	}

	@Test
	void testUnrelatedWatchedFileIsIgnored() throws IOException {
		services.setWorkspaceRoot(workspace);
		writeConfig("{\"rules\": {\"assignment-newline\": false}}");
		services.didChangeWatchedFiles(new DidChangeWatchedFilesParams(Collections.singletonList(
				new FileEvent(workspace.resolve("Other.groovy").toUri().toString(), FileChangeType.Changed))));
		Assertions.assertTrue(services.getConfiguration().isRuleEnabled(AssignmentNewlineRule.ID));
	}

	// --- requests

	@Test
	void testFormatting() throws Exception {
		open(DIRTY);
		DocumentFormattingParams params = new DocumentFormattingParams(new TextDocumentIdentifier(URI),
				new FormattingOptions(4, false));
		List<? extends TextEdit> edits = services.formatting(params).get();
		Assertions.assertEquals(1, edits.size());
		Assertions.assertEquals("def user =\n\trepo.getById(id)", edits.get(0).getNewText());
	}

	@Test
	void testFormattingOfUnknownDocument() throws Exception {
		DocumentFormattingParams params = new DocumentFormattingParams(new TextDocumentIdentifier(URI),
				new FormattingOptions(4, false));
		Assertions.assertTrue(services.formatting(params).get().isEmpty());
	}

	@Test
	void testCodeAction() throws Exception {
		open(DIRTY);
		CodeActionParams params = new CodeActionParams(new TextDocumentIdentifier(URI),
				new Range(new Position(0, 0), new Position(0, 0)),
				new CodeActionContext(lastPublished().getDiagnostics()));
		List<Either<Command, CodeAction>> actions = services.codeAction(params).get();
		Assertions.assertEquals(2, actions.size());
		Assertions.assertEquals("Fix: Expected newline after '='", actions.get(0).getRight().getTitle());
	}
}
