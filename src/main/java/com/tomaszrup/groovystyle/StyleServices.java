////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovystyle;

import java.net.URI;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.CodeActionParams;
import org.eclipse.lsp4j.Command;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.FileEvent;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovystyle.config.LogLevels;
import com.tomaszrup.groovystyle.config.StyleConfiguration;
import com.tomaszrup.groovystyle.config.StyleConfigurationLoader;
import com.tomaszrup.groovystyle.engine.CheckResult;
import com.tomaszrup.groovystyle.engine.RuleRegistry;
import com.tomaszrup.groovystyle.engine.StyleChecker;
import com.tomaszrup.groovystyle.engine.StyleEngine;
import com.tomaszrup.groovystyle.parser.GroovySourceParser;
import com.tomaszrup.groovystyle.providers.CodeActionProvider;
import com.tomaszrup.groovystyle.providers.DiagnosticsProvider;
import com.tomaszrup.groovystyle.providers.FormattingProvider;
import com.tomaszrup.groovystyle.util.FileContentsTracker;

/**
 * Text document and workspace services: lints open documents, publishes
 * style diagnostics and serves quick fixes and formatting.
 *
 * <p>Configuration comes from three layers, each laid over the previous
 * one: built-in defaults, {@code .groovy-style.json} in the workspace root,
 * and the client's {@code groovyStyle} settings.</p>
 */
public class StyleServices implements TextDocumentService, WorkspaceService, LanguageClientAware {

	private static final Logger logger = LoggerFactory.getLogger(StyleServices.class);

	/** Default debounce delay for didChange linting (milliseconds). */
	public static final long DEFAULT_DEBOUNCE_DELAY_MS = 300;

	private final RuleRegistry registry;
	private final StyleConfigurationLoader configurationLoader;
	private final GroovySourceParser parser = new GroovySourceParser();
	private final FileContentsTracker fileContentsTracker = new FileContentsTracker();
	private final DiagnosticsProvider diagnosticsProvider = new DiagnosticsProvider();
	private final ScheduledExecutorService schedulingPool;
	private final AtomicReference<LanguageClient> languageClient = new AtomicReference<>();
	private final ConcurrentHashMap<URI, ScheduledFuture<?>> pendingLints = new ConcurrentHashMap<>();

	private volatile long debounceDelayMs = DEFAULT_DEBOUNCE_DELAY_MS;
	private volatile Path workspaceRoot;
	/** Defaults plus the workspace configuration file. */
	private volatile StyleConfiguration fileConfiguration = StyleConfiguration.defaults();
	/** Last client settings, re-applied when the configuration file changes. */
	private volatile Object clientSettings;
	private volatile StyleChecker checker;

	public StyleServices(RuleRegistry registry, ExecutorPools executorPools) {
		this.registry = registry;
		this.configurationLoader = new StyleConfigurationLoader(registry);
		this.schedulingPool = executorPools.getSchedulingPool();
		this.checker = createChecker(StyleConfiguration.defaults());
	}

	@Override
	public void connect(LanguageClient client) {
		languageClient.set(client);
	}

	public void shutdown() {
		for (ScheduledFuture<?> pending : pendingLints.values()) {
			pending.cancel(false);
		}
		pendingLints.clear();
	}

	// --- Configuration ---

	public void setWorkspaceRoot(Path root) {
		this.workspaceRoot = root;
		reloadConfigurationFile();
	}

	/** Debounce delay for didChange; {@code 0} lints on every change. */
	public void setDebounceDelayMs(long delayMs) {
		this.debounceDelayMs = Math.max(0, delayMs);
	}

	public StyleConfiguration getConfiguration() {
		return checker.getEngine().getConfiguration();
	}

	/**
	 * Applies client settings (the {@code initializationOptions} object, or
	 * the settings of a {@code didChangeConfiguration} notification).
	 */
	public void applyClientSettings(Object settings) {
		this.clientSettings = settings;
		applyConfiguration(configurationLoader.fromSettings(settings, fileConfiguration));
	}

	private void reloadConfigurationFile() {
		fileConfiguration = configurationLoader.loadFromDirectory(workspaceRoot, StyleConfiguration.defaults());
		applyConfiguration(configurationLoader.fromSettings(clientSettings, fileConfiguration));
	}

	private void applyConfiguration(StyleConfiguration configuration) {
		if (configuration.getLogLevel() != null) {
			LogLevels.applyLogLevel(configuration.getLogLevel());
		}
		this.checker = createChecker(configuration);
		logger.debug("Style configuration: {}", configuration);
		for (URI uri : fileContentsTracker.getOpenURIs()) {
			lintAndPublish(uri);
		}
	}

	private StyleChecker createChecker(StyleConfiguration configuration) {
		return new StyleChecker(parser, new StyleEngine(registry, configuration));
	}

	// --- TextDocumentService notifications ---

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		fileContentsTracker.didOpen(params);
		lintAndPublish(URI.create(params.getTextDocument().getUri()));
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		fileContentsTracker.didChange(params);
		URI uri = URI.create(params.getTextDocument().getUri());
		long delay = debounceDelayMs;
		if (delay == 0) {
			lintAndPublish(uri);
			return;
		}
		ScheduledFuture<?> next = schedulingPool.schedule(() -> {
			pendingLints.remove(uri);
			lintAndPublish(uri);
		}, delay, TimeUnit.MILLISECONDS);
		ScheduledFuture<?> previous = pendingLints.put(uri, next);
		if (previous != null) {
			previous.cancel(false);
		}
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		fileContentsTracker.didClose(params);
		URI uri = URI.create(params.getTextDocument().getUri());
		ScheduledFuture<?> pending = pendingLints.remove(uri);
		if (pending != null) {
			pending.cancel(false);
		}
		publish(uri, Collections.emptyList());
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		if (params.getText() != null) {
			fileContentsTracker.setContents(uri, params.getText());
		}
		lintAndPublish(uri);
	}

	// --- WorkspaceService notifications ---

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		applyClientSettings(params.getSettings());
	}

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		for (FileEvent event : params.getChanges()) {
			if (event.getUri().endsWith("/" + StyleConfigurationLoader.CONFIG_FILE_NAME)) {
				logger.info("{} changed, reloading style configuration", StyleConfigurationLoader.CONFIG_FILE_NAME);
				reloadConfigurationFile();
				return;
			}
		}
	}

	// --- TextDocumentService requests ---

	@Override
	public CompletableFuture<List<Either<Command, CodeAction>>> codeAction(CodeActionParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		String text = fileContentsTracker.getContents(uri);
		return CompletableFuture.completedFuture(new CodeActionProvider(checker).provideCodeActions(params, text));
	}

	@Override
	public CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		String text = fileContentsTracker.getContents(uri);
		return CompletableFuture.completedFuture(
				new FormattingProvider(checker).provideFormatting(uri.toString(), text));
	}

	// --- Linting ---

	void lintAndPublish(URI uri) {
		String text = fileContentsTracker.getContents(uri);
		if (text == null) {
			return;
		}
		List<Diagnostic> diagnostics;
		try {
			CheckResult result = checker.check(uri.toString(), text);
			diagnostics = diagnosticsProvider.provideDiagnostics(result);
		} catch (RuntimeException e) {
			logger.warn("Style check of {} failed: {}", uri, e.getMessage(), e);
			diagnostics = Collections.emptyList();
		}
		publish(uri, diagnostics);
	}

	private void publish(URI uri, List<Diagnostic> diagnostics) {
		LanguageClient client = languageClient.get();
		if (client != null) {
			client.publishDiagnostics(new PublishDiagnosticsParams(uri.toString(), diagnostics));
		}
	}
}
