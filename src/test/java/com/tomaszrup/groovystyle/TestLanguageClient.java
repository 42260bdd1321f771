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

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import org.eclipse.lsp4j.MessageActionItem;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.ShowMessageRequestParams;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * No-op {@link LanguageClient} for tests. Published diagnostics can be
 * captured by passing a consumer.
 */
public class TestLanguageClient implements LanguageClient {

	private final Consumer<PublishDiagnosticsParams> diagnosticsConsumer;

	public TestLanguageClient() {
		this(null);
	}

	public TestLanguageClient(Consumer<PublishDiagnosticsParams> diagnosticsConsumer) {
		this.diagnosticsConsumer = diagnosticsConsumer;
	}

	@Override
	public void telemetryEvent(Object object) {
	}

	@Override
	public CompletableFuture<MessageActionItem> showMessageRequest(ShowMessageRequestParams requestParams) {
		return null;
	}

	@Override
	public void showMessage(MessageParams messageParams) {
	}

	@Override
	public void publishDiagnostics(PublishDiagnosticsParams diagnostics) {
		if (diagnosticsConsumer != null) {
			diagnosticsConsumer.accept(diagnostics);
		}
	}

	@Override
	public void logMessage(MessageParams message) {
	}
}
