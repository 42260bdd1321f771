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
package com.tomaszrup.groovystyle.util;

import java.net.URI;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;

import com.tomaszrup.groovystyle.source.SourceText;

/**
 * Thread-safe tracker for the contents of documents open in the editor.
 *
 * <p>Changes are applied with {@link ConcurrentHashMap#compute} so a
 * debounced lint never observes a half-applied change.</p>
 */
public class FileContentsTracker {

	private final ConcurrentHashMap<URI, String> openFiles = new ConcurrentHashMap<>();

	public Set<URI> getOpenURIs() {
		return Collections.unmodifiableSet(openFiles.keySet());
	}

	public boolean isOpen(URI uri) {
		return openFiles.containsKey(uri);
	}

	public void didOpen(DidOpenTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openFiles.put(uri, params.getTextDocument().getText());
	}

	/**
	 * Applies full or ranged content changes in order. A change whose range
	 * does not fit the current text replaces the whole document.
	 */
	public void didChange(DidChangeTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openFiles.compute(uri, (key, currentText) -> {
			String text = currentText;
			for (TextDocumentContentChangeEvent change : params.getContentChanges()) {
				Range range = change.getRange();
				if (text == null || range == null) {
					text = change.getText();
					continue;
				}
				SourceText source = new SourceText(text);
				int offsetStart = offsetOf(source, range.getStart());
				int offsetEnd = offsetOf(source, range.getEnd());
				if (offsetStart < 0 || offsetEnd < offsetStart) {
					text = change.getText();
				} else {
					text = text.substring(0, offsetStart) + change.getText() + text.substring(offsetEnd);
				}
			}
			return text;
		});
	}

	public void didClose(DidCloseTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openFiles.remove(uri);
	}

	/**
	 * @return the in-memory text, or {@code null} when the document is not open
	 */
	public String getContents(URI uri) {
		return openFiles.get(uri);
	}

	public void setContents(URI uri, String contents) {
		openFiles.put(uri, contents);
	}

	/** Offset of an LSP position, or -1 when the line does not exist. */
	private static int offsetOf(SourceText source, Position position) {
		int line = position.getLine() + 1;
		if (position.getLine() < 0 || position.getCharacter() < 0) {
			return -1;
		}
		if (line > source.getLineCount()) {
			return line == source.getLineCount() + 1 && position.getCharacter() == 0 ? source.length() : -1;
		}
		return source.offsetOf(line, position.getCharacter());
	}
}
