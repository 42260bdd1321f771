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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.eclipse.lsp4j.CodeActionKind;
import org.eclipse.lsp4j.CodeActionOptions;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.groovystyle.engine.RuleRegistry;

/**
 * Entry point. Without arguments the server speaks LSP over stdio;
 * {@code --tcp [port]} listens on a loopback socket instead, and
 * {@code --check}/{@code --fix} run {@link StyleBatchRunner} over paths.
 */
public class GroovyStyleLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(GroovyStyleLanguageServer.class);

    static final int DEFAULT_PORT = 5007;
    static final String DEBOUNCE_OPTION = "debounceMs";

    public static void main(String[] args) throws IOException {
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) ->
                logger.error("Uncaught exception on thread {}: {}", thread.getName(), throwable.getMessage(),
                        throwable));

        if (args.length > 0 && (StyleBatchRunner.CHECK_OPTION.equals(args[0])
                || StyleBatchRunner.FIX_OPTION.equals(args[0]))) {
            boolean fix = StyleBatchRunner.FIX_OPTION.equals(args[0]);
            String[] paths = Arrays.copyOfRange(args, 1, args.length);
            System.exit(StyleBatchRunner.run(paths, fix, System.out));
        }

        if (args.length > 0 && "--tcp".equals(args[0])) {
            int port = DEFAULT_PORT;
            if (args.length > 1) {
                try {
                    port = Integer.parseInt(args[1]);
                } catch (NumberFormatException e) {
                    logger.error("Invalid port number: {}", args[1]);
                    System.exit(1);
                }
            }

            try (ServerSocket serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress())) {
                logger.info("Groovy Style Server listening on port {} (localhost only)", port);
                try (Socket socket = serverSocket.accept()) {
                    logger.info("Client connected.");
                    startServer(socket.getInputStream(), socket.getOutputStream());
                }
            }
        } else {
            logger.info("Groovy Style Server starting in stdio mode.");
            startServer(System.in, System.out);
        }
    }

    private static void startServer(InputStream in, OutputStream out) {
        // stdout belongs to the protocol
        System.setOut(new PrintStream(System.err));

        GroovyStyleLanguageServer server = new GroovyStyleLanguageServer();
        Launcher<LanguageClient> launcher = LSPLauncher.createServerLauncher(server, in, out);
        server.connect(launcher.getRemoteProxy());

        // Block the main thread: pool threads are daemons.
        Future<Void> future = launcher.startListening();
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Language server listener interrupted");
        } catch (ExecutionException e) {
            logger.error("Language server listener terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    private final ExecutorPools executorPools;
    private final StyleServices styleServices;

    public GroovyStyleLanguageServer() {
        this(RuleRegistry.builtIn(), new ExecutorPools(1));
    }

    public GroovyStyleLanguageServer(RuleRegistry registry, ExecutorPools executorPools) {
        this.executorPools = executorPools;
        this.styleServices = new StyleServices(registry, executorPools);
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        Object initOptions = params.getInitializationOptions();
        if (initOptions instanceof JsonObject) {
            JsonElement debounce = ((JsonObject) initOptions).get(DEBOUNCE_OPTION);
            if (debounce != null && debounce.isJsonPrimitive() && debounce.getAsJsonPrimitive().isNumber()) {
                styleServices.setDebounceDelayMs(debounce.getAsLong());
            }
        }
        styleServices.applyClientSettings(initOptions);

        Path workspaceRoot = workspaceRoot(params);
        if (workspaceRoot != null) {
            styleServices.setWorkspaceRoot(workspaceRoot);
        }

        ServerCapabilities serverCapabilities = new ServerCapabilities();
        serverCapabilities.setTextDocumentSync(TextDocumentSyncKind.Full);
        CodeActionOptions codeActionOptions = new CodeActionOptions(
                Arrays.asList(CodeActionKind.QuickFix, CodeActionKind.SourceFixAll));
        serverCapabilities.setCodeActionProvider(codeActionOptions);
        serverCapabilities.setDocumentFormattingProvider(true);

        InitializeResult initializeResult = new InitializeResult(serverCapabilities,
                new ServerInfo("groovy-style-server"));
        return CompletableFuture.completedFuture(initializeResult);
    }

    @SuppressWarnings("deprecation")
    private static Path workspaceRoot(InitializeParams params) {
        String rootUri = params.getRootUri();
        if (rootUri == null && params.getWorkspaceFolders() != null && !params.getWorkspaceFolders().isEmpty()) {
            rootUri = params.getWorkspaceFolders().get(0).getUri();
        }
        if (rootUri == null) {
            return null;
        }
        try {
            return Paths.get(URI.create(rootUri));
        } catch (IllegalArgumentException | java.nio.file.FileSystemNotFoundException e) {
            logger.warn("Ignoring workspace root {}: {}", rootUri, e.getMessage());
            return null;
        }
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        styleServices.shutdown();
        executorPools.shutdownAll();
        return CompletableFuture.completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return styleServices;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return styleServices;
    }

    @Override
    public void connect(LanguageClient client) {
        styleServices.connect(client);
    }
}
