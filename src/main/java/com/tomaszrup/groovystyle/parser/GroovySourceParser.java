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
package com.tomaszrup.groovystyle.parser;

import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.CompilerConfiguration;
import org.codehaus.groovy.control.ErrorCollector;
import org.codehaus.groovy.control.MultipleCompilationErrorsException;
import org.codehaus.groovy.control.Phases;
import org.codehaus.groovy.control.SourceUnit;
import org.codehaus.groovy.control.messages.Message;
import org.codehaus.groovy.control.messages.SyntaxErrorMessage;
import org.codehaus.groovy.syntax.SyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovystyle.source.GroovyTokenizer;
import com.tomaszrup.groovystyle.source.SourceText;
import com.tomaszrup.groovystyle.source.TokenStream;
import com.tomaszrup.groovystyle.tree.ParsedSource;
import com.tomaszrup.groovystyle.tree.SyntaxTree;

/**
 * Turns Groovy source text into a {@link ParsedSource}.
 *
 * <p>The text is compiled only up to {@link Phases#CONVERSION}: that is
 * enough to get a positioned AST and needs no classpath, so unresolved
 * types and missing imports never fail a check.</p>
 */
public class GroovySourceParser {

    private static final Logger logger = LoggerFactory.getLogger(GroovySourceParser.class);

    public ParsedSource parse(String name, String text) throws SourceParseException {
        SourceText sourceText = new SourceText(text);
        ModuleNode module = compile(name, text);
        TokenStream tokens = GroovyTokenizer.tokenize(sourceText);
        SyntaxTree tree = new SyntaxTreeVisitor(sourceText).visitModule(module);
        logger.debug("Parsed {}: {} tokens, {} syntax nodes", name, tokens.size(), tree.size());
        return new ParsedSource(name, sourceText, tokens, tree);
    }

    private ModuleNode compile(String name, String text) throws SourceParseException {
        CompilationUnit compilationUnit = new CompilationUnit(new CompilerConfiguration());
        SourceUnit sourceUnit = compilationUnit.addSource(scriptName(name), text);
        try {
            compilationUnit.compile(Phases.CONVERSION);
        } catch (MultipleCompilationErrorsException e) {
            throw toParseException(name, e.getErrorCollector(), e);
        } catch (CompilationFailedException e) {
            throw new SourceParseException(name, e.getMessage(), -1, -1, e);
        }
        ModuleNode module = sourceUnit.getAST();
        if (module == null) {
            throw new SourceParseException(name, "Compiler produced no AST", -1, -1, null);
        }
        return module;
    }

    private static SourceParseException toParseException(String name, ErrorCollector collector,
            MultipleCompilationErrorsException e) {
        if (collector != null) {
            for (Message message : collector.getErrors()) {
                if (message instanceof SyntaxErrorMessage) {
                    SyntaxException cause = ((SyntaxErrorMessage) message).getCause();
                    return new SourceParseException(name, cause.getOriginalMessage(),
                            cause.getStartLine(), cause.getStartColumn(), e);
                }
            }
        }
        return new SourceParseException(name, e.getMessage(), -1, -1, e);
    }

    /**
     * The compiler derives a script class name from the source name, so
     * keep only the file name part.
     */
    private static String scriptName(String name) {
        if (name == null || name.isEmpty()) {
            return "Script.groovy";
        }
        String normalized = name.replace('\\', '/');
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        return fileName.isEmpty() ? "Script.groovy" : fileName;
    }
}
