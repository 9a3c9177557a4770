/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.docmatch.equality;

import com.docmatch.diagnostics.DiagnosticSink;
import com.docmatch.diagnostics.Slf4jDiagnosticSink;
import com.google.common.base.Strings;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Immutable settings shared by the matchers and the assertion helpers.
 * <p>
 * Defaults come from the {@code docmatch} block of the Typesafe Config stack
 * ({@code reference.conf}, overridable by {@code application.conf} or system properties such
 * as {@code -Ddocmatch.identifier_field=key}). The {@code with*} methods return modified copies.
 */
public final class MatchOptions {
    public static final String CONFIG_PATH = "docmatch";
    public static final String DEFAULT_IDENTIFIER_FIELD = "_id";
    public static final String DEFAULT_EXPRESSION_OUTPUT_FIELD = "output";

    private final String identifierField;
    private final boolean verbose;
    private final String expressionOutputField;
    @Nullable
    private final DiagnosticSink diagnosticSink;

    private MatchOptions(String identifierField, boolean verbose, String expressionOutputField, @Nullable DiagnosticSink diagnosticSink) {
        checkArgument(!Strings.isNullOrEmpty(identifierField) && !identifierField.isBlank(), "identifier field cannot be empty");
        checkArgument(!Strings.isNullOrEmpty(expressionOutputField) && !expressionOutputField.isBlank(), "expression output field cannot be empty");
        this.identifierField = identifierField;
        this.verbose = verbose;
        this.expressionOutputField = expressionOutputField;
        this.diagnosticSink = diagnosticSink;
    }

    /**
     * Options with the library defaults, ignoring any configuration on the classpath.
     */
    public static MatchOptions builtin() {
        return new MatchOptions(DEFAULT_IDENTIFIER_FIELD, false, DEFAULT_EXPRESSION_OUTPUT_FIELD, null);
    }

    /**
     * Loads the options from {@link ConfigFactory#load()}.
     */
    public static MatchOptions load() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads the {@code docmatch} block of the given configuration. Missing keys fall back to
     * the library defaults.
     *
     * @param config the root configuration
     * @return the options
     * @throws IllegalArgumentException if a configured field name is blank
     */
    public static MatchOptions fromConfig(Config config) {
        Config merged = config.withFallback(ConfigFactory.defaultReference()).getConfig(CONFIG_PATH);
        return new MatchOptions(
                merged.getString("identifier_field"),
                merged.getBoolean("verbose"),
                merged.getString("expression_output_field"),
                null
        );
    }

    /**
     * The options loaded once from the classpath configuration.
     */
    public static MatchOptions defaults() {
        return DefaultsHolder.DEFAULTS;
    }

    public String getIdentifierField() {
        return identifierField;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public String getExpressionOutputField() {
        return expressionOutputField;
    }

    /**
     * Returns the explicitly configured sink, or one derived from the verbose flag.
     */
    public DiagnosticSink getDiagnosticSink() {
        if (diagnosticSink != null) {
            return diagnosticSink;
        }
        return verbose ? new Slf4jDiagnosticSink() : DiagnosticSink.NOOP;
    }

    public MatchOptions withIdentifierField(String identifierField) {
        return new MatchOptions(identifierField, verbose, expressionOutputField, diagnosticSink);
    }

    public MatchOptions withVerbose(boolean verbose) {
        return new MatchOptions(identifierField, verbose, expressionOutputField, diagnosticSink);
    }

    public MatchOptions withExpressionOutputField(String expressionOutputField) {
        return new MatchOptions(identifierField, verbose, expressionOutputField, diagnosticSink);
    }

    public MatchOptions withDiagnosticSink(@Nullable DiagnosticSink diagnosticSink) {
        return new MatchOptions(identifierField, verbose, expressionOutputField, diagnosticSink);
    }

    @Override
    public String toString() {
        return "MatchOptions{identifierField=" + identifierField +
                ", verbose=" + verbose +
                ", expressionOutputField=" + expressionOutputField + "}";
    }

    private static class DefaultsHolder {
        private static final MatchOptions DEFAULTS = load();
    }
}
