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
package com.tomaszrup.groovystyle.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.tomaszrup.groovystyle.engine.RuleRegistry;
import com.tomaszrup.groovystyle.source.IndentStyle;
import com.tomaszrup.groovystyle.source.Indentation;

/**
 * Reads {@link StyleConfiguration} from JSON. Settings are laid over a base
 * configuration; anything missing or invalid keeps the base value and
 * invalid entries are logged as warnings.
 *
 * <pre>
 * {
 *   "indent": { "style": "tab", "width": 4 },
 *   "logLevel": "INFO",
 *   "rules": {
 *     "lambda-body-newline": { "enabled": true, "maxLength": 40 },
 *     "closing-paren-same-line": false
 *   }
 * }
 * </pre>
 */
public class StyleConfigurationLoader {

    private static final Logger logger = LoggerFactory.getLogger(StyleConfigurationLoader.class);

    public static final String CONFIG_FILE_NAME = ".groovy-style.json";
    public static final String SETTINGS_SECTION = "groovyStyle";

    private static final String INDENT_OPTION = "indent";
    private static final String INDENT_STYLE_OPTION = "style";
    private static final String INDENT_WIDTH_OPTION = "width";
    private static final String LOG_LEVEL_OPTION = "logLevel";
    private static final String RULES_OPTION = "rules";
    private static final String ENABLED_OPTION = "enabled";

    private final RuleRegistry registry;

    public StyleConfigurationLoader(RuleRegistry registry) {
        this.registry = registry;
    }

    public StyleConfiguration load(JsonObject json, StyleConfiguration base) {
        StyleConfiguration config = base;
        if (json.has(INDENT_OPTION)) {
            config = config.withIndentation(parseIndentation(json.get(INDENT_OPTION), config.getIndentation()));
        }
        JsonElement logLevel = json.get(LOG_LEVEL_OPTION);
        if (logLevel != null && logLevel.isJsonPrimitive()) {
            config = config.withLogLevel(logLevel.getAsString());
        }
        JsonElement rules = json.get(RULES_OPTION);
        if (rules != null) {
            if (rules.isJsonObject()) {
                config = applyRules(rules.getAsJsonObject(), config);
            } else {
                logger.warn("Ignoring '{}': expected an object", RULES_OPTION);
            }
        }
        return config;
    }

    /**
     * Loads a configuration file.
     *
     * @throws IOException when the file cannot be read or is not a JSON object
     */
    public StyleConfiguration loadFile(Path file, StyleConfiguration base) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                throw new IOException(file + " does not contain a JSON object");
            }
            StyleConfiguration config = load(root.getAsJsonObject(), base);
            logger.info("Loaded style configuration from {}", file);
            return config;
        } catch (JsonParseException e) {
            throw new IOException("Malformed JSON in " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads {@link #CONFIG_FILE_NAME} from {@code directory} when present.
     * A file that cannot be read is logged and the base is returned.
     */
    public StyleConfiguration loadFromDirectory(Path directory, StyleConfiguration base) {
        if (directory == null) {
            return base;
        }
        Path file = directory.resolve(CONFIG_FILE_NAME);
        if (!Files.isRegularFile(file)) {
            logger.debug("No {} in {}", CONFIG_FILE_NAME, directory);
            return base;
        }
        try {
            return loadFile(file, base);
        } catch (IOException e) {
            logger.warn("Could not load {}: {}", file, e.getMessage());
            return base;
        }
    }

    /**
     * Reads the {@link #SETTINGS_SECTION} object from LSP settings
     * ({@code initializationOptions} or {@code didChangeConfiguration}).
     * The section may also be passed directly.
     */
    public StyleConfiguration fromSettings(Object settings, StyleConfiguration fallback) {
        if (!(settings instanceof JsonObject)) {
            return fallback;
        }
        JsonObject json = (JsonObject) settings;
        JsonElement section = json.get(SETTINGS_SECTION);
        if (section == null) {
            return load(json, fallback);
        }
        if (!section.isJsonObject()) {
            logger.warn("Ignoring '{}' settings: expected an object", SETTINGS_SECTION);
            return fallback;
        }
        return load(section.getAsJsonObject(), fallback);
    }

    private Indentation parseIndentation(JsonElement element, Indentation current) {
        if (!element.isJsonObject()) {
            logger.warn("Ignoring '{}': expected an object", INDENT_OPTION);
            return current;
        }
        JsonObject indent = element.getAsJsonObject();
        IndentStyle style = current.getStyle();
        int width = current.getWidth();
        JsonElement styleValue = indent.get(INDENT_STYLE_OPTION);
        if (styleValue != null) {
            IndentStyle parsed = styleValue.isJsonPrimitive() ? IndentStyle.fromName(styleValue.getAsString()) : null;
            if (parsed == null) {
                logger.warn("Unknown indent style {}, keeping {}", styleValue, style);
            } else {
                style = parsed;
            }
        }
        JsonElement widthValue = indent.get(INDENT_WIDTH_OPTION);
        if (widthValue != null) {
            Object number = toJava(widthValue);
            if (number instanceof Number && ((Number) number).doubleValue() == Math.rint(((Number) number).doubleValue())
                    && ((Number) number).intValue() >= 1) {
                width = ((Number) number).intValue();
            } else {
                logger.warn("Invalid indent width {}, keeping {}", widthValue, width);
            }
        }
        return new Indentation(style, width);
    }

    private StyleConfiguration applyRules(JsonObject rules, StyleConfiguration config) {
        StyleConfiguration result = config;
        for (Map.Entry<String, JsonElement> entry : rules.entrySet()) {
            String ruleId = entry.getKey();
            if (!registry.contains(ruleId)) {
                logger.warn("Unknown rule '{}' in style configuration, ignoring it", ruleId);
                continue;
            }
            JsonElement value = entry.getValue();
            RuleSettings settings = result.getRuleSettings(ruleId);
            if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean()) {
                result = result.withRule(ruleId, settings.withEnabled(value.getAsBoolean()));
            } else if (value.isJsonObject()) {
                result = result.withRule(ruleId, parseRuleObject(ruleId, value.getAsJsonObject(), settings));
            } else {
                logger.warn("Ignoring settings of rule '{}': expected a boolean or an object", ruleId);
            }
        }
        return result;
    }

    private RuleSettings parseRuleObject(String ruleId, JsonObject object, RuleSettings settings) {
        RuleSettings result = settings;
        Map<String, Object> options = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> option : object.entrySet()) {
            if (ENABLED_OPTION.equals(option.getKey())) {
                JsonElement enabled = option.getValue();
                if (enabled.isJsonPrimitive() && enabled.getAsJsonPrimitive().isBoolean()) {
                    result = result.withEnabled(enabled.getAsBoolean());
                } else {
                    logger.warn("Invalid '{}' value {} for rule '{}', ignoring it", ENABLED_OPTION, enabled, ruleId);
                }
                continue;
            }
            Object value = toJava(option.getValue());
            if (value == null) {
                logger.warn("Option '{}' of rule '{}' is not a scalar, ignoring it", option.getKey(), ruleId);
                continue;
            }
            options.put(option.getKey(), value);
        }
        return options.isEmpty() ? result : result.withOptions(options);
    }

    /** Scalar JSON value as Boolean, Double or String; {@code null} otherwise. */
    private static Object toJava(JsonElement element) {
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return primitive.getAsDouble();
        }
        return primitive.getAsString();
    }
}
