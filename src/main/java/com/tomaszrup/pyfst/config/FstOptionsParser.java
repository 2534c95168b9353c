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
package com.tomaszrup.pyfst.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Reads {@link FstOptions} from a JSON object. Unknown keys are ignored and
 * malformed values fall back to the defaults with a warning, so a bad option
 * never prevents parsing.
 */
public final class FstOptionsParser {
	private static final Logger logger = LoggerFactory.getLogger(FstOptionsParser.class);

	private static final String INDENT_UNIT_OPTION = "indentUnit";
	private static final String SEPARATOR_OPTION = "separator";
	private static final String NEWLINE_OPTION = "newline";
	private static final String CACHE_DIRECTORY_OPTION = "cacheDirectory";
	private static final String CACHE_ENABLED_OPTION = "cacheEnabled";
	private static final String LOG_LEVEL_OPTION = "logLevel";

	private FstOptionsParser() {
	}

	/**
	 * Parses options and applies the {@code logLevel} side effect.
	 *
	 * @param element a {@link JsonObject}; anything else yields the defaults
	 */
	public static FstOptions parse(JsonElement element) {
		if (element == null || !element.isJsonObject()) {
			return FstOptions.defaults();
		}
		JsonObject opts = element.getAsJsonObject();
		applyLogLevelOption(opts);

		FstOptions.Builder builder = FstOptions.builder();
		String indentUnit = stringOption(opts, INDENT_UNIT_OPTION);
		if (indentUnit != null) {
			try {
				builder.indentUnit(indentUnit);
			} catch (IllegalArgumentException e) {
				logger.warn("Ignoring option {}: {}", INDENT_UNIT_OPTION, e.getMessage());
			}
		}
		String separator = stringOption(opts, SEPARATOR_OPTION);
		if (separator != null) {
			try {
				builder.separator(separator);
			} catch (IllegalArgumentException e) {
				logger.warn("Ignoring option {}: {}", SEPARATOR_OPTION, e.getMessage());
			}
		}
		String newline = stringOption(opts, NEWLINE_OPTION);
		if (newline != null) {
			try {
				builder.newline(newlineFromName(newline));
			} catch (IllegalArgumentException e) {
				logger.warn("Ignoring option {}: {}", NEWLINE_OPTION, e.getMessage());
			}
		}
		String cacheDirectory = stringOption(opts, CACHE_DIRECTORY_OPTION);
		if (cacheDirectory != null) {
			try {
				builder.cacheDirectory(Paths.get(cacheDirectory));
				logger.info("FST cache directory: {}", cacheDirectory);
			} catch (InvalidPathException e) {
				logger.warn("Ignoring option {}: {}", CACHE_DIRECTORY_OPTION, e.getMessage());
			}
		}
		if (opts.has(CACHE_ENABLED_OPTION) && opts.get(CACHE_ENABLED_OPTION).isJsonPrimitive()
				&& opts.get(CACHE_ENABLED_OPTION).getAsJsonPrimitive().isBoolean()) {
			boolean enabled = opts.get(CACHE_ENABLED_OPTION).getAsBoolean();
			builder.cacheEnabled(enabled);
			if (!enabled) {
				logger.info("FST caching disabled via options");
			}
		}
		return builder.build();
	}

	/**
	 * Parses options from JSON text.
	 */
	public static FstOptions parse(String json) {
		try {
			return parse(JsonParser.parseString(json));
		} catch (JsonParseException e) {
			logger.warn("Ignoring malformed options: {}", e.getMessage());
			return FstOptions.defaults();
		}
	}

	private static String stringOption(JsonObject opts, String name) {
		if (!opts.has(name)) {
			return null;
		}
		JsonElement value = opts.get(name);
		if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
			logger.warn("Ignoring option {}: expected a string but got {}", name, value);
			return null;
		}
		return value.getAsString();
	}

	/**
	 * Accepts the line break itself or one of the names {@code lf},
	 * {@code crlf}, {@code cr}.
	 */
	static String newlineFromName(String name) {
		switch (name.toLowerCase(Locale.ROOT)) {
			case "lf":
				return "\n";
			case "crlf":
				return "\r\n";
			case "cr":
				return "\r";
			default:
				return name;
		}
	}

	private static void applyLogLevelOption(JsonObject opts) {
		String level = stringOption(opts, LOG_LEVEL_OPTION);
		if (level != null) {
			applyLogLevel(level);
		}
	}

	/**
	 * Sets the Logback root logger level. Accepted values (case-insensitive):
	 * ERROR, WARN, INFO, DEBUG, TRACE. Invalid values are ignored and a
	 * warning is logged.
	 */
	static void applyLogLevel(String levelName) {
		try {
			ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
			if (level == null) {
				logger.warn("Unknown log level '{}', keeping current level", levelName);
				return;
			}
			ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
					LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
			ch.qos.logback.classic.Level previous = root.getLevel();
			root.setLevel(level);
			logger.info("Log level changed from {} to {}", previous, level);
		} catch (ClassCastException e) {
			logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
		}
	}
}
