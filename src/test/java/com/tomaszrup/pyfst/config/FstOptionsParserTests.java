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

import java.nio.file.Paths;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Unit tests for {@link FstOptionsParser}: accepted options and the
 * fallbacks for malformed values.
 */
class FstOptionsParserTests {

	// ------------------------------------------------------------------
	// Defaults
	// ------------------------------------------------------------------

	@Test
	void testNullYieldsDefaults() {
		FstOptions options = FstOptionsParser.parse((JsonObject) null);
		Assertions.assertSame(FstOptions.defaults(), options);
	}

	@Test
	void testNonObjectYieldsDefaults() {
		Assertions.assertSame(FstOptions.defaults(), FstOptionsParser.parse(new JsonArray()));
	}

	@Test
	void testMalformedJsonYieldsDefaults() {
		Assertions.assertSame(FstOptions.defaults(), FstOptionsParser.parse("{ indentUnit: "));
	}

	@Test
	void testDefaultValues() {
		FstOptions options = FstOptions.defaults();
		Assertions.assertEquals("    ", options.getIndentUnit());
		Assertions.assertEquals(", ", options.getSeparator());
		Assertions.assertEquals("\n", options.getNewline());
		Assertions.assertNull(options.getCacheDirectory());
		Assertions.assertTrue(options.isCacheEnabled());
	}

	// ------------------------------------------------------------------
	// Accepted options
	// ------------------------------------------------------------------

	@Test
	void testAllOptions() {
		FstOptions options = FstOptionsParser.parse("{\"indentUnit\": \"\\t\", \"separator\": \" , \","
				+ " \"newline\": \"crlf\", \"cacheDirectory\": \"build/fst\", \"cacheEnabled\": false}");
		Assertions.assertEquals("\t", options.getIndentUnit());
		Assertions.assertEquals(" , ", options.getSeparator());
		Assertions.assertEquals("\r\n", options.getNewline());
		Assertions.assertEquals(Paths.get("build/fst"), options.getCacheDirectory());
		Assertions.assertFalse(options.isCacheEnabled());
	}

	@Test
	void testNewlineNames() {
		Assertions.assertEquals("\n", FstOptionsParser.newlineFromName("LF"));
		Assertions.assertEquals("\r", FstOptionsParser.newlineFromName("cr"));
		Assertions.assertEquals("\r\n", FstOptionsParser.newlineFromName("\r\n"));
	}

	// ------------------------------------------------------------------
	// Malformed values
	// ------------------------------------------------------------------

	@Test
	void testInvalidIndentUnitIsIgnored() {
		FstOptions options = FstOptionsParser.parse("{\"indentUnit\": \"ab\", \"separator\": \";\"}");
		Assertions.assertEquals(FstOptions.DEFAULT_INDENT_UNIT, options.getIndentUnit());
		Assertions.assertEquals(FstOptions.DEFAULT_SEPARATOR, options.getSeparator());
	}

	@Test
	void testWrongValueTypesAreIgnored() {
		JsonObject json = new JsonObject();
		json.addProperty("indentUnit", 4);
		json.addProperty("newline", "unix");
		json.addProperty("cacheEnabled", "no");
		FstOptions options = FstOptionsParser.parse(json);
		Assertions.assertEquals(FstOptions.DEFAULT_INDENT_UNIT, options.getIndentUnit());
		Assertions.assertEquals(FstOptions.DEFAULT_NEWLINE, options.getNewline());
		Assertions.assertTrue(options.isCacheEnabled());
	}

	@Test
	void testBuilderRejectsInvalidValues() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> FstOptions.builder().indentUnit(""));
		Assertions.assertThrows(IllegalArgumentException.class, () -> FstOptions.builder().separator("|"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> FstOptions.builder().newline("\n\n"));
	}

	@Test
	void testToBuilderKeepsValues() {
		FstOptions options = FstOptions.builder().indentUnit("  ").cacheEnabled(false).build();
		FstOptions copy = options.toBuilder().build();
		Assertions.assertEquals("  ", copy.getIndentUnit());
		Assertions.assertFalse(copy.isCacheEnabled());
	}

	// ------------------------------------------------------------------
	// Log level
	// ------------------------------------------------------------------

	@Test
	void testUnknownLogLevelIsIgnored() {
		Assertions.assertDoesNotThrow(() -> FstOptionsParser.parse("{\"logLevel\": \"LOUD\"}"));
	}
}
