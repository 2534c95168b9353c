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
package com.tomaszrup.pyfst.fst;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pyfst.parser.Parser;
import com.tomaszrup.pyfst.render.Renderer;
import com.tomaszrup.pyfst.schema.ValidationError;

class FstInterchangeTests {

	private static final String SOURCE = "@d\nclass A(B):  # c\n    x: int = 1\n\n    def f(self, *a, **k):\n        return a[1:2]\n";

	@Test
	void testMapFormOfAtom() {
		Map<String, Object> map = FstInterchange.toMap(new AtomNode("int", "42"));
		Assertions.assertEquals(2, map.size());
		Assertions.assertEquals("int", map.get("type"));
		Assertions.assertEquals("42", map.get("value"));
	}

	@Test
	void testMapFormOfComposite() {
		CompositeNode module = Parser.parse("x = 1\n");
		Map<String, Object> map = FstInterchange.toMap(module);
		Assertions.assertEquals("module", map.get("type"));
		List<?> lines = (List<?>) map.get("value");
		Map<?, ?> assignment = (Map<?, ?>) lines.get(0);
		Assertions.assertEquals("assignment", assignment.get("type"));
		Assertions.assertEquals("", assignment.get("operator"));
		Assertions.assertEquals("x", ((Map<?, ?>) assignment.get("target")).get("value"));
	}

	@Test
	void testMapRoundTripRendersIdentically() {
		CompositeNode module = Parser.parse(SOURCE);
		FstNode rebuilt = FstInterchange.fromMap(FstInterchange.toMap(module));
		Assertions.assertEquals(SOURCE, Renderer.render(rebuilt));
		Assertions.assertNotSame(module, rebuilt);
	}

	@Test
	void testJsonRoundTripRendersIdentically() {
		CompositeNode module = Parser.parse(SOURCE);
		String json = FstInterchange.toJson(module);
		Assertions.assertTrue(json.startsWith("{\"type\":\"module\""));
		Assertions.assertEquals(SOURCE, Renderer.render(FstInterchange.fromJson(json)));
		Assertions.assertEquals(SOURCE, Renderer.render(FstInterchange.fromJson(FstInterchange.toPrettyJson(module))));
	}

	@Test
	void testAbsentOptionalNodeIsNull() {
		String json = FstInterchange.toJson(Parser.parse("return\n").getList("value").get(0));
		Assertions.assertTrue(json.contains("\"value\":null"), json);
	}

	@Test
	void testMissingTypeIsRejected() {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("value", "x");
		Assertions.assertThrows(ValidationError.class, () -> FstInterchange.fromMap(map));
	}

	@Test
	void testUnknownTypeIsRejected() {
		Assertions.assertThrows(ValidationError.class,
				() -> FstInterchange.fromJson("{\"type\":\"exec\",\"value\":\"x\"}"));
	}

	@Test
	void testAtomWithExtraKeyIsRejected() {
		Assertions.assertThrows(ValidationError.class,
				() -> FstInterchange.fromJson("{\"type\":\"name\",\"value\":\"x\",\"extra\":1}"));
	}

	@Test
	void testMissingAttributeIsRejected() {
		Assertions.assertThrows(ValidationError.class,
				() -> FstInterchange.fromJson("{\"type\":\"return\",\"formatting\":[]}"));
	}

	@Test
	void testUnknownAttributeIsRejected() {
		Assertions.assertThrows(ValidationError.class, () -> FstInterchange.fromJson(
				"{\"type\":\"return\",\"formatting\":[],\"value\":null,\"extra\":[]}"));
	}

	@Test
	void testMalformedJson() {
		Assertions.assertThrows(ValidationError.class, () -> FstInterchange.fromJson("{\"type\":"));
		Assertions.assertThrows(ValidationError.class, () -> FstInterchange.fromJson("[]"));
	}

	@Test
	void testNumbersAreNotNodeValues() {
		Assertions.assertThrows(ValidationError.class,
				() -> FstInterchange.fromJson("{\"type\":\"name\",\"value\":1}"));
	}

	@Test
	void testStructuralViolationIsRejected() {
		String json = "{\"type\":\"list\",\"first_formatting\":[],\"value\":[{\"type\":\"comma\","
				+ "\"first_formatting\":[],\"second_formatting\":[]}],\"second_formatting\":[]}";
		Assertions.assertThrows(ValidationError.class, () -> FstInterchange.fromJson(json));
	}
}
