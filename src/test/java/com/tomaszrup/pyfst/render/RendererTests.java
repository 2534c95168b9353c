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
package com.tomaszrup.pyfst.render;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pyfst.fst.AtomNode;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.parser.Parser;
import com.tomaszrup.pyfst.schema.ValidationError;

class RendererTests {

	private static CompositeNode call(String function, String... arguments) {
		CompositeNode call = new CompositeNode("call");
		List<FstNode> values = call.getList("value");
		for (int i = 0; i < arguments.length; i++) {
			if (i > 0) {
				CompositeNode comma = new CompositeNode("comma");
				comma.add("second_formatting", new AtomNode("space", " "));
				values.add(comma);
			}
			values.add(new AtomNode("name", arguments[i]));
		}
		CompositeNode trailers = new CompositeNode("atomtrailers");
		trailers.add("value", new AtomNode("name", function), call);
		return trailers;
	}

	// ---- rendering ----

	@Test
	void testRenderHandBuiltTree() {
		Assertions.assertEquals("f(a, b)", Renderer.render(call("f", "a", "b")));
	}

	@Test
	void testConditionalConstantFollowsFlag() {
		CompositeNode tuple = new CompositeNode("tuple");
		tuple.add("value", new AtomNode("name", "a"), new CompositeNode("comma"));
		Assertions.assertEquals("a,", Renderer.render(tuple));
		tuple.set("with_parenthesis", true);
		Assertions.assertEquals("(a,)", Renderer.render(tuple));
	}

	@Test
	void testConditionalConstantFollowsOptionalNode() {
		CompositeNode node = new CompositeNode("return");
		Assertions.assertEquals("return", Renderer.render(node));
		node.add("formatting", new AtomNode("space", " "));
		node.set("value", new AtomNode("int", "1"));
		Assertions.assertEquals("return 1", Renderer.render(node));
	}

	@Test
	void testRenderNodeList() {
		List<FstNode> nodes = new ArrayList<>();
		nodes.add(new AtomNode("name", "a"));
		nodes.add(new AtomNode("space", "  "));
		nodes.add(new AtomNode("name", "b"));
		Assertions.assertEquals("a  b", Renderer.render(nodes));
	}

	@Test
	void testSpansCoverEveryNode() {
		CompositeNode module = Parser.parse("x = f(a)\n");
		RenderedSpans spans = Renderer.renderWithSpans(module);
		Assertions.assertEquals("x = f(a)\n", spans.getText());
		CompositeNode assignment = (CompositeNode) module.getList("value").get(0);
		Assertions.assertEquals(0, spans.getStart(assignment));
		Assertions.assertEquals(8, spans.getEnd(assignment));
		FstNode value = assignment.getNode("value");
		Assertions.assertEquals(4, spans.getStart(value));
		Assertions.assertTrue(spans.contains(value));
		Assertions.assertFalse(spans.contains(new AtomNode("name", "x")));
	}

	// ---- validation ----

	@Test
	void testValidTreePasses() {
		SchemaValidator.validate(Parser.parse("def f(a, *, b=1) -> int:\n    return a\n"));
	}

	@Test
	void testMissingRequiredNode() {
		CompositeNode assignment = new CompositeNode("assignment");
		assignment.set("value", new AtomNode("int", "1"));
		Assertions.assertThrows(ValidationError.class, () -> SchemaValidator.validate(assignment));
	}

	@Test
	void testSeparatorInItemPosition() {
		CompositeNode list = new CompositeNode("list");
		list.add("value", new CompositeNode("comma"));
		Assertions.assertThrows(ValidationError.class, () -> SchemaValidator.validate(list));
	}

	@Test
	void testWrongSeparatorType() {
		CompositeNode list = new CompositeNode("list");
		list.add("value", new AtomNode("name", "a"), new CompositeNode("dot"), new AtomNode("name", "b"));
		Assertions.assertThrows(ValidationError.class, () -> SchemaValidator.validate(list));
	}

	@Test
	void testFormattingListRejectsNames() {
		CompositeNode node = new CompositeNode("return");
		node.add("formatting", new AtomNode("name", "x"));
		Assertions.assertThrows(ValidationError.class, () -> SchemaValidator.validateShallow(node));
	}

	@Test
	void testSharedNodeIsRejected() {
		AtomNode shared = new AtomNode("name", "a");
		CompositeNode list = new CompositeNode("list");
		list.add("value", shared, new CompositeNode("comma"), shared);
		Assertions.assertThrows(ValidationError.class, () -> SchemaValidator.validate(list));
	}

	@Test
	void testUnknownAttribute() {
		CompositeNode node = new CompositeNode("return");
		Assertions.assertThrows(ValidationError.class, () -> node.set("bogus", "x"));
	}
}
