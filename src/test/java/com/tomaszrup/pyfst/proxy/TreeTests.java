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
package com.tomaszrup.pyfst.proxy;

import java.util.List;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pyfst.config.FstOptions;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * Unit tests for {@link Tree}: detection of source conventions, lookups by
 * position and edits.
 */
class TreeTests {

	// ------------------------------------------------------------------
	// Construction
	// ------------------------------------------------------------------

	@Test
	void testRootIsModule() {
		Tree tree = Tree.parse("x = 1\n");
		Assertions.assertEquals("module", tree.root().getType());
		Assertions.assertEquals("x = 1\n", tree.getSource());
		Assertions.assertSame(tree, tree.root().getTree());
	}

	@Test
	void testTreeMustBeRootedAtModule() {
		Assertions.assertThrows(ValidationError.class,
				() -> new Tree("x", new CompositeNode("assignment"), FstOptions.defaults()));
	}

	@Test
	void testNewlineDetection() {
		Assertions.assertEquals("\r\n", Tree.parse("a = 1\r\nb = 2\r\n").getNewline());
		Assertions.assertEquals("\n", Tree.parse("a = 1\n").getNewline());
		Assertions.assertEquals("\r\n",
				Tree.parse("a = 1", FstOptions.builder().newline("\r\n").build()).getNewline());
	}

	@Test
	void testIndentUnitDetection() {
		Assertions.assertEquals("  ", Tree.parse("x = 1\ndef f():\n  pass\n").getIndentUnit());
		Assertions.assertEquals("\t", Tree.parse("if a:\n\tb()\n").getIndentUnit());
		Assertions.assertEquals("    ", Tree.parse("x = 1\n").getIndentUnit());
		Assertions.assertEquals("   ",
				Tree.parse("x = 1\n", FstOptions.builder().indentUnit("   ").build()).getIndentUnit());
	}

	@Test
	void testDetectedNewlineUsedForInsertion() {
		Tree tree = Tree.parse("a = 1\r\n");
		tree.root().list("value").append("b = 2");
		Assertions.assertEquals("a = 1\r\nb = 2\r\n", tree.dumps());
	}

	@Test
	void testDetectedIndentUnitUsedForNewBlock() {
		Tree tree = Tree.parse("def f():\n  pass\nif a: pass\n");
		tree.root().find("if").list("value").append("b()");
		Assertions.assertEquals("def f():\n  pass\nif a:\n  pass\n  b()\n", tree.dumps());
	}

	// ------------------------------------------------------------------
	// dumps()
	// ------------------------------------------------------------------

	@Test
	void testStrictDumpOfParsedTree() {
		String source = "class A(B):\n    x: int = 1\n    def f(self, *args, **kw):\n        return [i for i in args]\n";
		Assertions.assertEquals(source, Tree.parse(source).dumps(true));
	}

	@Test
	void testStrictDumpRejectsBrokenTree() {
		Tree tree = Tree.parse("x = 1\n");
		((CompositeNode) tree.root().find("assignment").node()).set("target", null);
		Assertions.assertThrows(ValidationError.class, () -> tree.dumps(true));
	}

	// ------------------------------------------------------------------
	// nodeAt()
	// ------------------------------------------------------------------

	@Test
	void testNodeAtFindsInnermostNode() {
		Tree tree = Tree.parse("x = foo(1)\n");
		Assertions.assertEquals("x", tree.nodeAt(new Position(0, 0)).getValue());
		Assertions.assertEquals("foo", tree.nodeAt(new Position(0, 5)).getValue());
		Assertions.assertEquals("1", tree.nodeAt(new Position(0, 8)).getValue());
	}

	@Test
	void testNodeAtSkipsFormatting() {
		Tree tree = Tree.parse("x = 1\n");
		Assertions.assertEquals("assignment", tree.nodeAt(new Position(0, 1)).getType());
	}

	@Test
	void testNodeAtNestedLine() {
		Tree tree = Tree.parse("def f():\n    return a\n");
		Assertions.assertEquals("a", tree.nodeAt(new Position(1, 11)).getValue());
		Assertions.assertEquals("return", tree.nodeAt(new Position(1, 5)).getType());
	}

	@Test
	void testNodeAtOutsideText() {
		Tree tree = Tree.parse("x = 1\n");
		Assertions.assertNull(tree.nodeAt(new Position(5, 0)));
		Assertions.assertNull(tree.nodeAt(new Position(0, 20)));
	}

	@Test
	void testNodeAtReturnsNavigableProxy() {
		Tree tree = Tree.parse("f(a, b)\n");
		Proxy b = tree.nodeAt(new Position(0, 5));
		Assertions.assertEquals("b", b.getValue());
		Assertions.assertEquals("call", b.parent().getType());
		Assertions.assertSame(tree.root(), b.root());
	}

	// ------------------------------------------------------------------
	// edits()
	// ------------------------------------------------------------------

	@Test
	void testNoEditsWithoutChanges() {
		Assertions.assertTrue(Tree.parse("a = 1\nb = 2\n").edits().isEmpty());
	}

	@Test
	void testEditsCoverChangedLines() {
		Tree tree = Tree.parse("a = 1\nb = 2\nc = 3\n");
		tree.root().list("value").get(1).get("target").setValue("bb");
		List<TextEdit> edits = tree.edits();
		Assertions.assertEquals(1, edits.size());
		Assertions.assertEquals(new Range(new Position(1, 0), new Position(2, 0)), edits.get(0).getRange());
		Assertions.assertEquals("bb = 2\n", edits.get(0).getNewText());
	}
}
