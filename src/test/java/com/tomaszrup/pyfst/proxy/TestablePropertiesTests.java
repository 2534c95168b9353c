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
import org.eclipse.lsp4j.TextEdit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.lsp.utils.Positions;

/**
 * End-to-end checks of the guarantees the tree gives its callers: lossless
 * dumps, local edits, query order, reversible splices and strict
 * identifiers.
 */
class TestablePropertiesTests {

	private static final String[] SOURCES = {
			"",
			"x = 1\n",
			"import os.path as p, sys  # modules\n",
			"from ..pkg.mod import (b as c,\n    d,)\n",
			"@decorator\nasync def f(a, b: int = 2, *args, key=None, **kw) -> str:\n    \"\"\"doc\"\"\"\n    return a\n",
			"class A(B, metaclass=M):\n\n    x: int\n\n    def g(self): return self.x\n",
			"try:\n    pass\nexcept (A, B) as e:\n    raise X from e\nelse:\n    pass\nfinally:\n    del a[0], b.c\n",
			"with open(p) as f, lock:\n    data = f.read()\n",
			"while not done:\n    i += 1\n    if i > 10: break\nelse:\n    continue\n",
			"result = {k: v for k, v in items if v}\n",
			"lambda x, *y, **z: (x, y, z)\n",
			"a = b if c else d\n",
			"x = 1 + \\\n    2\n",
			"x = [\n    1,  # one\n    2,\n]\n",
			"if a:\n\tb = a[1:2, ::3]\n",
			"y = yield from gen()\n",
			"s = 'a' \"b\"  r'''c'''\n",
			"x = 1\r\ny = 2\r\n",
			"x = 1  ",
	};

	// ------------------------------------------------------------------
	// Round trips
	// ------------------------------------------------------------------

	@Test
	void testRoundTrip() {
		for (String source : SOURCES) {
			Assertions.assertEquals(source, Tree.parse(source).dumps(), source);
		}
	}

	@Test
	void testStrictDumpOfParsedTrees() {
		for (String source : SOURCES) {
			Assertions.assertEquals(source, Tree.parse(source).dumps(true), source);
		}
	}

	// ------------------------------------------------------------------
	// Locality
	// ------------------------------------------------------------------

	@Test
	void testMutationOnlyChangesItsSpan() {
		String source = "a = 1\ndef f(x):\n    return x\nb = 2\n";
		Tree tree = Tree.parse(source);
		tree.root().find("def").list("arguments").append("y");
		List<TextEdit> edits = tree.edits();
		Assertions.assertEquals(1, edits.size());
		Assertions.assertEquals(1, edits.get(0).getRange().getStart().getLine());
		Assertions.assertEquals(2, edits.get(0).getRange().getEnd().getLine());
		Assertions.assertEquals("def f(x, y):\n", edits.get(0).getNewText());
	}

	// ------------------------------------------------------------------
	// Query order
	// ------------------------------------------------------------------

	@Test
	void testFindAllFollowsRenderingOrder() {
		Tree tree = Tree.parse("def f(a, b=1):\n    return [a, b]  # pair\nx = f(1)\n");
		List<Proxy> all = tree.root().findAll("*");
		Assertions.assertSame(tree.root(), all.get(0));
		Position previous = new Position(0, 0);
		for (Proxy proxy : all) {
			Position start = proxy.range().getStart();
			Assertions.assertTrue(Positions.COMPARATOR.compare(previous, start) <= 0, proxy.toString());
			previous = start;
		}
	}

	// ------------------------------------------------------------------
	// Separator symmetry
	// ------------------------------------------------------------------

	@Test
	void testInsertThenRemoveRestoresText() {
		String[] sources = {"f(a, b)\n", "f(a,b)\n", "f(a)\n", "f()\n", "import os, sys\n"};
		for (String source : sources) {
			Tree tree = Tree.parse(source);
			Proxy owner = tree.root().find("re:call|import");
			ProxyList list = owner.list("value");
			for (int index = 0; index <= list.size(); index++) {
				list.insert(index, "x");
				list.remove(index);
				Assertions.assertEquals(source, tree.dumps(), source + " at " + index);
			}
		}
	}

	// ------------------------------------------------------------------
	// Identifier strictness
	// ------------------------------------------------------------------

	@Test
	void testInvalidIdentifiersRaise() {
		Tree tree = Tree.parse("def f(a):\n    return a + a\n");
		Proxy def = tree.root().find("def");
		Proxy sum = tree.root().find("binary_operator");
		Assertions.assertThrows(IdentifierError.class, () -> def.get("nme"));
		Assertions.assertThrows(IdentifierError.class, () -> def.get("arguments"));
		Assertions.assertThrows(IdentifierError.class, () -> sum.get("name"));
		Assertions.assertThrows(IdentifierError.class, () -> def.list("name"));
		Assertions.assertThrows(IdentifierError.class, () -> def.getString("decorators"));
	}

	// ------------------------------------------------------------------
	// Scenarios
	// ------------------------------------------------------------------

	@Test
	void testRenameAssignmentTarget() {
		Tree tree = Tree.parse("x = 1\n");
		tree.root().find("assignment").get("target").setValue("y");
		Assertions.assertEquals("y = 1\n", tree.dumps());
	}

	@Test
	void testAppendCallArgument() {
		Tree tree = Tree.parse("f(a, b)\n");
		tree.root().find("call").list("value").append("c");
		Assertions.assertEquals("f(a, b, c)\n", tree.dumps());
	}

	@Test
	void testIndentFunctionBody() {
		Tree tree = Tree.parse("def f():\n    pass\n");
		tree.root().find("def").list("value").increaseIndentation(1);
		Assertions.assertEquals("def f():\n        pass\n", tree.dumps());
	}

	@Test
	void testRemoveStatementKeepsFollowingComment() {
		Tree tree = Tree.parse("a = 1\n# comment\nb = 2\n");
		tree.root().list("value").remove(0);
		Assertions.assertEquals("# comment\nb = 2\n", tree.dumps());
	}
}
