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

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pyfst.fst.NodePath;
import com.tomaszrup.pyfst.parser.ParseError;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * Unit tests for {@link Proxy}: attribute access, replacement, navigation
 * and conversions.
 */
class ProxyTests {

	// ------------------------------------------------------------------
	// get()
	// ------------------------------------------------------------------

	@Test
	void testGetByAttributeName() {
		Tree tree = Tree.parse("x = 1\n");
		Proxy assignment = tree.root().find("assignment");
		Assertions.assertEquals("x", assignment.get("target").getValue());
		Assertions.assertEquals("1", assignment.get("value").getValue());
	}

	@Test
	void testGetByChildType() {
		Proxy assignment = Tree.parse("x = 1\n").root().find("assignment");
		Assertions.assertEquals("1", assignment.get("int").getValue());
		Assertions.assertSame(assignment.get("target"), assignment.get("name"));
	}

	@Test
	void testGetReturnsSameProxy() {
		Proxy assignment = Tree.parse("x = 1\n").root().find("assignment");
		Assertions.assertSame(assignment.get("target"), assignment.get("target"));
		Assertions.assertSame(assignment, assignment.get("target").parent());
	}

	@Test
	void testGetAmbiguousTypeFails() {
		Proxy assignment = Tree.parse("a = b\n").root().find("assignment");
		Assertions.assertThrows(IdentifierError.class, () -> assignment.get("name"));
	}

	@Test
	void testGetNonNodeAttributesFails() {
		Tree tree = Tree.parse("def f():\n    pass\n");
		Proxy def = tree.root().find("def");
		Assertions.assertThrows(IdentifierError.class, () -> def.get("name"));
		Assertions.assertThrows(IdentifierError.class, () -> def.get("async"));
		Assertions.assertThrows(IdentifierError.class, () -> def.get("value"));
		Assertions.assertThrows(IdentifierError.class, () -> def.get("bogus"));
	}

	@Test
	void testGetOnAtomFails() {
		Proxy name = Tree.parse("x = 1\n").root().find("name");
		Assertions.assertThrows(IdentifierError.class, () -> name.get("value"));
	}

	@Test
	void testGetAbsentOptionalNode() {
		Proxy statement = Tree.parse("return\n").root().find("return");
		Assertions.assertNull(statement.get("value"));
	}

	// ------------------------------------------------------------------
	// set()
	// ------------------------------------------------------------------

	@Test
	void testSetFromSource() {
		Tree tree = Tree.parse("return 1\n");
		Proxy value = tree.root().find("return").set("value", "a + b");
		Assertions.assertEquals("return a + b\n", tree.dumps());
		Assertions.assertEquals("binary_operator", value.getType());
		Assertions.assertTrue(value.isAttached());
	}

	@Test
	void testSetReplacedChildIsDetached() {
		Tree tree = Tree.parse("return 1\n");
		Proxy statement = tree.root().find("return");
		Proxy old = statement.get("value");
		statement.set("value", "2");
		Assertions.assertTrue(old.isDetached());
		Assertions.assertThrows(DetachedNodeError.class, old::parent);
	}

	@Test
	void testSetOptionalAddsSpacing() {
		Tree tree = Tree.parse("def f():\n    pass\n");
		tree.root().find("def").set("return_annotation", "int");
		Assertions.assertEquals("def f() -> int:\n    pass\n", tree.dumps());
	}

	@Test
	void testSliceStepTogglesSecondColon() {
		Tree tree = Tree.parse("a[1:2]\n");
		Proxy slice = tree.root().find("slice");
		slice.set("step", "3");
		Assertions.assertEquals("a[1:2:3]\n", tree.dumps());
		Assertions.assertTrue(slice.getFlag("has_two_colons"));
		slice.set("step", null);
		Assertions.assertEquals("a[1:2]\n", tree.dumps());
		Assertions.assertFalse(slice.getFlag("has_two_colons"));
	}

	@Test
	void testSetImportAlias() {
		Tree tree = Tree.parse("import os\n");
		tree.root().find("dotted_as_name").set("target", "o");
		Assertions.assertEquals("import os as o\n", tree.dumps());
	}

	@Test
	void testSetRequiredToNullFails() {
		Tree tree = Tree.parse("x = 1\n");
		Proxy assignment = tree.root().find("assignment");
		Assertions.assertThrows(ValidationError.class, () -> assignment.set("target", null));
		Assertions.assertEquals("x = 1\n", tree.dumps());
	}

	@Test
	void testSetAttachedProxyFails() {
		Tree tree = Tree.parse("a = 1\nb = 2\n");
		Proxy first = tree.root().list("value").get(0);
		Proxy second = tree.root().list("value").get(1);
		Assertions.assertThrows(ValidationError.class, () -> first.set("value", second.get("value")));
		Assertions.assertEquals("a = 1\nb = 2\n", tree.dumps());
	}

	@Test
	void testSetCopyOfAttachedProxy() {
		Tree tree = Tree.parse("a = 1\nb = f(x)\n");
		Proxy first = tree.root().list("value").get(0);
		Proxy second = tree.root().list("value").get(1);
		first.set("value", second.get("value").copy());
		Assertions.assertEquals("a = f(x)\nb = f(x)\n", tree.dumps());
	}

	@Test
	void testSetStringAttributeThroughSetFails() {
		Proxy def = Tree.parse("def f():\n    pass\n").root().find("def");
		Assertions.assertThrows(IdentifierError.class, () -> def.set("name", "g"));
	}

	@Test
	void testSetInvalidSourceFails() {
		Tree tree = Tree.parse("x = 1\n");
		Proxy assignment = tree.root().find("assignment");
		Assertions.assertThrows(ParseError.class, () -> assignment.set("value", "1 +"));
		Assertions.assertEquals("x = 1\n", tree.dumps());
	}

	// ------------------------------------------------------------------
	// Strings, flags and atoms
	// ------------------------------------------------------------------

	@Test
	void testSetString() {
		Tree tree = Tree.parse("def f():\n    pass\n");
		Proxy def = tree.root().find("def");
		def.setString("name", "g");
		Assertions.assertEquals("g", def.getString("name"));
		Assertions.assertEquals("def g():\n    pass\n", tree.dumps());
	}

	@Test
	void testSetStringOnWrongKindFails() {
		Proxy def = Tree.parse("def f():\n    pass\n").root().find("def");
		Assertions.assertThrows(IdentifierError.class, () -> def.setString("async", "x"));
		Assertions.assertThrows(IdentifierError.class, () -> def.getFlag("name"));
	}

	@Test
	void testSetFlagAsync() {
		Tree tree = Tree.parse("def f():\n    pass\n");
		Proxy def = tree.root().find("def");
		def.setFlag("async", true);
		Assertions.assertEquals("async def f():\n    pass\n", tree.dumps());
		def.setFlag("async", false);
		Assertions.assertEquals("def f():\n    pass\n", tree.dumps());
	}

	@Test
	void testSetFlagTupleParenthesis() {
		Tree tree = Tree.parse("x = 1, 2\n");
		tree.root().find("tuple").setFlag("with_parenthesis", true);
		Assertions.assertEquals("x = (1, 2)\n", tree.dumps());
	}

	@Test
	void testSetValueOfAtom() {
		Tree tree = Tree.parse("print(x)\n");
		tree.root().find("name", java.util.Collections.singletonMap("value", "x")).setValue("y");
		Assertions.assertEquals("print(y)\n", tree.dumps());
	}

	@Test
	void testSetValueRejectsEmptyAndComposites() {
		Tree tree = Tree.parse("x = 1\n");
		Assertions.assertThrows(ValidationError.class, () -> tree.root().find("name").setValue(""));
		Assertions.assertThrows(IdentifierError.class, () -> tree.root().find("assignment").setValue("y"));
		Assertions.assertThrows(IdentifierError.class, () -> tree.root().find("assignment").getValue());
	}

	@Test
	void testNamesMustBeIdentifiers() {
		Tree tree = Tree.parse("def f():\n    x = 1\n");
		Proxy def = tree.root().find("def");
		Proxy target = tree.root().find("assignment").get("target");
		Assertions.assertThrows(ValidationError.class, () -> target.setValue("a b"));
		Assertions.assertThrows(ValidationError.class, () -> target.setValue("1x"));
		Assertions.assertThrows(ValidationError.class, () -> target.setValue("class"));
		Assertions.assertThrows(ValidationError.class, () -> def.setString("name", "g h"));
		Assertions.assertThrows(ValidationError.class, () -> def.setString("name", "return"));
		Assertions.assertEquals("def f():\n    x = 1\n", tree.dumps());

		target.setValue("_y2");
		def.setString("name", "größe");
		Assertions.assertEquals("def größe():\n    _y2 = 1\n", tree.dumps());
	}

	// ------------------------------------------------------------------
	// Node replacement
	// ------------------------------------------------------------------

	@Test
	void testReplaceStatementOfModule() {
		Tree tree = Tree.parse("import a\nx = 1\n");
		Proxy old = tree.root().find("import");
		Proxy replacement = old.replace("import b");
		Assertions.assertEquals("import b\nx = 1\n", tree.dumps());
		Assertions.assertTrue(old.isDetached());
		Assertions.assertEquals("assignment", replacement.next().getType());
	}

	@Test
	void testReplaceSingleNodeAttribute() {
		Tree tree = Tree.parse("x = 1\n");
		tree.root().find("int").replace("2 + 3");
		Assertions.assertEquals("x = 2 + 3\n", tree.dumps());
	}

	@Test
	void testReplaceRootFails() {
		Tree tree = Tree.parse("x = 1\n");
		Assertions.assertThrows(ValidationError.class, () -> tree.root().replace("y = 2"));
	}

	@Test
	void testRewriteFlaskExtImports() {
		Tree tree = Tree.parse("from flask.ext.sqlalchemy import SQLAlchemy\n"
				+ "from flask.ext.foo.bar import a as b, c\n"
				+ "from flask.ext import login\n"
				+ "import flask.ext.cache\n"
				+ "import os\n");

		for (Proxy node : tree.root().findAll("from_import")) {
			ProxyList modules = node.list("value");
			if (modules.size() < 2 || !"flask".equals(modules.get(0).getValue())
					|| !"ext".equals(modules.get(1).getValue())) {
				continue;
			}
			if (modules.size() == 2) {
				String module = node.list("targets").get(0).get("value").getValue();
				node.replace("import flask_" + module + " as " + module);
				continue;
			}
			List<String> path = new ArrayList<>();
			for (int i = 2; i < modules.size(); i++) {
				path.add(modules.get(i).getValue());
			}
			List<String> targets = new ArrayList<>();
			for (Proxy target : node.list("targets")) {
				targets.add(target.dumps());
			}
			node.replace("from flask_" + String.join(".", path) + " import " + String.join(", ", targets));
		}
		for (Proxy node : tree.root().findAll("import")) {
			ProxyList names = node.list("value").get(0).list("value");
			if (names.size() >= 3 && "flask".equals(names.get(0).getValue())
					&& "ext".equals(names.get(1).getValue())) {
				node.replace("import flask_" + names.get(2).getValue());
			}
		}

		Assertions.assertEquals("from flask_sqlalchemy import SQLAlchemy\n"
				+ "from flask_foo.bar import a as b, c\n"
				+ "import flask_login as login\n"
				+ "import flask_cache\n"
				+ "import os\n", tree.dumps());
		Assertions.assertEquals("from_import", tree.root().list("value").get(0).next().getType());
	}

	// ------------------------------------------------------------------
	// Navigation
	// ------------------------------------------------------------------

	@Test
	void testParentAndRoot() {
		Tree tree = Tree.parse("x = f(a)\n");
		Proxy argument = tree.root().find("name", java.util.Collections.singletonMap("value", "a"));
		Assertions.assertEquals("call", argument.parent().getType());
		Assertions.assertSame(tree.root(), argument.root());
		Assertions.assertNull(tree.root().parent());
	}

	@Test
	void testNextAndPrevious() {
		Tree tree = Tree.parse("a = 1\nb = 2\nc = 3\n");
		ProxyList statements = tree.root().list("value");
		Proxy b = statements.get(1);
		Assertions.assertSame(statements.get(2), b.next());
		Assertions.assertSame(statements.get(0), b.previous());
		Assertions.assertNull(statements.get(2).next());
		Assertions.assertNull(statements.get(0).previous());
		Assertions.assertEquals(OptionalInt.of(1), b.indexOnParent());
	}

	@Test
	void testIndexOnParentOutsideCollection() {
		Tree tree = Tree.parse("x = 1\n");
		Assertions.assertFalse(tree.root().indexOnParent().isPresent());
		Assertions.assertFalse(tree.root().find("name").indexOnParent().isPresent());
		Assertions.assertNull(tree.root().find("name").next());
	}

	@Test
	void testNextAndPreviousInSeparatedList() {
		Tree tree = Tree.parse("f(a, b)\n");
		ProxyList arguments = tree.root().find("call").list("value");
		Assertions.assertSame(arguments.get(1), arguments.get(0).next());
		Assertions.assertEquals(OptionalInt.of(1), arguments.get(1).indexOnParent());
	}

	@Test
	void testRecursiveNavigationCrossesBlocks() {
		Tree tree = Tree.parse("if x:\n    a = 1\nb = 2\n");
		Proxy a = tree.root().find("if").list("value").get(0);
		Proxy b = tree.root().list("value").get(1);
		Assertions.assertNull(a.next());
		Assertions.assertSame(b, a.nextRecursive());
		Assertions.assertSame(a, b.previousRecursive());
		Assertions.assertNull(b.nextRecursive());
	}

	@Test
	void testPathResolvesToNode() {
		Tree tree = Tree.parse("a = 1\nif b:\n    c = [1, 2]\n");
		Proxy two = tree.root().findAll("int").get(2);
		NodePath path = two.path();
		Assertions.assertSame(two.node(), path.resolve(tree.root().node()));
		Assertions.assertTrue(tree.root().path().isRoot());
	}

	@Test
	void testRange() {
		Tree tree = Tree.parse("a = 1\nb = 2\n");
		Proxy b = tree.root().list("value").get(1);
		Assertions.assertEquals(new Range(new Position(1, 0), new Position(1, 5)), b.range());
		Assertions.assertEquals(new Range(new Position(1, 4), new Position(1, 5)), b.get("value").range());
	}

	// ------------------------------------------------------------------
	// Copies and detached nodes
	// ------------------------------------------------------------------

	@Test
	void testCopyIsDetachedAndDedented() {
		Tree tree = Tree.parse("def f():\n    if x:\n        y = 1\n");
		Proxy copy = tree.root().find("if").copy();
		Assertions.assertTrue(copy.isDetached());
		Assertions.assertFalse(copy.isAttached());
		Assertions.assertEquals("if x:\n    y = 1\n", copy.dumps());
		Assertions.assertEquals("def f():\n    if x:\n        y = 1\n", tree.dumps());
	}

	@Test
	void testCopyAppendedElsewhere() {
		Tree tree = Tree.parse("x = 1\ny = 2\n");
		tree.root().list("value").append(tree.root().list("value").get(0).copy());
		Assertions.assertEquals("x = 1\ny = 2\nx = 1\n", tree.dumps());
	}

	@Test
	void testMoveByRemoveAndAppend() {
		Tree tree = Tree.parse("a = 1\nb = 2\n");
		Proxy removed = tree.root().list("value").remove(0);
		Assertions.assertTrue(removed.isDetached());
		tree.root().list("value").append(removed);
		Assertions.assertEquals("b = 2\na = 1\n", tree.dumps());
		Assertions.assertFalse(removed.isDetached());
		Assertions.assertSame(tree.root(), removed.parent());
	}

	@Test
	void testDetachedNodeRejectsUpwardNavigationAndMutation() {
		Tree tree = Tree.parse("a = 1\nb = 2\n");
		Proxy removed = tree.root().list("value").remove(0);
		Assertions.assertThrows(DetachedNodeError.class, removed::parent);
		Assertions.assertThrows(DetachedNodeError.class, removed::root);
		Assertions.assertThrows(DetachedNodeError.class, removed::path);
		Assertions.assertThrows(DetachedNodeError.class, removed::range);
		Assertions.assertThrows(DetachedNodeError.class, () -> removed.set("value", "3"));
		Assertions.assertEquals("a = 1", removed.dumps());
	}

	// ------------------------------------------------------------------
	// Conversions
	// ------------------------------------------------------------------

	@Test
	void testDescribe() {
		String description = Tree.parse("x = 1\n").root().describe();
		Assertions.assertTrue(description.startsWith("module\n"), description);
		Assertions.assertTrue(description.contains("value[0]: assignment"), description);
		Assertions.assertTrue(description.contains("target: name 'x'"), description);
		Assertions.assertTrue(description.contains("value: int '1'"), description);
		Assertions.assertFalse(description.contains("endl"), description);
	}

	@Test
	void testFstAndJson() {
		Proxy name = Tree.parse("x = 1\n").root().find("name");
		Assertions.assertEquals("name", name.fst().get("type"));
		Assertions.assertEquals("x", name.fst().get("value"));
		Assertions.assertTrue(name.toJson().contains("\"value\""));
	}

	@Test
	void testEvaluateLiteral() {
		Proxy value = Tree.parse("x = [1, 'a']\n").root().find("list");
		Assertions.assertEquals(java.util.Arrays.asList(1L, "a"), value.evaluateLiteral());
	}

	@Test
	void testToStringAbbreviates() {
		Proxy module = Tree.parse("value = 'a fairly long string literal here'\n").root();
		String text = module.toString();
		Assertions.assertTrue(text.startsWith("module("), text);
		Assertions.assertTrue(text.endsWith("...)"), text);
	}

	// ------------------------------------------------------------------
	// Indentation
	// ------------------------------------------------------------------

	@Test
	void testIncreaseAndDecreaseIndentationOfStatement() {
		Tree tree = Tree.parse("if a:\n    b = 1\n    c = 2\n");
		Proxy b = tree.root().find("if").list("value").get(0);
		b.increaseIndentation(1);
		Assertions.assertEquals("if a:\n        b = 1\n    c = 2\n", tree.dumps());
		b.decreaseIndentation(1);
		Assertions.assertEquals("if a:\n    b = 1\n    c = 2\n", tree.dumps());
	}

	@Test
	void testStatementCannotBeDedentedOutOfItsBlock() {
		String source = "if a:\n    b = 1\n";
		Tree tree = Tree.parse(source);
		Proxy b = tree.root().find("if").list("value").get(0);
		Assertions.assertThrows(ValidationError.class, () -> b.decreaseIndentation(1));
		Assertions.assertEquals(source, tree.dumps());
	}

	@Test
	void testNegativeLevelsFail() {
		Proxy module = Tree.parse("x = 1\n").root();
		Assertions.assertThrows(IllegalArgumentException.class, () -> module.increaseIndentation(-1));
		Assertions.assertThrows(IllegalArgumentException.class, () -> module.decreaseIndentation(-1));
	}
}
