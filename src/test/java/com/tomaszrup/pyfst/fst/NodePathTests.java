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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pyfst.parser.Parser;

class NodePathTests {

	@Test
	void testResolveThroughListsAndNodes() {
		CompositeNode module = Parser.parse("x = f(a)\n");
		NodePath path = NodePath.root().child("value", 0).child("target", -1);
		FstNode target = path.resolve(module);
		Assertions.assertTrue(target.is("name"));
		Assertions.assertEquals("x", ((AtomNode) target).getValue());
	}

	@Test
	void testRootResolvesToItself() {
		CompositeNode module = Parser.parse("pass\n");
		Assertions.assertTrue(NodePath.root().isRoot());
		Assertions.assertSame(module, NodePath.root().resolve(module));
	}

	@Test
	void testStalePathResolvesToNull() {
		CompositeNode module = Parser.parse("pass\n");
		Assertions.assertNull(NodePath.root().child("value", 5).resolve(module));
		Assertions.assertNull(NodePath.root().child("missing", -1).resolve(module));
		Assertions.assertNull(NodePath.root().child("value", 0).child("value", 0).resolve(module));
	}

	@Test
	void testEquality() {
		NodePath a = NodePath.root().child("value", 1);
		NodePath b = NodePath.root().child("value", 1);
		Assertions.assertEquals(a, b);
		Assertions.assertEquals(a.hashCode(), b.hashCode());
		Assertions.assertNotEquals(a, NodePath.root().child("value", 2));
	}
}
