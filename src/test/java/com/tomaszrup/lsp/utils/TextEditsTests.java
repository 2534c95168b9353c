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
package com.tomaszrup.lsp.utils;

import java.util.List;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link TextEdits}: minimal line diffs and applying them.
 */
class TextEditsTests {

	// ------------------------------------------------------------------
	// diff()
	// ------------------------------------------------------------------

	@Test
	void testDiffOfEqualTextsIsEmpty() {
		Assertions.assertTrue(TextEdits.diff("a\nb\n", "a\nb\n").isEmpty());
	}

	@Test
	void testDiffReplacesOnlyChangedLine() {
		List<TextEdit> edits = TextEdits.diff("a = 1\nb = 2\nc = 3\n", "a = 1\nB = 2\nc = 3\n");
		Assertions.assertEquals(1, edits.size());
		TextEdit edit = edits.get(0);
		Assertions.assertEquals(new Range(new Position(1, 0), new Position(2, 0)), edit.getRange());
		Assertions.assertEquals("B = 2\n", edit.getNewText());
	}

	@Test
	void testDiffOfPureInsertionHasEmptyRange() {
		List<TextEdit> edits = TextEdits.diff("a\nc\n", "a\nb\nc\n");
		TextEdit edit = edits.get(0);
		Assertions.assertEquals(edit.getRange().getStart(), edit.getRange().getEnd());
		Assertions.assertEquals("b\n", edit.getNewText());
	}

	@Test
	void testDiffOfDeletionHasEmptyText() {
		List<TextEdit> edits = TextEdits.diff("a\nb\nc\n", "a\nc\n");
		Assertions.assertEquals("", edits.get(0).getNewText());
	}

	@Test
	void testChangedLineEndingCounts() {
		Assertions.assertEquals(1, TextEdits.diff("a\nb\n", "a\r\nb\n").size());
	}

	// ------------------------------------------------------------------
	// apply()
	// ------------------------------------------------------------------

	@Test
	void testApplyReproducesUpdatedText() {
		String[][] pairs = {
				{"a = 1\nb = 2\n", "b = 2\n"},
				{"", "x = 1\n"},
				{"x = 1\n", ""},
				{"def f():\n    pass\n", "def f():\n        pass\n"},
				{"a\nb", "a\nb\nc"},
				{"a\r\nb\r\n", "a\r\nc\r\nb\r\n"},
		};
		for (String[] pair : pairs) {
			Assertions.assertEquals(pair[1], TextEdits.apply(pair[0], TextEdits.diff(pair[0], pair[1])), pair[0]);
		}
	}

	@Test
	void testApplyMultipleEditsFromTheEnd() {
		TextEdit first = new TextEdit(new Range(new Position(0, 0), new Position(0, 1)), "A");
		TextEdit second = new TextEdit(new Range(new Position(1, 0), new Position(1, 1)), "B");
		Assertions.assertEquals("A\nB\n", TextEdits.apply("a\nb\n", java.util.Arrays.asList(first, second)));
	}

	@Test
	void testApplyOutsideTextFails() {
		TextEdit edit = new TextEdit(new Range(new Position(5, 0), new Position(5, 1)), "x");
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> TextEdits.apply("a\n", java.util.Collections.singletonList(edit)));
	}
}
