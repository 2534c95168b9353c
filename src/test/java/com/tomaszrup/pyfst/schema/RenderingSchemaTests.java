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
package com.tomaszrup.pyfst.schema;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RenderingSchemaTests {

	@Test
	void testAtomTypesHaveNoSlots() {
		SchemaEntry entry = RenderingSchema.entry("name");
		Assertions.assertTrue(entry.isAtom());
		Assertions.assertTrue(entry.getSlots().isEmpty());
	}

	@Test
	void testUnknownTypeIsRejected() {
		Assertions.assertThrows(ValidationError.class, () -> RenderingSchema.entry("print"));
		Assertions.assertFalse(RenderingSchema.isKnownType("print"));
	}

	@Test
	void testDefSlotOrder() {
		SchemaEntry entry = RenderingSchema.entry("def");
		Slot first = entry.getSlots().get(0);
		Assertions.assertEquals("decorators", first.getName());
		Assertions.assertEquals(ListPolicy.DECORATORS, first.getPolicy());
		Slot value = entry.getAttribute("value");
		Assertions.assertEquals(ListPolicy.LINES, value.getPolicy());
		Slot arguments = entry.getAttribute("arguments");
		Assertions.assertEquals(SlotKind.SEPARATED_LIST, arguments.getKind());
		Assertions.assertEquals(RenderingSchema.COMMA, arguments.getSeparatorType());
	}

	@Test
	void testConditionalConstantNamesItsAttribute() {
		SchemaEntry entry = RenderingSchema.entry("def");
		Slot arrow = null;
		for (Slot slot : entry.getSlots()) {
			if (slot.getKind() == SlotKind.CONSTANT && "->".equals(slot.getConstantText())) {
				arrow = slot;
			}
		}
		Assertions.assertNotNull(arrow);
		Assertions.assertEquals("return_annotation", arrow.getCondition());
		Assertions.assertTrue(entry.getAttribute("return_annotation").isOptional());
	}

	@Test
	void testConstantsAreNotAttributes() {
		SchemaEntry entry = RenderingSchema.entry("if");
		Assertions.assertFalse(entry.hasAttribute("if"));
		Assertions.assertTrue(entry.hasAttribute("test"));
		Assertions.assertTrue(entry.hasAttribute("clauses"));
	}

	@Test
	void testDottedNamesUseDotSeparators() {
		Assertions.assertEquals(RenderingSchema.DOT,
				RenderingSchema.entry("dotted_as_name").getAttribute("value").getSeparatorType());
	}

	@Test
	void testFormattingTypes() {
		Assertions.assertTrue(RenderingSchema.isFormattingType("space"));
		Assertions.assertTrue(RenderingSchema.isFormattingType("comment"));
		Assertions.assertTrue(RenderingSchema.isFormattingType("semicolon"));
		Assertions.assertFalse(RenderingSchema.isFormattingType("name"));
		Assertions.assertTrue(RenderingSchema.isSeparatorType("comma"));
		Assertions.assertFalse(RenderingSchema.isSeparatorType("endl"));
	}

	@Test
	void testEveryEntryIsConsistent() {
		for (String type : RenderingSchema.types()) {
			SchemaEntry entry = RenderingSchema.entry(type);
			Assertions.assertEquals(type, entry.getType());
			for (Slot slot : entry.getSlots()) {
				if (slot.getCondition() != null) {
					Assertions.assertTrue(entry.hasAttribute(slot.getCondition()), type + " " + slot);
				}
			}
		}
	}
}
