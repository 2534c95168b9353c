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
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.tomaszrup.pyfst.fst.AtomNode;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.parser.FragmentParser;
import com.tomaszrup.pyfst.schema.ListPolicy;
import com.tomaszrup.pyfst.schema.RenderingSchema;
import com.tomaszrup.pyfst.schema.SchemaEntry;
import com.tomaszrup.pyfst.schema.Slot;
import com.tomaszrup.pyfst.schema.SlotKind;

/**
 * Node factories and context tables shared by the mutation code.
 */
final class Splice {

	private static final Set<String> NAME_ATTRIBUTES = new HashSet<>(Arrays.asList(
			"def_argument.target", "except.target", "dotted_as_name.target", "name_as_name.value",
			"name_as_name.target", "call_argument.target"));

	private static final Set<String> EXPRESSION_ATTRIBUTES = new HashSet<>(Arrays.asList(
			"assignment.target", "assignment.value", "annotated_assignment.value", "for.target",
			"for.iterable", "return.value", "del.value", "yield.value", "getitem.value",
			"comprehension_loop.target"));

	private Splice() {
	}

	// ----------------------------------------------------------------
	// Node factories
	// ----------------------------------------------------------------

	static AtomNode space(String value) {
		return new AtomNode("space", value);
	}

	static CompositeNode endl(String newline) {
		CompositeNode endl = new CompositeNode("endl");
		endl.set("value", newline);
		return endl;
	}

	static CompositeNode semicolon() {
		CompositeNode semicolon = new CompositeNode("semicolon");
		semicolon.add("second_formatting", space(" "));
		return semicolon;
	}

	static CompositeNode dot() {
		return new CompositeNode(RenderingSchema.DOT);
	}

	/**
	 * A comma in the given style, e.g. {@code ", "} or {@code " , "}.
	 */
	static CompositeNode comma(String style) {
		CompositeNode comma = new CompositeNode(RenderingSchema.COMMA);
		int at = style.indexOf(',');
		if (at > 0) {
			comma.add("first_formatting", space(style.substring(0, at)));
		}
		if (at + 1 < style.length()) {
			comma.add("second_formatting", space(style.substring(at + 1)));
		}
		return comma;
	}

	// ----------------------------------------------------------------
	// Classification
	// ----------------------------------------------------------------

	/**
	 * Statements and clauses that own a block.
	 */
	static boolean isCompound(FstNode node) {
		if (node == null || node.isAtom() || node.is("module")) {
			return false;
		}
		Slot value = ((CompositeNode) node).getEntry().getAttribute("value");
		return value != null && value.getKind() == SlotKind.NODE_LIST && value.getPolicy() == ListPolicy.LINES;
	}

	static boolean isItem(FstNode node) {
		return !RenderingSchema.isFormattingType(node.getType());
	}

	static List<Integer> itemIndices(List<FstNode> entries) {
		List<Integer> items = new ArrayList<>();
		for (int i = 0; i < entries.size(); i++) {
			if (isItem(entries.get(i))) {
				items.add(i);
			}
		}
		return items;
	}

	static boolean containsComment(List<FstNode> formatting) {
		for (FstNode node : formatting) {
			if (node.is("comment")) {
				return true;
			}
		}
		return false;
	}

	static boolean containsNewline(List<FstNode> formatting) {
		for (FstNode node : formatting) {
			if (node.is("space")) {
				String value = ((AtomNode) node).getValue();
				if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
					return true;
				}
			}
		}
		return false;
	}

	// ----------------------------------------------------------------
	// Fragment contexts
	// ----------------------------------------------------------------

	/**
	 * Grammatical context of the items of list {@code attribute} of a
	 * {@code type} node.
	 */
	static FragmentParser.Kind listKind(String type, String attribute) {
		Slot slot = RenderingSchema.entry(type).getAttribute(attribute);
		if (slot.getKind() == SlotKind.NODE_LIST) {
			switch (slot.getPolicy()) {
				case LINES:
					return FragmentParser.Kind.STATEMENT;
				case CLAUSES:
					return FragmentParser.Kind.CLAUSE;
				case DECORATORS:
					return FragmentParser.Kind.DECORATOR;
				default:
					break;
			}
		}
		switch (type) {
			case "import":
				return FragmentParser.Kind.IMPORT_NAME;
			case "from_import":
				return "targets".equals(attribute) ? FragmentParser.Kind.IMPORT_TARGET : FragmentParser.Kind.NAME;
			case "global":
			case "nonlocal":
			case "dotted_as_name":
				return FragmentParser.Kind.NAME;
			case "with":
				return FragmentParser.Kind.WITH_ITEM;
			case "def":
				return FragmentParser.Kind.DEF_ARGUMENT;
			case "lambda":
				return FragmentParser.Kind.LAMBDA_ARGUMENT;
			case "class":
			case "call":
				return FragmentParser.Kind.CALL_ARGUMENT;
			case "dict":
				return FragmentParser.Kind.DICT_ITEM;
			case "atomtrailers":
				return FragmentParser.Kind.TRAILER;
			case "string_chain":
				return FragmentParser.Kind.STRING;
			case "comprehension_loop":
				return FragmentParser.Kind.COMPREHENSION_IF;
			default:
				if ("generators".equals(attribute)) {
					return FragmentParser.Kind.COMPREHENSION_LOOP;
				}
				return FragmentParser.Kind.ELEMENT;
		}
	}

	/**
	 * Grammatical context of the single-node attribute {@code attribute} of
	 * a {@code type} node.
	 */
	static FragmentParser.Kind attributeKind(String type, String attribute) {
		String key = type + "." + attribute;
		if (NAME_ATTRIBUTES.contains(key)) {
			return FragmentParser.Kind.NAME;
		}
		if (EXPRESSION_ATTRIBUTES.contains(key)) {
			return FragmentParser.Kind.EXPRESSION;
		}
		if ("dict_comprehension.result".equals(key)) {
			return FragmentParser.Kind.DICT_ITEM;
		}
		return FragmentParser.Kind.ELEMENT;
	}

	// ----------------------------------------------------------------
	// Optional attribute spacing
	// ----------------------------------------------------------------

	/**
	 * Fills in or clears the whitespace around the constants that appear
	 * together with optional node {@code attribute}, e.g. the spaces around
	 * {@code as} when an import alias is added.
	 */
	static void adjustOptionalSpacing(CompositeNode node, String attribute, boolean present) {
		SchemaEntry entry = node.getEntry();
		List<Slot> slots = entry.getSlots();
		boolean spacedEquals = node.is("annotated_assignment")
				|| (node.is("def_argument") && node.getNode("annotation") != null);
		for (int i = 0; i < slots.size(); i++) {
			Slot constant = slots.get(i);
			if (constant.getKind() != SlotKind.CONSTANT || !attribute.equals(constant.getCondition())) {
				continue;
			}
			String text = constant.getConstantText();
			boolean keyword = Character.isLetter(text.charAt(0));
			boolean spaced = keyword || "->".equals(text) || ("=".equals(text) && spacedEquals);
			Slot before = i > 0 ? slots.get(i - 1) : null;
			Slot after = i + 1 < slots.size() ? slots.get(i + 1) : null;
			if (present) {
				if (spaced) {
					fillSpace(node, before);
					fillSpace(node, after);
				} else if (":".equals(text) || ",".equals(text)) {
					fillSpace(node, after);
				}
			} else {
				clearSpace(node, before);
				clearSpace(node, after);
			}
		}
		// a keyword directly in front of the attribute, as in "return value"
		for (int i = 2; i < slots.size(); i++) {
			if (!attribute.equals(slots.get(i).getName())) {
				continue;
			}
			Slot formatting = slots.get(i - 1);
			Slot keyword = slots.get(i - 2);
			if (formatting.isFormatting() && keyword.getKind() == SlotKind.CONSTANT
					&& keyword.getCondition() == null && Character.isLetter(keyword.getConstantText().charAt(0))) {
				if (present) {
					fillSpace(node, formatting);
				} else {
					clearSpace(node, formatting);
				}
			}
		}
	}

	/**
	 * Keeps the second colon of a slice in step with its {@code step}.
	 */
	static void adjustSliceStep(CompositeNode node, boolean present) {
		node.set("has_two_colons", present);
		if (!present) {
			clearSpace(node, node.getEntry().getAttribute("third_formatting"));
			clearSpace(node, node.getEntry().getAttribute("fourth_formatting"));
		}
	}

	/**
	 * Puts a space after a keyword constant controlled by {@code flag}, or
	 * removes the whitespace there when the flag is cleared.
	 */
	static void adjustFlagSpacing(CompositeNode node, String flag, boolean value) {
		List<Slot> slots = node.getEntry().getSlots();
		for (int i = 0; i < slots.size(); i++) {
			Slot constant = slots.get(i);
			if (constant.getKind() != SlotKind.CONSTANT || !flag.equals(constant.getCondition())
					|| !Character.isLetter(constant.getConstantText().charAt(0))) {
				continue;
			}
			Slot after = i + 1 < slots.size() ? slots.get(i + 1) : null;
			if (value) {
				fillSpace(node, after);
			} else {
				clearSpace(node, after);
			}
		}
	}

	private static void fillSpace(CompositeNode node, Slot slot) {
		if (slot != null && slot.isFormatting() && node.getList(slot.getName()).isEmpty()) {
			List<FstNode> formatting = new ArrayList<>();
			formatting.add(space(" "));
			node.set(slot.getName(), formatting);
		}
	}

	private static void clearSpace(CompositeNode node, Slot slot) {
		if (slot != null && slot.isFormatting() && !containsComment(node.getList(slot.getName()))) {
			node.set(slot.getName(), new ArrayList<FstNode>());
		}
	}
}
