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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exhaustive, immutable table of node types and their rendering order.
 *
 * <p>This is the single source of truth for the shape of every FST node: the
 * parser validates what it builds against it, the renderer walks it, the
 * interchange format uses its attribute names, and the proxy layer derives
 * attribute shortcuts and collection policies from it.</p>
 */
public final class RenderingSchema {

	/** Bump whenever an entry changes; persisted FST caches carry it. */
	public static final int VERSION = 1;

	public static final String COMMA = "comma";
	public static final String DOT = "dot";

	private static final Map<String, SchemaEntry> ENTRIES;

	static {
		Map<String, SchemaEntry> entries = new LinkedHashMap<>();

		for (String atom : new String[] {"name", "int", "float", "complex", "hexa", "octa", "binary",
				"string", "space", "pass", "break", "continue", "ellipsis", "star",
				"positional_only_marker"}) {
			entries.put(atom, new SchemaEntry(atom, true, Collections.emptyList()));
		}

		// layout
		define(entries, new Builder("module").lines("value"));
		define(entries, new Builder("endl").formatting("formatting").string("value"));
		define(entries, new Builder("comment").formatting("formatting").string("value"));
		define(entries, separator("comma", ","));
		define(entries, separator("dot", "."));
		define(entries, separator("semicolon", ";"));

		// simple statements
		define(entries, new Builder("assignment")
				.node("target").formatting("first_formatting").string("operator").constant("=")
				.formatting("second_formatting").node("value"));
		define(entries, new Builder("annotated_assignment")
				.node("target").formatting("first_formatting").constant(":").formatting("second_formatting")
				.node("annotation").formatting("third_formatting").constantIf("=", "value")
				.formatting("fourth_formatting").optionalNode("value"));
		define(entries, new Builder("return")
				.constant("return").formatting("formatting").optionalNode("value"));
		define(entries, new Builder("raise")
				.constant("raise").formatting("first_formatting").optionalNode("value")
				.formatting("second_formatting").constantIf("from", "cause")
				.formatting("third_formatting").optionalNode("cause"));
		define(entries, new Builder("del").constant("del").formatting("formatting").node("value"));
		define(entries, new Builder("assert")
				.constant("assert").formatting("first_formatting").node("value")
				.formatting("second_formatting").constantIf(",", "message")
				.formatting("third_formatting").optionalNode("message"));
		define(entries, new Builder("global").constant("global").formatting("formatting").separated("value", COMMA));
		define(entries, new Builder("nonlocal").constant("nonlocal").formatting("formatting").separated("value", COMMA));
		define(entries, new Builder("import").constant("import").formatting("formatting").separated("value", COMMA));
		define(entries, new Builder("dotted_as_name")
				.separated("value", DOT).formatting("first_formatting").constantIf("as", "target")
				.formatting("second_formatting").optionalNode("target"));
		define(entries, new Builder("from_import")
				.flag("with_parenthesis")
				.constant("from").formatting("first_formatting").string("dots").separated("value", DOT)
				.formatting("second_formatting").constant("import").formatting("third_formatting")
				.constantIf("(", "with_parenthesis").formatting("fourth_formatting")
				.separated("targets", COMMA).formatting("fifth_formatting")
				.constantIf(")", "with_parenthesis"));
		define(entries, new Builder("name_as_name")
				.node("value").formatting("first_formatting").constantIf("as", "target")
				.formatting("second_formatting").optionalNode("target"));

		// compound statements
		define(entries, new Builder("if")
				.constant("if").formatting("first_formatting").node("test").formatting("second_formatting")
				.constant(":").formatting("third_formatting").lines("value").clauses("clauses"));
		define(entries, new Builder("elif")
				.constant("elif").formatting("first_formatting").node("test").formatting("second_formatting")
				.constant(":").formatting("third_formatting").lines("value"));
		define(entries, new Builder("else")
				.constant("else").formatting("first_formatting").constant(":")
				.formatting("second_formatting").lines("value"));
		define(entries, new Builder("while")
				.constant("while").formatting("first_formatting").node("test").formatting("second_formatting")
				.constant(":").formatting("third_formatting").lines("value").clauses("clauses"));
		define(entries, new Builder("for")
				.constant("for").formatting("first_formatting").node("target").formatting("second_formatting")
				.constant("in").formatting("third_formatting").node("iterable").formatting("fourth_formatting")
				.constant(":").formatting("fifth_formatting").lines("value").clauses("clauses"));
		define(entries, new Builder("try")
				.constant("try").formatting("first_formatting").constant(":").formatting("second_formatting")
				.lines("value").clauses("clauses"));
		define(entries, new Builder("except")
				.constant("except").formatting("first_formatting").optionalNode("exception")
				.formatting("second_formatting").constantIf("as", "target").formatting("third_formatting")
				.optionalNode("target").formatting("fourth_formatting").constant(":")
				.formatting("fifth_formatting").lines("value"));
		define(entries, new Builder("finally")
				.constant("finally").formatting("first_formatting").constant(":")
				.formatting("second_formatting").lines("value"));
		define(entries, new Builder("with")
				.constant("with").formatting("first_formatting").separated("contexts", COMMA)
				.formatting("second_formatting").constant(":").formatting("third_formatting").lines("value"));
		define(entries, new Builder("with_context_item")
				.node("value").formatting("first_formatting").constantIf("as", "target")
				.formatting("second_formatting").optionalNode("target"));
		define(entries, new Builder("def")
				.decorators("decorators").flag("async").constantIf("async", "async").formatting("async_formatting")
				.constant("def").formatting("first_formatting").string("name").formatting("second_formatting")
				.constant("(").formatting("third_formatting").separated("arguments", COMMA)
				.formatting("fourth_formatting").constant(")").formatting("fifth_formatting")
				.constantIf("->", "return_annotation").formatting("sixth_formatting")
				.optionalNode("return_annotation").formatting("seventh_formatting").constant(":")
				.formatting("eighth_formatting").lines("value"));
		define(entries, new Builder("class")
				.decorators("decorators").constant("class").formatting("first_formatting").string("name")
				.formatting("second_formatting").flag("parenthesis").constantIf("(", "parenthesis")
				.formatting("third_formatting").separated("inherit_from", COMMA).formatting("fourth_formatting")
				.constantIf(")", "parenthesis").formatting("fifth_formatting").constant(":")
				.formatting("sixth_formatting").lines("value"));
		define(entries, new Builder("decorator").constant("@").formatting("formatting").node("value"));

		// arguments
		define(entries, new Builder("def_argument")
				.node("target").formatting("first_formatting").constantIf(":", "annotation")
				.formatting("second_formatting").optionalNode("annotation").formatting("third_formatting")
				.constantIf("=", "value").formatting("fourth_formatting").optionalNode("value"));
		define(entries, new Builder("list_argument").constant("*").formatting("formatting").optionalNode("value"));
		define(entries, new Builder("dict_argument").constant("**").formatting("formatting").node("value"));
		define(entries, new Builder("call_argument")
				.node("target").formatting("first_formatting").constant("=").formatting("second_formatting")
				.node("value"));

		// expressions
		define(entries, new Builder("lambda")
				.constant("lambda").formatting("first_formatting").separated("arguments", COMMA)
				.formatting("second_formatting").constant(":").formatting("third_formatting").node("value"));
		define(entries, new Builder("ternary_operator")
				.node("first").formatting("first_formatting").constant("if").formatting("second_formatting")
				.node("value").formatting("third_formatting").constant("else").formatting("fourth_formatting")
				.node("second"));
		define(entries, operator("boolean_operator"));
		define(entries, operator("binary_operator"));
		define(entries, new Builder("comparison")
				.node("first").formatting("first_formatting").node("value").formatting("second_formatting")
				.node("second"));
		define(entries, new Builder("comparison_operator").string("first").formatting("formatting").string("second"));
		define(entries, new Builder("unitary_operator").string("value").formatting("formatting").node("target"));
		define(entries, new Builder("associative_parenthesis")
				.constant("(").formatting("first_formatting").node("value").formatting("second_formatting")
				.constant(")"));
		define(entries, new Builder("tuple")
				.flag("with_parenthesis").constantIf("(", "with_parenthesis").formatting("first_formatting")
				.separated("value", COMMA).formatting("second_formatting").constantIf(")", "with_parenthesis"));
		define(entries, display("list", "[", "]"));
		define(entries, display("set", "{", "}"));
		define(entries, display("dict", "{", "}"));
		define(entries, new Builder("dict_item")
				.node("key").formatting("first_formatting").constant(":").formatting("second_formatting")
				.node("value"));
		define(entries, comprehension("list_comprehension", "[", "]"));
		define(entries, comprehension("set_comprehension", "{", "}"));
		define(entries, comprehension("dict_comprehension", "{", "}"));
		define(entries, new Builder("generator_comprehension")
				.flag("with_parenthesis").constantIf("(", "with_parenthesis").formatting("first_formatting")
				.node("result").plain("generators").formatting("second_formatting")
				.constantIf(")", "with_parenthesis"));
		define(entries, new Builder("comprehension_loop")
				.formatting("first_formatting").constant("for").formatting("second_formatting").node("target")
				.formatting("third_formatting").constant("in").formatting("fourth_formatting").node("iterable")
				.plain("ifs"));
		define(entries, new Builder("comprehension_if")
				.formatting("first_formatting").constant("if").formatting("second_formatting").node("value"));
		define(entries, new Builder("atomtrailers").plain("value"));
		define(entries, new Builder("call")
				.formatting("first_formatting").constant("(").formatting("second_formatting")
				.separated("value", COMMA).formatting("third_formatting").constant(")"));
		define(entries, new Builder("getitem")
				.formatting("first_formatting").constant("[").formatting("second_formatting").node("value")
				.formatting("third_formatting").constant("]"));
		define(entries, new Builder("slice")
				.optionalNode("lower").formatting("first_formatting").constant(":")
				.formatting("second_formatting").optionalNode("upper").formatting("third_formatting")
				.flag("has_two_colons").constantIf(":", "has_two_colons").formatting("fourth_formatting")
				.optionalNode("step"));
		define(entries, new Builder("string_chain").plain("value"));
		define(entries, new Builder("yield").constant("yield").formatting("formatting").optionalNode("value"));
		define(entries, new Builder("yield_from")
				.constant("yield").formatting("first_formatting").constant("from")
				.formatting("second_formatting").node("value"));

		ENTRIES = Collections.unmodifiableMap(entries);
	}

	private RenderingSchema() {
	}

	/**
	 * Returns the entry of {@code type}.
	 *
	 * @throws ValidationError if the type has no entry
	 */
	public static SchemaEntry entry(String type) {
		SchemaEntry entry = ENTRIES.get(type);
		if (entry == null) {
			throw new ValidationError("no rendering schema entry for node type '" + type + "'");
		}
		return entry;
	}

	public static boolean isKnownType(String type) {
		return ENTRIES.containsKey(type);
	}

	public static Set<String> types() {
		return ENTRIES.keySet();
	}

	public static boolean isSeparatorType(String type) {
		return COMMA.equals(type) || DOT.equals(type) || "semicolon".equals(type);
	}

	/**
	 * Node types that only carry layout: whitespace, newlines, comments and
	 * separators.
	 */
	public static boolean isFormattingType(String type) {
		return "space".equals(type) || "endl".equals(type) || "comment".equals(type) || isSeparatorType(type);
	}

	private static void define(Map<String, SchemaEntry> entries, Builder builder) {
		SchemaEntry entry = builder.build();
		if (entries.put(entry.getType(), entry) != null) {
			throw new IllegalStateException("duplicate schema entry " + entry.getType());
		}
	}

	private static Builder separator(String type, String text) {
		return new Builder(type).formatting("first_formatting").constant(text).formatting("second_formatting");
	}

	private static Builder operator(String type) {
		return new Builder(type)
				.node("first").formatting("first_formatting").string("value").formatting("second_formatting")
				.node("second");
	}

	private static Builder display(String type, String open, String close) {
		return new Builder(type)
				.constant(open).formatting("first_formatting").separated("value", COMMA)
				.formatting("second_formatting").constant(close);
	}

	private static Builder comprehension(String type, String open, String close) {
		return new Builder(type)
				.constant(open).formatting("first_formatting").node("result").plain("generators")
				.formatting("second_formatting").constant(close);
	}

	private static final class Builder {
		private final String type;
		private final List<Slot> slots = new ArrayList<>();

		private Builder(String type) {
			this.type = type;
		}

		Builder node(String name) {
			slots.add(Slot.node(name, false));
			return this;
		}

		Builder optionalNode(String name) {
			slots.add(Slot.node(name, true));
			return this;
		}

		Builder formatting(String name) {
			slots.add(Slot.list(name, ListPolicy.FORMATTING));
			return this;
		}

		Builder lines(String name) {
			slots.add(Slot.list(name, ListPolicy.LINES));
			return this;
		}

		Builder clauses(String name) {
			slots.add(Slot.list(name, ListPolicy.CLAUSES));
			return this;
		}

		Builder decorators(String name) {
			slots.add(Slot.list(name, ListPolicy.DECORATORS));
			return this;
		}

		Builder plain(String name) {
			slots.add(Slot.list(name, ListPolicy.PLAIN));
			return this;
		}

		Builder separated(String name, String separatorType) {
			slots.add(Slot.separated(name, separatorType));
			return this;
		}

		Builder string(String name) {
			slots.add(Slot.string(name));
			return this;
		}

		Builder flag(String name) {
			slots.add(Slot.flag(name));
			return this;
		}

		Builder constant(String text) {
			slots.add(Slot.constant(text, null));
			return this;
		}

		Builder constantIf(String text, String condition) {
			slots.add(Slot.constant(text, condition));
			return this;
		}

		SchemaEntry build() {
			SchemaEntry entry = new SchemaEntry(type, false, slots);
			for (Slot slot : slots) {
				String condition = slot.getCondition();
				if (condition == null) {
					continue;
				}
				Slot controlling = entry.getAttribute(condition);
				if (controlling == null
						|| !(controlling.getKind() == SlotKind.FLAG
								|| (controlling.getKind() == SlotKind.NODE && controlling.isOptional()))) {
					throw new IllegalStateException("constant condition " + condition + " of " + type
							+ " must name a flag or an optional node");
				}
			}
			return entry;
		}
	}
}
