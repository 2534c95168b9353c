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

/**
 * One step of a node type's rendering order: either a stored attribute or a
 * constant piece of text.
 */
public final class Slot {
	private final String name;
	private final SlotKind kind;
	private final boolean optional;
	private final ListPolicy policy;
	private final String separatorType;
	private final String constantText;
	private final String condition;

	private Slot(String name, SlotKind kind, boolean optional, ListPolicy policy, String separatorType,
			String constantText, String condition) {
		this.name = name;
		this.kind = kind;
		this.optional = optional;
		this.policy = policy;
		this.separatorType = separatorType;
		this.constantText = constantText;
		this.condition = condition;
	}

	static Slot node(String name, boolean optional) {
		return new Slot(name, SlotKind.NODE, optional, null, null, null, null);
	}

	static Slot list(String name, ListPolicy policy) {
		return new Slot(name, SlotKind.NODE_LIST, false, policy, null, null, null);
	}

	static Slot separated(String name, String separatorType) {
		return new Slot(name, SlotKind.SEPARATED_LIST, false, null, separatorType, null, null);
	}

	static Slot string(String name) {
		return new Slot(name, SlotKind.STRING, false, null, null, null, null);
	}

	static Slot flag(String name) {
		return new Slot(name, SlotKind.FLAG, false, null, null, null, null);
	}

	static Slot constant(String text, String condition) {
		return new Slot(null, SlotKind.CONSTANT, false, null, null, text, condition);
	}

	/** Attribute name, or {@code null} for constants. */
	public String getName() {
		return name;
	}

	public SlotKind getKind() {
		return kind;
	}

	public boolean isOptional() {
		return optional;
	}

	/** List policy for {@link SlotKind#NODE_LIST} slots. */
	public ListPolicy getPolicy() {
		return policy;
	}

	/** Separator node type for {@link SlotKind#SEPARATED_LIST} slots. */
	public String getSeparatorType() {
		return separatorType;
	}

	public String getConstantText() {
		return constantText;
	}

	/**
	 * Attribute that controls whether a constant is rendered: a flag that must
	 * be true or an optional node that must be present. {@code null} when the
	 * constant is unconditional.
	 */
	public String getCondition() {
		return condition;
	}

	public boolean isFormatting() {
		return kind == SlotKind.NODE_LIST && policy == ListPolicy.FORMATTING;
	}

	@Override
	public String toString() {
		if (kind == SlotKind.CONSTANT) {
			return "\"" + constantText + "\"" + (condition != null ? "?" + condition : "");
		}
		return name + ":" + kind + (optional ? "?" : "")
				+ (policy != null ? "(" + policy + ")" : "")
				+ (separatorType != null ? "(" + separatorType + ")" : "");
	}
}
