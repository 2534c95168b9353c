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

import java.util.List;

import com.tomaszrup.pyfst.fst.AtomNode;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.schema.Slot;

/**
 * Turns any subtree back into source text by walking the rendering schema.
 * Stateless; every method is a pure function of its argument.
 */
public final class Renderer {

	private Renderer() {
	}

	public static String render(FstNode node) {
		StringBuilder builder = new StringBuilder();
		render(node, builder, null);
		return builder.toString();
	}

	public static String render(List<FstNode> nodes) {
		StringBuilder builder = new StringBuilder();
		for (FstNode node : nodes) {
			render(node, builder, null);
		}
		return builder.toString();
	}

	/**
	 * Renders {@code node} and records the span of every node it contains.
	 */
	public static RenderedSpans renderWithSpans(FstNode node) {
		StringBuilder builder = new StringBuilder();
		RenderedSpans spans = new RenderedSpans();
		render(node, builder, spans);
		spans.setText(builder.toString());
		return spans;
	}

	/**
	 * Whether a constant slot is emitted for {@code node}.
	 */
	public static boolean isConstantRendered(CompositeNode node, Slot constant) {
		String condition = constant.getCondition();
		if (condition == null) {
			return true;
		}
		Object value = node.get(condition);
		if (value instanceof Boolean) {
			return (Boolean) value;
		}
		return value != null;
	}

	private static void render(FstNode node, StringBuilder builder, RenderedSpans spans) {
		int start = builder.length();
		if (node instanceof AtomNode) {
			builder.append(((AtomNode) node).getValue());
		} else {
			CompositeNode composite = (CompositeNode) node;
			for (Slot slot : composite.getEntry().getSlots()) {
				switch (slot.getKind()) {
					case CONSTANT:
						if (isConstantRendered(composite, slot)) {
							builder.append(slot.getConstantText());
						}
						break;
					case NODE: {
						FstNode child = composite.getNode(slot.getName());
						if (child != null) {
							render(child, builder, spans);
						}
						break;
					}
					case NODE_LIST:
					case SEPARATED_LIST:
						for (FstNode child : composite.getList(slot.getName())) {
							render(child, builder, spans);
						}
						break;
					case STRING:
						builder.append(composite.getString(slot.getName()));
						break;
					default:
						// flags render nothing themselves
						break;
				}
			}
		}
		if (spans != null) {
			spans.record(node, start, builder.length());
		}
	}
}
