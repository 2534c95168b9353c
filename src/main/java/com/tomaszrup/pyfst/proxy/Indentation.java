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

import com.tomaszrup.pyfst.fst.AtomNode;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.render.RenderedSpans;
import com.tomaszrup.pyfst.render.Renderer;
import com.tomaszrup.pyfst.schema.ListPolicy;
import com.tomaszrup.pyfst.schema.Slot;
import com.tomaszrup.pyfst.schema.SlotKind;

/**
 * Rewrites the leading whitespace of the lines a subtree owns.
 *
 * <p>A subtree owns the lines that start inside it: statement and comment
 * lines of its blocks, its clause and decorator lines, and continuation
 * lines inside its brackets. The first line of the subtree starts outside
 * of it and is left alone. String contents are never touched.</p>
 */
final class Indentation {

	private Indentation() {
	}

	/**
	 * Removes up to {@code removeCount} leading characters from every line
	 * owned by {@code node}, then prepends {@code addPrefix}.
	 */
	static void shift(FstNode node, int removeCount, String addPrefix) {
		if (node.isAtom()) {
			return;
		}
		CompositeNode composite = (CompositeNode) node;
		for (Slot slot : composite.getEntry().getSlots()) {
			if (slot.getKind() == SlotKind.NODE) {
				FstNode child = composite.getNode(slot.getName());
				if (child != null) {
					shift(child, removeCount, addPrefix);
				}
			} else if (slot.getKind().isList()) {
				List<FstNode> list = composite.getList(slot.getName());
				if (slot.getKind() == SlotKind.NODE_LIST && slot.getPolicy() != ListPolicy.FORMATTING
						&& slot.getPolicy() != ListPolicy.PLAIN) {
					shiftLineStarts(list, slot.getPolicy() == ListPolicy.CLAUSES, removeCount, addPrefix);
				}
				for (FstNode child : list) {
					if (child.is("space")) {
						shiftContinuation((AtomNode) child, removeCount, addPrefix);
					} else {
						shift(child, removeCount, addPrefix);
					}
				}
			}
		}
	}

	/**
	 * Shifts every line of a line-organised list, its comment lines
	 * included, and the lines its entries own.
	 */
	static void shiftList(List<FstNode> list, boolean startsAtLine, int removeCount, String addPrefix) {
		shiftLineStarts(list, startsAtLine, removeCount, addPrefix);
		for (FstNode child : list) {
			if (child.is("space")) {
				shiftContinuation((AtomNode) child, removeCount, addPrefix);
			} else {
				shift(child, removeCount, addPrefix);
			}
		}
	}

	private static void shiftLineStarts(List<FstNode> list, boolean startsAtLine, int removeCount,
			String addPrefix) {
		boolean lineStart = startsAtLine;
		for (int i = 0; i < list.size(); i++) {
			FstNode entry = list.get(i);
			if (lineStart) {
				if (entry.is("space")) {
					FstNode next = i + 1 < list.size() ? list.get(i + 1) : null;
					if (next != null && !next.is("endl")) {
						AtomNode space = (AtomNode) entry;
						String value = adjust(space.getValue(), removeCount, addPrefix);
						if (value.isEmpty()) {
							list.remove(i);
							i--;
							lineStart = false;
							continue;
						}
						space.setValue(value);
					}
				} else if (!entry.is("endl") && !addPrefix.isEmpty()) {
					list.add(i, new AtomNode("space", addPrefix));
					i++;
				}
			}
			lineStart = endsWithNewline(list.get(i));
		}
	}

	/** Whitespace that spans lines: only the part after the last break is indentation. */
	private static void shiftContinuation(AtomNode space, int removeCount, String addPrefix) {
		String value = space.getValue();
		int lastBreak = Math.max(value.lastIndexOf('\n'), value.lastIndexOf('\r'));
		if (lastBreak < 0) {
			return;
		}
		String head = value.substring(0, lastBreak + 1);
		space.setValue(head + adjust(value.substring(lastBreak + 1), removeCount, addPrefix));
	}

	static String adjust(String indentation, int removeCount, String addPrefix) {
		int removed = 0;
		while (removed < removeCount && removed < indentation.length()
				&& isIndentCharacter(indentation.charAt(removed))) {
			removed++;
		}
		return addPrefix + indentation.substring(removed);
	}

	private static boolean isIndentCharacter(char c) {
		return c == ' ' || c == '\t' || c == '\f';
	}

	static boolean endsWithNewline(FstNode node) {
		String text = Renderer.render(node);
		return text.endsWith("\n") || text.endsWith("\r");
	}

	static boolean endsWithNewline(List<FstNode> nodes) {
		return !nodes.isEmpty() && endsWithNewline(nodes.get(nodes.size() - 1));
	}

	/**
	 * Leading whitespace of the line on which {@code proxy} starts, or
	 * {@code ""} for a detached proxy.
	 */
	static String lineIndentation(Proxy proxy) {
		if (!proxy.isAttached()) {
			return "";
		}
		RenderedSpans spans = Renderer.renderWithSpans(proxy.getTree().module());
		int start = spans.getStart(proxy.node());
		if (start < 0) {
			return "";
		}
		String text = spans.getText();
		int lineStart = start;
		while (lineStart > 0 && text.charAt(lineStart - 1) != '\n' && text.charAt(lineStart - 1) != '\r') {
			lineStart--;
		}
		int end = lineStart;
		while (end < text.length() && isIndentCharacter(text.charAt(end))) {
			end++;
		}
		return text.substring(lineStart, end);
	}

	/** Whether only indentation precedes {@code proxy} on its line. */
	static boolean startsLine(Proxy proxy) {
		if (!proxy.isAttached()) {
			return false;
		}
		RenderedSpans spans = Renderer.renderWithSpans(proxy.getTree().module());
		int start = spans.getStart(proxy.node());
		if (start < 0) {
			return false;
		}
		String text = spans.getText();
		int at = start;
		while (at > 0 && isIndentCharacter(text.charAt(at - 1))) {
			at--;
		}
		return at == 0 || text.charAt(at - 1) == '\n' || text.charAt(at - 1) == '\r';
	}

	/**
	 * Adds a line break to the end of a compound statement that lacks one,
	 * in its innermost last block.
	 */
	static void ensureTrailingNewline(FstNode compound, String newline) {
		List<FstNode> lines = lastLines(compound);
		if (lines != null) {
			ensureTrailingNewline(lines, newline);
		}
	}

	static void ensureTrailingNewline(List<FstNode> lines, String newline) {
		if (lines.isEmpty() || endsWithNewline(lines)) {
			return;
		}
		FstNode last = lines.get(lines.size() - 1);
		if (Splice.isCompound(last)) {
			ensureTrailingNewline(last, newline);
		} else {
			lines.add(Splice.endl(newline));
		}
	}

	/**
	 * Drops the final line break of a compound statement, the inverse of
	 * {@link #ensureTrailingNewline(FstNode, String)}.
	 */
	static void stripTrailingNewline(FstNode compound) {
		List<FstNode> lines = lastLines(compound);
		if (lines == null || lines.isEmpty()) {
			return;
		}
		FstNode last = lines.get(lines.size() - 1);
		if (Splice.isCompound(last)) {
			stripTrailingNewline(last);
		} else if (last.is("endl")) {
			List<FstNode> formatting = ((CompositeNode) last).getList("formatting");
			lines.remove(lines.size() - 1);
			lines.addAll(formatting);
		}
	}

	/** The block or clause list rendered last by a compound statement. */
	private static List<FstNode> lastLines(FstNode compound) {
		if (!Splice.isCompound(compound)) {
			return null;
		}
		CompositeNode node = (CompositeNode) compound;
		if (node.hasAttribute("clauses") && !node.getList("clauses").isEmpty()) {
			List<FstNode> clauses = node.getList("clauses");
			FstNode lastClause = clauses.get(clauses.size() - 1);
			if (Splice.isCompound(lastClause)) {
				return ((CompositeNode) lastClause).getList("value");
			}
			return null;
		}
		return node.getList("value");
	}
}
