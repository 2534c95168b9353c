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

import com.tomaszrup.pyfst.fst.AtomNode;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.parser.FragmentParser;
import com.tomaszrup.pyfst.schema.Slot;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * Statements of a module or of a block.
 *
 * <p>A block body starts with the rest of its header line (an optional
 * comment and the line break); every following line is
 * {@code indentation item (; item)* comment? endl}. An inline body
 * ({@code if x: pass}) holds the statements of the header line only and is
 * turned into a block when a statement is added.</p>
 */
public class LineProxyList extends ProxyList {

	LineProxyList(Proxy owner, String attribute) {
		super(owner, attribute);
	}

	private boolean isModule() {
		return ownerNode().is("module");
	}

	@Override
	Item prepare(Object item) {
		if (item instanceof String) {
			FragmentParser.Fragment fragment = FragmentParser.parseStatement((String) item, tree().getNewline());
			return new Item(fragment.getNode(), fragment);
		}
		return super.prepare(item);
	}

	/**
	 * Raw index of the first body line: 0 for the module, the index after
	 * the header line break for a block, -1 for an inline body.
	 */
	private int bodyStart(List<FstNode> entries) {
		if (isModule()) {
			return 0;
		}
		int i = 0;
		if (i < entries.size() && entries.get(i).is("comment")) {
			i++;
		}
		if (i < entries.size() && entries.get(i).is("endl")) {
			return i + 1;
		}
		return -1;
	}

	private static int lineStart(List<FstNode> entries, int raw, int bodyStart) {
		int start = raw;
		while (start > Math.max(bodyStart, 0) && !Indentation.endsWithNewline(entries.get(start - 1))) {
			start--;
		}
		return start;
	}

	/** Raw index after the last entry of the line holding {@code raw}. */
	private static int lineEnd(List<FstNode> entries, int raw) {
		int end = raw + 1;
		if (Indentation.endsWithNewline(entries.get(raw))) {
			return end;
		}
		while (end < entries.size()) {
			FstNode entry = entries.get(end);
			end++;
			if (Indentation.endsWithNewline(entry)) {
				break;
			}
		}
		return end;
	}

	private static String indentationAt(List<FstNode> entries, int start, int raw) {
		if (start < raw && entries.get(start).is("space")) {
			return ((AtomNode) entries.get(start)).getValue();
		}
		return "";
	}

	private String ownerIndentation() {
		return isModule() ? "" : Indentation.lineIndentation(owner);
	}

	private String newline() {
		return tree().getNewline();
	}

	// ----------------------------------------------------------------
	// Insertion
	// ----------------------------------------------------------------

	@Override
	void spliceInsert(Change change, int index, Item item) {
		List<FstNode> entries = change.entries;
		int bodyStart = bodyStart(entries);
		if (bodyStart < 0) {
			bodyStart = convertToBlock(change);
		}
		List<Integer> items = Splice.itemIndices(entries);
		if (items.isEmpty()) {
			String indentation = isModule() ? "" : ownerIndentation() + tree().getIndentUnit();
			boolean newlineAtEnd = true;
			if (!entries.isEmpty() && !Indentation.endsWithNewline(entries)) {
				entries.add(Splice.endl(newline()));
				newlineAtEnd = false;
			}
			entries.addAll(line(indentation, item, newlineAtEnd));
			return;
		}
		if (index == 0) {
			int raw = items.get(0);
			int start = lineStart(entries, raw, bodyStart);
			entries.addAll(start, line(indentationAt(entries, start, raw), item, true));
			return;
		}
		int previous = items.get(index - 1);
		int start = lineStart(entries, previous, bodyStart);
		int end = lineEnd(entries, previous);
		String indentation = indentationAt(entries, start, previous);
		if (index < items.size() && items.get(index) < end) {
			if (Splice.isCompound(item.node)) {
				throw new ValidationError("a compound statement cannot join a line shared with ';'");
			}
			int at = items.get(index);
			entries.add(at, Splice.semicolon());
			entries.add(at, item.node);
			return;
		}
		if (Indentation.endsWithNewline(entries.get(end - 1))) {
			entries.addAll(end, line(indentation, item, true));
			return;
		}
		final FstNode last = entries.get(end - 1);
		if (Splice.isCompound(last)) {
			final String newline = newline();
			change.afterCommit.add(new Runnable() {
				@Override
				public void run() {
					Indentation.ensureTrailingNewline(last, newline);
				}
			});
		} else {
			entries.add(end, Splice.endl(newline()));
			end++;
		}
		entries.addAll(end, line(indentation, item, false));
	}

	/**
	 * Moves an inline body onto its own indented line.
	 *
	 * @return the new body start
	 */
	private int convertToBlock(Change change) {
		String before = slotBefore();
		if (before != null) {
			change.ownerAttributes.put(before, new ArrayList<FstNode>());
		}
		String indentation = ownerIndentation() + tree().getIndentUnit();
		List<FstNode> entries = change.entries;
		entries.add(0, Splice.endl(newline()));
		entries.add(1, Splice.space(indentation));
		return 1;
	}

	private String slotBefore() {
		List<Slot> slots = ownerNode().getEntry().getSlots();
		for (int i = 1; i < slots.size(); i++) {
			if (attribute.equals(slots.get(i).getName()) && slots.get(i - 1).isFormatting()) {
				return slots.get(i - 1).getName();
			}
		}
		return null;
	}

	/**
	 * Entries of a new line holding {@code item}, with the comments of its
	 * source text on lines of their own.
	 */
	private List<FstNode> line(String indentation, Item item, boolean newlineAtEnd) {
		List<FstNode> line = new ArrayList<>();
		String newline = newline();
		FragmentParser.Fragment fragment = item.fragment;
		if (fragment != null) {
			for (CompositeNode comment : fragment.getLeadingComments()) {
				commentLine(line, indentation, comment, newline);
			}
		}
		Indentation.shift(item.node, 0, indentation);
		if (!indentation.isEmpty()) {
			line.add(Splice.space(indentation));
		}
		line.add(item.node);
		if (Splice.isCompound(item.node)) {
			Indentation.ensureTrailingNewline(item.node, newline);
		} else {
			if (fragment != null && fragment.getTrailingComment() != null) {
				line.add(fragment.getTrailingComment());
			}
			line.add(Splice.endl(newline));
		}
		if (fragment != null) {
			for (CompositeNode comment : fragment.getFollowingComments()) {
				commentLine(line, indentation, comment, newline);
			}
		}
		if (!newlineAtEnd) {
			FstNode last = line.get(line.size() - 1);
			if (last.is("endl")) {
				line.remove(line.size() - 1);
			} else {
				Indentation.stripTrailingNewline(last);
			}
		}
		return line;
	}

	private static void commentLine(List<FstNode> line, String indentation, CompositeNode comment, String newline) {
		if (!indentation.isEmpty()) {
			line.add(Splice.space(indentation));
		}
		CompositeNode standalone = comment.deepCopy();
		standalone.set("formatting", new ArrayList<FstNode>());
		line.add(standalone);
		line.add(Splice.endl(newline));
	}

	// ----------------------------------------------------------------
	// Removal
	// ----------------------------------------------------------------

	@Override
	void spliceRemove(Change change, int index) {
		List<FstNode> entries = change.entries;
		List<Integer> items = Splice.itemIndices(entries);
		int raw = items.get(index);
		int bodyStart = bodyStart(entries);
		int start = lineStart(entries, raw, bodyStart);
		int end = lineEnd(entries, raw);
		change.removedIndentation = indentationAt(entries, start, raw);
		if (items.size() == 1 && !isModule()) {
			entries.set(raw, new AtomNode("pass", "pass"));
			return;
		}
		if (sharesLine(entries, items, raw, start, end)) {
			if (raw + 1 < end && entries.get(raw + 1).is("semicolon")) {
				entries.remove(raw + 1);
				entries.remove(raw);
			} else {
				entries.remove(raw);
				entries.remove(raw - 1);
			}
			return;
		}
		String indentation = indentationAt(entries, start, raw);
		boolean hadNewline = Indentation.endsWithNewline(entries.get(end - 1));
		List<FstNode> kept = new ArrayList<>();
		CompositeNode comment = trailingComment(entries, raw, end);
		if (comment != null) {
			if (!indentation.isEmpty()) {
				kept.add(Splice.space(indentation));
			}
			CompositeNode standalone = comment.deepCopy();
			standalone.set("formatting", new ArrayList<FstNode>());
			kept.add(standalone);
			FstNode lineEnd = entries.get(end - 1);
			if (lineEnd.is("endl")) {
				kept.add(lineEnd);
			}
		}
		entries.subList(start, end).clear();
		entries.addAll(start, kept);
		if (!hadNewline && kept.isEmpty() && start > Math.max(bodyStart, 0) && start == entries.size()) {
			FstNode previous = entries.get(start - 1);
			if (previous.is("endl") && start - 1 >= bodyStart) {
				entries.remove(start - 1);
			}
		}
	}

	private static boolean sharesLine(List<FstNode> entries, List<Integer> items, int raw, int start, int end) {
		for (int item : items) {
			if (item != raw && item >= start && item < end) {
				return true;
			}
		}
		return false;
	}

	private static CompositeNode trailingComment(List<FstNode> entries, int raw, int end) {
		for (int i = raw + 1; i < end; i++) {
			if (entries.get(i).is("comment")) {
				return (CompositeNode) entries.get(i);
			}
		}
		return null;
	}

	@Override
	void afterRemove(FstNode removed, Change change) {
		Indentation.shift(removed, change.removedIndentation.length(), "");
	}

	// ----------------------------------------------------------------
	// Replacement
	// ----------------------------------------------------------------

	@Override
	void spliceReplace(Change change, int index, Item item) {
		List<FstNode> entries = change.entries;
		List<Integer> items = Splice.itemIndices(entries);
		int raw = items.get(index);
		FstNode old = entries.get(raw);
		boolean plainFragment = item.fragment == null
				|| (item.fragment.getLeadingComments().isEmpty() && item.fragment.getTrailingComment() == null
						&& item.fragment.getFollowingComments().isEmpty());
		int bodyStart = bodyStart(entries);
		int start = lineStart(entries, raw, bodyStart);
		int end = lineEnd(entries, raw);
		String indentation = indentationAt(entries, start, raw);
		change.removedIndentation = indentation;
		if (!Splice.isCompound(old) && !Splice.isCompound(item.node) && plainFragment) {
			Indentation.shift(item.node, 0, indentation);
			entries.set(raw, item.node);
			return;
		}
		if (sharesLine(entries, items, raw, start, end) || bodyStart < 0) {
			if (Splice.isCompound(item.node)) {
				throw new ValidationError("a compound statement cannot replace a statement sharing its line");
			}
			Indentation.shift(item.node, 0, indentation);
			entries.set(raw, item.node);
			return;
		}
		boolean hadNewline = Indentation.endsWithNewline(entries.get(end - 1));
		List<FstNode> replacement = new ArrayList<>();
		CompositeNode comment = Splice.isCompound(old) ? null : trailingComment(entries, raw, end);
		if (comment != null) {
			commentLine(replacement, indentation, comment, newline());
		}
		replacement.addAll(line(indentation, item, hadNewline));
		entries.subList(start, end).clear();
		entries.addAll(start, replacement);
	}

	// ----------------------------------------------------------------
	// Indentation
	// ----------------------------------------------------------------

	@Override
	public void increaseIndentation(int levels) {
		StringBuilder prefix = new StringBuilder();
		for (int i = 0; i < levels; i++) {
			prefix.append(tree().getIndentUnit());
		}
		Indentation.shiftList(entries(), isModule(), 0, prefix.toString());
	}

	@Override
	public void decreaseIndentation(int levels) {
		int removeCount = levels * tree().getIndentUnit().length();
		for (Proxy item : toList()) {
			item.checkDecrease(removeCount);
		}
		Indentation.shiftList(entries(), isModule(), removeCount, "");
	}
}
