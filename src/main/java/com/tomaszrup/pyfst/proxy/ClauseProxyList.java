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
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.parser.Parser;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * The {@code elif}/{@code else}/{@code except}/{@code finally} clauses of a
 * compound statement. Each clause starts a line at the indentation of the
 * statement it continues.
 */
public class ClauseProxyList extends ProxyList {

	ClauseProxyList(Proxy owner, String attribute) {
		super(owner, attribute);
	}

	@Override
	void spliceInsert(Change change, int index, Item item) {
		List<FstNode> entries = change.entries;
		List<Integer> items = Splice.itemIndices(entries);
		String indentation = Indentation.lineIndentation(owner);
		int position = index == 0 ? 0 : items.get(index - 1) + 1;
		final List<FstNode> before = index == 0 ? ownerNode().getList("value") : null;
		final FstNode previous = index == 0 ? null : entries.get(position - 1);
		boolean terminated = before != null ? Indentation.endsWithNewline(before)
				: Indentation.endsWithNewline(previous);
		if (!terminated) {
			final String newline = tree().getNewline();
			change.afterCommit.add(new Runnable() {
				@Override
				public void run() {
					if (before != null) {
						Indentation.ensureTrailingNewline(before, newline);
					} else {
						Indentation.ensureTrailingNewline(previous, newline);
					}
				}
			});
		}
		Indentation.shift(item.node, 0, indentation);
		Indentation.ensureTrailingNewline(item.node, tree().getNewline());
		if (!terminated && position == entries.size()) {
			Indentation.stripTrailingNewline(item.node);
		}
		entries.add(position, item.node);
		if (!indentation.isEmpty()) {
			entries.add(position, Splice.space(indentation));
		}
	}

	@Override
	void spliceRemove(Change change, int index) {
		List<FstNode> entries = change.entries;
		int raw = Splice.itemIndices(entries).get(index);
		entries.remove(raw);
		if (raw > 0 && entries.get(raw - 1).is("space")
				&& (raw == 1 || Indentation.endsWithNewline(entries.get(raw - 2)))) {
			change.removedIndentation = ((AtomNode) entries.get(raw - 1)).getValue();
			entries.remove(raw - 1);
		}
	}

	@Override
	void spliceReplace(Change change, int index, Item item) {
		List<FstNode> entries = change.entries;
		int raw = Splice.itemIndices(entries).get(index);
		String indentation = Indentation.lineIndentation(owner);
		change.removedIndentation = indentation;
		Indentation.shift(item.node, 0, indentation);
		if (Indentation.endsWithNewline(entries.get(raw))) {
			Indentation.ensureTrailingNewline(item.node, tree().getNewline());
		} else {
			Indentation.stripTrailingNewline(item.node);
		}
		entries.set(raw, item.node);
	}

	@Override
	void afterRemove(FstNode removed, Change change) {
		Indentation.shift(removed, change.removedIndentation.length(), "");
	}

	/**
	 * Clauses must keep the order the grammar allows, and a {@code try}
	 * needs an {@code except} or a {@code finally}.
	 */
	@Override
	void validate(Change change) {
		String type = owner.getType();
		boolean sawElse = false;
		boolean sawExcept = false;
		boolean sawFinally = false;
		for (FstNode entry : change.entries) {
			if (!Splice.isItem(entry)) {
				continue;
			}
			String keyword = entry.getType();
			if (!Parser.clauseAllowed(type, keyword, sawElse, sawExcept, sawFinally)) {
				throw new ValidationError("'" + keyword + "' clause is not allowed here in a " + type + " statement");
			}
			if ("else".equals(keyword)) {
				sawElse = true;
			} else if ("except".equals(keyword)) {
				sawExcept = true;
			} else if ("finally".equals(keyword)) {
				sawFinally = true;
			}
		}
		if ("try".equals(type) && !sawExcept && !sawFinally) {
			throw new ValidationError("a try statement needs an except or a finally clause");
		}
	}

	@Override
	public void increaseIndentation(int levels) {
		StringBuilder prefix = new StringBuilder();
		for (int i = 0; i < levels; i++) {
			prefix.append(tree().getIndentUnit());
		}
		Indentation.shiftList(entries(), true, 0, prefix.toString());
	}

	@Override
	public void decreaseIndentation(int levels) {
		Indentation.shiftList(entries(), true, levels * tree().getIndentUnit().length(), "");
	}
}
