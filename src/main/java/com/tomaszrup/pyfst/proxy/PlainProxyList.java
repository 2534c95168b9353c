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

import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;

/**
 * Lists without separators: the trailers of an attribute chain
 * ({@code a.b(c)[d]}), the strings of an implicit concatenation, and the
 * loops and conditions of a comprehension.
 */
public class PlainProxyList extends ProxyList {

	PlainProxyList(Proxy owner, String attribute) {
		super(owner, attribute);
	}

	@Override
	void spliceInsert(Change change, int index, Item item) {
		List<FstNode> entries = change.entries;
		List<Integer> items = Splice.itemIndices(entries);
		String type = owner.getType();
		if ("atomtrailers".equals(type)) {
			insertTrailer(entries, items, index, item.node);
		} else if ("string_chain".equals(type)) {
			if (index == 0) {
				entries.add(0, Splice.space(" "));
				entries.add(0, item.node);
			} else {
				int at = items.get(index - 1) + 1;
				entries.add(at, item.node);
				entries.add(at, Splice.space(" "));
			}
		} else {
			if (!item.node.isAtom()) {
				CompositeNode clause = (CompositeNode) item.node;
				if (clause.hasAttribute("first_formatting") && clause.getList("first_formatting").isEmpty()) {
					List<FstNode> formatting = new ArrayList<>();
					formatting.add(Splice.space(" "));
					clause.set("first_formatting", formatting);
				}
			}
			int at = index < items.size() ? items.get(index) : entries.size();
			entries.add(at, item.node);
		}
	}

	/**
	 * Attribute names are written with a dot in front of them; calls and
	 * subscriptions attach directly.
	 */
	private static void insertTrailer(List<FstNode> entries, List<Integer> items, int index, FstNode node) {
		int at = index < items.size() ? items.get(index) : entries.size();
		if (index > 0 && index < items.size() && entries.get(at - 1).is("dot")) {
			at--;
		}
		List<FstNode> inserted = new ArrayList<>();
		if (node.is("name") && index > 0) {
			inserted.add(Splice.dot());
		}
		inserted.add(node);
		if (index == 0 && !items.isEmpty() && entries.get(items.get(0)).is("name")) {
			inserted.add(Splice.dot());
		}
		entries.addAll(at, inserted);
	}

	@Override
	void spliceRemove(Change change, int index) {
		List<FstNode> entries = change.entries;
		int raw = Splice.itemIndices(entries).get(index);
		String type = owner.getType();
		entries.remove(raw);
		if ("atomtrailers".equals(type)) {
			if (raw > 0 && entries.get(raw - 1).is("dot")) {
				entries.remove(raw - 1);
			} else if (raw == 0 && !entries.isEmpty() && entries.get(0).is("dot")) {
				entries.remove(0);
			}
		} else if ("string_chain".equals(type)) {
			if (index > 0) {
				while (raw > 0 && entries.get(raw - 1).is("space")) {
					entries.remove(raw - 1);
					raw--;
				}
			} else {
				while (raw < entries.size() && entries.get(raw).is("space")) {
					entries.remove(raw);
				}
			}
		}
	}
}
