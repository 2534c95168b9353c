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
 * Decorator lines of a {@code def} or {@code class}. The indentation of the
 * first decorator line belongs to the enclosing block; every later line,
 * the {@code def}/{@code class} line included, is indented from inside this
 * list.
 */
public class DecoratorProxyList extends ProxyList {

	DecoratorProxyList(Proxy owner, String attribute) {
		super(owner, attribute);
	}

	@Override
	void spliceInsert(Change change, int index, Item item) {
		List<FstNode> entries = change.entries;
		List<Integer> items = Splice.itemIndices(entries);
		int position = index < items.size() ? items.get(index) : entries.size();
		String indentation = Indentation.lineIndentation(owner);
		List<FstNode> line = new ArrayList<>();
		line.add(item.node);
		line.add(Splice.endl(tree().getNewline()));
		if (!indentation.isEmpty()) {
			line.add(Splice.space(indentation));
		}
		entries.addAll(position, line);
	}

	@Override
	void spliceRemove(Change change, int index) {
		List<FstNode> entries = change.entries;
		int raw = Splice.itemIndices(entries).get(index);
		int next = raw + 1;
		if (next < entries.size() && entries.get(next).is("comment")) {
			// the comment stays behind as a line of its own
			CompositeNode standalone = (CompositeNode) entries.get(next).deepCopy();
			standalone.set("formatting", new ArrayList<FstNode>());
			entries.set(next, standalone);
			entries.remove(raw);
			return;
		}
		if (next < entries.size() && entries.get(next).is("endl")) {
			entries.remove(next);
		}
		entries.remove(raw);
		if (raw > 0 && entries.get(raw - 1).is("space")) {
			entries.remove(raw - 1);
		} else if (raw < entries.size() && entries.get(raw).is("space")) {
			entries.remove(raw);
		}
	}
}
