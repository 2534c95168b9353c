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

import java.util.IdentityHashMap;
import java.util.Map;

import com.tomaszrup.pyfst.fst.FstNode;

/**
 * Result of {@link Renderer#renderWithSpans(FstNode)}: the rendered text and
 * the {@code [start, end)} offsets of every node inside it.
 */
public final class RenderedSpans {
	private final Map<FstNode, int[]> spans = new IdentityHashMap<>();
	private String text;

	RenderedSpans() {
	}

	void record(FstNode node, int start, int end) {
		spans.put(node, new int[] {start, end});
	}

	void setText(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	public boolean contains(FstNode node) {
		return spans.containsKey(node);
	}

	/** @return the start offset, or -1 if the node was not rendered */
	public int getStart(FstNode node) {
		int[] span = spans.get(node);
		return span == null ? -1 : span[0];
	}

	/** @return the end offset (exclusive), or -1 if the node was not rendered */
	public int getEnd(FstNode node) {
		int[] span = spans.get(node);
		return span == null ? -1 : span[1];
	}
}
