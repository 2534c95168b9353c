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
package com.tomaszrup.pyfst.fst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Location of a node as the sequence of steps from the root. A step names
 * an attribute and, for list attributes, the index in the raw list
 * (formatting entries included).
 *
 * <p>Paths are snapshots: any structural mutation may invalidate them.</p>
 */
public final class NodePath {

	public static final class Step {
		private final String attribute;
		private final int index;

		public Step(String attribute, int index) {
			this.attribute = attribute;
			this.index = index;
		}

		public String getAttribute() {
			return attribute;
		}

		/** Index within a list attribute, or -1 for a single-node attribute. */
		public int getIndex() {
			return index;
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Step)) {
				return false;
			}
			Step other = (Step) obj;
			return attribute.equals(other.attribute) && index == other.index;
		}

		@Override
		public int hashCode() {
			return Objects.hash(attribute, index);
		}

		@Override
		public String toString() {
			return index < 0 ? attribute : attribute + "[" + index + "]";
		}
	}

	private final List<Step> steps;

	public NodePath(List<Step> steps) {
		this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
	}

	public static NodePath root() {
		return new NodePath(Collections.emptyList());
	}

	public List<Step> getSteps() {
		return steps;
	}

	public boolean isRoot() {
		return steps.isEmpty();
	}

	public NodePath child(String attribute, int index) {
		List<Step> extended = new ArrayList<>(steps);
		extended.add(new Step(attribute, index));
		return new NodePath(extended);
	}

	/**
	 * Follows this path from {@code root}.
	 *
	 * @return the node, or {@code null} if the path does not exist (any more)
	 */
	public FstNode resolve(FstNode root) {
		FstNode current = root;
		for (Step step : steps) {
			if (!(current instanceof CompositeNode)) {
				return null;
			}
			CompositeNode composite = (CompositeNode) current;
			if (!composite.hasAttribute(step.attribute)) {
				return null;
			}
			Object value = composite.get(step.attribute);
			if (step.index < 0) {
				if (!(value instanceof FstNode)) {
					return null;
				}
				current = (FstNode) value;
			} else {
				if (!(value instanceof List) || step.index >= ((List<?>) value).size()) {
					return null;
				}
				current = (FstNode) ((List<?>) value).get(step.index);
			}
		}
		return current;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof NodePath && steps.equals(((NodePath) obj).steps);
	}

	@Override
	public int hashCode() {
		return steps.hashCode();
	}

	@Override
	public String toString() {
		if (steps.isEmpty()) {
			return "<root>";
		}
		StringBuilder builder = new StringBuilder();
		for (Step step : steps) {
			if (builder.length() > 0) {
				builder.append('.');
			}
			builder.append(step);
		}
		return builder.toString();
	}
}
