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
package com.tomaszrup.pyfst.config;

import java.nio.file.Path;

/**
 * Immutable runtime options of the FST library.
 */
public final class FstOptions {
	public static final String DEFAULT_INDENT_UNIT = "    ";
	public static final String DEFAULT_SEPARATOR = ", ";
	public static final String DEFAULT_NEWLINE = "\n";

	private static final FstOptions DEFAULTS = builder().build();

	private final String indentUnit;
	private final String separator;
	private final String newline;
	private final Path cacheDirectory;
	private final boolean cacheEnabled;

	private FstOptions(Builder builder) {
		this.indentUnit = builder.indentUnit;
		this.separator = builder.separator;
		this.newline = builder.newline;
		this.cacheDirectory = builder.cacheDirectory;
		this.cacheEnabled = builder.cacheEnabled;
	}

	public static FstOptions defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	/** Indentation of one block level when the source does not show one. */
	public String getIndentUnit() {
		return indentUnit;
	}

	/** Comma separator used when a list has no separator to copy. */
	public String getSeparator() {
		return separator;
	}

	/** Line break used when the source contains none. */
	public String getNewline() {
		return newline;
	}

	/** Directory of the on-disk FST cache, or {@code null} for the default. */
	public Path getCacheDirectory() {
		return cacheDirectory;
	}

	public boolean isCacheEnabled() {
		return cacheEnabled;
	}

	public Builder toBuilder() {
		return new Builder()
				.indentUnit(indentUnit)
				.separator(separator)
				.newline(newline)
				.cacheDirectory(cacheDirectory)
				.cacheEnabled(cacheEnabled);
	}

	@Override
	public String toString() {
		return "FstOptions[indentUnit='" + indentUnit + "', separator='" + separator + "', newline="
				+ newline.replace("\r", "\\r").replace("\n", "\\n") + ", cacheDirectory=" + cacheDirectory
				+ ", cacheEnabled=" + cacheEnabled + "]";
	}

	public static final class Builder {
		private String indentUnit = DEFAULT_INDENT_UNIT;
		private String separator = DEFAULT_SEPARATOR;
		private String newline = DEFAULT_NEWLINE;
		private Path cacheDirectory;
		private boolean cacheEnabled = true;

		private Builder() {
		}

		public Builder indentUnit(String indentUnit) {
			if (indentUnit == null || indentUnit.isEmpty() || !indentUnit.trim().isEmpty()) {
				throw new IllegalArgumentException("indent unit must be non-empty whitespace: '" + indentUnit + "'");
			}
			this.indentUnit = indentUnit;
			return this;
		}

		public Builder separator(String separator) {
			if (separator == null || !",".equals(separator.trim())) {
				throw new IllegalArgumentException("separator must be a comma surrounded by whitespace: '"
						+ separator + "'");
			}
			this.separator = separator;
			return this;
		}

		public Builder newline(String newline) {
			if (!"\n".equals(newline) && !"\r\n".equals(newline) && !"\r".equals(newline)) {
				throw new IllegalArgumentException("newline must be \\n, \\r\\n or \\r");
			}
			this.newline = newline;
			return this;
		}

		public Builder cacheDirectory(Path cacheDirectory) {
			this.cacheDirectory = cacheDirectory;
			return this;
		}

		public Builder cacheEnabled(boolean cacheEnabled) {
			this.cacheEnabled = cacheEnabled;
			return this;
		}

		public FstOptions build() {
			return new FstOptions(this);
		}
	}
}
