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
package com.tomaszrup.pyfst.cache;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.tomaszrup.pyfst.FstException;
import com.tomaszrup.pyfst.config.FstOptions;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstInterchange;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.parser.Parser;
import com.tomaszrup.pyfst.render.Renderer;
import com.tomaszrup.pyfst.schema.RenderingSchema;

/**
 * Persists parsed module trees on disk, keyed by the SHA-256 of the source
 * text.
 *
 * <p>Entries are written to a temporary file and atomically renamed over the
 * target, so readers never observe a half-written entry. An entry that is
 * unreadable, written by another cache or schema version, or that does not
 * render back to its source is deleted and treated as a miss.</p>
 */
public class FstDiskCache {
	private static final Logger logger = LoggerFactory.getLogger(FstDiskCache.class);

	private static final int CACHE_VERSION = 1;
	private static final String CACHE_FILE_PREFIX = "fst-";
	private static final String CACHE_FILE_EXTENSION = ".json";
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().disableHtmlEscaping()
			.create();

	private final Path directory;

	/** On-disk layout of one entry. */
	static final class CacheData {
		int version;
		int schemaVersion;
		String sourceHash;
		JsonElement tree;
	}

	public FstDiskCache(Path directory) {
		this.directory = directory;
	}

	/**
	 * Cache in the configured directory, or in the default one when the
	 * options name none.
	 */
	public static FstDiskCache fromOptions(FstOptions options) {
		Path directory = options.getCacheDirectory();
		return new FstDiskCache(directory != null ? directory : getDefaultCacheDir());
	}

	/**
	 * Returns the user-level cache directory ({@code ~/.pyfst/cache/fst}).
	 */
	public static Path getDefaultCacheDir() {
		return Paths.get(System.getProperty("user.home"), ".pyfst", "cache", "fst");
	}

	public Path getDirectory() {
		return directory;
	}

	Path getCacheFile(String sourceHash) {
		return directory.resolve(CACHE_FILE_PREFIX + sourceHash + CACHE_FILE_EXTENSION);
	}

	/**
	 * @return the cached tree of {@code source}, or {@code null} if there is
	 *         no usable entry
	 */
	public CompositeNode load(String source) {
		String key = sha256Hex(source);
		Path cacheFile = getCacheFile(key);
		if (!Files.isRegularFile(cacheFile)) {
			return null;
		}
		try (Reader reader = Files.newBufferedReader(cacheFile, StandardCharsets.UTF_8)) {
			CacheData data = GSON.fromJson(reader, CacheData.class);
			if (data == null || data.version != CACHE_VERSION || data.schemaVersion != RenderingSchema.VERSION
					|| !key.equals(data.sourceHash) || data.tree == null) {
				logger.info("FST cache entry {}… is stale or incomplete, regenerating", abbreviateKey(key));
				deleteQuietly(cacheFile);
				return null;
			}
			FstNode tree = FstInterchange.fromJson(data.tree.toString());
			if (!(tree instanceof CompositeNode) || !tree.is("module") || !source.equals(Renderer.render(tree))) {
				logger.warn("FST cache entry {}… does not match its source, regenerating", abbreviateKey(key));
				deleteQuietly(cacheFile);
				return null;
			}
			logger.debug("Loaded FST from cache entry {}…", abbreviateKey(key));
			return (CompositeNode) tree;
		} catch (IOException | JsonParseException | FstException e) {
			logger.warn("Failed to read FST cache entry {}: {}", cacheFile, e.getMessage());
			deleteQuietly(cacheFile);
			return null;
		}
	}

	/**
	 * Persists {@code module} as the tree of {@code source}. Failures are
	 * logged and otherwise ignored.
	 */
	public void save(String source, CompositeNode module) {
		String key = sha256Hex(source);
		try {
			Files.createDirectories(directory);
			Path cacheFile = getCacheFile(key);
			Path tempFile = directory.resolve(CACHE_FILE_PREFIX + key + ".tmp");

			CacheData data = new CacheData();
			data.version = CACHE_VERSION;
			data.schemaVersion = RenderingSchema.VERSION;
			data.sourceHash = key;
			data.tree = FstInterchange.toJsonElement(module);
			Files.writeString(tempFile, GSON.toJson(data), StandardCharsets.UTF_8);
			Files.move(tempFile, cacheFile, StandardCopyOption.REPLACE_EXISTING,
					StandardCopyOption.ATOMIC_MOVE);
			logger.debug("Persisted FST to cache entry {}…", abbreviateKey(key));
		} catch (IOException e) {
			logger.warn("Failed to persist FST cache entry {}…: {}", abbreviateKey(key), e.getMessage());
		}
	}

	/**
	 * Returns the cached tree of {@code source}, parsing and caching it on a
	 * miss.
	 */
	public CompositeNode loadOrParse(String source) {
		CompositeNode cached = load(source);
		if (cached != null) {
			return cached;
		}
		CompositeNode module = Parser.parse(source);
		save(source, module);
		return module;
	}

	public void invalidate(String source) {
		deleteQuietly(getCacheFile(sha256Hex(source)));
	}

	private static void deleteQuietly(Path cacheFile) {
		try {
			Files.deleteIfExists(cacheFile);
		} catch (IOException e) {
			logger.debug("Failed to delete FST cache file {}: {}", cacheFile, e.getMessage());
		}
	}

	static String abbreviateKey(String key) {
		return key.substring(0, Math.min(12, key.length()));
	}

	// ---- Hashing helpers ----

	static String sha256Hex(String text) {
		try {
			MessageDigest md = MessageDigest.getInstance("SHA-256");
			byte[] digest = md.digest(text.getBytes(StandardCharsets.UTF_8));
			StringBuilder sb = new StringBuilder(digest.length * 2);
			for (byte b : digest) {
				sb.append(String.format("%02x", b & 0xff));
			}
			return sb.toString();
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 algorithm unavailable", e);
		}
	}
}
