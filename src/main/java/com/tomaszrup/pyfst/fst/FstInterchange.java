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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.tomaszrup.pyfst.render.SchemaValidator;
import com.tomaszrup.pyfst.schema.RenderingSchema;
import com.tomaszrup.pyfst.schema.SchemaEntry;
import com.tomaszrup.pyfst.schema.Slot;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * Plain nested map/list form of a tree and its JSON encoding.
 *
 * <p>An atom is {@code {"type": t, "value": text}}. A composite is
 * {@code {"type": t, attr: value, ...}} with its attributes in schema order:
 * nodes as nested maps (or {@code null}), lists as lists, strings and
 * booleans as themselves. Attribute names are those of the
 * {@link RenderingSchema}, so the format is stable as long as the schema
 * version is.</p>
 */
public final class FstInterchange {
	public static final String TYPE_KEY = "type";
	public static final String VALUE_KEY = "value";

	private static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
	private static final Gson PRETTY_GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping()
			.setPrettyPrinting().create();

	private FstInterchange() {
	}

	public static Map<String, Object> toMap(FstNode node) {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put(TYPE_KEY, node.getType());
		if (node instanceof AtomNode) {
			map.put(VALUE_KEY, ((AtomNode) node).getValue());
			return map;
		}
		for (Map.Entry<String, Object> attribute : ((CompositeNode) node).getAttributes().entrySet()) {
			map.put(attribute.getKey(), toPlain(attribute.getValue()));
		}
		return map;
	}

	private static Object toPlain(Object value) {
		if (value instanceof FstNode) {
			return toMap((FstNode) value);
		}
		if (value instanceof List) {
			List<Object> list = new ArrayList<>();
			for (Object item : (List<?>) value) {
				list.add(toMap((FstNode) item));
			}
			return list;
		}
		return value;
	}

	/**
	 * Rebuilds a tree from its map form and validates it against the schema.
	 *
	 * @throws ValidationError if the structure does not describe a valid tree
	 */
	public static FstNode fromMap(Map<?, ?> map) {
		FstNode node = nodeFromMap(map);
		SchemaValidator.validate(node);
		return node;
	}

	private static FstNode nodeFromMap(Map<?, ?> map) {
		Object type = map.get(TYPE_KEY);
		if (!(type instanceof String)) {
			throw new ValidationError("interchange node without a string '" + TYPE_KEY + "': " + map.keySet());
		}
		SchemaEntry entry = RenderingSchema.entry((String) type);
		if (entry.isAtom()) {
			Object value = map.get(VALUE_KEY);
			if (!(value instanceof String) || map.size() != 2) {
				throw new ValidationError("atom '" + type + "' needs exactly a string '" + VALUE_KEY + "'");
			}
			return new AtomNode((String) type, (String) value);
		}
		CompositeNode node = new CompositeNode((String) type);
		for (Object key : map.keySet()) {
			if (!TYPE_KEY.equals(key) && !entry.hasAttribute(String.valueOf(key))) {
				throw new ValidationError("node type " + type + " has no attribute '" + key + "'");
			}
		}
		for (Slot slot : entry.getAttributes().values()) {
			if (!map.containsKey(slot.getName())) {
				throw new ValidationError("node " + type + " lacks attribute '" + slot.getName() + "'");
			}
			node.set(slot.getName(), valueFromPlain(slot, map.get(slot.getName())));
		}
		return node;
	}

	private static Object valueFromPlain(Slot slot, Object value) {
		switch (slot.getKind()) {
			case NODE:
				if (value == null) {
					return null;
				}
				return nodeFromMap(requireMap(slot, value));
			case NODE_LIST:
			case SEPARATED_LIST: {
				if (!(value instanceof List)) {
					throw new ValidationError("attribute '" + slot.getName() + "' must be a list");
				}
				List<FstNode> nodes = new ArrayList<>();
				for (Object item : (List<?>) value) {
					nodes.add(nodeFromMap(requireMap(slot, item)));
				}
				return nodes;
			}
			case STRING:
				if (!(value instanceof String)) {
					throw new ValidationError("attribute '" + slot.getName() + "' must be a string");
				}
				return value;
			case FLAG:
				if (!(value instanceof Boolean)) {
					throw new ValidationError("attribute '" + slot.getName() + "' must be a boolean");
				}
				return value;
			default:
				throw new IllegalStateException("constant slots carry no value");
		}
	}

	private static Map<?, ?> requireMap(Slot slot, Object value) {
		if (!(value instanceof Map)) {
			throw new ValidationError("attribute '" + slot.getName() + "' must hold node objects");
		}
		return (Map<?, ?>) value;
	}

	// ---- JSON ----

	public static String toJson(FstNode node) {
		return GSON.toJson(toJsonElement(node));
	}

	public static String toPrettyJson(FstNode node) {
		return PRETTY_GSON.toJson(toJsonElement(node));
	}

	public static JsonElement toJsonElement(FstNode node) {
		return plainToJson(toMap(node));
	}

	private static JsonElement plainToJson(Object value) {
		if (value == null) {
			return JsonNull.INSTANCE;
		}
		if (value instanceof Map) {
			JsonObject object = new JsonObject();
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
				object.add(String.valueOf(entry.getKey()), plainToJson(entry.getValue()));
			}
			return object;
		}
		if (value instanceof List) {
			JsonArray array = new JsonArray();
			for (Object item : (List<?>) value) {
				array.add(plainToJson(item));
			}
			return array;
		}
		if (value instanceof Boolean) {
			return new JsonPrimitive((Boolean) value);
		}
		return new JsonPrimitive(String.valueOf(value));
	}

	/**
	 * @throws ValidationError if the text is not JSON or does not describe a
	 *                         valid tree
	 */
	public static FstNode fromJson(String json) {
		JsonElement element;
		try {
			element = JsonParser.parseString(json);
		} catch (JsonParseException e) {
			throw new ValidationError("malformed FST JSON: " + e.getMessage(), e);
		}
		if (!element.isJsonObject()) {
			throw new ValidationError("FST JSON must be an object");
		}
		return fromMap((Map<?, ?>) jsonToPlain(element));
	}

	private static Object jsonToPlain(JsonElement element) {
		if (element.isJsonNull()) {
			return null;
		}
		if (element.isJsonObject()) {
			Map<String, Object> map = new LinkedHashMap<>();
			for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
				map.put(entry.getKey(), jsonToPlain(entry.getValue()));
			}
			return map;
		}
		if (element.isJsonArray()) {
			List<Object> list = new ArrayList<>();
			for (JsonElement item : element.getAsJsonArray()) {
				list.add(jsonToPlain(item));
			}
			return list;
		}
		JsonPrimitive primitive = element.getAsJsonPrimitive();
		if (primitive.isBoolean()) {
			return primitive.getAsBoolean();
		}
		if (primitive.isString()) {
			return primitive.getAsString();
		}
		throw new ValidationError("unexpected JSON value " + primitive + " in FST");
	}
}
