/*
 * Copyright (C) 2020 ActiveJ LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.lightwire.config;

import io.lightwire.common.exception.NotFoundException;
import io.lightwire.config.converter.ConfigConverter;
import io.lightwire.config.converter.ConfigConverters;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.regex.Pattern;

import static io.lightwire.common.Checks.checkArgument;
import static io.lightwire.common.Checks.checkNotNull;
import static java.util.Collections.emptyMap;

/**
 * An immutable node of a nested configuration tree.
 * <p>
 * A node is either a leaf holding a scalar value (a string, a number, a boolean...),
 * or a branch holding an ordered mapping from keys to child nodes.
 * Nodes are addressed with dotted paths such as {@code "database.url"}.
 * <p>
 * Path lookups never partially match: every segment of a path must be present as a key
 * at its level, descending through a leaf is a miss.
 */
public interface Config {
	/**
	 * Empty config with no value and no children
	 */
	Config EMPTY = new Config() {
		@Override
		public @Nullable Object getValue(@Nullable Object defaultValue) {
			return defaultValue;
		}

		@Override
		public Map<String, Config> getChildren() {
			return emptyMap();
		}

		@Override
		public String toString() {
			return "Config.EMPTY";
		}
	};

	String THIS = "";
	String DELIMITER = ".";
	Pattern DELIMITER_PATTERN = Pattern.compile(Pattern.quote(DELIMITER));

	static String concatPath(String prefix, String suffix) {
		return prefix.isEmpty() || suffix.isEmpty() ? prefix + suffix : prefix + DELIMITER + suffix;
	}

	/**
	 * A path is either empty or a sequence of non-empty keys joined by {@link #DELIMITER}
	 */
	static void checkPath(String path) {
		checkArgument(path.isEmpty() || Arrays.stream(DELIMITER_PATTERN.split(path, -1)).noneMatch(String::isEmpty),
				"Invalid path '%s'", path);
	}

	/**
	 * Any non-empty string without {@link #DELIMITER} is a valid key
	 */
	static void checkKey(String key) {
		checkArgument(!key.isEmpty() && !key.contains(DELIMITER), "Invalid key '%s'", key);
	}

	/**
	 * Returns the scalar of a leaf, an unmodifiable nested map of a branch,
	 * or {@code defaultValue} if this node is empty.
	 */
	@Nullable Object getValue(@Nullable Object defaultValue);

	Map<String, Config> getChildren();

	/**
	 * @throws NotFoundException if this node is empty
	 */
	default Object getValue() throws NotFoundException {
		Object value = getValue(null);
		if (value == null) {
			throw NotFoundException.noConfigValue(THIS);
		}
		return value;
	}

	default boolean isLeaf() {
		return false;
	}

	default boolean hasValue() {
		return getValue(null) != null;
	}

	default boolean hasChildren() {
		return !getChildren().isEmpty();
	}

	default boolean isEmpty() {
		return !hasValue();
	}

	default boolean hasChild(String path) {
		return !getChild(path).isEmpty();
	}

	/**
	 * @return child {@code Config} if every segment of the path exists, {@link Config#EMPTY} otherwise
	 */
	default Config getChild(String path) {
		if (path.isEmpty()) {
			return this;
		}
		Config config = this;
		for (String key : DELIMITER_PATTERN.split(path, -1)) {
			Config child = config.getChildren().get(key);
			if (child == null) {
				return EMPTY;
			}
			config = child;
		}
		return config;
	}

	/**
	 * Single-segment access with no default.
	 *
	 * @throws NotFoundException if there is no child under the key
	 */
	default Config at(String key) throws NotFoundException {
		checkKey(key);
		Config child = getChildren().get(key);
		if (child == null) {
			throw NotFoundException.noConfigChild(key);
		}
		return child;
	}

	/**
	 * @return value at the path
	 * @throws NotFoundException if nothing is stored at the path
	 */
	default Object get(String path) throws NotFoundException {
		Object value = getChild(path).getValue(null);
		if (value == null) {
			throw NotFoundException.noConfigValue(path);
		}
		return value;
	}

	/**
	 * @return value at the path, or {@code defaultValue} if nothing is stored there
	 */
	default @Nullable Object get(String path, @Nullable Object defaultValue) {
		return getChild(path).getValue(defaultValue);
	}

	/**
	 * @throws NotFoundException        if nothing is stored at the path
	 * @throws IllegalArgumentException if the stored value cannot be converted
	 * @see ConfigConverters
	 */
	default <T> T get(ConfigConverter<T> converter, String path) throws NotFoundException {
		Config child = getChild(path);
		if (child.isEmpty()) {
			throw NotFoundException.noConfigValue(path);
		}
		return converter.get(child);
	}

	/**
	 * @param converter specifies how to convert a stored value into &lt;T&gt;
	 * @param path      path to config value. Example: "database.pool.size"
	 * @return converted value at the path, or {@code defaultValue} if nothing is stored there
	 */
	default <T> T get(ConfigConverter<T> converter, String path, @Nullable T defaultValue) {
		return converter.get(getChild(path), defaultValue);
	}

	/**
	 * @return new {@code Config} with the value placed at the path, this config is left unchanged
	 */
	default Config with(@NotNull String path, @NotNull Object value) {
		checkNotNull(value, "Config value at '%s' is null", path);
		return with(path, toNode(value));
	}

	/**
	 * @return new {@code Config} with the given node placed at the path, this config is left unchanged
	 */
	default Config with(@NotNull String path, @NotNull Config config) {
		checkPath(path);
		String[] keys = DELIMITER_PATTERN.split(path);
		for (int i = keys.length - 1; i >= 0; i--) {
			String key = keys[i];
			if (key.isEmpty()) {
				continue;
			}
			config = new Config_Branch(Map.of(key, config));
		}
		return overrideWith(config);
	}

	/**
	 * Deep merge of two trees.
	 * Leaves of {@code other} replace whatever is at the same position in this config,
	 * branches present in both are merged key by key.
	 *
	 * @return new {@code Config}, this config is left unchanged
	 */
	default Config overrideWith(Config other) {
		if (other.isLeaf()) {
			return other;
		}
		if (other.isEmpty()) {
			return this;
		}
		if (isLeaf() || isEmpty()) {
			return other;
		}
		Map<String, Config> children = new LinkedHashMap<>(getChildren());
		other.getChildren().forEach((key, otherChild) -> children.merge(key, otherChild, Config::overrideWith));
		return new Config_Branch(children);
	}

	/**
	 * Flattens this config
	 *
	 * @return new {@code Map<path, value>} of every leaf
	 */
	default Map<String, Object> toMap() {
		Map<String, Object> result = new LinkedHashMap<>();
		if (isLeaf()) {
			result.put(THIS, getValue());
			return result;
		}
		for (Map.Entry<String, Config> entry : getChildren().entrySet()) {
			entry.getValue().toMap().forEach((path, value) -> result.put(concatPath(entry.getKey(), path), value));
		}
		return result;
	}

	/**
	 * @return empty config
	 */
	static Config create() {
		return EMPTY;
	}

	/**
	 * @return new {@code Config} with only one value
	 */
	static Config ofValue(Object value) {
		return new Config_Leaf(checkNotNull(value, "Config value is null"));
	}

	/**
	 * Builds a tree from a nested structure. Values that are maps become branches,
	 * any other non-null value becomes a leaf, {@code null} values are skipped.
	 *
	 * @param map nested mapping of keys to scalars or further mappings
	 * @return new {@code Config}
	 */
	static Config ofMap(Map<String, ?> map) {
		Map<String, Config> children = new LinkedHashMap<>();
		for (Map.Entry<String, ?> entry : map.entrySet()) {
			String key = entry.getKey();
			checkKey(key);
			Object value = entry.getValue();
			if (value == null) {
				continue;
			}
			children.put(key, toNode(value));
		}
		return new Config_Branch(children);
	}

	/**
	 * Builds a tree from dotted paths, as found in properties files
	 *
	 * @param map of path, value pairs
	 * @return new {@code Config}
	 */
	static Config ofFlatMap(Map<String, ?> map) {
		Config config = create();
		for (Map.Entry<String, ?> entry : map.entrySet()) {
			if (entry.getValue() != null) {
				config = config.with(entry.getKey(), entry.getValue());
			}
		}
		return config;
	}

	@SuppressWarnings("unchecked")
	private static Config toNode(Object value) {
		if (value instanceof Config config) {
			return config;
		}
		if (value instanceof Map<?, ?> map) {
			for (Object key : map.keySet()) {
				checkArgument(key instanceof String, "Config keys must be strings, got %s", key);
			}
			return ofMap((Map<String, ?>) map);
		}
		return new Config_Leaf(value);
	}
}
