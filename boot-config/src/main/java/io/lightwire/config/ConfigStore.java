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
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.util.Map;

import static io.lightwire.common.Checks.checkNotNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Holder of the configuration tree of a container.
 * <p>
 * The tree is loaded once at startup and read afterwards.
 * Each {@link #load} replaces the whole tree, nothing is merged with the previous content.
 * Reads need no synchronization, but a load must not race with reads.
 */
public final class ConfigStore {
	private static final Logger logger = getLogger(ConfigStore.class);

	private volatile Config root = Config.EMPTY;
	private volatile boolean loaded;

	/**
	 * Replaces the content of this store with a tree built from a nested mapping
	 *
	 * @see Config#ofMap(Map)
	 */
	public void load(Map<String, ?> source) {
		load(Config.ofMap(checkNotNull(source, "Config source is null")));
	}

	public void load(Config source) {
		checkNotNull(source, "Config source is null");
		if (loaded) {
			logger.debug("Replacing previously loaded config");
		}
		root = source;
		loaded = true;
		logger.debug("Loaded config with {} value(s)", source.toMap().size());
	}

	public boolean isLoaded() {
		return loaded;
	}

	public Config getRoot() {
		return root;
	}

	/**
	 * @throws NotFoundException if nothing is stored at the path
	 */
	public Object get(String path) throws NotFoundException {
		return root.get(path);
	}

	public @Nullable Object get(String path, @Nullable Object defaultValue) {
		Config child = root.getChild(path);
		if (child.isEmpty()) {
			logger.trace("No config value at '{}', using default {}", path, defaultValue);
			return defaultValue;
		}
		return child.getValue();
	}

	public <T> T get(ConfigConverter<T> converter, String path) throws NotFoundException {
		return root.get(converter, path);
	}

	public <T> T get(ConfigConverter<T> converter, String path, @Nullable T defaultValue) {
		return root.get(converter, path, defaultValue);
	}

	public boolean has(String path) {
		return root.hasChild(path);
	}

	/**
	 * @throws NotFoundException if there is no top-level entry under the key
	 * @see Config#at(String)
	 */
	public Config at(String key) throws NotFoundException {
		return root.at(key);
	}

	public Config getChild(String path) {
		return root.getChild(path);
	}

	public Map<String, Object> toMap() {
		return root.toMap();
	}

	@Override
	public String toString() {
		return "ConfigStore{loaded=" + loaded + ", values=" + root.toMap().size() + '}';
	}
}
