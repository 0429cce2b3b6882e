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

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

final class Config_Branch implements Config {
	private final Map<String, Config> children;

	private volatile @Nullable Map<String, Object> nested;

	Config_Branch(Map<String, Config> children) {
		Map<String, Config> nonEmpty = new LinkedHashMap<>();
		children.forEach((key, child) -> {
			if (!child.isEmpty()) {
				nonEmpty.put(key, child);
			}
		});
		this.children = unmodifiableMap(nonEmpty);
	}

	/**
	 * A branch always has a value: the nested map of its children, possibly empty.
	 */
	@Override
	public Object getValue(@Nullable Object defaultValue) {
		Map<String, Object> nested = this.nested;
		if (nested == null) {
			nested = toNestedMap();
			this.nested = nested;
		}
		return nested;
	}

	@Override
	public Map<String, Config> getChildren() {
		return children;
	}

	private Map<String, Object> toNestedMap() {
		Map<String, Object> result = new LinkedHashMap<>();
		children.forEach((key, child) -> result.put(key, child.getValue()));
		return unmodifiableMap(result);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return children.equals(((Config_Branch) o).children);
	}

	@Override
	public int hashCode() {
		return children.hashCode();
	}

	@Override
	public String toString() {
		return children.toString();
	}
}
