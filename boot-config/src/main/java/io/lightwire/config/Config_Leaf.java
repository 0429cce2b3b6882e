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

import java.util.Map;
import java.util.Objects;

import static java.util.Collections.emptyMap;

final class Config_Leaf implements Config {
	private final Object value;

	Config_Leaf(Object value) {
		this.value = value;
	}

	@Override
	public Object getValue(@Nullable Object defaultValue) {
		return value;
	}

	@Override
	public Map<String, Config> getChildren() {
		return emptyMap();
	}

	@Override
	public boolean isLeaf() {
		return true;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return value.equals(((Config_Leaf) o).value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}

	@Override
	public String toString() {
		return String.valueOf(value);
	}
}
