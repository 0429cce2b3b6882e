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

package io.lightwire.inject;

import org.jetbrains.annotations.Nullable;

import java.util.*;

import static io.lightwire.common.Checks.checkNotNull;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * An immutable set of provider arguments: an ordered list of positional values
 * and a mapping of named values.
 * <p>
 * A value is either a plain value, passed to the factory unchanged,
 * a nested {@link io.lightwire.inject.provider.Provider}, resolved first,
 * or a {@link Deferred} reference, invoked to obtain the value.
 * Plain values may be {@code null}.
 */
public final class Arguments {
	public static final Arguments EMPTY = new Arguments(List.of(), Map.of());

	private final List<@Nullable Object> positional;
	private final Map<String, @Nullable Object> named;

	private Arguments(List<@Nullable Object> positional, Map<String, @Nullable Object> named) {
		this.positional = positional;
		this.named = named;
	}

	public static Arguments of(@Nullable Object... positional) {
		return EMPTY.withPositional(positional);
	}

	public static Arguments named(String name, @Nullable Object value) {
		return EMPTY.with(name, value);
	}

	public static Arguments named(Map<String, ?> named) {
		Arguments arguments = EMPTY;
		for (Map.Entry<String, ?> entry : named.entrySet()) {
			arguments = arguments.with(entry.getKey(), entry.getValue());
		}
		return arguments;
	}

	/**
	 * @return new arguments with the named value added or replaced
	 */
	public Arguments with(String name, @Nullable Object value) {
		checkNotNull(name, "Argument name is null");
		Map<String, @Nullable Object> named = new LinkedHashMap<>(this.named);
		named.put(name, value);
		return new Arguments(positional, unmodifiableMap(named));
	}

	/**
	 * @return new arguments with the values appended to the positional ones
	 */
	public Arguments withPositional(@Nullable Object... values) {
		if (values.length == 0) return this;
		List<@Nullable Object> positional = new ArrayList<>(this.positional);
		positional.addAll(Arrays.asList(values));
		return new Arguments(unmodifiableList(positional), named);
	}

	/**
	 * Merges call-time arguments into bound ones.
	 * Positional values of {@code extra} are appended after these,
	 * named values of {@code extra} win on a name collision.
	 */
	public Arguments mergeWith(Arguments extra) {
		if (extra.isEmpty()) return this;
		if (isEmpty()) return extra;
		List<@Nullable Object> positional = new ArrayList<>(this.positional);
		positional.addAll(extra.positional);
		Map<String, @Nullable Object> named = new LinkedHashMap<>(this.named);
		named.putAll(extra.named);
		return new Arguments(unmodifiableList(positional), unmodifiableMap(named));
	}

	public List<@Nullable Object> getPositional() {
		return positional;
	}

	public Map<String, @Nullable Object> getNamed() {
		return named;
	}

	public boolean isEmpty() {
		return positional.isEmpty() && named.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Arguments that = (Arguments) o;
		return positional.equals(that.positional) && named.equals(that.named);
	}

	@Override
	public int hashCode() {
		return Objects.hash(positional, named);
	}

	@Override
	public String toString() {
		return "Arguments{positional=" + positional + ", named=" + named + '}';
	}
}
