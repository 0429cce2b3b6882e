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

import io.lightwire.common.exception.NotFoundException;
import io.lightwire.inject.provider.Provider;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The view of merged {@link Arguments} that a factory receives for a single construction.
 * <p>
 * Each argument is resolved when first read and remembered for the rest of the call:
 * nested providers are resolved, deferred references are invoked, plain values pass through.
 * Instances of this class are confined to the constructing thread.
 */
public final class ResolvedArguments {
	private static final Object UNRESOLVED = new Object();

	private final Arguments arguments;

	private final Object[] positional;
	private final Map<String, @Nullable Object> named = new HashMap<>();

	ResolvedArguments(Arguments arguments) {
		this.arguments = arguments;
		this.positional = new Object[arguments.getPositional().size()];
		Arrays.fill(positional, UNRESOLVED);
	}

	public static ResolvedArguments of(Arguments arguments) {
		return new ResolvedArguments(arguments);
	}

	public int size() {
		return positional.length;
	}

	public boolean has(String name) {
		return arguments.getNamed().containsKey(name);
	}

	public Set<String> getNames() {
		return arguments.getNamed().keySet();
	}

	/**
	 * @throws NotFoundException if there is no positional argument at the index
	 */
	public @Nullable Object get(int index) throws NotFoundException {
		checkIndex(index);
		Object value = positional[index];
		if (value == UNRESOLVED) {
			value = resolveValue(arguments.getPositional().get(index));
			positional[index] = value;
		}
		return value;
	}

	public <T> @Nullable T get(int index, Class<T> type) throws NotFoundException {
		return narrow("#" + index, get(index), type);
	}

	/**
	 * @throws NotFoundException if there is no argument under the name
	 */
	public @Nullable Object get(String name) throws NotFoundException {
		if (!has(name)) {
			throw NotFoundException.noArgument(name);
		}
		if (named.containsKey(name)) {
			return named.get(name);
		}
		Object value = resolveValue(arguments.getNamed().get(name));
		named.put(name, value);
		return value;
	}

	public <T> @Nullable T get(String name, Class<T> type) throws NotFoundException {
		return narrow(name, get(name), type);
	}

	public <T> T getOr(String name, Class<T> type, T defaultValue) {
		if (!has(name)) return defaultValue;
		T value = get(name, type);
		return value != null ? value : defaultValue;
	}

	/**
	 * Returns a reference to the argument instead of its value, leaving it unresolved.
	 * The reference can be kept and invoked after the instance under construction is built.
	 *
	 * @throws NotFoundException if there is no argument under the name
	 */
	public <T> Deferred<T> getDeferred(String name) throws NotFoundException {
		if (!has(name)) {
			throw NotFoundException.noArgument(name);
		}
		if (named.containsKey(name)) {
			return toDeferred(named.get(name), true);
		}
		return toDeferred(arguments.getNamed().get(name), false);
	}

	public <T> Deferred<T> getDeferred(int index) throws NotFoundException {
		checkIndex(index);
		Object value = positional[index];
		return value != UNRESOLVED ?
				toDeferred(value, true) :
				toDeferred(arguments.getPositional().get(index), false);
	}

	/**
	 * Resolves every positional argument
	 */
	public List<@Nullable Object> getPositional() {
		List<@Nullable Object> result = new ArrayList<>(positional.length);
		for (int i = 0; i < positional.length; i++) {
			result.add(get(i));
		}
		return result;
	}

	/**
	 * Resolves every named argument
	 */
	public Map<String, @Nullable Object> getNamed() {
		Map<String, @Nullable Object> result = new LinkedHashMap<>();
		for (String name : getNames()) {
			result.put(name, get(name));
		}
		return result;
	}

	private void checkIndex(int index) {
		if (index < 0 || index >= positional.length) {
			throw NotFoundException.noArgument("#" + index);
		}
	}

	static @Nullable Object resolveValue(@Nullable Object value) {
		if (value instanceof Provider<?> provider) {
			return provider.resolve();
		}
		if (value instanceof Deferred<?> deferred) {
			return deferred.get();
		}
		return value;
	}

	@SuppressWarnings("unchecked")
	private static <T> Deferred<T> toDeferred(@Nullable Object value, boolean resolved) {
		if (!resolved) {
			if (value instanceof Deferred<?> deferred) {
				return (Deferred<T>) deferred;
			}
			if (value instanceof Provider<?> provider) {
				return () -> (T) provider.resolve();
			}
		}
		return Deferred.ofValue((T) value);
	}

	private static <T> @Nullable T narrow(String name, @Nullable Object value, Class<T> type) {
		if (value != null && !type.isInstance(value)) {
			throw new ClassCastException("Argument '" + name + "' is " + value.getClass().getName() +
					", not " + type.getName());
		}
		return type.cast(value);
	}

	@Override
	public String toString() {
		return "ResolvedArguments{" + arguments + '}';
	}
}
