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

import io.lightwire.config.ConfigStore;
import org.jetbrains.annotations.Nullable;

import java.util.function.Supplier;

import static io.lightwire.common.Checks.checkNotNull;

/**
 * A zero-argument reference that produces its value only when invoked.
 * <p>
 * When used as a provider argument, it is invoked at the time the argument is read,
 * not at registration time. This is what lets two providers name each other:
 * registration never requires the other side to exist yet.
 * <p>
 * A factory may also keep the reference itself (see {@link ResolvedArguments#getDeferred(String)})
 * and invoke it later, after its own instance is built.
 * That is how mutually dependent components get linked to each other.
 *
 * @see Container#deferred(String)
 */
@FunctionalInterface
public interface Deferred<T> {
	T get();

	static <T> Deferred<T> of(Supplier<? extends T> supplier) {
		checkNotNull(supplier, "Supplier is null");
		return supplier::get;
	}

	static <T> Deferred<T> ofValue(T value) {
		return () -> value;
	}

	/**
	 * @return a reference to the instance registered under the name
	 */
	static <T> Deferred<T> ofName(InstanceLocator locator, String name) {
		return new NamedDeferred<>(locator, name, null);
	}

	/**
	 * @return a reference to the instance registered under the name, narrowed to the type
	 */
	static <T> Deferred<T> ofName(InstanceLocator locator, String name, Class<T> type) {
		return new NamedDeferred<>(locator, name, type);
	}

	/**
	 * Lookup of a config value, failing with {@link io.lightwire.common.exception.NotFoundException} if it is absent
	 */
	static Deferred<Object> ofConfig(ConfigStore config, String path) {
		return () -> config.get(path);
	}

	static Deferred<Object> ofConfig(ConfigStore config, String path, @Nullable Object defaultValue) {
		return () -> config.get(path, defaultValue);
	}
}
