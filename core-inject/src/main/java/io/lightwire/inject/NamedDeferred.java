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

import static io.lightwire.common.Checks.checkNotNull;

/**
 * A {@link Deferred} that resolves a name through an {@link InstanceLocator} each time it is invoked.
 * Caching is left to the provider behind the name.
 */
public final class NamedDeferred<T> implements Deferred<T> {
	private final InstanceLocator locator;
	private final String name;
	private final @Nullable Class<T> type;

	NamedDeferred(InstanceLocator locator, String name, @Nullable Class<T> type) {
		this.locator = checkNotNull(locator, "Locator is null");
		this.name = checkNotNull(name, "Name is null");
		this.type = type;
	}

	@SuppressWarnings("unchecked")
	@Override
	public T get() {
		return type != null ? locator.resolve(name, type) : (T) locator.resolve(name);
	}

	public String getName() {
		return name;
	}

	@Override
	public String toString() {
		return "Deferred{" + name + '}';
	}
}
