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

package io.lightwire.inject.provider;

import io.lightwire.inject.Arguments;
import io.lightwire.inject.InstanceFactory;
import org.jetbrains.annotations.Nullable;

/**
 * Constructs a new instance on every resolution and keeps nothing.
 * Needs no synchronization as long as the factory itself is safe to call concurrently.
 */
public final class Factory<T> extends AbstractProvider<T> {
	private Factory(InstanceFactory<T> factory, Arguments arguments) {
		super(factory, arguments);
	}

	public static <T> Factory<T> of(InstanceFactory<T> factory) {
		return new Factory<>(factory, Arguments.EMPTY);
	}

	public static <T> Factory<T> of(InstanceFactory<T> factory, Arguments arguments) {
		return new Factory<>(factory, arguments);
	}

	@Override
	public T resolve(Arguments extra) {
		return construct(extra);
	}

	@Override
	public ProviderKind getKind() {
		return ProviderKind.FACTORY;
	}

	@Override
	public @Nullable T peekInstance() {
		return null;
	}
}
