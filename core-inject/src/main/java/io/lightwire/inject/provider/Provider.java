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
import io.lightwire.inject.exception.ConstructionException;
import org.jetbrains.annotations.Nullable;

/**
 * A provider knows how to construct a component and under what lifecycle policy.
 * <p>
 * It holds a factory and bound {@link Arguments}, both fixed at creation.
 * Only the late-bound arguments (nested providers and deferred references) may vary
 * from one resolution to another.
 *
 * @see Singleton
 * @see Factory
 * @see Resource
 */
public interface Provider<T> {
	/**
	 * Returns an instance, constructing it if the lifecycle policy requires.
	 * <p>
	 * Unchecked exceptions thrown by the factory are propagated unchanged,
	 * checked ones are wrapped into {@link ConstructionException}.
	 * A failed construction caches nothing, so the next call retries.
	 *
	 * @param extra call-time arguments, merged with the bound ones
	 */
	T resolve(Arguments extra);

	default T resolve() {
		return resolve(Arguments.EMPTY);
	}

	ProviderKind getKind();

	/**
	 * Returns the cached instance if there is one, never triggers construction.
	 * Always {@code null} for providers that do not cache.
	 */
	@Nullable T peekInstance();

	default boolean hasInstance() {
		return peekInstance() != null;
	}
}
