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
import io.lightwire.inject.exception.CircularConstructionException;
import org.jetbrains.annotations.Nullable;

/**
 * A provider that keeps the first successfully constructed instance.
 * <p>
 * Concurrent first resolutions invoke the factory once, every caller gets the same instance.
 * Arguments passed after the instance exists are ignored.
 */
public abstract class AbstractCachingProvider<T> extends AbstractProvider<T> {
	protected volatile @Nullable T instance;

	// guarded by this
	private boolean constructing;

	protected AbstractCachingProvider(InstanceFactory<T> factory, Arguments arguments) {
		super(factory, arguments);
	}

	/**
	 * @throws CircularConstructionException if the factory of this provider,
	 *                                       directly or through other providers, asks for this provider again
	 */
	@Override
	public final T resolve(Arguments extra) {
		T instance = this.instance;
		if (instance != null) return instance;
		synchronized (this) {
			instance = this.instance;
			if (instance != null) return instance;
			if (constructing) {
				throw CircularConstructionException.ofProvider(this);
			}
			constructing = true;
			try {
				instance = construct(extra);
			} finally {
				constructing = false;
			}
			this.instance = instance;
			return instance;
		}
	}

	@Override
	public final @Nullable T peekInstance() {
		return instance;
	}
}
