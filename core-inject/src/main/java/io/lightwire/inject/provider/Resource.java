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
import io.lightwire.inject.InstanceReleaser;
import io.lightwire.inject.exception.ConstructionException;
import org.slf4j.Logger;

import static io.lightwire.common.Checks.checkNotNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Caches its instance like a {@link Singleton} and supports an explicit {@link #release()}
 * that runs a teardown routine on it.
 * <p>
 * Nothing is released implicitly. Once released, the provider is empty again,
 * and a later resolution constructs a fresh instance.
 */
public final class Resource<T> extends AbstractCachingProvider<T> {
	private static final Logger logger = getLogger(Resource.class);

	private final InstanceReleaser<? super T> releaser;

	private Resource(InstanceFactory<T> factory, InstanceReleaser<? super T> releaser, Arguments arguments) {
		super(factory, arguments);
		this.releaser = checkNotNull(releaser, "Releaser is null");
	}

	public static <T> Resource<T> of(InstanceFactory<T> factory, InstanceReleaser<? super T> releaser) {
		return new Resource<>(factory, releaser, Arguments.EMPTY);
	}

	public static <T> Resource<T> of(InstanceFactory<T> factory, InstanceReleaser<? super T> releaser, Arguments arguments) {
		return new Resource<>(factory, releaser, arguments);
	}

	/**
	 * Runs the teardown routine on the live instance, if there is one.
	 * The instance is dropped even if the routine fails, so it is never released twice.
	 *
	 * @return {@code true} if an instance was released, {@code false} if there was none
	 * @throws ConstructionException if the routine throws a checked exception
	 */
	public boolean release() {
		T instance;
		synchronized (this) {
			instance = this.instance;
			if (instance == null) return false;
			this.instance = null;
		}
		logger.debug("Releasing {}", instance.getClass().getName());
		try {
			releaser.release(instance);
		} catch (RuntimeException e) {
			throw e;
		} catch (Exception e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw ConstructionException.ofRelease(this, e);
		}
		return true;
	}

	@Override
	public ProviderKind getKind() {
		return ProviderKind.RESOURCE;
	}
}
