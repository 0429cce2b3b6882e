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

import static io.lightwire.common.Checks.checkNotNull;

/**
 * Constructs its instance once, on first resolution, and returns it to every caller afterwards.
 */
public final class Singleton<T> extends AbstractCachingProvider<T> {
	private Singleton(InstanceFactory<T> factory, Arguments arguments) {
		super(factory, arguments);
	}

	public static <T> Singleton<T> of(InstanceFactory<T> factory) {
		return new Singleton<>(factory, Arguments.EMPTY);
	}

	public static <T> Singleton<T> of(InstanceFactory<T> factory, Arguments arguments) {
		return new Singleton<>(factory, arguments);
	}

	/**
	 * @return a singleton that already holds the given instance
	 */
	public static <T> Singleton<T> ofInstance(T instance) {
		checkNotNull(instance, "Instance is null");
		Singleton<T> singleton = new Singleton<>(args -> instance, Arguments.EMPTY);
		singleton.instance = instance;
		return singleton;
	}

	@Override
	public ProviderKind getKind() {
		return ProviderKind.SINGLETON;
	}
}
