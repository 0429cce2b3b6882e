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

package io.lightwire.inject.exception;

import io.lightwire.inject.provider.Provider;

/**
 * Thrown when a factory or a release routine fails with a checked exception,
 * or when a factory returns {@code null}.
 * <p>
 * The original exception is kept as the cause. Unchecked exceptions thrown by factories
 * are never wrapped, callers see them as they were thrown.
 */
public final class ConstructionException extends RuntimeException {
	private ConstructionException(String message) {
		super(message);
	}

	private ConstructionException(String message, Throwable cause) {
		super(message, cause);
	}

	public static ConstructionException ofFactory(Provider<?> provider, Exception cause) {
		return new ConstructionException("Factory of " + provider + " failed: " + cause, cause);
	}

	public static ConstructionException ofRelease(Provider<?> provider, Exception cause) {
		return new ConstructionException("Release routine of " + provider + " failed: " + cause, cause);
	}

	public static ConstructionException nullInstance(Provider<?> provider) {
		return new ConstructionException("Factory of " + provider + " returned null");
	}
}
