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

package io.lightwire.common;

import org.jetbrains.annotations.Nullable;

import java.util.function.Supplier;

/**
 * Precondition checks used across the container and the configuration store.
 * <p>
 * Failing argument checks throw {@link IllegalArgumentException}, failing state checks
 * throw {@link IllegalStateException}, and failing null checks throw {@link NullPointerException}.
 * These signal programmer errors, not conditions a caller is expected to recover from.
 */
public final class Checks {
	private Checks() {
	}

	public static <T> T checkNotNull(@Nullable T reference, Object message) {
		if (reference != null) {
			return reference;
		}
		throw new NullPointerException(String.valueOf(message));
	}

	public static <T> T checkNotNull(@Nullable T reference, String template, Object... args) {
		if (reference != null) {
			return reference;
		}
		throw new NullPointerException(String.format(template, args));
	}

	public static void checkArgument(boolean expression, Supplier<String> message) {
		if (!expression) {
			throw new IllegalArgumentException(message.get());
		}
	}

	/**
	 * @param template a {@link String#format(String, Object...) format} template of the error message
	 * @throws IllegalArgumentException if {@code expression} is false
	 */
	public static void checkArgument(boolean expression, String template, Object... args) {
		if (!expression) {
			throw new IllegalArgumentException(String.format(template, args));
		}
	}
}
