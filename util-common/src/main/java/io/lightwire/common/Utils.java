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

import org.jetbrains.annotations.ApiStatus.Internal;
import org.jetbrains.annotations.Nullable;

import java.util.function.Supplier;

/**
 * Utility helper methods for internal use
 */
@Internal
public final class Utils {
	private Utils() {
	}

	public static <T> T nonNullElse(@Nullable T value, T defaultValue) {
		return value != null ? value : defaultValue;
	}

	public static <T, E extends Throwable> T nonNullOrException(@Nullable T value, Supplier<E> exceptionSupplier) throws E {
		if (value != null) {
			return value;
		}
		throw exceptionSupplier.get();
	}

	/**
	 * Short, single-line form of an object for log and error messages.
	 */
	public static String toDisplayString(@Nullable Object object) {
		if (object == null) return "null";
		String string = object.toString();
		return string.length() <= 64 ? string : string.substring(0, 61) + "...";
	}
}
