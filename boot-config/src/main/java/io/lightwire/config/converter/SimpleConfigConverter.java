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

package io.lightwire.config.converter;

import io.lightwire.config.Config;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Function;

import static io.lightwire.common.Checks.checkArgument;

/**
 * Base class for converters of scalar values.
 * <p>
 * Blank strings are treated as absent values, so a default applies to them.
 */
public abstract class SimpleConfigConverter<T> implements ConfigConverter<T> {
	@Override
	public final @NotNull T get(Config config) {
		return convert(config, config.getValue());
	}

	@Override
	public final @Nullable T get(Config config, @Nullable T defaultValue) {
		Object value = config.getValue(null);
		if (value == null || value instanceof String string && string.trim().isEmpty()) {
			return defaultValue;
		}
		return convert(config, value);
	}

	private T convert(Config config, Object value) {
		checkArgument(config.isLeaf(), "Expected a scalar value, found nested config %s", value);
		try {
			return fromScalar(value);
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new IllegalArgumentException("Cannot convert config value '" + value + '\'', e);
		}
	}

	protected abstract T fromScalar(Object value);

	public static <T> SimpleConfigConverter<T> of(Function<Object, T> fromScalarFn) {
		return new SimpleConfigConverter<>() {
			@Override
			protected T fromScalar(Object value) {
				return fromScalarFn.apply(value);
			}
		};
	}
}
