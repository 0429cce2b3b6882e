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

import java.util.Locale;

import static io.lightwire.common.Checks.checkArgument;

@SuppressWarnings("unused")
public final class ConfigConverters {
	private ConfigConverters() {
	}

	public static SimpleConfigConverter<String> ofString() {
		return SimpleConfigConverter.of(String::valueOf);
	}

	public static SimpleConfigConverter<Integer> ofInteger() {
		return SimpleConfigConverter.of(value -> Math.toIntExact(toLong(value)));
	}

	public static SimpleConfigConverter<Long> ofLong() {
		return SimpleConfigConverter.of(ConfigConverters::toLong);
	}

	public static SimpleConfigConverter<Double> ofDouble() {
		return SimpleConfigConverter.of(value -> value instanceof Number number ?
				number.doubleValue() :
				Double.parseDouble(value.toString().trim()));
	}

	/**
	 * Accepts booleans and the strings {@code true/false}, {@code yes/no}, {@code on/off}, {@code 1/0}
	 */
	public static SimpleConfigConverter<Boolean> ofBoolean() {
		return SimpleConfigConverter.of(value -> {
			if (value instanceof Boolean bool) return bool;
			switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
				case "true":
				case "yes":
				case "on":
				case "1":
					return true;
				case "false":
				case "no":
				case "off":
				case "0":
					return false;
				default:
					throw new IllegalArgumentException("Not a boolean: '" + value + '\'');
			}
		});
	}

	public static <E extends Enum<E>> SimpleConfigConverter<E> ofEnum(Class<E> enumClass) {
		return SimpleConfigConverter.of(value -> enumClass.isInstance(value) ?
				enumClass.cast(value) :
				Enum.valueOf(enumClass, value.toString().trim()));
	}

	private static long toLong(Object value) {
		if (value instanceof Number number) {
			if (number instanceof Double || number instanceof Float) {
				double d = number.doubleValue();
				checkArgument(d == Math.rint(d), "Not an integral number: %s", value);
			}
			return number.longValue();
		}
		return Long.parseLong(value.toString().trim());
	}
}
