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

package io.lightwire.common.exception;

import java.util.NoSuchElementException;

/**
 * Thrown when a name or a path is asked for and nothing is registered or stored under it.
 * <p>
 * The missing key is available through {@link #getKey()} and is always part of the message.
 */
public final class NotFoundException extends NoSuchElementException {
	private final String key;

	private NotFoundException(String key, String message) {
		super(message);
		this.key = key;
	}

	public static NotFoundException noProvider(String name) {
		return new NotFoundException(name, "No provider registered under name '" + name + '\'');
	}

	public static NotFoundException noConfigValue(String path) {
		return new NotFoundException(path, "No config value at path '" + path + '\'');
	}

	public static NotFoundException noConfigChild(String key) {
		return new NotFoundException(key, "No config entry for key '" + key + '\'');
	}

	public static NotFoundException noArgument(String name) {
		return new NotFoundException(name, "No argument '" + name + "' was bound or passed");
	}

	public String getKey() {
		return key;
	}
}
