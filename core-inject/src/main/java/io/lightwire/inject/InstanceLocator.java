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

package io.lightwire.inject;

import io.lightwire.common.exception.NotFoundException;
import org.jetbrains.annotations.Nullable;

/**
 * Read side of a {@link Container}: resolution of instances by name.
 * <p>
 * {@link Deferred} references depend on this interface only, and only when invoked.
 */
public interface InstanceLocator {
	/**
	 * @throws NotFoundException if nothing is registered under the name
	 */
	Object resolve(String name) throws NotFoundException;

	/**
	 * @param extra arguments merged with the bound ones for this call
	 * @throws NotFoundException if nothing is registered under the name
	 */
	Object resolve(String name, Arguments extra) throws NotFoundException;

	/**
	 * @throws NotFoundException  if nothing is registered under the name
	 * @throws ClassCastException if the instance is not of the requested type
	 */
	<T> T resolve(String name, Class<T> type) throws NotFoundException;

	/**
	 * Same as {@link #resolve(String, Class)} except that it returns {@code null}
	 * instead of throwing an exception when nothing is registered under the name.
	 */
	<T> @Nullable T resolveOrNull(String name, Class<T> type);

	/**
	 * Same as {@link #resolveOrNull(String, Class)}, but replaces {@code null} with given default value.
	 */
	<T> T resolveOr(String name, Class<T> type, T defaultValue);
}
