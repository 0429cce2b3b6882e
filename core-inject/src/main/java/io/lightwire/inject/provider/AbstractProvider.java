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
import io.lightwire.inject.ResolvedArguments;
import io.lightwire.inject.exception.ConstructionException;
import org.slf4j.Logger;

import static io.lightwire.common.Checks.checkNotNull;
import static org.slf4j.LoggerFactory.getLogger;

public abstract class AbstractProvider<T> implements Provider<T> {
	private static final Logger logger = getLogger(AbstractProvider.class);

	protected final InstanceFactory<T> factory;
	protected final Arguments arguments;

	protected AbstractProvider(InstanceFactory<T> factory, Arguments arguments) {
		this.factory = checkNotNull(factory, "Factory is null");
		this.arguments = checkNotNull(arguments, "Arguments are null");
	}

	public final Arguments getArguments() {
		return arguments;
	}

	protected final T construct(Arguments extra) {
		ResolvedArguments args = ResolvedArguments.of(arguments.mergeWith(extra));
		T instance;
		try {
			instance = factory.create(args);
		} catch (RuntimeException e) {
			throw e;
		} catch (Exception e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw ConstructionException.ofFactory(this, e);
		}
		if (instance == null) {
			throw ConstructionException.nullInstance(this);
		}
		logger.debug("{} constructed {}", this, instance.getClass().getName());
		return instance;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" + getKind() +
				(arguments.isEmpty() ? "" : ", " + arguments) + '}';
	}
}
