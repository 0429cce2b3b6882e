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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Thrown when resolving a name or provider requires resolving that same one first,
 * which would otherwise recurse until the stack is exhausted.
 * <p>
 * A cycle is broken by letting one side of it keep a
 * {@link io.lightwire.inject.Deferred deferred reference} to the other
 * instead of reading its value during construction.
 */
public final class CircularConstructionException extends RuntimeException {
	private final List<String> chain;

	private CircularConstructionException(List<String> chain) {
		super("Circular construction detected: " + String.join(" -> ", chain) +
				". Keep a deferred reference on one side of the cycle instead of its value");
		this.chain = chain;
	}

	/**
	 * @param inProgress names being resolved, outermost first
	 * @param name       the name requested again
	 */
	public static CircularConstructionException of(Collection<String> inProgress, String name) {
		List<String> chain = new ArrayList<>();
		boolean inCycle = false;
		for (String resolving : inProgress) {
			if (resolving.equals(name)) {
				inCycle = true;
			}
			if (inCycle) {
				chain.add(resolving);
			}
		}
		chain.add(name);
		return new CircularConstructionException(List.copyOf(chain));
	}

	/**
	 * Re-entry into a provider that is still constructing its instance,
	 * reached through nested providers or deferred references rather than by name
	 */
	public static CircularConstructionException ofProvider(Provider<?> provider) {
		String description = provider.toString();
		return new CircularConstructionException(List.of(description, description));
	}

	/**
	 * @return names forming the cycle, the first and the last being the same
	 */
	public List<String> getChain() {
		return chain;
	}
}
