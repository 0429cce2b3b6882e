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
import io.lightwire.config.ConfigStore;
import io.lightwire.inject.exception.CircularConstructionException;
import io.lightwire.inject.provider.Factory;
import io.lightwire.inject.provider.Provider;
import io.lightwire.inject.provider.ProviderKind;
import io.lightwire.inject.provider.Resource;
import io.lightwire.inject.provider.Singleton;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import static io.lightwire.common.Checks.checkArgument;
import static io.lightwire.common.Checks.checkNotNull;
import static io.lightwire.common.Utils.*;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Container is the registry that application wiring code talks to.
 * <p>
 * It maps unique names to {@link Provider providers} and owns exactly one {@link ConfigStore},
 * reachable through {@link #getConfig()} and never through the name registry.
 * <p>
 * Wiring follows two phases. First the composition root loads the config and registers
 * every provider, which is pure declaration and constructs nothing. Then instances are
 * resolved on demand, lazily, by name. Providers that need each other name the other side
 * with a {@link #deferred(String) deferred reference}, so registration order does not matter.
 * <p>
 * Resolving a name that is already being resolved by the same thread fails with
 * {@link CircularConstructionException} instead of recursing indefinitely.
 * <p>
 * Resources are never released implicitly, {@link #shutdown()} releases them
 * in reverse registration order.
 */
public final class Container implements InstanceLocator, AutoCloseable {
	private static final Logger logger = getLogger(Container.class);

	private static final Pattern NAME_PATTERN = Pattern.compile("[0-9a-zA-Z_$][0-9a-zA-Z_$.:-]*");

	private record RegisteredResource(String name, Resource<?> resource) {
	}

	private final ConfigStore config = new ConfigStore();

	private final Map<String, Provider<?>> providers = new ConcurrentHashMap<>();
	private final List<String> names = new CopyOnWriteArrayList<>();
	private final List<RegisteredResource> resources = new CopyOnWriteArrayList<>();

	private final ThreadLocal<Deque<String>> resolving = ThreadLocal.withInitial(ArrayDeque::new);

	private Container() {
	}

	public static Container create() {
		return new Container();
	}

	// region registration

	/**
	 * Binds the name to the provider, replacing any previous binding under that name.
	 * <p>
	 * An instance already cached by the replaced provider is not touched:
	 * whoever holds it keeps it, later resolutions use the new provider.
	 * A replaced resource is still released on {@link #shutdown()}.
	 */
	public <T> Container register(String name, Provider<T> provider) {
		checkNotNull(name, "Name is null");
		checkArgument(NAME_PATTERN.matcher(name).matches(), "Invalid provider name '%s'", name);
		checkNotNull(provider, "Provider for '%s' is null", name);
		synchronized (this) {
			Provider<?> previous = providers.put(name, provider);
			if (previous == null) {
				names.add(name);
			} else if (previous.hasInstance()) {
				logger.warn("Provider '{}' was replaced while holding a live instance {}, " +
						"existing holders keep the old instance", name, toDisplayString(previous.peekInstance()));
			} else {
				logger.debug("Provider '{}' was replaced", name);
			}
			if (provider instanceof Resource<?> resource && resources.stream().noneMatch(r -> r.resource() == resource)) {
				resources.add(new RegisteredResource(name, resource));
			}
		}
		logger.debug("Registered '{}': {}", name, provider);
		return this;
	}

	/**
	 * Binds the name to an already constructed instance
	 */
	public <T> Container registerInstance(String name, T instance) {
		return register(name, Singleton.ofInstance(instance));
	}

	/**
	 * Binds the name to a supplier called on every resolution
	 */
	public <T> Container registerFactory(String name, Supplier<? extends T> supplier) {
		checkNotNull(supplier, "Supplier for '%s' is null", name);
		return register(name, Factory.<T>of(args -> supplier.get()));
	}
	// endregion

	// region resolution

	@Override
	public Object resolve(String name) throws NotFoundException {
		return resolve(name, Arguments.EMPTY);
	}

	/**
	 * Looks up the provider bound to the name and resolves it.
	 * Failures of the provider are propagated unchanged.
	 * <p>
	 * A {@link ProviderKind#FACTORY factory} may resolve its own name again, with other arguments,
	 * while building an instance. Bounding such recursion is up to the factory.
	 *
	 * @throws NotFoundException              if nothing is registered under the name
	 * @throws CircularConstructionException if the name of a singleton or resource
	 *                                       is already being resolved by this thread
	 */
	@Override
	public Object resolve(String name, Arguments extra) throws NotFoundException {
		Provider<?> provider = nonNullOrException(providers.get(checkNotNull(name, "Name is null")),
				() -> NotFoundException.noProvider(name));
		Deque<String> stack = resolving.get();
		if (provider.getKind() != ProviderKind.FACTORY && stack.contains(name)) {
			throw CircularConstructionException.of(stack, name);
		}
		stack.addLast(name);
		try {
			return provider.resolve(extra);
		} finally {
			stack.removeLast();
			if (stack.isEmpty()) {
				resolving.remove();
			}
		}
	}

	@Override
	public <T> T resolve(String name, Class<T> type) throws NotFoundException {
		return narrow(name, resolve(name), type);
	}

	public <T> T resolve(String name, Class<T> type, Arguments extra) throws NotFoundException {
		return narrow(name, resolve(name, extra), type);
	}

	@Override
	public <T> @Nullable T resolveOrNull(String name, Class<T> type) {
		return providers.containsKey(name) ? resolve(name, type) : null;
	}

	@Override
	public <T> T resolveOr(String name, Class<T> type, T defaultValue) {
		return nonNullElse(resolveOrNull(name, type), defaultValue);
	}

	private static <T> T narrow(String name, Object instance, Class<T> type) {
		if (!type.isInstance(instance)) {
			throw new ClassCastException("Instance registered under '" + name + "' is " +
					instance.getClass().getName() + ", not " + type.getName());
		}
		return type.cast(instance);
	}

	/**
	 * Returns a reference that resolves the name when invoked. Nothing is looked up now,
	 * the name does not even have to be registered yet.
	 */
	public <T> Deferred<T> deferred(String name) {
		return Deferred.ofName(this, name);
	}

	public <T> Deferred<T> deferred(String name, Class<T> type) {
		return Deferred.ofName(this, name, type);
	}

	/**
	 * Returns a reference to a config value, read when the reference is invoked
	 */
	public Deferred<Object> deferredConfig(String path) {
		return Deferred.ofConfig(config, path);
	}

	public Deferred<Object> deferredConfig(String path, @Nullable Object defaultValue) {
		return Deferred.ofConfig(config, path, defaultValue);
	}
	// endregion

	// region introspection
	public ConfigStore getConfig() {
		return config;
	}

	public boolean hasProvider(String name) {
		return providers.containsKey(name);
	}

	public @Nullable Provider<?> getProvider(String name) {
		return providers.get(name);
	}

	/**
	 * @return registered names in the order they were first registered
	 */
	public List<String> getNames() {
		return List.copyOf(names);
	}

	/**
	 * This method returns an instance only if it was already created,
	 * it does not trigger instance creation.
	 */
	public @Nullable Object peekInstance(String name) {
		Provider<?> provider = providers.get(name);
		return provider != null ? provider.peekInstance() : null;
	}
	// endregion

	/**
	 * Releases every live resource instance, last registered first.
	 * <p>
	 * A failing release, including one failing with an {@link Error}, does not prevent the others.
	 * The first failure is rethrown once all releases have run, later ones are attached to it as suppressed.
	 */
	public void shutdown() {
		List<RegisteredResource> toRelease = new ArrayList<>(resources);
		Collections.reverse(toRelease);
		Throwable failure = null;
		int released = 0;
		for (RegisteredResource registered : toRelease) {
			try {
				if (registered.resource().release()) {
					released++;
					logger.debug("Released '{}'", registered.name());
				}
			} catch (Throwable e) {
				logger.error("Failed to release '{}'", registered.name(), e);
				if (failure == null) {
					failure = e;
				} else {
					failure.addSuppressed(e);
				}
			}
		}
		logger.info("Container shut down, {} resource(s) released", released);
		if (failure instanceof RuntimeException e) {
			throw e;
		}
		if (failure instanceof Error e) {
			throw e;
		}
		if (failure != null) {
			throw new IllegalStateException("Container shutdown failed", failure);
		}
	}

	@Override
	public void close() {
		shutdown();
	}

	@Override
	public String toString() {
		return "Container{providers=" + names + '}';
	}
}
