package io.lightwire.inject;

import io.lightwire.config.converter.ConfigConverters;
import io.lightwire.inject.provider.Factory;
import io.lightwire.inject.provider.Resource;
import io.lightwire.inject.provider.Singleton;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public final class ApplicationWiringTest {
	static final class ConnectionPool implements AutoCloseable {
		final String url;
		final int size;
		boolean open = true;

		ConnectionPool(String url, int size) {
			this.url = url;
			this.size = size;
		}

		@Override
		public void close() {
			open = false;
		}
	}

	static final class UserRepository {
		final ConnectionPool pool;

		UserRepository(ConnectionPool pool) {
			this.pool = pool;
		}
	}

	static final class RequestHandler {
		final UserRepository repository;
		final String path;

		RequestHandler(UserRepository repository, String path) {
			this.repository = repository;
			this.path = path;
		}
	}

	/**
	 * Composition root with typed accessors over the container
	 */
	static final class Application implements AutoCloseable {
		private final Container container = Container.create();

		Application(Map<String, ?> config) {
			container.getConfig().load(config);

			container.register("pool", Resource.of(
					args -> new ConnectionPool(
							args.get("url", String.class),
							container.getConfig().get(ConfigConverters.ofInteger(), "database.pool.size", 4)),
					InstanceReleaser.closing(),
					Arguments.named("url", container.deferredConfig("database.url"))));
			container.register("repository", Singleton.of(
					args -> new UserRepository(args.get("pool", ConnectionPool.class)),
					Arguments.named("pool", container.deferred("pool"))));
			container.register("handler", Factory.of(
					args -> new RequestHandler(args.get("repository", UserRepository.class), args.getOr("path", String.class, "/")),
					Arguments.named("repository", container.deferred("repository"))));
		}

		ConnectionPool pool() {
			return container.resolve("pool", ConnectionPool.class);
		}

		UserRepository repository() {
			return container.resolve("repository", UserRepository.class);
		}

		RequestHandler handler(String path) {
			return container.resolve("handler", RequestHandler.class, Arguments.named("path", path));
		}

		@Override
		public void close() {
			container.shutdown();
		}
	}

	private Application application;

	@Before
	public void setUp() {
		application = new Application(Map.of("database", Map.of("url", "postgres://db/app", "pool", Map.of("size", "16"))));
	}

	@After
	public void tearDown() {
		application.close();
	}

	@Test
	public void testWiring() {
		RequestHandler users = application.handler("/users");
		RequestHandler orders = application.handler("/orders");

		assertNotSame(users, orders);
		assertEquals("/users", users.path);
		assertSame(users.repository, orders.repository);
		assertSame(application.repository(), users.repository);
		assertSame(application.pool(), users.repository.pool);

		assertEquals("postgres://db/app", application.pool().url);
		assertEquals(16, application.pool().size);
	}

	@Test
	public void testPoolClosedOnShutdown() {
		ConnectionPool pool = application.pool();
		assertTrue(pool.open);

		application.close();
		assertFalse(pool.open);
	}
}
