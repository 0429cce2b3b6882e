package io.lightwire.inject.provider;

import io.lightwire.inject.Arguments;
import io.lightwire.inject.Deferred;
import io.lightwire.inject.exception.CircularConstructionException;
import io.lightwire.inject.exception.ConstructionException;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public final class SingletonTest {
	@Test
	public void testSameInstance() {
		AtomicInteger created = new AtomicInteger();
		Singleton<Object> singleton = Singleton.of(args -> {
			created.incrementAndGet();
			return new Object();
		});

		assertNull(singleton.peekInstance());
		assertFalse(singleton.hasInstance());

		Object first = singleton.resolve();
		for (int i = 0; i < 10; i++) {
			assertSame(first, singleton.resolve());
		}
		assertEquals(1, created.get());
		assertSame(first, singleton.peekInstance());
		assertEquals(ProviderKind.SINGLETON, singleton.getKind());
	}

	@Test
	public void testBoundArguments() {
		Singleton<String> singleton = Singleton.of(
				args -> args.get("host", String.class) + ":" + args.get(0, Integer.class),
				Arguments.of(8080).with("host", "localhost"));

		assertEquals("localhost:8080", singleton.resolve());
	}

	@Test
	public void testCallTimeArgumentsOnlyAffectFirstConstruction() {
		Singleton<String> singleton = Singleton.of(args -> args.get("name", String.class), Arguments.named("name", "bound"));

		assertEquals("call", singleton.resolve(Arguments.named("name", "call")));
		assertEquals("call", singleton.resolve(Arguments.named("name", "ignored")));
	}

	@Test
	public void testOfInstance() {
		Object instance = new Object();
		Singleton<Object> singleton = Singleton.ofInstance(instance);

		assertTrue(singleton.hasInstance());
		assertSame(instance, singleton.resolve());
	}

	@Test
	public void testFailedConstructionIsRetried() {
		AtomicInteger attempts = new AtomicInteger();
		Singleton<String> singleton = Singleton.of(args -> {
			if (attempts.incrementAndGet() == 1) {
				throw new IllegalStateException("not yet");
			}
			return "ready";
		});

		IllegalStateException e = assertThrows(IllegalStateException.class, singleton::resolve);
		assertEquals("not yet", e.getMessage());
		assertNull(singleton.peekInstance());

		assertEquals("ready", singleton.resolve());
		assertEquals(2, attempts.get());
	}

	@Test
	public void testCheckedExceptionIsWrapped() {
		IOException cause = new IOException("disk is gone");
		Singleton<String> singleton = Singleton.of(args -> {
			throw cause;
		});

		ConstructionException e = assertThrows(ConstructionException.class, singleton::resolve);
		assertSame(cause, e.getCause());
	}

	@Test(expected = ConstructionException.class)
	public void testNullInstance() {
		Singleton.of(args -> null).resolve();
	}

	@Test
	public void testConcurrentFirstResolution() throws Exception {
		int threads = 16;
		AtomicInteger created = new AtomicInteger();
		CountDownLatch start = new CountDownLatch(1);
		Singleton<Object> singleton = Singleton.of(args -> {
			created.incrementAndGet();
			Thread.sleep(50);
			return new Object();
		});

		ExecutorService executor = Executors.newFixedThreadPool(threads);
		try {
			List<Future<Object>> futures = new ArrayList<>();
			for (int i = 0; i < threads; i++) {
				futures.add(executor.submit(() -> {
					start.await();
					return singleton.resolve();
				}));
			}
			start.countDown();

			Object first = futures.get(0).get(10, TimeUnit.SECONDS);
			for (Future<Object> future : futures) {
				assertSame(first, future.get(10, TimeUnit.SECONDS));
			}
		} finally {
			executor.shutdownNow();
		}
		assertEquals(1, created.get());
	}

	@Test
	public void testCycleThroughNestedProviders() {
		AtomicBoolean cyclic = new AtomicBoolean(true);
		AtomicReference<Singleton<Object>> outer = new AtomicReference<>();
		Singleton<Object> inner = Singleton.of(args -> args.get("outer"),
				Arguments.named("outer", Deferred.of(() -> cyclic.get() ? outer.get().resolve() : "leaf")));
		Singleton<Object> singleton = Singleton.of(args -> args.get("inner"), Arguments.named("inner", inner));
		outer.set(singleton);

		CircularConstructionException e = assertThrows(CircularConstructionException.class, singleton::resolve);
		assertEquals(2, e.getChain().size());
		assertNull(singleton.peekInstance());
		assertNull(inner.peekInstance());

		cyclic.set(false);
		assertEquals("leaf", singleton.resolve());
		assertEquals("leaf", inner.peekInstance());
	}
}
