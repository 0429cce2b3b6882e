package io.lightwire.inject;

import io.lightwire.common.exception.NotFoundException;
import io.lightwire.config.ConfigStore;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public final class DeferredTest {
	private Container container;

	@Before
	public void setUp() {
		container = Container.create();
	}

	@Test
	public void testNameIsLookedUpOnEveryCall() {
		Deferred<String> deferred = container.deferred("greeting", String.class);

		assertThrows(NotFoundException.class, deferred::get);

		container.registerInstance("greeting", "hello");
		assertEquals("hello", deferred.get());

		container.registerInstance("greeting", "hi");
		assertEquals("hi", deferred.get());
	}

	@Test
	public void testNamedDeferred() {
		Deferred<Object> deferred = container.deferred("service");
		assertTrue(deferred instanceof NamedDeferred);
		assertEquals("service", ((NamedDeferred<Object>) deferred).getName());
		assertEquals("Deferred{service}", deferred.toString());
	}

	@Test
	public void testTypedDeferredNarrows() {
		container.registerInstance("port", 8080);
		Deferred<String> deferred = container.deferred("port", String.class);
		assertThrows(ClassCastException.class, deferred::get);
	}

	@Test
	public void testConfigIsReadOnEveryCall() {
		ConfigStore config = container.getConfig();
		Deferred<Object> url = container.deferredConfig("database.url");
		Deferred<Object> user = container.deferredConfig("database.user", "guest");

		assertThrows(NotFoundException.class, url::get);
		assertEquals("guest", user.get());

		config.load(Map.of("database", Map.of("url", "mysql://x", "user", "admin")));
		assertEquals("mysql://x", url.get());
		assertEquals("admin", user.get());
	}

	@Test
	public void testOfSupplier() {
		AtomicInteger calls = new AtomicInteger();
		Deferred<Integer> deferred = Deferred.of(calls::incrementAndGet);

		assertEquals(0, calls.get());
		assertEquals(Integer.valueOf(1), deferred.get());
		assertEquals(Integer.valueOf(2), deferred.get());
	}

	@Test
	public void testOfValue() {
		Object value = new Object();
		assertSame(value, Deferred.ofValue(value).get());
	}
}
