package io.lightwire.inject.provider;

import io.lightwire.inject.InstanceReleaser;
import io.lightwire.inject.exception.ConstructionException;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public final class ResourceTest {
	private static final class Pool implements AutoCloseable {
		private final AtomicInteger closed;

		Pool(AtomicInteger closed) {
			this.closed = closed;
		}

		@Override
		public void close() {
			closed.incrementAndGet();
		}
	}

	private AtomicInteger created;
	private AtomicInteger released;

	@Before
	public void setUp() {
		created = new AtomicInteger();
		released = new AtomicInteger();
	}

	private Resource<Pool> createPoolResource() {
		return Resource.of(args -> {
			created.incrementAndGet();
			return new Pool(released);
		}, InstanceReleaser.closing());
	}

	@Test
	public void testCachesLikeSingleton() {
		Resource<Pool> resource = createPoolResource();

		Pool pool = resource.resolve();
		for (int i = 0; i < 4; i++) {
			assertSame(pool, resource.resolve());
		}
		assertEquals(1, created.get());
		assertEquals(0, released.get());
		assertEquals(ProviderKind.RESOURCE, resource.getKind());
	}

	@Test
	public void testReleasedExactlyOnce() {
		Resource<Pool> resource = createPoolResource();
		resource.resolve();

		assertTrue(resource.release());
		assertFalse(resource.release());
		assertEquals(1, released.get());
		assertNull(resource.peekInstance());
	}

	@Test
	public void testReleaseWithoutInstance() {
		Resource<Pool> resource = createPoolResource();

		assertFalse(resource.release());
		assertEquals(0, created.get());
		assertEquals(0, released.get());
	}

	@Test
	public void testRecreatedAfterRelease() {
		Resource<Pool> resource = createPoolResource();
		Pool first = resource.resolve();
		resource.release();

		Pool second = resource.resolve();
		assertNotSame(first, second);
		assertEquals(2, created.get());
	}

	@Test
	public void testFailedReleaseDropsInstance() {
		Resource<Object> resource = Resource.of(args -> new Object(), instance -> {
			released.incrementAndGet();
			throw new IOException("close failed");
		});
		resource.resolve();

		ConstructionException e = assertThrows(ConstructionException.class, resource::release);
		assertTrue(e.getCause() instanceof IOException);
		assertFalse(resource.hasInstance());
		assertFalse(resource.release());
		assertEquals(1, released.get());
	}

	@Test
	public void testUncheckedReleaseFailurePropagatesUnchanged() {
		Resource<Object> resource = Resource.of(args -> new Object(), instance -> {
			throw new IllegalStateException("already closed");
		});
		resource.resolve();

		assertThrows(IllegalStateException.class, resource::release);
	}
}
