package io.lightwire.common;

import org.junit.Test;

import static io.lightwire.common.Checks.*;
import static org.junit.Assert.*;

public final class ChecksTest {
	@Test
	public void testCheckNotNullReturnsReference() {
		String value = "value";
		assertSame(value, checkNotNull(value, "message"));
		assertSame(value, checkNotNull(value, "message %s", 1));
	}

	@Test
	public void testCheckNotNullMessage() {
		NullPointerException e = assertThrows(NullPointerException.class, () -> checkNotNull(null, "Provider for '%s' is null", "db"));
		assertEquals("Provider for 'db' is null", e.getMessage());
	}

	@Test
	public void testCheckArgument() {
		checkArgument(true, "never %s", "thrown");
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> checkArgument(false, "Invalid path '%s'", "a..b"));
		assertEquals("Invalid path 'a..b'", e.getMessage());

		e = assertThrows(IllegalArgumentException.class, () -> checkArgument(false, () -> "supplied"));
		assertEquals("supplied", e.getMessage());
	}

	@Test
	public void testToDisplayString() {
		assertEquals("null", Utils.toDisplayString(null));
		assertEquals("short", Utils.toDisplayString("short"));
		String display = Utils.toDisplayString("x".repeat(100));
		assertEquals(64, display.length());
		assertTrue(display.endsWith("..."));
	}

	@Test
	public void testNonNullElse() {
		assertEquals("a", Utils.nonNullElse("a", "b"));
		assertEquals("b", Utils.nonNullElse(null, "b"));
	}
}
