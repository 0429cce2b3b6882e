package io.lightwire.inject;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public final class ArgumentsTest {
	@Test
	public void testEmpty() {
		assertTrue(Arguments.EMPTY.isEmpty());
		assertTrue(Arguments.of().isEmpty());
		assertEquals(Arguments.EMPTY, Arguments.named(Map.of()));
	}

	@Test
	public void testMergeAppendsPositional() {
		Arguments bound = Arguments.of("a", "b");
		Arguments merged = bound.mergeWith(Arguments.of("c"));

		assertEquals(List.of("a", "b", "c"), merged.getPositional());
		assertEquals(List.of("a", "b"), bound.getPositional());
	}

	@Test
	public void testMergeCallTimeNamedWins() {
		Arguments bound = Arguments.named("url", "bound").with("timeout", 10);
		Arguments merged = bound.mergeWith(Arguments.named("url", "call"));

		assertEquals(Map.of("url", "call", "timeout", 10), merged.getNamed());
		assertEquals("bound", bound.getNamed().get("url"));
	}

	@Test
	public void testMergeWithEmpty() {
		Arguments bound = Arguments.of(1).with("x", 2);
		assertSame(bound, bound.mergeWith(Arguments.EMPTY));
		assertSame(bound, Arguments.EMPTY.mergeWith(bound));
	}

	@Test
	public void testNullValuesAllowed() {
		Arguments arguments = Arguments.of((Object) null).with("name", null);
		assertEquals(Arrays.asList((Object) null), arguments.getPositional());
		assertTrue(arguments.getNamed().containsKey("name"));
		assertNull(arguments.getNamed().get("name"));
	}

	@Test
	public void testImmutable() {
		Arguments arguments = Arguments.of(1).with("x", 2);
		assertThrows(UnsupportedOperationException.class, () -> arguments.getPositional().add(3));
		assertThrows(UnsupportedOperationException.class, () -> arguments.getNamed().put("y", 3));
	}

	@Test
	public void testEquals() {
		assertEquals(Arguments.of(1, 2).with("x", 3), Arguments.of(1).withPositional(2).with("x", 3));
		assertEquals(Arguments.of(1, 2).hashCode(), Arguments.of(1).withPositional(2).hashCode());
		assertNotEquals(Arguments.of(1, 2), Arguments.of(2, 1));
	}
}
