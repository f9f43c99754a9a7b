package org.metricshub.slcscript;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;
import org.metricshub.slcscript.iterables.EmptyIterable;
import org.metricshub.slcscript.iterables.EnumIterable;
import org.metricshub.slcscript.iterables.ListIterable;
import org.metricshub.slcscript.iterables.PredefinedIterable;
import org.metricshub.slcscript.iterables.RangeIterables;
import org.metricshub.slcscript.iterables.ScriptIterable;
import org.metricshub.slcscript.iterables.SingleItemIterable;

public class IterablesTest {

	enum Color {
		None, Red, Green
	}

	/**
	 * @return the value of <code>variable</code> for each remaining element
	 */
	private static List<String> drain(ScriptIterable iterable, String variable) {
		List<String> values = new ArrayList<String>();
		Map<String, String> vars = new HashMap<String, String>();
		while (iterable.loadNext(vars)) {
			values.add(vars.get(variable));
		}
		return values;
	}

	private static ListIterable<String> letters(AtomicInteger fetches, Random random) {
		return new ListIterable<String>(() -> {
			fetches.incrementAndGet();
			return Arrays.asList("a", null, "b", "c", "d");
		}, (vars, letter) -> vars.put("letter", letter), random);
	}

	@Test
	public void testListIterableIsLazy() {
		AtomicInteger fetches = new AtomicInteger();
		ListIterable<String> iterable = letters(fetches, null);
		assertEquals(0, fetches.get());
		assertEquals(0, iterable.getCount());

		assertFalse(iterable.isAtEnd());
		assertEquals(1, fetches.get());
		assertEquals("nulls are dropped", 4, iterable.getCount());
		assertEquals(Arrays.asList("a", "b", "c", "d"), drain(iterable, "letter"));
		assertTrue(iterable.isAtEnd());

		iterable.reset();
		assertEquals(Arrays.asList("a", "b", "c", "d"), drain(iterable, "letter"));
		assertEquals("reset does not fetch again", 1, fetches.get());
	}

	@Test
	public void testLoadNextWithoutVariables() {
		ListIterable<String> iterable = letters(new AtomicInteger(), null);
		assertTrue(iterable.loadNext(null));
		assertEquals(Arrays.asList("b", "c", "d"), drain(iterable, "letter"));
	}

	@Test
	public void testRandomize() {
		AtomicInteger fetches = new AtomicInteger();
		ListIterable<String> iterable = letters(fetches, new Random(42));

		iterable.randomize();
		assertEquals(4, new HashSet<String>(drain(iterable, "letter")).size());
		assertEquals(4, iterable.getCount());
		assertEquals(1, fetches.get());

		iterable.randomize(2);
		List<String> two = drain(iterable, "letter");
		assertEquals(2, two.size());
		assertEquals(2, new HashSet<String>(two).size());
		assertTrue(Arrays.asList("a", "b", "c", "d").containsAll(two));
		assertEquals("randomize fetches again", 2, fetches.get());

		iterable.randomize(0.5f);
		assertEquals(2, drain(iterable, "letter").size());

		iterable.randomize(10);
		assertEquals(4, drain(iterable, "letter").size());
	}

	@Test
	public void testPredefinedIterable() {
		PredefinedIterable<String> iterable = new PredefinedIterable<String>(
				Arrays.asList("x", "y"),
				(vars, value) -> vars.put("value", value));
		assertEquals(2, iterable.getCount());
		assertEquals(Arrays.asList("x", "y"), drain(iterable, "value"));
		iterable.randomize(1);
		assertEquals("randomize only rewinds", Arrays.asList("x", "y"), drain(iterable, "value"));

		PredefinedIterable<String> empty = new PredefinedIterable<String>(null, null);
		assertTrue(empty.isAtEnd());
		assertEquals(0, empty.getCount());
		assertFalse(empty.loadNext(new HashMap<String, String>()));
	}

	@Test
	public void testSingleItemIterable() {
		SingleItemIterable<String> single = SingleItemIterable.of("only", (vars, value) -> vars.put("value", value));
		assertEquals(1, single.getCount());
		assertEquals(Arrays.asList("only"), drain(single, "value"));
		assertTrue(single.isAtEnd());
		single.randomize();
		assertEquals(Arrays.asList("only"), drain(single, "value"));

		AtomicInteger calls = new AtomicInteger();
		SingleItemIterable<Integer> lazy = SingleItemIterable
				.lazy(calls::incrementAndGet, (vars, value) -> vars.put("value", value.toString()));
		assertEquals(0, calls.get());
		assertEquals(Arrays.asList("1"), drain(lazy, "value"));
		lazy.reset();
		assertEquals(Arrays.asList("2"), drain(lazy, "value"));

		SingleItemIterable<String> none = SingleItemIterable.lazy(null, null);
		assertTrue(none.isAtEnd());
		assertEquals(0, none.getCount());
	}

	@Test
	public void testEmptyIterable() {
		assertSame(EmptyIterable.INSTANCE, EmptyIterable.INSTANCE);
		assertTrue(EmptyIterable.INSTANCE.isAtEnd());
		assertEquals(0, EmptyIterable.INSTANCE.getCount());
		assertFalse(EmptyIterable.INSTANCE.loadNext(new HashMap<String, String>()));
		EmptyIterable.INSTANCE.randomize(3);
		EmptyIterable.INSTANCE.reset();
		assertTrue(EmptyIterable.INSTANCE.isAtEnd());
	}

	@Test
	public void testEnumIterable() {
		assertEquals(Arrays.asList("Red", "Green"), drain(EnumIterable.get(Color.class), "name"));
		assertEquals(Arrays.asList("1", "2"), drain(EnumIterable.get(Color.class), "id"));
		assertEquals(Arrays.asList("None", "Red", "Green"), drain(EnumIterable.getWithNone(Color.class), "name"));
		assertEquals(Arrays.asList("0", "1", "2"), drain(new EnumIterable<Color>(Color.class, true), "id"));
	}

	@Test
	public void testRanges() {
		assertEquals(Arrays.asList("1", "2", "3"), drain(RangeIterables.standardRange(1, 3), "i"));
		assertEquals(Arrays.asList("1", "0", "-1"), drain(RangeIterables.standardRange(1, -1), "i"));
		ScriptIterable single = RangeIterables.standardRange(5, 5);
		assertEquals(1, single.getCount());
		assertEquals(Arrays.asList("5"), drain(single, "i"));

		assertEquals(Arrays.asList(3, 2, 1, 0), RangeIterables.getRange(3, 0));
		assertEquals(Arrays.asList(Integer.MAX_VALUE - 1, Integer.MAX_VALUE), RangeIterables.getRange(Integer.MAX_VALUE - 1, Integer.MAX_VALUE));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRangeTooLarge() {
		RangeIterables.getRange(Integer.MIN_VALUE, Integer.MAX_VALUE);
	}

	@Test
	public void testMissingVariablesAreNotWritten() {
		Map<String, String> vars = new HashMap<String, String>();
		vars.put("other", "kept");
		ScriptIterable iterable = RangeIterables.standardRange(1, 2);
		assertTrue(iterable.loadNext(vars));
		assertEquals("1", vars.get("i"));
		assertEquals("kept", vars.get("other"));
		assertNull(vars.get("letter"));
	}
}
