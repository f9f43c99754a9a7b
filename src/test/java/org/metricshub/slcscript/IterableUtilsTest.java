package org.metricshub.slcscript;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import org.junit.Test;
import org.metricshub.slcscript.iterables.IterableSettings;
import org.metricshub.slcscript.iterables.IterableUtils;

public class IterableUtilsTest {

	private static final List<Integer> NUMBERS = Arrays.asList(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);

	private static List<Integer> numbers() {
		return new ArrayList<Integer>(NUMBERS);
	}

	private static void assertSubset(List<Integer> values, int expectedSize) {
		assertEquals(expectedSize, values.size());
		assertEquals("no duplicates", expectedSize, new HashSet<Integer>(values).size());
		assertTrue(NUMBERS.containsAll(values));
	}

	@Test
	public void testFullShuffleIsInPlace() {
		List<Integer> data = numbers();
		List<Integer> shuffled = IterableUtils.shuffle(data, new Random(1));
		assertSame(data, shuffled);
		assertEquals(new HashSet<Integer>(NUMBERS), new HashSet<Integer>(shuffled));
	}

	@Test
	public void testPartialShuffle() {
		for (int amount = 0; amount <= 12; amount++) {
			assertSubset(IterableUtils.shuffle(numbers(), amount, new Random(amount)), Math.min(amount, 10));
		}
		assertSubset(IterableUtils.shuffle(numbers(), -3), 0);
		assertSubset(IterableUtils.shuffle(new ArrayList<Integer>(), 3), 0);
		assertEquals(Arrays.asList(7), IterableUtils.shuffle(new ArrayList<Integer>(Arrays.asList(7)), 1));
	}

	@Test
	public void testPercentShuffle() {
		assertSubset(IterableUtils.shuffle(numbers(), 0.5f), 5);
		assertSubset(IterableUtils.shuffle(numbers(), 0.25f, new Random(3)), 2);
		assertSubset(IterableUtils.shuffle(numbers(), 1.0f), 10);
	}

	@Test
	public void testApply() {
		Random random = new Random(7);
		List<Integer> data = numbers();
		assertSame(data, IterableUtils.apply(data, null, random));
		assertSame(data, IterableUtils.apply(data, new IterableSettings(), random));
		assertEquals(NUMBERS, data);

		assertSubset(IterableUtils.apply(numbers(), new IterableSettings(3), random), 3);
		assertSubset(IterableUtils.apply(numbers(), new IterableSettings(-1), random), 10);
		assertSubset(IterableUtils.apply(numbers(), new IterableSettings(0.3f), random), 3);
		assertSubset(IterableUtils.apply(numbers(), new IterableSettings(-0.5f), random), 10);
	}

	@Test
	public void testSettings() {
		IterableSettings none = new IterableSettings();
		assertTrue(none.isPrecise());
		assertTrue(none.isEmpty());
		assertFalse(none.isValid());

		IterableSettings amount = new IterableSettings(4);
		assertTrue(amount.isPrecise());
		assertFalse(amount.isEmpty());
		assertTrue(amount.isValid());
		assertEquals("4", amount.toString());

		IterableSettings percent = new IterableSettings(0.5f);
		assertFalse(percent.isPrecise());
		assertFalse(percent.isEmpty());
		assertTrue(percent.isValid());
		assertEquals(0.5f, percent.getPercent(), 0.0f);
		assertEquals("50.0%", percent.toString());

		assertFalse(new IterableSettings(-2).isValid());
		assertFalse(new IterableSettings(-0.1f).isValid());
	}
}
