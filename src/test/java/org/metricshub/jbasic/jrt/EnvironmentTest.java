package org.metricshub.jbasic.jrt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class EnvironmentTest {

	@Test
	public void testUnsetVariablesReadZero() {
		Environment environment = new Environment();
		for (char name = 'A'; name <= 'Z'; name++) {
			assertEquals(0, environment.get(name));
		}
	}

	@Test
	public void testNamesAreCaseInsensitive() {
		Environment environment = new Environment();
		environment.set('q', 42);
		assertEquals(42, environment.get('Q'));
		assertEquals("{Q=42}", environment.toString());
	}

	@Test
	public void testClear() {
		Environment environment = new Environment();
		environment.set('A', 1);
		environment.set('Z', -1);
		assertEquals("{A=1, Z=-1}", environment.toString());
		environment.clear();
		assertEquals(0, environment.get('A'));
		assertEquals("{}", environment.toString());
	}

	@Test
	public void testInvalidName() {
		Environment environment = new Environment();
		assertThrows(IllegalArgumentException.class, () -> environment.get('1'));
		assertThrows(IllegalArgumentException.class, () -> environment.set('_', 1));
	}
}
