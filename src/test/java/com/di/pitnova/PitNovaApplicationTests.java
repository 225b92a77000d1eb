package com.di.pitnova;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Basic smoke test for PitNovaApplication, without starting a Spring context.
 */
@DisplayName("PitNovaApplication Tests")
class PitNovaApplicationTests {

	@Test
	@DisplayName("Should have main class")
	void testMainClassExists() {
		Class<?> mainClass = PitNovaApplication.class;
		assertNotNull(mainClass);
		assertEquals("PitNovaApplication", mainClass.getSimpleName());
	}

	@Test
	@DisplayName("Should have public static main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = PitNovaApplication.class.getMethod("main", String[].class);
		assertNotNull(mainMethod);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}
}
