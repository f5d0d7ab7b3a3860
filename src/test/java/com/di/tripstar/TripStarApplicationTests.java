package com.di.tripstar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Basic smoke test for TripStarApplication. The full context needs Google Cloud
 * credentials for the BigQuery and Storage clients, so it is not started here.
 */
@DisplayName("TripStarApplication Tests")
class TripStarApplicationTests {

	@Test
	@DisplayName("Should have main class")
	void testMainClassExists() {
		Class<?> mainClass = TripStarApplication.class;
		assertNotNull(mainClass);
		assertEquals("TripStarApplication", mainClass.getSimpleName());
	}

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = TripStarApplication.class.getMethod("main", String[].class);
		assertNotNull(mainMethod);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}
}
