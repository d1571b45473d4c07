package org.lokray.stanzac.query;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.lokray.stanzac.query.CaptureQuantifier.*;

class StaticQueryTest
{
	private final StaticQuery query = StaticQuery.builder()
			.pattern().capture("a", ONE).capture("b", ZERO_OR_MORE)
			.pattern().capture("c", ZERO_OR_ONE).capture("a", ONE_OR_MORE)
			.build();

	@Test
	void captureTableIsSharedAcrossPatterns()
	{
		assertEquals(List.of("a", "b", "c"), query.captureNames());
		assertEquals(2, query.patternCount());
		assertEquals(0, query.captureIndexForName("a").getAsInt());
		assertEquals(2, query.captureIndexForName("c").getAsInt());
		assertTrue(query.captureIndexForName("d").isEmpty());
	}

	@Test
	void quantifiersArePerPattern()
	{
		assertEquals(ONE, query.captureQuantifier(0, 0));
		assertEquals(ONE_OR_MORE, query.captureQuantifier(1, 0));
		assertEquals(ZERO_OR_ONE, query.captureQuantifier(1, 2));
	}

	@Test
	void captureMissingFromPatternHasNoQuantifier()
	{
		assertThrows(IllegalStateException.class, () -> query.captureQuantifier(0, 2));
		assertThrows(IllegalStateException.class, () -> query.captureQuantifier(5, 0));
	}

	@Test
	void patternQueryRenumbersInPatternOrder()
	{
		StaticQuery second = query.patternQuery(1);

		assertEquals(List.of("c", "a"), second.captureNames());
		assertEquals(1, second.patternCount());
		assertEquals(ZERO_OR_ONE, second.captureQuantifier(0, 0));
		assertEquals(ONE_OR_MORE, second.captureQuantifier(0, 1));
		assertTrue(second.captureIndexForName("b").isEmpty());
	}

	@Test
	void builderRejectsMisuse()
	{
		assertThrows(IllegalStateException.class, () -> StaticQuery.builder().capture("a", ONE));
		assertThrows(IllegalArgumentException.class, () -> StaticQuery.builder().pattern().capture("a", ONE).capture("a", ZERO_OR_ONE));
	}
}
