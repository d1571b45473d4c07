package org.lokray.stanzac.ast;

import java.util.List;

/**
 * {@code some @a, @b} or {@code none @a, @b}. Every capture must be optional.
 */
public record Condition(Kind kind, List<Capture> captures, Location location)
{
	public enum Kind
	{
		SOME,
		NONE
	}

	public Condition
	{
		captures = List.copyOf(captures);
	}
}
