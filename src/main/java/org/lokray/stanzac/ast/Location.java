package org.lokray.stanzac.ast;

/**
 * A zero-based position in a stanza source file.
 */
public record Location(int row, int column)
{
	public static final Location NONE = new Location(0, 0);

	@Override
	public String toString()
	{
		return String.format("line %d:%d", row + 1, column + 1);
	}
}
