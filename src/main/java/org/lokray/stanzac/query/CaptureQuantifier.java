package org.lokray.stanzac.query;

/**
 * How many nodes a capture binds in one match. Fixed by the query compiler and independent of the
 * source being matched.
 */
public enum CaptureQuantifier
{
	ONE("1"),
	ZERO_OR_ONE("?"),
	ZERO_OR_MORE("*"),
	ONE_OR_MORE("+");

	private final String suffix;

	CaptureQuantifier(String suffix)
	{
		this.suffix = suffix;
	}

	/**
	 * The tree-sitter query suffix for this quantifier ({@code ?}, {@code *}, {@code +}), or {@code 1} for a plain capture.
	 */
	public String getSuffix()
	{
		return suffix;
	}

	/**
	 * True for the quantifiers a {@code for} loop can iterate over.
	 */
	public boolean isList()
	{
		return this == ZERO_OR_MORE || this == ONE_OR_MORE;
	}

	/**
	 * True only for {@code ?}. {@code some}/{@code none} conditions need exactly this.
	 */
	public boolean isOptional()
	{
		return this == ZERO_OR_ONE;
	}

	/**
	 * Accepts either the constant name ({@code ZERO_OR_MORE}, case-insensitive) or the query suffix
	 * ({@code *}). The empty string means {@link #ONE}.
	 */
	public static CaptureQuantifier fromString(String text)
	{
		if (text == null)
		{
			throw new IllegalArgumentException("Missing capture quantifier.");
		}
		String trimmed = text.trim();
		if (trimmed.isEmpty())
		{
			return ONE;
		}
		for (CaptureQuantifier quantifier : values())
		{
			if (quantifier.suffix.equals(trimmed) || quantifier.name().equalsIgnoreCase(trimmed))
			{
				return quantifier;
			}
		}
		throw new IllegalArgumentException("Unknown capture quantifier: '" + text + "'.");
	}
}
