// File: src/main/java/org/lokray/stanzac/query/StaticQuery.java
package org.lokray.stanzac.query;

import java.util.*;

/**
 * A {@link CompiledQuery} backed by precomputed tables: the shared capture name list and, per
 * pattern, the quantifier of each capture occurring in that pattern.
 */
public class StaticQuery implements CompiledQuery
{
	private final List<String> captureNames;
	private final Map<String, Integer> captureIndices;
	private final List<Map<Integer, CaptureQuantifier>> patterns;

	private StaticQuery(List<String> captureNames, List<Map<Integer, CaptureQuantifier>> patterns)
	{
		this.captureNames = List.copyOf(captureNames);
		this.captureIndices = new HashMap<>();
		for (int i = 0; i < captureNames.size(); i++)
		{
			captureIndices.put(captureNames.get(i), i);
		}
		List<Map<Integer, CaptureQuantifier>> copies = new ArrayList<>();
		for (Map<Integer, CaptureQuantifier> pattern : patterns)
		{
			copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(pattern)));
		}
		this.patterns = List.copyOf(copies);
	}

	public static Builder builder()
	{
		return new Builder();
	}

	@Override
	public OptionalInt captureIndexForName(String name)
	{
		Integer index = captureIndices.get(name);
		return index == null ? OptionalInt.empty() : OptionalInt.of(index);
	}

	@Override
	public List<String> captureNames()
	{
		return captureNames;
	}

	@Override
	public int patternCount()
	{
		return patterns.size();
	}

	@Override
	public CaptureQuantifier captureQuantifier(int patternIndex, int captureIndex)
	{
		if (patternIndex < 0 || patternIndex >= patterns.size())
		{
			throw new IllegalStateException("Query has no pattern " + patternIndex + " (" + patterns.size() + " patterns).");
		}
		CaptureQuantifier quantifier = patterns.get(patternIndex).get(captureIndex);
		if (quantifier == null)
		{
			String name = captureIndex >= 0 && captureIndex < captureNames.size() ? captureNames.get(captureIndex) : "#" + captureIndex;
			throw new IllegalStateException("Capture @" + name + " does not occur in pattern " + patternIndex + ".");
		}
		return quantifier;
	}

	/**
	 * Derives the query pattern {@code patternIndex} would compile to on its own: only its captures,
	 * numbered in the order they appear in the pattern.
	 */
	public StaticQuery patternQuery(int patternIndex)
	{
		if (patternIndex < 0 || patternIndex >= patterns.size())
		{
			throw new IllegalStateException("Query has no pattern " + patternIndex + " (" + patterns.size() + " patterns).");
		}
		Builder builder = builder().pattern();
		patterns.get(patternIndex).forEach((index, quantifier) -> builder.capture(captureNames.get(index), quantifier));
		return builder.build();
	}

	public static class Builder
	{
		private final List<String> captureNames = new ArrayList<>();
		private final Map<String, Integer> captureIndices = new HashMap<>();
		private final List<Map<Integer, CaptureQuantifier>> patterns = new ArrayList<>();

		private Builder()
		{
		}

		/**
		 * Starts a new pattern. Subsequent {@link #capture} calls add to it.
		 */
		public Builder pattern()
		{
			patterns.add(new LinkedHashMap<>());
			return this;
		}

		public Builder capture(String name, CaptureQuantifier quantifier)
		{
			if (patterns.isEmpty())
			{
				throw new IllegalStateException("capture() called before pattern().");
			}
			Integer index = captureIndices.get(name);
			if (index == null)
			{
				index = captureNames.size();
				captureNames.add(name);
				captureIndices.put(name, index);
			}
			Map<Integer, CaptureQuantifier> current = patterns.get(patterns.size() - 1);
			if (current.containsKey(index))
			{
				throw new IllegalArgumentException("Capture @" + name + " declared twice in pattern " + (patterns.size() - 1) + ".");
			}
			current.put(index, Objects.requireNonNull(quantifier, "quantifier"));
			return this;
		}

		public StaticQuery build()
		{
			return new StaticQuery(captureNames, patterns);
		}
	}
}
