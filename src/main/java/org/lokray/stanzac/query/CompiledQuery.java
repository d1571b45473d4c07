package org.lokray.stanzac.query;

import java.util.List;
import java.util.OptionalInt;

/**
 * The parts of a compiled syntax-tree query the checker relies on. A query holds one or more
 * patterns that share a single capture table.
 */
public interface CompiledQuery
{
	/**
	 * Capture added to every stanza pattern so the whole matched node is available at runtime.
	 */
	String FULL_MATCH = "__tsg__full_match";

	OptionalInt captureIndexForName(String name);

	List<String> captureNames();

	int patternCount();

	/**
	 * The quantifier of capture {@code captureIndex} in pattern {@code patternIndex}.
	 *
	 * @throws IllegalStateException if the capture does not occur in that pattern.
	 */
	CaptureQuantifier captureQuantifier(int patternIndex, int captureIndex);
}
