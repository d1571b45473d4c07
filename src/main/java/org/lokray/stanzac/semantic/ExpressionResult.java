package org.lokray.stanzac.semantic;

import org.lokray.stanzac.query.CaptureQuantifier;

/**
 * What the checker knows about the value of an expression: only its cardinality.
 */
public record ExpressionResult(CaptureQuantifier quantifier)
{
	public static final ExpressionResult ONE = new ExpressionResult(CaptureQuantifier.ONE);
	public static final ExpressionResult LIST = new ExpressionResult(CaptureQuantifier.ZERO_OR_MORE);
}
