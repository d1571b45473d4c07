package org.lokray.stanzac.ast;

/**
 * {@code $n}, the n-th group of the regex matched by the enclosing scan arm.
 */
public record RegexCapture(int matchIndex, Location location) implements ScanExpression
{
	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitRegexCapture(this);
	}
}
