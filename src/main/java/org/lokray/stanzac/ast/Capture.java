package org.lokray.stanzac.ast;

/**
 * A reference to a syntax capture of the enclosing stanza's query, written {@code @name}.
 * Resolved indices and cardinality are not stored here; the checker records them in its
 * side tables, keyed by node identity.
 */
public record Capture(Identifier name, Location location) implements ScanExpression
{
	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitCapture(this);
	}
}
