package org.lokray.stanzac.ast;

/**
 * {@code edge source -> sink}
 */
public record CreateEdge(Expression source, Expression sink, Location location) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitCreateEdge(this);
	}
}
