package org.lokray.stanzac.ast;

/**
 * {@code node variable}
 */
public record CreateGraphNode(Variable node, Location location) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitCreateGraphNode(this);
	}
}
