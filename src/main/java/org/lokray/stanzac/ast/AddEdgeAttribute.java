package org.lokray.stanzac.ast;

import java.util.List;

/**
 * {@code attr (source -> sink) name = value, ...}
 */
public record AddEdgeAttribute(Expression source, Expression sink, List<Attribute> attributes, Location location) implements Statement
{
	public AddEdgeAttribute
	{
		attributes = List.copyOf(attributes);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitAddEdgeAttribute(this);
	}
}
