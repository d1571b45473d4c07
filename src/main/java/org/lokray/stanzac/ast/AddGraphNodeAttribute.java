package org.lokray.stanzac.ast;

import java.util.List;

/**
 * {@code attr (node) name = value, ...}
 */
public record AddGraphNodeAttribute(Expression node, List<Attribute> attributes, Location location) implements Statement
{
	public AddGraphNodeAttribute
	{
		attributes = List.copyOf(attributes);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitAddGraphNodeAttribute(this);
	}
}
