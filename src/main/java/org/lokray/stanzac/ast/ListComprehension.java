package org.lokray.stanzac.ast;

import java.util.List;

/**
 * {@code [a, b, c]}
 */
public record ListComprehension(List<Expression> elements, Location location) implements Expression
{
	public ListComprehension
	{
		elements = List.copyOf(elements);
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitListComprehension(this);
	}
}
