package org.lokray.stanzac.ast;

import java.util.List;

/**
 * {@code (function arg1 arg2 ...)}
 */
public record Call(Identifier function, List<Expression> parameters, Location location) implements Expression
{
	public Call
	{
		parameters = List.copyOf(parameters);
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitCall(this);
	}
}
