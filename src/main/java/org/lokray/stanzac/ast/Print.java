package org.lokray.stanzac.ast;

import java.util.List;

public record Print(List<Expression> values, Location location) implements Statement
{
	public Print
	{
		values = List.copyOf(values);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitPrint(this);
	}
}
