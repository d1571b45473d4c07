package org.lokray.stanzac.ast;

import java.util.List;

/**
 * {@code for variable in @capture { ... }}
 */
public record ForIn(UnscopedVariable variable, Capture capture, List<Statement> statements, Location location) implements Statement
{
	public ForIn
	{
		statements = List.copyOf(statements);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitForIn(this);
	}
}
