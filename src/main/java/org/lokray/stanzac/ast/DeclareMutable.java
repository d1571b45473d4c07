package org.lokray.stanzac.ast;

/**
 * {@code var variable = value}
 */
public record DeclareMutable(Variable variable, Expression value, Location location) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitDeclareMutable(this);
	}
}
