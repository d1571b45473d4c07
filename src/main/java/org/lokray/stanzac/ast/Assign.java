package org.lokray.stanzac.ast;

/**
 * {@code set variable = value}
 */
public record Assign(Variable variable, Expression value, Location location) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitAssign(this);
	}
}
