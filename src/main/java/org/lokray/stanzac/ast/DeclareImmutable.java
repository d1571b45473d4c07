package org.lokray.stanzac.ast;

/**
 * {@code let variable = value}
 */
public record DeclareImmutable(Variable variable, Expression value, Location location) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitDeclareImmutable(this);
	}
}
