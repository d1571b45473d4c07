package org.lokray.stanzac.ast;

public record UnscopedVariable(Identifier name, Location location) implements Variable
{
	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitUnscopedVariable(this);
	}
}
