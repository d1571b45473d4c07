package org.lokray.stanzac.ast;

/**
 * A variable attached to the value of {@code scope}, written {@code scope.name}.
 */
public record ScopedVariable(Expression scope, Identifier name, Location location) implements Variable
{
	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitScopedVariable(this);
	}
}
