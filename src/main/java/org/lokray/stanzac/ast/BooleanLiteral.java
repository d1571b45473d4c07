package org.lokray.stanzac.ast;

public record BooleanLiteral(boolean value) implements Expression
{
	public static final BooleanLiteral TRUE = new BooleanLiteral(true);
	public static final BooleanLiteral FALSE = new BooleanLiteral(false);

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitBooleanLiteral(this);
	}
}
