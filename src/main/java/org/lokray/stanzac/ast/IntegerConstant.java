package org.lokray.stanzac.ast;

public record IntegerConstant(long value) implements Expression
{
	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitIntegerConstant(this);
	}
}
