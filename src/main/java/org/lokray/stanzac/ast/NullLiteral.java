package org.lokray.stanzac.ast;

public record NullLiteral() implements Expression
{
	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitNullLiteral(this);
	}
}
