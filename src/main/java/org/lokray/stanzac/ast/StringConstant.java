package org.lokray.stanzac.ast;

public record StringConstant(String value) implements ScanExpression
{
	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitStringConstant(this);
	}
}
