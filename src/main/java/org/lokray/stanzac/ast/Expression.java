package org.lokray.stanzac.ast;

public interface Expression
{
	<R> R accept(ExpressionVisitor<R> visitor);
}
