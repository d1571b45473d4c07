package org.lokray.stanzac.ast;

/**
 * Dispatch over every expression kind, variables included.
 */
public interface ExpressionVisitor<R>
{
	R visitBooleanLiteral(BooleanLiteral expr);

	R visitNullLiteral(NullLiteral expr);

	R visitIntegerConstant(IntegerConstant expr);

	R visitStringConstant(StringConstant expr);

	R visitListComprehension(ListComprehension expr);

	R visitSetComprehension(SetComprehension expr);

	R visitCapture(Capture expr);

	R visitUnscopedVariable(UnscopedVariable expr);

	R visitScopedVariable(ScopedVariable expr);

	R visitCall(Call expr);

	R visitRegexCapture(RegexCapture expr);
}
