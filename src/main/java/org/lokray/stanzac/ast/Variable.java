package org.lokray.stanzac.ast;

/**
 * A variable reference, either a bare name or a name qualified by a scope expression.
 */
public interface Variable extends ScanExpression
{
	Identifier name();

	Location location();
}
