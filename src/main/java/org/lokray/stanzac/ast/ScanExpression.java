package org.lokray.stanzac.ast;

/**
 * Marker for the expressions allowed as the subject of a {@code scan} statement:
 * string constants, captures, variables and regex captures.
 */
public interface ScanExpression extends Expression
{
}
