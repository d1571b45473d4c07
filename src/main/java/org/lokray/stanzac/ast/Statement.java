package org.lokray.stanzac.ast;

/**
 * One statement of a stanza body.
 */
public interface Statement
{
	Location location();

	<R> R accept(StatementVisitor<R> visitor);
}
