package org.lokray.stanzac.ast;

import org.lokray.stanzac.query.CompiledQuery;

import java.util.List;

/**
 * A query pattern and the statements run once per match of it.
 *
 * @param query      The stanza's pattern compiled on its own. Captures referenced by the body must exist here.
 * @param statements The stanza body, in source order.
 * @param location   Where the stanza's pattern starts.
 */
public record Stanza(CompiledQuery query, List<Statement> statements, Location location)
{
	public Stanza
	{
		statements = List.copyOf(statements);
	}
}
