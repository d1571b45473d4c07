package org.lokray.stanzac.ast;

import org.lokray.stanzac.query.CompiledQuery;

import java.util.List;

/**
 * A whole stanza file.
 *
 * @param stanzas The stanzas, in declaration order. A stanza's position here is its pattern index in {@code query}.
 * @param query   All stanza patterns compiled together, or {@code null} if the file has not been compiled yet.
 */
public record File(List<Stanza> stanzas, CompiledQuery query)
{
	public File
	{
		stanzas = List.copyOf(stanzas);
	}
}
