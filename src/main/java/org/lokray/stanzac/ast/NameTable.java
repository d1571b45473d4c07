// File: src/main/java/org/lokray/stanzac/ast/NameTable.java
package org.lokray.stanzac.ast;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interns variable, capture, function and attribute names.
 * Equal strings always map to the same {@link Identifier}.
 */
public class NameTable
{
	private final Map<String, Identifier> identifiers = new HashMap<>();
	private final List<String> names = new ArrayList<>();

	public Identifier intern(String name)
	{
		Identifier existing = identifiers.get(name);
		if (existing != null)
		{
			return existing;
		}
		Identifier id = new Identifier(names.size());
		names.add(name);
		identifiers.put(name, id);
		return id;
	}

	public String resolve(Identifier identifier)
	{
		if (identifier.id() < 0 || identifier.id() >= names.size())
		{
			throw new IllegalArgumentException("Identifier " + identifier.id() + " was not interned by this table.");
		}
		return names.get(identifier.id());
	}

	public int size()
	{
		return names.size();
	}
}
