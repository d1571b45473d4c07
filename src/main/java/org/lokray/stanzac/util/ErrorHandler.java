// File: src/main/java/org/lokray/stanzac/util/ErrorHandler.java
package org.lokray.stanzac.util;

import org.lokray.stanzac.semantic.CheckException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ErrorHandler
{
	private final List<String> errors = new ArrayList<>();

	public void logError(CheckException error, int stanzaIndex)
	{
		String err = String.format("[Semantic Error] stanza %d - %s", stanzaIndex, error.getMessage());
		Debug.logError(err);
		errors.add(err);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public List<String> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}
}
