package org.lokray.stanzac.semantic;

/**
 * Raised by {@link Variables} when a scoping rule is broken.
 */
public class VariableException extends Exception
{
	private final VariableError error;

	public VariableException(VariableError error)
	{
		super(error.getMessage());
		this.error = error;
	}

	public VariableError getError()
	{
		return error;
	}
}
