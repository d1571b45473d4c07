package org.lokray.stanzac.semantic;

public enum VariableError
{
	ALREADY_DEFINED("Variable already defined"),
	CANNOT_ASSIGN_IMMUTABLE("Cannot assign immutable variable"),
	UNDEFINED("Undefined variable");

	private final String message;

	VariableError(String message)
	{
		this.message = message;
	}

	public String getMessage()
	{
		return message;
	}
}
