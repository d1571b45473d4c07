// File: src/main/java/org/lokray/stanzac/semantic/CheckException.java
package org.lokray.stanzac.semantic;

import org.lokray.stanzac.ast.Location;

/**
 * The first problem found while checking a file. Checking stops at the first one.
 */
public class CheckException extends RuntimeException
{
	public enum Kind
	{
		EXPECTED_LIST_VALUE,
		EXPECTED_OPTIONAL_VALUE,
		UNDEFINED_SYNTAX_CAPTURE,
		VARIABLE
	}

	private final Kind kind;
	private final Location location;
	private final String name;
	private final VariableError variableError;

	private CheckException(Kind kind, String message, Location location, String name, VariableError variableError, Throwable cause)
	{
		super(message, cause);
		this.kind = kind;
		this.location = location;
		this.name = name;
		this.variableError = variableError;
	}

	public static CheckException expectedListValue(Location location)
	{
		return new CheckException(Kind.EXPECTED_LIST_VALUE, "Expected list value at " + location, location, null, null, null);
	}

	public static CheckException expectedOptionalValue(Location location)
	{
		return new CheckException(Kind.EXPECTED_OPTIONAL_VALUE, "Expected optional value at " + location, location, null, null, null);
	}

	public static CheckException undefinedSyntaxCapture(String name, Location location)
	{
		return new CheckException(Kind.UNDEFINED_SYNTAX_CAPTURE, "Undefined syntax capture @" + name + " at " + location, location, name, null, null);
	}

	public static CheckException variable(VariableException cause, String name, Location location)
	{
		return new CheckException(Kind.VARIABLE, cause.getMessage() + ": " + name + " at " + location, location, name, cause.getError(), cause);
	}

	public Kind getKind()
	{
		return kind;
	}

	public Location getLocation()
	{
		return location;
	}

	/**
	 * The capture or variable name, without sigil. {@code null} for cardinality errors.
	 */
	public String getName()
	{
		return name;
	}

	/**
	 * Set only for {@link Kind#VARIABLE}.
	 */
	public VariableError getVariableError()
	{
		return variableError;
	}
}
