package org.lokray.stanzac.semantic;

import org.lokray.stanzac.ast.Identifier;

import java.util.Optional;

/**
 * A lexical variable environment.
 */
public interface Variables<V>
{
	/**
	 * Declares {@code name} in this scope.
	 *
	 * @throws VariableException {@link VariableError#ALREADY_DEFINED} if this scope (not an enclosing one) already declares it.
	 */
	void add(Identifier name, V value, boolean mutable) throws VariableException;

	/**
	 * Replaces the value of the nearest visible declaration of {@code name}.
	 *
	 * @throws VariableException {@link VariableError#UNDEFINED} if no visible scope declares it,
	 *                           {@link VariableError#CANNOT_ASSIGN_IMMUTABLE} if the declaration is not mutable.
	 */
	void set(Identifier name, V value) throws VariableException;

	Optional<V> get(Identifier name);
}
