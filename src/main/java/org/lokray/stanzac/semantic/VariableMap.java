// File: src/main/java/org/lokray/stanzac/semantic/VariableMap.java
package org.lokray.stanzac.semantic;

import org.lokray.stanzac.ast.Identifier;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One scope of a variable environment. Lookups and assignments fall through to the enclosing scope;
 * declarations never do.
 */
public class VariableMap<V> implements Variables<V>
{
	private final VariableMap<V> enclosingScope;
	private final Map<Identifier, Binding<V>> bindings = new HashMap<>();

	private static final class Binding<V>
	{
		private V value;
		private final boolean mutable;

		private Binding(V value, boolean mutable)
		{
			this.value = value;
			this.mutable = mutable;
		}
	}

	/**
	 * A root scope.
	 */
	public VariableMap()
	{
		this(null);
	}

	public VariableMap(VariableMap<V> enclosingScope)
	{
		this.enclosingScope = enclosingScope;
	}

	public VariableMap<V> newChild()
	{
		return new VariableMap<>(this);
	}

	public VariableMap<V> getEnclosingScope()
	{
		return enclosingScope;
	}

	@Override
	public void add(Identifier name, V value, boolean mutable) throws VariableException
	{
		if (bindings.containsKey(name))
		{
			throw new VariableException(VariableError.ALREADY_DEFINED);
		}
		bindings.put(name, new Binding<>(value, mutable));
	}

	@Override
	public void set(Identifier name, V value) throws VariableException
	{
		Binding<V> binding = resolve(name);
		if (binding == null)
		{
			throw new VariableException(VariableError.UNDEFINED);
		}
		if (!binding.mutable)
		{
			throw new VariableException(VariableError.CANNOT_ASSIGN_IMMUTABLE);
		}
		binding.value = value;
	}

	@Override
	public Optional<V> get(Identifier name)
	{
		Binding<V> binding = resolve(name);
		return binding == null ? Optional.empty() : Optional.ofNullable(binding.value);
	}

	public boolean isDefinedLocally(Identifier name)
	{
		return bindings.containsKey(name);
	}

	private Binding<V> resolve(Identifier name)
	{
		for (VariableMap<V> scope = this; scope != null; scope = scope.enclosingScope)
		{
			Binding<V> binding = scope.bindings.get(name);
			if (binding != null)
			{
				return binding;
			}
		}
		return null;
	}
}
