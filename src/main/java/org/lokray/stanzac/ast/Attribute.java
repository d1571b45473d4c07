package org.lokray.stanzac.ast;

/**
 * {@code name = value} in an {@code attr} statement.
 */
public record Attribute(Identifier name, Expression value)
{
}
