package org.lokray.stanzac.ast;

/**
 * An interned name handle. Only meaningful together with the {@link NameTable} that created it.
 */
public record Identifier(int id)
{
}
