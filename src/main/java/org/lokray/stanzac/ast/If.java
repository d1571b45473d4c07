package org.lokray.stanzac.ast;

import java.util.List;

/**
 * An {@code if}/{@code elif}/{@code else} chain. An {@code else} arm is an arm without conditions.
 */
public record If(List<IfArm> arms, Location location) implements Statement
{
	public If
	{
		arms = List.copyOf(arms);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitIf(this);
	}
}
