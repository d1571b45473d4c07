package org.lokray.stanzac.ast;

import java.util.List;

/**
 * Matches {@code value} against each arm's regex in order and runs the first arm that matches.
 */
public record Scan(ScanExpression value, List<ScanArm> arms, Location location) implements Statement
{
	public Scan
	{
		arms = List.copyOf(arms);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitScan(this);
	}
}
