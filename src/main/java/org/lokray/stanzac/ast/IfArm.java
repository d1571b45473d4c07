package org.lokray.stanzac.ast;

import java.util.List;

public record IfArm(List<Condition> conditions, List<Statement> statements, Location location)
{
	public IfArm
	{
		conditions = List.copyOf(conditions);
		statements = List.copyOf(statements);
	}
}
