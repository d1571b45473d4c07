package org.lokray.stanzac.ast;

import java.util.List;

public record ScanArm(String regex, List<Statement> statements, Location location)
{
	public ScanArm
	{
		statements = List.copyOf(statements);
	}
}
