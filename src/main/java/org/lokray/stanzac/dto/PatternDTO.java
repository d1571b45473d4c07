package org.lokray.stanzac.dto;

import java.util.Map;

public class PatternDTO
{
	// capture name -> quantifier, in pattern order
	public Map<String, String> captures;
}
