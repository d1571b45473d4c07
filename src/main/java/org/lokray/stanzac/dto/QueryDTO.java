package org.lokray.stanzac.dto;

import java.util.List;

// Read-only: left null when absent from the manifest so the loader can report it.
public class QueryDTO
{
	public List<PatternDTO> patterns;
}
