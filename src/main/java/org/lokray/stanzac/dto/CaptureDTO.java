package org.lokray.stanzac.dto;

public class CaptureDTO
{
	public String name;
	public int line;
	public int column;
	public int stanzaCaptureIndex;
	public int fileCaptureIndex;
	public String quantifier;
}
