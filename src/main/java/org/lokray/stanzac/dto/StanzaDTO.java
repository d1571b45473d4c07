package org.lokray.stanzac.dto;

import java.util.ArrayList;
import java.util.List;

public class StanzaDTO
{
	public int index;
	public int fullMatchCaptureIndex;
	public List<CaptureDTO> captures = new ArrayList<>();
}
