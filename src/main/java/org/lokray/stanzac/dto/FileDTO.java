package org.lokray.stanzac.dto;

import java.util.ArrayList;
import java.util.List;

public class FileDTO
{
	public List<StanzaDTO> stanzas = new ArrayList<>();
}
