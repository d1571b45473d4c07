package org.lokray.stanzac.semantic.info;

import java.util.List;

/**
 * Per-stanza results of a successful check.
 */
public record StanzaInfo(
		int stanzaIndex,
		int fullMatchCaptureIndex, // index of the full-match capture in the file query
		List<ResolvedCapture> captures // in the order the references were checked
)
{
	public StanzaInfo
	{
		captures = List.copyOf(captures);
	}
}
