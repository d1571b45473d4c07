package org.lokray.stanzac.semantic.info;

import org.lokray.stanzac.ast.Location;
import org.lokray.stanzac.query.CaptureQuantifier;

/**
 * What the checker resolved for one capture reference. The interpreter uses the stanza index to read the
 * capture from a stanza-only match and the file index to read it from a match of the combined query.
 */
public record ResolvedCapture(
		String name,
		Location location,
		int stanzaCaptureIndex,
		int fileCaptureIndex,
		CaptureQuantifier quantifier
)
{
}
