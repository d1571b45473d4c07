// File: src/main/java/org/lokray/stanzac/util/ResolutionDumper.java
package org.lokray.stanzac.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.stanzac.dto.CaptureDTO;
import org.lokray.stanzac.dto.FileDTO;
import org.lokray.stanzac.dto.StanzaDTO;
import org.lokray.stanzac.semantic.info.ResolvedCapture;
import org.lokray.stanzac.semantic.info.StanzaInfo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes the checker's capture resolutions as JSON, one entry per stanza.
 */
public class ResolutionDumper
{
	public static FileDTO toDTO(List<StanzaInfo> stanzas)
	{
		FileDTO dto = new FileDTO();
		for (StanzaInfo stanza : stanzas)
		{
			dto.stanzas.add(stanzaToDTO(stanza));
		}
		return dto;
	}

	private static StanzaDTO stanzaToDTO(StanzaInfo stanza)
	{
		StanzaDTO dto = new StanzaDTO();
		dto.index = stanza.stanzaIndex();
		dto.fullMatchCaptureIndex = stanza.fullMatchCaptureIndex();
		for (ResolvedCapture capture : stanza.captures())
		{
			CaptureDTO cd = new CaptureDTO();
			cd.name = capture.name();
			// one-based, as in diagnostics
			cd.line = capture.location().row() + 1;
			cd.column = capture.location().column() + 1;
			cd.stanzaCaptureIndex = capture.stanzaCaptureIndex();
			cd.fileCaptureIndex = capture.fileCaptureIndex();
			cd.quantifier = capture.quantifier().name();
			dto.captures.add(cd);
		}
		return dto;
	}

	public static String toJson(List<StanzaInfo> stanzas)
	{
		Gson gson = new GsonBuilder().setPrettyPrinting().create();
		return gson.toJson(toDTO(stanzas));
	}

	public static void write(List<StanzaInfo> stanzas, Path outPath) throws IOException
	{
		Path parent = outPath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outPath, toJson(stanzas), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote capture resolutions to: " + outPath);
	}
}
