// File: src/main/java/org/lokray/stanzac/query/QueryManifestLoader.java
package org.lokray.stanzac.query;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.lokray.stanzac.dto.PatternDTO;
import org.lokray.stanzac.dto.QueryDTO;
import org.lokray.stanzac.util.Debug;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads compiled query facts written by the query compiler as JSON:
 * <pre>
 * { "patterns": [ { "captures": { "__tsg__full_match": "1", "child": "*" } } ] }
 * </pre>
 * Quantifiers may be given as suffixes ({@code 1 ? * +}) or as {@link CaptureQuantifier} names.
 */
public class QueryManifestLoader
{
	private static final Gson GSON = new Gson();

	public static StaticQuery load(Path manifest) throws IOException
	{
		Debug.logDebug("Loading query manifest: " + manifest);
		try (Reader reader = Files.newBufferedReader(manifest))
		{
			return fromDTO(validate(GSON.fromJson(reader, QueryDTO.class), manifest.toString()));
		}
		catch (JsonParseException e)
		{
			throw new IllegalArgumentException("Malformed query manifest " + manifest + ": " + e.getMessage(), e);
		}
	}

	public static StaticQuery fromJson(String json)
	{
		try
		{
			return fromDTO(validate(GSON.fromJson(json, QueryDTO.class), "<string>"));
		}
		catch (JsonParseException e)
		{
			throw new IllegalArgumentException("Malformed query manifest: " + e.getMessage(), e);
		}
	}

	private static QueryDTO validate(QueryDTO dto, String source)
	{
		if (dto == null || dto.patterns == null)
		{
			throw new IllegalArgumentException("Query manifest " + source + " has no 'patterns' array.");
		}
		return dto;
	}

	static StaticQuery fromDTO(QueryDTO dto)
	{
		StaticQuery.Builder builder = StaticQuery.builder();
		for (int i = 0; i < dto.patterns.size(); i++)
		{
			PatternDTO pattern = dto.patterns.get(i);
			if (pattern == null || pattern.captures == null)
			{
				throw new IllegalArgumentException("Pattern " + i + " of query manifest has no 'captures' object.");
			}
			builder.pattern();
			for (Map.Entry<String, String> capture : pattern.captures.entrySet())
			{
				try
				{
					builder.capture(capture.getKey(), CaptureQuantifier.fromString(capture.getValue()));
				}
				catch (IllegalArgumentException e)
				{
					throw new IllegalArgumentException("Pattern " + i + ", capture @" + capture.getKey() + ": " + e.getMessage(), e);
				}
			}
		}
		return builder.build();
	}
}
