package org.lokray.stanzac.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.stanzac.ast.*;
import org.lokray.stanzac.query.CaptureQuantifier;
import org.lokray.stanzac.query.CompiledQuery;
import org.lokray.stanzac.query.QueryManifestLoader;
import org.lokray.stanzac.query.StaticQuery;
import org.lokray.stanzac.semantic.GraphChecker;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionDumperTest
{
	@TempDir
	Path tempDir;

	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	private final NameTable names = new NameTable();

	private File functionsFile()
	{
		StaticQuery fileQuery = QueryManifestLoader.fromJson(
				"{\"patterns\":[{\"captures\":{\"" + CompiledQuery.FULL_MATCH + "\":\"1\",\"name\":\"\",\"params\":\"*\"}}]}");
		Statement print = new Print(List.of(new Capture(names.intern("name"), new Location(1, 8))), new Location(1, 2));
		Statement loop = new ForIn(new UnscopedVariable(names.intern("p"), new Location(2, 6)),
				new Capture(names.intern("params"), new Location(2, 11)), List.of(), new Location(2, 2));
		Stanza stanza = new Stanza(fileQuery.patternQuery(0), List.of(print, loop), Location.NONE);
		return new File(List.of(stanza), fileQuery);
	}

	@Test
	void jsonListsCapturesPerStanza()
	{
		GraphChecker checker = new GraphChecker(names, new ErrorHandler());
		checker.check(functionsFile());

		JsonObject root = JsonParser.parseString(ResolutionDumper.toJson(checker.getCheckedStanzas())).getAsJsonObject();
		JsonArray stanzas = root.getAsJsonArray("stanzas");
		assertEquals(1, stanzas.size());

		JsonObject stanza = stanzas.get(0).getAsJsonObject();
		assertEquals(0, stanza.get("fullMatchCaptureIndex").getAsInt());
		JsonArray captures = stanza.getAsJsonArray("captures");
		assertEquals(2, captures.size());

		JsonObject params = captures.get(1).getAsJsonObject();
		assertEquals("params", params.get("name").getAsString());
		assertEquals("ZERO_OR_MORE", params.get("quantifier").getAsString());
		assertEquals(2, params.get("fileCaptureIndex").getAsInt());
		assertEquals(3, params.get("line").getAsInt());
		assertEquals(12, params.get("column").getAsInt());
	}

	@Test
	void analyzeWritesDumpWhenAsked() throws Exception
	{
		Path out = tempDir.resolve("nested/captures.json");
		CheckerOptions options = CheckerOptions.parse("--dump-captures", out.toString());

		assertTrue(new GraphChecker(names, new ErrorHandler(), options).analyze(functionsFile()));

		assertTrue(Files.exists(out));
		JsonObject root = JsonParser.parseString(Files.readString(out)).getAsJsonObject();
		assertEquals(1, root.getAsJsonArray("stanzas").size());
	}

	@Test
	void failedAnalyzeWritesNothing()
	{
		Path out = tempDir.resolve("captures.json");
		CheckerOptions options = CheckerOptions.parse("--dump-captures", out.toString());
		StaticQuery query = StaticQuery.builder().pattern().capture(CompiledQuery.FULL_MATCH, CaptureQuantifier.ONE).build();
		Stanza stanza = new Stanza(query, List.of(new Print(List.of(new Capture(names.intern("nope"), Location.NONE)), Location.NONE)), Location.NONE);

		assertFalse(new GraphChecker(names, new ErrorHandler(), options).analyze(new File(List.of(stanza), query)));
		assertFalse(Files.exists(out));
	}
}
