package org.lokray.stanzac.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class CheckerOptionsTest
{
	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void defaultsAreQuiet()
	{
		CheckerOptions options = CheckerOptions.parse();

		assertFalse(options.isHelpFlag());
		assertFalse(options.isVerboseFlag());
		assertNull(options.getCaptureDumpPath());
		assertFalse(Debug.ENABLE_DEBUG);
	}

	@Test
	void verboseEnablesDebugLogging()
	{
		CheckerOptions options = CheckerOptions.parse("--verbose", "--dump-captures", "out/captures.json");

		assertTrue(options.isVerboseFlag());
		assertTrue(Debug.ENABLE_DEBUG);
		assertEquals(Paths.get("out/captures.json"), options.getCaptureDumpPath());
	}

	@Test
	void helpWinsOverEverythingAfterIt()
	{
		CheckerOptions options = CheckerOptions.parse("-h", "--no-such-flag");

		assertTrue(options.isHelpFlag());
		assertDoesNotThrow(CheckerOptions::printUsage);
	}

	@Test
	void rejectsBadArguments()
	{
		assertThrows(IllegalArgumentException.class, () -> CheckerOptions.parse("--frobnicate"));
		assertThrows(IllegalArgumentException.class, () -> CheckerOptions.parse("--dump-captures"));
		assertThrows(IllegalArgumentException.class, () -> CheckerOptions.parse("--dump-captures", "-v"));
	}
}
