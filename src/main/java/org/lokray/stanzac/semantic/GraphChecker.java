package org.lokray.stanzac.semantic;

import org.lokray.stanzac.ast.Capture;
import org.lokray.stanzac.ast.File;
import org.lokray.stanzac.ast.NameTable;
import org.lokray.stanzac.ast.Stanza;
import org.lokray.stanzac.query.CompiledQuery;
import org.lokray.stanzac.semantic.info.ResolvedCapture;
import org.lokray.stanzac.semantic.info.StanzaInfo;
import org.lokray.stanzac.util.CheckerOptions;
import org.lokray.stanzac.util.Debug;
import org.lokray.stanzac.util.ErrorHandler;
import org.lokray.stanzac.util.ResolutionDumper;

import java.io.IOException;
import java.util.*;

/**
 * Checks a stanza file before it is executed. Stanzas are checked one at a time, in order, each in its
 * own variable scope. Capture resolutions are kept in side tables on this object for the interpreter.
 */
public class GraphChecker
{
	private final NameTable names;
	private final ErrorHandler errorHandler;
	private final CheckerOptions options;

	private final Map<Capture, ResolvedCapture> resolvedCaptures = new IdentityHashMap<>();
	private final Map<Stanza, StanzaInfo> stanzaInfo = new IdentityHashMap<>();
	private final List<StanzaInfo> checkedStanzas = new ArrayList<>();
	private int currentStanzaIndex = -1;

	public GraphChecker(NameTable names, ErrorHandler errorHandler)
	{
		this(names, errorHandler, CheckerOptions.defaults());
	}

	public GraphChecker(NameTable names, ErrorHandler errorHandler, CheckerOptions options)
	{
		this.names = names;
		this.errorHandler = errorHandler;
		this.options = options;
	}

	/**
	 * Checks every stanza of {@code file} and records capture resolutions.
	 *
	 * @throws CheckException        for the first problem found. Later stanzas are not checked.
	 * @throws IllegalStateException if the file has no compiled query or the query does not agree with the stanzas.
	 */
	public void check(File file)
	{
		resolvedCaptures.clear();
		stanzaInfo.clear();
		checkedStanzas.clear();

		CompiledQuery fileQuery = file.query();
		if (fileQuery == null)
		{
			throw new IllegalStateException("File has not been compiled; no file query to check against.");
		}
		int fullMatchIndex = fileQuery.captureIndexForName(CompiledQuery.FULL_MATCH)
				.orElseThrow(() -> new IllegalStateException("File query does not define @" + CompiledQuery.FULL_MATCH + "."));

		Debug.logDebug("Checking " + file.stanzas().size() + " stanza(s)...");
		List<Stanza> stanzas = file.stanzas();
		for (int i = 0; i < stanzas.size(); i++)
		{
			currentStanzaIndex = i;
			checkStanza(stanzas.get(i), fileQuery, i, fullMatchIndex);
		}
		currentStanzaIndex = -1;
		Debug.logDebug("Check completed successfully.");
	}

	private void checkStanza(Stanza stanza, CompiledQuery fileQuery, int stanzaIndex, int fullMatchIndex)
	{
		Debug.logDebug("Stanza " + stanzaIndex + " at " + stanza.location());
		List<ResolvedCapture> captures = new ArrayList<>();
		CheckVisitor visitor = new CheckVisitor(names, fileQuery, stanzaIndex, stanza.query(), resolvedCaptures, captures);
		visitor.checkStatements(stanza.statements());

		StanzaInfo info = new StanzaInfo(stanzaIndex, fullMatchIndex, captures);
		stanzaInfo.put(stanza, info);
		checkedStanzas.add(info);
	}

	/**
	 * Checks {@code file}, reporting a failure through the error handler instead of throwing it.
	 * When the options ask for it, the resolved captures are written out after a successful check.
	 *
	 * @return true if the file checked cleanly.
	 */
	public boolean analyze(File file)
	{
		try
		{
			check(file);
		}
		catch (CheckException e)
		{
			errorHandler.logError(e, currentStanzaIndex);
			currentStanzaIndex = -1;
			return false;
		}

		if (options.getCaptureDumpPath() != null)
		{
			try
			{
				ResolutionDumper.write(checkedStanzas, options.getCaptureDumpPath());
			}
			catch (IOException e)
			{
				Debug.logWarning("Failed to write capture dump: " + options.getCaptureDumpPath() + " | Reason: " + e.getMessage());
			}
		}
		return true;
	}

	public Optional<ResolvedCapture> getResolvedCapture(Capture capture)
	{
		return Optional.ofNullable(resolvedCaptures.get(capture));
	}

	public Optional<StanzaInfo> getStanzaInfo(Stanza stanza)
	{
		return Optional.ofNullable(stanzaInfo.get(stanza));
	}

	/**
	 * File-query index of the full-match capture for {@code stanza}, once it has been checked.
	 */
	public OptionalInt getFullMatchCaptureIndex(Stanza stanza)
	{
		StanzaInfo info = stanzaInfo.get(stanza);
		return info == null ? OptionalInt.empty() : OptionalInt.of(info.fullMatchCaptureIndex());
	}

	public List<StanzaInfo> getCheckedStanzas()
	{
		return Collections.unmodifiableList(checkedStanzas);
	}
}
