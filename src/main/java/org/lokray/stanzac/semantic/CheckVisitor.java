package org.lokray.stanzac.semantic;

import org.lokray.stanzac.ast.*;
import org.lokray.stanzac.query.CaptureQuantifier;
import org.lokray.stanzac.query.CompiledQuery;
import org.lokray.stanzac.semantic.info.ResolvedCapture;
import org.lokray.stanzac.util.Debug;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Checks the body of a single stanza: variable scoping, capture resolution and capture cardinality.
 * Statements are visited for effect; expressions return the cardinality of their value.
 * The first problem found is thrown as a {@link CheckException}.
 */
public class CheckVisitor implements StatementVisitor<Void>, ExpressionVisitor<ExpressionResult>
{
	private final NameTable names;
	private final CompiledQuery fileQuery;
	private final int stanzaIndex;
	private final CompiledQuery stanzaQuery;
	private final Map<Capture, ResolvedCapture> resolvedCaptures;
	private final List<ResolvedCapture> stanzaCaptures;
	private VariableMap<ExpressionResult> currentScope;

	public CheckVisitor(NameTable names, CompiledQuery fileQuery, int stanzaIndex, CompiledQuery stanzaQuery, Map<Capture, ResolvedCapture> resolvedCaptures, List<ResolvedCapture> stanzaCaptures)
	{
		this.names = names;
		this.fileQuery = fileQuery;
		this.stanzaIndex = stanzaIndex;
		this.stanzaQuery = stanzaQuery;
		this.resolvedCaptures = resolvedCaptures;
		this.stanzaCaptures = stanzaCaptures;
		// Stanzas never share variables, so every stanza starts from a fresh root scope.
		this.currentScope = new VariableMap<>();
	}

	public void checkStatements(List<Statement> statements)
	{
		for (Statement statement : statements)
		{
			statement.accept(this);
		}
	}

	public ExpressionResult check(Expression expression)
	{
		return expression.accept(this);
	}

	/**
	 * Checks {@code statements} in a fresh child of the current scope. Nothing they declare is visible afterwards.
	 */
	private void checkBlock(List<Statement> statements)
	{
		VariableMap<ExpressionResult> enclosing = currentScope;
		currentScope = enclosing.newChild();
		try
		{
			checkStatements(statements);
		}
		finally
		{
			currentScope = enclosing;
		}
	}

	// --- Statements ---

	@Override
	public Void visitDeclareImmutable(DeclareImmutable stmt)
	{
		ExpressionResult value = check(stmt.value());
		addCheck(stmt.variable(), value, false);
		return null;
	}

	@Override
	public Void visitDeclareMutable(DeclareMutable stmt)
	{
		ExpressionResult value = check(stmt.value());
		addCheck(stmt.variable(), value, true);
		return null;
	}

	@Override
	public Void visitAssign(Assign stmt)
	{
		ExpressionResult value = check(stmt.value());
		setCheck(stmt.variable(), value);
		return null;
	}

	@Override
	public Void visitCreateGraphNode(CreateGraphNode stmt)
	{
		addCheck(stmt.node(), ExpressionResult.ONE, false);
		return null;
	}

	@Override
	public Void visitAddGraphNodeAttribute(AddGraphNodeAttribute stmt)
	{
		check(stmt.node());
		checkAttributes(stmt.attributes());
		return null;
	}

	@Override
	public Void visitCreateEdge(CreateEdge stmt)
	{
		check(stmt.source());
		check(stmt.sink());
		return null;
	}

	@Override
	public Void visitAddEdgeAttribute(AddEdgeAttribute stmt)
	{
		check(stmt.source());
		check(stmt.sink());
		checkAttributes(stmt.attributes());
		return null;
	}

	@Override
	public Void visitScan(Scan stmt)
	{
		check(stmt.value());
		for (ScanArm arm : stmt.arms())
		{
			checkBlock(arm.statements());
		}
		return null;
	}

	@Override
	public Void visitPrint(Print stmt)
	{
		for (Expression value : stmt.values())
		{
			check(value);
		}
		return null;
	}

	@Override
	public Void visitIf(If stmt)
	{
		for (IfArm arm : stmt.arms())
		{
			// Conditions are checked in the enclosing scope, before the arm's own scope exists.
			for (Condition condition : arm.conditions())
			{
				checkCondition(condition);
			}
			checkBlock(arm.statements());
		}
		return null;
	}

	private void checkCondition(Condition condition)
	{
		for (Capture capture : condition.captures())
		{
			ExpressionResult result = check(capture);
			if (!result.quantifier().isOptional())
			{
				throw CheckException.expectedOptionalValue(capture.location());
			}
		}
	}

	@Override
	public Void visitForIn(ForIn stmt)
	{
		ExpressionResult source = check(stmt.capture());
		if (!source.quantifier().isList())
		{
			throw CheckException.expectedListValue(stmt.location());
		}

		VariableMap<ExpressionResult> enclosing = currentScope;
		currentScope = enclosing.newChild();
		try
		{
			// The loop variable holds one element per iteration.
			addCheck(stmt.variable(), ExpressionResult.ONE, false);
			checkStatements(stmt.statements());
		}
		finally
		{
			currentScope = enclosing;
		}
		return null;
	}

	private void checkAttributes(List<Attribute> attributes)
	{
		for (Attribute attribute : attributes)
		{
			check(attribute.value());
		}
	}

	// --- Expressions ---

	@Override
	public ExpressionResult visitBooleanLiteral(BooleanLiteral expr)
	{
		return ExpressionResult.ONE;
	}

	@Override
	public ExpressionResult visitNullLiteral(NullLiteral expr)
	{
		return ExpressionResult.ONE;
	}

	@Override
	public ExpressionResult visitIntegerConstant(IntegerConstant expr)
	{
		return ExpressionResult.ONE;
	}

	@Override
	public ExpressionResult visitStringConstant(StringConstant expr)
	{
		return ExpressionResult.ONE;
	}

	@Override
	public ExpressionResult visitListComprehension(ListComprehension expr)
	{
		for (Expression element : expr.elements())
		{
			check(element);
		}
		return ExpressionResult.LIST;
	}

	@Override
	public ExpressionResult visitSetComprehension(SetComprehension expr)
	{
		for (Expression element : expr.elements())
		{
			check(element);
		}
		return ExpressionResult.LIST;
	}

	@Override
	public ExpressionResult visitCapture(Capture expr)
	{
		String name = names.resolve(expr.name());
		OptionalInt stanzaIndexOfCapture = stanzaQuery.captureIndexForName(name);
		if (stanzaIndexOfCapture.isEmpty())
		{
			throw CheckException.undefinedSyntaxCapture(name, expr.location());
		}
		// Every stanza pattern is part of the file query, so a stanza capture is always a file capture.
		int fileCaptureIndex = fileQuery.captureIndexForName(name)
				.orElseThrow(() -> new IllegalStateException("Capture @" + name + " is missing from the file query."));
		CaptureQuantifier quantifier = fileQuery.captureQuantifier(stanzaIndex, fileCaptureIndex);

		ResolvedCapture resolved = new ResolvedCapture(name, expr.location(), stanzaIndexOfCapture.getAsInt(), fileCaptureIndex, quantifier);
		resolvedCaptures.put(expr, resolved);
		stanzaCaptures.add(resolved);
		Debug.logDebug("  @" + name + " -> stanza #" + resolved.stanzaCaptureIndex() + ", file #" + fileCaptureIndex + ", " + quantifier);
		return new ExpressionResult(quantifier);
	}

	@Override
	public ExpressionResult visitUnscopedVariable(UnscopedVariable expr)
	{
		// An undeclared name may still be a global supplied at execution time. Its cardinality is
		// unknown, so assume one value; the interpreter reports it if it is really unbound.
		return currentScope.get(expr.name()).orElse(ExpressionResult.ONE);
	}

	@Override
	public ExpressionResult visitScopedVariable(ScopedVariable expr)
	{
		check(expr.scope());
		// Scoped variables are resolved at runtime; their cardinality is not tracked.
		return ExpressionResult.ONE;
	}

	@Override
	public ExpressionResult visitCall(Call expr)
	{
		for (Expression parameter : expr.parameters())
		{
			check(parameter);
		}
		// Function results are not typed; assume one value.
		return ExpressionResult.ONE;
	}

	@Override
	public ExpressionResult visitRegexCapture(RegexCapture expr)
	{
		return ExpressionResult.ONE;
	}

	// --- Variable binding ---

	private void addCheck(Variable variable, ExpressionResult value, boolean mutable)
	{
		if (variable instanceof ScopedVariable scoped)
		{
			check(scoped.scope());
			return;
		}
		try
		{
			currentScope.add(variable.name(), value, mutable);
		}
		catch (VariableException e)
		{
			throw CheckException.variable(e, names.resolve(variable.name()), variable.location());
		}
	}

	private void setCheck(Variable variable, ExpressionResult value)
	{
		if (variable instanceof ScopedVariable scoped)
		{
			check(scoped.scope());
			return;
		}
		try
		{
			currentScope.set(variable.name(), value);
		}
		catch (VariableException e)
		{
			throw CheckException.variable(e, names.resolve(variable.name()), variable.location());
		}
	}
}
