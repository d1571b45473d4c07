package org.lokray.stanzac.semantic;

import org.junit.jupiter.api.Test;
import org.lokray.stanzac.ast.Identifier;
import org.lokray.stanzac.ast.NameTable;

import static org.junit.jupiter.api.Assertions.*;
import static org.lokray.stanzac.query.CaptureQuantifier.*;

class VariableMapTest
{
	private final NameTable names = new NameTable();
	private final Identifier x = names.intern("x");
	private final Identifier y = names.intern("y");

	private static final ExpressionResult OPTIONAL = new ExpressionResult(ZERO_OR_ONE);

	@Test
	void addThenGet() throws VariableException
	{
		VariableMap<ExpressionResult> root = new VariableMap<>();
		root.add(x, ExpressionResult.LIST, false);

		assertEquals(ZERO_OR_MORE, root.get(x).orElseThrow().quantifier());
		assertTrue(root.get(y).isEmpty());
	}

	@Test
	void duplicateInSameScopeIgnoresMutability() throws VariableException
	{
		VariableMap<ExpressionResult> root = new VariableMap<>();
		root.add(x, ExpressionResult.ONE, true);

		VariableException e = assertThrows(VariableException.class, () -> root.add(x, ExpressionResult.ONE, false));
		assertEquals(VariableError.ALREADY_DEFINED, e.getError());
	}

	@Test
	void childShadowsWithoutTouchingParent() throws VariableException
	{
		VariableMap<ExpressionResult> root = new VariableMap<>();
		root.add(x, ExpressionResult.ONE, false);

		VariableMap<ExpressionResult> child = root.newChild();
		child.add(x, ExpressionResult.LIST, true);
		child.set(x, OPTIONAL);

		assertEquals(ZERO_OR_ONE, child.get(x).orElseThrow().quantifier());
		assertEquals(ONE, root.get(x).orElseThrow().quantifier());
		assertFalse(root.isDefinedLocally(y));
		assertSame(root, child.getEnclosingScope());
	}

	@Test
	void childDeclarationsAreInvisibleToParentAndSiblings() throws VariableException
	{
		VariableMap<ExpressionResult> root = new VariableMap<>();
		VariableMap<ExpressionResult> first = root.newChild();
		VariableMap<ExpressionResult> second = root.newChild();
		first.add(y, ExpressionResult.ONE, false);

		assertTrue(root.get(y).isEmpty());
		assertTrue(second.get(y).isEmpty());
		assertDoesNotThrow(() -> second.add(y, ExpressionResult.ONE, false));
	}

	@Test
	void setUpdatesEnclosingBindingVisibleToDescendants() throws VariableException
	{
		VariableMap<ExpressionResult> root = new VariableMap<>();
		root.add(x, ExpressionResult.ONE, true);
		VariableMap<ExpressionResult> child = root.newChild();
		VariableMap<ExpressionResult> grandchild = child.newChild();

		child.set(x, ExpressionResult.LIST);

		assertEquals(ZERO_OR_MORE, root.get(x).orElseThrow().quantifier());
		assertEquals(ZERO_OR_MORE, grandchild.get(x).orElseThrow().quantifier());
	}

	@Test
	void setImmutableFails() throws VariableException
	{
		VariableMap<ExpressionResult> root = new VariableMap<>();
		root.add(x, ExpressionResult.ONE, false);

		VariableException e = assertThrows(VariableException.class, () -> root.newChild().set(x, ExpressionResult.LIST));
		assertEquals(VariableError.CANNOT_ASSIGN_IMMUTABLE, e.getError());
		assertEquals(ONE, root.get(x).orElseThrow().quantifier());
	}

	@Test
	void setUndeclaredFails()
	{
		VariableMap<ExpressionResult> root = new VariableMap<>();

		VariableException e = assertThrows(VariableException.class, () -> root.set(x, ExpressionResult.ONE));
		assertEquals(VariableError.UNDEFINED, e.getError());
		assertEquals("Undefined variable", e.getMessage());
	}
}
