package org.lokray.stanzac.ast;

/**
 * Dispatch over every statement kind. Adding a statement kind means adding a method here.
 */
public interface StatementVisitor<R>
{
	R visitDeclareImmutable(DeclareImmutable stmt);

	R visitDeclareMutable(DeclareMutable stmt);

	R visitAssign(Assign stmt);

	R visitCreateGraphNode(CreateGraphNode stmt);

	R visitAddGraphNodeAttribute(AddGraphNodeAttribute stmt);

	R visitCreateEdge(CreateEdge stmt);

	R visitAddEdgeAttribute(AddEdgeAttribute stmt);

	R visitScan(Scan stmt);

	R visitPrint(Print stmt);

	R visitIf(If stmt);

	R visitForIn(ForIn stmt);
}
