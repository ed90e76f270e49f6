package org.pragmatica.exformat.ast;

/**
 * Exhaustive dispatch over the {@link Node} variants.
 *
 * @param <R> result type
 * @param <A> argument threaded through the traversal
 */
public interface NodeVisitor<R, A> {
    R visitVariable(Node.Variable node, A arg);

    R visitModulePath(Node.ModulePath node, A arg);

    R visitBlock(Node.Block node, A arg);

    R visitBitstring(Node.Bitstring node, A arg);

    R visitInterpolation(Node.Interpolation node, A arg);

    R visitTwoElementTuple(Node.TwoElementTuple node, A arg);

    R visitTupleLiteral(Node.TupleLiteral node, A arg);

    R visitMapLiteral(Node.MapLiteral node, A arg);

    R visitStructLiteral(Node.StructLiteral node, A arg);

    R visitAnonymousFunction(Node.AnonymousFunction node, A arg);

    R visitRange(Node.Range node, A arg);

    R visitClauseList(Node.ClauseList node, A arg);

    R visitClause(Node.Clause node, A arg);

    R visitGuardedExpression(Node.GuardedExpression node, A arg);

    R visitBinaryOp(Node.BinaryOp node, A arg);

    R visitUnaryOp(Node.UnaryOp node, A arg);

    R visitCapture(Node.Capture node, A arg);

    R visitAccessIndex(Node.AccessIndex node, A arg);

    R visitCall(Node.Call node, A arg);

    R visitListLiteral(Node.ListLiteral node, A arg);

    R visitAtomLiteral(Node.AtomLiteral node, A arg);

    R visitLiteral(Node.Literal node, A arg);

    R visitSigil(Node.Sigil node, A arg);

    R visitRawValue(Node.RawValue node, A arg);
}
