package org.lokray.sleaf.ast;

import org.lokray.sleaf.ast.declarations.FunctionDeclaration;
import org.lokray.sleaf.ast.declarations.Parameter;
import org.lokray.sleaf.ast.expressions.*;
import org.lokray.sleaf.ast.statements.*;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * There is one method per concrete node kind and no default implementations,
 * so adding a node kind forces every consumer to handle it.
 *
 * @param <R> The result type of the visit methods.
 */
public interface ASTVisitor<R>
{
	// --- Declarations ---
	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitParameter(Parameter parameter);

	// --- Statements ---
	R visitBlockStatement(BlockStatement statement);

	R visitVariableDeclarationStatement(VariableDeclarationStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitWhileStatement(WhileStatement statement);

	R visitForStatement(ForStatement statement);

	R visitReturnStatement(ReturnStatement statement);

	R visitExpressionStatement(ExpressionStatement statement);

	// --- Expressions ---
	R visitBinaryExpression(BinaryExpression expression);

	R visitAssignmentExpression(AssignmentExpression expression);

	R visitUnaryExpression(UnaryExpression expression);

	R visitCallExpression(CallExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);

	R visitLiteralExpression(LiteralExpression expression);

	R visitGroupingExpression(GroupingExpression expression);
}
