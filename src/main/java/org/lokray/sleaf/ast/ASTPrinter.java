package org.lokray.sleaf.ast;

import org.lokray.sleaf.ast.declarations.FunctionDeclaration;
import org.lokray.sleaf.ast.declarations.Parameter;
import org.lokray.sleaf.ast.expressions.*;
import org.lokray.sleaf.ast.statements.*;

import java.util.List;

/**
 * Diagnostic printer for the AST. Renders one node per line, indenting children by
 * two spaces per nesting level. Used by the driver's --parser/--ast modes and by tests
 * to compare tree shapes.
 */
public class ASTPrinter implements ASTVisitor<Void>
{
	private final StringBuilder out = new StringBuilder();
	private int indentLevel = 0;

	/**
	 * Renders a whole compilation unit.
	 *
	 * @param statements The top-level statements returned by the parser.
	 * @return The rendered tree, one node per line.
	 */
	public String print(List<Statement> statements)
	{
		out.setLength(0);
		indentLevel = 0;
		for (Statement statement : statements)
		{
			statement.accept(this);
		}
		return out.toString();
	}

	/**
	 * Renders a single node and its subtree.
	 */
	public String print(ASTNode node)
	{
		out.setLength(0);
		indentLevel = 0;
		node.accept(this);
		return out.toString();
	}

	private void line(String text)
	{
		out.append("  ".repeat(indentLevel)).append(text).append('\n');
	}

	private void child(ASTNode node)
	{
		indentLevel++;
		node.accept(this);
		indentLevel--;
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		line("FunctionDecl " + declaration.getName().getLexeme() + " -> " + declaration.getReturnKind().name().toLowerCase());
		for (Parameter parameter : declaration.getParameters())
		{
			child(parameter);
		}
		child(declaration.getBody());
		return null;
	}

	@Override
	public Void visitParameter(Parameter parameter)
	{
		line("Param " + parameter.getName().getLexeme() + ": " + parameter.getType().getLexeme());
		return null;
	}

	@Override
	public Void visitBlockStatement(BlockStatement statement)
	{
		line("Block");
		for (Statement inner : statement.getStatements())
		{
			child(inner);
		}
		return null;
	}

	@Override
	public Void visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		line((statement.isConst() ? "ConstDecl " : "VarDecl ") + statement.getName().getLexeme() + ": " + statement.getType().getLexeme());
		if (statement.getInitializer() != null)
		{
			child(statement.getInitializer());
		}
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement)
	{
		line("If");
		child(statement.getCondition());
		child(statement.getThenBranch());
		if (statement.getElseBranch() != null)
		{
			indentLevel++;
			line("Else");
			child(statement.getElseBranch());
			indentLevel--;
		}
		return null;
	}

	@Override
	public Void visitWhileStatement(WhileStatement statement)
	{
		line("While");
		child(statement.getCondition());
		child(statement.getBody());
		return null;
	}

	@Override
	public Void visitForStatement(ForStatement statement)
	{
		line("For");
		if (statement.getInitializer() != null)
		{
			child(statement.getInitializer());
		}
		if (statement.getCondition() != null)
		{
			child(statement.getCondition());
		}
		if (statement.getIncrement() != null)
		{
			child(statement.getIncrement());
		}
		child(statement.getBody());
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatement statement)
	{
		line("Return");
		if (statement.getValue() != null)
		{
			child(statement.getValue());
		}
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement)
	{
		line("ExprStmt");
		child(statement.getExpression());
		return null;
	}

	@Override
	public Void visitBinaryExpression(BinaryExpression expression)
	{
		line("Binary " + expression.getOperator().getLexeme());
		child(expression.getLeft());
		child(expression.getRight());
		return null;
	}

	@Override
	public Void visitAssignmentExpression(AssignmentExpression expression)
	{
		line("Assign " + expression.getOperator().getLexeme() + " " + expression.getName().getLexeme());
		child(expression.getValue());
		return null;
	}

	@Override
	public Void visitUnaryExpression(UnaryExpression expression)
	{
		line("Unary " + expression.getOperator().getLexeme() + (expression.isPostfix() ? " (postfix)" : ""));
		child(expression.getOperand());
		return null;
	}

	@Override
	public Void visitCallExpression(CallExpression expression)
	{
		line("Call");
		child(expression.getCallee());
		for (Expression argument : expression.getArguments())
		{
			child(argument);
		}
		return null;
	}

	@Override
	public Void visitIdentifierExpression(IdentifierExpression expression)
	{
		line("Identifier " + expression.getName().getLexeme());
		return null;
	}

	@Override
	public Void visitLiteralExpression(LiteralExpression expression)
	{
		line("Literal " + expression.getKind() + " " + expression.getValue());
		return null;
	}

	@Override
	public Void visitGroupingExpression(GroupingExpression expression)
	{
		line("Grouping");
		child(expression.getExpression());
		return null;
	}
}
