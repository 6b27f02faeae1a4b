package org.lokray.sleaf.codegen;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.ast.declarations.FunctionDeclaration;
import org.lokray.sleaf.ast.declarations.Parameter;
import org.lokray.sleaf.ast.expressions.*;
import org.lokray.sleaf.ast.statements.*;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;
import org.lokray.sleaf.util.Debug;
import org.lokray.sleaf.util.ErrorReporter;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.*;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.*;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Lowers a SLEAF AST into an LLVM module.
 * <p>
 * Generation runs in two passes over the top level: every function signature is declared
 * first, so calls may refer to functions defined later, then every body is emitted.
 * A user function named {@code main} is renamed to {@value #USER_MAIN_NAME} and a native
 * {@code i32 main(i32, i8**)} entry point calling it is synthesized afterwards.
 * <p>
 * Errors are reported through the {@link ErrorReporter} and generation continues; a visit
 * that could not produce a value returns {@code null}. Check {@link #hadErrors()} before
 * trusting the module.
 */
public class LLVMIRGenerator implements ASTVisitor<LLVMValueRef>
{
	static final String USER_MAIN_NAME = "sleaf_main";

	private final ErrorReporter errorReporter;
	private final LLVMContextRef context;
	private final LLVMModuleRef module;
	private final LLVMBuilderRef builder;

	// --- State Management ---
	private final Map<String, LLVMValueRef> functions = new HashMap<>();
	private final Map<FunctionDeclaration, LLVMValueRef> declaredBodies = new IdentityHashMap<>();
	private final Map<String, LLVMValueRef> namedValues = new HashMap<>(); // Per-function, flat
	private LLVMValueRef currentFunction;
	private FunctionDeclaration currentDeclaration;
	private int parameterIndex;
	private boolean hasMainFunction = false;
	private int errorCount = 0;
	private boolean disposed = false;

	public LLVMIRGenerator(String moduleName, ErrorReporter errorReporter)
	{
		this.errorReporter = errorReporter;
		this.context = LLVMContextCreate();
		this.module = LLVMModuleCreateWithNameInContext(moduleName, context);
		this.builder = LLVMCreateBuilderInContext(context);

		BytePointer triple = LLVMGetDefaultTargetTriple();
		LLVMSetTarget(module, triple);
		LLVMDisposeMessage(triple);
	}

	/**
	 * Generates the module for a whole compilation unit.
	 *
	 * @param statements The top-level statements produced by the parser.
	 */
	public void generate(List<Statement> statements)
	{
		Debug.log("Starting LLVM IR Generation...");
		Debug.indent();
		try
		{
			Debug.log("Declaring function signatures...");
			for (Statement statement : statements)
			{
				if (statement instanceof FunctionDeclaration)
				{
					declareFunction((FunctionDeclaration) statement);
				}
			}

			Debug.log("Emitting function bodies...");
			for (Statement statement : statements)
			{
				if (statement instanceof FunctionDeclaration)
				{
					statement.accept(this);
				}
				else
				{
					error(statement.getFirstToken(), "Only function declarations are allowed at the top level");
				}
			}

			if (hasMainFunction)
			{
				emitEntryPoint();
			}
		}
		finally
		{
			Debug.dedent();
			Debug.log("LLVM IR Generation Finished.");
		}
	}

	// --- Declarations ---

	private void declareFunction(FunctionDeclaration declaration)
	{
		String name = declaration.getName().getLexeme();
		if (functions.containsKey(name))
		{
			error(declaration.getName(), "Function '" + name + "' is already declared");
			return;
		}

		List<LLVMTypeRef> parameterTypes = new ArrayList<>();
		for (Parameter parameter : declaration.getParameters())
		{
			if (parameter.getType().getType() == TokenType.VOID)
			{
				error(parameter.getType(), "Parameter '" + parameter.getName().getLexeme() + "' cannot have type void");
				return;
			}
			parameterTypes.add(getLLVMType(parameter.getType().getType()));
		}

		String llvmName = name;
		if (name.equals("main"))
		{
			llvmName = USER_MAIN_NAME;
			hasMainFunction = true;
			Debug.log("Renamed user 'main' to '%s'", USER_MAIN_NAME);
		}
		LLVMTypeRef functionType = LLVMFunctionType(getLLVMType(declaration.getReturnKind()), toPointerPointer(parameterTypes), parameterTypes.size(), 0);
		LLVMValueRef function = LLVMAddFunction(module, llvmName, functionType);

		for (int i = 0; i < declaration.getParameters().size(); i++)
		{
			LLVMSetValueName(LLVMGetParam(function, i), declaration.getParameters().get(i).getName().getLexeme());
		}

		functions.put(name, function);
		declaredBodies.put(declaration, function);
		Debug.log("Declared function '%s' with %d parameter(s)", llvmName, parameterTypes.size());
	}

	/**
	 * Emits {@code i32 main(i32 argc, i8** argv)} which calls the renamed user main.
	 */
	private void emitEntryPoint()
	{
		Debug.log("Generating native 'main' entry point...");
		LLVMValueRef userMain = functions.get("main");
		if (LLVMCountParams(userMain) != 0)
		{
			errorReporter.error("Function 'main' must not take parameters");
			errorCount++;
			return;
		}

		LLVMTypeRef i32 = LLVMInt32TypeInContext(context);
		LLVMTypeRef argvType = LLVMPointerType(LLVMPointerType(LLVMInt8TypeInContext(context), 0), 0);
		LLVMTypeRef entryType = LLVMFunctionType(i32, toPointerPointer(List.of(i32, argvType)), 2, 0);
		LLVMValueRef entry = LLVMAddFunction(module, "main", entryType);
		LLVMSetValueName(LLVMGetParam(entry, 0), "argc");
		LLVMSetValueName(LLVMGetParam(entry, 1), "argv");

		LLVMPositionBuilderAtEnd(builder, LLVMAppendBasicBlockInContext(context, entry, "entry"));
		LLVMTypeRef userMainType = LLVMGlobalGetValueType(userMain);
		boolean returnsVoid = LLVMGetTypeKind(LLVMGetReturnType(userMainType)) == LLVMVoidTypeKind;
		LLVMValueRef result = LLVMBuildCall2(builder, userMainType, userMain, (PointerPointer<?>) null, 0, returnsVoid ? "" : "result");

		if (returnsVoid)
		{
			LLVMBuildRet(builder, LLVMConstInt(i32, 0, 0));
		}
		else
		{
			LLVMValueRef status = coerce(result, i32, null);
			LLVMBuildRet(builder, status != null ? status : LLVMConstInt(i32, 0, 0));
		}
	}

	@Override
	public LLVMValueRef visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		String name = declaration.getName().getLexeme();
		Debug.log("Visiting FunctionDeclaration: %s", name);

		// Nested declarations are never declared; the enclosing function's state must survive them.
		LLVMValueRef function = declaredBodies.get(declaration);
		if (function == null)
		{
			error(declaration.getName(), "No declaration found for the body of function '" + name + "'");
			return null;
		}

		Debug.indent();
		try
		{
			currentFunction = function;
			currentDeclaration = declaration;
			namedValues.clear();

			LLVMBasicBlockRef entry = LLVMAppendBasicBlockInContext(context, function, "entry");
			LLVMPositionBuilderAtEnd(builder, entry);

			parameterIndex = 0;
			for (Parameter parameter : declaration.getParameters())
			{
				parameter.accept(this);
				parameterIndex++;
			}

			declaration.getBody().accept(this);

			LLVMBasicBlockRef lastBlock = LLVMGetInsertBlock(builder);
			if (isNull(LLVMGetBasicBlockTerminator(lastBlock)))
			{
				if (declaration.getReturnKind() == TokenType.VOID)
				{
					Debug.log("-> No terminator found. Adding implicit 'ret void'.");
					LLVMBuildRetVoid(builder);
				}
				else if (!lastBlock.equals(entry) && isNull(LLVMGetFirstUse(LLVMBasicBlockAsValue(lastBlock))))
				{
					// Nothing branches here, every path already returned.
					LLVMBuildUnreachable(builder);
				}
				else
				{
					error(declaration.getName(), "Function " + name + " does not return a value");
					LLVMBuildUnreachable(builder);
				}
			}

			if (LLVMVerifyFunction(function, LLVMReturnStatusAction) != 0)
			{
				errorReporter.warning("LLVM verification failed for function '" + name + "'");
			}
			return function;
		}
		finally
		{
			currentFunction = null;
			currentDeclaration = null;
			Debug.dedent();
		}
	}

	/**
	 * Spills the parameter at {@link #parameterIndex} into a stack slot so it can be
	 * assigned like any local.
	 */
	@Override
	public LLVMValueRef visitParameter(Parameter parameter)
	{
		String name = parameter.getName().getLexeme();
		Debug.log("Materializing parameter '%s'", name);
		LLVMValueRef incoming = LLVMGetParam(currentFunction, parameterIndex);
		LLVMValueRef slot = createEntryBlockAlloca(LLVMTypeOf(incoming), name + "_addr");
		LLVMBuildStore(builder, incoming, slot);
		namedValues.put(name, slot);
		return slot;
	}

	// --- Statements ---

	@Override
	public LLVMValueRef visitBlockStatement(BlockStatement statement)
	{
		Debug.log("Visiting BlockStatement (%d statements)", statement.getStatements().size());
		Debug.indent();
		try
		{
			for (Statement inner : statement.getStatements())
			{
				if (!isNull(LLVMGetBasicBlockTerminator(LLVMGetInsertBlock(builder))))
				{
					Debug.log("-> Block already terminated, skipping unreachable statements.");
					break;
				}
				inner.accept(this);
			}
			return null;
		}
		finally
		{
			Debug.dedent();
		}
	}

	@Override
	public LLVMValueRef visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		String name = statement.getName().getLexeme();
		Debug.log("Visiting VariableDeclarationStatement: %s", name);
		Debug.indent();
		try
		{
			if (statement.getInitializer() == null)
			{
				Debug.log("-> No initializer, nothing is allocated.");
				return null;
			}

			LLVMTypeRef type = getLLVMType(statement.getType().getType());
			if (LLVMGetTypeKind(type) == LLVMVoidTypeKind)
			{
				error(statement.getType(), "Variable '" + name + "' cannot have type void");
				return null;
			}

			LLVMValueRef initial = statement.getInitializer().accept(this);
			if (initial == null)
			{
				return null;
			}
			LLVMValueRef converted = coerce(initial, type, statement.getName());
			if (converted == null)
			{
				return null;
			}

			LLVMValueRef slot = createEntryBlockAlloca(type, name);
			LLVMBuildStore(builder, converted, slot);
			namedValues.put(name, slot);
			return slot;
		}
		finally
		{
			Debug.dedent();
		}
	}

	@Override
	public LLVMValueRef visitIfStatement(IfStatement statement)
	{
		Debug.log("Visiting IfStatement");
		Debug.indent();
		try
		{
			LLVMValueRef condition = toCondition(statement.getCondition().accept(this), statement.getFirstToken());
			if (condition == null)
			{
				return null;
			}

			LLVMBasicBlockRef thenBlock = LLVMAppendBasicBlockInContext(context, currentFunction, "then");
			LLVMBasicBlockRef elseBlock = LLVMAppendBasicBlockInContext(context, currentFunction, "else");
			LLVMBasicBlockRef mergeBlock = LLVMAppendBasicBlockInContext(context, currentFunction, "ifcont");

			LLVMBuildCondBr(builder, condition, thenBlock, elseBlock);

			LLVMPositionBuilderAtEnd(builder, thenBlock);
			statement.getThenBranch().accept(this);
			branchIfOpen(mergeBlock);

			LLVMPositionBuilderAtEnd(builder, elseBlock);
			if (statement.getElseBranch() != null)
			{
				statement.getElseBranch().accept(this);
			}
			branchIfOpen(mergeBlock);

			LLVMPositionBuilderAtEnd(builder, mergeBlock);
			return null;
		}
		finally
		{
			Debug.dedent();
		}
	}

	@Override
	public LLVMValueRef visitWhileStatement(WhileStatement statement)
	{
		Debug.log("Visiting WhileStatement");
		Debug.indent();
		try
		{
			emitLoop(statement.getFirstToken(), statement.getCondition(), statement.getBody(), null);
			return null;
		}
		finally
		{
			Debug.dedent();
		}
	}

	/**
	 * The parser desugars 'for' loops, but a programmatically built ForStatement is lowered
	 * the same way: initializer, then a while loop whose body ends with the increment.
	 */
	@Override
	public LLVMValueRef visitForStatement(ForStatement statement)
	{
		Debug.log("Visiting ForStatement");
		Debug.indent();
		try
		{
			if (statement.getInitializer() != null)
			{
				statement.getInitializer().accept(this);
			}
			emitLoop(statement.getFirstToken(), statement.getCondition(), statement.getBody(), statement.getIncrement());
			return null;
		}
		finally
		{
			Debug.dedent();
		}
	}

	/**
	 * Emits {@code loop_cond -> loop_body -> loop_cond} with the exit edge to {@code after_loop}.
	 * A null condition loops forever.
	 */
	private void emitLoop(Token where, Expression conditionExpression, Statement body, Expression increment)
	{
		LLVMBasicBlockRef conditionBlock = LLVMAppendBasicBlockInContext(context, currentFunction, "loop_cond");
		LLVMBasicBlockRef bodyBlock = LLVMAppendBasicBlockInContext(context, currentFunction, "loop_body");
		LLVMBasicBlockRef afterBlock = LLVMAppendBasicBlockInContext(context, currentFunction, "after_loop");

		LLVMBuildBr(builder, conditionBlock);
		LLVMPositionBuilderAtEnd(builder, conditionBlock);

		if (conditionExpression == null)
		{
			LLVMBuildBr(builder, bodyBlock);
		}
		else
		{
			LLVMValueRef condition = toCondition(conditionExpression.accept(this), where);
			if (condition == null)
			{
				LLVMBuildBr(builder, afterBlock);
				LLVMPositionBuilderAtEnd(builder, afterBlock);
				return;
			}
			LLVMBuildCondBr(builder, condition, bodyBlock, afterBlock);
		}

		LLVMPositionBuilderAtEnd(builder, bodyBlock);
		body.accept(this);
		if (increment != null && isNull(LLVMGetBasicBlockTerminator(LLVMGetInsertBlock(builder))))
		{
			increment.accept(this);
		}
		branchIfOpen(conditionBlock);

		LLVMPositionBuilderAtEnd(builder, afterBlock);
	}

	@Override
	public LLVMValueRef visitReturnStatement(ReturnStatement statement)
	{
		Debug.log("Visiting ReturnStatement");
		Debug.indent();
		try
		{
			TokenType returnKind = currentDeclaration.getReturnKind();
			if (statement.getValue() == null)
			{
				if (returnKind != TokenType.VOID)
				{
					error(statement.getFirstToken(), "Function " + currentDeclaration.getName().getLexeme() + " must return a value");
					return LLVMBuildRet(builder, LLVMGetUndef(getLLVMType(returnKind)));
				}
				return LLVMBuildRetVoid(builder);
			}

			LLVMValueRef value = statement.getValue().accept(this);
			if (returnKind == TokenType.VOID)
			{
				if (value != null)
				{
					error(statement.getFirstToken(), "Void function " + currentDeclaration.getName().getLexeme() + " cannot return a value");
				}
				return LLVMBuildRetVoid(builder);
			}

			LLVMTypeRef returnType = getLLVMType(returnKind);
			LLVMValueRef converted = value != null ? coerce(value, returnType, statement.getFirstToken()) : null;
			// A failed value was already reported; keep the block terminated.
			return LLVMBuildRet(builder, converted != null ? converted : LLVMGetUndef(returnType));
		}
		finally
		{
			Debug.dedent();
		}
	}

	@Override
	public LLVMValueRef visitExpressionStatement(ExpressionStatement statement)
	{
		Debug.log("Visiting ExpressionStatement");
		Debug.indent();
		try
		{
			statement.getExpression().accept(this);
			return null;
		}
		finally
		{
			Debug.dedent();
		}
	}

	// --- Expressions ---

	@Override
	public LLVMValueRef visitBinaryExpression(BinaryExpression expression)
	{
		TokenType op = expression.getOperator().getType();
		Debug.log("Visiting BinaryExpression: '%s'", expression.getOperator().getLexeme());
		Debug.indent();
		errorReporter.pushExpression("binary", expression.toString());
		try
		{
			switch (op)
			{
				case QUESTION:
					return emitTernary(expression);
				case AND_AND:
				case OR_OR:
					return emitShortCircuit(expression, op == TokenType.AND_AND);
				case COLON:
					error(expression.getOperator(), "Unexpected ':' outside of a conditional expression");
					return null;
				default:
					break;
			}

			LLVMValueRef left = expression.getLeft().accept(this);
			LLVMValueRef right = expression.getRight().accept(this);
			if (left == null || right == null)
			{
				return null;
			}

			LLVMTypeRef common = commonType(LLVMTypeOf(left), LLVMTypeOf(right), expression.getOperator());
			if (common == null)
			{
				return null;
			}
			left = coerce(left, common, expression.getOperator());
			right = coerce(right, common, expression.getOperator());
			if (left == null || right == null)
			{
				return null;
			}

			int kind = LLVMGetTypeKind(common);
			boolean isFloat = kind == LLVMFloatTypeKind || kind == LLVMDoubleTypeKind;
			boolean isPointer = kind == LLVMPointerTypeKind;

			switch (op)
			{
				case EQUAL_EQUAL:
					return isFloat ? LLVMBuildFCmp(builder, LLVMRealOEQ, left, right, "eqtmp") : LLVMBuildICmp(builder, LLVMIntEQ, left, right, "eqtmp");
				case BANG_EQUAL:
					return isFloat ? LLVMBuildFCmp(builder, LLVMRealONE, left, right, "netmp") : LLVMBuildICmp(builder, LLVMIntNE, left, right, "netmp");
				default:
					break;
			}

			if (isPointer)
			{
				error(expression.getOperator(), "Operator '" + expression.getOperator().getLexeme() + "' cannot be applied to strings");
				return null;
			}

			switch (op)
			{
				case PLUS:
					return isFloat ? LLVMBuildFAdd(builder, left, right, "addtmp") : LLVMBuildAdd(builder, left, right, "addtmp");
				case MINUS:
					return isFloat ? LLVMBuildFSub(builder, left, right, "subtmp") : LLVMBuildSub(builder, left, right, "subtmp");
				case STAR:
					return isFloat ? LLVMBuildFMul(builder, left, right, "multmp") : LLVMBuildMul(builder, left, right, "multmp");
				case SLASH:
					return isFloat ? LLVMBuildFDiv(builder, left, right, "divtmp") : LLVMBuildSDiv(builder, left, right, "divtmp");
				case PERCENT:
					return isFloat ? LLVMBuildFRem(builder, left, right, "remtmp") : LLVMBuildSRem(builder, left, right, "remtmp");
				case LESS:
					return isFloat ? LLVMBuildFCmp(builder, LLVMRealOLT, left, right, "lttmp") : LLVMBuildICmp(builder, LLVMIntSLT, left, right, "lttmp");
				case LESS_EQUAL:
					return isFloat ? LLVMBuildFCmp(builder, LLVMRealOLE, left, right, "letmp") : LLVMBuildICmp(builder, LLVMIntSLE, left, right, "letmp");
				case GREATER:
					return isFloat ? LLVMBuildFCmp(builder, LLVMRealOGT, left, right, "gttmp") : LLVMBuildICmp(builder, LLVMIntSGT, left, right, "gttmp");
				case GREATER_EQUAL:
					return isFloat ? LLVMBuildFCmp(builder, LLVMRealOGE, left, right, "getmp") : LLVMBuildICmp(builder, LLVMIntSGE, left, right, "getmp");
				case AMPERSAND:
				case PIPE:
					if (isFloat)
					{
						error(expression.getOperator(), "Bitwise operator '" + expression.getOperator().getLexeme() + "' requires integer operands");
						return null;
					}
					return op == TokenType.AMPERSAND ? LLVMBuildAnd(builder, left, right, "andtmp") : LLVMBuildOr(builder, left, right, "ortmp");
				default:
					error(expression.getOperator(), "Unsupported binary operator '" + expression.getOperator().getLexeme() + "'");
					return null;
			}
		}
		finally
		{
			Debug.dedent();
		}
	}

	/**
	 * {@code a && b} / {@code a || b}: the right side is only evaluated when needed and the
	 * result is merged with a phi.
	 */
	private LLVMValueRef emitShortCircuit(BinaryExpression expression, boolean isAnd)
	{
		LLVMValueRef left = toCondition(expression.getLeft().accept(this), expression.getOperator());
		if (left == null)
		{
			return null;
		}

		LLVMBasicBlockRef startBlock = LLVMGetInsertBlock(builder);
		LLVMBasicBlockRef rhsBlock = LLVMAppendBasicBlockInContext(context, currentFunction, "shortcircuit_rhs");
		LLVMBasicBlockRef endBlock = LLVMAppendBasicBlockInContext(context, currentFunction, "shortcircuit_end");

		if (isAnd)
		{
			LLVMBuildCondBr(builder, left, rhsBlock, endBlock);
		}
		else
		{
			LLVMBuildCondBr(builder, left, endBlock, rhsBlock);
		}

		LLVMPositionBuilderAtEnd(builder, rhsBlock);
		LLVMValueRef right = toCondition(expression.getRight().accept(this), expression.getOperator());
		LLVMTypeRef i1 = LLVMInt1TypeInContext(context);
		if (right == null)
		{
			right = LLVMGetUndef(i1);
		}
		LLVMBasicBlockRef rhsFinalBlock = LLVMGetInsertBlock(builder);
		LLVMBuildBr(builder, endBlock);

		LLVMPositionBuilderAtEnd(builder, endBlock);
		LLVMValueRef phi = LLVMBuildPhi(builder, i1, "logic_result");
		LLVMValueRef shortValue = LLVMConstInt(i1, isAnd ? 0 : 1, 0);
		addIncoming(phi, new LLVMValueRef[]{shortValue, right}, new LLVMBasicBlockRef[]{startBlock, rhsFinalBlock});
		return phi;
	}

	/**
	 * {@code c ? a : b}, stored as {@code Binary(?, c, Binary(:, a, b))}. Both arms are
	 * converted to a common type before branching into the merge block.
	 */
	private LLVMValueRef emitTernary(BinaryExpression expression)
	{
		if (!(expression.getRight() instanceof BinaryExpression)
				|| ((BinaryExpression) expression.getRight()).getOperator().getType() != TokenType.COLON)
		{
			error(expression.getOperator(), "Malformed conditional expression");
			return null;
		}
		BinaryExpression arms = (BinaryExpression) expression.getRight();

		LLVMValueRef condition = toCondition(expression.getLeft().accept(this), expression.getOperator());
		if (condition == null)
		{
			return null;
		}

		LLVMBasicBlockRef thenBlock = LLVMAppendBasicBlockInContext(context, currentFunction, "tern_then");
		LLVMBasicBlockRef elseBlock = LLVMAppendBasicBlockInContext(context, currentFunction, "tern_else");
		LLVMBasicBlockRef endBlock = LLVMAppendBasicBlockInContext(context, currentFunction, "tern_end");
		LLVMBuildCondBr(builder, condition, thenBlock, elseBlock);

		LLVMPositionBuilderAtEnd(builder, thenBlock);
		LLVMValueRef thenValue = arms.getLeft().accept(this);
		LLVMBasicBlockRef thenEnd = LLVMGetInsertBlock(builder);

		LLVMPositionBuilderAtEnd(builder, elseBlock);
		LLVMValueRef elseValue = arms.getRight().accept(this);
		LLVMBasicBlockRef elseEnd = LLVMGetInsertBlock(builder);

		LLVMTypeRef common = null;
		if (thenValue != null && elseValue != null)
		{
			common = commonType(LLVMTypeOf(thenValue), LLVMTypeOf(elseValue), arms.getOperator());
		}

		LLVMPositionBuilderAtEnd(builder, thenEnd);
		if (common != null)
		{
			thenValue = coerce(thenValue, common, arms.getOperator());
		}
		LLVMBuildBr(builder, endBlock);

		LLVMPositionBuilderAtEnd(builder, elseEnd);
		if (common != null)
		{
			elseValue = coerce(elseValue, common, arms.getOperator());
		}
		LLVMBuildBr(builder, endBlock);

		LLVMPositionBuilderAtEnd(builder, endBlock);
		if (common == null || thenValue == null || elseValue == null)
		{
			return null;
		}
		LLVMValueRef phi = LLVMBuildPhi(builder, common, "tern_result");
		addIncoming(phi, new LLVMValueRef[]{thenValue, elseValue}, new LLVMBasicBlockRef[]{thenEnd, elseEnd});
		return phi;
	}

	@Override
	public LLVMValueRef visitAssignmentExpression(AssignmentExpression expression)
	{
		String name = expression.getName().getLexeme();
		Debug.log("Visiting AssignmentExpression: %s %s", name, expression.getOperator().getLexeme());
		Debug.indent();
		errorReporter.pushExpression("assign", expression.toString());
		try
		{
			LLVMValueRef slot = namedValues.get(name);
			if (slot == null)
			{
				error(expression.getName(), "Unknown variable name '" + name + "'");
				return null;
			}

			LLVMValueRef value = expression.getValue().accept(this);
			if (value == null)
			{
				return null;
			}

			LLVMTypeRef targetType = LLVMGetAllocatedType(slot);
			value = coerce(value, targetType, expression.getOperator());
			if (value == null)
			{
				return null;
			}

			if (expression.isCompound())
			{
				LLVMValueRef current = LLVMBuildLoad2(builder, targetType, slot, name);
				int kind = LLVMGetTypeKind(targetType);
				if (kind == LLVMFloatTypeKind || kind == LLVMDoubleTypeKind)
				{
					value = LLVMBuildFAdd(builder, current, value, "addtmp");
				}
				else if (kind == LLVMIntegerTypeKind)
				{
					value = LLVMBuildAdd(builder, current, value, "addtmp");
				}
				else
				{
					error(expression.getOperator(), "Operator '+=' cannot be applied to '" + name + "'");
					return null;
				}
			}

			LLVMBuildStore(builder, value, slot);
			return value;
		}
		finally
		{
			Debug.dedent();
		}
	}

	@Override
	public LLVMValueRef visitUnaryExpression(UnaryExpression expression)
	{
		Token operator = expression.getOperator();
		Debug.log("Visiting UnaryExpression: '%s'%s", operator.getLexeme(), expression.isPostfix() ? " (postfix)" : "");
		Debug.indent();
		errorReporter.pushExpression("unary", expression.toString());
		try
		{
			if (operator.getType() == TokenType.PLUS_PLUS)
			{
				return emitIncrement(expression);
			}

			LLVMValueRef operand = expression.getOperand().accept(this);
			if (operand == null)
			{
				return null;
			}

			switch (operator.getType())
			{
				case MINUS:
				{
					int kind = LLVMGetTypeKind(LLVMTypeOf(operand));
					if (kind == LLVMFloatTypeKind || kind == LLVMDoubleTypeKind)
					{
						return LLVMBuildFNeg(builder, operand, "negtmp");
					}
					if (kind == LLVMIntegerTypeKind)
					{
						return LLVMBuildNeg(builder, operand, "negtmp");
					}
					error(operator, "Unary '-' requires a numeric operand");
					return null;
				}
				case BANG:
				{
					LLVMValueRef condition = toCondition(operand, operator);
					return condition != null ? LLVMBuildNot(builder, condition, "nottmp") : null;
				}
				default:
					error(operator, "Unsupported unary operator '" + operator.getLexeme() + "'");
					return null;
			}
		}
		finally
		{
			Debug.dedent();
		}
	}

	/**
	 * {@code ++x} yields the incremented value, {@code x++} the value before the increment.
	 */
	private LLVMValueRef emitIncrement(UnaryExpression expression)
	{
		Token operator = expression.getOperator();
		if (!(expression.getOperand() instanceof IdentifierExpression))
		{
			error(operator, "Invalid increment target");
			return null;
		}

		Token name = ((IdentifierExpression) expression.getOperand()).getName();
		LLVMValueRef slot = namedValues.get(name.getLexeme());
		if (slot == null)
		{
			error(name, "Unknown variable name '" + name.getLexeme() + "'");
			return null;
		}

		LLVMTypeRef type = LLVMGetAllocatedType(slot);
		LLVMValueRef oldValue = LLVMBuildLoad2(builder, type, slot, name.getLexeme());
		LLVMValueRef newValue;
		int kind = LLVMGetTypeKind(type);
		if (kind == LLVMFloatTypeKind || kind == LLVMDoubleTypeKind)
		{
			newValue = LLVMBuildFAdd(builder, oldValue, LLVMConstReal(type, 1.0), "inctmp");
		}
		else if (kind == LLVMIntegerTypeKind)
		{
			newValue = LLVMBuildAdd(builder, oldValue, LLVMConstInt(type, 1, 0), "inctmp");
		}
		else
		{
			error(operator, "Operator '++' requires a numeric variable");
			return null;
		}
		LLVMBuildStore(builder, newValue, slot);
		return expression.isPostfix() ? oldValue : newValue;
	}

	@Override
	public LLVMValueRef visitCallExpression(CallExpression expression)
	{
		Debug.log("Visiting CallExpression: %s", expression.getCallee());
		Debug.indent();
		errorReporter.pushExpression("call", expression.toString());
		try
		{
			List<LLVMValueRef> arguments = new ArrayList<>();
			boolean argumentsValid = true;
			for (Expression argument : expression.getArguments())
			{
				LLVMValueRef value = argument.accept(this);
				argumentsValid &= value != null;
				arguments.add(value);
			}

			LLVMValueRef function = null;
			if (expression.getCallee() instanceof IdentifierExpression)
			{
				function = functions.get(((IdentifierExpression) expression.getCallee()).getName().getLexeme());
			}
			if (function == null)
			{
				error(expression.getCallee().getFirstToken(), "Call to non-function '" + expression.getCallee() + "'");
				return null;
			}
			if (!argumentsValid)
			{
				return null;
			}

			int expected = LLVMCountParams(function);
			if (expected != arguments.size())
			{
				error(expression.getClosingParen(), "Function '" + expression.getCallee() + "' expects " + expected + " argument(s) but got " + arguments.size());
				return null;
			}

			for (int i = 0; i < arguments.size(); i++)
			{
				LLVMValueRef converted = coerce(arguments.get(i), LLVMTypeOf(LLVMGetParam(function, i)), expression.getArguments().get(i).getFirstToken());
				if (converted == null)
				{
					return null;
				}
				arguments.set(i, converted);
			}

			LLVMTypeRef functionType = LLVMGlobalGetValueType(function);
			boolean returnsVoid = LLVMGetTypeKind(LLVMGetReturnType(functionType)) == LLVMVoidTypeKind;
			return LLVMBuildCall2(builder, functionType, function, toPointerPointer(arguments), arguments.size(), returnsVoid ? "" : "calltmp");
		}
		finally
		{
			Debug.dedent();
		}
	}

	@Override
	public LLVMValueRef visitIdentifierExpression(IdentifierExpression expression)
	{
		String name = expression.getName().getLexeme();
		Debug.log("Visiting IdentifierExpression: %s", name);
		LLVMValueRef slot = namedValues.get(name);
		if (slot == null)
		{
			error(expression.getName(), "Unknown variable name '" + name + "'");
			return null;
		}
		return LLVMBuildLoad2(builder, LLVMGetAllocatedType(slot), slot, name);
	}

	@Override
	public LLVMValueRef visitLiteralExpression(LiteralExpression expression)
	{
		Debug.log("Visiting LiteralExpression: %s", expression.getValue());
		Token literal = expression.getLiteral();
		switch (expression.getKind())
		{
			case TRUE:
				return LLVMConstInt(LLVMInt1TypeInContext(context), 1, 0);
			case FALSE:
				return LLVMConstInt(LLVMInt1TypeInContext(context), 0, 0);
			case INT_LITERAL:
				return integerConstant(literal);
			case FLOAT_LITERAL:
				try
				{
					double value = Double.parseDouble(literal.getLexeme().replace("_", ""));
					return LLVMConstReal(LLVMDoubleTypeInContext(context), value);
				}
				catch (NumberFormatException e)
				{
					error(literal, "Invalid floating-point literal '" + literal.getLexeme() + "'");
					return null;
				}
			case STRING_LITERAL:
			{
				String raw = literal.getLexeme();
				String text = LiteralDecoder.decode(raw.substring(1, raw.length() - 1));
				return LLVMBuildGlobalStringPtr(builder, text, ".str");
			}
			case CHAR_LITERAL:
			{
				String raw = literal.getLexeme();
				String text = LiteralDecoder.decode(raw.substring(1, raw.length() - 1));
				if (text.length() != 1)
				{
					error(literal, "Invalid character literal " + raw);
					return null;
				}
				return LLVMConstInt(LLVMInt8TypeInContext(context), text.charAt(0) & 0xFF, 0);
			}
			default:
				error(literal, "Unsupported literal '" + literal.getLexeme() + "'");
				return null;
		}
	}

	/**
	 * Integer literals are i32 unless the value needs 64 bits. Hex and binary literals
	 * keep their radix and '_' separators are dropped.
	 */
	private LLVMValueRef integerConstant(Token literal)
	{
		String digits = literal.getLexeme().replace("_", "");
		int radix = 10;
		if (digits.startsWith("0x") || digits.startsWith("0X"))
		{
			radix = 16;
			digits = digits.substring(2);
		}
		else if (digits.startsWith("0b") || digits.startsWith("0B"))
		{
			radix = 2;
			digits = digits.substring(2);
		}

		BigInteger value;
		try
		{
			value = new BigInteger(digits, radix);
		}
		catch (NumberFormatException e)
		{
			error(literal, "Invalid integer literal '" + literal.getLexeme() + "'");
			return null;
		}

		if (value.bitLength() > 64)
		{
			error(literal, "Integer literal '" + literal.getLexeme() + "' does not fit in 64 bits");
			return null;
		}
		if (value.bitLength() <= 31)
		{
			return LLVMConstInt(LLVMInt32TypeInContext(context), value.longValue(), 1);
		}
		return LLVMConstInt(LLVMInt64TypeInContext(context), value.longValue(), 1);
	}

	@Override
	public LLVMValueRef visitGroupingExpression(GroupingExpression expression)
	{
		return expression.getExpression().accept(this);
	}

	// --- Types and conversions ---

	LLVMTypeRef getLLVMType(TokenType type)
	{
		switch (type)
		{
			case I8:
			case U8:
			case CHAR:
				return LLVMInt8TypeInContext(context);
			case I16:
			case U16:
				return LLVMInt16TypeInContext(context);
			case I64:
			case U64:
				return LLVMInt64TypeInContext(context);
			case F32:
				return LLVMFloatTypeInContext(context);
			case F64:
				return LLVMDoubleTypeInContext(context);
			case BOOL:
				return LLVMInt1TypeInContext(context);
			case STRING:
				return LLVMPointerType(LLVMInt8TypeInContext(context), 0);
			case VOID:
				return LLVMVoidTypeInContext(context);
			case I32:
			case U32:
			default:
				return LLVMInt32TypeInContext(context);
		}
	}

	/**
	 * Picks the type both operands are converted to: the widest float if either side is
	 * floating, otherwise the widest integer.
	 */
	private LLVMTypeRef commonType(LLVMTypeRef left, LLVMTypeRef right, Token where)
	{
		if (left.equals(right))
		{
			return left;
		}
		int leftKind = LLVMGetTypeKind(left);
		int rightKind = LLVMGetTypeKind(right);
		if (leftKind == LLVMDoubleTypeKind || rightKind == LLVMDoubleTypeKind)
		{
			return LLVMDoubleTypeInContext(context);
		}
		if (leftKind == LLVMFloatTypeKind || rightKind == LLVMFloatTypeKind)
		{
			boolean otherIsWideInt = (leftKind == LLVMIntegerTypeKind && LLVMGetIntTypeWidth(left) > 16)
					|| (rightKind == LLVMIntegerTypeKind && LLVMGetIntTypeWidth(right) > 16);
			return otherIsWideInt ? LLVMDoubleTypeInContext(context) : LLVMFloatTypeInContext(context);
		}
		if (leftKind == LLVMIntegerTypeKind && rightKind == LLVMIntegerTypeKind)
		{
			return LLVMGetIntTypeWidth(left) >= LLVMGetIntTypeWidth(right) ? left : right;
		}
		error(where, "Incompatible operand types");
		return null;
	}

	/**
	 * Converts a value to the target type: integer widening/narrowing, int/float conversion
	 * and float widening/narrowing. Conversion to bool compares against zero.
	 *
	 * @return The converted value, or null (after reporting) when no conversion exists.
	 */
	private LLVMValueRef coerce(LLVMValueRef value, LLVMTypeRef target, Token where)
	{
		LLVMTypeRef source = LLVMTypeOf(value);
		if (source.equals(target))
		{
			return value;
		}

		int sourceKind = LLVMGetTypeKind(source);
		int targetKind = LLVMGetTypeKind(target);
		boolean sourceFloat = sourceKind == LLVMFloatTypeKind || sourceKind == LLVMDoubleTypeKind;
		boolean targetFloat = targetKind == LLVMFloatTypeKind || targetKind == LLVMDoubleTypeKind;

		if (sourceKind == LLVMVoidTypeKind)
		{
			error(where, "A void value cannot be used here");
			return null;
		}
		if (targetKind == LLVMIntegerTypeKind && LLVMGetIntTypeWidth(target) == 1 && (sourceKind == LLVMIntegerTypeKind || sourceFloat))
		{
			return toCondition(value, where);
		}
		if (sourceKind == LLVMIntegerTypeKind && targetKind == LLVMIntegerTypeKind)
		{
			int sourceWidth = LLVMGetIntTypeWidth(source);
			int targetWidth = LLVMGetIntTypeWidth(target);
			if (sourceWidth < targetWidth)
			{
				return sourceWidth == 1 ? LLVMBuildZExt(builder, value, target, "zexttmp") : LLVMBuildSExt(builder, value, target, "sexttmp");
			}
			return LLVMBuildTrunc(builder, value, target, "trunctmp");
		}
		if (sourceKind == LLVMIntegerTypeKind && targetFloat)
		{
			return LLVMGetIntTypeWidth(source) == 1 ? LLVMBuildUIToFP(builder, value, target, "fptmp") : LLVMBuildSIToFP(builder, value, target, "fptmp");
		}
		if (sourceFloat && targetKind == LLVMIntegerTypeKind)
		{
			return LLVMBuildFPToSI(builder, value, target, "inttmp");
		}
		if (sourceFloat && targetFloat)
		{
			return sourceKind == LLVMFloatTypeKind ? LLVMBuildFPExt(builder, value, target, "fpexttmp") : LLVMBuildFPTrunc(builder, value, target, "fptrunctmp");
		}
		if (sourceKind == LLVMPointerTypeKind && targetKind == LLVMPointerTypeKind)
		{
			return value;
		}

		error(where, "Cannot convert value to the expected type");
		return null;
	}

	/**
	 * Turns any scalar into an i1 suitable for a branch by comparing it against zero.
	 */
	private LLVMValueRef toCondition(LLVMValueRef value, Token where)
	{
		if (value == null)
		{
			return null;
		}
		LLVMTypeRef type = LLVMTypeOf(value);
		int kind = LLVMGetTypeKind(type);
		if (kind == LLVMIntegerTypeKind)
		{
			if (LLVMGetIntTypeWidth(type) == 1)
			{
				return value;
			}
			return LLVMBuildICmp(builder, LLVMIntNE, value, LLVMConstInt(type, 0, 0), "tobool");
		}
		if (kind == LLVMFloatTypeKind || kind == LLVMDoubleTypeKind)
		{
			return LLVMBuildFCmp(builder, LLVMRealONE, value, LLVMConstReal(type, 0.0), "tobool");
		}
		if (kind == LLVMPointerTypeKind)
		{
			return LLVMBuildICmp(builder, LLVMIntNE, value, LLVMConstNull(type), "tobool");
		}
		error(where, "Value cannot be used as a condition");
		return null;
	}

	// --- Helpers ---

	/**
	 * Allocas go to the top of the entry block so loops don't grow the stack.
	 */
	private LLVMValueRef createEntryBlockAlloca(LLVMTypeRef type, String name)
	{
		LLVMBuilderRef entryBuilder = LLVMCreateBuilderInContext(context);
		try
		{
			LLVMBasicBlockRef entry = LLVMGetEntryBasicBlock(currentFunction);
			LLVMValueRef first = LLVMGetFirstInstruction(entry);
			if (isNull(first))
			{
				LLVMPositionBuilderAtEnd(entryBuilder, entry);
			}
			else
			{
				LLVMPositionBuilderBefore(entryBuilder, first);
			}
			return LLVMBuildAlloca(entryBuilder, type, name);
		}
		finally
		{
			LLVMDisposeBuilder(entryBuilder);
		}
	}

	private void branchIfOpen(LLVMBasicBlockRef target)
	{
		if (isNull(LLVMGetBasicBlockTerminator(LLVMGetInsertBlock(builder))))
		{
			LLVMBuildBr(builder, target);
		}
	}

	private void addIncoming(LLVMValueRef phi, LLVMValueRef[] values, LLVMBasicBlockRef[] blocks)
	{
		PointerPointer<LLVMValueRef> phiValues = new PointerPointer<>(values);
		PointerPointer<LLVMBasicBlockRef> phiBlocks = new PointerPointer<>(blocks);
		LLVMAddIncoming(phi, phiValues, phiBlocks, values.length);
	}

	private static PointerPointer<Pointer> toPointerPointer(List<? extends Pointer> items)
	{
		if (items.isEmpty())
		{
			return null;
		}
		return new PointerPointer<>(items.toArray(new Pointer[0]));
	}

	private static boolean isNull(Pointer pointer)
	{
		return pointer == null || pointer.isNull();
	}

	private void error(Token where, String message)
	{
		errorCount++;
		if (where != null)
		{
			errorReporter.report(where.getLine(), where.getColumn(), message);
		}
		else
		{
			errorReporter.error(message);
		}
	}

	// --- Output ---

	/**
	 * @return True if any error was reported while generating this module.
	 */
	public boolean hadErrors()
	{
		return errorCount > 0;
	}

	public int getErrorCount()
	{
		return errorCount;
	}

	/**
	 * Runs the LLVM module verifier.
	 *
	 * @return True if the module is well formed. Failures are reported as warnings.
	 */
	public boolean verifyModule()
	{
		BytePointer verificationError = new BytePointer((Pointer) null);
		try
		{
			if (LLVMVerifyModule(module, LLVMReturnStatusAction, verificationError) != 0)
			{
				errorReporter.warning("LLVM module verification failed: " + verificationError.getString());
				return false;
			}
			return true;
		}
		finally
		{
			LLVMDisposeMessage(verificationError);
		}
	}

	/**
	 * @return The module rendered in the textual IR format.
	 */
	public String getModuleIR()
	{
		BytePointer irString = LLVMPrintModuleToString(module);
		try
		{
			return irString.getString();
		}
		finally
		{
			LLVMDisposeMessage(irString);
		}
	}

	/**
	 * Writes the textual IR to a file. Nothing is reported when the file cannot be written;
	 * the caller checks the return value.
	 *
	 * @return True when the file was written.
	 */
	public boolean writeToFile(Path path)
	{
		BytePointer fileWriteError = new BytePointer((Pointer) null);
		try
		{
			if (LLVMPrintModuleToFile(module, path.toString(), fileWriteError) != 0)
			{
				Debug.log("Error writing IR to file: %s", fileWriteError.getString());
				return false;
			}
			Debug.log("Wrote LLVM IR to %s", path);
			return true;
		}
		finally
		{
			LLVMDisposeMessage(fileWriteError);
		}
	}

	/**
	 * Releases the native builder, module and context. The generator is unusable afterwards.
	 */
	public void dispose()
	{
		if (disposed)
		{
			return;
		}
		disposed = true;
		Debug.log("Disposing LLVM resources...");
		LLVMDisposeBuilder(builder);
		LLVMDisposeModule(module);
		LLVMContextDispose(context);
	}
}
