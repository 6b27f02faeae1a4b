package org.lokray.sleaf.codegen;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.sleaf.ast.declarations.FunctionDeclaration;
import org.lokray.sleaf.ast.expressions.BinaryExpression;
import org.lokray.sleaf.ast.expressions.IdentifierExpression;
import org.lokray.sleaf.ast.expressions.LiteralExpression;
import org.lokray.sleaf.ast.expressions.UnaryExpression;
import org.lokray.sleaf.ast.statements.BlockStatement;
import org.lokray.sleaf.ast.statements.ForStatement;
import org.lokray.sleaf.ast.statements.Statement;
import org.lokray.sleaf.ast.statements.VariableDeclarationStatement;
import org.lokray.sleaf.lexer.Lexer;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;
import org.lokray.sleaf.parser.SleafParser;
import org.lokray.sleaf.util.ErrorReporter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LLVMIRGeneratorTest
{
	private final ByteArrayOutputStream errors = new ByteArrayOutputStream();
	private final ErrorReporter errorReporter = new ErrorReporter(
			new PrintStream(new ByteArrayOutputStream()), new PrintStream(errors, true));
	private LLVMIRGenerator generator;

	@AfterEach
	void tearDown()
	{
		if (generator != null)
		{
			generator.dispose();
		}
	}

	private String compile(String source)
	{
		SleafParser parser = new SleafParser(new Lexer(source), errorReporter);
		List<Statement> statements = parser.parse();
		assertThat(parser.hadError()).as("parse errors: %s", errorOutput()).isFalse();

		generator = new LLVMIRGenerator("test", errorReporter);
		generator.generate(statements);
		return generator.getModuleIR();
	}

	private String errorOutput()
	{
		return errors.toString(StandardCharsets.UTF_8);
	}

	@Test
	void wrapsUserMainInNativeEntryPoint()
	{
		String ir = compile("func main() -> i32 { return 0; }");

		assertThat(generator.hadErrors()).isFalse();
		assertThat(ir).contains("define i32 @sleaf_main()");
		assertThat(ir).contains("define i32 @main(i32 %argc, ptr %argv)");
		assertThat(ir).contains("call i32 @sleaf_main()");
		assertThat(generator.verifyModule()).isTrue();
	}

	@Test
	void voidMainReturnsZeroFromEntryPoint()
	{
		String ir = compile("func main() { }");

		assertThat(generator.hadErrors()).isFalse();
		assertThat(ir).contains("define void @sleaf_main()");
		assertThat(ir).contains("ret void");
		assertThat(ir).contains("call void @sleaf_main()");
		assertThat(ir).contains("ret i32 0");
	}

	@Test
	void noEntryPointWithoutMain()
	{
		String ir = compile("func helper() -> i32 { return 1; }");

		assertThat(ir).contains("define i32 @helper()");
		assertThat(ir).doesNotContain("@main");
	}

	@Test
	void mainWithParametersIsRejected()
	{
		compile("func main(a: i32) -> i32 { return a; }");

		assertThat(generator.hadErrors()).isTrue();
		assertThat(errorOutput()).contains("Function 'main' must not take parameters");
	}

	@Test
	void resolvesForwardReferences()
	{
		String ir = compile(
				"func main() -> i32 { return twice(21); }\n"
						+ "func twice(x: i32) -> i32 { return x * 2; }");

		assertThat(generator.hadErrors()).isFalse();
		assertThat(ir).contains("call i32 @twice(i32 21)");
		assertThat(generator.verifyModule()).isTrue();
	}

	@Test
	void spillsParametersToStackSlots()
	{
		String ir = compile("func id(x: i64) -> i64 { return x; }");

		assertThat(ir).contains("define i64 @id(i64 %x)");
		assertThat(ir).contains("%x_addr = alloca i64");
		assertThat(ir).contains("store i64 %x, ptr %x_addr");
	}

	@Test
	void reportsUnknownVariableOnce()
	{
		compile("func main() -> i32 { return y; }");

		assertThat(generator.getErrorCount()).isEqualTo(1);
		assertThat(errorOutput()).contains("Line 1, Column 29: Unknown variable name 'y'");
	}

	@Test
	void reportsCallToNonFunction()
	{
		compile("func main() -> i32 { return missing(1); }");

		assertThat(generator.hadErrors()).isTrue();
		assertThat(errorOutput()).contains("Call to non-function 'missing'");
	}

	@Test
	void reportsArgumentCountMismatch()
	{
		compile("func f(a: i32) -> i32 { return a; }\nfunc g() -> i32 { return f(1, 2); }");

		assertThat(errorOutput()).contains("Function 'f' expects 1 argument(s) but got 2");
	}

	@Test
	void reportsMissingReturn()
	{
		compile("func f() -> i32 { var x: i32 = 1; }");

		assertThat(generator.hadErrors()).isTrue();
		assertThat(errorOutput()).contains("Function f does not return a value");
	}

	@Test
	void reportsDuplicateFunction()
	{
		compile("func f() { }\nfunc f() { }");

		assertThat(errorOutput()).contains("Function 'f' is already declared");
	}

	@Test
	void rejectsTopLevelStatements()
	{
		compile("var x: i32 = 1;\nfunc main() -> i32 { return 0; }");

		assertThat(generator.hadErrors()).isTrue();
		assertThat(errorOutput()).contains("Only function declarations are allowed at the top level");
	}

	@Test
	void lowersIfElseWithMergeBlock()
	{
		String ir = compile(
				"func sign(x: i32) -> i32 {\n"
						+ "  var r: i32 = 0;\n"
						+ "  if (x < 0) { r = -1; } else { r = 1; }\n"
						+ "  return r;\n"
						+ "}");

		assertThat(generator.hadErrors()).isFalse();
		assertThat(ir).contains("icmp slt i32");
		assertThat(ir).contains("then:", "else:", "ifcont:");
		assertThat(generator.verifyModule()).isTrue();
	}

	@Test
	void branchesThatReturnDoNotNeedTrailingReturn()
	{
		compile("func pick(c: bool) -> i32 { if (c) { return 1; } else { return 2; } }");

		assertThat(generator.hadErrors()).isFalse();
		assertThat(generator.verifyModule()).isTrue();
	}

	@Test
	void lowersWhileAndDesugaredForLoops()
	{
		String ir = compile(
				"func sum(n: i32) -> i32 {\n"
						+ "  var total: i32 = 0;\n"
						+ "  for (var i: i32 = 0; i < n; i++) { total += i; }\n"
						+ "  while (total > 100) { total = total - 100; }\n"
						+ "  return total;\n"
						+ "}");

		assertThat(generator.hadErrors()).isFalse();
		assertThat(ir).contains("loop_cond:", "loop_body:", "after_loop:");
		assertThat(generator.verifyModule()).isTrue();
	}

	@Test
	void integerConditionsAreComparedWithZero()
	{
		String ir = compile("func f(x: i32) -> i32 { while (x) { x = x - 1; } return x; }");

		assertThat(ir).contains("icmp ne i32");
		assertThat(generator.verifyModule()).isTrue();
	}

	@Test
	void shortCircuitOperatorsUsePhi()
	{
		String ir = compile("func both(a: bool, b: bool) -> bool { return a && b || a; }");

		assertThat(generator.hadErrors()).isFalse();
		assertThat(ir).contains("phi i1");
		assertThat(ir).contains("shortcircuit_rhs");
		assertThat(generator.verifyModule()).isTrue();
	}

	@Test
	void ternaryUnifiesArmTypes()
	{
		String ir = compile("func f(c: bool) -> f64 { return c ? 1 : 2.5; }");

		assertThat(generator.hadErrors()).isFalse();
		assertThat(ir).contains("tern_then:", "tern_else:", "tern_end:");
		assertThat(ir).contains("phi double");
		assertThat(generator.verifyModule()).isTrue();
	}

	@Test
	void convertsValuesToDeclaredTypes()
	{
		String ir = compile(
				"func f(x: f64) -> i32 { return x; }\n"
						+ "func g(x: i32) -> f64 { var wide: i64 = x; return wide; }");

		assertThat(generator.hadErrors()).isFalse();
		assertThat(ir).contains("fptosi double");
		assertThat(ir).contains("sext i32");
		assertThat(ir).contains("sitofp i64");
		assertThat(generator.verifyModule()).isTrue();
	}

	@Test
	void valuesHexAndBinaryLiteralsWithTheirRadix()
	{
		String ir = compile("func a() -> i32 { return 0xFF; }\nfunc b() -> i32 { return 0b1_010; }");

		assertThat(ir).contains("ret i32 255");
		assertThat(ir).contains("ret i32 10");
	}

	@Test
	void largeLiteralsBecomeSixtyFourBit()
	{
		String ir = compile("func big() -> i64 { return 5000000000; }");

		assertThat(ir).contains("ret i64 5000000000");
	}

	@Test
	void prefixAndPostfixIncrementYieldDifferentValues()
	{
		String ir = compile(
				"func f() -> i32 { var i: i32 = 1; var a: i32 = i++; var b: i32 = ++i; return a + b; }");

		assertThat(generator.hadErrors()).isFalse();
		assertThat(ir).contains("add i32");
		assertThat(generator.verifyModule()).isTrue();
	}

	@Test
	void emitsStringAndCharConstants()
	{
		String ir = compile(
				"func greet() -> string { return \"hi\\n\"; }\n"
						+ "func letter() -> char { return 'a'; }");

		assertThat(generator.hadErrors()).isFalse();
		assertThat(ir).contains("c\"hi\\0A\\00\"");
		assertThat(ir).contains("ret i8 97");
	}

	@Test
	void returningValueFromVoidFunctionIsAnError()
	{
		compile("func f() { return 1; }");

		assertThat(errorOutput()).contains("Void function f cannot return a value");
	}

	@Test
	void recordsExpressionHistory()
	{
		compile("func f(a: i32) -> i32 { return a + 1; }");

		assertThat(errorReporter.getTraceback()).anyMatch(entry -> entry.startsWith("binary"));
	}

	@Test
	void writesModuleToFile(@TempDir Path tempDir) throws IOException
	{
		compile("func main() -> i32 { return 7; }");
		Path irFile = tempDir.resolve("out.ll");

		assertThat(generator.writeToFile(irFile)).isTrue();
		assertThat(Files.readString(irFile)).contains("define i32 @main(i32 %argc, ptr %argv)");
	}

	@Test
	void nestedFunctionIsReportedWithoutLosingEnclosingFunction()
	{
		String ir = compile("func main() -> i32 { func g() { } return 0; }");

		assertThat(generator.getErrorCount()).isEqualTo(1);
		assertThat(errorOutput()).contains("No declaration found for the body of function 'g'");
		assertThat(ir).contains("define i32 @sleaf_main()").contains("ret i32 0");
	}

	@Test
	void rejectsVoidParameter()
	{
		String ir = compile("func f(x: void) { }");

		assertThat(generator.hadErrors()).isTrue();
		assertThat(errorOutput()).contains("Parameter 'x' cannot have type void");
		assertThat(ir).doesNotContain("@f(");
	}

	@Test
	void mainWithVoidParameterGetsNoEntryPoint()
	{
		String ir = compile("func main(x: void) -> i32 { return 0; }");

		assertThat(errorOutput()).contains("Parameter 'x' cannot have type void");
		assertThat(ir).doesNotContain("@main(").doesNotContain("@sleaf_main(");
	}

	@Test
	void variableWithoutInitializerIsNotAllocated()
	{
		String ir = compile("func f() -> i32 { var x: i32; return x; }");

		assertThat(generator.getErrorCount()).isEqualTo(1);
		assertThat(errorOutput()).contains("Unknown variable name 'x'");
		assertThat(ir).doesNotContain("%x = alloca");
	}

	@Test
	void writeToUnwritablePathFailsQuietly(@TempDir Path tempDir)
	{
		compile("func main() -> i32 { return 7; }");

		assertThat(generator.writeToFile(tempDir.resolve("missing").resolve("out.ll"))).isFalse();
		assertThat(errorOutput()).isEmpty();
	}

	@Test
	void lowersForStatementBuiltWithoutParser()
	{
		Token i = new Token(TokenType.IDENTIFIER, "i", 1, 1);
		Statement init = new VariableDeclarationStatement(new Token(TokenType.VAR, "var", 1, 1), i,
				new Token(TokenType.I32, "i32", 1, 1), new LiteralExpression(new Token(TokenType.INT_LITERAL, "0", 1, 1)));
		BinaryExpression condition = new BinaryExpression(new IdentifierExpression(i),
				new Token(TokenType.LESS, "<", 1, 1), new LiteralExpression(new Token(TokenType.INT_LITERAL, "3", 1, 1)));
		UnaryExpression increment = new UnaryExpression(new Token(TokenType.PLUS_PLUS, "++", 1, 1), new IdentifierExpression(i), true);
		Token brace = new Token(TokenType.LEFT_BRACE, "{", 1, 1);
		ForStatement loop = new ForStatement(new Token(TokenType.FOR, "for", 1, 1), init, condition, increment,
				new BlockStatement(brace, List.of()));
		FunctionDeclaration function = new FunctionDeclaration(new Token(TokenType.FUNC, "func", 1, 1),
				new Token(TokenType.IDENTIFIER, "count", 1, 1), List.of(), null, new BlockStatement(brace, List.of(loop)));

		generator = new LLVMIRGenerator("test", errorReporter);
		generator.generate(List.of(function));

		assertThat(generator.hadErrors()).isFalse();
		assertThat(generator.getModuleIR()).contains("define void @count()", "loop_cond:", "after_loop:");
		assertThat(generator.verifyModule()).isTrue();
	}
}
