package gotoc.formatters;

import static org.junit.Assert.*;
import static gotoc.model.golang.GoBuilder.*;

import java.io.IOException;
import java.util.Arrays;

import org.junit.Test;

import gotoc.UnsupportedNodeException;
import gotoc.model.golang.GoAssignmentStatement;
import gotoc.model.golang.GoExpression;
import gotoc.model.golang.GoStatement;

public class CStatementFormattingVisitorTest {

	private static String format(GoStatement statement) throws IOException {
		IndentingBuffer out = new IndentingBuffer();
		statement.accept(new CStatementFormattingVisitor(out));
		assertEquals(0, out.getDepth());
		return out.toString();
	}

	@Test
	public void testExpressionStatement() throws IOException {
		assertEquals("f(x);\n", format(exprStmt(call("f", id("x")))));
	}

	@Test
	public void testAssignmentKeepsToken() throws IOException {
		assertEquals("x = 1;\n", format(assign(id("x"), num(1))));
		assertEquals("i := 0;\n", format(define("i", num(0))));
		assertEquals("p.x += (a*2);\n", format(assign(dot(id("p"), "x"), "+=", binop("*", id("a"), num(2)))));
		assertEquals("*p = xs[0];\n", format(assign(deref(id("p")), "=", index(id("xs"), num(0)))));
	}

	@Test(expected = UnsupportedNodeException.class)
	public void testMultipleAssignmentIsFatal() throws IOException {
		format(new GoAssignmentStatement(
				Arrays.<GoExpression>asList(id("a"), id("b")),
				GoAssignmentStatement.Operation.ASSIGN,
				Arrays.<GoExpression>asList(id("b"), id("a"))));
	}

	@Test
	public void testReturn() throws IOException {
		assertEquals("return (a+b);\n", format(ret(binop("+", id("a"), id("b")))));
		assertEquals("return;\n", format(ret()));
	}

	@Test(expected = UnsupportedNodeException.class)
	public void testMultipleReturnValuesIsFatal() throws IOException {
		format(ret(id("a"), id("b")));
	}

	@Test
	public void testIncDec() throws IOException {
		assertEquals("i++;\n", format(inc(id("i"))));
		assertEquals("xs[0]--;\n", format(dec(index(id("xs"), num(0)))));
	}

	@Test
	public void testBreakContinue() throws IOException {
		assertEquals("break;\n", format(brk()));
		assertEquals("continue;\n", format(cont()));
	}

	@Test
	public void testLocalDeclaration() throws IOException {
		assertEquals("int x;\n", format(declStmt(var("x", type("int")))));
		assertEquals("int buf[8];\n", format(declStmt(var("buf", array(num(8), type("int"))))));
		assertEquals("int n = (a+1);\n", format(declStmt(var("n", type("int"), binop("+", id("a"), num(1))))));
	}

	@Test
	public void testIf() throws IOException {
		assertEquals(
				"if ((x>0)) {\n" +
				"    y = 1;\n" +
				"}\n",
				format(ifStmt(binop(">", id("x"), num(0)), block(assign(id("y"), num(1))))));
	}

	@Test
	public void testIfElse() throws IOException {
		assertEquals(
				"if (ok) {\n" +
				"    f();\n" +
				"}\n" +
				"else\n" +
				"{\n" +
				"    g();\n" +
				"}\n",
				format(ifStmt(id("ok"), block(exprStmt(call("f"))), block(exprStmt(call("g"))))));
	}

	@Test
	public void testElseIfChain() throws IOException {
		GoStatement chain = ifStmt(binop("==", id("x"), num(1)), block(ret(str("one"))),
				ifStmt(binop("==", id("x"), num(2)), block(ret(str("two"))),
						ifStmt(binop("==", id("x"), num(3)), block(ret(str("three"))),
								block(ret(str("many"))))));
		assertEquals(
				"if ((x==1)) {\n" +
				"    return \"one\";\n" +
				"}\n" +
				"else if((x==2)) {\n" +
				"    return \"two\";\n" +
				"}\n" +
				"else if((x==3)) {\n" +
				"    return \"three\";\n" +
				"}\n" +
				"else\n" +
				"{\n" +
				"    return \"many\";\n" +
				"}\n",
				format(chain));
	}

	@Test
	public void testForHeader() throws IOException {
		String formatted = format(forStmt(define("i", num(0)), binop("<", id("i"), id("n")), inc(id("i")),
				block(exprStmt(call("f", id("i"))))));
		assertEquals("for (i := 0; (i<n); i++) {", formatted.split("\n")[0]);
		assertEquals(
				"for (i := 0; (i<n); i++) {\n" +
				"    f(i);\n" +
				"}\n",
				formatted);
	}

	@Test
	public void testForWithMissingClauses() throws IOException {
		assertEquals(
				"for (; (x>0); ) {\n" +
				"    x--;\n" +
				"}\n",
				format(forStmt(null, binop(">", id("x"), num(0)), null, block(dec(id("x"))))));
		assertEquals(
				"for (; ; ) {\n" +
				"    break;\n" +
				"}\n",
				format(forStmt(null, null, null, block(brk()))));
	}

	@Test
	public void testForClausesAreSimpleStatements() throws IOException {
		assertEquals("for (x = f(); ok; g(x)) {\n}\n",
				format(forStmt(assign(id("x"), call("f")), id("ok"), exprStmt(call("g", id("x"))), block())));
	}

	@Test(expected = UnsupportedNodeException.class)
	public void testReturnAsForClauseIsFatal() throws IOException {
		format(forStmt(ret(num(0)), id("ok"), null, block()));
	}

	@Test(expected = UnsupportedNodeException.class)
	public void testBlockAsForClauseIsFatal() throws IOException {
		format(forStmt(null, id("ok"), block(), block()));
	}

	@Test
	public void testNestedBlocks() throws IOException {
		GoStatement loop = forStmt(define("i", num(0)), binop("<", id("i"), num(3)), inc(id("i")), block(
				ifStmt(binop("==", id("i"), num(1)), block(cont())),
				block(exprStmt(call("f", id("i"))))));
		assertEquals(
				"for (i := 0; (i<3); i++) {\n" +
				"    if ((i==1)) {\n" +
				"        continue;\n" +
				"    }\n" +
				"    {\n" +
				"        f(i);\n" +
				"    }\n" +
				"}\n",
				format(loop));
	}

	@Test
	public void testEmptyBlock() throws IOException {
		assertEquals("{\n}\n", format(block()));
	}

	@Test
	public void testRespectsEnclosingDepth() throws IOException {
		IndentingBuffer out = new IndentingBuffer();
		out.indent();
		ifStmt(id("ok"), block(ret(num(1)))).accept(new CStatementFormattingVisitor(out));
		assertEquals(
				"    if (ok) {\n" +
				"        return 1;\n" +
				"    }\n",
				out.toString());
		assertEquals(1, out.getDepth());
	}

}
