package gotoc.formatters;

import static org.junit.Assert.*;
import static gotoc.model.golang.GoBuilder.*;

import org.junit.Test;

import gotoc.model.golang.GoModule;

public class GoNodeDumpingVisitorTest {

	@Test
	public void testDumpShowsStructure() {
		GoModule module = module("main",
				importDecl("os"),
				func("inc", params(param("p", ptr(type("int")))), params(),
						block(assign(deref(id("p")), "+=", num(1)))));
		assertEquals(
				"GoModule main\n" +
				"  declarations: (2)\n" +
				"    GoImportDeclaration \"os\"\n" +
				"    GoFunctionDeclaration inc\n" +
				"      arguments: (1)\n" +
				"        GoFunctionParameter p\n" +
				"          GoPtrType\n" +
				"            GoTypeName int\n" +
				"      results: (0)\n" +
				"      body:\n" +
				"        GoBlock\n" +
				"          statements: (1)\n" +
				"            GoAssignmentStatement +=\n" +
				"              names: (1)\n" +
				"                GoDereference\n" +
				"                  GoVariableName p\n" +
				"              values: (1)\n" +
				"                GoBasicLiteral 1\n",
				module.toString());
	}

	@Test
	public void testDumpShowsMissingChildren() {
		String dumped = forStmt(null, id("ok"), null, block()).toString();
		assertEquals(
				"GoFor\n" +
				"  init: nil\n" +
				"  cond:\n" +
				"    GoVariableName ok\n" +
				"  post: nil\n" +
				"  body:\n" +
				"    GoBlock\n" +
				"      statements: (0)\n",
				dumped);
	}

	@Test
	public void testDumpOfExpressionsAndTypes() {
		assertEquals(
				"GoCall\n" +
				"  target:\n" +
				"    GoSelectorExpression .Println\n" +
				"      GoVariableName fmt\n" +
				"  arguments: (1)\n" +
				"    GoBinop *\n" +
				"      GoUnary -\n" +
				"        GoVariableName x\n" +
				"      GoIndexExpression\n" +
				"        GoVariableName xs\n" +
				"        GoBasicLiteral 0\n",
				call(dot(id("fmt"), "Println"), binop("*", unary("-", id("x")), index(id("xs"), num(0)))).toString());
		assertEquals(
				"GoTypeDeclaration Grid\n" +
				"  GoArrayType\n" +
				"    length:\n" +
				"      GoBasicLiteral 3\n" +
				"    element:\n" +
				"      GoStructType\n" +
				"        fields: (1)\n" +
				"          GoStructTypeField v\n" +
				"            GoTypeName int\n",
				typeDecl("Grid", array(num(3), struct(field("v", type("int"))))).toString());
	}

}
