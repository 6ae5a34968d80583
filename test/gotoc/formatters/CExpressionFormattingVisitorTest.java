package gotoc.formatters;

import static org.junit.Assert.*;
import static gotoc.model.golang.GoBuilder.*;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import gotoc.model.golang.GoExpression;

@RunWith(Parameterized.class)
public class CExpressionFormattingVisitorTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
			{ num(42), "42" },
			{ lit("0x1F"), "0x1F" },
			{ lit("'a'"), "'a'" },
			{ str("hello\\n"), "\"hello\\n\"" },
			{ id("x"), "x" },
			{ dot(id("p"), "x"), "p.x" },
			// pointer bases keep the dot
			{ dot(deref(id("p")), "x"), "*p.x" },
			{ dot(paren(deref(id("p"))), "x"), "(*p).x" },
			{ unary("-", paren(unary("-", id("y")))), "-(-y)" },
			{ deref(paren(index(id("ps"), num(0)))), "*(ps[0])" },
			{ dot(dot(id("a"), "b"), "c"), "a.b.c" },
			{ binop("+", id("a"), id("b")), "(a+b)" },
			{ binop("*", binop("+", id("a"), id("b")), id("c")), "((a+b)*c)" },
			{ binop("+", id("a"), binop("*", id("b"), id("c"))), "(a+(b*c))" },
			{ binop("&&", binop("<", id("a"), id("b")), binop("!=", id("c"), id("d"))), "((a<b)&&(c!=d))" },
			{ binop("&^", id("a"), id("b")), "(a&^b)" },
			{ binop("<<", num(1), id("n")), "(1<<n)" },
			{ unary("-", id("x")), "-x" },
			{ unary("!", binop("==", id("a"), id("b"))), "!(a==b)" },
			{ unary("&", id("v")), "&v" },
			{ unary("^", id("mask")), "^mask" },
			{ deref(id("p")), "*p" },
			{ deref(deref(id("pp"))), "**pp" },
			{ index(id("xs"), id("i")), "xs[i]" },
			{ index(id("xs"), binop("+", id("i"), num(1))), "xs[(i+1)]" },
			{ index(index(id("grid"), num(1)), num(2)), "grid[1][2]" },
			{ call("f"), "f()" },
			{ call("f", id("a"), binop("-", id("b"), num(1))), "f(a, (b-1))" },
			{ call(dot(id("fmt"), "Println"), str("x"), call("g", id("y"))), "fmt.Println(\"x\", g(y))" },
			{ binop("+", call("f", id("x")), index(id("xs"), num(0))), "(f(x)+xs[0])" },
		});
	}

	private final GoExpression expression;
	private final String expected;

	public CExpressionFormattingVisitorTest(GoExpression expression, String expected) {
		this.expression = expression;
		this.expected = expected;
	}

	@Test
	public void test() throws IOException {
		IndentingBuffer out = new IndentingBuffer();
		out.indent();
		expression.accept(new CExpressionFormattingVisitor(out));
		assertEquals(expected, out.toString());
	}

}
