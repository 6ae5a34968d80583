package gotoc.formatters;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringWriter;

import org.junit.Test;

public class IndentingBufferTest {

	@Test
	public void testWriteAddsNoIndentation() {
		IndentingBuffer out = new IndentingBuffer();
		out.indent();
		out.write("a");
		out.write("b");
		assertEquals("ab", out.toString());
	}

	@Test
	public void testWriteLineIndentsByDepth() {
		IndentingBuffer out = new IndentingBuffer();
		out.writeLine("zero");
		try (IndentingBuffer.Indent ignored = out.indent()) {
			out.writeLine("one");
			try (IndentingBuffer.Indent ignored2 = out.indent()) {
				out.writeLine("two");
			}
		}
		out.writeLine("back");
		assertEquals("zero\n    one\n        two\nback\n", out.toString());
		assertEquals(0, out.getDepth());
	}

	@Test
	public void testCustomIndentUnit() {
		IndentingBuffer out = new IndentingBuffer(2);
		out.indent();
		out.writeLine("x");
		assertEquals("  x\n", out.toString());
	}

	@Test
	public void testUnindentClampsAtZero() {
		IndentingBuffer out = new IndentingBuffer();
		out.unindent();
		out.unindent();
		assertEquals(0, out.getDepth());
		out.indent();
		assertEquals(1, out.getDepth());
		out.writeLine("x");
		assertEquals("    x\n", out.toString());
	}

	@Test
	public void testWriteLineAfterPartialLine() {
		IndentingBuffer out = new IndentingBuffer();
		out.indent();
		out.write("head ");
		out.writeLine("tail");
		assertEquals("head     tail\n", out.toString());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeIndentUnit() {
		new IndentingBuffer(-1);
	}

	@Test
	public void testWriteToCopiesEverything() throws IOException {
		IndentingBuffer out = new IndentingBuffer();
		out.writeLine("int x;");
		out.writeLine("int y;");
		StringWriter sink = new StringWriter();
		out.writeTo(sink);
		assertEquals("int x;\nint y;\n", sink.toString());
	}

}
