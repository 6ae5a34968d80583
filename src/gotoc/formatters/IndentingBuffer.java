package gotoc.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * Accumulates emitted text along with the current indentation depth.
 *
 * Plain {@link #write} calls append text exactly as given; only {@link #writeLine(String)} prefixes the
 * current indentation. Nothing reaches the final destination until {@link #writeTo(Writer)}.
 */
public class IndentingBuffer extends Writer {

	public static final int DEFAULT_INDENT = 4;
	public static final String LINE_SEPARATOR = "\n";

	private final StringBuilder text = new StringBuilder();
	private final int indentUnit;
	private int depth = 0;

	public static class Indent implements AutoCloseable {

		IndentingBuffer buffer;

		public Indent(IndentingBuffer buffer) {
			this.buffer = buffer;
		}

		@Override
		public void close() {
			buffer.unindent();
		}

	}

	public IndentingBuffer() {
		this(DEFAULT_INDENT);
	}

	/**
	 * @param indentUnit number of spaces written per indentation level
	 */
	public IndentingBuffer(int indentUnit) {
		if (indentUnit < 0) {
			throw new IllegalArgumentException("indent unit must not be negative, was " + indentUnit);
		}
		this.indentUnit = indentUnit;
	}

	/**
	 * Increases the depth by one level
	 *
	 * @return an AutoCloseable that will reverse the indent when closed
	 */
	public Indent indent() {
		depth++;
		return new Indent(this);
	}

	/**
	 * Decreases the depth by one level. Extra calls at depth 0 are ignored.
	 */
	public void unindent() {
		if (depth > 0) {
			depth--;
		}
	}

	public int getDepth() {
		return depth;
	}

	/**
	 * Writes the current indentation, then fragment, then a line separator
	 */
	public void writeLine(String fragment) {
		for (int i = 0; i < depth * indentUnit; ++i) {
			text.append(' ');
		}
		write(fragment);
		write(LINE_SEPARATOR);
	}

	@Override
	public void write(char[] chars, int offset, int len) {
		text.append(chars, offset, len);
	}

	@Override
	public void write(String str) {
		text.append(str);
	}

	/**
	 * Copies everything accumulated so far to out and flushes it
	 */
	public void writeTo(Writer out) throws IOException {
		out.write(text.toString());
		out.flush();
	}

	@Override
	public void flush() {
	}

	@Override
	public void close() {
	}

	@Override
	public String toString() {
		return text.toString();
	}

}
