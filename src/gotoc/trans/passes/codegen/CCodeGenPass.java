package gotoc.trans.passes.codegen;

import gotoc.formatters.CNodeFormattingVisitor;
import gotoc.formatters.IndentingBuffer;
import gotoc.model.golang.GoModule;

import java.io.IOException;

public class CCodeGenPass {
	private CCodeGenPass() {}

	/**
	 * Renders every top-level declaration of module, in order, into a fresh buffer. Nothing is written
	 * anywhere else; the caller flushes the returned buffer once.
	 *
	 * @param indentUnit spaces per nesting level
	 * @throws gotoc.UnsupportedNodeException at the first shape that has no C rendering
	 */
	public static IndentingBuffer perform(GoModule module, int indentUnit) throws IOException {
		IndentingBuffer out = new IndentingBuffer(indentUnit);
		module.accept(new CNodeFormattingVisitor(out));
		return out;
	}

	public static IndentingBuffer perform(GoModule module) throws IOException {
		return perform(module, IndentingBuffer.DEFAULT_INDENT);
	}

}
