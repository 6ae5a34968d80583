package gotoc.formatters;

import gotoc.model.golang.GoExpression;
import gotoc.model.golang.type.GoType;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

public class FormattingTools {

	private FormattingTools() {}

	public interface Formatter<T>{
		void format(T param) throws IOException;
	}

	public static <T> void writeCommaSeparated(Writer out, List<T> items, Formatter<T> writer) throws IOException {
		boolean isFirst = true;
		for(T item : items) {
			if(!isFirst) {
				out.write(", ");
			}
			isFirst = false;
			writer.format(item);
		}
	}

	/**
	 * Renders expression into a scratch buffer of its own and returns the text
	 */
	public static String fragment(GoExpression expression) throws IOException {
		IndentingBuffer scratch = new IndentingBuffer();
		expression.accept(new CExpressionFormattingVisitor(scratch));
		return scratch.toString();
	}

	/**
	 * @return the C spelling of type when it is not attached to a name, e.g. "Node*"
	 */
	public static String typeText(GoType type) throws IOException {
		IndentingBuffer scratch = new IndentingBuffer();
		type.accept(new CTypeFormattingVisitor(scratch));
		return scratch.toString();
	}

	/**
	 * @return the C declarator for name of the given type, e.g. "int xs[4]" or "Node* next"
	 */
	public static String declarator(GoType type, String name) throws IOException {
		IndentingBuffer scratch = new IndentingBuffer();
		type.accept(new CDeclaratorFormattingVisitor(scratch, name));
		return scratch.toString();
	}

}
