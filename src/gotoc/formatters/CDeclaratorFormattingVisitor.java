package gotoc.formatters;

import gotoc.UnsupportedNodeException;
import gotoc.model.golang.GoExpression;
import gotoc.model.golang.type.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a type together with the name it declares: "int x", "Node* next", "int grid[3][4]".
 * The name may be null, for unnamed parameters.
 */
public class CDeclaratorFormattingVisitor extends GoTypeVisitor<Void, IOException> {

	private final IndentingBuffer out;
	private final String name;

	public CDeclaratorFormattingVisitor(IndentingBuffer out, String name) {
		this.out = out;
		this.name = name;
	}

	private void writeName() {
		if (name != null) {
			out.write(" ");
			out.write(name);
		}
	}

	@Override
	public Void visit(GoTypeName typeName) throws IOException {
		typeName.accept(new CTypeFormattingVisitor(out));
		writeName();
		return null;
	}

	@Override
	public Void visit(GoStructType structType) throws IOException {
		throw new UnsupportedNodeException("anonymous struct type for " + (name == null ? "unnamed declaration" : name));
	}

	@Override
	public Void visit(GoPtrType ptrType) throws IOException {
		ptrType.accept(new CTypeFormattingVisitor(out));
		writeName();
		return null;
	}

	@Override
	public Void visit(GoArrayType arrayType) throws IOException {
		// [2][3]int is declared as int name[2][3], outermost length first
		List<GoExpression> lengths = new ArrayList<>();
		GoType element = arrayType;
		while (element instanceof GoArrayType) {
			lengths.add(((GoArrayType) element).getLength());
			element = ((GoArrayType) element).getElementType();
		}
		element.accept(this);
		for (GoExpression length : lengths) {
			out.write("[");
			length.accept(new CExpressionFormattingVisitor(out));
			out.write("]");
		}
		return null;
	}

}
