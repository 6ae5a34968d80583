package gotoc.formatters;

import gotoc.UnsupportedNodeException;
import gotoc.model.golang.type.*;

import java.io.IOException;

/**
 * Writes a type in positions where C has no name to attach it to: return types, typedef targets, pointees.
 */
public class CTypeFormattingVisitor extends GoTypeVisitor<Void, IOException> {

	private final IndentingBuffer out;

	public CTypeFormattingVisitor(IndentingBuffer out) {
		this.out = out;
	}

	@Override
	public Void visit(GoTypeName typeName) throws IOException {
		out.write(typeName.getName());
		return null;
	}

	@Override
	public Void visit(GoStructType structType) throws IOException {
		throw new UnsupportedNodeException("anonymous struct types can only be emitted as named type declarations");
	}

	@Override
	public Void visit(GoPtrType ptrType) throws IOException {
		ptrType.getPointee().accept(this);
		out.write("*");
		return null;
	}

	@Override
	public Void visit(GoArrayType arrayType) throws IOException {
		throw new UnsupportedNodeException("array type of length "
				+ FormattingTools.fragment(arrayType.getLength())
				+ " can only be emitted in a variable, field, parameter or type declaration");
	}

}
