package gotoc.formatters;

import gotoc.model.golang.*;

import java.io.IOException;

/**
 * Writes an expression as a single line of C with no indentation and no terminator.
 *
 * Binary operations are always parenthesised, so no precedence table is needed.
 */
public class CExpressionFormattingVisitor extends GoExpressionVisitor<Void, IOException> {

	private final IndentingBuffer out;

	public CExpressionFormattingVisitor(IndentingBuffer out) {
		this.out = out;
	}

	@Override
	public Void visit(GoVariableName v) throws IOException {
		out.write(v.getName());
		return null;
	}

	@Override
	public Void visit(GoBasicLiteral basicLiteral) throws IOException {
		out.write(basicLiteral.getValue());
		return null;
	}

	@Override
	public Void visit(GoIndexExpression index) throws IOException {
		index.getTarget().accept(this);
		out.write("[");
		index.getIndex().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(GoCall call) throws IOException {
		call.getTarget().accept(this);
		out.write("(");
		FormattingTools.writeCommaSeparated(out, call.getArguments(), arg -> out.write(FormattingTools.fragment(arg)));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(GoBinop binop) throws IOException {
		out.write("(");
		binop.getLHS().accept(this);
		out.write(binop.getOperation().getToken());
		binop.getRHS().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(GoUnary unary) throws IOException {
		out.write(unary.getOperation().getToken());
		unary.getTarget().accept(this);
		return null;
	}

	@Override
	public Void visit(GoDereference dereference) throws IOException {
		out.write("*");
		dereference.getTarget().accept(this);
		return null;
	}

	@Override
	public Void visit(GoSelectorExpression dot) throws IOException {
		// always ".", pointer bases are not rewritten to "->"
		dot.getLHS().accept(this);
		out.write(".");
		out.write(dot.getName());
		return null;
	}

	@Override
	public Void visit(GoParen paren) throws IOException {
		out.write("(");
		paren.getInner().accept(this);
		out.write(")");
		return null;
	}

}
