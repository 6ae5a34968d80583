package gotoc.formatters;

import gotoc.UnsupportedNodeException;
import gotoc.model.golang.*;

import java.io.IOException;

/**
 * Renders a simple statement as an unterminated, unindented fragment. The statement formatter terminates
 * these with ";" and the for loop header splices them between its separators.
 */
public class CClauseFormattingVisitor extends GoStatementVisitor<String, IOException> {

	private static UnsupportedNodeException notAClause(String what) {
		return new UnsupportedNodeException(what + " cannot be written as a simple statement");
	}

	@Override
	public String visit(GoAssignmentStatement assignment) throws IOException {
		if (assignment.getNames().size() != 1 || assignment.getValues().size() != 1) {
			throw new UnsupportedNodeException("assignment of " + assignment.getValues().size()
					+ " value(s) to " + assignment.getNames().size() + " target(s), only single assignment is supported");
		}
		return FormattingTools.fragment(assignment.getNames().get(0))
				+ " " + assignment.getOperation().getToken() + " "
				+ FormattingTools.fragment(assignment.getValues().get(0));
	}

	@Override
	public String visit(GoIncDec incDec) throws IOException {
		return FormattingTools.fragment(incDec.getExpression()) + (incDec.isInc() ? "++" : "--");
	}

	@Override
	public String visit(GoExpressionStatement expressionStatement) throws IOException {
		return FormattingTools.fragment(expressionStatement.getExpression());
	}

	@Override
	public String visit(GoReturn goReturn) throws IOException {
		throw notAClause("return");
	}

	@Override
	public String visit(GoBlock block) throws IOException {
		throw notAClause("block");
	}

	@Override
	public String visit(GoFor goFor) throws IOException {
		throw notAClause("for loop");
	}

	@Override
	public String visit(GoIf goIf) throws IOException {
		throw notAClause("if statement");
	}

	@Override
	public String visit(GoBreak break1) throws IOException {
		throw notAClause("break");
	}

	@Override
	public String visit(GoContinue continue1) throws IOException {
		throw notAClause("continue");
	}

	@Override
	public String visit(GoDeclarationStatement declarationStatement) throws IOException {
		throw notAClause("declaration");
	}

}
