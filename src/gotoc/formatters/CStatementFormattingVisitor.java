package gotoc.formatters;

import gotoc.UnsupportedNodeException;
import gotoc.model.golang.*;

import java.io.IOException;
import java.util.List;

public class CStatementFormattingVisitor extends GoStatementVisitor<Void, IOException> {

	private final IndentingBuffer out;

	public CStatementFormattingVisitor(IndentingBuffer out) {
		this.out = out;
	}

	/**
	 * Writes opener and "{" on one line, the statements one level deeper, then "}".
	 *
	 * @param opener header text preceding the brace, empty to put the brace on its own line
	 */
	public void formatBlock(String opener, GoBlock block) throws IOException {
		out.writeLine(opener + "{");
		try (IndentingBuffer.Indent ignored = out.indent()) {
			for (GoStatement stmt : block.getStatements()) {
				stmt.accept(this);
			}
		}
		out.writeLine("}");
	}

	private void writeSimpleStatement(GoStatement statement) throws IOException {
		out.writeLine(statement.accept(new CClauseFormattingVisitor()) + ";");
	}

	private String clause(GoStatement statement) throws IOException {
		if (statement == null) {
			return "";
		}
		return statement.accept(new CClauseFormattingVisitor());
	}

	@Override
	public Void visit(GoAssignmentStatement assignment) throws IOException {
		writeSimpleStatement(assignment);
		return null;
	}

	@Override
	public Void visit(GoReturn goReturn) throws IOException {
		List<GoExpression> values = goReturn.getValues();
		if (values.isEmpty()) {
			out.writeLine("return;");
		} else if (values.size() == 1) {
			out.writeLine("return " + FormattingTools.fragment(values.get(0)) + ";");
		} else {
			throw new UnsupportedNodeException("return of " + values.size() + " values, at most one is supported");
		}
		return null;
	}

	@Override
	public Void visit(GoBlock block) throws IOException {
		formatBlock("", block);
		return null;
	}

	@Override
	public Void visit(GoFor goFor) throws IOException {
		String init = clause(goFor.getInit());
		String cond = goFor.getCondition() == null ? "" : FormattingTools.fragment(goFor.getCondition());
		String post = clause(goFor.getIncrement());
		formatBlock("for (" + init + "; " + cond + "; " + post + ") ", goFor.getBody());
		return null;
	}

	private void formatIf(String keyword, GoIf goIf) throws IOException {
		formatBlock(keyword + FormattingTools.fragment(goIf.getCond()) + ") ", goIf.getThen());
		GoStatement otherwise = goIf.getElse();
		if (otherwise == null) {
			return;
		}
		if (otherwise instanceof GoIf) {
			formatIf("else if(", (GoIf) otherwise);
		} else if (otherwise instanceof GoBlock) {
			out.writeLine("else");
			formatBlock("", (GoBlock) otherwise);
		} else {
			throw new UnsupportedNodeException("else branch must be an if statement or a block");
		}
	}

	@Override
	public Void visit(GoIf goIf) throws IOException {
		formatIf("if (", goIf);
		return null;
	}

	@Override
	public Void visit(GoIncDec incDec) throws IOException {
		writeSimpleStatement(incDec);
		return null;
	}

	@Override
	public Void visit(GoExpressionStatement expressionStatement) throws IOException {
		writeSimpleStatement(expressionStatement);
		return null;
	}

	@Override
	public Void visit(GoBreak break1) throws IOException {
		out.writeLine("break;");
		return null;
	}

	@Override
	public Void visit(GoContinue continue1) throws IOException {
		out.writeLine("continue;");
		return null;
	}

	@Override
	public Void visit(GoDeclarationStatement declarationStatement) throws IOException {
		declarationStatement.getDeclaration().accept(new CDeclarationFormattingVisitor(out));
		return null;
	}
}
