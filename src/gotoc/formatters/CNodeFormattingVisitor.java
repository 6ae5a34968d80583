package gotoc.formatters;

import gotoc.model.golang.*;
import gotoc.model.golang.type.GoStructTypeField;
import gotoc.model.golang.type.GoType;

import java.io.IOException;

public class CNodeFormattingVisitor extends GoNodeVisitor<Void, IOException> {

	private final IndentingBuffer out;

	public CNodeFormattingVisitor(IndentingBuffer out) {
		this.out = out;
	}

	@Override
	public Void visit(GoModule module) throws IOException {
		// the package clause has no C counterpart
		for (GoDeclaration decl : module.getDeclarations()) {
			decl.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(GoStatement statement) throws IOException {
		statement.accept(new CStatementFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoDeclaration declaration) throws IOException {
		declaration.accept(new CDeclarationFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoType type) throws IOException {
		type.accept(new CTypeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoStructTypeField structTypeField) throws IOException {
		structTypeField.getType().accept(new CDeclaratorFormattingVisitor(out, structTypeField.getName()));
		return null;
	}

	@Override
	public Void visit(GoFunctionParameter functionParameter) throws IOException {
		functionParameter.getType().accept(new CDeclaratorFormattingVisitor(out, functionParameter.getName()));
		return null;
	}

	@Override
	public Void visit(GoExpression expression) throws IOException {
		expression.accept(new CExpressionFormattingVisitor(out));
		return null;
	}

}
