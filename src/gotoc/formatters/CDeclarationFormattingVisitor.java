package gotoc.formatters;

import gotoc.UnsupportedNodeException;
import gotoc.model.golang.*;
import gotoc.model.golang.type.GoStructType;
import gotoc.model.golang.type.GoStructTypeField;

import java.io.IOException;
import java.util.List;

public class CDeclarationFormattingVisitor extends GoDeclarationVisitor<Void, IOException> {

	private final IndentingBuffer out;

	public CDeclarationFormattingVisitor(IndentingBuffer out) {
		this.out = out;
	}

	@Override
	public Void visit(GoFunctionDeclaration functionDeclaration) throws IOException {
		List<GoFunctionParameter> results = functionDeclaration.getReturnTypes();
		if (results.size() > 1) {
			throw new UnsupportedNodeException("function " + functionDeclaration.getName() + " declares "
					+ results.size() + " results, at most one is supported");
		}
		String returnType = results.isEmpty() ? "void" : FormattingTools.typeText(results.get(0).getType());
		IndentingBuffer header = new IndentingBuffer();
		header.write(returnType + " " + functionDeclaration.getName() + "(");
		FormattingTools.writeCommaSeparated(header, functionDeclaration.getArguments(),
				param -> header.write(FormattingTools.declarator(param.getType(), param.getName())));
		header.write(")");
		out.writeLine(header.toString());
		new CStatementFormattingVisitor(out).formatBlock("", functionDeclaration.getBody());
		return null;
	}

	@Override
	public Void visit(GoTypeDeclaration typeDeclaration) throws IOException {
		if (typeDeclaration.getType() instanceof GoStructType) {
			GoStructType structType = (GoStructType) typeDeclaration.getType();
			out.writeLine("struct " + typeDeclaration.getName() + " {");
			try (IndentingBuffer.Indent ignored = out.indent()) {
				for (GoStructTypeField field : structType.getFields()) {
					out.writeLine(FormattingTools.declarator(field.getType(), field.getName()) + ";");
				}
			}
			out.writeLine("};");
		} else {
			out.writeLine("typedef " + FormattingTools.declarator(typeDeclaration.getType(), typeDeclaration.getName()) + ";");
		}
		return null;
	}

	@Override
	public Void visit(GoVariableDeclaration variableDeclaration) throws IOException {
		String line = FormattingTools.declarator(variableDeclaration.getType(), variableDeclaration.getName());
		if (variableDeclaration.getValue() != null) {
			line += " = " + FormattingTools.fragment(variableDeclaration.getValue());
		}
		out.writeLine(line + ";");
		return null;
	}

	@Override
	public Void visit(GoImportDeclaration importDeclaration) throws IOException {
		out.writeLine("#include <" + unquote(importDeclaration.getPath()) + ".h>");
		return null;
	}

	/**
	 * Strips the quotes of an import path literal, either "interpreted" with \" and \\ escapes or `raw`
	 */
	static String unquote(String literal) {
		if (literal.length() >= 2 && literal.startsWith("`") && literal.endsWith("`")) {
			return literal.substring(1, literal.length() - 1);
		}
		if (literal.length() < 2 || !literal.startsWith("\"") || !literal.endsWith("\"")) {
			throw new UnsupportedNodeException("malformed import path " + literal);
		}
		StringBuilder path = new StringBuilder();
		for (int i = 1; i < literal.length() - 1; ++i) {
			char c = literal.charAt(i);
			if (c == '\\') {
				++i;
				char escaped = literal.charAt(i);
				if (i == literal.length() - 1 || (escaped != '"' && escaped != '\\')) {
					throw new UnsupportedNodeException("unsupported escape in import path " + literal);
				}
				path.append(escaped);
			} else {
				path.append(c);
			}
		}
		return path.toString();
	}

}
