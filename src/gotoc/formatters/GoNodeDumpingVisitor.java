package gotoc.formatters;

import gotoc.model.golang.*;
import gotoc.model.golang.type.*;

import java.io.IOException;
import java.util.List;

/**
 * Prints a tree as one line per node, children indented below their parent. Used for debugging output
 * only, the format is not meant to be parsed back.
 */
public class GoNodeDumpingVisitor extends GoNodeVisitor<Void, IOException> {

	private final IndentingBuffer out;

	public GoNodeDumpingVisitor(IndentingBuffer out) {
		this.out = out;
	}

	private void child(String label, GoNode node) throws IOException {
		if (node == null) {
			out.writeLine(label + ": nil");
			return;
		}
		out.writeLine(label + ":");
		try (IndentingBuffer.Indent ignored = out.indent()) {
			node.accept(this);
		}
	}

	private void children(String label, List<? extends GoNode> nodes) throws IOException {
		out.writeLine(label + ": (" + nodes.size() + ")");
		try (IndentingBuffer.Indent ignored = out.indent()) {
			for (GoNode node : nodes) {
				node.accept(this);
			}
		}
	}

	private void node(String header, GoNode... nested) throws IOException {
		out.writeLine(header);
		try (IndentingBuffer.Indent ignored = out.indent()) {
			for (GoNode node : nested) {
				node.accept(this);
			}
		}
	}

	@Override
	public Void visit(GoModule module) throws IOException {
		out.writeLine("GoModule " + module.getPackage());
		try (IndentingBuffer.Indent ignored = out.indent()) {
			children("declarations", module.getDeclarations());
		}
		return null;
	}

	@Override
	public Void visit(GoStatement statement) throws IOException {
		statement.accept(new GoStatementVisitor<Void, IOException>() {
			@Override
			public Void visit(GoAssignmentStatement assignment) throws IOException {
				out.writeLine("GoAssignmentStatement " + assignment.getOperation().getToken());
				try (IndentingBuffer.Indent ignored = out.indent()) {
					children("names", assignment.getNames());
					children("values", assignment.getValues());
				}
				return null;
			}

			@Override
			public Void visit(GoReturn goReturn) throws IOException {
				out.writeLine("GoReturn");
				try (IndentingBuffer.Indent ignored = out.indent()) {
					children("values", goReturn.getValues());
				}
				return null;
			}

			@Override
			public Void visit(GoBlock block) throws IOException {
				out.writeLine("GoBlock");
				try (IndentingBuffer.Indent ignored = out.indent()) {
					children("statements", block.getStatements());
				}
				return null;
			}

			@Override
			public Void visit(GoFor goFor) throws IOException {
				out.writeLine("GoFor");
				try (IndentingBuffer.Indent ignored = out.indent()) {
					child("init", goFor.getInit());
					child("cond", goFor.getCondition());
					child("post", goFor.getIncrement());
					child("body", goFor.getBody());
				}
				return null;
			}

			@Override
			public Void visit(GoIf goIf) throws IOException {
				out.writeLine("GoIf");
				try (IndentingBuffer.Indent ignored = out.indent()) {
					child("cond", goIf.getCond());
					child("then", goIf.getThen());
					child("else", goIf.getElse());
				}
				return null;
			}

			@Override
			public Void visit(GoIncDec incDec) throws IOException {
				node("GoIncDec " + (incDec.isInc() ? "++" : "--"), incDec.getExpression());
				return null;
			}

			@Override
			public Void visit(GoExpressionStatement expressionStatement) throws IOException {
				node("GoExpressionStatement", expressionStatement.getExpression());
				return null;
			}

			@Override
			public Void visit(GoBreak break1) throws IOException {
				out.writeLine("GoBreak");
				return null;
			}

			@Override
			public Void visit(GoContinue continue1) throws IOException {
				out.writeLine("GoContinue");
				return null;
			}

			@Override
			public Void visit(GoDeclarationStatement declarationStatement) throws IOException {
				node("GoDeclarationStatement", declarationStatement.getDeclaration());
				return null;
			}
		});
		return null;
	}

	@Override
	public Void visit(GoDeclaration declaration) throws IOException {
		declaration.accept(new GoDeclarationVisitor<Void, IOException>() {
			@Override
			public Void visit(GoFunctionDeclaration functionDeclaration) throws IOException {
				out.writeLine("GoFunctionDeclaration " + functionDeclaration.getName());
				try (IndentingBuffer.Indent ignored = out.indent()) {
					children("arguments", functionDeclaration.getArguments());
					children("results", functionDeclaration.getReturnTypes());
					child("body", functionDeclaration.getBody());
				}
				return null;
			}

			@Override
			public Void visit(GoTypeDeclaration typeDeclaration) throws IOException {
				node("GoTypeDeclaration " + typeDeclaration.getName(), typeDeclaration.getType());
				return null;
			}

			@Override
			public Void visit(GoVariableDeclaration variableDeclaration) throws IOException {
				out.writeLine("GoVariableDeclaration " + variableDeclaration.getName());
				try (IndentingBuffer.Indent ignored = out.indent()) {
					child("type", variableDeclaration.getType());
					child("value", variableDeclaration.getValue());
				}
				return null;
			}

			@Override
			public Void visit(GoImportDeclaration importDeclaration) throws IOException {
				out.writeLine("GoImportDeclaration " + importDeclaration.getPath());
				return null;
			}
		});
		return null;
	}

	@Override
	public Void visit(GoType type) throws IOException {
		type.accept(new GoTypeVisitor<Void, IOException>() {
			@Override
			public Void visit(GoTypeName typeName) throws IOException {
				out.writeLine("GoTypeName " + typeName.getName());
				return null;
			}

			@Override
			public Void visit(GoStructType structType) throws IOException {
				out.writeLine("GoStructType");
				try (IndentingBuffer.Indent ignored = out.indent()) {
					children("fields", structType.getFields());
				}
				return null;
			}

			@Override
			public Void visit(GoPtrType ptrType) throws IOException {
				node("GoPtrType", ptrType.getPointee());
				return null;
			}

			@Override
			public Void visit(GoArrayType arrayType) throws IOException {
				out.writeLine("GoArrayType");
				try (IndentingBuffer.Indent ignored = out.indent()) {
					child("length", arrayType.getLength());
					child("element", arrayType.getElementType());
				}
				return null;
			}
		});
		return null;
	}

	@Override
	public Void visit(GoStructTypeField structTypeField) throws IOException {
		node("GoStructTypeField " + structTypeField.getName(), structTypeField.getType());
		return null;
	}

	@Override
	public Void visit(GoFunctionParameter functionParameter) throws IOException {
		String name = functionParameter.getName() == null ? "_" : functionParameter.getName();
		node("GoFunctionParameter " + name, functionParameter.getType());
		return null;
	}

	@Override
	public Void visit(GoExpression expression) throws IOException {
		expression.accept(new GoExpressionVisitor<Void, IOException>() {
			@Override
			public Void visit(GoVariableName v) throws IOException {
				out.writeLine("GoVariableName " + v.getName());
				return null;
			}

			@Override
			public Void visit(GoBasicLiteral basicLiteral) throws IOException {
				out.writeLine("GoBasicLiteral " + basicLiteral.getValue());
				return null;
			}

			@Override
			public Void visit(GoIndexExpression index) throws IOException {
				node("GoIndexExpression", index.getTarget(), index.getIndex());
				return null;
			}

			@Override
			public Void visit(GoCall call) throws IOException {
				out.writeLine("GoCall");
				try (IndentingBuffer.Indent ignored = out.indent()) {
					child("target", call.getTarget());
					children("arguments", call.getArguments());
				}
				return null;
			}

			@Override
			public Void visit(GoBinop binop) throws IOException {
				node("GoBinop " + binop.getOperation().getToken(), binop.getLHS(), binop.getRHS());
				return null;
			}

			@Override
			public Void visit(GoUnary unary) throws IOException {
				node("GoUnary " + unary.getOperation().getToken(), unary.getTarget());
				return null;
			}

			@Override
			public Void visit(GoDereference dereference) throws IOException {
				node("GoDereference", dereference.getTarget());
				return null;
			}

			@Override
			public Void visit(GoSelectorExpression dot) throws IOException {
				node("GoSelectorExpression ." + dot.getName(), dot.getLHS());
				return null;
			}

			@Override
			public Void visit(GoParen paren) throws IOException {
				node("GoParen", paren.getInner());
				return null;
			}
		});
		return null;
	}

}
