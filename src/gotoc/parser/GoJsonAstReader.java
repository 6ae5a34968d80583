package gotoc.parser;

import gotoc.model.golang.*;
import gotoc.model.golang.type.*;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads a parsed Go source file serialised as JSON.
 *
 * Every node is an object whose "kind" field names the go/ast node type (Ident, BinaryExpr, IfStmt, ...),
 * the remaining fields carry the node's children under their go/ast names. The root object holds "package"
 * and "decls". Only the shapes the C emitter handles are accepted; anything else is reported with a
 * {@link GoJsonAstReadException} naming the offending node.
 */
public class GoJsonAstReader {

	private GoJsonAstReader() {}

	public static GoModule readFile(File file) throws IOException {
		return read(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
	}

	public static GoModule read(String json) {
		JSONObject root;
		try {
			root = new JSONObject(json);
		} catch (JSONException e) {
			throw new GoJsonAstReadException("malformed JSON: " + e.getMessage(), e);
		}
		try {
			return module(root);
		} catch (JSONException e) {
			throw new GoJsonAstReadException(e.getMessage(), e);
		}
	}

	static GoModule module(JSONObject root) {
		List<GoDeclaration> declarations = new ArrayList<>();
		JSONArray decls = root.optJSONArray("decls");
		if (decls != null) {
			for (int i = 0; i < decls.length(); i++) {
				declarations.add(declaration(decls.getJSONObject(i)));
			}
		}
		return new GoModule(root.optString("package", "main"), declarations);
	}

	private static String kind(JSONObject node) {
		if (!node.has("kind")) {
			throw new GoJsonAstReadException("node without \"kind\": " + node);
		}
		return node.getString("kind");
	}

	private static GoJsonAstReadException unsupported(String family, JSONObject node) {
		return new GoJsonAstReadException("unsupported " + family + " kind \"" + node.optString("kind") + "\"");
	}

	// declarations

	static GoDeclaration declaration(JSONObject node) {
		switch (kind(node)) {
			case "FuncDecl":
				return new GoFunctionDeclaration(
						node.getString("name"),
						parameters(node.optJSONArray("params")),
						parameters(node.optJSONArray("results")),
						block(node.getJSONObject("body")));
			case "VarDecl":
				return new GoVariableDeclaration(
						node.getString("name"),
						type(node.getJSONObject("type")),
						node.has("value") ? expression(node.getJSONObject("value")) : null);
			case "ImportDecl":
				return new GoImportDeclaration(node.getString("path"));
			case "TypeDecl":
				return new GoTypeDeclaration(node.getString("name"), type(node.getJSONObject("type")));
			default:
				throw unsupported("declaration", node);
		}
	}

	private static List<String> names(JSONObject field) {
		List<String> names = new ArrayList<>();
		JSONArray array = field.optJSONArray("names");
		if (array != null) {
			for (int i = 0; i < array.length(); i++) {
				names.add(array.getString(i));
			}
		}
		return names;
	}

	// a field list entry such as "a, b int" declares one parameter per name
	private static List<GoFunctionParameter> parameters(JSONArray fields) {
		if (fields == null) {
			return Collections.emptyList();
		}
		List<GoFunctionParameter> parameters = new ArrayList<>();
		for (int i = 0; i < fields.length(); i++) {
			JSONObject field = fields.getJSONObject(i);
			GoType type = type(field.getJSONObject("type"));
			List<String> names = names(field);
			if (names.isEmpty()) {
				parameters.add(new GoFunctionParameter(null, type));
			}
			for (String name : names) {
				parameters.add(new GoFunctionParameter(name, type));
			}
		}
		return parameters;
	}

	// types

	static GoType type(JSONObject node) {
		switch (kind(node)) {
			case "Ident":
				return new GoTypeName(node.getString("name"));
			case "StarExpr":
				return new GoPtrType(type(node.getJSONObject("x")));
			case "ArrayType":
				if (!node.has("len")) {
					throw new GoJsonAstReadException("slice types are not supported");
				}
				return new GoArrayType(expression(node.getJSONObject("len")), type(node.getJSONObject("elt")));
			case "StructType": {
				List<GoStructTypeField> fields = new ArrayList<>();
				JSONArray array = node.optJSONArray("fields");
				if (array != null) {
					for (int i = 0; i < array.length(); i++) {
						JSONObject field = array.getJSONObject(i);
						GoType type = type(field.getJSONObject("type"));
						List<String> names = names(field);
						if (names.isEmpty()) {
							throw new GoJsonAstReadException("embedded struct fields are not supported");
						}
						for (String name : names) {
							fields.add(new GoStructTypeField(name, type));
						}
					}
				}
				return new GoStructType(fields);
			}
			default:
				throw unsupported("type", node);
		}
	}

	// expressions

	private static List<GoExpression> expressions(JSONArray array) {
		if (array == null) {
			return Collections.emptyList();
		}
		List<GoExpression> expressions = new ArrayList<>();
		for (int i = 0; i < array.length(); i++) {
			expressions.add(expression(array.getJSONObject(i)));
		}
		return expressions;
	}

	static GoExpression expression(JSONObject node) {
		switch (kind(node)) {
			case "BasicLit":
				return new GoBasicLiteral(node.getString("value"));
			case "Ident":
				return new GoVariableName(node.getString("name"));
			case "ParenExpr": {
				GoExpression inner = expression(node.getJSONObject("x"));
				// binary operations are always parenthesised on output
				if (inner instanceof GoBinop || inner instanceof GoParen) {
					return inner;
				}
				return new GoParen(inner);
			}
			case "SelectorExpr":
				return new GoSelectorExpression(expression(node.getJSONObject("x")), node.getString("sel"));
			case "BinaryExpr": {
				GoBinop.Operation op = GoBinop.Operation.fromToken(node.getString("op"));
				if (op == null) {
					throw new GoJsonAstReadException("unsupported binary operator \"" + node.getString("op") + "\"");
				}
				return new GoBinop(op, expression(node.getJSONObject("x")), expression(node.getJSONObject("y")));
			}
			case "UnaryExpr": {
				GoUnary.Operation op = GoUnary.Operation.fromToken(node.getString("op"));
				if (op == null) {
					throw new GoJsonAstReadException("unsupported unary operator \"" + node.getString("op") + "\"");
				}
				return new GoUnary(op, expression(node.getJSONObject("x")));
			}
			case "StarExpr":
				return new GoDereference(expression(node.getJSONObject("x")));
			case "IndexExpr":
				return new GoIndexExpression(expression(node.getJSONObject("x")), expression(node.getJSONObject("index")));
			case "CallExpr":
				return new GoCall(expression(node.getJSONObject("fun")), expressions(node.optJSONArray("args")));
			default:
				throw unsupported("expression", node);
		}
	}

	// statements

	static GoBlock block(JSONObject node) {
		if (!"BlockStmt".equals(kind(node))) {
			throw new GoJsonAstReadException("expected BlockStmt, found \"" + kind(node) + "\"");
		}
		List<GoStatement> statements = new ArrayList<>();
		JSONArray list = node.optJSONArray("list");
		if (list != null) {
			for (int i = 0; i < list.length(); i++) {
				statements.add(statement(list.getJSONObject(i)));
			}
		}
		return new GoBlock(statements);
	}

	private static GoStatement optionalStatement(JSONObject node, String key) {
		return node.has(key) ? statement(node.getJSONObject(key)) : null;
	}

	static GoStatement statement(JSONObject node) {
		switch (kind(node)) {
			case "ExprStmt":
				return new GoExpressionStatement(expression(node.getJSONObject("x")));
			case "AssignStmt": {
				GoAssignmentStatement.Operation op = GoAssignmentStatement.Operation.fromToken(node.getString("tok"));
				if (op == null) {
					throw new GoJsonAstReadException("unsupported assignment operator \"" + node.getString("tok") + "\"");
				}
				return new GoAssignmentStatement(
						expressions(node.getJSONArray("lhs")), op, expressions(node.getJSONArray("rhs")));
			}
			case "DeclStmt":
				return new GoDeclarationStatement(declaration(node.getJSONObject("decl")));
			case "ReturnStmt":
				return new GoReturn(expressions(node.optJSONArray("results")));
			case "IncDecStmt": {
				String tok = node.getString("tok");
				if (!tok.equals("++") && !tok.equals("--")) {
					throw new GoJsonAstReadException("IncDecStmt with token \"" + tok + "\"");
				}
				return new GoIncDec(tok.equals("++"), expression(node.getJSONObject("x")));
			}
			case "IfStmt": {
				if (node.has("init")) {
					throw new GoJsonAstReadException("if statements with an init statement are not supported");
				}
				GoStatement otherwise = optionalStatement(node, "else");
				if (otherwise != null && !(otherwise instanceof GoIf) && !(otherwise instanceof GoBlock)) {
					throw new GoJsonAstReadException("else branch must be an IfStmt or a BlockStmt");
				}
				return new GoIf(expression(node.getJSONObject("cond")), block(node.getJSONObject("body")), otherwise);
			}
			case "ForStmt":
				return new GoFor(
						optionalStatement(node, "init"),
						node.has("cond") ? expression(node.getJSONObject("cond")) : null,
						optionalStatement(node, "post"),
						block(node.getJSONObject("body")));
			case "BlockStmt":
				return block(node);
			case "BranchStmt": {
				if (node.has("label")) {
					throw new GoJsonAstReadException("labelled " + node.getString("tok") + " is not supported");
				}
				String tok = node.getString("tok");
				if (tok.equals("break")) {
					return new GoBreak();
				} else if (tok.equals("continue")) {
					return new GoContinue();
				}
				throw new GoJsonAstReadException("unsupported branch statement \"" + tok + "\"");
			}
			default:
				throw unsupported("statement", node);
		}
	}

}
