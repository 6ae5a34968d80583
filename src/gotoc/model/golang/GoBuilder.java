package gotoc.model.golang;

import gotoc.model.golang.type.GoArrayType;
import gotoc.model.golang.type.GoPtrType;
import gotoc.model.golang.type.GoStructType;
import gotoc.model.golang.type.GoStructTypeField;
import gotoc.model.golang.type.GoType;
import gotoc.model.golang.type.GoTypeName;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class GoBuilder {
	private GoBuilder() {}

	// expressions

	public static GoVariableName id(String name) {
		return new GoVariableName(name);
	}

	public static GoBasicLiteral lit(String raw) {
		return new GoBasicLiteral(raw);
	}

	public static GoBasicLiteral num(int value) {
		return new GoBasicLiteral(Integer.toString(value));
	}

	public static GoBasicLiteral str(String value) {
		return new GoBasicLiteral("\"" + value + "\"");
	}

	public static GoBinop binop(String token, GoExpression lhs, GoExpression rhs) {
		GoBinop.Operation op = GoBinop.Operation.fromToken(token);
		if (op == null) {
			throw new IllegalArgumentException("not a binary operator: " + token);
		}
		return new GoBinop(op, lhs, rhs);
	}

	public static GoUnary unary(String token, GoExpression target) {
		GoUnary.Operation op = GoUnary.Operation.fromToken(token);
		if (op == null) {
			throw new IllegalArgumentException("not a unary operator: " + token);
		}
		return new GoUnary(op, target);
	}

	public static GoDereference deref(GoExpression target) {
		return new GoDereference(target);
	}

	public static GoSelectorExpression dot(GoExpression lhs, String name) {
		return new GoSelectorExpression(lhs, name);
	}

	public static GoParen paren(GoExpression inner) {
		return new GoParen(inner);
	}

	public static GoIndexExpression index(GoExpression target, GoExpression index) {
		return new GoIndexExpression(target, index);
	}

	public static GoCall call(GoExpression target, GoExpression... args) {
		return new GoCall(target, Arrays.asList(args));
	}

	public static GoCall call(String target, GoExpression... args) {
		return call(id(target), args);
	}

	// statements

	public static GoExpressionStatement exprStmt(GoExpression expression) {
		return new GoExpressionStatement(expression);
	}

	public static GoAssignmentStatement assign(GoExpression lhs, String token, GoExpression rhs) {
		GoAssignmentStatement.Operation op = GoAssignmentStatement.Operation.fromToken(token);
		if (op == null) {
			throw new IllegalArgumentException("not an assignment operator: " + token);
		}
		return new GoAssignmentStatement(Collections.singletonList(lhs), op, Collections.singletonList(rhs));
	}

	public static GoAssignmentStatement assign(GoExpression lhs, GoExpression rhs) {
		return assign(lhs, "=", rhs);
	}

	public static GoAssignmentStatement define(String name, GoExpression rhs) {
		return assign(id(name), ":=", rhs);
	}

	public static GoReturn ret(GoExpression... values) {
		return new GoReturn(Arrays.asList(values));
	}

	public static GoIncDec inc(GoExpression expression) {
		return new GoIncDec(true, expression);
	}

	public static GoIncDec dec(GoExpression expression) {
		return new GoIncDec(false, expression);
	}

	public static GoIf ifStmt(GoExpression cond, GoBlock then) {
		return new GoIf(cond, then, null);
	}

	public static GoIf ifStmt(GoExpression cond, GoBlock then, GoStatement otherwise) {
		return new GoIf(cond, then, otherwise);
	}

	public static GoFor forStmt(GoStatement init, GoExpression cond, GoStatement inc, GoBlock body) {
		return new GoFor(init, cond, inc, body);
	}

	public static GoBlock block(GoStatement... statements) {
		return new GoBlock(Arrays.asList(statements));
	}

	public static GoDeclarationStatement declStmt(GoDeclaration declaration) {
		return new GoDeclarationStatement(declaration);
	}

	public static GoBreak brk() {
		return new GoBreak();
	}

	public static GoContinue cont() {
		return new GoContinue();
	}

	// types

	public static GoTypeName type(String name) {
		return new GoTypeName(name);
	}

	public static GoPtrType ptr(GoType pointee) {
		return new GoPtrType(pointee);
	}

	public static GoArrayType array(GoExpression length, GoType elementType) {
		return new GoArrayType(length, elementType);
	}

	public static GoStructType struct(GoStructTypeField... fields) {
		return new GoStructType(Arrays.asList(fields));
	}

	public static GoStructTypeField field(String name, GoType type) {
		return new GoStructTypeField(name, type);
	}

	// declarations

	public static GoFunctionParameter param(String name, GoType type) {
		return new GoFunctionParameter(name, type);
	}

	public static List<GoFunctionParameter> params(GoFunctionParameter... params) {
		return Arrays.asList(params);
	}

	public static GoFunctionDeclaration func(String name, List<GoFunctionParameter> params,
	                                         List<GoFunctionParameter> results, GoBlock body) {
		return new GoFunctionDeclaration(name, params, results, body);
	}

	public static GoVariableDeclaration var(String name, GoType type) {
		return new GoVariableDeclaration(name, type, null);
	}

	public static GoVariableDeclaration var(String name, GoType type, GoExpression value) {
		return new GoVariableDeclaration(name, type, value);
	}

	/**
	 * @param path the import path without quotes
	 */
	public static GoImportDeclaration importDecl(String path) {
		return new GoImportDeclaration("\"" + path + "\"");
	}

	public static GoTypeDeclaration typeDecl(String name, GoType type) {
		return new GoTypeDeclaration(name, type);
	}

	public static GoModule module(String pkg, GoDeclaration... declarations) {
		return new GoModule(pkg, Arrays.asList(declarations));
	}

}
