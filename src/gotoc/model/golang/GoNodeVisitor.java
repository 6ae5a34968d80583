package gotoc.model.golang;

import gotoc.model.golang.type.GoStructTypeField;
import gotoc.model.golang.type.GoType;

public abstract class GoNodeVisitor<T, E extends Throwable> {

	public abstract T visit(GoModule module) throws E;
	public abstract T visit(GoStatement statement) throws E;
	public abstract T visit(GoDeclaration declaration) throws E;
	public abstract T visit(GoType type) throws E;
	public abstract T visit(GoStructTypeField structTypeField) throws E;
	public abstract T visit(GoFunctionParameter functionParameter) throws E;
	public abstract T visit(GoExpression expression) throws E;
}
