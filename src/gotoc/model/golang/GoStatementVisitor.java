package gotoc.model.golang;

public abstract class GoStatementVisitor<T, E extends Throwable>{

	public abstract T visit(GoAssignmentStatement assignment) throws E;
	public abstract T visit(GoReturn goReturn) throws E;
	public abstract T visit(GoBlock block) throws E;
	public abstract T visit(GoFor goFor) throws E;
	public abstract T visit(GoIf goIf) throws E;
	public abstract T visit(GoIncDec incDec) throws E;
	public abstract T visit(GoExpressionStatement expressionStatement) throws E;
	public abstract T visit(GoBreak break1) throws E;
	public abstract T visit(GoContinue continue1) throws E;
	public abstract T visit(GoDeclarationStatement declarationStatement) throws E;

}
