package gotoc.model.golang;

public abstract class GoExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(GoVariableName v) throws E;
	public abstract T visit(GoBasicLiteral basicLiteral) throws E;
	public abstract T visit(GoIndexExpression index) throws E;
	public abstract T visit(GoCall call) throws E;
	public abstract T visit(GoBinop binop) throws E;
	public abstract T visit(GoUnary unary) throws E;
	public abstract T visit(GoDereference dereference) throws E;
	public abstract T visit(GoSelectorExpression dot) throws E;
	public abstract T visit(GoParen paren) throws E;
}
