package gotoc.model.golang.type;

public abstract class GoTypeVisitor<T, E extends Throwable> {
	public abstract T visit(GoTypeName typeName) throws E;
	public abstract T visit(GoStructType structType) throws E;
	public abstract T visit(GoPtrType ptrType) throws E;
	public abstract T visit(GoArrayType arrayType) throws E;
}
