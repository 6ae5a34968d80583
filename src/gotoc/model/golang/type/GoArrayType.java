package gotoc.model.golang.type;

import gotoc.model.golang.GoExpression;

import java.util.Objects;

/**
 * A fixed length array type, [length]elementType
 */
public class GoArrayType extends GoType {

	private final GoExpression length;
	private final GoType elementType;

	public GoArrayType(GoExpression length, GoType elementType) {
		this.length = length;
		this.elementType = elementType;
	}

	public GoExpression getLength() {
		return length;
	}

	public GoType getElementType() {
		return elementType;
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoArrayType that = (GoArrayType) o;
		return Objects.equals(length, that.length) &&
				Objects.equals(elementType, that.elementType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(length, elementType);
	}
}
