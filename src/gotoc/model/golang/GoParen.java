package gotoc.model.golang;

import java.util.Objects;

/**
 * Explicit grouping around an operand, kept so that (*p).x and -(-y) keep their meaning in C
 */
public class GoParen extends GoExpression {

	private final GoExpression inner;

	public GoParen(GoExpression inner) {
		this.inner = inner;
	}

	public GoExpression getInner() {
		return inner;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoParen goParen = (GoParen) o;
		return Objects.equals(inner, goParen.inner);
	}

	@Override
	public int hashCode() {
		return Objects.hash(inner);
	}
}
