package gotoc.model.golang;

import java.util.Objects;

public class GoDereference extends GoExpression {

	private final GoExpression target;

	public GoDereference(GoExpression target) {
		this.target = target;
	}

	public GoExpression getTarget() {
		return target;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoDereference that = (GoDereference) o;
		return Objects.equals(target, that.target);
	}

	@Override
	public int hashCode() {

		return Objects.hash(target);
	}
}
