package gotoc.model.golang;

import java.util.Objects;

/**
 * A literal as it appeared in the source: numbers, strings, runes. The raw text
 * is kept exactly, quotes and escapes included.
 */
public class GoBasicLiteral extends GoExpression {

	private final String value;

	public GoBasicLiteral(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoBasicLiteral that = (GoBasicLiteral) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {

		return Objects.hash(value);
	}
}
