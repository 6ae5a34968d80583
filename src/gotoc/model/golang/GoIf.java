package gotoc.model.golang;

import java.util.Objects;

/**
 * The if statement
 *
 * The else branch is either null, another {@link GoIf} (an else-if chain) or a {@link GoBlock}.
 */
public class GoIf extends GoStatement {
	// boolean condition
	private final GoExpression cond;
	private final GoBlock bThen;
	private final GoStatement bElse;

	public GoIf(GoExpression cond, GoBlock bThen, GoStatement bElse) {
		this.cond = cond;
		this.bThen = bThen;
		this.bElse = bElse;
	}

	public GoExpression getCond() {
		return cond;
	}

	public GoBlock getThen() {
		return bThen;
	}

	public GoStatement getElse() {
		return bElse;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoIf anIf = (GoIf) o;
		return Objects.equals(cond, anIf.cond) &&
				Objects.equals(bThen, anIf.bThen) &&
				Objects.equals(bElse, anIf.bElse);
	}

	@Override
	public int hashCode() {
		return Objects.hash(cond, bThen, bElse);
	}
}
