package gotoc.model.golang;

import java.util.List;
import java.util.Objects;

public class GoCall extends GoExpression {

	private final GoExpression target;
	private final List<GoExpression> arguments;

	public GoCall(GoExpression target, List<GoExpression> arguments) {
		this.target = target;
		this.arguments = arguments;
	}

	public GoExpression getTarget() {
		return target;
	}

	public List<GoExpression> getArguments(){
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoCall call = (GoCall) o;
		return Objects.equals(target, call.target) &&
				Objects.equals(arguments, call.arguments);
	}

	@Override
	public int hashCode() {

		return Objects.hash(target, arguments);
	}
}
