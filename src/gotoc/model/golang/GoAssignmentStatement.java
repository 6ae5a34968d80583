package gotoc.model.golang;

import java.util.List;
import java.util.Objects;

/**
 * Assigns a value to a variable :
 *
 *
 *  goVar = {expr}
 *  goVar := {expr}
 *  goVar += {expr}
 *
 * Targets and values are kept as parsed; only the single target form can be emitted.
 */
public class GoAssignmentStatement extends GoStatement {

	public enum Operation {
		ASSIGN("="),
		DEFINE(":="),
		ADD_ASSIGN("+="),
		SUB_ASSIGN("-="),
		MUL_ASSIGN("*="),
		QUO_ASSIGN("/="),
		REM_ASSIGN("%="),
		AND_ASSIGN("&="),
		OR_ASSIGN("|="),
		XOR_ASSIGN("^="),
		SHL_ASSIGN("<<="),
		SHR_ASSIGN(">>="),
		AND_NOT_ASSIGN("&^="),
		;

		private final String token;

		Operation(String token) {
			this.token = token;
		}

		public String getToken() {
			return token;
		}

		public static Operation fromToken(String token) {
			for (Operation op : values()) {
				if (op.token.equals(token)) {
					return op;
				}
			}
			return null;
		}
	}

	private final List<GoExpression> names;
	private final Operation op;
	private final List<GoExpression> values;

	public GoAssignmentStatement(List<GoExpression> names, Operation op, List<GoExpression> values) {
		this.names = names;
		this.op = op;
		this.values = values;
	}

	public List<GoExpression> getNames() {
		return names;
	}

	public Operation getOperation() {
		return op;
	}

	public List<GoExpression> getValues() {
		return values;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoAssignmentStatement that = (GoAssignmentStatement) o;
		return op == that.op &&
				Objects.equals(names, that.names) &&
				Objects.equals(values, that.values);
	}

	@Override
	public int hashCode() {

		return Objects.hash(names, op, values);
	}
}
