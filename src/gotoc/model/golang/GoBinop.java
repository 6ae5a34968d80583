package gotoc.model.golang;

import java.util.Objects;

public class GoBinop extends GoExpression {

	private final GoExpression lhs;
	private final GoExpression rhs;
	private final Operation op;

	public enum Operation {
		OR("||"),
		AND("&&"),

		EQ("=="),
		NEQ("!="),
		LT("<"),
		LEQ("<="),
		GT(">"),
		GEQ(">="),

		PLUS("+"),
		MINUS("-"),
		BOR("|"),
		BXOR("^"),

		TIMES("*"),
		DIVIDE("/"),
		MOD("%"),
		LSHIFT("<<"),
		RSHIFT(">>"),
		BAND("&"),
		BCLEAR("&^"),
		;

		private final String token;

		Operation(String token) {
			this.token = token;
		}

		public String getToken() {
			return token;
		}

		/**
		 * @return the operation spelled by token, or null if there is none
		 */
		public static Operation fromToken(String token) {
			for (Operation op : values()) {
				if (op.token.equals(token)) {
					return op;
				}
			}
			return null;
		}
	}

	public GoBinop(Operation op, GoExpression lhs, GoExpression rhs) {
		this.op = op;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public Operation getOperation() {
		return op;
	}

	public GoExpression getLHS() {
		return lhs;
	}

	public GoExpression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoBinop binop = (GoBinop) o;
		return Objects.equals(lhs, binop.lhs) &&
				Objects.equals(rhs, binop.rhs) &&
				op == binop.op;
	}

	@Override
	public int hashCode() {

		return Objects.hash(lhs, rhs, op);
	}
}
