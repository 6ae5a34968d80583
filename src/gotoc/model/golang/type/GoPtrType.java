package gotoc.model.golang.type;

import java.util.Objects;

public class GoPtrType extends GoType {

	private final GoType pointee;

	public GoPtrType(GoType pointee) {
		this.pointee = pointee;
	}

	public GoType getPointee() {
		return pointee;
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoPtrType goPtrType = (GoPtrType) o;
		return Objects.equals(pointee, goPtrType.pointee);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pointee);
	}
}
