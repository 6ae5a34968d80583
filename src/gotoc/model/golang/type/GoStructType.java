package gotoc.model.golang.type;

import java.util.List;
import java.util.Objects;

public class GoStructType extends GoType {

	private final List<GoStructTypeField> fields;

	public GoStructType(List<GoStructTypeField> fields) {
		this.fields = fields;
	}

	public List<GoStructTypeField> getFields() {
		return fields;
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoStructType that = (GoStructType) o;
		return Objects.equals(fields, that.fields);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fields);
	}
}
