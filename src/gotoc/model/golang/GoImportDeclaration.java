package gotoc.model.golang;

import java.util.Objects;

public class GoImportDeclaration extends GoDeclaration {

	// the path literal as written, quotes included
	private final String path;

	public GoImportDeclaration(String path) {
		this.path = path;
	}

	public String getPath() {
		return path;
	}

	@Override
	public <T, E extends Throwable> T accept(GoDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoImportDeclaration that = (GoImportDeclaration) o;
		return Objects.equals(path, that.path);
	}

	@Override
	public int hashCode() {

		return Objects.hash(path);
	}
}
