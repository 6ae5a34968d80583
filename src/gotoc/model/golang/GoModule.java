package gotoc.model.golang;

import java.util.List;
import java.util.Objects;

/**
 * One parsed source file: its package clause and its top-level declarations in source order.
 */
public class GoModule extends GoNode {

	private final String pkg;
	private final List<GoDeclaration> declarations;

	public GoModule(String pkg, List<GoDeclaration> declarations) {
		this.pkg = pkg;
		this.declarations = declarations;
	}

	public String getPackage() {
		return pkg;
	}

	public List<GoDeclaration> getDeclarations() {
		return declarations;
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoModule module = (GoModule) o;
		return Objects.equals(pkg, module.pkg) &&
				Objects.equals(declarations, module.declarations);
	}

	@Override
	public int hashCode() {

		return Objects.hash(pkg, declarations);
	}
}
