package gotoc.model.golang.type;

import gotoc.model.golang.GoNode;
import gotoc.model.golang.GoNodeVisitor;

public abstract class GoType extends GoNode {

	public abstract <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
