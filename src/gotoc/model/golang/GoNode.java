package gotoc.model.golang;

import gotoc.formatters.GoNodeDumpingVisitor;
import gotoc.formatters.IndentingBuffer;

import java.io.IOException;

public abstract class GoNode {

	public abstract <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		IndentingBuffer out = new IndentingBuffer(2);
		try {
			accept(new GoNodeDumpingVisitor(out));
		} catch (IOException e) {
			throw new RuntimeException("IndentingBuffer should not throw IOException", e);
		}
		return out.toString();
	}

}
