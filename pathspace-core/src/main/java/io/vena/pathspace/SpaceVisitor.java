package io.vena.pathspace;

/**
 * Called once for each node reached by {@link PathSpace#visit}.
 */
@FunctionalInterface
public interface SpaceVisitor {
	VisitControl visit(PathEntry entry);
}
