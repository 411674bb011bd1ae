package io.vena.pathspace;

import lombok.Value;

/**
 * A snapshot of one node, as passed to a {@link SpaceVisitor}.
 */
@Value
public class PathEntry {
	Path path;

	/**
	 * Live (unexpired) slots at the moment the node was visited.
	 */
	int slotCount;

	int childCount;
}
