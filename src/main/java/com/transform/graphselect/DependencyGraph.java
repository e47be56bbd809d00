package com.transform.graphselect;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Directed dependency graph over node identifiers. Edges point from producer to consumer.
 * <p>
 * Implementations must not change while a selection runs over them; readers take no locks.
 */
public interface DependencyGraph {

	/**
	 * Every node identifier in the graph.
	 */
	Set<String> nodes();

	/**
	 * Direct producers of {@code node}, i.e. the nodes it depends on.
	 */
	Set<String> predecessors(String node);

	/**
	 * Direct consumers of {@code node}, i.e. the nodes that depend on it.
	 */
	Set<String> successors(String node);

	/**
	 * All nodes with a directed path into any of {@code seeds}, at every depth.
	 * Seeds only appear in the result when another seed depends on them.
	 */
	default Set<String> ancestors(Collection<String> seeds) {
		return reachable(seeds, this::predecessors);
	}

	/**
	 * All nodes reachable by a directed path from any of {@code seeds}, at every depth.
	 * Seeds only appear in the result when they depend on another seed.
	 */
	default Set<String> descendants(Collection<String> seeds) {
		return reachable(seeds, this::successors);
	}

	private static Set<String> reachable(Collection<String> seeds, Function<String, Set<String>> neighbours) {
		Set<String> found = new LinkedHashSet<>();
		Set<String> visited = new LinkedHashSet<>(seeds);
		ArrayDeque<String> queue = new ArrayDeque<>(seeds);
		while (!queue.isEmpty()) {
			String current = queue.removeFirst();
			for (String next : neighbours.apply(current)) {
				found.add(next);
				if (visited.add(next)) {
					queue.add(next);
				}
			}
		}
		return found;
	}
}
