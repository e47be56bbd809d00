package com.transform.graphselect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable adjacency-list graph. Instances come from {@link Builder#build()}, which
 * rejects edges to undeclared nodes and dependency cycles.
 */
public final class AdjacencyDependencyGraph implements DependencyGraph {
	private final Set<String> nodes;
	private final Map<String, Set<String>> incoming;
	private final Map<String, Set<String>> outgoing;

	private AdjacencyDependencyGraph(Set<String> nodes, Map<String, Set<String>> incoming, Map<String, Set<String>> outgoing) {
		this.nodes = nodes;
		this.incoming = incoming;
		this.outgoing = outgoing;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Set<String> nodes() {
		return nodes;
	}

	@Override
	public Set<String> predecessors(String node) {
		return neighbours(incoming, node);
	}

	@Override
	public Set<String> successors(String node) {
		return neighbours(outgoing, node);
	}

	public int edgeCount() {
		int count = 0;
		for (Set<String> targets : outgoing.values()) {
			count += targets.size();
		}
		return count;
	}

	private Set<String> neighbours(Map<String, Set<String>> adjacency, String node) {
		Set<String> result = adjacency.get(node);
		if (result == null) {
			throw new IllegalArgumentException("Unknown graph node: " + node);
		}
		return result;
	}

	@Override
	public String toString() {
		return "AdjacencyDependencyGraph[nodes=" + nodes.size() + ", edges=" + edgeCount() + "]";
	}

	/**
	 * Collects nodes and producer-to-consumer edges.
	 */
	public static final class Builder {
		private final Set<String> nodes = new LinkedHashSet<>();
		private final Map<String, Set<String>> outgoing = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder addNode(String node) {
			if (node == null || node.trim().isEmpty()) {
				throw new IllegalArgumentException("node identifier cannot be null or empty");
			}
			nodes.add(node);
			return this;
		}

		public Builder addEdge(String producer, String consumer) {
			if (producer == null || consumer == null) {
				throw new IllegalArgumentException("edge endpoints cannot be null");
			}
			outgoing.computeIfAbsent(producer, k -> new LinkedHashSet<>()).add(consumer);
			return this;
		}

		public AdjacencyDependencyGraph build() {
			Map<String, Set<String>> out = new LinkedHashMap<>();
			Map<String, Set<String>> in = new LinkedHashMap<>();
			for (String node : nodes) {
				out.put(node, new LinkedHashSet<>());
				in.put(node, new LinkedHashSet<>());
			}
			for (Map.Entry<String, Set<String>> entry : outgoing.entrySet()) {
				String producer = entry.getKey();
				for (String consumer : entry.getValue()) {
					if (!nodes.contains(producer)) {
						throw new GraphIntegrityException("Edge " + producer + " -> " + consumer + " starts at an unknown node");
					}
					if (!nodes.contains(consumer)) {
						throw new GraphIntegrityException("Edge " + producer + " -> " + consumer + " ends at an unknown node");
					}
					out.get(producer).add(consumer);
					in.get(consumer).add(producer);
				}
			}
			List<String> cycle = findCycleMembers(out, in);
			if (!cycle.isEmpty()) {
				throw new GraphIntegrityException("Dependency cycle detected among nodes " + cycle);
			}
			Map<String, Set<String>> frozenOut = new LinkedHashMap<>();
			Map<String, Set<String>> frozenIn = new LinkedHashMap<>();
			for (String node : nodes) {
				frozenOut.put(node, Collections.unmodifiableSet(out.get(node)));
				frozenIn.put(node, Collections.unmodifiableSet(in.get(node)));
			}
			return new AdjacencyDependencyGraph(
				Collections.unmodifiableSet(new LinkedHashSet<>(nodes)),
				Collections.unmodifiableMap(frozenIn),
				Collections.unmodifiableMap(frozenOut)
			);
		}

		// Kahn's algorithm; whatever never reaches in-degree zero sits on or behind a cycle.
		private List<String> findCycleMembers(Map<String, Set<String>> out, Map<String, Set<String>> in) {
			Map<String, Integer> inDegree = new LinkedHashMap<>();
			ArrayDeque<String> ready = new ArrayDeque<>();
			for (Map.Entry<String, Set<String>> entry : in.entrySet()) {
				inDegree.put(entry.getKey(), entry.getValue().size());
				if (entry.getValue().isEmpty()) {
					ready.add(entry.getKey());
				}
			}
			int processed = 0;
			while (!ready.isEmpty()) {
				String current = ready.removeFirst();
				processed++;
				for (String consumer : out.get(current)) {
					int remaining = inDegree.merge(consumer, -1, Integer::sum);
					if (remaining == 0) {
						ready.add(consumer);
					}
				}
			}
			if (processed == inDegree.size()) {
				return Collections.emptyList();
			}
			List<String> stuck = new ArrayList<>();
			for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
				if (entry.getValue() > 0) {
					stuck.add(entry.getKey());
				}
			}
			return stuck;
		}
	}
}
