package com.transform.graphselect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Resolves include and exclude selection specs to a set of graph nodes.
 * <p>
 * Every include spec contributes the nodes it matches plus the directional closure its
 * modifiers ask for; contributions are unioned. Exclude specs are resolved the same way
 * and subtracted from the union. A malformed spec anywhere fails the whole call.
 * <p>
 * The graph must be acyclic and unchanged for the duration of a call. Instances hold no
 * mutable state and may be shared between threads.
 */
public class NodeSelector {
	private static final Logger logger = LoggerFactory.getLogger(NodeSelector.class);

	private final ResourceCatalog catalog;

	public NodeSelector(ResourceCatalog catalog) {
		if (catalog == null) {
			throw new IllegalArgumentException("catalog cannot be null");
		}
		this.catalog = catalog;
	}

	/**
	 * @param graph        dependency graph to select from
	 * @param includeSpecs specs whose matches are unioned
	 * @param excludeSpecs specs whose matches are removed from the union
	 * @return selected node identifiers, in graph iteration order
	 * @throws InvalidSelectorException     if any spec is malformed
	 * @throws MissingNodeMetadataException if a graph node has no catalog entry
	 */
	public Set<String> select(DependencyGraph graph, List<String> includeSpecs, List<String> excludeSpecs) {
		List<SelectionCriteria> includes = parseAll(includeSpecs);
		List<SelectionCriteria> excludes = parseAll(excludeSpecs);

		Map<String, NodeMetadata> metadata = snapshotMetadata(graph);

		Set<String> included = resolveAll(graph, metadata, includes);
		Set<String> excluded = resolveAll(graph, metadata, excludes);

		Set<String> selected = new LinkedHashSet<>();
		for (String node : graph.nodes()) {
			if (included.contains(node) && !excluded.contains(node)) {
				selected.add(node);
			}
		}
		logger.debug("Selected {} of {} nodes (included={}, excluded={})",
			selected.size(), graph.nodes().size(), included.size(), excluded.size());
		return Collections.unmodifiableSet(selected);
	}

	/**
	 * Nodes matched by a single criterion plus the closure its modifiers request.
	 */
	public Set<String> resolve(DependencyGraph graph, SelectionCriteria criteria) {
		return resolve(graph, snapshotMetadata(graph), criteria);
	}

	/**
	 * Distinct package names, i.e. the first namespace segment of every node.
	 */
	public Set<String> packageNames(DependencyGraph graph) {
		Set<String> packages = new TreeSet<>();
		for (NodeMetadata node : snapshotMetadata(graph).values()) {
			packages.add(node.path().packageName());
		}
		return packages;
	}

	private List<SelectionCriteria> parseAll(List<String> specs) {
		if (specs == null || specs.isEmpty()) {
			return Collections.emptyList();
		}
		List<SelectionCriteria> parsed = new ArrayList<>(specs.size());
		for (String spec : specs) {
			parsed.add(SelectionCriteria.parse(spec));
		}
		return parsed;
	}

	private Set<String> resolveAll(DependencyGraph graph, Map<String, NodeMetadata> metadata, List<SelectionCriteria> criteria) {
		Set<String> result = new LinkedHashSet<>();
		for (SelectionCriteria criterion : criteria) {
			result.addAll(resolve(graph, metadata, criterion));
		}
		return result;
	}

	private Set<String> resolve(DependencyGraph graph, Map<String, NodeMetadata> metadata, SelectionCriteria criteria) {
		Set<String> matched = directMatches(metadata, criteria);
		Set<String> result = new LinkedHashSet<>(matched);

		if (criteria.selectChildrensParents()) {
			Set<String> downstream = new LinkedHashSet<>(matched);
			downstream.addAll(graph.descendants(matched));
			result.addAll(downstream);
			result.addAll(graph.ancestors(downstream));
		} else {
			if (criteria.selectParents()) {
				result.addAll(graph.ancestors(matched));
			}
			if (criteria.selectChildren()) {
				result.addAll(graph.descendants(matched));
			}
		}

		logger.debug("Spec '{}' matched {} node(s), {} after closure", criteria.rawSpec(), matched.size(), result.size());
		if (matched.isEmpty()) {
			logger.warn("Selector '{}' does not match any nodes", criteria.rawSpec());
		}
		return result;
	}

	private Set<String> directMatches(Map<String, NodeMetadata> metadata, SelectionCriteria criteria) {
		Set<String> matched = new LinkedHashSet<>();
		for (Map.Entry<String, NodeMetadata> entry : metadata.entrySet()) {
			if (NodeMatcher.matches(entry.getValue(), criteria)) {
				matched.add(entry.getKey());
			}
		}
		return matched;
	}

	private Map<String, NodeMetadata> snapshotMetadata(DependencyGraph graph) {
		Map<String, NodeMetadata> metadata = new LinkedHashMap<>();
		for (String node : graph.nodes()) {
			NodeMetadata entry = catalog.metadataFor(node);
			if (entry == null) {
				throw new MissingNodeMetadataException(node);
			}
			metadata.put(node, entry);
		}
		return metadata;
	}
}
