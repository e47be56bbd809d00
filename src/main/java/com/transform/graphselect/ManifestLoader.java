package com.transform.graphselect;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads a YAML manifest into a {@link Manifest}.
 * <pre>
 * nodes:
 *   - id: model.X.a
 *     kind: model          # optional, derived from the id prefix
 *     fqn: [X, a]          # optional, id segments after the first
 *     tags: [nightly]
 *     depends_on: [source.X.raw.orders]
 * </pre>
 */
final class ManifestLoader {
	private static final Logger logger = LoggerFactory.getLogger(ManifestLoader.class);

	static final String SOURCE_ID_PREFIX = "source";

	private ManifestLoader() {
	}

	static Manifest load(Path manifestPath) throws IOException {
		if (!Files.exists(manifestPath)) {
			throw new ValidationException("Manifest does not exist: " + manifestPath);
		}
		if (!Files.isRegularFile(manifestPath)) {
			throw new ValidationException("Manifest is not a regular file: " + manifestPath);
		}
		String contents = Files.readString(manifestPath, StandardCharsets.UTF_8);
		logger.debug("Loading manifest {}", manifestPath);
		return parse(contents);
	}

	static Manifest parse(String contents) {
		JsonNode root = YamlLoader.loadText(contents);
		JsonNode nodes = root.path("nodes");
		if (!nodes.isArray()) {
			throw new ValidationException("Manifest must contain a 'nodes' list");
		}

		InMemoryResourceCatalog.Builder catalog = InMemoryResourceCatalog.builder();
		AdjacencyDependencyGraph.Builder graph = AdjacencyDependencyGraph.builder();
		Map<String, List<String>> dependsOn = new LinkedHashMap<>();

		int index = 0;
		for (JsonNode entry : nodes) {
			String id = requiredText(entry, "id", index);
			if (dependsOn.containsKey(id)) {
				throw new ValidationException("Duplicate node id '" + id + "' in manifest");
			}
			ResourceKind kind = resolveKind(entry, id);
			NamespacePath path = resolvePath(entry, id);
			Set<String> tags = new LinkedHashSet<>(textList(entry.path("tags"), id, "tags"));

			graph.addNode(id);
			catalog.put(id, new NodeMetadata(path, tags, kind));
			dependsOn.put(id, textList(entry.path("depends_on"), id, "depends_on"));
			index++;
		}

		for (Map.Entry<String, List<String>> entry : dependsOn.entrySet()) {
			for (String producer : entry.getValue()) {
				if (!dependsOn.containsKey(producer)) {
					throw new GraphIntegrityException("Node '" + entry.getKey() + "' depends on unknown node '" + producer + "'");
				}
				graph.addEdge(producer, entry.getKey());
			}
		}

		AdjacencyDependencyGraph built = graph.build();
		logger.info("Loaded manifest with {} nodes and {} edges", built.nodes().size(), built.edgeCount());
		return new Manifest(built, catalog.build());
	}

	private static String requiredText(JsonNode entry, String field, int index) {
		JsonNode value = entry.get(field);
		if (value == null || value.isNull() || !value.isValueNode() || value.asText().trim().isEmpty()) {
			throw new ValidationException("Manifest node #" + index + " is missing required field '" + field + "'");
		}
		return value.asText().trim();
	}

	private static ResourceKind resolveKind(JsonNode entry, String id) {
		JsonNode explicit = entry.get("kind");
		if (explicit != null && !explicit.isNull()) {
			ResourceKind kind = ResourceKind.fromName(explicit.asText());
			if (kind == null) {
				throw new ValidationException("Node '" + id + "' has unknown kind '" + explicit.asText() + "'");
			}
			return kind;
		}
		String prefix = id.contains(".") ? id.substring(0, id.indexOf('.')) : id;
		return SOURCE_ID_PREFIX.equals(prefix) ? ResourceKind.SOURCE : ResourceKind.MODEL;
	}

	private static NamespacePath resolvePath(JsonNode entry, String id) {
		List<String> segments;
		JsonNode fqn = entry.get("fqn");
		if (fqn != null && !fqn.isNull()) {
			segments = fqn.isArray() ? textList(fqn, id, "fqn") : Arrays.asList(fqn.asText().split("\\.", -1));
		} else {
			List<String> idSegments = Arrays.asList(id.split("\\.", -1));
			segments = idSegments.subList(Math.min(1, idSegments.size()), idSegments.size());
		}
		try {
			return NamespacePath.of(segments);
		} catch (IllegalArgumentException ex) {
			throw new ValidationException("Node '" + id + "' has an invalid namespace path: " + ex.getMessage(), ex);
		}
	}

	private static List<String> textList(JsonNode node, String id, String field) {
		if (node == null || node.isMissingNode() || node.isNull()) {
			return new ArrayList<>();
		}
		List<String> values = new ArrayList<>();
		if (node.isArray()) {
			for (JsonNode element : node) {
				if (!element.isValueNode()) {
					throw new ValidationException("Node '" + id + "' has a non-scalar entry in '" + field + "'");
				}
				String text = element.asText("").trim();
				if (!text.isEmpty()) {
					values.add(text);
				}
			}
			return values;
		}
		if (!node.isValueNode()) {
			throw new ValidationException("Node '" + id + "' field '" + field + "' must be a list");
		}
		String text = node.asText("").trim();
		if (!text.isEmpty()) {
			values.add(text);
		}
		return values;
	}
}
