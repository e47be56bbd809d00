package com.transform.graphselect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Loads a manifest and resolves a {@link SelectionRequest} against it. Failures never
 * escape as exceptions; they come back as a failed {@link SelectionResult}.
 */
public class GraphSelectionService {
	private static final Logger logger = LoggerFactory.getLogger(GraphSelectionService.class);

	public SelectionResult performSelection(SelectionRequest request) {
		long start = System.currentTimeMillis();
		try {
			Path manifestPath = Paths.get(request.manifestPath());
			Manifest manifest = ManifestLoader.load(manifestPath);
			NodeSelector selector = new NodeSelector(manifest.catalog());
			int total = manifest.graph().nodes().size();

			if (request.listPackages()) {
				List<String> packages = new ArrayList<>(selector.packageNames(manifest.graph()));
				return SelectionResult.success()
					.packageNames(packages)
					.totalNodes(total)
					.executionTimeMs(elapsed(start))
					.build();
			}

			logger.debug("Selecting with include={} exclude={}", request.includeSpecs(), request.excludeSpecs());
			Set<String> selected = selector.select(manifest.graph(), request.includeSpecs(), request.excludeSpecs());
			List<String> sorted = new ArrayList<>(selected);
			sorted.sort(null);
			logger.info("Selected {} of {} nodes", sorted.size(), total);
			return SelectionResult.success()
				.selectedNodes(sorted)
				.totalNodes(total)
				.executionTimeMs(elapsed(start))
				.build();
		} catch (GraphSelectException ex) {
			logger.debug("Selection failed: {}", ex.getMessage());
			return SelectionResult.failure(ex.getMessage()).executionTimeMs(elapsed(start)).build();
		} catch (IOException ex) {
			logger.warn("Failed to read manifest {}", request.manifestPath(), ex);
			return SelectionResult.failure("Failed to read manifest: " + ex.getMessage()).executionTimeMs(elapsed(start)).build();
		}
	}

	private static long elapsed(long start) {
		return System.currentTimeMillis() - start;
	}
}
