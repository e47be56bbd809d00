package com.transform.graphselect;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for resolving node selections against a manifest.
 *
 * Usage: graphselect manifest.yml --select tag:nightly+ --exclude staging.*
 */
@Command(
    name = "graphselect",
    description = "Resolve which nodes of a dependency graph a set of selection specs picks. Selected node ids are printed one per line.",
    mixinStandardHelpOptions = true,
    version = "1.0.0"
)
public class GraphSelectCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(GraphSelectCLI.class);
    private static final String LOGGER_ROOT = "com.transform.graphselect";

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Path of the YAML manifest describing nodes, tags and dependencies"
    )
    private String manifestPath;

    @Option(
        names = {"--select", "-s"},
        description = "Selection spec, repeatable; each value is one whole spec (default: *)"
    )
    private List<String> select = new ArrayList<>();

    @Option(
        names = {"--exclude", "-x"},
        description = "Spec of nodes to leave out, repeatable"
    )
    private List<String> exclude = new ArrayList<>();

    @Option(
        names = {"--packages"},
        description = "List the package names in the manifest instead of selecting"
    )
    private boolean listPackages = false;

    @Option(
        names = {"--json"},
        description = "Print the result as a JSON array"
    )
    private boolean json = false;

    @Option(
        names = {"--verbose", "-v"},
        description = "Enable verbose logging"
    )
    private boolean verbose = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GraphSelectCLI()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(LOGGER_ROOT)).setLevel(Level.DEBUG);
        }
        try {
            File manifest = new File(manifestPath);
            if (!manifest.exists()) {
                logger.error("Manifest does not exist: {}", manifestPath);
                return 1;
            }
            if (!manifest.isFile()) {
                logger.error("Manifest is not a file: {}", manifestPath);
                return 1;
            }

            for (String selector : select) {
                if (selector.trim().isEmpty()) {
                    logger.error("Empty spec found in --select");
                    return 1;
                }
            }

            SelectionRequest request = new SelectionRequest(manifestPath, select, exclude, listPackages);
            SelectionResult result = new GraphSelectionService().performSelection(request);

            if (!result.isSuccess()) {
                logger.error("Selection failed: {}", result.getErrorMessage());
                return 1;
            }

            List<String> lines = listPackages ? result.getPackageNames() : result.getSelectedNodes();
            PrintWriter out = spec.commandLine().getOut();
            if (json) {
                ObjectMapper mapper = new ObjectMapper();
                ArrayNode array = mapper.createArrayNode();
                for (String line : lines) {
                    array.add(line);
                }
                out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(array));
            } else {
                for (String line : lines) {
                    out.println(line);
                }
            }
            out.flush();
            logger.info("Execution time: {}ms", result.getExecutionTimeMs());
            return 0;

        } catch (Exception e) {
            logger.error("Unexpected error during selection", e);
            return 1;
        }
    }
}
