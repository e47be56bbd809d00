package com.transform.graphselect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line-delimited JSON-RPC 2.0 server on stdin/stdout exposing node selection as a tool.
 */
public class GraphSelectMcpServer {
	private static final Logger logger = LoggerFactory.getLogger(GraphSelectMcpServer.class);
	private static final String SERVER_NAME = "Graph Selection MCP Server";
	private static final String VERSION = "1.0.0";
	static final String TOOL_NAME = "select_nodes";

	private final ObjectMapper objectMapper = new ObjectMapper();
	private final GraphSelectionService selectionService = new GraphSelectionService();
	private final BufferedReader reader;
	private final PrintWriter writer;

	public GraphSelectMcpServer() {
		this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), new PrintWriter(System.out, true));
	}

	GraphSelectMcpServer(BufferedReader reader, PrintWriter writer) {
		this.reader = reader;
		this.writer = writer;
	}

	public static void main(String[] args) {
		new GraphSelectMcpServer().run();
	}

	public void run() {
		logger.info("Starting MCP Server: {}", SERVER_NAME);
		try {
			while (true) {
				String line = reader.readLine();
				if (line == null) {
					return;
				}
				if (line.trim().isEmpty()) {
					continue;
				}
				try {
					JsonNode request = objectMapper.readTree(line);
					JsonNode response = handleRequest(request);
					if (response == null) {
						continue;
					}
					writer.println(objectMapper.writeValueAsString(response));
					writer.flush();
				} catch (Exception ex) {
					logger.error("Error processing request: {}", ex.getMessage(), ex);
					ObjectNode errorResponse = createErrorResponse(null, -32603, "Internal error", ex.getMessage());
					writer.println(objectMapper.writeValueAsString(errorResponse));
					writer.flush();
				}
			}
		} catch (IOException ioEx) {
			logger.error("IO error: {}", ioEx.getMessage(), ioEx);
		}
	}

	JsonNode handleRequest(JsonNode request) {
		String method = request.path("method").asText();
		JsonNode params = request.path("params");
		JsonNode id = request.path("id");
		logger.debug("Handling request: method={}, id={}", method, id);
		switch (method) {
			case "initialize":
				return handleInitialize(id);
			case "notifications/initialized":
				return null;
			case "tools/list":
				return handleToolsList(id);
			case "tools/call":
				return handleToolsCall(id, params);
			default:
				return createErrorResponse(id, -32601, "Method not found", "Unknown method: " + method);
		}
	}

	private JsonNode handleInitialize(JsonNode id) {
		ObjectNode result = objectMapper.createObjectNode();
		result.put("protocolVersion", "2024-11-05");

		ObjectNode tools = objectMapper.createObjectNode();
		tools.put("listChanged", false);
		ObjectNode capabilities = objectMapper.createObjectNode();
		capabilities.set("tools", tools);
		result.set("capabilities", capabilities);

		ObjectNode serverInfo = objectMapper.createObjectNode();
		serverInfo.put("name", SERVER_NAME);
		serverInfo.put("version", VERSION);
		result.set("serverInfo", serverInfo);
		return createResponse(id, result);
	}

	private JsonNode handleToolsList(JsonNode id) {
		ObjectNode result = objectMapper.createObjectNode();
		ArrayNode tools = objectMapper.createArrayNode();

		ObjectNode tool = objectMapper.createObjectNode();
		tool.put("name", TOOL_NAME);
		tool.put("description", "Resolve which nodes of a manifest's dependency graph the given selection specs pick.");

		ObjectNode inputSchema = objectMapper.createObjectNode();
		inputSchema.put("type", "object");

		ArrayNode required = objectMapper.createArrayNode();
		required.add("manifestPath");
		inputSchema.set("required", required);

		ObjectNode properties = objectMapper.createObjectNode();
		properties.set("manifestPath", createStringProperty("Path of the YAML manifest describing nodes, tags and dependencies."));
		properties.set("select", createSpecListProperty("Selection specs, OR'd together. Defaults to '*'. Examples: 'tag:nightly', '+orders', 'staging.*+', '@source:raw'."));
		properties.set("exclude", createSpecListProperty("Specs whose nodes are removed from the selection."));

		ObjectNode listPackagesProperty = objectMapper.createObjectNode();
		listPackagesProperty.put("type", "boolean");
		listPackagesProperty.put("description", "Return the package names in the manifest instead of a selection.");
		properties.set("listPackages", listPackagesProperty);

		inputSchema.set("properties", properties);
		tool.set("inputSchema", inputSchema);

		tools.add(tool);
		result.set("tools", tools);
		return createResponse(id, result);
	}

	private JsonNode handleToolsCall(JsonNode id, JsonNode params) {
		String toolName = params.path("name").asText();
		JsonNode arguments = params.path("arguments");
		logger.info("Calling tool: {}", toolName);

		if (TOOL_NAME.equals(toolName)) {
			return handleSelectNodes(id, arguments);
		}

		return createErrorResponse(id, -32601, "Tool not found", "Unknown tool: " + toolName);
	}

	private JsonNode handleSelectNodes(JsonNode id, JsonNode arguments) {
		String manifestPath = optionalText(arguments, "manifestPath");
		if (manifestPath == null) {
			manifestPath = optionalText(arguments, "manifest_path");
		}
		if (manifestPath == null) {
			return createErrorResponse(id, -32602, "Invalid parameters", "Missing required parameter: manifestPath");
		}
		File manifestFile = new File(manifestPath);
		if (!manifestFile.isFile()) {
			return createErrorResponse(id, -32602, "Invalid parameters", "manifestPath must point to an existing file: " + manifestPath);
		}

		List<String> select = specList(arguments.path("select"));
		List<String> exclude = specList(arguments.path("exclude"));
		boolean listPackages = arguments.path("listPackages").asBoolean(false);

		logger.info("Executing {}: manifestPath={}, select={}, exclude={}, listPackages={}",
			TOOL_NAME, manifestPath, select, exclude, listPackages);

		SelectionResult result = selectionService.performSelection(
			new SelectionRequest(manifestPath, select, exclude, listPackages));

		ObjectNode toolResult = objectMapper.createObjectNode();
		ArrayNode content = objectMapper.createArrayNode();
		ObjectNode textContent = objectMapper.createObjectNode();
		textContent.put("type", "text");

		StringBuilder resultText = new StringBuilder();
		List<String> items = listPackages ? result.getPackageNames() : result.getSelectedNodes();
		if (result.isSuccess()) {
			if (listPackages) {
				resultText.append("[SUCCESS] Found ").append(items.size()).append(" package(s).\n");
			} else {
				resultText.append("[SUCCESS] Selected ").append(items.size())
					.append(" of ").append(result.getTotalNodes()).append(" node(s).\n");
			}
			for (String item : items) {
				resultText.append("  ").append(item).append("\n");
			}
		} else {
			resultText.append("[ERROR] Node selection failed.\n");
			String errorMessage = result.getErrorMessage();
			if (errorMessage == null || errorMessage.trim().isEmpty()) {
				errorMessage = "An unknown error occurred.";
			}
			resultText.append("  ").append(errorMessage).append("\n");
		}

		textContent.put("text", resultText.toString());
		content.add(textContent);
		toolResult.set("content", content);
		toolResult.put("isError", !result.isSuccess());
		toolResult.put("executionTimeMs", result.getExecutionTimeMs());
		if (result.isSuccess()) {
			ArrayNode values = objectMapper.createArrayNode();
			for (String item : items) {
				values.add(item);
			}
			toolResult.set(listPackages ? "packages" : "selectedNodes", values);
		}
		return createResponse(id, toolResult);
	}

	private ObjectNode createResponse(JsonNode id, JsonNode result) {
		ObjectNode response = objectMapper.createObjectNode();
		response.put("jsonrpc", "2.0");
		response.set("id", id);
		response.set("result", result);
		return response;
	}

	private ObjectNode createErrorResponse(JsonNode id, int code, String message, String data) {
		ObjectNode response = objectMapper.createObjectNode();
		response.put("jsonrpc", "2.0");
		response.set("id", id);

		ObjectNode error = objectMapper.createObjectNode();
		error.put("code", code);
		error.put("message", message);
		if (data != null && !data.isEmpty()) {
			error.put("data", data);
		}
		response.set("error", error);
		return response;
	}

	private ObjectNode createStringProperty(String description) {
		ObjectNode property = objectMapper.createObjectNode();
		property.put("type", "string");
		property.put("description", description);
		return property;
	}

	private ObjectNode createSpecListProperty(String description) {
		ObjectNode property = objectMapper.createObjectNode();
		property.put("type", "array");
		property.put("description", description);
		ObjectNode items = objectMapper.createObjectNode();
		items.put("type", "string");
		property.set("items", items);
		return property;
	}

	/**
	 * Spec list argument: an array of specs, or a single spec string.
	 */
	private List<String> specList(JsonNode node) {
		List<String> specs = new ArrayList<>();
		Iterable<JsonNode> elements = node.isArray() ? node : Collections.singletonList(node);
		for (JsonNode element : elements) {
			if (element.isValueNode() && !element.isNull()) {
				specs.add(element.asText());
			}
		}
		return specs;
	}

	private String optionalText(JsonNode node, String fieldName) {
		if (node == null || node.isMissingNode()) {
			return null;
		}
		JsonNode value = node.get(fieldName);
		if (value == null || value.isNull()) {
			return null;
		}
		String text = value.asText("").trim();
		return text.isEmpty() ? null : text;
	}
}
