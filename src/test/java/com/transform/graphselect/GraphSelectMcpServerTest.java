package com.transform.graphselect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GraphSelectMcpServerTest {
	private final ObjectMapper mapper = new ObjectMapper();

	@Test
	public void answersInitializeAndToolsList() throws Exception {
		List<JsonNode> responses = exchange(
			"{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}",
			"{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}",
			"",
			"{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}");
		assertEquals(2, responses.size());
		assertEquals("2024-11-05", responses.get(0).path("result").path("protocolVersion").asText());
		JsonNode tool = responses.get(1).path("result").path("tools").get(0);
		assertEquals(GraphSelectMcpServer.TOOL_NAME, tool.path("name").asText());
		assertEquals("manifestPath", tool.path("inputSchema").path("required").get(0).asText());
	}

	@Test
	public void selectsNodesThroughToolCall() throws Exception {
		ToolCall call = new ToolCall(7)
			.argument("manifestPath", GraphSelectionServiceTest.shopManifest())
			.argument("select", mapper.createArrayNode().add("+marts.fct_orders"))
			.argument("exclude", mapper.createArrayNode().add("source:raw").add("staging.stg_customers"));
		JsonNode response = exchange(call.toJson()).get(0);

		JsonNode result = response.path("result");
		assertEquals(7, response.path("id").asInt());
		assertFalse(result.path("isError").asBoolean(true));
		List<String> selected = new ArrayList<>();
		result.path("selectedNodes").forEach(node -> selected.add(node.asText()));
		assertEquals(Arrays.asList("model.shop.marts.fct_orders", "model.shop.staging.stg_orders"), selected);
		assertTrue(result.path("content").get(0).path("text").asText().startsWith("[SUCCESS] Selected 2 of 6"));
	}

	@Test
	public void reportsSelectionErrorsAsToolErrors() throws Exception {
		ToolCall call = new ToolCall(8)
			.argument("manifestPath", GraphSelectionServiceTest.shopManifest())
			.argument("select", mapper.getNodeFactory().textNode("@staging.stg_orders+"));
		JsonNode result = exchange(call.toJson()).get(0).path("result");
		assertTrue(result.path("isError").asBoolean());
		assertTrue(result.path("content").get(0).path("text").asText().contains("@staging.stg_orders+"));
	}

	@Test
	public void rejectsMissingManifestParameter() throws Exception {
		JsonNode response = exchange(new ToolCall(9).toJson()).get(0);
		assertEquals(-32602, response.path("error").path("code").asInt());
	}

	@Test
	public void rejectsUnknownMethodsAndTools() throws Exception {
		List<JsonNode> responses = exchange(
			"{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"resources/list\"}",
			"{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"tools/call\",\"params\":{\"name\":\"drop_tables\"}}",
			"not json");
		assertEquals(-32601, responses.get(0).path("error").path("code").asInt());
		assertEquals(-32601, responses.get(1).path("error").path("code").asInt());
		assertEquals(-32603, responses.get(2).path("error").path("code").asInt());
	}

	private List<JsonNode> exchange(String... lines) throws Exception {
		StringWriter out = new StringWriter();
		BufferedReader in = new BufferedReader(new StringReader(String.join("\n", lines) + "\n"));
		new GraphSelectMcpServer(in, new PrintWriter(out, true)).run();
		List<JsonNode> responses = new ArrayList<>();
		for (String line : out.toString().split("\\R")) {
			if (!line.trim().isEmpty()) {
				responses.add(mapper.readTree(line));
			}
		}
		return responses;
	}

	private final class ToolCall {
		private final ObjectNode request = mapper.createObjectNode();
		private final ObjectNode arguments;

		ToolCall(int id) {
			request.put("jsonrpc", "2.0");
			request.put("id", id);
			request.put("method", "tools/call");
			ObjectNode params = request.putObject("params");
			params.put("name", GraphSelectMcpServer.TOOL_NAME);
			arguments = params.putObject("arguments");
		}

		ToolCall argument(String name, String value) {
			arguments.put(name, value);
			return this;
		}

		ToolCall argument(String name, JsonNode value) {
			arguments.set(name, value);
			return this;
		}

		String toJson() throws Exception {
			return mapper.writeValueAsString(request);
		}
	}
}
