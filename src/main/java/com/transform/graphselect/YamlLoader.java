package com.transform.graphselect;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;

import java.io.IOException;

/**
 * Parses YAML text into a Jackson tree. Syntax errors are reported with the surrounding
 * lines of the input so the offending spot can be found without opening the file.
 */
public final class YamlLoader {
	static final int CONTEXT_LINES = 3;
	static final String RULE = "------------------------------";
	static final String MULTIPLE_DOCUMENTS = "expected a single document in the stream, but found another document";

	private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

	private YamlLoader() {
	}

	/**
	 * @return the parsed document; a missing node for empty input
	 * @throws ValidationException if the text is not valid YAML or holds more than one document
	 */
	public static JsonNode loadText(String contents) {
		if (contents == null) {
			throw new ValidationException("YAML contents cannot be null");
		}
		try (JsonParser parser = YAML_MAPPER.getFactory().createParser(contents)) {
			JsonNode root = YAML_MAPPER.readTree(parser);
			if (root == null) {
				return MissingNode.getInstance();
			}
			if (parser.nextToken() != null) {
				throw new ValidationException(describeExtraDocument(contents, parser.getTokenLocation()));
			}
			return root;
		} catch (JsonProcessingException ex) {
			throw new ValidationException(describeError(contents, ex), ex);
		} catch (IOException ex) {
			throw new ValidationException("Failed to read YAML: " + ex.getMessage(), ex);
		}
	}

	static String describeExtraDocument(String contents, JsonLocation location) {
		if (location != null && location.getLineNr() > 0) {
			return contextualizedError(contents, location.getLineNr() - 1, MULTIPLE_DOCUMENTS);
		}
		return MULTIPLE_DOCUMENTS;
	}

	static String describeError(String contents, JsonProcessingException ex) {
		MarkedYAMLException marked = findMarkedCause(ex);
		if (marked != null && marked.getProblemMark() != null) {
			Mark mark = marked.getProblemMark();
			return contextualizedError(contents, mark.getLine(), marked.getMessage());
		}
		JsonLocation location = ex.getLocation();
		if (location != null && location.getLineNr() > 0) {
			return contextualizedError(contents, location.getLineNr() - 1, ex.getOriginalMessage());
		}
		return ex.getOriginalMessage();
	}

	/**
	 * Builds the error report for a zero-based {@code errorLine}.
	 */
	static String contextualizedError(String contents, int errorLine, String rawError) {
		int from = Math.max(errorLine - CONTEXT_LINES, 0);
		int to = errorLine + CONTEXT_LINES + 1;
		return "Syntax error near line " + (errorLine + 1) + "\n"
			+ RULE + "\n"
			+ prefixWithLineNumbers(contents, from, to) + "\n"
			+ "\n"
			+ "Raw Error:\n"
			+ RULE + "\n"
			+ rawError;
	}

	/**
	 * Lines {@code from} (inclusive) to {@code to} (exclusive), zero-based, each prefixed
	 * with its one-based number. Bounds past the end of the text are clipped.
	 */
	static String prefixWithLineNumbers(String contents, int from, int to) {
		String[] lines = contents.split("\n", -1);
		int end = Math.min(to, lines.length);
		StringBuilder builder = new StringBuilder();
		for (int i = from; i < end; i++) {
			if (builder.length() > 0) {
				builder.append('\n');
			}
			builder.append(lineNo(i + 1, lines[i]));
		}
		return builder.toString();
	}

	static String lineNo(int number, String line) {
		return String.format("%-3s| %s", number, line);
	}

	private static MarkedYAMLException findMarkedCause(Throwable ex) {
		Throwable current = ex;
		while (current != null) {
			if (current instanceof MarkedYAMLException) {
				return (MarkedYAMLException) current;
			}
			if (current.getCause() == current) {
				break;
			}
			current = current.getCause();
		}
		return null;
	}
}
