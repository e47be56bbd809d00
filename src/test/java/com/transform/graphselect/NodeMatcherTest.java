package com.transform.graphselect;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NodeMatcherTest {

	@Test
	public void matchesWithOrWithoutPackage() {
		assertSelected(path("X", "a"), "a", true);
		assertSelected(path("X", "a"), "X.a", true);
		assertSelected(path("X", "a"), "*", true);
		assertSelected(path("X", "a"), "X.*", true);
	}

	@Test
	public void matchesAnyLeadingPrefixOfDeeperPaths() {
		assertSelected(path("X", "a", "b", "c"), "X.*", true);
		assertSelected(path("X", "a", "b", "c"), "X.a.*", true);
		assertSelected(path("X", "a", "b", "c"), "X.a.b.*", true);
		assertSelected(path("X", "a", "b", "c"), "X.a.b.c", true);
		assertSelected(path("X", "a", "b", "c"), "X.a", true);
		assertSelected(path("X", "a", "b", "c"), "X.a.b", true);
		assertSelected(path("X", "a", "b", "c"), "a.b", true);
		assertSelected(path("X", "a", "b", "c"), "a.b.c.*", true);
	}

	@Test
	public void rejectsNonMatchingPatterns() {
		assertSelected(path("X", "a"), "b", false);
		assertSelected(path("X", "a"), "X.b", false);
		assertSelected(path("X", "a"), "X.a.b", false);
		assertSelected(path("X", "a"), "Y.*", false);
		assertSelected(path("X", "a", "b", "c"), "b", false);
		assertSelected(path("X", "a", "b", "c"), "X.b", false);
	}

	@Test
	public void wildcardOnlyCountsInLastPosition() {
		assertSelected(path("X", "a", "b"), "X.*.b", false);
		assertSelected(path("X", "*", "b"), "X.*.b", true);
	}

	@Test
	public void emptySegmentsNeverMatch() {
		assertSelected(path("X", "a"), "X.", false);
		assertSelected(path("X", "a"), "X..a", false);
		assertSelected(path("X", "a"), ".a", false);
	}

	@Test
	public void fullPathAndStrippedPathAreBothTried() {
		// package and first folder share a name; either reading may match
		assertSelected(path("X", "X", "a"), "X.a", true);
		assertSelected(path("X", "X", "a"), "X.X.a", true);
		assertSelected(path("X", "X", "a"), "X.X", true);
		assertSelected(path("X", "X", "a"), "X.X.X", false);
	}

	@Test
	public void isSelectedNodeOnRawSegments() {
		assertTrue(NodeMatcher.isSelectedNode(Arrays.asList("X", "a"), Arrays.asList("a")));
		assertTrue(NodeMatcher.isSelectedNode(Arrays.asList("X", "a"), Arrays.asList("*")));
		assertTrue(NodeMatcher.isSelectedNode(Arrays.asList("X", "a"), Collections.emptyList()));
		assertFalse(NodeMatcher.isSelectedNode(Arrays.asList("X", "a"), Arrays.asList("X", "a", "*", "b")));
	}

	@Test
	public void tagSelectorUsesTagSet() {
		NodeMetadata node = NodeMetadata.model(path("X", "a"), new LinkedHashSet<>(Arrays.asList("nightly", "finance")));
		assertTrue(NodeMatcher.matches(node, SelectorType.TAG, "nightly"));
		assertTrue(NodeMatcher.matches(node, SelectorType.TAG, "finance"));
		assertFalse(NodeMatcher.matches(node, SelectorType.TAG, "a"));
		assertFalse(NodeMatcher.matches(node, SelectorType.TAG, "night"));
	}

	@Test
	public void sourceSelectorRequiresSourceKind() {
		NodeMetadata source = NodeMetadata.source(path("shop", "raw", "orders"), null);
		NodeMetadata model = NodeMetadata.model(path("shop", "raw", "orders"), null);
		assertTrue(NodeMatcher.matches(source, SelectorType.SOURCE, "raw"));
		assertTrue(NodeMatcher.matches(source, SelectorType.SOURCE, "shop.raw.orders"));
		assertTrue(NodeMatcher.matches(source, SelectorType.SOURCE, "raw.*"));
		assertFalse(NodeMatcher.matches(source, SelectorType.SOURCE, "raw.customers"));
		assertFalse(NodeMatcher.matches(model, SelectorType.SOURCE, "raw"));
		assertTrue(NodeMatcher.matches(model, SelectorType.FQN, "raw"));
	}

	@Test
	public void matchesParsedCriteria() {
		NodeMetadata node = NodeMetadata.model(path("X", "staging", "orders"), Collections.singleton("abc"));
		assertTrue(NodeMatcher.matches(node, SelectionCriteria.parse("+staging.*+")));
		assertTrue(NodeMatcher.matches(node, SelectionCriteria.parse("@tag:abc")));
		assertFalse(NodeMatcher.matches(node, SelectionCriteria.parse("orders")));
	}

	private static NamespacePath path(String... segments) {
		return NamespacePath.of(segments);
	}

	private static void assertSelected(NamespacePath path, String pattern, boolean expected) {
		NodeMetadata node = NodeMetadata.model(path, Collections.emptySet());
		assertEquals(expected, NodeMatcher.matches(node, SelectorType.FQN, pattern), () -> pattern + " against " + path);
		List<String> segments = NodeMatcher.splitPattern(pattern);
		if (!NodeMatcher.WILDCARD.equals(pattern)) {
			assertEquals(expected, NodeMatcher.isSelectedNode(path.segments(), segments), () -> segments + " against " + path);
		}
	}
}
