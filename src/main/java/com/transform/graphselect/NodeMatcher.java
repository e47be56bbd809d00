package com.transform.graphselect;

import java.util.Arrays;
import java.util.List;

/**
 * Decides whether one node satisfies a selector, independent of graph direction.
 */
public final class NodeMatcher {
	static final String WILDCARD = "*";

	private NodeMatcher() {
	}

	public static boolean matches(NodeMetadata node, SelectionCriteria criteria) {
		return matches(node, criteria.selectorType(), criteria.selectorValue());
	}

	public static boolean matches(NodeMetadata node, SelectorType type, String value) {
		switch (type) {
			case TAG:
				return node.tags().contains(value);
			case SOURCE:
				return node.kind() == ResourceKind.SOURCE && matchesFqn(node.path(), value);
			case FQN:
				return matchesFqn(node.path(), value);
			default:
				throw new IllegalStateException("Unhandled selector type " + type);
		}
	}

	/**
	 * Dotted name pattern against a namespace path. The pattern may name the node with or
	 * without its package, and may stop at any directory-style prefix of the path.
	 */
	public static boolean matchesFqn(NamespacePath path, String pattern) {
		if (WILDCARD.equals(pattern)) {
			return true;
		}
		return isSelectedNode(path.segments(), splitPattern(pattern));
	}

	/**
	 * Segment-level form of {@link #matchesFqn}: {@code pattern}, with a trailing {@code *}
	 * dropped, must be a prefix of {@code path} or of {@code path} minus its first segment.
	 */
	public static boolean isSelectedNode(List<String> path, List<String> pattern) {
		List<String> effective = pattern;
		if (!effective.isEmpty() && WILDCARD.equals(effective.get(effective.size() - 1))) {
			effective = effective.subList(0, effective.size() - 1);
		}
		if (isPrefix(effective, path)) {
			return true;
		}
		return !path.isEmpty() && isPrefix(effective, path.subList(1, path.size()));
	}

	static List<String> splitPattern(String pattern) {
		// keep empty segments so "X." or "X..a" never match
		return Arrays.asList(pattern.split("\\.", -1));
	}

	private static boolean isPrefix(List<String> prefix, List<String> candidate) {
		if (prefix.size() > candidate.size()) {
			return false;
		}
		for (int i = 0; i < prefix.size(); i++) {
			if (!prefix.get(i).equals(candidate.get(i))) {
				return false;
			}
		}
		return true;
	}
}
