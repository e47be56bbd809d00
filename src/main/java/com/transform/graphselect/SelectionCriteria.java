package com.transform.graphselect;

import java.util.Objects;

/**
 * One compiled selection spec.
 * <p>
 * Grammar: an optional leading {@code @} or leading {@code +}, a body, and an optional
 * trailing {@code +}. The body is {@code tag:<value>}, {@code source:<value>} or a
 * dotted name pattern, in which dots and {@code *} are kept verbatim.
 * <ul>
 *   <li>{@code +body}: the matched nodes and everything they depend on</li>
 *   <li>{@code body+}: the matched nodes and everything that depends on them</li>
 *   <li>{@code @body}: the matched nodes, their descendants, and all ancestors of those</li>
 * </ul>
 * {@code @} cannot be combined with a trailing {@code +}. Surrounding whitespace is
 * ignored; whitespace inside a spec is rejected.
 */
public final class SelectionCriteria {
	static final char PARENTS_MARKER = '+';
	static final char CHILDREN_MARKER = '+';
	static final char CHILDRENS_PARENTS_MARKER = '@';

	private final String rawSpec;
	private final boolean selectParents;
	private final boolean selectChildren;
	private final boolean selectChildrensParents;
	private final SelectorType selectorType;
	private final String selectorValue;

	private SelectionCriteria(String rawSpec, boolean selectParents, boolean selectChildren,
	                          boolean selectChildrensParents, SelectorType selectorType, String selectorValue) {
		this.rawSpec = rawSpec;
		this.selectParents = selectParents;
		this.selectChildren = selectChildren;
		this.selectChildrensParents = selectChildrensParents;
		this.selectorType = selectorType;
		this.selectorValue = selectorValue;
	}

	/**
	 * Compiles a single spec string.
	 *
	 * @throws InvalidSelectorException if the spec is blank, contains inner whitespace, has an
	 *                                  empty body, or combines {@code @} with another directional
	 *                                  modifier
	 */
	public static SelectionCriteria parse(String spec) {
		if (spec == null || spec.trim().isEmpty()) {
			throw new InvalidSelectorException(spec, "selector cannot be empty");
		}
		String trimmed = spec.trim();
		for (int i = 0; i < trimmed.length(); i++) {
			if (Character.isWhitespace(trimmed.charAt(i))) {
				throw new InvalidSelectorException(spec, "selector cannot contain whitespace");
			}
		}
		int start = 0;
		int end = trimmed.length();

		boolean childrensParents = false;
		boolean parents = false;
		boolean children = false;

		if (trimmed.charAt(0) == CHILDRENS_PARENTS_MARKER) {
			childrensParents = true;
			start = 1;
			if (start < end && trimmed.charAt(start) == PARENTS_MARKER) {
				throw new InvalidSelectorException(spec, "'@' cannot be combined with a leading '+'");
			}
		} else if (trimmed.charAt(0) == PARENTS_MARKER) {
			parents = true;
			start = 1;
		}
		if (end > start && trimmed.charAt(end - 1) == CHILDREN_MARKER) {
			children = true;
			end--;
		}
		if (childrensParents && children) {
			throw new InvalidSelectorException(spec, "'@' cannot be combined with a trailing '+'");
		}
		if (start >= end) {
			throw new InvalidSelectorException(spec, "selector has no body");
		}

		String body = trimmed.substring(start, end);
		SelectorType type = SelectorType.FQN;
		String value = body;
		for (SelectorType candidate : SelectorType.values()) {
			String prefix = candidate.prefix();
			if (prefix != null && body.startsWith(prefix)) {
				type = candidate;
				value = body.substring(prefix.length());
				break;
			}
		}
		if (value.isEmpty()) {
			throw new InvalidSelectorException(spec, "'" + type.prefix() + "' selector has no value");
		}
		return new SelectionCriteria(spec, parents, children, childrensParents, type, value);
	}

	public String rawSpec() {
		return rawSpec;
	}

	public boolean selectParents() {
		return selectParents;
	}

	public boolean selectChildren() {
		return selectChildren;
	}

	public boolean selectChildrensParents() {
		return selectChildrensParents;
	}

	public SelectorType selectorType() {
		return selectorType;
	}

	public String selectorValue() {
		return selectorValue;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof SelectionCriteria)) return false;
		SelectionCriteria other = (SelectionCriteria) obj;
		return selectParents == other.selectParents
			&& selectChildren == other.selectChildren
			&& selectChildrensParents == other.selectChildrensParents
			&& selectorType == other.selectorType
			&& selectorValue.equals(other.selectorValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(selectParents, selectChildren, selectChildrensParents, selectorType, selectorValue);
	}

	@Override
	public String toString() {
		return "SelectionCriteria{spec=" + rawSpec
			+ ", type=" + selectorType
			+ ", value=" + selectorValue
			+ ", parents=" + selectParents
			+ ", children=" + selectChildren
			+ ", childrensParents=" + selectChildrensParents + "}";
	}
}
