package com.transform.graphselect;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SelectionCriteriaTest {

	@Test
	public void parsesModifiersOnPlainNames() {
		assertParsed("a", false, false, SelectorType.FQN, "a", false);
		assertParsed("+a", true, false, SelectorType.FQN, "a", false);
		assertParsed("a+", false, true, SelectorType.FQN, "a", false);
		assertParsed("+a+", true, true, SelectorType.FQN, "a", false);
		assertParsed("@a", false, false, SelectorType.FQN, "a", true);
		assertInvalid("@a+");
	}

	@Test
	public void parsesModifiersOnDottedNames() {
		assertParsed("a.b", false, false, SelectorType.FQN, "a.b", false);
		assertParsed("+a.b", true, false, SelectorType.FQN, "a.b", false);
		assertParsed("a.b+", false, true, SelectorType.FQN, "a.b", false);
		assertParsed("+a.b+", true, true, SelectorType.FQN, "a.b", false);
		assertParsed("@a.b", false, false, SelectorType.FQN, "a.b", true);
		assertInvalid("@a.b+");
	}

	@Test
	public void keepsWildcardsVerbatim() {
		assertParsed("a.b.*", false, false, SelectorType.FQN, "a.b.*", false);
		assertParsed("+a.b.*", true, false, SelectorType.FQN, "a.b.*", false);
		assertParsed("a.b.*+", false, true, SelectorType.FQN, "a.b.*", false);
		assertParsed("+a.b.*+", true, true, SelectorType.FQN, "a.b.*", false);
		assertParsed("@a.b.*", false, false, SelectorType.FQN, "a.b.*", true);
		assertParsed("*", false, false, SelectorType.FQN, "*", false);
		assertInvalid("@a.b*+");
	}

	@Test
	public void parsesTagSelectors() {
		assertParsed("tag:a", false, false, SelectorType.TAG, "a", false);
		assertParsed("+tag:a", true, false, SelectorType.TAG, "a", false);
		assertParsed("tag:a+", false, true, SelectorType.TAG, "a", false);
		assertParsed("+tag:a+", true, true, SelectorType.TAG, "a", false);
		assertParsed("@tag:a", false, false, SelectorType.TAG, "a", true);
		assertInvalid("@tag:a+");
	}

	@Test
	public void parsesSourceSelectors() {
		assertParsed("source:a", false, false, SelectorType.SOURCE, "a", false);
		assertParsed("source:a+", false, true, SelectorType.SOURCE, "a", false);
		assertParsed("+source:a.b", true, false, SelectorType.SOURCE, "a.b", false);
		assertParsed("@source:a", false, false, SelectorType.SOURCE, "a", true);
		assertInvalid("@source:a+");
	}

	@Test
	public void unknownPrefixFallsBackToFqn() {
		assertParsed("config:a", false, false, SelectorType.FQN, "config:a", false);
		assertParsed("tags:a", false, false, SelectorType.FQN, "tags:a", false);
	}

	@Test
	public void rejectsEmptyBodies() {
		assertInvalid("");
		assertInvalid("   ");
		assertInvalid(null);
		assertInvalid("+");
		assertInvalid("++");
		assertInvalid("@");
		assertInvalid("tag:");
		assertInvalid("+source:+");
	}

	@Test
	public void rejectsAtCombinedWithLeadingPlus() {
		assertInvalid("@+a");
	}

	@Test
	public void ignoresSurroundingWhitespace() {
		assertParsed("  +a.b+\t", true, true, SelectorType.FQN, "a.b", false);
	}

	@Test
	public void rejectsWhitespaceInsideSpec() {
		assertInvalid("a +");
		assertInvalid("+ a");
		assertInvalid("@ a");
		assertInvalid("tag: nightly");
		assertInvalid("a .b");
	}

	@Test
	public void invalidSpecIsReportedInError() {
		InvalidSelectorException ex = assertThrows(InvalidSelectorException.class, () -> SelectionCriteria.parse("@orders+"));
		assertEquals("@orders+", ex.getSpec());
		assertTrue(ex.getMessage().contains("@orders+"));
	}

	@Test
	public void parsingIsDeterministic() {
		assertEquals(SelectionCriteria.parse("+tag:nightly+"), SelectionCriteria.parse("+tag:nightly+"));
		assertNotEquals(SelectionCriteria.parse("tag:nightly+"), SelectionCriteria.parse("+tag:nightly"));
	}

	private void assertParsed(String spec, boolean parents, boolean children, SelectorType type, String value, boolean childrensParents) {
		SelectionCriteria parsed = SelectionCriteria.parse(spec);
		assertEquals(parents, parsed.selectParents(), () -> spec + " parents");
		assertEquals(children, parsed.selectChildren(), () -> spec + " children");
		assertEquals(type, parsed.selectorType(), () -> spec + " type");
		assertEquals(value, parsed.selectorValue(), () -> spec + " value");
		assertEquals(childrensParents, parsed.selectChildrensParents(), () -> spec + " childrens parents");
		assertEquals(spec, parsed.rawSpec());
	}

	private void assertInvalid(String spec) {
		assertThrows(InvalidSelectorException.class, () -> SelectionCriteria.parse(spec), () -> "expected '" + spec + "' to be rejected");
	}
}
