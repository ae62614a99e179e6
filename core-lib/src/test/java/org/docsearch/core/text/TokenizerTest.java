package org.docsearch.core.text;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TokenizerTest {
	private final Tokenizer tokenizer = new Tokenizer();

	@Test
	public void testLowercasesAndStripsPunctuation() {
		List<String> terms = tokenizer.tokenize("Python 3.10+ is awesome! It's the best language.");

		assertEquals(List.of("python", "310", "is", "awesome", "its", "best", "language"), terms);
	}

	@Test
	public void testStopWordsRemovedAndOrderPreserved() {
		assertEquals(List.of("cat", "hat", "mat"), tokenizer.tokenize("The cat and the hat on a mat"));
	}

	@Test
	public void testDuplicatesAreKept() {
		assertEquals(List.of("data", "science", "data"), tokenizer.tokenize("data science, data"));
	}

	@Test
	public void testEmptyInputs() {
		assertTrue(tokenizer.tokenize(null).isEmpty());
		assertTrue(tokenizer.tokenize("").isEmpty());
		assertTrue(tokenizer.tokenize("   \t\n ").isEmpty());
		assertTrue(tokenizer.tokenize("The and of, by!!! ...").isEmpty());
	}

	@Test
	public void testUnicodeLettersCountAsWordCharacters() {
		assertEquals(List.of("café", "straße", "naïve"), tokenizer.tokenize("Café Straße, naïve!"));
	}

	@Test
	public void testAllUnicodeNumbersCountAsWordCharacters() {
		assertEquals(List.of("x²", "½", "ⅻ"), tokenizer.tokenize("x² ½ Ⅻ"));
	}

	@Test
	public void testCombiningMarksAreStripped() {
		assertEquals(List.of("cafe", "resume"), tokenizer.tokenize("cafe\u0301 re\u0301sume\u0301"));
	}

	@Test
	public void testInformationSeparatorsSplitTerms() {
		assertEquals(List.of("a", "b", "c", "d", "e"), tokenizer.tokenize("a\u001Cb\u001Dc\u001Ed\u001Fe"));
	}

	@Test
	public void testUnderscoreIsAWordCharacter() {
		assertEquals(List.of("snake_case", "value"), tokenizer.tokenize("snake_case value"));
	}

	@Test
	public void testNormalizeKeepsWhitespace() {
		assertEquals("hello world", tokenizer.normalize("Hello, World!"));
	}

	@Test
	public void testDeterministic() {
		String text = "Search engines rank documents; documents contain terms.";
		assertEquals(tokenizer.tokenize(text), tokenizer.tokenize(text));
		assertEquals(tokenizer.tokenize(text), new Tokenizer().tokenize(text));
	}

	@Test
	public void testCustomStopWords() {
		Tokenizer custom = new Tokenizer(Set.of("python"));

		assertEquals(List.of("the", "language"), custom.tokenize("The Python language"));
		assertEquals(Set.of("python"), custom.stopWords());
	}
}
