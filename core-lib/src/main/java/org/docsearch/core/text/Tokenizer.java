package org.docsearch.core.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns text into the ordered sequence of terms used both for indexing and for queries.
 *
 * <p>Text is lowercased, every character that is neither a word character nor whitespace is dropped (Unicode letters,
 * any Unicode number such as {@code ²} or {@code ½}, and underscore count as word characters; combining marks do not),
 * the rest is split on whitespace and stopwords are removed. The same input always yields the same terms.</p>
 */
public final class Tokenizer {
	public static final Set<String> DEFAULT_STOP_WORDS = Set.of(
			"the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by"
	);

	private static final Pattern NON_WORD_PATTERN =
			Pattern.compile("[^\\p{L}\\p{N}_\\s\\x1C-\\x1F]", Pattern.UNICODE_CHARACTER_CLASS);
	// the information separators 0x1C-0x1F split terms like ordinary whitespace
	private static final Pattern WHITESPACE_PATTERN =
			Pattern.compile("[\\s\\x1C-\\x1F]+", Pattern.UNICODE_CHARACTER_CLASS);

	private final Set<String> stopWords;

	public Tokenizer() {
		this(DEFAULT_STOP_WORDS);
	}

	public Tokenizer(Set<String> stopWords) {
		this.stopWords = Set.copyOf(stopWords);
	}

	/**
	 * Tokenize text, keeping duplicates and their order
	 *
	 * @return the surviving terms, empty for null, blank or stopword-only input
	 */
	public List<String> tokenize(String text) {
		if (text == null || text.isBlank()) {
			return List.of();
		}

		List<String> terms = new ArrayList<>();
		for (String token : WHITESPACE_PATTERN.split(normalize(text))) {
			if (isValidTerm(token)) {
				terms.add(token);
			}
		}
		return terms;
	}

	/**
	 * Lowercase and strip punctuation, leaving whitespace in place
	 */
	String normalize(String text) {
		return NON_WORD_PATTERN.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
	}

	private boolean isValidTerm(String token) {
		return !token.isEmpty() && !stopWords.contains(token);
	}

	public Set<String> stopWords() {
		return stopWords;
	}
}
