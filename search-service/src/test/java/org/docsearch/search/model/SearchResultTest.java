package org.docsearch.search.model;

import org.docsearch.core.model.DocumentRecord;
import org.docsearch.core.model.SearchHit;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class SearchResultTest {

	private static DocumentRecord record(String content) {
		return new DocumentRecord("doc1", content, "Title", null, 3, 3, 0L);
	}

	@Test
	public void testShortContentIsKeptWhole() {
		SearchResult result = SearchResult.fromHit(new SearchHit("doc1", 0.25, record("short text")));

		assertEquals("short text", result.snippet());
		assertEquals("Title", result.title());
		assertNull(result.author());
	}

	@Test
	public void testLongContentIsTruncatedWithEllipsis() {
		String content = "x".repeat(250);

		SearchResult result = SearchResult.fromHit(new SearchHit("doc1", 0.25, record(content)));

		assertEquals(203, result.snippet().length());
		assertTrue(result.snippet().endsWith("..."));
		assertEquals("x".repeat(200), result.snippet().substring(0, 200));
	}

	@Test
	public void testContentOfExactlySnippetLengthHasNoEllipsis() {
		String content = "y".repeat(SearchResult.SNIPPET_LENGTH);

		assertEquals(content, SearchResult.snippet(content));
	}

	@Test
	public void testSnippetCountsCodePointsAndKeepsSurrogatePairsWhole() {
		String emoji = "\uD83D\uDE00";
		String content = "a".repeat(199) + emoji + "tail";

		String snippet = SearchResult.snippet(content);

		assertEquals("a".repeat(199) + emoji + "...", snippet);
		assertEquals(snippet, new String(snippet.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8));
	}

	@Test
	public void testContentOfSnippetLengthInCodePointsIsKeptWhole() {
		String content = "\uD83D\uDE00".repeat(SearchResult.SNIPPET_LENGTH);

		assertEquals(content, SearchResult.snippet(content));
	}

	@Test
	public void testScoreIsRoundedToFourPlaces() {
		SearchResult result = SearchResult.fromHit(new SearchHit("doc1", 1.0 / 3, record("abc")));

		assertEquals(0.3333, result.score(), 1e-12);
	}
}
