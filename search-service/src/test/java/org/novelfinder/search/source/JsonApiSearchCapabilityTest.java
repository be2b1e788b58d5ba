package org.novelfinder.search.source;

import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.novelfinder.core.model.RawHit;
import org.novelfinder.core.source.SearchOptions;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class JsonApiSearchCapabilityTest {
	private Javalin upstream;
	private final HttpClient httpClient = HttpClient.newHttpClient();

	@BeforeEach
	public void startUpstream() {
		upstream = Javalin.create(cfg -> cfg.showJavalinBanner = false);
		upstream.get("/plain", ctx -> ctx.contentType("application/json").result(
				"[{\"title\": \"Martial Peak\", \"url\": \"/novel/martial-peak\", \"score\": 9.1},"
						+ " {\"title\": \"Query Was " + ctx.queryParam("q") + "\", \"url\": \"https://other.example/x\"},"
						+ " {\"title\": null, \"url\": \"/novel/untitled\"}]"));
		upstream.get("/wrapped", ctx -> ctx.contentType("application/json").result(
				"{\"total\": 1, \"novels\": [{\"name\": \"Solo Leveling\", \"link\": \"/solo\", \"tags\": [\"action\"]}]}"));
		upstream.get("/broken", ctx -> ctx.contentType("application/json").result(
				"[{\"title\": \"Fine\", \"url\": \"/fine\"}, 42]"));
		upstream.get("/error", ctx -> ctx.status(503).result("unavailable"));
		upstream.start(0);
	}

	@AfterEach
	public void stopUpstream() {
		upstream.stop();
	}

	private JsonApiSearchCapability capability(String path, String resultsField, String titleField, String urlField) {
		String searchUrl = "http://localhost:" + upstream.port() + path + "?q={query}";
		SourceDefinition definition = new SourceDefinition("test", searchUrl, List.of(searchUrl),
				resultsField, titleField, urlField);
		return new JsonApiSearchCapability(definition, httpClient, Duration.ofSeconds(5));
	}

	@Test
	public void testStreamsTopLevelArray() throws Exception {
		List<RawHit> hits;
		try (Stream<RawHit> stream = capability("/plain", null, null, null).search("martial peak", SearchOptions.forFanOut())) {
			hits = stream.collect(Collectors.toList());
		}

		assertEquals(3, hits.size());
		assertEquals("Martial Peak", hits.get(0).title());
		assertEquals("http://localhost:" + upstream.port() + "/novel/martial-peak", hits.get(0).url());
		assertEquals("Query Was martial peak", hits.get(1).title());
		assertEquals("https://other.example/x", hits.get(1).url());
		assertNull(hits.get(2).title());
	}

	@Test
	public void testReadsNestedArrayWithCustomFields() throws Exception {
		List<RawHit> hits;
		try (Stream<RawHit> stream = capability("/wrapped", "novels", "name", "link").search("solo", SearchOptions.forFanOut())) {
			hits = stream.collect(Collectors.toList());
		}

		assertEquals(1, hits.size());
		assertEquals("Solo Leveling", hits.get(0).title());
		assertTrue(hits.get(0).url().endsWith("/solo"));
	}

	@Test
	public void testMissingResultsFieldIsAnError() {
		assertThrows(IOException.class,
				() -> capability("/wrapped", "results", null, null).search("solo", SearchOptions.forFanOut()));
	}

	@Test
	public void testHitsAreParsedLazily() throws Exception {
		try (Stream<RawHit> stream = capability("/broken", null, null, null).search("x", SearchOptions.forFanOut())) {
			Iterator<RawHit> iterator = stream.iterator();

			assertEquals("Fine", iterator.next().title());
			assertThrows(RuntimeException.class, iterator::next);
		}
	}

	@Test
	public void testHttpErrorStatusIsAnIOException() {
		IOException error = assertThrows(IOException.class,
				() -> capability("/error", null, null, null).search("x", SearchOptions.forFanOut()));

		assertTrue(error.getMessage().contains("HTTP 503"));
	}

	@Test
	public void testUnreachableSourceIsAnIOException() {
		SourceDefinition definition = new SourceDefinition("dead", "http://localhost:1/search?q={query}",
				List.of("http://localhost:1/"), null, null, null);
		JsonApiSearchCapability dead = new JsonApiSearchCapability(definition, httpClient, Duration.ofSeconds(2));

		assertThrows(IOException.class, () -> dead.search("x", SearchOptions.forFanOut()));
	}

	@Test
	public void testIdComesFromDefinition() {
		assertEquals("test", capability("/plain", null, null, null).id());
	}
}
