package org.novelfinder.search.service;

import org.junit.jupiter.api.Test;
import org.novelfinder.core.model.SearchResult;
import org.novelfinder.core.source.CapabilityResolver;
import org.novelfinder.core.source.SearchCapability;
import org.novelfinder.search.session.SearchSession;
import org.novelfinder.search.support.FakeCapability;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.novelfinder.search.support.FakeCapability.hit;

public class SearchDispatcherTest {
	private final Map<String, SearchCapability> sources = new HashMap<>();
	private final CapabilityResolver resolver = reference -> Optional.ofNullable(sources.get(reference));

	private SearchDispatcher dispatcher(int maxConcurrency, Duration timeout) {
		return new SearchDispatcher(resolver, maxConcurrency, timeout);
	}

	private static SearchSession session(String query, List<String> references) {
		return new SearchSession("test", query, references);
	}

	@Test
	public void testMirrorsAreSearchedOnce() {
		FakeCapability capability = FakeCapability.returning("novel-site", hit("Martial Peak", "https://a.com/1"));
		List<String> mirrors = new ArrayList<>();
		for (int i = 0; i < 10; i++) {
			String mirror = "https://mirror" + i + ".novel-site.com/";
			sources.put(mirror, capability);
			mirrors.add(mirror);
		}
		SearchSession session = session("martial", mirrors);

		List<SearchResult> results = dispatcher(10, Duration.ofSeconds(5)).dispatch(session);

		assertEquals(1, capability.invocations());
		assertEquals(1, session.totalTasks());
		assertEquals(1, results.size());
		assertEquals(100.0, session.progress());
	}

	@Test
	public void testFirstReferenceOfACapabilityIsUsed() {
		FakeCapability capability = FakeCapability.returning("site");
		sources.put("https://b.site.com/", capability);
		sources.put("https://a.site.com/", capability);

		List<SiteSearchTask> tasks = dispatcher(10, Duration.ZERO)
				.planTasks(session("q", List.of("https://b.site.com/", "https://a.site.com/")));

		assertEquals(1, tasks.size());
		assertEquals("https://b.site.com/", tasks.get(0).sourceReference());
	}

	@Test
	public void testFailingSourceDoesNotStopOthers() {
		sources.put("good", FakeCapability.returning("good",
				hit("Lord Of Mysteries", "https://good.com/1"),
				hit("Shadow Slave", "https://good.com/2")));
		sources.put("bad", FakeCapability.failing("bad", new IOException("HTTP 503")));
		sources.put("worse", FakeCapability.failing("worse", new NullPointerException("no crawler")));
		SearchSession session = session("mysteries", List.of("bad", "good", "worse"));

		List<SearchResult> results = dispatcher(10, Duration.ofSeconds(5)).dispatch(session);

		assertEquals(2, results.size());
		assertEquals(100.0, session.progress());
		assertEquals(3, session.completedTasks());
		assertEquals(2, session.failures().size());
		assertTrue(session.failures().get("bad").contains("HTTP 503"));
	}

	@Test
	public void testUnknownReferencesAreSkipped() {
		sources.put("known", FakeCapability.returning("known", hit("Solo Leveling", "https://k.com/1")));
		SearchSession session = session("solo", List.of("unknown-1", "known", "unknown-2"));

		List<SearchResult> results = dispatcher(10, Duration.ZERO).dispatch(session);

		assertEquals(1, session.totalTasks());
		assertEquals(1, results.size());
		assertTrue(session.failures().isEmpty());
	}

	@Test
	public void testNoResolvableSourceCompletesImmediately() {
		SearchSession session = session("anything", List.of("nowhere"));

		assertTrue(dispatcher(10, Duration.ZERO).dispatch(session).isEmpty());
		assertEquals(0, session.totalTasks());
		assertEquals(100.0, session.progress());
	}

	@Test
	public void testEmptyQueryDispatchesNothing() {
		FakeCapability capability = FakeCapability.returning("site", hit("Title", "https://s.com/1"));
		sources.put("site", capability);
		SearchSession session = session("", List.of("site"));

		List<SearchResult> results = dispatcher(10, Duration.ZERO).dispatch(session);

		assertTrue(results.isEmpty());
		assertEquals(0, capability.invocations());
		assertEquals(100.0, session.progress());
	}

	@Test
	public void testEmptyReferenceSetDispatchesNothing() {
		SearchSession session = session("martial peak", List.of());

		assertTrue(dispatcher(10, Duration.ZERO).dispatch(session).isEmpty());
		assertEquals(100.0, session.progress());
	}

	@Test
	public void testConcurrencyIsBounded() {
		AtomicInteger running = new AtomicInteger();
		AtomicInteger peak = new AtomicInteger();
		List<String> references = new ArrayList<>();
		for (int i = 0; i < 12; i++) {
			String id = "site-" + i;
			sources.put(id, FakeCapability.returning(id, hit("Novel " + i, "https://" + id + "/1")).before(() -> {
				peak.accumulateAndGet(running.incrementAndGet(), Math::max);
				try {
					Thread.sleep(40);
				} finally {
					running.decrementAndGet();
				}
			}));
			references.add(id);
		}
		SearchSession session = session("novel", references);

		List<SearchResult> results = dispatcher(3, Duration.ofSeconds(5)).dispatch(session);

		assertEquals(12, results.size());
		assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
		assertEquals(100.0, session.progress());
	}

	@Test
	public void testHungSourceTimesOut() {
		sources.put("slow", FakeCapability.returning("slow", hit("Never Seen", "https://slow.com/1"))
				.before(() -> Thread.sleep(10_000)));
		sources.put("fast", FakeCapability.returning("fast", hit("Seen Quickly", "https://fast.com/1")));
		SearchSession session = session("seen", List.of("slow", "fast"));

		long start = System.nanoTime();
		List<SearchResult> results = dispatcher(10, Duration.ofMillis(200)).dispatch(session);
		long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

		assertTrue(elapsedMillis < 5_000, "dispatch took " + elapsedMillis + " ms");
		assertEquals(1, results.size());
		assertEquals("Seen Quickly", results.get(0).title());
		assertEquals(100.0, session.progress());
		assertTrue(session.failures().get("slow").startsWith("timed out"));
	}

	@Test
	public void testRejectsInvalidConcurrency() {
		assertThrows(IllegalArgumentException.class, () -> dispatcher(0, Duration.ZERO));
	}
}
