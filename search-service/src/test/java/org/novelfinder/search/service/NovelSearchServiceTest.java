package org.novelfinder.search.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.novelfinder.core.model.CombinedSearchResult;
import org.novelfinder.core.model.SearchResult;
import org.novelfinder.search.session.SearchSession;
import org.novelfinder.search.session.SearchSessionRegistry;
import org.novelfinder.search.source.SourceCatalog;
import org.novelfinder.search.support.FakeCapability;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.novelfinder.search.support.FakeCapability.hit;

public class NovelSearchServiceTest {
	private NovelSearchService service;

	private NovelSearchService serviceFor(SourceCatalog catalog) {
		service = new NovelSearchService(
				catalog,
				new SearchDispatcher(catalog, 10, Duration.ofSeconds(5)),
				new ResultAggregator(10),
				new SearchSessionRegistry(Duration.ofMinutes(5)));
		return service;
	}

	@AfterEach
	public void tearDown() {
		if (service != null) {
			service.shutdown();
		}
	}

	@Test
	public void testSearchMergesSourcesAndRanksByAgreement() {
		SourceCatalog catalog = SourceCatalog.builder()
				.register(FakeCapability.returning("a", hit("My Cultivation Journey", "a.com/1")), "https://a.com/")
				.register(FakeCapability.returning("b", hit("my cultivation journey", "b.com/2")), "https://b.com/")
				.register(FakeCapability.returning("c", hit("MY CULTIVATION JOURNEY", "c.com/3")), "https://c.com/")
				.register(FakeCapability.returning("d", hit("Unrelated Title", "d.com/4")), "https://d.com/")
				.register(FakeCapability.failing("e", new IOException("down")), "https://e.com/")
				.build();

		SearchSession session = serviceFor(catalog).runSearch("Cultivation", catalog.sourceReferences());

		assertTrue(session.isFinished());
		assertEquals(100.0, session.progress());
		List<CombinedSearchResult> results = session.results();
		assertEquals(2, results.size());
		assertEquals("my-cultivation-journey", results.get(0).id());
		assertEquals("My Cultivation Journey", results.get(0).title());
		assertEquals(3, results.get(0).size());
		assertEquals("unrelated-title", results.get(1).id());
		assertEquals(1, session.failures().size());
	}

	@Test
	public void testEmptyQueryFinishesWithoutSearching() {
		FakeCapability capability = FakeCapability.returning("a", hit("Title", "a.com/1"));
		SourceCatalog catalog = SourceCatalog.builder().register(capability, "https://a.com/").build();

		SearchSession session = serviceFor(catalog).runSearch("", catalog.sourceReferences());

		assertTrue(session.isFinished());
		assertTrue(session.results().isEmpty());
		assertEquals(100.0, session.progress());
		assertEquals(0, capability.invocations());
	}

	@Test
	public void testBackgroundSearchReportsProgress() throws Exception {
		CountDownLatch releaseFirst = new CountDownLatch(1);
		CountDownLatch releaseSecond = new CountDownLatch(1);
		SourceCatalog catalog = SourceCatalog.builder()
				.register(FakeCapability.returning("first", hit("Shadow Slave", "first.com/1"))
						.before(releaseFirst::await), "https://first.com/")
				.register(FakeCapability.returning("second", hit("Shadow Slave", "second.com/1"))
						.before(releaseSecond::await), "https://second.com/")
				.build();
		serviceFor(catalog);

		SearchSession session = service.startSearch("Shadow Slave", catalog.sourceReferences());
		assertSame(session, service.findSession(session.id()).orElseThrow());
		assertFalse(session.isFinished());

		releaseFirst.countDown();
		awaitProgress(session, 50.0);
		assertFalse(session.isFinished());

		releaseSecond.countDown();
		assertTrue(session.await(Duration.ofSeconds(5)));
		assertEquals(100.0, session.progress());
		assertEquals(1, session.results().size());
		assertEquals(2, session.results().get(0).size());
	}

	@Test
	public void testBackgroundSearchFinishesWhenAggregationBreaks() throws Exception {
		SourceCatalog catalog = SourceCatalog.builder()
				.register(FakeCapability.returning("a", hit("Shadow Slave", "a.com/1")), "https://a.com/")
				.build();
		ResultAggregator broken = new ResultAggregator(10) {
			@Override
			public List<CombinedSearchResult> aggregate(List<SearchResult> results, String query) {
				throw new LinkageError("ranking unavailable");
			}
		};
		service = new NovelSearchService(catalog,
				new SearchDispatcher(catalog, 10, Duration.ofSeconds(5)),
				broken,
				new SearchSessionRegistry(Duration.ofMinutes(5)));

		SearchSession session = service.startSearch("Shadow Slave", catalog.sourceReferences());

		assertTrue(session.await(Duration.ofSeconds(5)));
		assertTrue(session.isFinished());
		assertTrue(session.results().isEmpty());
	}

	@Test
	public void testBackgroundSearchesBeyondLimitWait() throws Exception {
		CountDownLatch release = new CountDownLatch(1);
		SourceCatalog catalog = SourceCatalog.builder()
				.register(FakeCapability.returning("slow", hit("Shadow Slave", "slow.com/1"))
						.before(release::await), "https://slow.com/")
				.build();
		service = new NovelSearchService(catalog,
				new SearchDispatcher(catalog, 10, Duration.ofSeconds(5)),
				new ResultAggregator(10),
				new SearchSessionRegistry(Duration.ofMinutes(5)),
				1);

		SearchSession first = service.startSearch("Shadow Slave", catalog.sourceReferences());
		SearchSession second = service.startSearch("Shadow Slave", catalog.sourceReferences());
		awaitTotalTasks(first, 1);

		assertFalse(second.await(Duration.ofMillis(200)));
		assertEquals(0, second.totalTasks());
		assertEquals(0.0, second.progress());

		release.countDown();
		assertTrue(first.await(Duration.ofSeconds(5)));
		assertTrue(second.await(Duration.ofSeconds(5)));
		assertEquals(1, second.results().size());
	}

	@Test
	public void testActiveSearchLimitMustBePositive() {
		SourceCatalog catalog = SourceCatalog.builder().build();

		assertThrows(IllegalArgumentException.class, () -> new NovelSearchService(catalog,
				new SearchDispatcher(catalog, 10, Duration.ofSeconds(5)),
				new ResultAggregator(10),
				new SearchSessionRegistry(Duration.ofMinutes(5)),
				0));
	}

	private static void awaitTotalTasks(SearchSession session, int expected) throws InterruptedException {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
		while (session.totalTasks() < expected && System.nanoTime() < deadline) {
			Thread.sleep(10);
		}
		assertEquals(expected, session.totalTasks());
	}

	private static void awaitProgress(SearchSession session, double expected) throws InterruptedException {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
		while (session.progress() < expected && System.nanoTime() < deadline) {
			Thread.sleep(10);
		}
		assertEquals(expected, session.progress());
	}
}
