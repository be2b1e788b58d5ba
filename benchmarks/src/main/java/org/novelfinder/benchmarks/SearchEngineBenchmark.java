package org.novelfinder.benchmarks;

import org.novelfinder.core.model.CombinedSearchResult;
import org.novelfinder.core.model.RawHit;
import org.novelfinder.core.model.SearchResult;
import org.novelfinder.core.source.SearchCapability;
import org.novelfinder.core.source.SearchOptions;
import org.novelfinder.search.service.ResultAggregator;
import org.novelfinder.search.service.SearchDispatcher;
import org.novelfinder.search.session.SearchSession;
import org.novelfinder.search.source.SourceCatalog;
import org.novelfinder.search.text.SequenceMatcher;
import org.novelfinder.search.text.Slugifier;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Benchmarks for the search engine
 * Tests: slug keys, title similarity, aggregation, in-memory fan-out
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class SearchEngineBenchmark {

	private static final String QUERY = "Cultivation Journey";
	private static final String[] WORDS = {
			"martial", "peak", "cultivation", "journey", "sword", "immortal", "dragon", "shadow",
			"emperor", "heaven", "reincarnation", "villain", "library", "mysteries", "lord", "system"
	};

	@Param({"100", "1000", "5000"})
	private int resultCount;

	@Param({"5", "40"})
	private int sourceCount;

	private List<SearchResult> results;
	private ResultAggregator aggregator;
	private SearchDispatcher dispatcher;
	private List<String> references;

	@Setup(Level.Trial)
	public void setup() {
		Random random = new Random(42);
		results = new ArrayList<>(resultCount);
		for (int i = 0; i < resultCount; i++) {
			String title = randomTitle(random);
			int source = random.nextInt(sourceCount);
			results.add(new SearchResult(title, "https://source" + source + ".example/novel/" + i, "source-" + source));
		}
		aggregator = new ResultAggregator(10);

		SourceCatalog.Builder catalog = SourceCatalog.builder();
		references = new ArrayList<>();
		int perSource = Math.max(1, resultCount / sourceCount);
		for (int s = 0; s < sourceCount; s++) {
			String reference = "https://source" + s + ".example/";
			catalog.register(new InMemorySource("source-" + s, results.subList(
					Math.min(s * perSource, results.size()),
					Math.min((s + 1) * perSource, results.size()))), reference);
			references.add(reference);
		}
		dispatcher = new SearchDispatcher(catalog.build(), 10, Duration.ofSeconds(30));

		System.out.println("Dataset ready: " + resultCount + " results across " + sourceCount + " sources");
	}

	private static String randomTitle(Random random) {
		int words = 2 + random.nextInt(3);
		StringJoiner title = new StringJoiner(" ");
		for (int w = 0; w < words; w++) {
			title.add(WORDS[random.nextInt(WORDS.length)]);
		}
		return title.toString();
	}

	/**
	 * Benchmark: Slug keys for every collected title
	 */
	@Benchmark
	public void slugifyTitles(Blackhole blackhole) {
		for (SearchResult result : results) {
			blackhole.consume(Slugifier.slugify(result.title()));
		}
	}

	/**
	 * Benchmark: Title similarity against the query
	 */
	@Benchmark
	public void titleSimilarity(Blackhole blackhole) {
		for (SearchResult result : results) {
			blackhole.consume(SequenceMatcher.ratio(result.title(), QUERY));
		}
	}

	/**
	 * Benchmark: Group, rank and truncate
	 */
	@Benchmark
	public void aggregateResults(Blackhole blackhole) {
		List<CombinedSearchResult> combined = aggregator.aggregate(results, QUERY);
		blackhole.consume(combined);
	}

	/**
	 * Benchmark: Full fan-out over in-memory sources, then aggregation
	 */
	@Benchmark
	public void fanOutAndAggregate(Blackhole blackhole) {
		SearchSession session = new SearchSession("bench", QUERY, references);
		List<SearchResult> collected = dispatcher.dispatch(session);
		blackhole.consume(aggregator.aggregate(collected, session.query()));
	}

	private static final class InMemorySource implements SearchCapability {
		private final String id;
		private final List<RawHit> hits;

		InMemorySource(String id, List<SearchResult> results) {
			this.id = id;
			this.hits = results.stream().map(r -> new RawHit(r.title(), r.url())).toList();
		}

		@Override
		public String id() {
			return id;
		}

		@Override
		public Stream<RawHit> search(String query, SearchOptions options) {
			return hits.stream();
		}
	}
}
