package org.novelfinder.search.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of searches started in the background, so that callers can poll them by id.
 * A session is forgotten once it has been finished for longer than the configured TTL.
 */
public class SearchSessionRegistry {
	private static final Logger logger = LoggerFactory.getLogger(SearchSessionRegistry.class);

	private final Map<String, SearchSession> sessions = new ConcurrentHashMap<>();
	private final Duration ttl;
	private final Clock clock;

	public SearchSessionRegistry(Duration ttl) {
		this(ttl, Clock.systemUTC());
	}

	SearchSessionRegistry(Duration ttl, Clock clock) {
		this.ttl = ttl;
		this.clock = clock;
	}

	public void register(SearchSession session) {
		evictExpired();
		sessions.put(session.id(), session);
	}

	public Optional<SearchSession> find(String id) {
		evictExpired();
		return Optional.ofNullable(sessions.get(id));
	}

	/** Number of sessions currently held, finished or not. */
	public int size() {
		return sessions.size();
	}

	public int evictExpired() {
		Instant cutoff = clock.instant().minus(ttl);
		int before = sessions.size();
		sessions.values().removeIf(session -> {
			Instant finishedAt = session.finishedAt();
			return finishedAt != null && finishedAt.isBefore(cutoff);
		});
		int evicted = before - sessions.size();
		if (evicted > 0) {
			logger.debug("Evicted {} expired search sessions", evicted);
		}
		return evicted;
	}
}
