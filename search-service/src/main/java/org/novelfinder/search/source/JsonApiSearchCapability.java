package org.novelfinder.search.source;

import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import org.novelfinder.core.model.RawHit;
import org.novelfinder.core.source.SearchCapability;
import org.novelfinder.core.source.SearchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Searches a site that exposes a JSON search endpoint.
 *
 * <p>The response body is read incrementally: hits are parsed only as the returned stream is
 * consumed, and closing the stream closes the connection. Relative links are resolved against
 * the search URL. The browser hint is ignored.</p>
 */
public class JsonApiSearchCapability implements SearchCapability {
	private static final Logger logger = LoggerFactory.getLogger(JsonApiSearchCapability.class);
	private static final String QUERY_PLACEHOLDER = "{query}";

	private final SourceDefinition definition;
	private final HttpClient httpClient;
	private final Duration readTimeout;

	public JsonApiSearchCapability(SourceDefinition definition, HttpClient httpClient, Duration readTimeout) {
		this.definition = definition;
		this.httpClient = httpClient;
		this.readTimeout = readTimeout;
	}

	@Override
	public String id() {
		return definition.id();
	}

	@Override
	public Stream<RawHit> search(String query, SearchOptions options) throws IOException, InterruptedException {
		URI uri = URI.create(definition.searchUrl()
				.replace(QUERY_PLACEHOLDER, URLEncoder.encode(query, StandardCharsets.UTF_8)));
		logger.debug("GET {}", uri);

		HttpRequest request = HttpRequest.newBuilder()
				.uri(uri)
				.timeout(readTimeout)
				.header("Accept", "application/json")
				.GET()
				.build();

		HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
		if (response.statusCode() >= 400) {
			response.body().close();
			throw new IOException("HTTP " + response.statusCode() + " for URL: " + uri);
		}

		JsonReader reader = new JsonReader(new InputStreamReader(response.body(), StandardCharsets.UTF_8));
		try {
			openHitArray(reader);
		} catch (IOException | RuntimeException e) {
			reader.close();
			throw e;
		}
		HitIterator hits = new HitIterator(reader, uri);
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(hits, Spliterator.ORDERED | Spliterator.NONNULL), false)
				.onClose(hits::close);
	}

	/** Positions the reader just inside the array of hits. */
	private void openHitArray(JsonReader reader) throws IOException {
		String resultsField = definition.resultsField();
		if (resultsField == null || resultsField.isBlank()) {
			reader.beginArray();
			return;
		}
		reader.beginObject();
		while (reader.hasNext()) {
			if (reader.nextName().equals(resultsField)) {
				reader.beginArray();
				return;
			}
			reader.skipValue();
		}
		throw new IOException("Response has no '" + resultsField + "' field");
	}

	private class HitIterator implements Iterator<RawHit> {
		private final JsonReader reader;
		private final URI base;

		HitIterator(JsonReader reader, URI base) {
			this.reader = reader;
			this.base = base;
		}

		@Override
		public boolean hasNext() {
			try {
				return reader.hasNext();
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		}

		@Override
		public RawHit next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			try {
				return readHit();
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		}

		private RawHit readHit() throws IOException {
			String title = null;
			String url = null;
			reader.beginObject();
			while (reader.hasNext()) {
				String name = reader.nextName();
				if (name.equals(definition.titleFieldOrDefault())) {
					title = readString();
				} else if (name.equals(definition.urlFieldOrDefault())) {
					url = readString();
				} else {
					reader.skipValue();
				}
			}
			reader.endObject();
			return new RawHit(title, absolute(url));
		}

		private String readString() throws IOException {
			if (reader.peek() == JsonToken.STRING) {
				return reader.nextString();
			}
			reader.skipValue();
			return null;
		}

		private String absolute(String url) {
			if (url == null || url.isBlank()) {
				return url;
			}
			try {
				return base.resolve(url.strip()).toString();
			} catch (IllegalArgumentException e) {
				return url;
			}
		}

		void close() {
			try {
				reader.close();
			} catch (IOException e) {
				logger.warn("Failed to close response of {}: {}", base, e.getMessage());
			}
		}
	}
}
