package org.novelfinder.search.source;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.novelfinder.core.source.CapabilityResolver;
import org.novelfinder.core.source.SearchCapability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Known sources, keyed by the hostnames of their mirrors.
 *
 * <p>A reference resolves by its hostname: {@code https://www.example.com/novel/1} and
 * {@code www.example.com} both resolve to the source registered for {@code www.example.com}.</p>
 */
public final class SourceCatalog implements CapabilityResolver {
    private static final Logger logger = LoggerFactory.getLogger(SourceCatalog.class);

    private final Map<String, SearchCapability> byHost;
    private final List<String> references;

    private SourceCatalog(Map<String, SearchCapability> byHost, List<String> references) {
        this.byHost = Collections.unmodifiableMap(byHost);
        this.references = List.copyOf(references);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the catalog from a JSON resource on the classpath, building a {@link JsonApiSearchCapability}
     * for each source.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static SourceCatalog load(String resourceName, HttpClient httpClient, Duration readTimeout) {
        List<SourceDefinition> definitions = readDefinitions(resourceName);
        Builder builder = builder();
        for (SourceDefinition definition : definitions) {
            if (definition.id() == null || definition.searchUrl() == null) {
                throw new IllegalStateException("Source entry without id or searchUrl in " + resourceName);
            }
            builder.register(new JsonApiSearchCapability(definition, httpClient, readTimeout),
                    definition.mirrorsOrEmpty());
        }
        SourceCatalog catalog = builder.build();
        logger.info("Loaded {} sources ({} references) from {}", definitions.size(), catalog.references.size(), resourceName);
        return catalog;
    }

    private static List<SourceDefinition> readDefinitions(String resourceName) {
        try (InputStream in = SourceCatalog.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IllegalStateException("Source catalog not found on classpath: " + resourceName);
            }
            Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
            Type type = new TypeToken<List<SourceDefinition>>(){}.getType();
            List<SourceDefinition> definitions = new Gson().fromJson(reader, type);
            return definitions == null ? List.of() : definitions;
        } catch (IOException | JsonParseException e) {
            throw new IllegalStateException("Failed to load source catalog " + resourceName, e);
        }
    }

    @Override
    public Optional<SearchCapability> resolve(String sourceReference) {
        return hostOf(sourceReference).map(byHost::get);
    }

    /** Every registered reference, in registration order. */
    public List<String> sourceReferences() {
        return references;
    }

    /** Number of distinct sources. */
    public int size() {
        Set<String> ids = new LinkedHashSet<>();
        byHost.values().forEach(capability -> ids.add(capability.id()));
        return ids.size();
    }

    static Optional<String> hostOf(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String trimmed = reference.strip();
        if (!trimmed.contains("://")) {
            int slash = trimmed.indexOf('/');
            String host = slash >= 0 ? trimmed.substring(0, slash) : trimmed;
            return host.isEmpty() ? Optional.empty() : Optional.of(host.toLowerCase(Locale.ROOT));
        }
        try {
            String host = URI.create(trimmed).getHost();
            return Optional.ofNullable(host).map(h -> h.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.debug("Ignoring malformed source reference {}", reference);
            return Optional.empty();
        }
    }

    public static final class Builder {
        private final Map<String, SearchCapability> byHost = new LinkedHashMap<>();
        private final List<String> references = new ArrayList<>();
        private final Map<String, SearchCapability> byId = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers a capability under each mirror. The first registration of a hostname wins.
         *
         * @throws IllegalStateException if another capability was already registered with the same id
         */
        public Builder register(SearchCapability capability, List<String> mirrors) {
            SearchCapability known = byId.putIfAbsent(capability.id(), capability);
            if (known != null && known != capability) {
                throw new IllegalStateException("Duplicate source id: " + capability.id());
            }
            for (String mirror : mirrors) {
                Optional<String> host = hostOf(mirror);
                if (host.isEmpty()) {
                    throw new IllegalArgumentException("Mirror without a hostname: " + mirror);
                }
                if (byHost.putIfAbsent(host.get(), capability) == null) {
                    references.add(mirror);
                } else {
                    logger.warn("Hostname {} is already registered, ignoring mirror of {}", host.get(), capability.id());
                }
            }
            return this;
        }

        public Builder register(SearchCapability capability, String... mirrors) {
            return register(capability, List.of(mirrors));
        }

        public SourceCatalog build() {
            return new SourceCatalog(new LinkedHashMap<>(byHost), references);
        }
    }
}
