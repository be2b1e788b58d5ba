package org.novelfinder.search.bootstrap;

import org.novelfinder.search.config.SearchConfig;
import org.novelfinder.search.controller.SearchController;
import org.novelfinder.search.service.NovelSearchService;
import org.novelfinder.search.service.ResultAggregator;
import org.novelfinder.search.service.SearchDispatcher;
import org.novelfinder.search.session.SearchSessionRegistry;
import org.novelfinder.search.source.SourceCatalog;
import org.novelfinder.search.web.SearchHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;

import io.javalin.Javalin;

/**
 * Application bootstrapper for the Search Service.
 *
 * <p>Loads configuration and the source catalog, starts the HTTP API, and registers a JVM shutdown hook.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the Search Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run(String[] args) {
        try {
            start(args);
        } catch (Exception e) {
            logger.error("Failed to start Search Service", e);
            System.exit(1);
        }
    }

    private static void start(String[] args) {
        SearchConfig cfg = SearchConfig.load(args);
        NovelSearchService service = buildService(cfg);
        Javalin app = startHttp(cfg, service);
        addShutdownHook(service, app);
        logger.info("Search Service started on port {} with {} sources.", app.port(), service.sourceCount());
    }

    /** Wires the engine for the given configuration. */
    public static NovelSearchService buildService(SearchConfig cfg) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(cfg.http().connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        SourceCatalog catalog = SourceCatalog.load(cfg.sourcesCatalog(), httpClient, cfg.http().readTimeout());
        return new NovelSearchService(
            catalog,
            new SearchDispatcher(catalog, cfg.maxConcurrency(), cfg.taskTimeout()),
            new ResultAggregator(cfg.maxResults()),
            new SearchSessionRegistry(cfg.sessionTtl()),
            cfg.maxActiveSearches()
        );
    }

    private static Javalin startHttp(SearchConfig cfg, NovelSearchService service) {
        SearchController controller = new SearchController(service);
        return SearchHttpServer.start(cfg.serverPort(), controller);
    }

    private static void addShutdownHook(NovelSearchService service, Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(service, app)));
    }

    private static void shutdown(NovelSearchService service, Javalin app) {
        logger.info("Shutting down Search Service...");
        app.stop();
        service.shutdown();
        logger.info("Search Service stopped.");
    }
}
