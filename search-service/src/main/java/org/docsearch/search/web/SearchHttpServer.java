package org.docsearch.search.web;

import org.docsearch.search.controller.SearchController;

import io.javalin.Javalin;

/** HTTP server wiring for the Search Service. */
public final class SearchHttpServer {
    private SearchHttpServer() {}

    /**
     * Starts the Javalin HTTP server and registers routes.
     *
     * @param port port to bind, {@code 0} for an ephemeral port
     * @param controller controller that registers routes
     * @return started {@link Javalin} instance
     */
    public static Javalin start(int port, SearchController controller) {
        Javalin app = Javalin.create(cfg -> {
            cfg.showJavalinBanner = false;
            cfg.http.defaultContentType = "application/json";
        });
        controller.registerRoutes(app);
        return app.start(port);
    }
}
