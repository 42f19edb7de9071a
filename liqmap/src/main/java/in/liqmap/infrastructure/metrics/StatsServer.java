package in.liqmap.infrastructure.metrics;

import in.liqmap.service.zone.LiquidityMap;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Embedded Undertow server for monitoring.
 *
 * Routes:
 * - GET /metrics - Prometheus scrape endpoint
 * - GET /stats   - JSON filter statistics and plugin status per symbol
 */
public final class StatsServer {
    private static final Logger log = LoggerFactory.getLogger(StatsServer.class);

    private final int port;
    private final RoutingHandler routes;
    private Undertow server;

    public StatsServer(int port, CollectorRegistry registry, Collection<LiquidityMap> maps) {
        this.port = port;
        this.routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(registry))
            .get("/stats", new StatsHandler(maps))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send("liqmap stats: GET /metrics, /stats\n");
            });
    }

    public synchronized void start() {
        if (server != null) {
            throw new IllegalStateException("Stats server already started on port " + port);
        }
        server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("[STATS] Serving /metrics and /stats on port {}", port);
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("[STATS] Stopped");
        }
    }

    public synchronized boolean isRunning() {
        return server != null;
    }
}
