package in.liqmap.infrastructure.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.zone.ZoneFilter;
import in.liqmap.service.zone.LiquidityMap;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP handler for /stats: filter statistics, zone counts and plugin status per symbol as JSON.
 */
public class StatsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(StatsHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Collection<LiquidityMap> maps;

    public StatsHandler(Collection<LiquidityMap> maps) {
        this.maps = List.copyOf(maps);
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        try {
            String json = MAPPER.writeValueAsString(buildStats());
            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            log.error("[STATS] Failed to serialize statistics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
            exchange.getResponseSender().send("Failed to serialize statistics: " + e.getMessage(),
                StandardCharsets.UTF_8);
        }
    }

    Map<String, Object> buildStats() {
        Map<String, Object> symbols = new LinkedHashMap<>();
        for (LiquidityMap map : maps) {
            Map<String, Object> zones = new LinkedHashMap<>();
            Map<String, Object> plugins = new LinkedHashMap<>();
            for (Timeframe tf : map.getTimeframes()) {
                zones.put(tf.getLabel(), map.getZones(tf, ZoneFilter.active()).size());
                plugins.put(tf.getLabel(), map.getPluginStatus(tf));
            }

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("statistics", map.getStatistics());
            entry.put("activeZones", zones);
            entry.put("plugins", plugins);
            symbols.put(map.getSymbol(), entry);
        }
        return symbols;
    }
}
