package in.liqmap.service.plugin;

/**
 * Snapshot of a plugin's state.
 *
 * @param patternCount stored patterns
 * @param activeCount  stored patterns still live (unmitigated, unfilled, unswept, ...)
 */
public record PluginStatus(String name, boolean enabled, int patternCount, int activeCount) {}
