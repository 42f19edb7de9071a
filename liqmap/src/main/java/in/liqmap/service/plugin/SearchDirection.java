package in.liqmap.service.plugin;

/**
 * Where to look for the nearest pattern relative to a price.
 */
public enum SearchDirection {
    ABOVE,
    BELOW,
    BOTH
}
