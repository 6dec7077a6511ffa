package io.b2mash.b2b.cantonaltax.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the published tax data feeds.
 *
 * @param location Spring resource location of the directory holding {@code scales-<year>.json}
 *     and {@code rates-<year>.json} (e.g., {@code classpath:tax-data} or {@code file:data})
 * @param firstYear first year covered by the feeds
 * @param lastYear last year covered by the feeds
 * @param cacheSize maximum number of compiled years kept in memory
 */
@ConfigurationProperties(prefix = "tax.data")
public record TaxDataProperties(String location, int firstYear, int lastYear, int cacheSize) {}
