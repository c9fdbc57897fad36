package org.ckbtextify.text;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads word tables shipped as HOCON resources under {@code lexicon/}.
 * <p>
 * A lexicon file holds one object per table:
 * <pre>
 * words {
 *   "phone" = "فۆن"
 * }
 * </pre>
 * Keys are read from the object root, so they may contain dots.
 */
public final class Lexicons {

    private static final Logger LOG = LoggerFactory.getLogger(Lexicons.class);

    private Lexicons() {}

    /**
     * Reads one table from a classpath lexicon.
     *
     * @param resource The resource name, e.g. "lexicon/english.conf".
     * @param table    The top-level object to read.
     * @return An unmodifiable map, empty if the table is missing.
     */
    public static Map<String, String> load(String resource, String table) {
        Config config = ConfigFactory.parseResources(resource);
        if (!config.hasPath(table)) {
            LOG.warn("Lexicon table '{}' not found in {}", table, resource);
            return Map.of();
        }
        Map<String, String> entries = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> e : config.getObject(table).entrySet()) {
            entries.put(e.getKey(), String.valueOf(e.getValue().unwrapped()));
        }
        LOG.debug("Loaded {} entries from {}#{}", entries.size(), resource, table);
        return Collections.unmodifiableMap(entries);
    }
}
