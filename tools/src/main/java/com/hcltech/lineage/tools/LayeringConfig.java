package com.hcltech.lineage.tools;

import com.hcltech.lineage.common.IEnvGetter;
import com.hcltech.lineage.common.ISystemProps;
import com.hcltech.lineage.common.errorsor.ErrorsOr;
import com.hcltech.lineage.common.random.IRandom;
import com.hcltech.lineage.graph.LayeringStrategies;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.Properties;

/**
 * Run settings. Lookup order per key: environment ({@code graph.nodes -> GRAPH_NODES}), system
 * property, {@code application.properties}, built-in default.
 */
public class LayeringConfig {
    private static final Logger log = LoggerFactory.getLogger(LayeringConfig.class);

    public static final String NODES = "graph.nodes";
    public static final String EDGE_DENSITY = "graph.edge.density";
    public static final String SEED = "graph.seed";
    public static final String STRATEGY = "layering.strategy";
    public static final String REPORT_JSON = "report.json";

    private final Properties app;
    private final IEnvGetter env;
    private final ISystemProps sys;

    public LayeringConfig(Properties app, IEnvGetter env, ISystemProps sys) {
        this.app = app;
        this.env = env;
        this.sys = sys;
    }

    public static LayeringConfig load() {
        return new LayeringConfig(loadApplicationProperties(), IEnvGetter.env, ISystemProps.real);
    }

    public static Properties loadApplicationProperties() {
        Properties defaults = new Properties();
        try (InputStream is = LayeringConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (is != null) defaults.load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load application.properties", e);
        }
        return defaults;
    }

    public int nodes() {
        int n = parseInt(NODES, get(NODES, "12"));
        if (n < 0) throw new IllegalStateException("Invalid " + NODES + ": must be >= 0 but was " + n);
        return n;
    }

    public double edgeDensity() {
        String raw = get(EDGE_DENSITY, "0.25");
        double d;
        try {
            d = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid " + EDGE_DENSITY + " = '" + raw + "'", e);
        }
        if (!(d >= 0.0 && d <= 1.0))
            throw new IllegalStateException("Invalid " + EDGE_DENSITY + ": must be within [0, 1] but was " + d);
        return d;
    }

    public OptionalLong seed() {
        String raw = get(SEED, null);
        if (raw == null) return OptionalLong.empty();
        try {
            return OptionalLong.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid " + SEED + " = '" + raw + "'", e);
        }
    }

    public String strategy() {
        String s = get(STRATEGY, "reachability").toLowerCase(Locale.ROOT);
        if (!LayeringStrategies.NAMES.contains(s))
            throw new IllegalStateException("Invalid " + STRATEGY + " = '" + s + "'; expected one of " + LayeringStrategies.NAMES);
        return s;
    }

    public boolean reportJson() {
        return Boolean.parseBoolean(get(REPORT_JSON, "false"));
    }

    /** The run's single random source; unseeded when no seed is configured. */
    public IRandom random() {
        OptionalLong seed = seed();
        return seed.isPresent() ? IRandom.seeded(seed.getAsLong()) : IRandom.unseeded();
    }

    /** Every invalid setting at once, rather than the first one a getter trips over. */
    public ErrorsOr<LayeringConfig> validate() {
        List<String> errors = new ArrayList<>();
        ErrorsOr.trying(this::nodes).ifError(errors::addAll);
        ErrorsOr.trying(this::edgeDensity).ifError(errors::addAll);
        ErrorsOr.trying(this::seed).ifError(errors::addAll);
        ErrorsOr.trying(this::strategy).ifError(errors::addAll);
        return errors.isEmpty() ? ErrorsOr.lift(this) : ErrorsOr.errors(errors);
    }

    public void logImportantConfig() {
        log.info("CFG nodes={} edgeDensity={} seed={} strategy={} reportJson={}",
                nodes(), edgeDensity(), get(SEED, "<unseeded>"), strategy(), reportJson());
    }

    // --- helpers ---
    @Nullable
    private String get(String key, @Nullable String def) {
        String fromEnv = trimToNull(env.get(IEnvGetter.toEnvKey(key)));
        if (fromEnv != null) return fromEnv;
        String fromSys = trimToNull(sys.getProperty(key));
        if (fromSys != null) return fromSys;
        String prop = trimToNull(app.getProperty(key));
        return prop != null ? prop : def;
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + " = '" + raw + "'", e);
        }
    }

    @Nullable
    private static String trimToNull(@Nullable String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
