package io.datashape.core.engine;

import io.datashape.core.spi.ErrorMap;
import io.datashape.core.spi.IssueFormatter;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holder of global parse defaults, the global error map and the issue formatter.
 *
 * <p>The {@linkplain #shared() shared} instance is what every parse uses unless
 * {@link ParseOptions#config()} names another one. Independent instances from {@link #create()}
 * keep tests and embedded uses isolated from each other.
 *
 * <p>Thread-safe: every mutation atomically swaps an immutable {@link GlobalSettings} snapshot.
 */
public final class GlobalConfig {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalConfig.class);

    private static final GlobalConfig SHARED = new GlobalConfig();

    private final AtomicReference<GlobalSettings> settings = new AtomicReference<>(GlobalSettings.defaults());

    private GlobalConfig() {}

    /** The process-wide instance. */
    public static GlobalConfig shared() {
        return SHARED;
    }

    /** A fresh instance holding the defaults. */
    public static GlobalConfig create() {
        return new GlobalConfig();
    }

    /** Current immutable snapshot. */
    public GlobalSettings snapshot() {
        return settings.get();
    }

    public GlobalOptions getOptions() {
        return settings.get().options();
    }

    public GlobalConfig setOptions(GlobalOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        return update(s -> new GlobalSettings(options, s.errorMap(), s.issueFormatter()));
    }

    public GlobalConfig updateOptions(UnaryOperator<GlobalOptions> change) {
        return update(s -> new GlobalSettings(change.apply(s.options()), s.errorMap(), s.issueFormatter()));
    }

    /** The global error map, or {@code null} if none is set. */
    public ErrorMap getErrorMap() {
        return settings.get().errorMap();
    }

    /** Sets the global error map layer; {@code null} removes it. */
    public GlobalConfig setErrorMap(ErrorMap errorMap) {
        return update(s -> new GlobalSettings(s.options(), errorMap, s.issueFormatter()));
    }

    public IssueFormatter getIssueFormatter() {
        return settings.get().issueFormatter();
    }

    /** Sets the issue formatter; {@code null} restores the default one. */
    public GlobalConfig setIssueFormatter(IssueFormatter formatter) {
        IssueFormatter resolved = formatter != null ? formatter : DefaultIssueFormatter.INSTANCE;
        return update(s -> new GlobalSettings(s.options(), s.errorMap(), resolved));
    }

    /** Replaces the whole snapshot, e.g. with one produced by {@link GlobalConfigLoader}. */
    public GlobalConfig apply(GlobalSettings snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        return update(s -> snapshot);
    }

    /** Restores options, error map and formatter to their defaults. */
    public GlobalConfig reset() {
        return update(s -> GlobalSettings.defaults());
    }

    private GlobalConfig update(UnaryOperator<GlobalSettings> change) {
        GlobalSettings next = settings.updateAndGet(change);
        LOG.debug(
                "Global config updated: abortEarly={}, debug={}, errorMap={}",
                next.options().abortEarly(),
                next.options().debug(),
                next.errorMap() != null);
        return this;
    }
}
