package org.javai.errata.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.javai.errata.Outcome;
import org.javai.errata.boundary.Boundary;
import org.javai.errata.boundary.ErrorConversions;
import org.javai.errata.storage.Storage;
import org.javai.errata.text.Literals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link Config} from {@code key=value} lines, starting from {@link Config#defaults()}.
 *
 * <p>Fields differ in how much they tolerate:
 * <ul>
 *   <li>a line without exactly one {@code =} is skipped</li>
 *   <li>an unknown key is ignored</li>
 *   <li>{@code debug} other than {@code true}/{@code false} falls back to {@code false}</li>
 *   <li>{@code port} that is not an unsigned 16-bit integer fails the whole load with {@code Parse}</li>
 *   <li>{@code host} is taken verbatim</li>
 * </ul>
 * Lines are separated by {@code \n} (a trailing {@code \r} is dropped). Keys and values are trimmed of
 * Unicode white space first. A later line for the same key overrides an earlier one.
 *
 * <p>An unreadable file fails the load with {@code Io}.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final char SEPARATOR = '=';
    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private final Storage storage;
    private final Boundary boundary;

    public ConfigLoader(Storage storage, Boundary boundary) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
    }

    /**
     * Reads and parses the config file at {@code path}.
     *
     * @return the config, {@code Io} if the file cannot be read, or {@code Parse} for a malformed port
     */
    public Outcome<Config> load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return boundary.<String, IOException>call("Storage.readText", ErrorConversions.IO, () -> storage.readText(path))
                .flatMap(this::parse);
    }

    /**
     * Like {@link #load(Path)}, but falls back to {@link Config#defaults()} on any failure.
     */
    public Config loadOrDefaults(Path path) {
        return load(path)
                .recover(kind -> {
                    LOG.warn("Could not load {} ({}), using default configuration", path, kind.describe());
                    return Config.defaults();
                })
                .getOrThrow();
    }

    /**
     * Parses config text.
     *
     * @return the config, or {@code Parse} for a malformed port
     */
    public Outcome<Config> parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        Config config = Config.defaults();
        for (String line : LINE_BREAK.split(text)) {
            Optional<Entry> entry = Entry.parse(line);
            if (entry.isEmpty()) {
                LOG.debug("Skipping malformed config line: {}", line);
                continue;
            }
            Outcome<Config> applied = apply(config, entry.get());
            if (applied.isFail()) {
                return applied;
            }
            config = applied.getOrThrow();
        }
        return Outcome.ok(config);
    }

    private Outcome<Config> apply(Config config, Entry entry) {
        return switch (entry.key()) {
            case "debug" -> Outcome.ok(config.withDebug(parseDebug(entry.value())));
            case "port" -> boundary.<Integer, NumberFormatException>call(
                    "ConfigLoader.parsePort", ErrorConversions.INTEGER_PARSE, () -> parsePort(entry.value()))
                    .map(config::withPort);
            case "host" -> Outcome.ok(config.withHost(entry.value()));
            default -> {
                LOG.debug("Ignoring unknown config key: {}", entry.key());
                yield Outcome.ok(config);
            }
        };
    }

    private static boolean parseDebug(String value) {
        if ("true".equals(value)) {
            return true;
        }
        if (!"false".equals(value)) {
            LOG.debug("Invalid debug value '{}', defaulting to false", value);
        }
        return false;
    }

    private static int parsePort(String value) {
        return Literals.parseUnsigned(value, Config.MAX_PORT);
    }

    private record Entry(String key, String value) {

        static Optional<Entry> parse(String line) {
            int separator = line.indexOf(SEPARATOR);
            if (separator < 0 || line.indexOf(SEPARATOR, separator + 1) >= 0) {
                return Optional.empty();
            }
            return Optional.of(new Entry(Literals.trim(line.substring(0, separator)), Literals.trim(line.substring(separator + 1))));
        }
    }
}
