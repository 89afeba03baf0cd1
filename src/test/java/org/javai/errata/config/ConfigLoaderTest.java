package org.javai.errata.config;

import org.javai.errata.ErrorCategory;
import org.javai.errata.ErrorKind;
import org.javai.errata.IoReason;
import org.javai.errata.Outcome;
import org.javai.errata.boundary.Boundary;
import org.javai.errata.storage.InMemoryStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ConfigLoaderTest {

    private static final Path CONFIG_FILE = Path.of("config.txt");

    private InMemoryStorage storage;
    private List<ErrorKind> reported;
    private ConfigLoader loader;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorage();
        reported = new ArrayList<>();
        loader = new ConfigLoader(storage, Boundary.withReporter((operation, kind) -> reported.add(kind)));
    }

    @Test
    void wellFormedText_setsEveryField() {
        Outcome<Config> result = loader.parse("debug=true\nport=3000\nhost=0.0.0.0");

        assertThat(result.getOrThrow()).isEqualTo(new Config(true, 3000, "0.0.0.0"));
    }

    @Test
    void malformedLine_isSkipped() {
        Outcome<Config> result = loader.parse("debug=true\ngarbage-line\nport=3000");

        assertThat(result.getOrThrow()).isEqualTo(new Config(true, 3000, "localhost"));
    }

    @Test
    void malformedPort_failsTheLoad() {
        Outcome<Config> result = loader.parse("port=notanumber");

        assertThat(result.isFail()).isTrue();
        ErrorKind kind = ((Outcome.Fail<Config>) result).kind();
        assertThat(kind).isInstanceOf(ErrorKind.Parse.class);
        assertThat(kind.describe()).startsWith("Parse error: ").contains("notanumber");
        assertThat(reported).containsExactly(kind);
    }

    @Test
    void malformedDebug_defaultsToFalse() {
        Outcome<Config> result = loader.parse("debug=notabool\nport=3000");

        assertThat(result.getOrThrow()).isEqualTo(new Config(false, 3000, "localhost"));
        assertThat(reported).isEmpty();
    }

    @Test
    void debug_isCaseSensitive() {
        assertThat(loader.parse("debug=TRUE").getOrThrow().debug()).isFalse();
        assertThat(loader.parse("debug=true").getOrThrow().debug()).isTrue();
    }

    @Test
    void malformedDebugAfterValidDebug_resetsToFalse() {
        assertThat(loader.parse("debug=true\ndebug=yes").getOrThrow().debug()).isFalse();
    }

    @Test
    void emptyText_yieldsDefaults() {
        assertThat(loader.parse("").getOrThrow()).isEqualTo(Config.defaults());
    }

    @Test
    void whitespaceAroundKeysAndValues_isTrimmed() {
        Outcome<Config> result = loader.parse("  debug = true \n\tport=\t3000\r\nhost =  example.org  ");

        assertThat(result.getOrThrow()).isEqualTo(new Config(true, 3000, "example.org"));
    }

    @Test
    void lineWithTwoSeparators_isSkipped() {
        Outcome<Config> result = loader.parse("host=a=b\nport=3000");

        assertThat(result.getOrThrow()).isEqualTo(new Config(false, 3000, "localhost"));
    }

    @Test
    void lineWithTwoSeparatorsOnPort_isSkippedNotFailed() {
        assertThat(loader.parse("port=80=80").getOrThrow()).isEqualTo(Config.defaults());
    }

    @Test
    void unknownKeys_areIgnored() {
        Outcome<Config> result = loader.parse("colour=blue\nport=3000\nPORT=bad");

        assertThat(result.getOrThrow()).isEqualTo(new Config(false, 3000, "localhost"));
    }

    @Test
    void emptyHost_isTakenVerbatim() {
        assertThat(loader.parse("host=").getOrThrow().host()).isEmpty();
    }

    @Test
    void laterLine_overridesEarlierOne() {
        assertThat(loader.parse("port=1\nport=2").getOrThrow().port()).isEqualTo(2);
    }

    @ParameterizedTest
    @ValueSource(strings = {"65536", "-1", "-0", "3000.5", "", "0x50", "99999999999",
            "\u0663\u0660\u0660\u0660", "\uFF13\uFF10\uFF10\uFF10", "++80", "80 80"})
    void outOfRangeOrNonIntegerPort_failsWithParse(String port) {
        Outcome<Config> result = loader.parse("port=" + port);

        assertThat(((Outcome.Fail<Config>) result).kind().category()).isEqualTo(ErrorCategory.PARSE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "1", "8080", "65535", "+443"})
    void portInRange_isAccepted(String port) {
        assertThat(loader.parse("port=" + port).isOk()).isTrue();
    }

    @Test
    void loneCarriageReturn_doesNotSplitLines() {
        Outcome<Config> result = loader.parse("debug=true\rport=3000");

        assertThat(result.getOrThrow()).isEqualTo(Config.defaults());
    }

    @Test
    void noBreakSpaceAroundValue_isTrimmed() {
        Outcome<Config> result = loader.parse("port=\u00A03000\u00A0\nhost=\u2003example.org");

        assertThat(result.getOrThrow()).isEqualTo(new Config(false, 3000, "example.org"));
    }

    @Test
    void portFailure_stopsBeforeLaterLines() {
        Outcome<Config> result = loader.parse("port=bad\nport=3000");

        assertThat(result.isFail()).isTrue();
    }

    @Test
    void load_readsFromStorage() {
        storage.with(CONFIG_FILE, "debug=true\nport=3000\nhost=0.0.0.0");

        assertThat(loader.load(CONFIG_FILE).getOrThrow()).isEqualTo(new Config(true, 3000, "0.0.0.0"));
    }

    @Test
    void load_isIdempotent() {
        storage.with(CONFIG_FILE, "debug=true\nport=3000\nhost=0.0.0.0");

        Config first = loader.load(CONFIG_FILE).getOrThrow();
        Config second = loader.load(CONFIG_FILE).getOrThrow();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void load_missingFile_failsWithIo() {
        Outcome<Config> result = loader.load(CONFIG_FILE);

        ErrorKind kind = ((Outcome.Fail<Config>) result).kind();
        assertThat(kind).isInstanceOf(ErrorKind.Io.class);
        assertThat(((ErrorKind.Io) kind).reason()).isEqualTo(IoReason.NOT_FOUND);
        assertThat(kind.describe()).isEqualTo("I/O error: config.txt");
    }

    @Test
    void load_unreadableFile_failsWithAccessDenied() {
        storage.with(CONFIG_FILE, "port=3000").deny(CONFIG_FILE);

        ErrorKind kind = ((Outcome.Fail<Config>) loader.load(CONFIG_FILE)).kind();

        assertThat(((ErrorKind.Io) kind).reason()).isEqualTo(IoReason.ACCESS_DENIED);
    }

    @Test
    void loadOrDefaults_fallsBackOnFailure() {
        assertThat(loader.loadOrDefaults(CONFIG_FILE)).isEqualTo(Config.defaults());

        storage.with(CONFIG_FILE, "port=bad");
        assertThat(loader.loadOrDefaults(CONFIG_FILE)).isEqualTo(Config.defaults());
    }

    @Test
    void loadOrDefaults_returnsLoadedConfig() {
        storage.with(CONFIG_FILE, "port=3000");

        assertThat(loader.loadOrDefaults(CONFIG_FILE)).isEqualTo(new Config(false, 3000, "localhost"));
    }
}
