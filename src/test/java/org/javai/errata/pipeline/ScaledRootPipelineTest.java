package org.javai.errata.pipeline;

import org.javai.errata.DomainError;
import org.javai.errata.ErrorKind;
import org.javai.errata.IoReason;
import org.javai.errata.Outcome;
import org.javai.errata.boundary.Boundary;
import org.javai.errata.storage.FileStorage;
import org.javai.errata.storage.InMemoryStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ScaledRootPipelineTest {

    private static final Path NUMBER_FILE = Path.of("number.txt");

    @Test
    void hundred_yieldsOne() {
        InMemoryStorage storage = new InMemoryStorage().with(NUMBER_FILE, "100");

        Outcome<Double> result = new ScaledRootPipeline(storage, Boundary.silent()).run(NUMBER_FILE);

        assertThat(result.getOrThrow()).isEqualTo(1.0);
    }

    @Test
    void surroundingWhitespace_isTrimmed() {
        InMemoryStorage storage = new InMemoryStorage().with(NUMBER_FILE, "  100\n");

        assertThat(new ScaledRootPipeline(storage, Boundary.silent()).run(NUMBER_FILE).getOrThrow()).isEqualTo(1.0);
    }

    @Test
    void negativeInput_failsAtSqrtAndNeverDivides() {
        InMemoryStorage storage = new InMemoryStorage().with(NUMBER_FILE, "-4");
        // a zero divisor would fail differently if the divide step ran
        ScaledRootPipeline pipeline = new ScaledRootPipeline(storage, Boundary.silent(), 0.0);

        Outcome<Double> result = pipeline.run(NUMBER_FILE);

        assertThat(((Outcome.Fail<Double>) result).kind())
                .isEqualTo(new ErrorKind.Domain(DomainError.NEGATIVE_SQUARE_ROOT));
    }

    @Test
    void zeroDivisor_failsAtDivide() {
        InMemoryStorage storage = new InMemoryStorage().with(NUMBER_FILE, "100");

        Outcome<Double> result = new ScaledRootPipeline(storage, Boundary.silent(), 0.0).run(NUMBER_FILE);

        assertThat(((Outcome.Fail<Double>) result).kind())
                .isEqualTo(new ErrorKind.Domain(DomainError.DIVISION_BY_ZERO));
    }

    @Test
    void missingFile_failsWithNotFound() {
        InMemoryStorage storage = new InMemoryStorage();

        Outcome<Double> result = new ScaledRootPipeline(storage, Boundary.silent()).run(NUMBER_FILE);

        ErrorKind kind = ((Outcome.Fail<Double>) result).kind();
        assertThat(kind).isInstanceOf(ErrorKind.Io.class);
        assertThat(((ErrorKind.Io) kind).reason()).isEqualTo(IoReason.NOT_FOUND);
    }

    @Test
    void malformedNumber_failsWithParseFloatAndIsReported() {
        InMemoryStorage storage = new InMemoryStorage().with(NUMBER_FILE, "one hundred");
        List<String> operations = new ArrayList<>();
        Boundary boundary = Boundary.withReporter((operation, kind) -> operations.add(operation));

        Outcome<Double> result = new ScaledRootPipeline(storage, boundary).run(NUMBER_FILE);

        ErrorKind kind = ((Outcome.Fail<Double>) result).kind();
        assertThat(kind).isInstanceOf(ErrorKind.ParseFloat.class);
        assertThat(kind.describe()).startsWith("Float parse error: ").contains("one hundred");
        assertThat(operations).containsExactly("ScaledRootPipeline.parse");
    }

    @ParameterizedTest
    @ValueSource(strings = {"100d", "100f", "0x1p4", "1_000", "\u0661\u0660\u0660"})
    void nonDecimalLiterals_failWithParseFloat(String text) {
        InMemoryStorage storage = new InMemoryStorage().with(NUMBER_FILE, text);

        Outcome<Double> result = new ScaledRootPipeline(storage, Boundary.silent()).run(NUMBER_FILE);

        assertThat(((Outcome.Fail<Double>) result).kind()).isInstanceOf(ErrorKind.ParseFloat.class);
    }

    @Test
    void lowercaseInfinityAndNaN_areNumbers() {
        InMemoryStorage storage = new InMemoryStorage()
                .with(Path.of("inf"), "inf")
                .with(Path.of("nan"), "nan\n");
        ScaledRootPipeline pipeline = new ScaledRootPipeline(storage, Boundary.silent());

        assertThat(pipeline.run(Path.of("inf")).getOrThrow()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(pipeline.run(Path.of("nan")).getOrThrow()).isNaN();
    }

    @Test
    void pipeline_isReusable() {
        InMemoryStorage storage = new InMemoryStorage()
                .with(Path.of("a"), "400")
                .with(Path.of("b"), "-1");
        ScaledRootPipeline pipeline = new ScaledRootPipeline(storage, Boundary.silent());

        assertThat(pipeline.run(Path.of("a")).getOrThrow()).isEqualTo(2.0);
        assertThat(pipeline.run(Path.of("b")).isFail()).isTrue();
        assertThat(pipeline.run(Path.of("a")).getOrThrow()).isEqualTo(2.0);
        assertThat(storage.reads()).isEqualTo(3);
    }

    @Test
    void fileStorage_endToEnd(@TempDir Path dir) throws Exception {
        FileStorage storage = new FileStorage();
        Path file = dir.resolve("number.txt");
        storage.writeText(file, "100");

        assertThat(new ScaledRootPipeline(storage, Boundary.silent()).run(file).getOrThrow()).isEqualTo(1.0);
    }
}
