package org.javai.errata.pipeline;

import java.nio.file.Path;
import java.util.Objects;
import org.javai.errata.Outcome;
import org.javai.errata.boundary.Boundary;
import org.javai.errata.boundary.ErrorConversions;
import org.javai.errata.chain.Chain;
import org.javai.errata.domain.Arithmetic;
import org.javai.errata.storage.Storage;
import org.javai.errata.text.Literals;

/**
 * Reads a number from storage and returns its square root divided by a fixed divisor.
 *
 * <p>The four links run in order and stop at the first failure:
 * <ol>
 *   <li>read the text at the path ({@code Io})</li>
 *   <li>parse the trimmed text as a decimal, {@code inf} or {@code nan} literal ({@code ParseFloat})</li>
 *   <li>take the square root ({@code Domain(NEGATIVE_SQUARE_ROOT)})</li>
 *   <li>divide by the divisor ({@code Domain(DIVISION_BY_ZERO)})</li>
 * </ol>
 */
public final class ScaledRootPipeline {

    public static final double DEFAULT_DIVISOR = 10.0;

    private final Chain<Path, Double> chain;

    public ScaledRootPipeline(Storage storage, Boundary boundary) {
        this(storage, boundary, DEFAULT_DIVISOR);
    }

    public ScaledRootPipeline(Storage storage, Boundary boundary, double divisor) {
        Objects.requireNonNull(storage, "storage must not be null");
        Objects.requireNonNull(boundary, "boundary must not be null");
        this.chain = Chain.<Path>start()
                .thenCall("Storage.readText", boundary, ErrorConversions.IO, storage::readText)
                .thenCall("ScaledRootPipeline.parse", boundary, ErrorConversions.FLOAT_PARSE, ScaledRootPipeline::parse)
                .then(Arithmetic::sqrt)
                .then(root -> Arithmetic.divide(root, divisor));
    }

    /**
     * Runs the pipeline against the text stored at {@code path}.
     *
     * @return √value / divisor, or the first failure
     */
    public Outcome<Double> run(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return chain.run(path);
    }

    private static double parse(String text) {
        return Literals.parseFloat(Literals.trim(text));
    }
}
