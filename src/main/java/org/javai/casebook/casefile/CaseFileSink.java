package org.javai.casebook.casefile;

import java.nio.file.Path;
import java.util.Optional;
import org.javai.casebook.FailureRecord;
import org.javai.casebook.classify.Classification;

/**
 * Persists a recovered failure as a human-readable case file.
 *
 * <p>Called synchronously by the guard. An implementation that cannot persist the
 * record must throw {@link CaseFileException} rather than drop it.
 */
@FunctionalInterface
public interface CaseFileSink {

    /**
     * Writes the case file.
     *
     * @return where the case file was written, or empty if the sink keeps no file
     * @throws CaseFileException if no destination could be written
     */
    Optional<Path> write(FailureRecord record, Classification classification);

    /**
     * A sink that keeps nothing. Useful for testing.
     */
    static CaseFileSink noOp() {
        return (record, classification) -> Optional.empty();
    }
}
