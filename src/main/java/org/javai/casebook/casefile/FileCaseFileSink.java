package org.javai.casebook.casefile;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.casebook.CasebookConfig;
import org.javai.casebook.FailureRecord;
import org.javai.casebook.classify.Classification;

/**
 * Writes each case file to a notebook path, or to a fresh temporary file when the
 * notebook cannot be used.
 *
 * <p>The file holds the original fault's message and the trace captured at the failure:
 * <pre>
 * FAILURE: disk: no space left on device
 * STACK TRACE:
 * 	at com.example.Store.save(Store.java:42)
 * 	...
 * </pre>
 *
 * <p>An existing notebook is replaced, so it always describes the most recent failure.
 */
public class FileCaseFileSink implements CaseFileSink {

    static final String TEMP_PREFIX = "casebook-";
    static final String TEMP_SUFFIX = ".case";

    private static final Logger LOG = LogManager.getLogger(FileCaseFileSink.class);

    private final Path notebook;
    private final Path tempDirectory;

    /**
     * Creates a sink using the notebook configured by {@code casebook.notebook} /
     * {@code CASEBOOK_NOTEBOOK}; temporary files only when neither is set.
     */
    public FileCaseFileSink() {
        this(CasebookConfig.notebook().orElse(null));
    }

    /**
     * @param notebook the preferred destination, or null to always use a temporary file
     */
    public FileCaseFileSink(Path notebook) {
        this(notebook, null);
    }

    /**
     * @param notebook the preferred destination, or null to always use a temporary file
     * @param tempDirectory where temporary files go, or null for the system default
     */
    public FileCaseFileSink(Path notebook, Path tempDirectory) {
        this.notebook = notebook;
        this.tempDirectory = tempDirectory;
    }

    public Optional<Path> notebook() {
        return Optional.ofNullable(notebook);
    }

    @Override
    public Optional<Path> write(FailureRecord record, Classification classification) {
        Objects.requireNonNull(record, "record must not be null");
        String content = format(record);

        if (notebook != null) {
            try {
                writeReplacing(notebook, content);
                return Optional.of(notebook);
            } catch (IOException e) {
                LOG.warn("Cannot write case file to notebook {}, using a temporary file: {}",
                        notebook, e.getMessage());
            }
        }

        try {
            Path temp = tempDirectory != null
                    ? Files.createTempFile(tempDirectory, TEMP_PREFIX, TEMP_SUFFIX)
                    : Files.createTempFile(TEMP_PREFIX, TEMP_SUFFIX);
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            return Optional.of(temp);
        } catch (IOException e) {
            throw new CaseFileException("No writable destination for case file of " + record.fault().code(), e);
        }
    }

    /**
     * Renders the case-file text for a record.
     */
    public static String format(FailureRecord record) {
        return "FAILURE: " + record.message() + System.lineSeparator()
                + "STACK TRACE:" + System.lineSeparator()
                + record.trace() + System.lineSeparator();
    }

    private static void writeReplacing(Path path, String content) throws IOException {
        Files.deleteIfExists(path);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(content);
        }
    }
}
