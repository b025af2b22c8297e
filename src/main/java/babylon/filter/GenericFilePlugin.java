package babylon.filter;

import java.io.File;
import java.io.IOException;

/**
 * Plugin interface for handling columnar file formats.
 * Implementations are registered via ServiceLoader
 * ({@code META-INF/services/babylon.filter.GenericFilePlugin}).
 */
public interface GenericFilePlugin {

    /**
     * Higher priority plugins are checked first.
     * @return Priority value (higher = checked first)
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this plugin can handle the given file.
     * @param file The file to check
     * @return true if this plugin can handle the file
     */
    boolean supports(File file);

    /**
     * Open an existing file for reading.
     * @throws IOException if opening fails
     */
    GenericFile open(File file, Logger logger) throws IOException;

    /**
     * Create a new file with the schema of {@code template}.
     * @param file        The file to create
     * @param template    Open source file whose schema is reused
     * @param compression Codec name
     * @param logger      The logger to use
     * @throws IOException if creation fails
     */
    GenericFile create(File file, GenericFile template, String compression, Logger logger) throws IOException;
}
