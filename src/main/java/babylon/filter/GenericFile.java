/**
 *
 */
package babylon.filter;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Format-neutral handle over a columnar file, opened either for reading or for writing.
 */
public interface GenericFile extends AutoCloseable {

    /**
     * Plugin registry for file format handlers.
     * Plugins are loaded via ServiceLoader, highest priority first.
     */
    class PluginRegistry {
        private static final List<GenericFilePlugin> plugins = new ArrayList<>();

        static {
            for (GenericFilePlugin plugin : ServiceLoader.load(GenericFilePlugin.class)) {
                plugins.add(plugin);
            }
            plugins.sort(Comparator.comparingInt(GenericFilePlugin::priority).reversed());
        }

        static GenericFilePlugin findPlugin(final File file) {
            for (GenericFilePlugin plugin : plugins) {
                if (plugin.supports(file)) {
                    return plugin;
                }
            }
            return null;
        }
    }

    /**
     * Get the schema of this file.
     * @throws IOException if the schema cannot be read
     */
    Meta meta() throws IOException;

    /**
     * Append a row. Only valid on handles returned by {@code create}.
     * @return number of rows written so far
     */
    long write(final Row row) throws IOException;

    /**
     * Lazily read all rows in file order. Only valid on handles returned by {@code open}.
     */
    Cursor<Row> find() throws IOException;

    /**
     * @return size of the file in bytes
     */
    long fileSize();

    /**
     * @param force recount instead of trusting file metadata
     * @return row count, -1 when unknown
     */
    long rows(boolean force) throws IOException;

    /**
     * Flush and finalize (writers) or release (readers).
     */
    @Override
    void close() throws IOException;

    /**
     * Check if the file format is supported by a registered plugin.
     */
    static boolean supports(final File file) {
        return PluginRegistry.findPlugin(file) != null;
    }

    /**
     * Open a file for reading.
     * @throws FilterException STORAGE_READ_ERROR when no plugin handles the file
     */
    static GenericFile open(final File file, final Logger logger) throws IOException {
        final GenericFilePlugin plugin = PluginRegistry.findPlugin(file);
        if (plugin == null)
            throw new FilterException(ErrorCode.STORAGE_READ_ERROR, "unsupported format " + file);
        return plugin.open(file, logger);
    }

    /**
     * Create a file with the same schema as {@code template}. The format is chosen by
     * {@code name}, the file actually created is {@code file}, which lets writers go to a
     * temporary sibling first.
     *
     * @param name        file whose name selects the plugin
     * @param file        file to create
     * @param template    source whose schema is copied
     * @param compression codec name, e.g. "zstd"
     */
    static GenericFile create(final File name, final File file, final GenericFile template, final String compression,
            final Logger logger) throws IOException {
        final GenericFilePlugin plugin = PluginRegistry.findPlugin(name);
        if (plugin == null)
            throw new FilterException(ErrorCode.STORAGE_WRITE_ERROR, "unsupported format " + name);
        return plugin.create(file, template, compression, logger);
    }
}
