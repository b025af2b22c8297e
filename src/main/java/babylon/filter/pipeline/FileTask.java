package babylon.filter.pipeline;

import java.io.File;

/**
 * One source file and where its filtered copy goes.
 */
public final class FileTask {

    private final File source;
    private final File destination;

    public FileTask(final File source, final File destination) {
        if (source == null || destination == null)
            throw new IllegalArgumentException("source and destination are required");
        this.source = source;
        this.destination = destination;
    }

    /**
     * Mirror {@code source} into {@code directory} under the same base name.
     */
    public static FileTask mirror(final File source, final File directory) {
        return new FileTask(source, new File(directory, source.getName()));
    }

    public File source() {
        return source;
    }

    public File destination() {
        return destination;
    }

    @Override
    public String toString() {
        return source + " -> " + destination;
    }
}
