package babylon.filter;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

/**
 * Plugin for handling Parquet files.
 */
public class ParquetFilePlugin implements GenericFilePlugin {

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean supports(File file) {
        return file.getName().toLowerCase(Locale.ROOT).endsWith(".parquet");
    }

    @Override
    public GenericFile open(File file, Logger logger) throws IOException {
        return ParquetFile.open(file, logger);
    }

    @Override
    public GenericFile create(File file, GenericFile template, String compression, Logger logger) throws IOException {
        if (template instanceof ParquetFile source)
            return ParquetFile.create(file, source.schema(), source.layout(), compression, logger);
        return ParquetFile.create(file, template.meta().columns(), compression, logger);
    }
}
