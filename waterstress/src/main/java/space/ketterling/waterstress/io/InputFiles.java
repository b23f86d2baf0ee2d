package space.ketterling.waterstress.io;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

/**
 * Opens pipeline input files, transparently decompressing .gz and .bz2.
 *
 * <p>
 * Callers own the returned stream and must close it (try-with-resources);
 * closing the outer stream releases the file handle.
 * </p>
 */
public final class InputFiles {

    /**
     * Utility class; no instances.
     */
    private InputFiles() {
    }

    /**
     * Opens a file as a byte stream.
     */
    public static InputStream open(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Input file not found: " + path);
        }
        InputStream raw = new BufferedInputStream(Files.newInputStream(path));
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            if (name.endsWith(".gz"))
                return new GzipCompressorInputStream(raw, true);
            if (name.endsWith(".bz2"))
                return new BZip2CompressorInputStream(raw, true);
            return raw;
        } catch (IOException e) {
            raw.close();
            throw e;
        }
    }

    /**
     * Opens a file as UTF-8 text.
     */
    public static BufferedReader openReader(Path path) throws IOException {
        return new BufferedReader(new InputStreamReader(open(path), StandardCharsets.UTF_8));
    }
}
