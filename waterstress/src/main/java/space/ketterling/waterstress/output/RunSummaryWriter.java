package space.ketterling.waterstress.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Writes a {@link RunSummary} as pretty-printed JSON.
 */
public class RunSummaryWriter {
    private static final Logger log = LoggerFactory.getLogger(RunSummaryWriter.class);

    private final ObjectMapper om;

    public RunSummaryWriter(ObjectMapper om) {
        this.om = om;
    }

    public void write(Path path, RunSummary summary) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        om.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), summary);
        log.info("Wrote run summary to {} (latest month {}, {} regions in deficit)", path, summary.latestMonth(),
                summary.regionsInDeficit());
    }
}
