package com.skillbench.dispatch.cli;

import com.skillbench.core.results.ExportFormat;
import com.skillbench.core.results.ResultQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * CLI command: skillbench export &lt;project-id&gt; --format json|csv --out &lt;path&gt;
 */
@Command(name = "export", mixinStandardHelpOptions = true, description = "Export result records")
@Component
public class ExportCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    @Option(names = "--format", defaultValue = "json", description = "json or csv (default: ${DEFAULT-VALUE})")
    private String format;

    @Option(names = "--out", required = true, description = "Destination file")
    private Path out;

    private final ResultQueryService results;

    public ExportCommand(ResultQueryService results) {
        this.results = results;
    }

    @Override
    public void run() {
        try {
            Path written = results.exportResults(projectId, ExportFormat.parse(format), out);
            ConsoleOutput.success("Exported to " + written);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Export failed: " + ConsoleOutput.rootCauseMessage(e));
        }
    }
}
