package ai.teliclens.cli;

import ai.teliclens.analyzer.SourceFile;
import ai.teliclens.flow.FlowAnalysis;
import ai.teliclens.flow.FlowAnalyzer;
import ai.teliclens.flow.ZoomLevel;
import ai.teliclens.graph.FlowGraph;
import ai.teliclens.graph.GraphDiff;
import ai.teliclens.graph.GraphJson;
import ai.teliclens.util.AnalysisSettings;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "teliclens",
        mixinStandardHelpOptions = true,
        version = "teliclens 0.1.0",
        description = "Extracts a scoped variable data-flow graph from TypeScript/JavaScript sources, checks it and "
                + "prints it as JSON.")
public final class TelicLensCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(TelicLensCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_IO_ERROR = 2;
    static final int EXIT_CONFIG_ERROR = 3;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(paramLabel = "FILE", arity = "1..*", description = "Source files to analyze.")
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(
            names = "--language",
            description = "Language of all inputs (typescript, javascript). Defaults to the file extension.")
    @Nullable
    private String language;

    @CommandLine.Option(
            names = "--zoom",
            defaultValue = "0",
            description = "Zoom level: 0 variables, 1 functions, 2 files, 3 intents. Default: ${DEFAULT-VALUE}.")
    private int zoom;

    @CommandLine.Option(names = "--report", description = "Print the consistency report instead of the graph.")
    private boolean report;

    @CommandLine.Option(
            names = "--overlay",
            description = "JSON graph of function/file/data/intent nodes to merge the variables into.")
    @Nullable
    private Path overlay;

    @CommandLine.Option(
            names = "--baseline",
            description = "Previously saved graph JSON; print the differences instead of the graph.")
    @Nullable
    private Path baseline;

    @CommandLine.Option(names = "--config", description = "Properties file overriding the analysis defaults.")
    @Nullable
    private Path config;

    @CommandLine.Option(
            names = "--no-call-edges",
            description = "Do not emit edges from call arguments to their callee.")
    private boolean noCallEdges;

    @CommandLine.Option(
            names = "--fail-on-findings",
            description = "Exit with code 1 when the consistency report is not clean.")
    private boolean failOnFindings;

    @CommandLine.Option(names = "--output", description = "Write the JSON to this file instead of stdout.")
    @Nullable
    private Path output;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TelicLensCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        ZoomLevel level;
        try {
            level = ZoomLevel.of(zoom);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        AnalysisSettings settings;
        try {
            settings = AnalysisSettings.load(config);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            spec.commandLine().getErr().println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            logger.error("Unable to read configuration {}", config, e);
            spec.commandLine().getErr().println("Error: cannot read configuration " + config + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        if (noCallEdges) {
            settings = settings.withCallArgumentEdges(false);
        }

        FlowAnalysis analysis;
        Object result;
        try {
            var sources = new ArrayList<SourceFile>(files.size());
            for (var path : files) {
                sources.add(SourceFile.read(path, language));
            }
            var structure = overlay == null ? FlowGraph.EMPTY : GraphJson.readGraph(overlay);

            analysis = new FlowAnalyzer(settings).analyze(sources, structure);
            if (report) {
                result = analysis.report();
            } else if (baseline != null) {
                result = GraphDiff.between(GraphJson.readGraph(baseline), analysis.atZoom(level));
            } else {
                result = analysis.atZoom(level);
            }

            if (output == null) {
                var out = spec.commandLine().getOut();
                out.println(GraphJson.toJson(result));
                out.flush();
            } else {
                GraphJson.write(result, output);
                logger.info("Wrote {}", output);
            }
        } catch (IOException | UncheckedIOException e) {
            logger.error("I/O error: {}", e.getMessage(), e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        if (!analysis.report().isClean()) {
            spec.commandLine().getErr().println(analysis.report().summary());
            if (failOnFindings) {
                return EXIT_FINDINGS;
            }
        }
        return EXIT_OK;
    }
}
