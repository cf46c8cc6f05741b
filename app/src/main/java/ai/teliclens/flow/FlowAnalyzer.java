package ai.teliclens.flow;

import ai.teliclens.analyzer.SourceFile;
import ai.teliclens.analyzer.TreeSitterSyntaxTreeProvider;
import ai.teliclens.graph.FlowGraph;
import ai.teliclens.util.AnalysisSettings;
import ai.teliclens.util.ExecutorServiceUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the whole pipeline over a set of source files: per-file extraction, identity merge, noise filtering, trust
 * boundary marking, an optional structure overlay and the consistency check.
 *
 * <p>Extraction may run on a small thread pool; results are always merged in input order, so the output does not
 * depend on the parallelism setting.
 */
public class FlowAnalyzer {
    private static final Logger logger = LogManager.getLogger(FlowAnalyzer.class);

    private final AnalysisSettings settings;
    private final VariableExtractor extractor;
    private final NoiseFilter noiseFilter;
    private final TrustBoundaryMarker trustMarker;
    private final ConsistencyChecker checker;

    public FlowAnalyzer() {
        this(AnalysisSettings.defaults());
    }

    public FlowAnalyzer(AnalysisSettings settings) {
        this(settings, new VariableExtractor(
                new TreeSitterSyntaxTreeProvider(settings.strictParsing()), settings.callArgumentEdges()));
    }

    public FlowAnalyzer(AnalysisSettings settings, VariableExtractor extractor) {
        this.settings = settings;
        this.extractor = extractor;
        this.noiseFilter = new NoiseFilter(settings.loopCounters());
        this.trustMarker = new TrustBoundaryMarker(settings.trustKeywords());
        this.checker = new ConsistencyChecker(settings.sanitizers());
    }

    public FlowAnalysis analyze(List<SourceFile> files) {
        return analyze(files, FlowGraph.EMPTY);
    }

    public FlowAnalysis analyze(List<SourceFile> files, FlowGraph overlay) {
        var extraction = extractAll(files);
        var table = SymbolTable.of(extraction.variables());
        var nodes = table.toNodes();
        if (settings.filterEnabled()) {
            nodes = noiseFilter.filter(nodes);
        }
        var edges = extraction.flows().stream().map(FlowEdge::toGraphEdge).toList();
        var graph = new FlowGraph(nodes, edges);
        if (settings.trustEnabled()) {
            graph = trustMarker.mark(graph);
        }
        if (!overlay.nodes().isEmpty() || !overlay.edges().isEmpty()) {
            graph = StructureOverlay.merge(overlay, graph);
        }
        var report = checker.check(graph.nodes(), graph.edges());
        logger.info(
                "Analyzed {} files: {} symbols ({} kept), {} edges, {} issues",
                files.size(),
                table.size(),
                nodes.size(),
                edges.size(),
                report.issueCount());
        return new FlowAnalysis(graph, report);
    }

    ExtractionResult extractAll(List<SourceFile> files) {
        int threads = Math.min(settings.parallelism(), files.size());
        if (threads <= 1) {
            var results = new ArrayList<ExtractionResult>(files.size());
            for (var file : files) {
                results.add(extractor.extract(file));
            }
            return ExtractionResult.concat(results);
        }

        var executor = ExecutorServiceUtil.newFixedThreadExecutor(threads, "flow-extract-");
        try {
            var futures = new ArrayList<Future<ExtractionResult>>(files.size());
            for (var file : files) {
                futures.add(executor.submit(() -> extractor.extract(file)));
            }
            var results = new ArrayList<ExtractionResult>(files.size());
            for (var future : futures) {
                results.add(future.get());
            }
            return ExtractionResult.concat(results);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while extracting flows", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Extraction failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }
}
