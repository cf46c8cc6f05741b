package ai.teliclens.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** JSON encoding of graphs, reports and diffs, in the shape the rendering layer consumes. */
public final class GraphJson {
    private static final Logger logger = LogManager.getLogger(GraphJson.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(SerializationFeature.CLOSE_CLOSEABLE, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private GraphJson() {}

    public static String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static FlowGraph parseGraph(String json) throws IOException {
        var graph = objectMapper.readValue(json, FlowGraph.class);
        return graph == null ? FlowGraph.EMPTY : graph;
    }

    /**
     * Reads a graph previously written by {@link #toJson(Object)} or supplied by a collaborator. Unknown properties
     * (layout coordinates, colors) are ignored.
     */
    public static FlowGraph readGraph(Path path) throws IOException {
        var graph = parseGraph(Files.readString(path));
        logger.debug("Read {} nodes and {} edges from {}", graph.nodes().size(), graph.edges().size(), path);
        return graph;
    }

    public static void write(Object value, Path path) throws IOException {
        Files.writeString(path, toJson(value));
    }
}
