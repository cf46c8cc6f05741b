package ai.teliclens.flow;

import ai.teliclens.graph.EdgeType;
import ai.teliclens.graph.FlowGraph;
import ai.teliclens.graph.GraphEdge;
import ai.teliclens.graph.GraphNode;
import ai.teliclens.graph.NodeType;
import ai.teliclens.graph.SourceLocation;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/**
 * Coarsens a variable graph into function, file or intent resolution. All operations are pure; inputs are never
 * modified. At every level the first edge seen for an ordered endpoint pair wins.
 */
public final class GraphClusterer {
    static final String UNKNOWN_FILE = "unknown";

    private GraphClusterer() {}

    public static FlowGraph cluster(FlowGraph graph, ZoomLevel level) {
        return cluster(graph.nodes(), graph.edges(), level);
    }

    public static FlowGraph cluster(List<GraphNode> nodes, List<GraphEdge> edges, int level) {
        return cluster(nodes, edges, ZoomLevel.of(level));
    }

    public static FlowGraph cluster(List<GraphNode> nodes, List<GraphEdge> edges, ZoomLevel level) {
        return switch (level) {
            case VARIABLE -> new FlowGraph(nodes, edges);
            case FUNCTION -> toFunctionLevel(nodes, edges);
            case FILE -> toFileLevel(nodes, edges);
            case INTENT -> toIntentLevel(nodes, edges);
        };
    }

    static FlowGraph toFunctionLevel(List<GraphNode> nodes, List<GraphEdge> edges) {
        var members = new LinkedHashMap<String, List<GraphNode>>();
        var others = new ArrayList<GraphNode>();
        for (var node : nodes) {
            if (node.isVariable()) {
                members.computeIfAbsent(clusterOf(node), k -> new ArrayList<>()).add(node);
            } else {
                others.add(node);
            }
        }

        var otherIds = others.stream().map(GraphNode::id).collect(Collectors.toSet());
        var clustered = new ArrayList<GraphNode>(others.size() + members.size());
        for (var node : others) {
            var cluster = members.get(node.id());
            clustered.add(cluster == null
                    ? node
                    : node.asCluster(
                            suffixed(node.description(), cluster.size() + " variables"),
                            cluster.size(),
                            ZoomLevel.FUNCTION.level(),
                            union(node.inputs(), cluster, GraphNode::inputs),
                            union(node.outputs(), cluster, GraphNode::outputs)));
        }
        members.forEach((key, cluster) -> {
            if (!otherIds.contains(key)) {
                clustered.add(synthesizeFunction(key, cluster));
            }
        });

        var byId = index(nodes);
        var aggregated = new LinkedHashMap<String, GraphEdge>();
        for (var edge : edges) {
            var source = byId.get(edge.source());
            var target = byId.get(edge.target());
            if (source == null || target == null) {
                continue;
            }
            if (source.isVariable() && target.isVariable()) {
                String sourceCluster = clusterOf(source);
                String targetCluster = clusterOf(target);
                if (sourceCluster.equals(targetCluster)) {
                    continue;
                }
                var lifted = new GraphEdge(
                        sourceCluster,
                        targetCluster,
                        EdgeType.FLOW,
                        "data flow (" + (edge.label() == null ? "variables" : edge.label()) + ")",
                        "Aggregated from variable flows",
                        edge.trustBoundary());
                aggregated.putIfAbsent(lifted.key(), lifted);
            } else {
                aggregated.putIfAbsent(edge.key(), edge);
            }
        }
        return new FlowGraph(clustered, List.copyOf(aggregated.values()));
    }

    static FlowGraph toFileLevel(List<GraphNode> nodes, List<GraphEdge> edges) {
        var clusterFiles = clusterFiles(nodes);
        var byFile = new LinkedHashMap<String, List<GraphNode>>();
        var fileNodes = new LinkedHashMap<String, GraphNode>();
        var rest = new ArrayList<GraphNode>();
        for (var node : nodes) {
            if (node.type().isFunctionLike()) {
                byFile.computeIfAbsent(homeFile(node, clusterFiles), k -> new ArrayList<>())
                        .add(node);
            } else if (node.type() == NodeType.FILE) {
                fileNodes.put(node.id(), node);
            } else {
                rest.add(node);
            }
        }

        var fileIds = new LinkedHashMap<String, String>();
        var existingFiles = List.copyOf(fileNodes.values());
        byFile.forEach((file, group) -> {
            int functions = countFunctions(group);
            var existing = existingFiles.stream()
                    .filter(f -> file.equals(f.locationFile()) || file.equals(f.label()))
                    .findFirst();
            if (existing.isPresent()) {
                var current = fileNodes.get(existing.get().id());
                assert current != null;
                fileNodes.put(
                        current.id(),
                        current.asCluster(
                                suffixed(current.description(), functions + " functions"),
                                functions,
                                ZoomLevel.FILE.level(),
                                union(current.inputs(), group, GraphNode::inputs),
                                union(current.outputs(), group, GraphNode::outputs)));
                fileIds.put(file, current.id());
            } else {
                String id = CanonicalId.file(file);
                fileNodes.putIfAbsent(
                        id,
                        new GraphNode(
                                id,
                                file,
                                NodeType.FILE,
                                functions + " functions",
                                new SourceLocation(file, 1, 1, null),
                                null,
                                null,
                                ZoomLevel.FILE.level(),
                                functions,
                                union(List.of(), group, GraphNode::inputs),
                                union(List.of(), group, GraphNode::outputs)));
                fileIds.put(file, id);
            }
        });

        var byId = index(nodes);
        var aggregated = new LinkedHashMap<String, GraphEdge>();
        for (var edge : edges) {
            var source = byId.get(edge.source());
            var target = byId.get(edge.target());
            if (source == null || target == null) {
                continue;
            }
            if (source.type().isFunctionLike() && target.type().isFunctionLike()) {
                String sourceFile = homeFile(source, clusterFiles);
                String targetFile = homeFile(target, clusterFiles);
                if (sourceFile.equals(targetFile)) {
                    continue;
                }
                var lifted = new GraphEdge(
                        fileIds.getOrDefault(sourceFile, CanonicalId.file(sourceFile)),
                        fileIds.getOrDefault(targetFile, CanonicalId.file(targetFile)),
                        EdgeType.DEPENDENCY,
                        "file dependency",
                        "Aggregated from function dependencies",
                        edge.trustBoundary());
                aggregated.putIfAbsent(lifted.key(), lifted);
            } else {
                aggregated.putIfAbsent(edge.key(), edge);
            }
        }

        var clustered = new ArrayList<GraphNode>(fileNodes.values());
        clustered.addAll(rest);
        return new FlowGraph(clustered, List.copyOf(aggregated.values()));
    }

    static FlowGraph toIntentLevel(List<GraphNode> nodes, List<GraphEdge> edges) {
        var intents = nodes.stream().filter(n -> n.type() == NodeType.INTENT).toList();
        var intentIds = intents.stream().map(GraphNode::id).collect(Collectors.toSet());
        var servingComponents = new LinkedHashMap<String, Set<String>>();
        for (var edge : edges) {
            if (edge.type() == EdgeType.SERVES_INTENT) {
                servingComponents.computeIfAbsent(edge.target(), k -> new LinkedHashSet<>()).add(edge.source());
            }
        }

        var clustered = intents.stream()
                .map(intent -> {
                    int components = servingComponents.getOrDefault(intent.id(), Set.of()).size();
                    return intent.asCluster(
                            suffixed(intent.description(), components + " components"),
                            components,
                            ZoomLevel.INTENT.level(),
                            intent.inputs(),
                            intent.outputs());
                })
                .toList();

        var kept = new LinkedHashMap<String, GraphEdge>();
        for (var edge : edges) {
            boolean keep =
                    switch (edge.type()) {
                        case SUPPORTS_INTENT, UNDERMINES_INTENT -> true;
                        case SERVES_INTENT -> intentIds.contains(edge.target());
                        default -> false;
                    };
            if (keep) {
                kept.putIfAbsent(edge.key(), edge);
            }
        }
        return new FlowGraph(clustered, List.copyOf(kept.values()));
    }

    private static String clusterOf(GraphNode variable) {
        var clusterId = variable.clusterId();
        return clusterId == null ? TraversalContext.GLOBAL_SCOPE : clusterId;
    }

    private static String fileOf(GraphNode node) {
        var file = node.locationFile();
        return file == null ? UNKNOWN_FILE : file;
    }

    /**
     * File of each variable cluster: the owning node's file when the cluster has a node, otherwise the first member's.
     * Members of one cluster always land in the same file as their owner.
     */
    private static Map<String, String> clusterFiles(List<GraphNode> nodes) {
        var byId = index(nodes);
        var files = new LinkedHashMap<String, String>();
        for (var node : nodes) {
            if (!node.isVariable()) {
                continue;
            }
            String key = clusterOf(node);
            if (files.containsKey(key)) {
                continue;
            }
            var owner = byId.get(key);
            if (owner != null && !owner.isVariable()) {
                files.put(key, fileOf(owner));
            } else if (node.locationFile() != null) {
                files.put(key, node.locationFile());
            }
        }
        return files;
    }

    private static String homeFile(GraphNode node, Map<String, String> clusterFiles) {
        if (node.isVariable()) {
            return clusterFiles.getOrDefault(clusterOf(node), UNKNOWN_FILE);
        }
        return fileOf(node);
    }

    /** Function nodes count once each; variables count once per function cluster not already represented. */
    private static int countFunctions(List<GraphNode> group) {
        var functions = new HashSet<String>();
        for (var node : group) {
            functions.add(node.isVariable() ? clusterOf(node) : node.id());
        }
        return functions.size();
    }

    private static GraphNode synthesizeFunction(String key, List<GraphNode> cluster) {
        @Nullable SourceLocation location = null;
        var locations = cluster.stream()
                .map(GraphNode::location)
                .filter(l -> l != null)
                .toList();
        if (!locations.isEmpty()) {
            String file = locations.get(0).file();
            var sameFile =
                    locations.stream().filter(l -> l.file().equals(file)).toList();
            int start = sameFile.stream().mapToInt(SourceLocation::startLine).min().orElse(0);
            int end = sameFile.stream().mapToInt(SourceLocation::endLine).max().orElse(start);
            location = new SourceLocation(file, start, end, null);
        }
        return new GraphNode(
                key,
                CanonicalId.functionName(key),
                NodeType.FUNCTION,
                cluster.size() + " variables",
                location,
                null,
                null,
                ZoomLevel.FUNCTION.level(),
                cluster.size(),
                union(List.of(), cluster, GraphNode::inputs),
                union(List.of(), cluster, GraphNode::outputs));
    }

    private static String suffixed(@Nullable String description, String count) {
        String suffix = "[" + count + "]";
        return description == null || description.isEmpty() ? suffix : description + " " + suffix;
    }

    private static List<String> union(
            List<String> own, Collection<GraphNode> members, Function<GraphNode, List<String>> names) {
        var result = new LinkedHashSet<>(own);
        for (var member : members) {
            result.addAll(names.apply(member));
        }
        return List.copyOf(result);
    }

    private static Map<String, GraphNode> index(List<GraphNode> nodes) {
        var byId = new LinkedHashMap<String, GraphNode>();
        for (var node : nodes) {
            byId.putIfAbsent(node.id(), node);
        }
        return byId;
    }
}
