package ai.teliclens.flow;

import static ai.teliclens.analyzer.ASTTraversalUtils.namedChildren;
import static ai.teliclens.analyzer.ASTTraversalUtils.sameNode;
import static ai.teliclens.analyzer.ASTTraversalUtils.startLine;
import static ai.teliclens.analyzer.javascript.JavaScriptTreeSitterNodeTypes.IDENTIFIER;

import ai.teliclens.analyzer.ParseFailure;
import ai.teliclens.analyzer.SourceContent;
import ai.teliclens.analyzer.SourceFile;
import ai.teliclens.analyzer.SyntaxTree;
import ai.teliclens.analyzer.SyntaxTreeProvider;
import ai.teliclens.analyzer.TreeSitterSyntaxTreeProvider;
import ai.teliclens.graph.DataType;
import ai.teliclens.graph.VariableKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Walks a syntax tree with an explicit scope stack and emits the raw variable observations and data-flow edges of one
 * file. Observations are not merged here; see {@link SymbolTable}.
 *
 * <p>Instances are stateless apart from configuration and may be shared between threads; each call gets its own
 * {@link TraversalContext}.
 */
public class VariableExtractor {
    private static final Logger log = LogManager.getLogger(VariableExtractor.class);

    private final SyntaxTreeProvider provider;
    private final boolean callArgumentEdges;

    public VariableExtractor() {
        this(new TreeSitterSyntaxTreeProvider(), false);
    }

    /**
     * @param callArgumentEdges also emit a {@link FlowEdgeKind#PARAMETER_ARGUMENT} edge from each bare identifier
     *     argument to the callee's root identifier
     */
    public VariableExtractor(SyntaxTreeProvider provider, boolean callArgumentEdges) {
        this.provider = provider;
        this.callArgumentEdges = callArgumentEdges;
    }

    /** Extracts one file. A file that cannot be parsed contributes nothing and does not fail the caller. */
    public ExtractionResult extract(SourceFile file) {
        var outcome = provider.parse(file);
        if (outcome instanceof ParseFailure failure) {
            log.warn(
                    "Skipping {}: parse failed during {}: {}",
                    failure.fileName(),
                    failure.operation(),
                    failure.message());
            return ExtractionResult.EMPTY;
        }
        return extract((SyntaxTree) outcome);
    }

    public ExtractionResult extract(SyntaxTree tree) {
        var context = new TraversalContext(tree.fileName());
        new Walker(tree.source(), context).walk(tree.rootNode());
        var result = context.result();
        log.debug(
                "Extracted {} observations and {} flows from {}",
                result.variables().size(),
                result.flows().size(),
                tree.fileName());
        return result;
    }

    private final class Walker implements SyntaxConstruct.Visitor {
        private final SourceContent source;
        private final TraversalContext context;
        private final ConstructClassifier classifier;

        Walker(SourceContent source, TraversalContext context) {
            this.source = source;
            this.context = context;
            this.classifier = new ConstructClassifier(source);
        }

        void walk(TSNode node) {
            classifier.classify(node).accept(this);
        }

        private void walkChildren(TSNode node) {
            for (var child : namedChildren(node)) {
                walk(child);
            }
        }

        private void walkChildrenExcept(TSNode node, @Nullable TSNode skipped) {
            for (var child : namedChildren(node)) {
                if (!sameNode(child, skipped)) {
                    walk(child);
                }
            }
        }

        @Override
        public void visit(SyntaxConstruct.FunctionLike function) {
            context.enterScope(function.scopeName());
            try {
                for (var parameter : function.parameters()) {
                    context.define(parameter.name(), VariableKind.PARAMETER, parameter.line(), null);
                }
                for (var child : namedChildren(function.node())) {
                    if (sameNode(child, function.nameNode())) {
                        continue;
                    }
                    if (sameNode(child, function.parameterList())) {
                        walkParameterList(function, child);
                    } else if (!isParameterDeclaration(function, child)) {
                        walk(child);
                    }
                }
            } finally {
                context.exitScope();
            }
        }

        private void walkParameterList(SyntaxConstruct.FunctionLike function, TSNode parameterList) {
            for (var child : namedChildren(parameterList)) {
                var parameter = function.parameters().stream()
                        .filter(p -> sameNode(p.declaration(), child))
                        .findFirst();
                if (parameter.isEmpty()) {
                    walk(child);
                } else if (parameter.get().defaultValue() != null) {
                    walk(parameter.get().defaultValue());
                }
            }
        }

        private boolean isParameterDeclaration(SyntaxConstruct.FunctionLike function, TSNode child) {
            return function.parameters().stream().anyMatch(p -> sameNode(p.declaration(), child));
        }

        @Override
        public void visit(SyntaxConstruct.Declarator declarator) {
            var nameNode = declarator.nameNode();
            if (nameNode != null) {
                String name = source.textOf(nameNode);
                var value = declarator.value();
                DataType dataType = value == null ? null : DataTypeInference.infer(value, source);
                var kind = context.atModuleScope() ? VariableKind.GLOBAL : VariableKind.LOCAL;
                context.define(name, kind, startLine(nameNode), dataType);
                for (String src : declarator.flowSources()) {
                    context.flow(FlowEdgeKind.ASSIGNMENT, src, name, src + " assigned to " + name);
                }
            }
            walkChildrenExcept(declarator.node(), nameNode);
        }

        @Override
        public void visit(SyntaxConstruct.FieldDefinition field) {
            var nameNode = field.nameNode();
            if (nameNode != null) {
                var owner = context.currentClass();
                var value = field.value();
                DataType dataType = value == null ? null : DataTypeInference.infer(value, source);
                context.defineIn(
                        owner == null ? context.currentScope() : owner,
                        source.textOf(nameNode),
                        VariableKind.FIELD,
                        startLine(nameNode),
                        dataType);
            }
            // the name is a property identifier; only the initializer can reference variables
            if (field.value() != null) {
                walk(field.value());
            }
        }

        @Override
        public void visit(SyntaxConstruct.IdentifierRef reference) {
            if (!reference.name().isEmpty()) {
                context.use(reference.name(), startLine(reference.node()));
            }
        }

        @Override
        public void visit(SyntaxConstruct.ReturnStatement returnStatement) {
            var returned = returnStatement.returnedName();
            if (returned != null) {
                context.returnValue(returned, startLine(returnStatement.node()));
            }
            walkChildren(returnStatement.node());
        }

        @Override
        public void visit(SyntaxConstruct.Assignment assignment) {
            var target = assignment.targetName();
            if (target != null) {
                for (String src : assignment.flowSources()) {
                    context.flow(FlowEdgeKind.ASSIGNMENT, src, target, src + " assigned to " + target);
                }
            }
            walkChildren(assignment.node());
        }

        @Override
        public void visit(SyntaxConstruct.CallSite call) {
            var root = call.calleeRoot();
            if (callArgumentEdges && root != null) {
                for (var argument : call.identifierArguments()) {
                    context.flow(
                            FlowEdgeKind.PARAMETER_ARGUMENT,
                            argument,
                            root,
                            argument + " passed to " + call.calleeText());
                }
            }
            walkChildren(call.node());
        }

        @Override
        public void visit(SyntaxConstruct.ImportDeclaration importDeclaration) {
            for (var binding : importDeclaration.bindings()) {
                context.define(source.textOf(binding), VariableKind.GLOBAL, startLine(binding), null);
            }
        }

        @Override
        public void visit(SyntaxConstruct.ClassDeclaration classDeclaration) {
            var nameNode = classDeclaration.nameNode();
            context.enterClass(classDeclaration.className());
            try {
                for (var child : namedChildren(classDeclaration.node())) {
                    // class names are declarations, not references
                    if (sameNode(child, nameNode) && IDENTIFIER.equals(child.getType())) {
                        continue;
                    }
                    walk(child);
                }
            } finally {
                context.exitClass();
            }
        }

        @Override
        public void visit(SyntaxConstruct.Unhandled unhandled) {
            walkChildren(unhandled.node());
        }
    }
}
