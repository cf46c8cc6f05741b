package ai.teliclens.flow;

import static ai.teliclens.analyzer.ASTTraversalUtils.field;
import static ai.teliclens.analyzer.ASTTraversalUtils.namedChildren;
import static ai.teliclens.analyzer.ASTTraversalUtils.startLine;
import static ai.teliclens.analyzer.javascript.JavaScriptTreeSitterNodeTypes.*;

import ai.teliclens.analyzer.SourceContent;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Maps tree-sitter nodes of the TypeScript and JavaScript grammars onto {@link SyntaxConstruct}s. */
final class ConstructClassifier {

    private final SourceContent source;

    ConstructClassifier(SourceContent source) {
        this.source = source;
    }

    SyntaxConstruct classify(TSNode node) {
        String type = node.getType();
        return switch (type) {
            case FUNCTION_DECLARATION, GENERATOR_FUNCTION_DECLARATION -> functionLike(node, "anonymous");
            case FUNCTION_EXPRESSION, FUNCTION, GENERATOR_FUNCTION, METHOD_DEFINITION ->
                functionLike(node, "anonymous_" + startLine(node));
            case ARROW_FUNCTION -> arrowFunction(node);
            case VARIABLE_DECLARATOR -> {
                var value = field(node, "value").orElse(null);
                yield new SyntaxConstruct.Declarator(
                        node,
                        identifierField(node, "name").orElse(null),
                        value,
                        value == null ? List.of() : flowSources(value));
            }
            case FOR_IN_STATEMENT -> forBinding(node);
            case FIELD_DEFINITION, PUBLIC_FIELD_DEFINITION -> fieldDefinition(node);
            case IDENTIFIER, SHORTHAND_PROPERTY_IDENTIFIER ->
                new SyntaxConstruct.IdentifierRef(node, source.textOf(node));
            case RETURN_STATEMENT ->
                new SyntaxConstruct.ReturnStatement(
                        node,
                        returnedExpression(node)
                                .flatMap(this::bareIdentifier)
                                .map(source::textOf)
                                .orElse(null));
            case ASSIGNMENT_EXPRESSION ->
                new SyntaxConstruct.Assignment(
                        node,
                        field(node, "left").flatMap(this::bareIdentifier).map(source::textOf).orElse(null),
                        field(node, "right").map(this::flowSources).orElse(List.of()));
            case CALL_EXPRESSION -> callSite(node);
            case IMPORT_STATEMENT -> new SyntaxConstruct.ImportDeclaration(node, importBindings(node));
            case CLASS_DECLARATION, ABSTRACT_CLASS_DECLARATION, CLASS -> classDeclaration(node);
            default -> new SyntaxConstruct.Unhandled(node);
        };
    }

    /** The node itself when it is an identifier, looking through redundant parentheses. */
    Optional<TSNode> bareIdentifier(TSNode node) {
        TSNode current = unwrap(node);
        return IDENTIFIER.equals(current.getType()) ? Optional.of(current) : Optional.empty();
    }

    /**
     * Names whose value flows into whatever {@code value} is assigned to: the identifier itself for {@code x = y}, the
     * bare identifier arguments for {@code x = f(a, b)} and {@code x = await f(a)}. Anything else yields no flow.
     */
    List<String> flowSources(TSNode value) {
        var identifier = bareIdentifier(value);
        if (identifier.isPresent()) {
            return List.of(source.textOf(identifier.get()));
        }
        TSNode current = unwrap(value);
        if (AWAIT_EXPRESSION.equals(current.getType())) {
            var awaited = namedChildren(current);
            if (awaited.size() != 1) {
                return List.of();
            }
            current = unwrap(awaited.get(0));
        }
        if (!CALL_EXPRESSION.equals(current.getType())) {
            return List.of();
        }
        var names = new ArrayList<String>();
        field(current, "arguments").ifPresent(list -> {
            for (var argument : namedChildren(list)) {
                bareIdentifier(argument).map(source::textOf).ifPresent(names::add);
            }
        });
        return names;
    }

    private static TSNode unwrap(TSNode node) {
        TSNode current = node;
        while (PARENTHESIZED_EXPRESSION.equals(current.getType())) {
            var inner = namedChildren(current);
            if (inner.size() != 1) {
                return current;
            }
            current = inner.get(0);
        }
        return current;
    }

    private Optional<TSNode> identifierField(TSNode node, String fieldName) {
        return field(node, fieldName).filter(child -> IDENTIFIER.equals(child.getType()));
    }

    private SyntaxConstruct functionLike(TSNode node, String fallbackName) {
        var nameNode = field(node, "name").orElse(null);
        String scopeName = nameNode == null ? fallbackName : source.textOf(nameNode);
        if (scopeName.isEmpty()) {
            scopeName = fallbackName;
        }
        var parameterList = field(node, "parameters").orElse(null);
        var parameters = parameterList == null ? List.<SyntaxConstruct.Parameter>of() : parameters(parameterList);
        return new SyntaxConstruct.FunctionLike(node, scopeName, nameNode, parameterList, parameters);
    }

    private SyntaxConstruct arrowFunction(TSNode node) {
        String scopeName = "arrow_" + startLine(node);
        var single = identifierField(node, "parameter");
        if (single.isPresent()) {
            var identifier = single.get();
            var parameter =
                    new SyntaxConstruct.Parameter(source.textOf(identifier), startLine(identifier), identifier, null);
            return new SyntaxConstruct.FunctionLike(node, scopeName, null, null, List.of(parameter));
        }
        var parameterList = field(node, "parameters").orElse(null);
        var parameters = parameterList == null ? List.<SyntaxConstruct.Parameter>of() : parameters(parameterList);
        return new SyntaxConstruct.FunctionLike(node, scopeName, null, parameterList, parameters);
    }

    /** Simple-identifier parameters only; destructured and rest parameters are not bindings we track. */
    private List<SyntaxConstruct.Parameter> parameters(TSNode parameterList) {
        var parameters = new ArrayList<SyntaxConstruct.Parameter>();
        for (var child : namedChildren(parameterList)) {
            @Nullable TSNode identifier = null;
            @Nullable TSNode defaultValue = null;
            switch (child.getType()) {
                case IDENTIFIER -> identifier = child;
                case ASSIGNMENT_PATTERN -> {
                    identifier = identifierField(child, "left").orElse(null);
                    defaultValue = field(child, "right").orElse(null);
                }
                case REQUIRED_PARAMETER, OPTIONAL_PARAMETER -> {
                    identifier = identifierField(child, "pattern").orElse(null);
                    defaultValue = field(child, "value").orElse(null);
                }
                default -> {
                    // patterns, rest elements, decorators, `this` parameters
                }
            }
            if (identifier != null) {
                parameters.add(new SyntaxConstruct.Parameter(
                        source.textOf(identifier), startLine(identifier), child, defaultValue));
            }
        }
        return parameters;
    }

    /** {@code for (const x of xs)} declares {@code x}; {@code for (x of xs)} only uses it. */
    private SyntaxConstruct forBinding(TSNode node) {
        if (field(node, "kind").isEmpty() && !hasDeclarationKeyword(node)) {
            return new SyntaxConstruct.Unhandled(node);
        }
        var left = identifierField(node, "left");
        return left.<SyntaxConstruct>map(
                        identifier -> new SyntaxConstruct.Declarator(node, identifier, null, List.of()))
                .orElseGet(() -> new SyntaxConstruct.Unhandled(node));
    }

    private static boolean hasDeclarationKeyword(TSNode forStatement) {
        for (int i = 0; i < forStatement.getChildCount(); i++) {
            var child = forStatement.getChild(i);
            if (!child.isNull()) {
                var type = child.getType();
                if (type.equals("const") || type.equals("let") || type.equals("var")) {
                    return true;
                }
            }
        }
        return false;
    }

    private SyntaxConstruct fieldDefinition(TSNode node) {
        var name = field(node, "name").or(() -> field(node, "property")).orElse(null);
        return new SyntaxConstruct.FieldDefinition(node, name, field(node, "value").orElse(null));
    }

    private Optional<TSNode> returnedExpression(TSNode returnStatement) {
        return namedChildren(returnStatement).stream().findFirst();
    }

    private SyntaxConstruct callSite(TSNode node) {
        var callee = field(node, "function").orElse(null);
        if (callee == null) {
            return new SyntaxConstruct.CallSite(node, null, "", List.of());
        }
        var arguments = new ArrayList<String>();
        field(node, "arguments").ifPresent(list -> {
            for (var argument : namedChildren(list)) {
                bareIdentifier(argument).map(source::textOf).ifPresent(arguments::add);
            }
        });
        return new SyntaxConstruct.CallSite(
                node, calleeRoot(callee).map(source::textOf).orElse(null), source.textOf(callee), arguments);
    }

    private Optional<TSNode> calleeRoot(TSNode callee) {
        TSNode current = callee;
        while (MEMBER_EXPRESSION.equals(current.getType())) {
            var object = field(current, "object");
            if (object.isEmpty()) {
                return Optional.empty();
            }
            current = object.get();
        }
        return bareIdentifier(current);
    }

    private List<TSNode> importBindings(TSNode importStatement) {
        var bindings = new ArrayList<TSNode>();
        for (var child : namedChildren(importStatement)) {
            if (IMPORT_CLAUSE.equals(child.getType())) {
                for (var part : namedChildren(child)) {
                    switch (part.getType()) {
                        case IDENTIFIER -> bindings.add(part);
                        case NAMESPACE_IMPORT ->
                            namedChildren(part).stream()
                                    .filter(n -> IDENTIFIER.equals(n.getType()))
                                    .forEach(bindings::add);
                        case NAMED_IMPORTS -> {
                            for (var specifier : namedChildren(part)) {
                                if (IMPORT_SPECIFIER.equals(specifier.getType())) {
                                    identifierField(specifier, "alias")
                                            .or(() -> identifierField(specifier, "name"))
                                            .ifPresent(bindings::add);
                                }
                            }
                        }
                        default -> {
                            // nothing else binds a name
                        }
                    }
                }
            } else if (IMPORT_REQUIRE_CLAUSE.equals(child.getType())) {
                namedChildren(child).stream()
                        .filter(n -> IDENTIFIER.equals(n.getType()))
                        .findFirst()
                        .ifPresent(bindings::add);
            }
        }
        return bindings;
    }

    private SyntaxConstruct classDeclaration(TSNode node) {
        var nameNode = field(node, "name").orElse(null);
        String className = nameNode == null ? "" : source.textOf(nameNode);
        if (className.isEmpty()) {
            className = "class_" + startLine(node);
        }
        return new SyntaxConstruct.ClassDeclaration(node, className, nameNode);
    }
}
