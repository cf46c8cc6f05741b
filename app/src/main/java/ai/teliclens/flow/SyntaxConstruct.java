package ai.teliclens.flow;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * The syntax constructs the extractor distinguishes. Every tree-sitter node is classified into exactly one of these
 * by {@link ConstructClassifier}; nodes the extractor has no rule for become {@link Unhandled} and are only descended
 * into.
 */
public sealed interface SyntaxConstruct
        permits SyntaxConstruct.FunctionLike,
                SyntaxConstruct.Declarator,
                SyntaxConstruct.FieldDefinition,
                SyntaxConstruct.IdentifierRef,
                SyntaxConstruct.ReturnStatement,
                SyntaxConstruct.Assignment,
                SyntaxConstruct.CallSite,
                SyntaxConstruct.ImportDeclaration,
                SyntaxConstruct.ClassDeclaration,
                SyntaxConstruct.Unhandled {

    TSNode node();

    void accept(Visitor visitor);

    interface Visitor {
        void visit(FunctionLike function);

        void visit(Declarator declarator);

        void visit(FieldDefinition field);

        void visit(IdentifierRef reference);

        void visit(ReturnStatement returnStatement);

        void visit(Assignment assignment);

        void visit(CallSite call);

        void visit(ImportDeclaration importDeclaration);

        void visit(ClassDeclaration classDeclaration);

        void visit(Unhandled unhandled);
    }

    /**
     * A simple-identifier parameter.
     *
     * @param declaration the child of the parameter list (or the arrow's lone parameter) that declares it
     * @param defaultValue initializer of a default-valued parameter
     */
    record Parameter(String name, int line, TSNode declaration, @Nullable TSNode defaultValue) {}

    /**
     * Function declaration or expression, arrow function, method or generator.
     *
     * @param nameNode the declared name, which is neither a use nor a definition
     * @param parameterList the {@code formal_parameters} node, absent for {@code x => ...}
     */
    record FunctionLike(
            TSNode node,
            String scopeName,
            @Nullable TSNode nameNode,
            @Nullable TSNode parameterList,
            List<Parameter> parameters)
            implements SyntaxConstruct {
        public FunctionLike {
            parameters = List.copyOf(parameters);
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * A variable declarator, or the binding of a {@code for (const x of xs)} loop.
     *
     * @param nameNode the bound identifier; absent for destructuring patterns, which are walked as ordinary code
     * @param value the initializer
     * @param flowSources names whose value flows into the declared one, see {@link ConstructClassifier#flowSources}
     */
    record Declarator(TSNode node, @Nullable TSNode nameNode, @Nullable TSNode value, List<String> flowSources)
            implements SyntaxConstruct {
        public Declarator {
            flowSources = List.copyOf(flowSources);
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    /** A class field such as {@code private token = ""}. */
    record FieldDefinition(TSNode node, @Nullable TSNode nameNode, @Nullable TSNode value) implements SyntaxConstruct {
        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    record IdentifierRef(TSNode node, String name) implements SyntaxConstruct {
        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    /** @param returnedName set only when the returned expression is a bare identifier */
    record ReturnStatement(TSNode node, @Nullable String returnedName) implements SyntaxConstruct {
        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * Assignment expression.
     *
     * @param targetName set only when the left side is a bare identifier
     * @param flowSources names whose value flows into the target
     */
    record Assignment(TSNode node, @Nullable String targetName, List<String> flowSources) implements SyntaxConstruct {
        public Assignment {
            flowSources = List.copyOf(flowSources);
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * A call.
     *
     * @param calleeRoot leftmost identifier of the callee ({@code db} in {@code db.users.find(x)})
     * @param calleeText source text of the callee expression
     * @param identifierArguments arguments that are bare identifiers, in order
     */
    record CallSite(TSNode node, @Nullable String calleeRoot, String calleeText, List<String> identifierArguments)
            implements SyntaxConstruct {
        public CallSite {
            identifierArguments = List.copyOf(identifierArguments);
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    /** An import statement and the local names it binds. */
    record ImportDeclaration(TSNode node, List<TSNode> bindings) implements SyntaxConstruct {
        public ImportDeclaration {
            bindings = List.copyOf(bindings);
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    record ClassDeclaration(TSNode node, String className, @Nullable TSNode nameNode) implements SyntaxConstruct {
        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    record Unhandled(TSNode node) implements SyntaxConstruct {
        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }
}
