package ai.teliclens.flow;

import ai.teliclens.graph.DataType;
import ai.teliclens.graph.VariableKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Mutable state of a single traversal: the scope stack and the symbols and edges emitted so far. Owned by exactly one
 * extraction call and never shared between threads.
 */
final class TraversalContext {
    static final String GLOBAL_SCOPE = "global";

    private final String file;
    private final Deque<String> scopes = new ArrayDeque<>();
    private final Deque<String> classes = new ArrayDeque<>();
    private final List<VariableSymbol> variables = new ArrayList<>();
    private final List<FlowEdge> flows = new ArrayList<>();

    TraversalContext(String file) {
        this.file = file;
        scopes.push(GLOBAL_SCOPE);
    }

    String file() {
        return file;
    }

    String currentScope() {
        var top = scopes.peek();
        assert top != null : "scope stack always holds the module scope";
        return top;
    }

    boolean atModuleScope() {
        return scopes.size() == 1;
    }

    void enterScope(String name) {
        scopes.push(name);
    }

    void exitScope() {
        if (atModuleScope()) {
            throw new IllegalStateException("Unbalanced scope exit in " + file);
        }
        scopes.pop();
    }

    void enterClass(String name) {
        classes.push(name);
    }

    void exitClass() {
        classes.pop();
    }

    @Nullable
    String currentClass() {
        return classes.peek();
    }

    void define(String name, VariableKind kind, int line, @Nullable DataType dataType) {
        variables.add(VariableSymbol.def(name, currentScope(), kind, file, line, dataType));
    }

    /** Definition in an explicitly named scope, used for class fields which do not open a function scope. */
    void defineIn(String scope, String name, VariableKind kind, int line, @Nullable DataType dataType) {
        variables.add(VariableSymbol.def(name, scope, kind, file, line, dataType));
    }

    void use(String name, int line) {
        variables.add(VariableSymbol.use(name, currentScope(), file, line));
    }

    /** Records {@code return name} as the synthetic {@code return_<name>} symbol and the flow into it. */
    void returnValue(String name, int line) {
        String scope = currentScope();
        String returnName = "return_" + name;
        variables.add(new VariableSymbol(returnName, scope, VariableKind.RETURN, file, line, false, true, scope, null));
        flows.add(new FlowEdge(
                CanonicalId.key(file, scope, name),
                CanonicalId.key(file, scope, returnName),
                FlowEdgeKind.RETURN,
                name + " returned from " + scope));
    }

    void flow(FlowEdgeKind kind, String fromName, String toName, String reason) {
        String scope = currentScope();
        flows.add(new FlowEdge(
                CanonicalId.key(file, scope, fromName), CanonicalId.key(file, scope, toName), kind, reason));
    }

    ExtractionResult result() {
        return new ExtractionResult(variables, flows);
    }
}
