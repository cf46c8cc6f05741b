package ai.teliclens.flow;

import static ai.teliclens.analyzer.ASTTraversalUtils.field;
import static ai.teliclens.analyzer.javascript.JavaScriptTreeSitterNodeTypes.*;

import ai.teliclens.analyzer.SourceContent;
import ai.teliclens.graph.DataType;
import org.treesitter.TSNode;

/** Syntactic type guess for an initializer: literals and calls to the built-in constructors only. */
final class DataTypeInference {

    private DataTypeInference() {}

    static DataType infer(TSNode initializer, SourceContent source) {
        return switch (initializer.getType()) {
            case STRING, TEMPLATE_STRING -> DataType.STRING;
            case NUMBER -> DataType.NUMBER;
            case TRUE, FALSE -> DataType.BOOLEAN;
            case ARRAY -> DataType.ARRAY;
            case OBJECT -> DataType.OBJECT;
            case FUNCTION_EXPRESSION, FUNCTION, GENERATOR_FUNCTION, ARROW_FUNCTION -> DataType.FUNCTION;
            case CALL_EXPRESSION -> field(initializer, "function")
                    .map(callee -> fromConstructorName(source.textOf(callee)))
                    .orElse(DataType.UNKNOWN);
            case NEW_EXPRESSION -> field(initializer, "constructor")
                    .map(constructor -> fromConstructorName(source.textOf(constructor)))
                    .orElse(DataType.UNKNOWN);
            default -> DataType.UNKNOWN;
        };
    }

    private static DataType fromConstructorName(String name) {
        return switch (name) {
            case "Array" -> DataType.ARRAY;
            case "Object" -> DataType.OBJECT;
            case "String" -> DataType.STRING;
            case "Number" -> DataType.NUMBER;
            case "Boolean" -> DataType.BOOLEAN;
            default -> DataType.UNKNOWN;
        };
    }
}
