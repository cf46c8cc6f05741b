package ai.teliclens.analyzer;

/** Common TreeSitter node type names shared by the JavaScript-family grammars. */
public final class CommonTreeSitterNodeTypes {

    // ===== ROOT =====
    public static final String PROGRAM = "program";

    // ===== CLASS-LIKE DECLARATIONS =====
    /** Object-oriented class definition */
    public static final String CLASS_DECLARATION = "class_declaration";

    // ===== FUNCTION-LIKE DECLARATIONS =====
    /** Regular function declaration */
    public static final String FUNCTION_DECLARATION = "function_declaration";

    /** Arrow function (JavaScript/TypeScript) */
    public static final String ARROW_FUNCTION = "arrow_function";

    /** Method definition (JavaScript/TypeScript) */
    public static final String METHOD_DEFINITION = "method_definition";

    // ===== FIELD-LIKE DECLARATIONS =====
    /** Variable declarator (JavaScript/TypeScript) */
    public static final String VARIABLE_DECLARATOR = "variable_declarator";

    /** Variable declaration statement */
    public static final String VARIABLE_DECLARATION = "variable_declaration";

    /** Lexical declaration (let/const in JS/TS) */
    public static final String LEXICAL_DECLARATION = "lexical_declaration";

    // ===== STATEMENTS =====
    /** Export statement (JavaScript/TypeScript) */
    public static final String EXPORT_STATEMENT = "export_statement";

    public static final String RETURN_STATEMENT = "return_statement";

    // ===== EXPRESSIONS =====
    public static final String IDENTIFIER = "identifier";

    public static final String ASSIGNMENT_EXPRESSION = "assignment_expression";

    public static final String CALL_EXPRESSION = "call_expression";

    private CommonTreeSitterNodeTypes() {}
}
