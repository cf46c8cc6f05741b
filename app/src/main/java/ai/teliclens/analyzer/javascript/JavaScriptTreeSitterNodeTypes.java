package ai.teliclens.analyzer.javascript;

import ai.teliclens.analyzer.CommonTreeSitterNodeTypes;

/** Constants for JavaScript and TypeScript TreeSitter node type names. */
public final class JavaScriptTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    public static final String PROGRAM = CommonTreeSitterNodeTypes.PROGRAM;

    // Class-like declarations
    public static final String CLASS_DECLARATION = CommonTreeSitterNodeTypes.CLASS_DECLARATION;

    // Function-like declarations
    public static final String FUNCTION_DECLARATION = CommonTreeSitterNodeTypes.FUNCTION_DECLARATION;
    public static final String ARROW_FUNCTION = CommonTreeSitterNodeTypes.ARROW_FUNCTION;
    public static final String METHOD_DEFINITION = CommonTreeSitterNodeTypes.METHOD_DEFINITION;

    // Variable declarations
    public static final String VARIABLE_DECLARATOR = CommonTreeSitterNodeTypes.VARIABLE_DECLARATOR;

    // Statements and expressions
    public static final String RETURN_STATEMENT = CommonTreeSitterNodeTypes.RETURN_STATEMENT;
    public static final String IDENTIFIER = CommonTreeSitterNodeTypes.IDENTIFIER;
    public static final String ASSIGNMENT_EXPRESSION = CommonTreeSitterNodeTypes.ASSIGNMENT_EXPRESSION;
    public static final String CALL_EXPRESSION = CommonTreeSitterNodeTypes.CALL_EXPRESSION;

    // ===== JAVASCRIPT-SPECIFIC TYPES =====
    // Class-like declarations
    public static final String CLASS = "class";
    public static final String ABSTRACT_CLASS_DECLARATION = "abstract_class_declaration";

    // Function-like declarations
    public static final String FUNCTION_EXPRESSION = "function_expression";
    // Older grammar releases name anonymous function expressions plainly "function"
    public static final String FUNCTION = "function";
    public static final String GENERATOR_FUNCTION_DECLARATION = "generator_function_declaration";
    public static final String GENERATOR_FUNCTION = "generator_function";

    // Parameters
    public static final String FORMAL_PARAMETERS = "formal_parameters";
    public static final String REQUIRED_PARAMETER = "required_parameter";
    public static final String OPTIONAL_PARAMETER = "optional_parameter";
    public static final String ASSIGNMENT_PATTERN = "assignment_pattern";

    // Class members
    public static final String FIELD_DEFINITION = "field_definition";
    public static final String PUBLIC_FIELD_DEFINITION = "public_field_definition";

    // Statements
    public static final String FOR_IN_STATEMENT = "for_in_statement";

    // Identifiers
    public static final String SHORTHAND_PROPERTY_IDENTIFIER = "shorthand_property_identifier";
    public static final String MEMBER_EXPRESSION = "member_expression";

    // Expressions
    public static final String NEW_EXPRESSION = "new_expression";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String AWAIT_EXPRESSION = "await_expression";

    // Imports
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_CLAUSE = "import_clause";
    public static final String IMPORT_SPECIFIER = "import_specifier";
    public static final String NAMESPACE_IMPORT = "namespace_import";
    public static final String NAMED_IMPORTS = "named_imports";
    public static final String IMPORT_REQUIRE_CLAUSE = "import_require_clause";

    // Literals
    public static final String STRING = "string";
    public static final String TEMPLATE_STRING = "template_string";
    public static final String NUMBER = "number";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String ARRAY = "array";
    public static final String OBJECT = "object";

    // Error recovery
    public static final String ERROR = "ERROR";

    private JavaScriptTreeSitterNodeTypes() {}
}
