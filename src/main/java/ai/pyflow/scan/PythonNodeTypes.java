package ai.pyflow.scan;

/**
 * tree-sitter-python node and field names used by the scanners.
 */
public final class PythonNodeTypes {

    // Definitions
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";

    // Imports
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    public static final String ALIASED_IMPORT = "aliased_import";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String RELATIVE_IMPORT = "relative_import";
    public static final String WILDCARD_IMPORT = "wildcard_import";

    // Expressions
    public static final String CALL = "call";
    public static final String ATTRIBUTE = "attribute";
    public static final String IDENTIFIER = "identifier";
    public static final String PRINT_STATEMENT = "print_statement";

    public static final String COMMENT = "comment";
    public static final String ERROR = "ERROR";

    // Field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_DEFINITION = "definition";
    public static final String FIELD_MODULE_NAME = "module_name";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_OBJECT = "object";
    public static final String FIELD_ATTRIBUTE = "attribute";

    private PythonNodeTypes() {
    }
}
