package io.cflow.parser;

/**
 * Node type and field names of the tree-sitter Python grammar used by the extractor.
 */
public final class PythonNodeTypes {

    // Definitions
    public static final String MODULE = "module";
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";

    // Expressions
    public static final String CALL = "call";
    public static final String ATTRIBUTE = "attribute";
    public static final String IDENTIFIER = "identifier";
    public static final String GENERATOR_EXPRESSION = "generator_expression";
    public static final String SUBSCRIPT = "subscript";
    public static final String COMMENT = "comment";
    public static final String NAMED_EXPRESSION = "named_expression";
    public static final String AS_PATTERN = "as_pattern";
    public static final String AS_PATTERN_TARGET = "as_pattern_target";
    public static final String TUPLE = "tuple";
    public static final String LIST = "list";

    // Statements
    public static final String ASSIGNMENT = "assignment";
    public static final String AUGMENTED_ASSIGNMENT = "augmented_assignment";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String EXCEPT_CLAUSE = "except_clause";
    public static final String PATTERN_LIST = "pattern_list";
    public static final String TUPLE_PATTERN = "tuple_pattern";
    public static final String LIST_PATTERN = "list_pattern";

    // Parameters
    public static final String TYPED_PARAMETER = "typed_parameter";
    public static final String DEFAULT_PARAMETER = "default_parameter";
    public static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";
    public static final String LIST_SPLAT_PATTERN = "list_splat_pattern";
    public static final String DICTIONARY_SPLAT_PATTERN = "dictionary_splat_pattern";

    // Errors
    public static final String ERROR = "ERROR";

    // Keywords
    public static final String ASYNC = "async";
    public static final String AS = "as";

    // Field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_PARAMETERS = "parameters";
    public static final String FIELD_SUPERCLASSES = "superclasses";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_ARGUMENTS = "arguments";
    public static final String FIELD_OBJECT = "object";
    public static final String FIELD_ATTRIBUTE = "attribute";
    public static final String FIELD_LEFT = "left";
    public static final String FIELD_RIGHT = "right";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_ALIAS = "alias";

    private PythonNodeTypes() {
    }
}
