package io.codelab.analyzer.java;

/**
 * Constants for Java TreeSitter node type names.
 */
public final class JavaTreeSitterNodeTypes {

    // Class-like declarations
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String INTERFACE_DECLARATION = "interface_declaration";
    public static final String ENUM_DECLARATION = "enum_declaration";
    public static final String RECORD_DECLARATION = "record_declaration";
    public static final String ANNOTATION_TYPE_DECLARATION = "annotation_type_declaration";
    public static final String ENUM_CONSTANT = "enum_constant";
    public static final String ENUM_BODY_DECLARATIONS = "enum_body_declarations";
    public static final String EXTENDS_INTERFACES = "extends_interfaces";
    public static final String TYPE_LIST = "type_list";

    // Method-like declarations
    public static final String METHOD_DECLARATION = "method_declaration";
    public static final String CONSTRUCTOR_DECLARATION = "constructor_declaration";
    public static final String COMPACT_CONSTRUCTOR_DECLARATION = "compact_constructor_declaration";
    public static final String FORMAL_PARAMETER = "formal_parameter";
    public static final String SPREAD_PARAMETER = "spread_parameter";

    // Field-like declarations
    public static final String FIELD_DECLARATION = "field_declaration";
    public static final String CONSTANT_DECLARATION = "constant_declaration";
    public static final String LOCAL_VARIABLE_DECLARATION = "local_variable_declaration";
    public static final String VARIABLE_DECLARATOR = "variable_declarator";
    public static final String MODIFIERS = "modifiers";
    public static final String MARKER_ANNOTATION = "marker_annotation";
    public static final String ANNOTATION = "annotation";
    public static final String THROWS = "throws";
    public static final String GENERIC_TYPE = "generic_type";

    // Package and imports
    public static final String PACKAGE_DECLARATION = "package_declaration";
    public static final String IMPORT_DECLARATION = "import_declaration";
    public static final String SCOPED_IDENTIFIER = "scoped_identifier";
    public static final String ASTERISK = "asterisk";

    // Statements
    public static final String BLOCK = "block";
    public static final String CONSTRUCTOR_BODY = "constructor_body";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String IF_STATEMENT = "if_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String DO_STATEMENT = "do_statement";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String ENHANCED_FOR_STATEMENT = "enhanced_for_statement";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String TRY_WITH_RESOURCES_STATEMENT = "try_with_resources_statement";
    public static final String CATCH_CLAUSE = "catch_clause";
    public static final String FINALLY_CLAUSE = "finally_clause";
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String CONTINUE_STATEMENT = "continue_statement";

    // Expressions
    public static final String METHOD_INVOCATION = "method_invocation";
    public static final String OBJECT_CREATION_EXPRESSION = "object_creation_expression";
    public static final String FIELD_ACCESS = "field_access";
    public static final String IDENTIFIER = "identifier";
    public static final String THIS = "this";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";

    // Literals
    public static final String DECIMAL_INTEGER_LITERAL = "decimal_integer_literal";
    public static final String HEX_INTEGER_LITERAL = "hex_integer_literal";
    public static final String OCTAL_INTEGER_LITERAL = "octal_integer_literal";
    public static final String BINARY_INTEGER_LITERAL = "binary_integer_literal";
    public static final String DECIMAL_FLOATING_POINT_LITERAL = "decimal_floating_point_literal";
    public static final String HEX_FLOATING_POINT_LITERAL = "hex_floating_point_literal";
    public static final String STRING_LITERAL = "string_literal";
    public static final String CHARACTER_LITERAL = "character_literal";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String NULL_LITERAL = "null_literal";

    // Field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_PARAMETERS = "parameters";
    public static final String FIELD_SUPERCLASS = "superclass";
    public static final String FIELD_INTERFACES = "interfaces";
    public static final String FIELD_DECLARATOR = "declarator";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_CONDITION = "condition";
    public static final String FIELD_CONSEQUENCE = "consequence";
    public static final String FIELD_ALTERNATIVE = "alternative";
    public static final String FIELD_INIT = "init";
    public static final String FIELD_UPDATE = "update";
    public static final String FIELD_OBJECT = "object";
    public static final String FIELD_ARGUMENTS = "arguments";
    public static final String FIELD_LEFT = "left";
    public static final String FIELD_RIGHT = "right";

    private JavaTreeSitterNodeTypes() {
    }
}
