package io.codelab.ast;

/** The closed set of node kinds every language front-end maps its native tree onto. */
public enum NodeType {
    PROGRAM("Program"),
    FUNCTION_DECLARATION("FunctionDeclaration"),
    CLASS_DECLARATION("ClassDeclaration"),
    METHOD_DECLARATION("MethodDeclaration"),
    VARIABLE_DECLARATION("VariableDeclaration"),
    IF_STATEMENT("IfStatement"),
    WHILE_LOOP("WhileLoop"),
    FOR_LOOP("ForLoop"),
    RETURN_STATEMENT("ReturnStatement"),
    EXPRESSION_STATEMENT("ExpressionStatement"),
    BLOCK_STATEMENT("BlockStatement"),
    CALL_EXPRESSION("CallExpression"),
    IDENTIFIER("Identifier"),
    LITERAL("Literal");

    private final String displayName;

    NodeType(String displayName) {
        this.displayName = displayName;
    }

    /** Name used in exported dictionaries, e.g. "FunctionDeclaration". */
    public String displayName() {
        return displayName;
    }

    public boolean isBranching() {
        return this == IF_STATEMENT || this == WHILE_LOOP || this == FOR_LOOP;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
