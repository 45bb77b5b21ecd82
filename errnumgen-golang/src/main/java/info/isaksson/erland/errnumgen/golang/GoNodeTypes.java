package info.isaksson.erland.errnumgen.golang;

/** Node type and field names of the tree-sitter Go grammar used by errnumgen. */
public final class GoNodeTypes {

    private GoNodeTypes() {}

    public static final String PACKAGE_CLAUSE = "package_clause";
    public static final String PACKAGE_IDENTIFIER = "package_identifier";
    public static final String COMMENT = "comment";
    public static final String ERROR = "ERROR";

    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String METHOD_DECLARATION = "method_declaration";
    public static final String FUNC_LITERAL = "func_literal";
    public static final String PARAMETER_LIST = "parameter_list";
    public static final String PARAMETER_DECLARATION = "parameter_declaration";

    public static final String VAR_DECLARATION = "var_declaration";
    public static final String VAR_SPEC = "var_spec";

    public static final String RETURN_STATEMENT = "return_statement";
    public static final String EXPRESSION_LIST = "expression_list";
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String ARGUMENT_LIST = "argument_list";
    public static final String VARIADIC_ARGUMENT = "variadic_argument";
    public static final String SELECTOR_EXPRESSION = "selector_expression";
    public static final String IDENTIFIER = "identifier";
    public static final String TYPE_IDENTIFIER = "type_identifier";
    public static final String NIL = "nil";

    // field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_RESULT = "result";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_ARGUMENTS = "arguments";
    public static final String FIELD_OPERAND = "operand";
    public static final String FIELD_FIELD = "field";
}
