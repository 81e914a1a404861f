package io.opgraph.core.workflow.node;

/// Well-known param keys shared by the builder, resolver and renumberer.
public final class NodeParams {

    public static final String PARENT_POSITION = "_parent_position";

    // route
    public static final String PATHS = "paths";
    public static final String PATHS_SPEC = "paths_spec";
    public static final String BRANCH_NAME = "name";
    public static final String BRANCH_CONDITION = "condition";
    public static final String BRANCH_POSITIONS = "branch_positions";
    public static final String BRANCH = "branch";
    public static final String BRANCH_SPEC = "branch_spec";

    // iterate
    public static final String BODY = "body";
    public static final String BODY_POSITIONS = "body_positions";
    public static final String BODY_SPEC = "body_spec";
    public static final String BODY_TYPE = "body_type";
    public static final String RESOLVER_REPORT = "resolver_report";
    public static final String LIST_VARIABLE = "listVariable";
    public static final String OVER = "over";
    public static final String RECORDS = "records";
    public static final String ITEM_VARIABLE = "itemVariable";
    public static final String INDEX_VARIABLE = "indexVariable";
    public static final String MAX_ITERATIONS = "maxIterations";
    public static final String LIMIT = "limit";
    public static final String CONTINUE_ON_ERROR = "continueOnError";
    public static final String ON_ERROR = "on_error";
    public static final String STORE = "store";

    // handle
    public static final String TRY = "try";
    public static final String CATCH = "catch";
    public static final String FINALLY = "finally";

    // context
    public static final String OPERATION = "operation";
    public static final String KEY = "key";
    public static final String VALUE = "value";

    private NodeParams() {}
}
