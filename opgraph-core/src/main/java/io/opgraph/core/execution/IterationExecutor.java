package io.opgraph.core.execution;

import io.opgraph.core.context.ContextStack;
import io.opgraph.core.context.IterationFrame;
import io.opgraph.core.context.ScopedVariables;
import io.opgraph.core.exception.IterationFailedException;
import io.opgraph.core.exception.NodeExecutionException;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.record.RecordStatus;
import io.opgraph.core.record.RecordStore;
import io.opgraph.core.record.WorkflowRecord;
import io.opgraph.core.resolve.BranchResolution;
import io.opgraph.core.resolve.ControlFlowResolver;
import io.opgraph.core.resolve.ResolutionReport;
import io.opgraph.core.state.VariableStore;
import io.opgraph.core.state.VariableStoreRegistry;
import io.opgraph.core.store.NodeSnapshot;
import io.opgraph.core.store.NodeStore;
import io.opgraph.core.template.TemplateResolver;
import io.opgraph.core.util.Values;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeRef;
import io.opgraph.core.workflow.params.IterateParams;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Runs an iterate node: resolves its body, then executes every body child once per item.
///
/// ### Sources
/// - list loops read `listVariable` (or `over`) through the active scope
/// - record loops query the record store with the `records` glob and process records in id
///   order, moving each through `processing` to `complete` or `failed`
///
/// ### Execution
/// Each iteration runs on its own fork of the caller's {@link ContextStack}, with a record
/// frame (record loops) and an iteration frame pushed. Body params are resolved through
/// templates against that scope, then handed to the {@link NodeActionExecutor} with the
/// configured {@link RetryPolicy}. Nested iterate nodes recurse; `context` nodes act on the
/// variable store directly.
///
/// With a parallelism above 1, iterations run in batches of that size on the supplied
/// executor service. Results are always collected in index order.
///
/// ### Contracts
/// - `maxIterations` / `limit` caps the number of iterations without error
/// - with `continueOnError=false` the first failure (in index order) ends the loop with an
///   {@link IterationFailedException}; the summary is stored before it is thrown
/// - with `continueOnError=true` a failing iteration is recorded and the loop proceeds
///
/// @implNote Thread-safe as long as the injected stores are. Iterations never share a
/// context stack.
public class IterationExecutor {

    private static final Logger logger = Logger.getLogger(IterationExecutor.class.getName());

    /// Node param: write the node's output into the active record instead of a variable.
    public static final String STORE_TO_RECORD = "store_to_record";

    /// Node param: record var name for {@link #STORE_TO_RECORD}, defaults to the node alias.
    public static final String RECORD_FIELD = "record_field";

    private final NodeStore nodeStore;
    private final RecordStore recordStore;
    private final VariableStoreRegistry variables;
    private final ControlFlowResolver resolver;
    private final TemplateResolver templateResolver;
    private final NodeActionExecutor actionExecutor;
    private final RetryPolicy retryPolicy;
    private final int parallelism;
    private final ExecutorService executorService;

    /// @param parallelism iterations run concurrently per batch, at least 1
    /// @param executorService runs parallel batches; may be null when parallelism is 1
    public IterationExecutor(
            NodeStore nodeStore,
            RecordStore recordStore,
            VariableStoreRegistry variables,
            ControlFlowResolver resolver,
            TemplateResolver templateResolver,
            NodeActionExecutor actionExecutor,
            RetryPolicy retryPolicy,
            int parallelism,
            ExecutorService executorService) {
        this.nodeStore = Objects.requireNonNull(nodeStore, "nodeStore must not be null");
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore must not be null");
        this.variables = Objects.requireNonNull(variables, "variables must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.templateResolver =
                Objects.requireNonNull(templateResolver, "templateResolver must not be null");
        this.actionExecutor =
                Objects.requireNonNull(actionExecutor, "actionExecutor must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        if (parallelism > 1 && executorService == null) {
            throw new IllegalArgumentException("executorService is required for parallel iteration");
        }
        this.parallelism = parallelism;
        this.executorService = executorService;
    }

    /// Runs an iterate node with an empty scope.
    public IterationOutcome execute(String executionId, String workflowId, NodeRef iterateRef) {
        return execute(executionId, workflowId, iterateRef, new ContextStack());
    }

    /// Runs an iterate node inside an existing scope.
    ///
    /// @param executionId passed through to the driver, not null
    /// @param workflowId owning workflow, not null
    /// @param iterateRef the iterate node, not null
    /// @param scope frames of the enclosing loops; not modified
    /// @return per-iteration outcomes in index order, never null
    /// @throws IterationFailedException if an iteration fails and the loop stops on error
    /// @throws ValidationException if the node is not a valid iterate node or its source is
    ///     not a list
    public IterationOutcome execute(
            String executionId, String workflowId, NodeRef iterateRef, ContextStack scope) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(scope, "scope must not be null");

        ResolutionReport report = resolver.resolveIterate(workflowId, iterateRef);
        Optional<BranchResolution> failed =
                report.branches().stream().filter(BranchResolution::failed).findFirst();
        if (failed.isPresent()) {
            throw new ValidationException("params.body", failed.get().error());
        }

        NodeSnapshot snapshot = NodeSnapshot.of(nodeStore, workflowId);
        Node iterateNode = snapshot.get(iterateRef);
        IterateParams params = IterateParams.of(iterateNode.getParams());
        params.requireValid();
        List<Node> body = new ArrayList<>();
        for (Integer position : report.bodyPositions()) {
            snapshot.atPosition(position).ifPresent(body::add);
        }

        VariableStore store = variables.forWorkflow(workflowId);
        List<Source> sources = loadSources(workflowId, iterateNode, params, scope, store);
        int count = sources.size();
        Integer ceiling = params.maxIterations();
        if (ceiling != null && ceiling < count) {
            logger.info(
                    "Iterate node "
                            + iterateNode.getPosition()
                            + " capped at "
                            + ceiling
                            + " of "
                            + count
                            + " items");
            count = ceiling;
        }

        logger.info(
                "Entering iterate node "
                        + iterateNode.getPosition()
                        + " ("
                        + iterateNode.getAlias()
                        + "): "
                        + count
                        + " iterations, "
                        + body.size()
                        + " body nodes, parallelism "
                        + parallelism);

        Loop loop = new Loop(executionId, workflowId, iterateNode, params, body, scope, store, count);
        List<IterationResult> results = new ArrayList<>(count);
        for (int start = 0; start < count; start += parallelism) {
            int end = Math.min(count, start + parallelism);
            for (Run run : runBatch(loop, sources, start, end)) {
                results.add(run.result());
                if (!run.result().success() && !params.continueOnError()) {
                    IterationOutcome partial =
                            new IterationOutcome(
                                    workflowId, iterateNode.getPosition(), sources.size(),
                                    results.size(), results);
                    storeSummary(iterateNode, params, store, partial);
                    throw new IterationFailedException(
                            iterateNode.getPosition(),
                            run.result().index(),
                            run.result().failedNodePosition(),
                            run.cause());
                }
            }
        }

        IterationOutcome outcome =
                new IterationOutcome(
                        workflowId, iterateNode.getPosition(), sources.size(), count, results);
        storeSummary(iterateNode, params, store, outcome);
        logger.info(
                "Iterate node "
                        + iterateNode.getPosition()
                        + " completed: "
                        + outcome.results().size()
                        + " succeeded, "
                        + outcome.errors().size()
                        + " failed");
        return outcome;
    }

    private List<Run> runBatch(Loop loop, List<Source> sources, int start, int end) {
        List<Run> runs = new ArrayList<>(end - start);
        if (end - start == 1) {
            runs.add(runIteration(loop, sources.get(start), start));
            return runs;
        }
        List<Future<Run>> futures = new ArrayList<>(end - start);
        for (int i = start; i < end; i++) {
            Source source = sources.get(i);
            int index = i;
            futures.add(executorService.submit(() -> runIteration(loop, source, index)));
        }
        for (int i = 0; i < futures.size(); i++) {
            try {
                runs.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException(
                        "Interrupted while waiting for iteration " + (start + i), e);
            } catch (ExecutionException e) {
                throw new IterationFailedException(
                        loop.iterateNode().getPosition(), start + i, null, e.getCause());
            }
        }
        return runs;
    }

    private Run runIteration(Loop loop, Source source, int index) {
        String workflowId = loop.workflowId();
        ContextStack stack = loop.scope().fork();
        if (source.recordId() != null) {
            stack.pushRecordContext(source.recordId(), Values.asMap(source.item()));
            recordStore.updateStatus(workflowId, source.recordId(), RecordStatus.PROCESSING, null);
        }
        stack.pushIterationContext(
                new IterationFrame(
                        loop.iterateNode().getPosition(),
                        index,
                        loop.params().itemVariable(),
                        loop.count(),
                        source.item(),
                        loop.params().indexVariable()));

        List<NodeResult> nodeResults = new ArrayList<>();
        for (Node node : loop.body()) {
            try {
                NodeResult result = runNode(loop, node, stack, source.recordId());
                nodeResults.add(result);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                logger.warning(
                        "Iteration "
                                + index
                                + " of iterate node "
                                + loop.iterateNode().getPosition()
                                + " failed at node "
                                + node.getPosition()
                                + ": "
                                + message);
                if (source.recordId() != null) {
                    recordStore.updateStatus(
                            workflowId, source.recordId(), RecordStatus.FAILED, message);
                }
                return new Run(
                        new IterationResult(
                                index, source.item(), source.recordId(), false, nodeResults,
                                message, node.getPosition()),
                        e);
            }
        }
        if (source.recordId() != null) {
            recordStore.updateStatus(workflowId, source.recordId(), RecordStatus.COMPLETE, null);
        }
        return new Run(
                new IterationResult(
                        index, source.item(), source.recordId(), true, nodeResults, null, null),
                null);
    }

    private NodeResult runNode(Loop loop, Node node, ContextStack stack, String recordId)
            throws Exception {
        ScopedVariables scope = new ScopedVariables(stack, loop.store());
        switch (node.getType()) {
            case ITERATE -> {
                IterationOutcome nested =
                        execute(
                                loop.executionId(),
                                loop.workflowId(),
                                NodeRef.uuid(node.getUuid()),
                                stack);
                return NodeResult.success(nested.toSummary());
            }
            case CONTEXT -> {
                return ContextOperationHandler.apply(resolveParams(node, scope), loop.store());
            }
            case GROUP -> {
                return NodeResult.skipped("group nodes carry no action");
            }
            default -> {
                Node resolved = resolveParams(node, scope);
                NodeResult result =
                        retryPolicy.call(
                                "Node " + node.getPosition() + " (" + node.getAlias() + ")",
                                () -> invoke(loop.executionId(), resolved));
                if (recordId != null && Values.isTrue(resolved.getParamsMap().get(STORE_TO_RECORD))) {
                    storeToRecord(loop.workflowId(), recordId, resolved, result, stack);
                }
                return result;
            }
        }
    }

    private NodeResult invoke(String executionId, Node node) throws Exception {
        NodeResult result = actionExecutor.executeNode(executionId, node);
        if (result == null) {
            throw new NodeExecutionException(node.getPosition(), "driver returned no result", null);
        }
        if (result.getStatus() == ResultStatus.FAILURE) {
            throw new NodeExecutionException(
                    node.getPosition(), result.getErrorMessage(), result.getError());
        }
        return result;
    }

    private void storeToRecord(
            String workflowId, String recordId, Node node, NodeResult result, ContextStack stack) {
        Object field = node.getParamsMap().get(RECORD_FIELD);
        String name = Values.isBlank(field) ? node.getAlias() : String.valueOf(field);
        WorkflowRecord updated =
                recordStore.updateVar(workflowId, recordId, name, result.getOutput());
        stack.popRecordContext();
        stack.pushRecordContext(recordId, updated.getData());
    }

    private Node resolveParams(Node node, ScopedVariables scope) {
        Object resolved = templateResolver.resolveAll(node.getParams(), scope);
        return node.toBuilder().params(resolved).build();
    }

    private List<Source> loadSources(
            String workflowId,
            Node iterateNode,
            IterateParams params,
            ContextStack scope,
            VariableStore store) {
        List<Source> sources = new ArrayList<>();
        if (params.isRecordIteration()) {
            for (WorkflowRecord record : recordStore.queryRecords(workflowId, params.recordPattern())) {
                sources.add(new Source(record.getData(), record.getRecordId()));
            }
            return sources;
        }

        String path = listPath(params.listVariable());
        if (path == null) {
            logger.warning("Iterate node " + iterateNode.getPosition() + " has no list source");
            return sources;
        }
        Optional<Object> value = new ScopedVariables(scope, store).lookup(path);
        if (value.isEmpty()) {
            logger.warning(
                    "Iterate node "
                            + iterateNode.getPosition()
                            + ": variable '"
                            + path
                            + "' is not set, nothing to iterate");
            return sources;
        }
        List<Object> items = Values.asList(value.get());
        if (items == null) {
            throw new ValidationException(
                    "params.listVariable", "variable '" + path + "' does not hold a list");
        }
        items.forEach(item -> sources.add(new Source(item, null)));
        return sources;
    }

    /// Accepts `emails`, `state.emails` and `{{emails}}`.
    private static String listPath(String raw) {
        if (raw == null) {
            return null;
        }
        String path = raw.trim();
        if (path.startsWith("{{") && path.endsWith("}}")) {
            path = path.substring(2, path.length() - 2).trim();
        }
        if (path.startsWith("state.")) {
            path = path.substring("state.".length());
        }
        return path.isEmpty() ? null : path;
    }

    private void storeSummary(
            Node iterateNode, IterateParams params, VariableStore store, IterationOutcome outcome) {
        Object target = params.store();
        if (target == null || Boolean.FALSE.equals(target)) {
            return;
        }
        Map<String, Object> summary = outcome.toSummary();
        if (Values.isTrue(target)) {
            store.set(iterateNode.getAlias(), summary);
            return;
        }
        if (target instanceof String path && !path.isBlank()) {
            store.set(path, summary);
            return;
        }
        Map<String, Object> mapping = Values.asMap(target);
        if (mapping == null) {
            logger.warning(
                    "Iterate node " + iterateNode.getPosition() + ": ignoring store setting " + target);
            return;
        }
        Map<String, Object> written = new LinkedHashMap<>();
        mapping.forEach(
                (key, variable) -> {
                    if (summary.containsKey(key) && !Values.isBlank(variable)) {
                        store.set(String.valueOf(variable), summary.get(key));
                        written.put(key, variable);
                    }
                });
        if (written.size() < mapping.size()) {
            logger.warning(
                    "Iterate node "
                            + iterateNode.getPosition()
                            + ": store mapping keys other than "
                            + summary.keySet()
                            + " were ignored");
        }
    }

    private record Source(Object item, String recordId) {}

    private record Run(IterationResult result, Throwable cause) {}

    private record Loop(
            String executionId,
            String workflowId,
            Node iterateNode,
            IterateParams params,
            List<Node> body,
            ContextStack scope,
            VariableStore store,
            int count) {}
}
