/*
 *   Copyright Flux Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package com.danielgmyers.fluxio.sfn.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

import com.danielgmyers.fluxio.ast.Assign;
import com.danielgmyers.fluxio.ast.Attribute;
import com.danielgmyers.fluxio.ast.Call;
import com.danielgmyers.fluxio.ast.ClassDef;
import com.danielgmyers.fluxio.ast.Constant;
import com.danielgmyers.fluxio.ast.DictExpr;
import com.danielgmyers.fluxio.ast.ExceptHandler;
import com.danielgmyers.fluxio.ast.ExprStatement;
import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.FunctionDef;
import com.danielgmyers.fluxio.ast.If;
import com.danielgmyers.fluxio.ast.Import;
import com.danielgmyers.fluxio.ast.ImportFrom;
import com.danielgmyers.fluxio.ast.Keyword;
import com.danielgmyers.fluxio.ast.ListExpr;
import com.danielgmyers.fluxio.ast.Name;
import com.danielgmyers.fluxio.ast.OpaqueStatement;
import com.danielgmyers.fluxio.ast.Pass;
import com.danielgmyers.fluxio.ast.Raise;
import com.danielgmyers.fluxio.ast.Return;
import com.danielgmyers.fluxio.ast.Statement;
import com.danielgmyers.fluxio.ast.StatementVisitor;
import com.danielgmyers.fluxio.ast.Try;
import com.danielgmyers.fluxio.ast.TupleExpr;
import com.danielgmyers.fluxio.ast.With;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.options.CallableOption;
import com.danielgmyers.fluxio.options.OptionSchema;
import com.danielgmyers.fluxio.options.ResolvedOptions;
import com.danielgmyers.fluxio.options.ValueShape;
import com.danielgmyers.fluxio.sfn.definitions.ScriptDeclarations;
import com.danielgmyers.fluxio.sfn.definitions.StateMachineDefinition;
import com.danielgmyers.fluxio.sfn.definitions.TaskAttributes;
import com.danielgmyers.fluxio.sfn.definitions.TaskDefinition;
import com.danielgmyers.fluxio.sfn.states.Catch;
import com.danielgmyers.fluxio.sfn.states.ChoiceBranch;
import com.danielgmyers.fluxio.sfn.states.ChoiceState;
import com.danielgmyers.fluxio.sfn.states.FailState;
import com.danielgmyers.fluxio.sfn.states.MapState;
import com.danielgmyers.fluxio.sfn.states.ParallelState;
import com.danielgmyers.fluxio.sfn.states.PassState;
import com.danielgmyers.fluxio.sfn.states.Retry;
import com.danielgmyers.fluxio.sfn.states.State;
import com.danielgmyers.fluxio.sfn.states.StateMachineFragment;
import com.danielgmyers.fluxio.sfn.states.SucceedState;
import com.danielgmyers.fluxio.sfn.states.WaitState;
import com.danielgmyers.fluxio.sfn.states.tasks.StateMachineTaskState;
import com.danielgmyers.fluxio.sfn.states.tasks.TaskInvocation;
import com.danielgmyers.fluxio.sfn.states.tasks.TaskState;
import com.danielgmyers.fluxio.sfn.states.tasks.TaskStateFactory;
import com.danielgmyers.fluxio.sfn.transform.DataDictTransformer;
import com.danielgmyers.fluxio.util.ErrorNames;
import com.danielgmyers.fluxio.util.InputDataReferences;
import com.danielgmyers.fluxio.util.LiteralValues;
import com.danielgmyers.fluxio.util.NodeHashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the WorkflowGraph for one state machine function by walking its body statement by statement.
 *
 * Each supported statement adds one fragment, linked from the current cursor; the cursor then moves to the new
 * fragment. If/elif/else chains are flattened into a single Choice, exception handlers hang off the task they
 * guard, and calls to map() and parallel() embed other state machine functions.
 *
 * A builder is used once. It only reads the script's declarations; functions it references as map iterators or
 * parallel branches are reported through {@link #getMapIterators()} and {@link #getParallelBranches()} and demoted
 * by the caller once every builder has finished.
 */
public class WorkflowGraphBuilder implements StatementVisitor<Void> {

    private static final Logger log = LoggerFactory.getLogger(WorkflowGraphBuilder.class);

    public static final String MAP = "map";
    public static final String PARALLEL = "parallel";
    public static final String WAIT = "wait";
    public static final String RETRY = "retry";
    public static final String UPDATE = "update";

    public static final String MAX_CONCURRENCY = "max_concurrency";
    public static final String SECONDS = "seconds";
    public static final String TIMESTAMP = "timestamp";
    public static final String ON_EXCEPTIONS = "on_exceptions";
    public static final String INTERVAL = "interval";
    public static final String MAX_ATTEMPTS = "max_attempts";
    public static final String BACKOFF_RATE = "backoff_rate";

    public static final long NESTED_STATE_MACHINE_TIMEOUT = 300;

    private static final String SUPPORTED_EXPRESSIONS = "Supported expressions include:\n"
            + "* ``update()`` for Pass states\n"
            + "* ``parallel()`` for Parallel states\n"
            + "* ``wait`` for Wait states\n"
            + "* ``map()`` for Map states\n"
            + "* Instantiating Task classes\n"
            + "* Nesting state machines";

    private static final String WAIT_KEYWORDS = "Valid keyword arguments for a wait state are seconds or timestamp";

    private static final String SUPPORTED_CONTEXT_MANAGERS = "Supported context managers include:\n"
            + "* ``retry()`` for retrying tasks";

    private static final OptionSchema MAP_OPTIONS = new OptionSchema()
            .add(MAX_CONCURRENCY, CallableOption.builder("integer", ValueShape.INTEGER).defaultValue(0L).build());

    private static final OptionSchema WAIT_OPTIONS = new OptionSchema()
            .add(SECONDS, CallableOption.builder("integer or data reference", ValueShape.INTEGER,
                                                 ValueShape.DATA_REFERENCE).build())
            .add(TIMESTAMP, CallableOption.builder("string or data reference", ValueShape.STRING,
                                                   ValueShape.DATA_REFERENCE).build());

    private static final OptionSchema RETRY_OPTIONS = new OptionSchema()
            .add(ON_EXCEPTIONS, CallableOption.builder("list", ValueShape.LIST)
                                              .extractor(WorkflowGraphBuilder::errorNames)
                                              .defaultValue(Collections.singletonList("Exception")).build())
            .add(INTERVAL, CallableOption.builder("integer", ValueShape.INTEGER).defaultValue(1L).build())
            .add(MAX_ATTEMPTS, CallableOption.builder("integer", ValueShape.INTEGER).defaultValue(3L).build())
            .add(BACKOFF_RATE, CallableOption.builder("number", ValueShape.NUMBER)
                                             .extractor(v -> ((Number)((Constant)v).getValue()).doubleValue())
                                             .defaultValue(2.0).build());

    private final StateMachineDefinition definition;
    private final ScriptDeclarations declarations;
    private final WorkflowGraph graph = new WorkflowGraph();
    private final Deque<ChoiceState> choiceStack = new ArrayDeque<>();
    private final List<StateMachineDefinition> mapIterators = new ArrayList<>();
    private final List<StateMachineDefinition> parallelBranches = new ArrayList<>();

    private StateMachineFragment cursor;
    private boolean inElse;
    private boolean built;

    public WorkflowGraphBuilder(StateMachineDefinition definition, ScriptDeclarations declarations) {
        this.definition = definition;
        this.declarations = declarations;
        this.cursor = graph.getStart();
        this.inElse = false;
    }

    /**
     * Walks the function body, then shapes and validates the resulting graph.
     */
    public WorkflowGraph build() {
        if (built) {
            throw new IllegalStateException("A WorkflowGraphBuilder can only build one graph.");
        }
        built = true;

        log.debug("Building state machine {}.", definition.getName());
        visitBody(definition.getNode().getBody());

        if (graph.outEdges(graph.getStart()).size() != 1) {
            throw new WorkflowGraphBuildException("A state machine function must contain at least one state",
                                                  definition.getNode());
        }
        shape();
        validate();
        return graph;
    }

    /**
     * The state machine functions referenced as map iterators, in the order they were referenced.
     */
    public List<StateMachineDefinition> getMapIterators() {
        return Collections.unmodifiableList(mapIterators);
    }

    /**
     * The state machine functions referenced as parallel branches, in the order they were referenced.
     */
    public List<StateMachineDefinition> getParallelBranches() {
        return Collections.unmodifiableList(parallelBranches);
    }

    private void visitBody(List<Statement> body) {
        for (Statement statement : body) {
            statement.accept(this);
        }
    }

    private <T extends StateMachineFragment> T addFragment(T fragment) {
        if (cursor instanceof State && ((State)cursor).isTerminal()) {
            throw new WorkflowGraphBuildException("Statements cannot follow a return or raise statement",
                                                  fragment.getNode());
        }
        graph.add(fragment);
        graph.addEdge(cursor, fragment, inElse);
        log.debug("Added edge {} -> {}{}.", cursor, fragment, inElse ? " (else)" : "");
        inElse = false;
        cursor = fragment;
        return fragment;
    }

    private String stateMachineNames() {
        return declarations.getStateMachineNames().stream()
                .filter(name -> !name.equals(definition.getName()))
                .collect(Collectors.joining(", "));
    }

    // Assignments

    @Override
    public Void visitAssign(Assign node) {
        WorkflowGraphBuildException.check(node.getTargets().size() == 1,
                                          "Value assignments can only target one variable", node);
        Expression target = node.getTargets().get(0);
        WorkflowGraphBuildException.check(InputDataReferences.isReference(target),
                                          "Assignment target must be a key on `data`", node);
        String resultPath = InputDataReferences.toPath(target);
        if (InputDataReferences.isReservedPath(resultPath)) {
            throw new WorkflowGraphBuildException(
                    String.format("%s is a reserved key and cannot be assigned. Reserved keys: %s", resultPath,
                                  String.join(", ", InputDataReferences.RESERVED_KEYS)), node);
        }

        Expression value = node.getValue();
        if (value instanceof Call) {
            Call call = (Call)value;
            String name = call.getFuncName();
            if (declarations.isTask(name)) {
                addTask(node, call, resultPath);
                return null;
            } else if (declarations.isStateMachine(name)) {
                addNestedStateMachine(node, call, resultPath);
                return null;
            } else if (MAP.equals(name)) {
                addMap(node, call, resultPath);
                return null;
            }
        }

        String key = "Pass-" + NodeHashing.hash(node, definition.getName());
        if (InputDataReferences.isReference(value)) {
            addFragment(PassState.withInputPath(key, node, InputDataReferences.toPath(value), resultPath));
        } else if (InputDataReferences.isInputObject(value)) {
            addFragment(PassState.withInputPath(key, node, InputDataReferences.ROOT_PATH, resultPath));
        } else if (value instanceof DictExpr && DataDictTransformer.containsReferences(value)) {
            addFragment(PassState.withParameters(key, node, DataDictTransformer.transform((DictExpr)value),
                                                 resultPath));
        } else {
            addFragment(PassState.withResult(key, node, LiteralValues.evaluate(value), resultPath));
        }
        return null;
    }

    // Expression statements

    @Override
    public Void visitExprStatement(ExprStatement node) {
        if (node.isDocstring()) {
            return null;
        }
        if (!(node.getValue() instanceof Call)) {
            throw new WorkflowGraphBuildException(SUPPORTED_EXPRESSIONS, node);
        }

        Call call = (Call)node.getValue();
        if (call.getFunc() instanceof Attribute) {
            addUpdate(node, call);
            return null;
        }

        String name = call.getFuncName();
        if (PARALLEL.equals(name)) {
            addParallel(node, call);
        } else if (WAIT.equals(name)) {
            addWait(node, call);
        } else if (MAP.equals(name)) {
            addMap(node, call, null);
        } else if (declarations.isTask(name)) {
            addTask(node, call, null);
        } else if (declarations.isStateMachine(name)) {
            addNestedStateMachine(node, call, null);
        } else {
            throw new WorkflowGraphBuildException(SUPPORTED_EXPRESSIONS, node);
        }
        return null;
    }

    private void addUpdate(ExprStatement node, Call call) {
        Attribute method = (Attribute)call.getFunc();
        WorkflowGraphBuildException.check(
                InputDataReferences.isInputObject(method.getValue()) && UPDATE.equals(method.getAttr()),
                "The only supported method call is `data.update()` to set values on the input data", node);
        WorkflowGraphBuildException.check(
                call.getArgs().size() == 1 && call.getKeywords().isEmpty() && call.getArgs().get(0) instanceof DictExpr,
                "`data.update()` requires exactly one dict argument", node);

        DictExpr values = (DictExpr)call.getArgs().get(0);
        String key = "Pass-" + NodeHashing.hash(node, definition.getName());
        if (DataDictTransformer.containsReferences(values)) {
            addFragment(PassState.withParameters(key, node, DataDictTransformer.transform(values),
                                                 InputDataReferences.ROOT_PATH));
        } else {
            addFragment(PassState.withResult(key, node, LiteralValues.evaluate(values), InputDataReferences.ROOT_PATH));
        }
    }

    private void addWait(ExprStatement node, Call call) {
        WorkflowGraphBuildException.check(call.getArgs().isEmpty(), WAIT_KEYWORDS, node);
        for (Keyword keyword : call.getKeywords()) {
            WorkflowGraphBuildException.check(WAIT_OPTIONS.getOptions().containsKey(keyword.getArg()),
                                              WAIT_KEYWORDS, call);
        }
        ResolvedOptions options = WAIT_OPTIONS.resolve(call.getKeywords(), call);
        boolean hasSeconds = options.get(SECONDS) != null;
        boolean hasTimestamp = options.get(TIMESTAMP) != null;
        WorkflowGraphBuildException.check(hasSeconds != hasTimestamp,
                                          "The wait state requires exactly one of the seconds or timestamp options",
                                          node);

        String option = hasSeconds ? SECONDS : TIMESTAMP;
        boolean isPath = false;
        for (Keyword keyword : call.getKeywords()) {
            if (option.equals(keyword.getArg())) {
                isPath = InputDataReferences.isReference(keyword.getValue());
            }
        }

        String field;
        if (hasSeconds) {
            field = isPath ? WaitState.SECONDS_PATH : WaitState.SECONDS;
        } else {
            field = isPath ? WaitState.TIMESTAMP_PATH : WaitState.TIMESTAMP;
        }
        addFragment(new WaitState("Wait-" + NodeHashing.hash(node), node, field, options.get(option)));
    }

    private void addParallel(ExprStatement node, Call call) {
        WorkflowGraphBuildException.check(!call.getArgs().isEmpty(),
                                          "At least one branch function must be provided to the parallel state.",
                                          node);
        WorkflowGraphBuildException.check(call.getKeywords().isEmpty(),
                                          "The parallel state does not accept keyword arguments", node);

        List<StateMachineDefinition> branches = new ArrayList<>();
        for (Expression arg : call.getArgs()) {
            String name = arg instanceof Name ? ((Name)arg).getId() : null;
            WorkflowGraphBuildException.check(
                    declarations.isStateMachine(name) && !name.equals(definition.getName()),
                    String.format("Only defined functions can be provided to the parallel state. Available functions: %s",
                                  stateMachineNames()), node);
            branches.add(declarations.getStateMachine(name));
        }
        addFragment(new ParallelState("Parallel-" + NodeHashing.hash(node), node, branches));
        parallelBranches.addAll(branches);
    }

    private void addMap(Statement node, Call call, String resultPath) {
        WorkflowGraphBuildException.check(
                call.getArgs().size() == 2,
                "Map state requires two arguments: a list of items from data and an iterator function", node);

        Expression items = call.getArgs().get(0);
        String inputPath;
        if (InputDataReferences.isReference(items)) {
            inputPath = InputDataReferences.toPath(items);
        } else if (InputDataReferences.isInputObject(items)) {
            inputPath = InputDataReferences.ROOT_PATH;
        } else {
            throw new WorkflowGraphBuildException("The first argument of the map state must be a reference to `data`",
                                                  items);
        }

        Expression iterator = call.getArgs().get(1);
        String name = iterator instanceof Name ? ((Name)iterator).getId() : null;
        WorkflowGraphBuildException.check(
                declarations.isStateMachine(name) && !name.equals(definition.getName()),
                String.format("Only defined functions can be provided to the map state. Available functions: %s",
                              stateMachineNames()), node);

        ResolvedOptions options = MAP_OPTIONS.resolve(call.getKeywords(), call);
        StateMachineDefinition iteratorDefinition = declarations.getStateMachine(name);
        addFragment(new MapState("Map-" + NodeHashing.hash(node), node, iteratorDefinition, inputPath, resultPath,
                                 options.getLong(MAX_CONCURRENCY)));
        mapIterators.add(iteratorDefinition);
    }

    // Tasks

    private static OptionSchema taskOptions(String calledName, Statement node, long defaultTimeout) {
        return new OptionSchema()
                .add(TaskInvocation.KEY_OPTION, CallableOption.builder("string", ValueShape.STRING)
                        .computedDefault(() -> calledName + "-" + NodeHashing.hash(node)).build())
                .add(TaskInvocation.TIMEOUT_OPTION, CallableOption.builder("integer", ValueShape.INTEGER)
                        .defaultValue(defaultTimeout).build());
    }

    private static String taskInputPath(Statement node, Call call) {
        WorkflowGraphBuildException.check(call.getArgs().size() <= 1,
                                          "Tasks accept at most one positional argument: a reference to `data`",
                                          node);
        if (call.getArgs().isEmpty()) {
            return InputDataReferences.ROOT_PATH;
        }
        Expression input = call.getArgs().get(0);
        if (InputDataReferences.isInputObject(input)) {
            return InputDataReferences.ROOT_PATH;
        }
        WorkflowGraphBuildException.check(InputDataReferences.isReference(input),
                                          "The task input must be a reference to `data`", input);
        return InputDataReferences.toPath(input);
    }

    private void addTask(Statement node, Call call, String resultPath) {
        String name = call.getFuncName();
        TaskDefinition task = declarations.getTask(name);
        TaskStateFactory factory = declarations.getServiceRegistry().getFactory(task.getServiceKind());
        if (factory == null) {
            throw new WorkflowGraphBuildException(
                    String.format("No task state is registered for service %s", task.getServiceKind()),
                    task.getNode());
        }

        OptionSchema schema = taskOptions(name, node, task.getTimeout()).extend(factory.getAdditionalOptions());
        ResolvedOptions options = schema.resolve(call.getKeywords(), call);
        TaskInvocation invocation = new TaskInvocation(node, name, task, options, taskInputPath(node, call),
                                                       resultPath, definition);
        addFragment(factory.create(invocation));
    }

    private void addNestedStateMachine(Statement node, Call call, String resultPath) {
        String name = call.getFuncName();
        ResolvedOptions options = taskOptions(name, node, NESTED_STATE_MACHINE_TIMEOUT).resolve(call.getKeywords(),
                                                                                                 call);
        TaskInvocation invocation = new TaskInvocation(node, name, null, options, taskInputPath(node, call),
                                                       resultPath, definition);
        addFragment(new StateMachineTaskState(invocation));
    }

    // Control flow

    @Override
    public Void visitIf(If node) {
        visitConditional(node, null);
        return null;
    }

    /**
     * @param continued The choice an elif clause belongs to, or null for a new if statement.
     */
    private void visitConditional(If node, ChoiceState continued) {
        WorkflowGraphBuildException.check(!node.getBody().isEmpty(),
                                          "A conditional branch must contain at least one statement", node);

        ChoiceState choice = continued;
        if (choice == null) {
            choice = addFragment(new ChoiceState("Choice-" + NodeHashing.hash(node), node));
            choiceStack.push(choice);
            log.debug("Pushed choice {} (depth {}).", choice, choiceStack.size());
        }

        ChoiceBranch branch = graph.add(new ChoiceBranch("ChoiceBranch-" + NodeHashing.hash(node), node));
        choice.addBranch(branch);
        cursor = branch;
        inElse = false;
        visitBody(node.getBody());

        cursor = choice;
        if (node.hasElifContinuation()) {
            visitConditional((If)node.getOrelse().get(0), choice);
        } else {
            WorkflowGraphBuildException.check(node.getOrelse().size() <= 1,
                                              "A maximum of 1 state can be included in an `else` clause", node);
            inElse = true;
            visitBody(node.getOrelse());
            inElse = false;
        }

        if (continued == null) {
            choiceStack.pop();
            log.debug("Popped choice {} (depth {}).", choice, choiceStack.size());
        }
        cursor = choice;
    }

    @Override
    public Void visitRaise(Raise node) {
        Expression exception = node.getException();
        WorkflowGraphBuildException.check(exception != null, "A bare `raise` statement is not supported", node);

        String error;
        String cause = null;
        if (exception instanceof Call) {
            Call call = (Call)exception;
            error = raisedErrorName(call.getFunc());
            WorkflowGraphBuildException.check(call.getArgs().size() <= 1 && call.getKeywords().isEmpty(),
                                              "Exceptions can only be raised with a single message argument", node);
            if (!call.getArgs().isEmpty()) {
                Expression message = call.getArgs().get(0);
                WorkflowGraphBuildException.check(message instanceof Constant && ((Constant)message).isString(),
                                                  "The exception message must be a string literal", message);
                cause = (String)((Constant)message).getValue();
            }
        } else {
            error = raisedErrorName(exception);
        }

        addFragment(new FailState("Fail-" + NodeHashing.hash(node), node, error, cause == null ? error : cause));
        return null;
    }

    private static String raisedErrorName(Expression exception) {
        if (exception instanceof Name) {
            return ((Name)exception).getId();
        } else if (exception instanceof Attribute) {
            Attribute attribute = (Attribute)exception;
            if (attribute.getValue() instanceof Name && ((Name)attribute.getValue()).is(ErrorNames.STATES_PREFIX)) {
                return ErrorNames.STATES_PREFIX + "." + attribute.getAttr();
            }
        }
        throw new WorkflowGraphBuildException("Only exception classes or States errors can be raised", exception);
    }

    @Override
    public Void visitReturn(Return node) {
        addFragment(new SucceedState("Succeed-" + NodeHashing.hash(node, definition.getName()), node));
        return null;
    }

    @Override
    public Void visitPass(Pass node) {
        addFragment(PassState.placeholder("Pass-" + NodeHashing.hash(node, definition.getName()), node));
        return null;
    }

    // Error handling

    @Override
    public Void visitTry(Try node) {
        WorkflowGraphBuildException.check(
                node.getBody().size() == 1,
                "Only a single task statement at a time can have exception handling applied", node);
        WorkflowGraphBuildException.check(node.getOrelse().isEmpty(),
                                          "The `else` part of a try/except block is not currently supported", node);
        WorkflowGraphBuildException.check(node.getFinalbody().isEmpty(),
                                          "The `finally` part of a try/except block is not currently supported",
                                          node);
        WorkflowGraphBuildException.check(!node.getHandlers().isEmpty(), "At least 1 exception handler is required",
                                          node);

        node.getBody().get(0).accept(this);
        WorkflowGraphBuildException.check(cursor instanceof TaskState,
                                          "Only task states can have exception handlers", node);
        TaskState task = (TaskState)cursor;

        for (ExceptHandler handler : node.getHandlers()) {
            WorkflowGraphBuildException.check(handler.getType() != null,
                                              "Exception handlers must name the errors they catch", handler);
            Catch handlerHead = graph.add(new Catch("Catch-" + NodeHashing.hash(handler), handler,
                                                    caughtErrors(handler.getType())));
            task.addCatch(handlerHead);
            log.debug("Added catch {} to task {}.", handlerHead, task);

            cursor = handlerHead;
            inElse = false;
            visitBody(handler.getBody());
            cursor = task;
        }
        return null;
    }

    private static List<String> caughtErrors(Expression type) {
        if (type instanceof TupleExpr) {
            return ((TupleExpr)type).getElements().stream().map(ErrorNames::serialize).collect(Collectors.toList());
        }
        return Collections.singletonList(ErrorNames.serialize(type));
    }

    private static Object errorNames(Expression value) {
        List<Expression> elements = value instanceof ListExpr ? ((ListExpr)value).getElements()
                                                              : ((TupleExpr)value).getElements();
        return elements.stream().map(ErrorNames::serialize).collect(Collectors.toList());
    }

    @Override
    public Void visitWith(With node) {
        Expression item = node.getItems().size() == 1 ? node.getItems().get(0) : null;
        if (!(item instanceof Call) || !RETRY.equals(((Call)item).getFuncName())) {
            throw new WorkflowGraphBuildException(SUPPORTED_CONTEXT_MANAGERS, node);
        }
        Call call = (Call)item;
        WorkflowGraphBuildException.check(node.getBody().size() == 1,
                                          "The retry context manager can only wrap a single task", node);
        WorkflowGraphBuildException.check(call.getArgs().isEmpty(),
                                          "The retry context manager only accepts keyword arguments", node);
        ResolvedOptions options = RETRY_OPTIONS.resolve(call.getKeywords(), call);

        node.getBody().get(0).accept(this);
        WorkflowGraphBuildException.check(cursor instanceof TaskState, "Only task states can be retried", node);

        ((TaskState)cursor).addRetry(new Retry(options.getStringList(ON_EXCEPTIONS), options.getLong(INTERVAL),
                                               options.getLong(MAX_ATTEMPTS), options.getNumber(BACKOFF_RATE)));
        return null;
    }

    // Statements that never belong in a state machine function

    @Override
    public Void visitClassDef(ClassDef node) {
        throw new WorkflowGraphBuildException("Classes must be declared at the top level", node);
    }

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        throw new WorkflowGraphBuildException("State machine functions must be declared at the top level", node);
    }

    @Override
    public Void visitImport(Import node) {
        throw new WorkflowGraphBuildException("Imports are not supported in state machine functions", node);
    }

    @Override
    public Void visitImportFrom(ImportFrom node) {
        throw new WorkflowGraphBuildException("Imports are not supported in state machine functions", node);
    }

    @Override
    public Void visitOpaqueStatement(OpaqueStatement node) {
        throw new WorkflowGraphBuildException(
                String.format("%s statements are not supported in state machine functions", node.getKind()), node);
    }

    // Shaping

    /**
     * Links the open ends of choice branches and exception handlers to the state that follows them, then removes
     * pass placeholders that have a successor.
     *
     * Choices and guarded tasks are processed innermost first, i.e. in reverse creation order, so an inner
     * construct's open ends have been linked to its own successor before the enclosing construct looks for open ends.
     */
    private void shape() {
        List<StateMachineFragment> fragments = graph.getFragments();
        Collections.reverse(fragments);
        for (StateMachineFragment fragment : fragments) {
            if (fragment instanceof ChoiceState) {
                ChoiceState choice = (ChoiceState)fragment;
                List<StateMachineFragment> successors = graph.successors(choice);
                if (successors.size() > 1) {
                    throw new WorkflowGraphBuildException("A maximum of 1 state can be downstream from a Choice state",
                                                          choice.getNode());
                }
                if (!successors.isEmpty()) {
                    List<StateMachineFragment> heads = new ArrayList<>(choice.getBranches());
                    heads.addAll(graph.elseSuccessors(choice));
                    linkOpenEnds(heads, successors.get(0));
                }
            } else if (fragment instanceof TaskState && !((TaskState)fragment).getCatches().isEmpty()) {
                StateMachineFragment successor = graph.next(fragment);
                if (successor != null) {
                    linkOpenEnds(new ArrayList<>(((TaskState)fragment).getCatches()), successor);
                }
            }
        }

        for (StateMachineFragment fragment : graph.getFragments()) {
            if (fragment instanceof PassState && ((PassState)fragment).isPlaceholder()
                    && graph.successors(fragment).size() == 1) {
                log.debug("Collapsing placeholder {}.", fragment);
                graph.bypass(fragment);
            }
        }
    }

    private void linkOpenEnds(List<StateMachineFragment> heads, StateMachineFragment successor) {
        for (StateMachineFragment head : heads) {
            for (StateMachineFragment fragment : graph.reachable(head)) {
                if (isOpenEnd(fragment)) {
                    log.debug("Linking open end {} -> {}.", fragment, successor);
                    graph.addEdge(fragment, successor, false);
                }
            }
        }
    }

    private boolean isOpenEnd(StateMachineFragment fragment) {
        return fragment instanceof State
                && !(fragment instanceof ChoiceState)
                && !((State)fragment).isTerminal()
                && graph.outEdges(fragment).isEmpty();
    }

    private void validate() {
        for (StateMachineFragment fragment : graph.getFragments()) {
            if (!(fragment instanceof ChoiceState) && graph.successors(fragment).size() > 1) {
                throw new WorkflowGraphBuildException(
                        String.format("State %s can only transition to one next state", fragment.getKey()),
                        fragment.getNode());
            }
        }
    }
}
