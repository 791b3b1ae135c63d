package com.hartwig.miniwt.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.hartwig.miniwt.diagnostics.Diagnostic;
import com.hartwig.miniwt.diagnostics.DiagnosticKind;
import com.hartwig.miniwt.expression.Expression;
import com.hartwig.miniwt.expression.Expressions;
import com.hartwig.miniwt.expression.MemberRef;
import com.hartwig.miniwt.expression.VariableRef;
import com.hartwig.miniwt.graph.CallGraph;
import com.hartwig.miniwt.ir.Call;
import com.hartwig.miniwt.ir.Declaration;
import com.hartwig.miniwt.ir.Frame;
import com.hartwig.miniwt.ir.Task;
import com.hartwig.miniwt.ir.Workflow;
import com.hartwig.miniwt.ir.WorkflowIndex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural checks of a workflow. Checks run in {@link ValidationKind} order and stop at the first failing kind.
 * Stateless, so one instance can be shared between threads.
 */
public class WorkflowValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkflowValidator.class);

    /**
     * @return non-fatal warnings, in workflow order
     * @throws ValidationException with every issue of the first failing check
     */
    public List<Diagnostic> validate(Workflow workflow) throws ValidationException {
        var index = WorkflowIndex.of(workflow);
        LOGGER.debug("[{}] Validating {} call(s) over {} task(s)", workflow.name(), workflow.calls().size(), workflow.tasks().size());

        failOn(ValidationKind.UNKNOWN_TASK, unknownTasks(index));
        failOn(ValidationKind.UNRESOLVED_REFERENCE, unresolvedReferences(index));
        var bindingIssues = bindingIssues(index);
        failOn(bindingIssues.stream().anyMatch(issue -> issue.kind() == ValidationKind.UNBOUND_INPUT)
                ? ValidationKind.UNBOUND_INPUT
                : ValidationKind.UNKNOWN_INPUT, bindingIssues);
        failOn(ValidationKind.CYCLE, cycles(index));
        failOn(ValidationKind.MISSING_COMMAND, missingCommands(index));

        var warnings = new ArrayList<Diagnostic>();
        warnings.addAll(unusedInputs(workflow));
        for (Task task : workflow.tasks().values()) {
            warnings.addAll(unknownPlaceholders(task));
        }
        warnings.forEach(warning -> LOGGER.warn("[{}] {}", workflow.name(), warning.render()));
        return warnings;
    }

    private static void failOn(ValidationKind kind, List<ValidationIssue> issues) throws ValidationException {
        if (!issues.isEmpty()) {
            throw new ValidationException(kind, issues);
        }
    }

    private static List<ValidationIssue> unknownTasks(WorkflowIndex index) {
        return index.calls()
                .stream()
                .filter(call -> index.taskOf(call).isEmpty())
                .map(call -> ValidationIssue.of(ValidationKind.UNKNOWN_TASK,
                        location(call),
                        String.format("unknown task '%s'", call.taskName())))
                .collect(Collectors.toList());
    }

    private static List<ValidationIssue> unresolvedReferences(WorkflowIndex index) {
        var issues = new ArrayList<ValidationIssue>();
        var inputs = index.workflow().inputs().stream().map(Declaration::name).collect(Collectors.toSet());
        for (Call call : index.calls()) {
            // each frame sees the workflow inputs and the variables of the frames around it
            var visible = new HashSet<>(inputs);
            for (Frame frame : call.frames()) {
                var frameLocation = String.format("%s %s '%s'",
                        location(call),
                        frame.kind() == Frame.Kind.SCATTER ? "scatter" : "condition",
                        frame.blockId());
                checkReferences(frame.expression(), frameLocation, frame.blockId(), visible, index, issues);
                frame.variable().ifPresent(visible::add);
            }
            call.inputs()
                    .forEach((input, binding) -> checkReferences(binding,
                            String.format("%s input '%s'", location(call), input),
                            null,
                            visible,
                            index,
                            issues));
        }
        for (Declaration output : index.workflow().outputs()) {
            output.expression()
                    .ifPresent(expression -> checkReferences(expression,
                            String.format("workflow output '%s'", output.name()),
                            null,
                            inputs,
                            index,
                            issues));
        }
        return issues;
    }

    /**
     * @param openedBlock block whose collection or guard this expression is, null for bindings and outputs
     */
    private static void checkReferences(Expression expression, String location, String openedBlock, Set<String> visibleVariables,
            WorkflowIndex index, List<ValidationIssue> issues) {
        for (VariableRef variable : Expressions.references(expression)) {
            if (!visibleVariables.contains(variable.name())) {
                issues.add(ValidationIssue.of(ValidationKind.UNRESOLVED_REFERENCE,
                        location,
                        String.format("'%s' is neither a workflow input nor an enclosing scatter variable", variable.name())));
            }
        }
        for (MemberRef member : Expressions.memberRefs(expression)) {
            var referenced = index.call(member.callName());
            if (referenced.isEmpty()) {
                issues.add(ValidationIssue.of(ValidationKind.UNRESOLVED_REFERENCE,
                        location,
                        String.format("unknown call '%s'", member.callName())));
            } else if (index.taskOf(referenced.get()).flatMap(task -> task.output(member.outputName())).isEmpty()) {
                issues.add(ValidationIssue.of(ValidationKind.UNRESOLVED_REFERENCE,
                        location,
                        String.format("call '%s' has no output '%s'", member.callName(), member.outputName())));
            } else if (!visible(openedBlock, referenced.get())) {
                issues.add(ValidationIssue.of(ValidationKind.UNRESOLVED_REFERENCE,
                        location,
                        String.format("call '%s' is inside block '%s' and not visible from its header",
                                member.callName(),
                                openedBlock)));
            }
        }
    }

    /**
     * Calls in other blocks are seen gathered, except from the header of a block that contains them.
     */
    static boolean visible(String openedBlock, Call referenced) {
        return openedBlock == null || !referenced.blockIds().contains(openedBlock);
    }

    private static List<ValidationIssue> bindingIssues(WorkflowIndex index) {
        var issues = new ArrayList<ValidationIssue>();
        for (Call call : index.calls()) {
            var task = index.taskOf(call).orElseThrow();
            for (Declaration input : task.inputs()) {
                if (input.isRequired() && !call.inputs().containsKey(input.name())) {
                    issues.add(ValidationIssue.of(ValidationKind.UNBOUND_INPUT,
                            String.format("%s input '%s'", location(call), input.name()),
                            String.format("required input of task '%s' is not bound", task.name())));
                }
            }
            for (String bound : call.inputs().keySet()) {
                if (task.input(bound).isEmpty()) {
                    issues.add(ValidationIssue.of(ValidationKind.UNKNOWN_INPUT,
                            String.format("%s input '%s'", location(call), bound),
                            String.format("task '%s' declares no such input", task.name())));
                }
            }
        }
        return issues;
    }

    private static List<ValidationIssue> cycles(WorkflowIndex index) {
        return CallGraph.of(index)
                .cycles()
                .stream()
                .map(component -> ValidationIssue.of(ValidationKind.CYCLE,
                        String.format("workflow '%s'", index.workflow().name()),
                        component.toString()))
                .collect(Collectors.toList());
    }

    private static List<ValidationIssue> missingCommands(WorkflowIndex index) {
        var tasks = new LinkedHashMap<String, Task>();
        index.calls().forEach(call -> tasks.putIfAbsent(call.taskName(), index.taskOf(call).orElseThrow()));
        return tasks.values()
                .stream()
                .filter(task -> task.command().isBlank())
                .map(task -> ValidationIssue.of(ValidationKind.MISSING_COMMAND,
                        String.format("task '%s'", task.name()),
                        "command is empty"))
                .collect(Collectors.toList());
    }

    private static List<Diagnostic> unusedInputs(Workflow workflow) {
        var used = new HashSet<String>();
        for (Call call : workflow.calls()) {
            call.inputs().values().forEach(binding -> Expressions.references(binding).forEach(ref -> used.add(ref.name())));
            call.frames().forEach(frame -> Expressions.references(frame.expression()).forEach(ref -> used.add(ref.name())));
        }
        workflow.outputs()
                .forEach(output -> output.expression()
                        .ifPresent(expression -> Expressions.references(expression).forEach(ref -> used.add(ref.name()))));
        return workflow.inputs()
                .stream()
                .filter(input -> !used.contains(input.name()))
                .map(input -> Diagnostic.warning(DiagnosticKind.UNUSED_INPUT,
                        String.format("workflow input '%s'", input.name()),
                        "input is not used by any call or output"))
                .collect(Collectors.toList());
    }

    private static List<Diagnostic> unknownPlaceholders(Task task) {
        var declared = task.inputs().stream().map(Declaration::name).collect(Collectors.toSet());
        return Expressions.references(task.command())
                .stream()
                .map(VariableRef::name)
                .distinct()
                .filter(name -> !declared.contains(name))
                .map(name -> Diagnostic.warning(DiagnosticKind.UNKNOWN_PLACEHOLDER,
                        String.format("task '%s' command", task.name()),
                        String.format("placeholder references '%s', which is not an input", name)))
                .collect(Collectors.toList());
    }

    private static String location(Call call) {
        return String.format("call '%s'", call.name());
    }
}
