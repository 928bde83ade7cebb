package com.purchasingpower.plangraph.service.synthesis;

import com.purchasingpower.plangraph.exception.SourceSyntaxException;
import com.purchasingpower.plangraph.model.ir.WorkerClassVars;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.parser.PythonSyntaxTree;
import com.purchasingpower.plangraph.parser.SyntaxNodes;
import com.purchasingpower.plangraph.service.analysis.FrameworkVocabulary;
import com.purchasingpower.plangraph.util.PythonLiterals;
import com.purchasingpower.plangraph.util.PythonText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes a worker class: recognized classvars, lifecycle hooks, then passthrough members.
 *
 * <p>{@code consume_work}, {@code consume_work_joined}, {@code post_process} and
 * {@code extra_cache_key} get a signature typed from the worker's input (or LLM output) type;
 * other hooks keep the signature found in their stored source.
 */
@Slf4j
@Component
public class WorkerClassWriter {

    private static final String INDENT = "    ";
    private static final String DEFAULT_TASK_HINT = "Task";
    private static final String POST_PROCESS = "post_process";
    private static final String EXTRA_CACHE_KEY = "extra_cache_key";

    /**
     * @return the class source, or null for factory-created workers, which have no class
     */
    public String write(WorkerDefinition worker) {
        if (worker.getFactoryFunction() != null) {
            return null;
        }
        List<String> members = new ArrayList<>();

        List<String> classVars = classVarLines(worker.getClassVars());
        if (!classVars.isEmpty()) {
            members.add(String.join("\n", classVars));
        }

        Map<String, String> methods = worker.getMethods() == null ? Map.of() : worker.getMethods();
        Set<String> order = new LinkedHashSet<>(FrameworkVocabulary.KNOWN_METHODS);
        order.addAll(methods.keySet());
        for (String name : order) {
            String source = methods.get(name);
            if (source != null && !source.isBlank()) {
                members.add(method(name, source, worker));
            }
        }

        String passthrough = worker.getRawPassthroughSource();
        if (passthrough != null && !passthrough.isBlank()) {
            members.add(PythonText.dedentCode(PythonText.normalize(passthrough)).strip());
        }

        StringBuilder out = new StringBuilder()
                .append("class ").append(worker.getClassName())
                .append("(").append(worker.getVariantKind().getBaseClass()).append("):\n");
        if (members.isEmpty()) {
            return out.append(INDENT).append("pass").toString();
        }
        return out.append(PythonText.indentCode(String.join("\n\n", members), INDENT)).toString();
    }

    private static List<String> classVarLines(WorkerClassVars vars) {
        List<String> lines = new ArrayList<>();
        if (vars == null) {
            return lines;
        }
        if (vars.getOutputTypes() != null) {
            lines.add("output_types: List[Type[Task]] = [" + String.join(", ", vars.getOutputTypes()) + "]");
        }
        if (vars.getInputType() != null) {
            lines.add("input_type: Type[Task] = " + vars.getInputType());
        }
        if (vars.getLlmInputType() != null) {
            lines.add("llm_input_type: Type[Task] = " + vars.getLlmInputType());
        }
        if (vars.getLlmOutputType() != null) {
            lines.add("llm_output_type: Type[Task] = " + vars.getLlmOutputType());
        }
        if (vars.getJoinType() != null) {
            lines.add("join_type: Type[TaskWorker] = " + vars.getJoinType());
        }
        if (vars.getPrompt() != null) {
            lines.add("prompt: str = dedent(" + PythonLiterals.tripleQuote(vars.getPrompt()) + ").strip()");
        }
        if (vars.getSystemPrompt() != null) {
            lines.add("system_prompt: str = dedent(" + PythonLiterals.tripleQuote(vars.getSystemPrompt()) + ").strip()");
        }
        if (vars.getUseXml() != null) {
            lines.add("use_xml: bool = " + PythonLiterals.literal(vars.getUseXml()));
        }
        if (vars.getDebugMode() != null) {
            lines.add("debug_mode: bool = " + PythonLiterals.literal(vars.getDebugMode()));
        }
        if (vars.getTools() != null) {
            lines.add("tools: List[Tool] = [" + String.join(", ", vars.getTools()) + "]");
        }
        return lines;
    }

    /** One hook, dedented to column zero, decorators first. */
    String method(String name, String source, WorkerDefinition worker) {
        String code = PythonText.dedentCode(PythonText.normalize(source)).strip();
        PythonSyntaxTree tree = parse(code);
        TSNode statement = tree == null ? null : firstFunction(tree);
        TSNode function = SyntaxNodes.definition(statement);
        TSNode colon = SyntaxNodes.headerColon(function);
        if (colon == null) {
            log.debug("Stored source of {}.{} does not parse, using a generic signature", worker.getClassName(), name);
            return fallbackMethod(name, code, worker);
        }

        String decorators = tree.text(statement.getStartByte(), function.getStartByte());
        String signature = canonicalSignature(name, function, tree, worker);
        if (signature == null) {
            signature = tree.text(function.getStartByte(), colon.getEndByte());
        }

        String rest = tree.source().substring(tree.offset(colon.getEndByte()));
        int newline = rest.indexOf('\n');
        String firstLine = newline < 0 ? rest : rest.substring(0, newline);
        String body;
        if (!firstLine.isBlank()) {
            body = rest.strip();
        } else {
            body = newline < 0 ? "" : PythonText.dedentCode(rest.substring(newline + 1)).strip();
        }
        return decorators + signature + "\n" + PythonText.indentCode(body.isEmpty() ? "pass" : body, INDENT);
    }

    private String fallbackMethod(String name, String code, WorkerDefinition worker) {
        List<String> lines = PythonText.lines(code);
        int defLine = -1;
        for (int i = 0; i < lines.size(); i++) {
            String stripped = lines.get(i).strip();
            if (stripped.startsWith("def ") || stripped.startsWith("async def ")) {
                defLine = i;
                break;
            }
        }
        String body = defLine < 0 ? code : String.join("\n", lines.subList(defLine + 1, lines.size()));
        body = PythonText.dedentCode(body).strip();

        String signature = canonicalSignature(name, null, null, worker);
        if (signature == null) {
            signature = "def " + name + "(self, *args, **kwargs):";
        }
        return signature + "\n" + PythonText.indentCode(body.isEmpty() ? "pass" : body, INDENT);
    }

    /**
     * Rebuilt header of a known hook, keeping the parameter names the stored body uses and any
     * parameters after the task:
     * <ul>
     *   <li>{@code def consume_work(self, task: T):}</li>
     *   <li>{@code def consume_work_joined(self, tasks: List[T]):}</li>
     *   <li>{@code def post_process(self, task: O):}, O being the LLM output type of LLM workers</li>
     *   <li>{@code def extra_cache_key(self, task: T) -> str:}</li>
     * </ul>
     * Null for other hooks, and for post_process and extra_cache_key when the stored source
     * did not parse, since their bodies name parameters that cannot be recovered then.
     */
    private static String canonicalSignature(String name, TSNode function, PythonSyntaxTree tree,
                                             WorkerDefinition worker) {
        String parameter = "task";
        String annotation;
        String returns = "";
        switch (name) {
            case FrameworkVocabulary.CONSUME_WORK -> annotation = inputTypeHint(worker);
            case FrameworkVocabulary.CONSUME_WORK_JOINED -> {
                parameter = "tasks";
                annotation = "List[" + inputTypeHint(worker) + "]";
            }
            case POST_PROCESS -> annotation = outputTypeHint(worker);
            case EXTRA_CACHE_KEY -> {
                annotation = inputTypeHint(worker);
                returns = " -> str";
            }
            default -> {
                return null;
            }
        }
        if (function == null && (name.equals(POST_PROCESS) || name.equals(EXTRA_CACHE_KEY))) {
            return null;
        }

        List<String> trailing = new ArrayList<>();
        String prefix = "def ";
        if (function != null) {
            List<TSNode> positional = SyntaxNodes.positionalParameters(function);
            List<TSNode> all = SyntaxNodes.namedChildren(SyntaxNodes.field(function, "parameters"));
            int last = -1;
            if (positional.size() > 1) {
                TSNode name1 = SyntaxNodes.parameterName(positional.get(1));
                if (name1 != null) {
                    parameter = tree.text(name1);
                }
                last = indexOf(all, positional.get(1));
            } else if (!positional.isEmpty()) {
                last = indexOf(all, positional.get(0));
            }
            for (int i = last + 1; i < all.size(); i++) {
                if (!SyntaxNodes.is(all.get(i), SyntaxNodes.POSITIONAL_SEPARATOR)) {
                    trailing.add(tree.text(all.get(i)));
                }
            }
            if (SyntaxNodes.isAsync(function)) {
                prefix = "async def ";
            }
        }
        StringBuilder header = new StringBuilder(prefix).append(name)
                .append("(self, ").append(parameter).append(": ").append(annotation);
        trailing.forEach(extra -> header.append(", ").append(extra));
        return header.append(")").append(returns).append(":").toString();
    }

    private static int indexOf(List<TSNode> nodes, TSNode node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).getStartByte() == node.getStartByte()) {
                return i;
            }
        }
        return -1;
    }

    private static String inputTypeHint(WorkerDefinition worker) {
        return typeHint(worker.firstInputType());
    }

    /** LLM output type for LLM-backed workers, else the generic task hint. */
    private static String outputTypeHint(WorkerDefinition worker) {
        if (worker.getVariantKind() != null && worker.getVariantKind().usesLlmInputType()
                && worker.getClassVars() != null) {
            return typeHint(worker.getClassVars().getLlmOutputType());
        }
        return DEFAULT_TASK_HINT;
    }

    private static String typeHint(String type) {
        if (type == null) {
            return DEFAULT_TASK_HINT;
        }
        return FrameworkVocabulary.PRIMITIVE_TAGS.inverse().getOrDefault(type, type);
    }

    private static PythonSyntaxTree parse(String code) {
        try {
            return PythonSyntaxTree.parse(code, "<method>");
        } catch (SourceSyntaxException e) {
            log.debug("Method source does not parse: {}", e.getMessage());
            return null;
        }
    }

    private static TSNode firstFunction(PythonSyntaxTree tree) {
        for (TSNode statement : SyntaxNodes.statements(tree.root())) {
            if (SyntaxNodes.isFunction(statement)) {
                return statement;
            }
        }
        return null;
    }
}
