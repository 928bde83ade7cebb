package com.purchasingpower.plangraph.service.analysis;

import com.purchasingpower.plangraph.model.ir.LlmConfigValue;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.parser.PythonLiteral;
import com.purchasingpower.plangraph.parser.PythonSyntaxTree;
import com.purchasingpower.plangraph.parser.SyntaxNodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Attaches {@code llm_from_config(...)} settings to the workers instantiated with an
 * {@code llm=} keyword.
 *
 * <p>An inline builder call sets {@code llmConfigFromCode}. A variable sets
 * {@code llmConfigVar}, plus {@code llmConfigFromCode} when the variable is assigned a builder
 * call in the graph builder or at module level (try blocks included). Workers without an
 * {@code llm=} keyword get neither property.
 */
@Slf4j
@Component
public class LlmBindingParser {

    private static final String LLM_KEYWORD = "llm";

    public void bind(PythonSyntaxTree tree, PipelineTopology topology, Map<String, WorkerDefinition> workers) {
        if (!topology.hasBuilder()) {
            return;
        }
        for (WorkerBinding binding : topology.bindings().values()) {
            WorkerDefinition worker = workers.get(binding.className());
            Optional<TSNode> llm = tree.keyword(binding.call(), LLM_KEYWORD);
            if (worker == null || llm.isEmpty()) {
                continue;
            }
            TSNode value = llm.get();
            String variable = tree.name(value);
            if (isConfigBuilderCall(value, tree)) {
                worker.setLlmConfigFromCode(decode(value, tree));
            } else if (variable != null) {
                worker.setLlmConfigVar(variable);
                findBuilderAssignment(variable, SyntaxNodes.body(topology.builder()),
                        SyntaxNodes.statements(tree.root()), tree)
                        .ifPresent(call -> worker.setLlmConfigFromCode(decode(call, tree)));
            }
            log.debug("Worker {} llm binding: var={}, config={}", worker.getClassName(),
                    worker.getLlmConfigVar(), worker.getLlmConfigFromCode());
        }
    }

    /** Keyword arguments of a builder call, constants as Python values, the rest as source text. */
    public Map<String, LlmConfigValue> decode(TSNode call, PythonSyntaxTree tree) {
        Map<String, LlmConfigValue> config = new LinkedHashMap<>();
        tree.keywords(call).forEach((keyword, value) -> config.put(keyword, decodeValue(value, tree)));
        return config;
    }

    /** Strings, numbers (signed ones included), booleans and None decode as literals. */
    static LlmConfigValue decodeValue(TSNode value, PythonSyntaxTree tree) {
        PythonLiteral literal = tree.literal(value);
        if (literal == null) {
            return LlmConfigValue.expression(tree.text(value));
        }
        return switch (literal.kind()) {
            case STRING, INTEGER, FLOAT, TRUE, FALSE, NONE -> LlmConfigValue.literal(literal.value());
            default -> LlmConfigValue.expression(tree.text(value));
        };
    }

    /**
     * Last assignment of {@code variable} in the builder, else at module level; present only
     * when that assignment is a builder call.
     */
    private static Optional<TSNode> findBuilderAssignment(String variable, List<TSNode> builderBody,
                                                          List<TSNode> moduleBody, PythonSyntaxTree tree) {
        Optional<TSNode> assigned = lastAssignment(variable, builderBody, tree);
        if (assigned.isEmpty()) {
            assigned = lastAssignment(variable, moduleBody, tree);
        }
        return assigned.filter(value -> isConfigBuilderCall(value, tree));
    }

    private static Optional<TSNode> lastAssignment(String variable, List<TSNode> body, PythonSyntaxTree tree) {
        TSNode assigned = null;
        for (TSNode statement : TopologyExtractor.flatten(body)) {
            TSNode assignment = SyntaxNodes.assignment(statement);
            if (assignment != null && variable.equals(tree.name(SyntaxNodes.singleTarget(assignment)))) {
                assigned = SyntaxNodes.assignedValue(assignment);
            }
        }
        return Optional.ofNullable(assigned);
    }

    private static boolean isConfigBuilderCall(TSNode expression, PythonSyntaxTree tree) {
        return SyntaxNodes.is(expression, SyntaxNodes.CALL)
                && FrameworkVocabulary.LLM_CONFIG_BUILDER.equals(tree.calleeName(expression));
    }
}
