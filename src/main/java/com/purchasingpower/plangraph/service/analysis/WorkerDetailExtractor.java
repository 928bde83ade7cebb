package com.purchasingpower.plangraph.service.analysis;

import com.purchasingpower.plangraph.model.ir.WorkerClassVars;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerVariant;
import com.purchasingpower.plangraph.parser.PythonLiteral;
import com.purchasingpower.plangraph.parser.PythonSyntaxTree;
import com.purchasingpower.plangraph.parser.SyntaxNodes;
import com.purchasingpower.plangraph.util.PythonText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Splits a worker class body into recognized classvars, recognized lifecycle hooks and
 * passthrough source, and infers the worker's input type.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerDetailExtractor {

    private static final String ANY = "Any";

    private final AnnotationDecoder annotationDecoder;

    /**
     * @param classDef the worker's {@code class_definition} node
     */
    public WorkerDefinition extract(TSNode classDef, WorkerVariant variant, PythonSyntaxTree tree) {
        String className = tree.definitionName(classDef);
        WorkerClassVars classVars = new WorkerClassVars();
        Map<String, String> methods = new LinkedHashMap<>();
        List<String> passthrough = new ArrayList<>();
        Map<String, TSNode> hooks = new LinkedHashMap<>();

        for (TSNode statement : SyntaxNodes.body(classDef)) {
            TSNode assignment = SyntaxNodes.assignment(statement);
            String classVar = assignment == null ? null : tree.name(SyntaxNodes.singleTarget(assignment));
            if (classVar != null && FrameworkVocabulary.isKnownClassVar(classVar)) {
                TSNode value = SyntaxNodes.assignedValue(assignment);
                if (value != null && applyClassVar(classVars, classVar, value, tree)) {
                    continue;
                }
                log.debug("Keeping {}.{} verbatim, value not decodable", className, classVar);
            }
            if (SyntaxNodes.isFunction(statement)) {
                TSNode function = SyntaxNodes.definition(statement);
                String name = tree.definitionName(function);
                if (FrameworkVocabulary.isKnownMethod(name)) {
                    methods.put(name, tree.lines(statement));
                    hooks.putIfAbsent(name, function);
                    continue;
                }
            }
            if (SyntaxNodes.is(statement, SyntaxNodes.PASS_STATEMENT)) {
                continue;
            }
            passthrough.add(PythonText.dedentCode(tree.lines(statement)).strip());
        }

        String rawPassthrough = String.join("\n\n", passthrough).strip();
        String inputType = inferInputType(variant, classVars, hooks, tree);

        return WorkerDefinition.builder()
                .className(className)
                .variantKind(variant)
                .classVars(classVars)
                .methods(methods)
                .rawPassthroughSource(rawPassthrough.isEmpty() ? null : rawPassthrough)
                .inputTypes(inputType == null ? null : new ArrayList<>(List.of(inputType)))
                .build();
    }

    /**
     * First match wins: join element type, then {@code llm_input_type} for LLM variants, then
     * the {@code consume_work} task annotation. {@code Any} never counts.
     */
    String inferInputType(WorkerVariant variant, WorkerClassVars classVars,
                          Map<String, TSNode> hooks, PythonSyntaxTree tree) {
        if (variant.isJoin()) {
            Optional<DecodedAnnotation> joined = taskAnnotation(hooks.get(FrameworkVocabulary.CONSUME_WORK_JOINED), tree);
            if (joined.isPresent() && joined.get().list() && !ANY.equals(joined.get().typeName())) {
                return joined.get().typeName();
            }
        }
        if (variant.usesLlmInputType() && classVars.getLlmInputType() != null) {
            return classVars.getLlmInputType();
        }
        return taskAnnotation(hooks.get(FrameworkVocabulary.CONSUME_WORK), tree)
                .map(DecodedAnnotation::typeName)
                .filter(type -> !ANY.equals(type))
                .orElse(null);
    }

    private Optional<DecodedAnnotation> taskAnnotation(TSNode hook, PythonSyntaxTree tree) {
        if (hook == null) {
            return Optional.empty();
        }
        List<TSNode> parameters = SyntaxNodes.positionalParameters(hook);
        TSNode annotation = parameters.size() < 2 ? null : SyntaxNodes.parameterAnnotation(parameters.get(1));
        if (annotation == null) {
            return Optional.empty();
        }
        return Optional.of(annotationDecoder.decode(annotation, tree));
    }

    /**
     * Decodes one recognized classvar into {@code classVars}.
     *
     * @return false when the value does not have the shape the classvar expects
     */
    boolean applyClassVar(WorkerClassVars classVars, String name, TSNode value, PythonSyntaxTree tree) {
        switch (name) {
            case "output_types" -> {
                return typeList(value, tree).map(types -> {
                    classVars.setOutputTypes(types);
                    return true;
                }).orElse(false);
            }
            case "tools" -> {
                return typeList(value, tree).map(tools -> {
                    classVars.setTools(tools);
                    return true;
                }).orElse(false);
            }
            case "input_type" -> {
                return typeName(value, tree).map(type -> {
                    classVars.setInputType(type);
                    return true;
                }).orElse(false);
            }
            case "llm_input_type" -> {
                return typeName(value, tree).map(type -> {
                    classVars.setLlmInputType(type);
                    return true;
                }).orElse(false);
            }
            case "llm_output_type" -> {
                return typeName(value, tree).map(type -> {
                    classVars.setLlmOutputType(type);
                    return true;
                }).orElse(false);
            }
            case "join_type" -> {
                return typeName(value, tree).map(type -> {
                    classVars.setJoinType(type);
                    return true;
                }).orElse(false);
            }
            case "prompt" -> {
                return promptText(value, tree).map(text -> {
                    classVars.setPrompt(text);
                    return true;
                }).orElse(false);
            }
            case "system_prompt" -> {
                return promptText(value, tree).map(text -> {
                    classVars.setSystemPrompt(text);
                    return true;
                }).orElse(false);
            }
            case "debug_mode" -> {
                return flag(value, tree).map(flag -> {
                    classVars.setDebugMode(flag);
                    return true;
                }).orElse(false);
            }
            case "use_xml" -> {
                return flag(value, tree).map(flag -> {
                    classVars.setUseXml(flag);
                    return true;
                }).orElse(false);
            }
            default -> {
                return false;
            }
        }
    }

    private static Optional<List<String>> typeList(TSNode value, PythonSyntaxTree tree) {
        if (!SyntaxNodes.is(value, SyntaxNodes.LIST)) {
            return Optional.empty();
        }
        List<String> names = new ArrayList<>();
        for (TSNode element : SyntaxNodes.elements(value)) {
            names.add(tree.text(element));
        }
        return Optional.of(names);
    }

    private static Optional<String> typeName(TSNode value, PythonSyntaxTree tree) {
        if (SyntaxNodes.is(value, SyntaxNodes.IDENTIFIER) || SyntaxNodes.is(value, SyntaxNodes.ATTRIBUTE)) {
            return Optional.of(tree.text(value));
        }
        return tree.stringValue(value);
    }

    /** {@code dedent("...").strip()} yields the dedented raw text; a plain string yields itself. */
    private static Optional<String> promptText(TSNode value, PythonSyntaxTree tree) {
        Optional<String> plain = tree.stringValue(value);
        if (plain.isPresent()) {
            return plain;
        }
        if (!SyntaxNodes.is(value, SyntaxNodes.CALL) || !SyntaxNodes.arguments(value).isEmpty()) {
            return Optional.empty();
        }
        TSNode strip = SyntaxNodes.unwrap(SyntaxNodes.field(value, "function"));
        if (!SyntaxNodes.is(strip, SyntaxNodes.ATTRIBUTE) || !"strip".equals(tree.attributeName(strip))) {
            return Optional.empty();
        }
        TSNode dedent = SyntaxNodes.unwrap(SyntaxNodes.field(strip, "object"));
        if (!SyntaxNodes.is(dedent, SyntaxNodes.CALL) || !"dedent".equals(tree.calleeName(dedent))) {
            return Optional.empty();
        }
        List<TSNode> arguments = SyntaxNodes.positionalArguments(dedent);
        if (arguments.size() != 1) {
            return Optional.empty();
        }
        return tree.stringValue(arguments.get(0)).map(PythonText::dedent);
    }

    private static Optional<Boolean> flag(TSNode value, PythonSyntaxTree tree) {
        PythonLiteral literal = tree.literal(value);
        if (literal != null && (literal.kind() == PythonLiteral.LiteralKind.TRUE
                || literal.kind() == PythonLiteral.LiteralKind.FALSE)) {
            return Optional.of((Boolean) literal.value());
        }
        return Optional.empty();
    }
}
