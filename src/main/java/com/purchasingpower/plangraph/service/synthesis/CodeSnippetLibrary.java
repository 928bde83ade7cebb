package com.purchasingpower.plangraph.service.synthesis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.plangraph.model.snippet.CodeSnippet;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Code Snippet Library
 *
 * Loads Python source templates from {@code classpath:codesnippets/*.yaml}, compiles them once
 * and renders them with variables.
 *
 * Usage:
 * String source = snippets.render("instantiation", Map.of(
 *     "statements", "planner_worker = Planner(llm=None)",
 *     "nodeName", "\"Planner\""
 * ));
 */
@Slf4j
@Service
public class CodeSnippetLibrary {

    private static final String LOCATION = "classpath:codesnippets/*.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, CodeSnippet> snippets = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadSnippets() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(LOCATION);

            for (Resource resource : resources) {
                CodeSnippet snippet = yamlMapper.readValue(resource.getInputStream(), CodeSnippet.class);
                snippets.put(snippet.getName(), snippet);
                compiled.put(snippet.getName(),
                        mustacheFactory.compile(new StringReader(snippet.getTemplate()), snippet.getName()));
                log.info("Loaded code snippet: {} (version: {})", snippet.getName(), snippet.getVersion());
            }

            log.info("Loaded {} code snippets", snippets.size());

        } catch (Exception e) {
            log.error("Failed to load code snippets", e);
            throw new IllegalStateException("Code snippet library initialization failed", e);
        }
    }

    /**
     * Render a snippet with variables
     */
    public String render(String snippetName, Map<String, Object> variables) {
        Mustache mustache = compiled.get(snippetName);

        if (mustache == null) {
            throw new IllegalArgumentException("Code snippet not found: " + snippetName);
        }

        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);

        return writer.toString();
    }

    /**
     * Get snippet metadata (for logging, debugging)
     */
    public CodeSnippet getSnippet(String name) {
        return snippets.get(name);
    }
}
