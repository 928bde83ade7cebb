package com.purchasingpower.plangraph.model.snippet;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Source template loaded from YAML.
 *
 * YAML structure:
 * <pre>
 * name: module
 * version: 1.0
 * description: Skeleton of a generated pipeline module
 * template: |
 *   {{=&lt;% %&gt;=}}
 *   ...
 * </pre>
 *
 * Templates are Mustache. Python source is full of braces, so templates switch the
 * delimiters to {@code <% %>} on their first line.
 *
 * @see com.purchasingpower.plangraph.service.synthesis.CodeSnippetLibrary
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CodeSnippet {

    private String name;
    private String version;
    private String description;
    private String template;
}
