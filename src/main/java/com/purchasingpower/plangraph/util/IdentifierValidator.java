package com.purchasingpower.plangraph.util;

import com.purchasingpower.plangraph.exception.InvalidIdentifierException;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates names that end up as Python identifiers in generated source (class names,
 * field names, worker instance names).
 *
 * Allowed: {@code ^[a-zA-Z_][a-zA-Z0-9_]*$}, excluding reserved keywords.
 * Examples of valid names: {@code Query}, {@code _Draft2}, {@code search_result}
 * Examples of invalid names: {@code 2fast}, {@code my-task}, {@code class}, {@code ""}
 *
 * Invalid names are rejected, never silently renamed.
 */
@Slf4j
public final class IdentifierValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    /** Reserved words; the soft keywords {@code match}, {@code case} and {@code type} stay usable. */
    public static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private IdentifierValidator() {
    }

    public static boolean isValid(String name) {
        return name != null && IDENTIFIER.matcher(name).matches() && !KEYWORDS.contains(name);
    }

    /**
     * @param name     the candidate identifier
     * @param role     what the name is used as ("class", "field", ...), for the message
     * @param nodeName the task/worker the name belongs to
     * @throws InvalidIdentifierException if the name is not a valid identifier
     */
    public static String requireValid(String name, String role, String nodeName) {
        if (!isValid(name)) {
            log.warn("Rejected invalid {} name '{}' on {}", role, name, nodeName);
            throw new InvalidIdentifierException(name, role, nodeName);
        }
        return name;
    }
}
