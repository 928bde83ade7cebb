package com.purchasingpower.plangraph.parser;

import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Structural helpers over tree-sitter-python nodes. None of them look at source text; the
 * text-level queries live on {@link PythonSyntaxTree}.
 */
public final class SyntaxNodes {

    public static final String MODULE = "module";
    public static final String BLOCK = "block";
    public static final String COMMENT = "comment";
    public static final String ERROR = "ERROR";

    public static final String CLASS_DEFINITION = "class_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";
    public static final String DECORATOR = "decorator";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String ASSIGNMENT = "assignment";
    public static final String PASS_STATEMENT = "pass_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String RELATIVE_IMPORT = "relative_import";
    public static final String ALIASED_IMPORT = "aliased_import";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String ELSE_CLAUSE = "else_clause";
    public static final String FINALLY_CLAUSE = "finally_clause";

    public static final String IDENTIFIER = "identifier";
    public static final String ATTRIBUTE = "attribute";
    public static final String CALL = "call";
    public static final String ARGUMENT_LIST = "argument_list";
    public static final String KEYWORD_ARGUMENT = "keyword_argument";
    public static final String LIST_SPLAT = "list_splat";
    public static final String DICTIONARY_SPLAT = "dictionary_splat";
    public static final String SUBSCRIPT = "subscript";
    public static final String GENERIC_TYPE = "generic_type";
    public static final String TYPE_PARAMETER = "type_parameter";
    public static final String TYPE = "type";
    public static final String LIST = "list";
    public static final String TUPLE = "tuple";
    public static final String EXPRESSION_LIST = "expression_list";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String UNARY_OPERATOR = "unary_operator";

    public static final String PARAMETERS = "parameters";
    public static final String TYPED_PARAMETER = "typed_parameter";
    public static final String DEFAULT_PARAMETER = "default_parameter";
    public static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";
    public static final String POSITIONAL_SEPARATOR = "positional_separator";
    public static final String KEYWORD_SEPARATOR = "keyword_separator";
    public static final String LIST_SPLAT_PATTERN = "list_splat_pattern";
    public static final String DICTIONARY_SPLAT_PATTERN = "dictionary_splat_pattern";

    private SyntaxNodes() {
    }

    public static boolean isPresent(TSNode node) {
        return node != null && !node.isNull();
    }

    public static boolean is(TSNode node, String type) {
        return isPresent(node) && type.equals(node.getType());
    }

    /** Child by field name, null when absent. */
    public static TSNode field(TSNode node, String name) {
        if (!isPresent(node)) {
            return null;
        }
        TSNode child = node.getChildByFieldName(name);
        return isPresent(child) ? child : null;
    }

    /** Named children, comments left out. */
    public static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> children = new ArrayList<>();
        if (!isPresent(node)) {
            return children;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (isPresent(child) && !COMMENT.equals(child.getType())) {
                children.add(child);
            }
        }
        return children;
    }

    public static TSNode firstNamedChild(TSNode node) {
        List<TSNode> children = namedChildren(node);
        return children.isEmpty() ? null : children.get(0);
    }

    /** All children, anonymous tokens included. */
    public static List<TSNode> children(TSNode node) {
        List<TSNode> children = new ArrayList<>();
        if (!isPresent(node)) {
            return children;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (isPresent(child)) {
                children.add(child);
            }
        }
        return children;
    }

    public static TSNode findFirstChild(TSNode node, String type) {
        for (TSNode child : children(node)) {
            if (type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /** Statements of a module or block. */
    public static List<TSNode> statements(TSNode container) {
        return namedChildren(container);
    }

    /** Statements of the block in a definition's or clause's {@code body} field. */
    public static List<TSNode> body(TSNode node) {
        TSNode body = field(node, "body");
        return body == null ? statements(findFirstChild(node, BLOCK)) : statements(body);
    }

    /** The class or function under a decorated definition; any other node as is. */
    public static TSNode definition(TSNode statement) {
        if (is(statement, DECORATED_DEFINITION)) {
            TSNode definition = field(statement, "definition");
            return definition == null ? statement : definition;
        }
        return statement;
    }

    public static boolean isFunction(TSNode statement) {
        return is(definition(statement), FUNCTION_DEFINITION);
    }

    public static boolean isClass(TSNode statement) {
        return is(definition(statement), CLASS_DEFINITION);
    }

    /** Breadth-first walk over a node and its named descendants, the node itself first. */
    public static List<TSNode> walk(TSNode root) {
        List<TSNode> visited = new ArrayList<>();
        Deque<TSNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            TSNode node = queue.poll();
            visited.add(node);
            queue.addAll(namedChildren(node));
        }
        return visited;
    }

    /** Named nodes of one type in source order, the root itself included. */
    public static List<TSNode> findAllDescendants(TSNode root, String type) {
        List<TSNode> found = new ArrayList<>();
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (type.equals(node.getType())) {
                found.add(node);
            }
            List<TSNode> children = namedChildren(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return found;
    }

    /** Strips grouping parentheses and the {@code type} wrapper tree-sitter puts around annotations. */
    public static TSNode unwrap(TSNode node) {
        TSNode current = node;
        while (is(current, PARENTHESIZED_EXPRESSION) || is(current, TYPE)) {
            List<TSNode> inner = namedChildren(current);
            if (inner.size() != 1) {
                return current;
            }
            current = inner.get(0);
        }
        return current;
    }

    /**
     * The assignment an expression statement consists of, null for any other statement.
     * A chained {@code a = b = c} nests the inner assignment in {@code right}.
     */
    public static TSNode assignment(TSNode statement) {
        if (!is(statement, EXPRESSION_STATEMENT)) {
            return null;
        }
        List<TSNode> children = namedChildren(statement);
        return children.size() == 1 && is(children.get(0), ASSIGNMENT) ? children.get(0) : null;
    }

    /** The expression an expression statement consists of, null for assignments and other statements. */
    public static TSNode expression(TSNode statement) {
        if (!is(statement, EXPRESSION_STATEMENT)) {
            return null;
        }
        List<TSNode> children = namedChildren(statement);
        if (children.size() != 1 || is(children.get(0), ASSIGNMENT)) {
            return null;
        }
        return unwrap(children.get(0));
    }

    /** Target of a single-target assignment; null for chained assignments. */
    public static TSNode singleTarget(TSNode assignment) {
        if (!is(assignment, ASSIGNMENT) || is(field(assignment, "right"), ASSIGNMENT)) {
            return null;
        }
        return field(assignment, "left");
    }

    /** Assigned value, parentheses stripped; null for a bare annotation. */
    public static TSNode assignedValue(TSNode assignment) {
        TSNode right = field(assignment, "right");
        return right == null ? null : unwrap(right);
    }

    /** Argument nodes of a call, or of a class definition's base list. */
    public static List<TSNode> arguments(TSNode node) {
        TSNode list = is(node, CALL) ? field(node, "arguments") : field(node, "superclasses");
        return is(list, ARGUMENT_LIST) ? namedChildren(list) : List.of();
    }

    /** Positional arguments, parentheses stripped; keyword and unpacked arguments are left out. */
    public static List<TSNode> positionalArguments(TSNode node) {
        List<TSNode> positional = new ArrayList<>();
        for (TSNode argument : arguments(node)) {
            if (!is(argument, KEYWORD_ARGUMENT) && !is(argument, LIST_SPLAT) && !is(argument, DICTIONARY_SPLAT)) {
                positional.add(unwrap(argument));
            }
        }
        return positional;
    }

    /** Elements of a list, tuple or bare tuple, parentheses stripped. */
    public static List<TSNode> elements(TSNode node) {
        List<TSNode> elements = new ArrayList<>();
        for (TSNode element : namedChildren(node)) {
            elements.add(unwrap(element));
        }
        return elements;
    }

    /**
     * Type arguments of {@code X[a, b]}: the subscripts of a subscript expression or the
     * entries of a generic type's parameter list, unwrapped.
     */
    public static List<TSNode> genericArguments(TSNode node) {
        TSNode expression = unwrap(node);
        List<TSNode> arguments = new ArrayList<>();
        if (is(expression, SUBSCRIPT)) {
            List<TSNode> children = namedChildren(expression);
            for (int i = 1; i < children.size(); i++) {
                arguments.add(unwrap(children.get(i)));
            }
        } else if (is(expression, GENERIC_TYPE)) {
            for (TSNode entry : namedChildren(findFirstChild(expression, TYPE_PARAMETER))) {
                arguments.add(unwrap(entry));
            }
        }
        return arguments;
    }

    /** Parameters that can be passed positionally, in declaration order. */
    public static List<TSNode> positionalParameters(TSNode function) {
        List<TSNode> positional = new ArrayList<>();
        for (TSNode parameter : namedChildren(field(function, "parameters"))) {
            if (is(parameter, KEYWORD_SEPARATOR) || is(parameter, LIST_SPLAT_PATTERN)
                    || is(parameter, DICTIONARY_SPLAT_PATTERN) || isStarredTyped(parameter)) {
                break;
            }
            if (is(parameter, POSITIONAL_SEPARATOR)) {
                continue;
            }
            positional.add(parameter);
        }
        return positional;
    }

    /** Name node of a parameter of any shape. */
    public static TSNode parameterName(TSNode parameter) {
        if (is(parameter, IDENTIFIER)) {
            return parameter;
        }
        TSNode name = field(parameter, "name");
        if (name != null) {
            return name;
        }
        TSNode first = firstNamedChild(parameter);
        return is(first, IDENTIFIER) ? first : null;
    }

    /** Annotation of a parameter, unwrapped, or null. */
    public static TSNode parameterAnnotation(TSNode parameter) {
        TSNode type = field(parameter, "type");
        return type == null ? null : unwrap(type);
    }

    public static boolean isAsync(TSNode function) {
        return findFirstChild(function, "async") != null;
    }

    /** The colon that closes a compound statement's header, null when there is none. */
    public static TSNode headerColon(TSNode compound) {
        return findFirstChild(compound, ":");
    }

    private static boolean isStarredTyped(TSNode parameter) {
        if (!is(parameter, TYPED_PARAMETER)) {
            return false;
        }
        TSNode first = firstNamedChild(parameter);
        return is(first, LIST_SPLAT_PATTERN) || is(first, DICTIONARY_SPLAT_PATTERN);
    }
}
