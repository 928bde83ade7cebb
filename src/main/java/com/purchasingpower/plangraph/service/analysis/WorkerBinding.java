package com.purchasingpower.plangraph.service.analysis;

import org.treesitter.TSNode;

/**
 * {@code variable = callee(...)} inside the graph builder, where the callee is a local worker
 * class or a registered factory.
 *
 * @param className worker class name; for factories the {@code name=} keyword or the default
 * @param call      the {@code call} node on the right-hand side
 * @param factory   the factory called, null for a direct instantiation
 */
public record WorkerBinding(String variable, String className, TSNode call, FactorySpec factory) {

    public boolean isFactory() {
        return factory != null;
    }
}
