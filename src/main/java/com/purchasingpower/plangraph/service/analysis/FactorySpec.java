package com.purchasingpower.plangraph.service.analysis;

import java.util.List;

/**
 * Immutable view of a registered factory function.
 */
public record FactorySpec(String name, String module, String defaultClassName,
                          List<String> inputTypes, List<String> outputTypes, String taskModule) {
}
