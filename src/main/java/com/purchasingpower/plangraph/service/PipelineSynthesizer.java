package com.purchasingpower.plangraph.service;

import com.purchasingpower.plangraph.model.payload.GraphPayload;
import com.purchasingpower.plangraph.model.result.SynthesisResult;

/**
 * Writes a runnable pipeline module from an editor graph payload.
 *
 * <p>Never throws for bad input. Contract violations (invalid names, several input types on a
 * non-join worker, unparsable output) come back as {@link SynthesisResult#getError()}.
 */
public interface PipelineSynthesizer {

    /**
     * @param payload nodes and edges as sent by the editor; not modified
     * @return formatted module source and module name, or an error descriptor
     */
    SynthesisResult synthesize(GraphPayload payload);
}
