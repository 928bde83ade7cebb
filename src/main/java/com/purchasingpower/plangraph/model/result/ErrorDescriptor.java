package com.purchasingpower.plangraph.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.google.common.base.Throwables;
import com.purchasingpower.plangraph.exception.FormatException;
import com.purchasingpower.plangraph.exception.InvalidIdentifierException;
import com.purchasingpower.plangraph.exception.MultipleInputTypesException;
import com.purchasingpower.plangraph.exception.PipelineTransformException;
import com.purchasingpower.plangraph.exception.SourceSyntaxException;
import com.purchasingpower.plangraph.exception.UnresolvedTypeReferenceException;
import lombok.Builder;
import lombok.Value;

/**
 * Structured failure report, shaped like the error blocks the generated harness prints:
 * {@code {"success": false, "error": {"kind", "message", "nodeName", "fullTraceback"}}}.
 *
 * @since 1.0.0
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorDescriptor {

    boolean success;

    ErrorDetail error;

    @Value
    @Builder(toBuilder = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {

        ErrorKind kind;

        String message;

        String nodeName;

        String fullTraceback;

        /** Unformatted generated text, only for {@link ErrorKind#FORMAT_ERROR}. */
        String rawSource;
    }

    public static ErrorDescriptor of(ErrorKind kind, String message, String nodeName, Throwable cause) {
        return ErrorDescriptor.builder()
                .success(false)
                .error(ErrorDetail.builder()
                        .kind(kind)
                        .message(message)
                        .nodeName(nodeName)
                        .fullTraceback(cause == null ? null : Throwables.getStackTraceAsString(cause))
                        .build())
                .build();
    }

    /**
     * Maps a transform failure to its descriptor kind, keeping the raw text of format failures.
     */
    public static ErrorDescriptor from(PipelineTransformException e) {
        ErrorKind kind;
        if (e instanceof SourceSyntaxException) {
            kind = ErrorKind.SYNTAX_ERROR;
        } else if (e instanceof InvalidIdentifierException) {
            kind = ErrorKind.INVALID_IDENTIFIER;
        } else if (e instanceof UnresolvedTypeReferenceException) {
            kind = ErrorKind.UNRESOLVED_TYPE;
        } else if (e instanceof MultipleInputTypesException) {
            kind = ErrorKind.MULTIPLE_INPUT_TYPES;
        } else if (e instanceof FormatException) {
            kind = ErrorKind.FORMAT_ERROR;
        } else {
            kind = ErrorKind.INVALID_PAYLOAD;
        }
        ErrorDescriptor descriptor = of(kind, e.getMessage(), e.getNodeName(), e);
        if (e instanceof FormatException format) {
            return ErrorDescriptor.builder()
                    .success(false)
                    .error(descriptor.getError().toBuilder().rawSource(format.getRawSource()).build())
                    .build();
        }
        return descriptor;
    }

    public ErrorKind kind() {
        return error.getKind();
    }
}
