// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.jspecify.annotations.Nullable;

/**
 * Parsed response body of the chain service: {@code {data, error, statusCode}}.
 *
 * <p>
 * Only {@code error} and {@code statusCode} are interpreted by the client's
 * error classification; {@code data} is left for the calling operation to
 * convert into its target record.
 *
 * @param data       response payload, {@link MissingNode} when absent
 * @param error      the parsed error member
 * @param statusCode status reported in the body, or the HTTP status when the body has none
 * @param message    top-level {@code message} member, if any
 * @since 0.1.0
 */
public record ResponseEnvelope(
        JsonNode data,
        ErrorField error,
        @Nullable Integer statusCode,
        @Nullable String message) {

    public ResponseEnvelope {
        data = data == null ? MissingNode.getInstance() : data;
        error = error == null ? ErrorField.NONE : error;
    }

    /**
     * Builds an envelope from a parsed body.
     *
     * @param root       the JSON object the service returned
     * @param httpStatus HTTP status of the exchange, used when the body has no {@code statusCode}
     * @return the envelope
     */
    public static ResponseEnvelope fromJson(final JsonNode root, final @Nullable Integer httpStatus) {
        Objects.requireNonNull(root, "root");
        final JsonNode status = root.get("statusCode");
        final Integer statusCode = status != null && status.canConvertToInt() && status.isNumber()
                ? Integer.valueOf(status.intValue())
                : httpStatus;
        final JsonNode messageNode = root.get("message");
        final String message = messageNode != null && messageNode.isTextual() ? messageNode.textValue() : null;
        return new ResponseEnvelope(root.path("data"), ErrorField.parse(root.get("error")), statusCode, message);
    }

    /**
     * Returns whether the payload is absent, null, or an empty container.
     */
    public boolean hasNoData() {
        return data.isMissingNode() || data.isNull() || (data.isContainerNode() && data.size() == 0);
    }
}
