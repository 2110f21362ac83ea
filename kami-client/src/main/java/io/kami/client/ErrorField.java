// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kami.client;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * The {@code error} member of a response envelope, parsed once at the
 * boundary.
 *
 * <p>
 * The chain service reports errors either as a plain string or as an object
 * with a message and a type tag. Both shapes, and the absence of an error,
 * are modelled as explicit variants:
 * <ul>
 * <li>{@link None} - no error, or a falsy value ({@code null}, {@code false},
 * {@code ""}, {@code 0}, empty object or array)</li>
 * <li>{@link Message} - a message without a type</li>
 * <li>{@link Typed} - a message with a type tag</li>
 * </ul>
 *
 * @since 0.1.0
 */
public sealed interface ErrorField permits ErrorField.None, ErrorField.Message, ErrorField.Typed {

    /** Shared instance for "no error". */
    None NONE = new None();

    /**
     * Returns whether an error was reported.
     */
    boolean isPresent();

    /**
     * Returns the error message, or {@code null} for {@link None}.
     */
    @Nullable String message();

    /**
     * Returns the error type tag, or {@code null} when untyped.
     */
    @Nullable String type();

    /**
     * No error was reported.
     */
    record None() implements ErrorField {
        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public @Nullable String message() {
            return null;
        }

        @Override
        public @Nullable String type() {
            return null;
        }
    }

    /**
     * An untyped error message.
     *
     * @param message the message
     */
    record Message(String message) implements ErrorField {
        public Message {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean isPresent() {
            return true;
        }

        @Override
        public @Nullable String type() {
            return null;
        }
    }

    /**
     * A structured error with a type tag.
     *
     * @param message the message
     * @param type    the type tag
     */
    record Typed(String message, String type) implements ErrorField {
        public Typed {
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(type, "type");
        }

        @Override
        public boolean isPresent() {
            return true;
        }
    }

    /**
     * Parses the {@code error} member of an envelope.
     *
     * @param node the member, or {@code null} when absent
     * @return the parsed variant
     */
    static ErrorField parse(final @Nullable JsonNode node) {
        if (!isTruthy(node)) {
            return NONE;
        }
        if (node.isTextual()) {
            return new Message(node.textValue());
        }
        if (node.isObject()) {
            final String message = node.hasNonNull("message") ? node.get("message").asText() : node.toString();
            final String type = firstText(node, "type", "name");
            return type == null ? new Message(message) : new Typed(message, type);
        }
        return new Message(node.toString());
    }

    private static boolean isTruthy(final @Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0.0;
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return true;
    }

    private static @Nullable String firstText(final JsonNode node, final String... fields) {
        for (final String field : fields) {
            final JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return null;
    }
}
