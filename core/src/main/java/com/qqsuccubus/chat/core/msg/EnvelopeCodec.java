package com.qqsuccubus.chat.core.msg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qqsuccubus.chat.core.error.EnvelopeValidationException;
import com.qqsuccubus.chat.core.util.JsonUtils;

/**
 * Decodes raw client text frames into {@link InboundFrame}s and encodes outbound {@link Envelope}s.
 */
public final class EnvelopeCodec {
    private EnvelopeCodec() {
    }

    /**
     * Decodes and validates one inbound text frame.
     *
     * @param json raw frame text
     * @return the decoded frame, fields validated
     * @throws EnvelopeValidationException when the frame is not a JSON object, its type is missing
     *                                     or unrecognised, or a required field is missing
     */
    public static InboundFrame decode(String json) {
        ObjectMapper mapper = JsonUtils.mapper();
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EnvelopeValidationException("Malformed JSON frame", e);
        }
        if (node == null || !node.isObject()) {
            throw new EnvelopeValidationException("Frame must be a JSON object");
        }

        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new EnvelopeValidationException("Missing required field 'type'");
        }
        String type = typeNode.asText();
        EnvelopeType envelopeType = EnvelopeType.inboundOf(type)
                .orElseThrow(() -> new EnvelopeValidationException("Unknown message type '" + type + "'"));

        Class<? extends InboundFrame> frameClass = switch (envelopeType) {
            case MESSAGE -> InboundFrames.DirectMessage.class;
            case GROUP_MESSAGE -> InboundFrames.GroupMessage.class;
            case TYPING -> InboundFrames.Typing.class;
            case READ_MESSAGES -> InboundFrames.ReadMessages.class;
            default -> throw new EnvelopeValidationException("Unknown message type '" + type + "'");
        };

        if (envelopeType == EnvelopeType.MESSAGE || envelopeType == EnvelopeType.GROUP_MESSAGE) {
            requireTextual(node, "content");
        }

        InboundFrame frame;
        try {
            frame = mapper.treeToValue(node, frameClass);
        } catch (JsonProcessingException e) {
            throw new EnvelopeValidationException("Invalid '" + type + "' frame: " + e.getOriginalMessage(), e);
        }
        frame.validate();
        return frame;
    }

    // Jackson would coerce numbers and booleans into a String field
    private static void requireTextual(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value != null && !value.isNull() && !value.isTextual()) {
            throw new EnvelopeValidationException("Field '" + field + "' must be a string");
        }
    }

    public static String encode(Envelope envelope) {
        return JsonUtils.writeValueAsString(envelope);
    }
}
