package com.deliium.drawingboard.protocol;

import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.stereotype.Component;

/**
 * Translates between push-channel text frames and {@link Envelope}s.
 *
 * <p>Decoding discriminates on {@code type} first and then reads only the field that tag names.
 * A frame whose tag and populated field disagree is rejected; a frame with an unknown tag
 * decodes to {@link Optional#empty()} so the caller can ignore it.
 */
@Component
public class EnvelopeCodec {
    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<Envelope> decode(String payload) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("invalid json: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedEnvelopeException("envelope must be a json object");
        }
        JsonNode type = node.get("type");
        if (type == null || !type.isTextual()) {
            throw new MalformedEnvelopeException("missing envelope type");
        }
        switch (type.asText()) {
            case Envelope.STROKE:
                return Optional.of(decodeStroke(node));
            case Envelope.DELETE:
                return Optional.of(decodeDelete(node));
            default:
                return Optional.empty();
        }
    }

    public String encode(Envelope envelope) throws JsonProcessingException {
        return objectMapper.writeValueAsString(envelope);
    }

    private Envelope decodeStroke(JsonNode node) {
        JsonNode stroke = node.get("stroke");
        if (stroke == null || !stroke.isObject()) {
            throw new MalformedEnvelopeException("stroke envelope without stroke");
        }
        if (isPopulated(node.get("delete"))) {
            throw new MalformedEnvelopeException("stroke envelope carries a delete id");
        }
        try {
            return Envelope.ofStroke(objectMapper.treeToValue(stroke, Stroke.class));
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("invalid stroke: " + e.getOriginalMessage(), e);
        }
    }

    private Envelope decodeDelete(JsonNode node) {
        JsonNode id = node.get("delete");
        if (id == null || !id.canConvertToLong() || !id.isIntegralNumber()) {
            throw new MalformedEnvelopeException("delete envelope without stroke id");
        }
        if (isPopulated(node.get("stroke"))) {
            throw new MalformedEnvelopeException("delete envelope carries a stroke");
        }
        return Envelope.ofDelete(id.asLong());
    }

    private static boolean isPopulated(JsonNode field) {
        return field != null && !field.isNull();
    }
}
