package com.esmp.envelope;

import com.esmp.error.ErrorKind;
import com.esmp.error.EsmpException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Strict JSON reading for everything that arrives signed: duplicate keys, trailing garbage and
 * invalid UTF-8 are rejected, and non-integral numbers keep their exact decimal value.
 */
@Component
public class WireFormat {

    private final ObjectMapper mapper;
    private final ObjectReader strictReader;

    public WireFormat(ObjectMapper mapper) {
        this.mapper = mapper;
        this.strictReader = mapper.reader()
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .with(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Parses one envelope or signed request body.
     *
     * @throws EsmpException {@link ErrorKind#MALFORMED_INPUT} unless the bytes are one JSON object
     */
    public ObjectNode readObject(byte[] bytes) {
        JsonNode node;
        try {
            node = strictReader.readTree(bytes);
        } catch (JsonProcessingException e) {
            throw new EsmpException(ErrorKind.MALFORMED_INPUT, "Invalid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new EsmpException(ErrorKind.MALFORMED_INPUT, "Unreadable input: " + e.getMessage());
        }
        if (node == null || !node.isObject()) {
            throw new EsmpException(ErrorKind.MALFORMED_INPUT, "Expected a JSON object");
        }
        return (ObjectNode) node;
    }

    /** Reads back an envelope this server stored itself. */
    public JsonNode readStored(String json) {
        try {
            return strictReader.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored envelope is not valid JSON", e);
        }
    }

    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise " + value.getClass().getSimpleName(), e);
        }
    }
}
