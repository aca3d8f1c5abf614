package com.esmp.crypto;

import com.esmp.error.ErrorKind;
import com.esmp.error.EsmpException;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Set;
import java.util.TreeSet;

/**
 * Produces the exact bytes a message signature covers.
 *
 * <p>Rules: the top-level {@code signature} and {@code sender_pubkey} members are left out,
 * as are top-level members whose value is {@code null}; object keys are sorted by UTF-16
 * code unit at every depth; no whitespace; UTF-8; integers in plain decimal and other numbers
 * as their shortest plain decimal. The wire order of keys therefore never matters.
 */
@Component
public class Canonicalizer {

    public static final Set<String> UNSIGNED_FIELDS = Set.of("signature", "sender_pubkey");

    /** Largest decimal exponent, either sign, a signed number may carry. */
    static final int MAX_NUMBER_SCALE = 1000;

    private final JsonFactory jsonFactory = new JsonFactory();

    /** Canonical bytes of an envelope, without its signature fields. */
    public byte[] canonicalize(JsonNode envelope) {
        return canonicalize(envelope, UNSIGNED_FIELDS);
    }

    /** Canonical bytes of any JSON object, leaving out the named top-level members. */
    public byte[] canonicalize(JsonNode object, Set<String> excluded) {
        if (object == null || !object.isObject()) {
            throw new EsmpException(ErrorKind.MALFORMED_INPUT, "Only JSON objects can be canonicalised");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(256);
        try (JsonGenerator generator = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
            generator.writeStartObject();
            for (String name : sortedNames(object)) {
                JsonNode value = object.get(name);
                if (excluded.contains(name) || value.isNull()) {
                    continue;
                }
                writeName(generator, name);
                writeValue(generator, value);
            }
            generator.writeEndObject();
        } catch (IOException e) {
            throw new EsmpException(ErrorKind.MALFORMED_INPUT, "Cannot canonicalise: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    private void writeValue(JsonGenerator generator, JsonNode node) throws IOException {
        switch (node.getNodeType()) {
            case OBJECT:
                generator.writeStartObject();
                for (String name : sortedNames(node)) {
                    writeName(generator, name);
                    writeValue(generator, node.get(name));
                }
                generator.writeEndObject();
                break;
            case ARRAY:
                generator.writeStartArray();
                for (JsonNode element : node) {
                    writeValue(generator, element);
                }
                generator.writeEndArray();
                break;
            case STRING:
                checkWellFormed(node.textValue());
                generator.writeString(node.textValue());
                break;
            case NUMBER:
                writeNumber(generator, node);
                break;
            case BOOLEAN:
                generator.writeBoolean(node.booleanValue());
                break;
            case NULL:
                generator.writeNull();
                break;
            default:
                throw new EsmpException(ErrorKind.MALFORMED_INPUT,
                        "Unsupported JSON value of type " + node.getNodeType());
        }
    }

    private void writeNumber(JsonGenerator generator, JsonNode node) throws IOException {
        if (node.isIntegralNumber()) {
            generator.writeNumber(node.bigIntegerValue());
            return;
        }
        if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) {
            throw new EsmpException(ErrorKind.MALFORMED_INPUT, "Non-finite numbers cannot be signed");
        }
        BigDecimal value = node.decimalValue().stripTrailingZeros();
        if (Math.abs((long) value.scale()) > MAX_NUMBER_SCALE || value.precision() > MAX_NUMBER_SCALE) {
            throw new EsmpException(ErrorKind.MALFORMED_INPUT,
                    "Numbers beyond " + MAX_NUMBER_SCALE + " decimal digits cannot be signed");
        }
        try {
            if (value.scale() <= 0) {
                generator.writeNumber(value.toBigIntegerExact());
            } else {
                generator.writeNumber(value.toPlainString());
            }
        } catch (ArithmeticException e) {
            throw new EsmpException(ErrorKind.MALFORMED_INPUT, "Number cannot be signed: " + e.getMessage(), e);
        }
    }

    private void writeName(JsonGenerator generator, String name) throws IOException {
        checkWellFormed(name);
        generator.writeFieldName(name);
    }

    private static Set<String> sortedNames(JsonNode object) {
        Set<String> names = new TreeSet<>();
        Iterator<String> it = object.fieldNames();
        while (it.hasNext()) {
            names.add(it.next());
        }
        return names;
    }

    /** Unpaired surrogates have no UTF-8 encoding. */
    private static void checkWellFormed(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    throw new EsmpException(ErrorKind.MALFORMED_INPUT, "String contains an unpaired surrogate");
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                throw new EsmpException(ErrorKind.MALFORMED_INPUT, "String contains an unpaired surrogate");
            }
        }
    }
}
