package com.repoforensics.core.source.base;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repoforensics.core.model.SourceRecord;
import com.repoforensics.core.source.LoadContext;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Abstract base class for loaders that parse JSON documents using Jackson.
 *
 * <p>The document is read into a {@link JsonNode} tree; subclasses select the array holding
 * the records and decode each element. Navigation helpers mirror the ones used by the
 * CSV base class so that missing and non-numeric fields are reported the same way.
 *
 * @see AbstractSourceLoader
 */
public abstract class AbstractJsonSourceLoader extends AbstractSourceLoader {

    /**
     * JSON mapper for parsing input documents.
     * Thread-safe and reusable across parse operations.
     */
    protected final ObjectMapper objectMapper;

    /**
     * Constructor that initializes the JSON mapper.
     */
    protected AbstractJsonSourceLoader() {
        super();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Selects the array of record nodes from the document root.
     *
     * @param root document root
     * @return array node, or a missing/null node if the document holds no records
     */
    protected abstract JsonNode selectRecords(JsonNode root);

    /**
     * Decodes one record node.
     *
     * @param node record node
     * @param context load context
     * @return decoded record
     * @throws MalformedRecordException if the node cannot be decoded
     */
    protected abstract SourceRecord parseRecord(JsonNode node, LoadContext context) throws MalformedRecordException;

    @Override
    protected void decode(Path file, LoadContext context, RecordCollector collector) throws IOException {
        JsonNode root = objectMapper.readTree(file.toFile());
        JsonNode records = root == null ? null : selectRecords(root);
        if (records == null || !records.isArray()) {
            log.warn("{} contains no record array: {}", getDisplayName(), file);
            return;
        }

        int index = 0;
        for (JsonNode node : records) {
            index++;
            collector.rowRead();
            try {
                if (!node.isObject()) {
                    throw new MalformedRecordException("not an object", "expected an object but found " + node.getNodeType());
                }
                collector.accept(parseRecord(node, context));
            } catch (MalformedRecordException e) {
                collector.skip("element " + index, node.toString(), e);
            } catch (IllegalArgumentException e) {
                collector.skip("element " + index, node.toString(), new MalformedRecordException("invalid value", e.getMessage()));
            }
        }
    }

    // ==================== JsonNode Navigation Utilities ====================

    /**
     * Extracts a text value from a child node.
     *
     * @param node parent node
     * @param field field name
     * @return text content, or null if absent, null or blank
     */
    protected String extractText(JsonNode node, String field) {
        JsonNode child = node.get(field);
        if (child == null || child.isNull()) {
            return null;
        }
        String text = child.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Safely gets a text value with a default fallback.
     *
     * @param node parent node
     * @param field field name
     * @param defaultValue value returned when the field is absent or blank
     * @return text value or default
     */
    protected String getTextOrDefault(JsonNode node, String field, String defaultValue) {
        String text = extractText(node, field);
        return text != null ? text : defaultValue;
    }

    /**
     * Extracts a required integer field. Numeric strings and whole-valued decimals such as
     * {@code 7.0} are accepted; fractions and values outside the {@code int} range are not.
     *
     * @param node parent node
     * @param field field name
     * @return integer value
     * @throws MalformedRecordException if the field is missing or not an integer
     */
    protected int requiredInt(JsonNode node, String field) throws MalformedRecordException {
        JsonNode child = node.get(field);
        if (child == null || child.isNull()) {
            throw new MalformedRecordException("missing value", "missing value for '" + field + "'");
        }
        if (child.isIntegralNumber()) {
            if (!child.canConvertToInt()) {
                throw new MalformedRecordException("invalid number", "'" + field + "' is out of range: " + child.asText());
            }
            return child.asInt();
        }
        if (child.isNumber()) {
            double value = child.asDouble();
            if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw new MalformedRecordException("invalid number", "'" + field + "' is not an integer: " + child.asText());
            }
            return (int) value;
        }
        try {
            return Integer.parseInt(child.asText().trim());
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("invalid number", "'" + field + "' is not an integer: " + child.asText());
        }
    }

    /**
     * Extracts an optional integer field, returning a default when absent.
     *
     * @param node parent node
     * @param field field name
     * @param defaultValue value returned when the field is absent
     * @return integer value or default
     * @throws MalformedRecordException if the field is present but not an integer
     */
    protected int optionalInt(JsonNode node, String field, int defaultValue) throws MalformedRecordException {
        JsonNode child = node.get(field);
        if (child == null || child.isNull()) {
            return defaultValue;
        }
        return requiredInt(node, field);
    }
}
