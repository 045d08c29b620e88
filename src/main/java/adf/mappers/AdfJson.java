package adf.mappers;

import adf.AdfException;
import adf.Document;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON view of a document.
 */
public final class AdfJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private AdfJson() {
    }

    public static String toJson(Document document) {
        return write(document.toStructuredCopy().toPlain());
    }

    /**
     * With {@code includeRelative} the output is an object with {@code absolute} and
     * {@code relative} members.
     */
    public static String toJson(Document document, boolean includeRelative) {
        if (!includeRelative) {
            return toJson(document);
        }
        Map<String, Object> both = new LinkedHashMap<>();
        both.put("absolute", document.toStructuredCopy().toPlain());
        both.put("relative", document.relativeSectionsCopy().toPlain());
        return write(both);
    }

    private static String write(Object plain) {
        try {
            return MAPPER.writeValueAsString(plain);
        } catch (JsonProcessingException ex) {
            throw new AdfException("Could not write document as JSON", ex);
        }
    }
}
