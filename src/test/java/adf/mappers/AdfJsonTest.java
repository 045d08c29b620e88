package adf.mappers;

import adf.Adf;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdfJsonTest {

    private static final String CONFIG_FULL = "src/test/resources/adf/config_full.adf";

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesAbsoluteTree() throws Exception {
        var doc = Adf.parseFile(Paths.get(CONFIG_FULL));
        var tree = mapper.readTree(AdfJson.toJson(doc));

        assertEquals("StoryWeaver", tree.get("app").get("name").asText());
        assertEquals(1.1, tree.get("app").get("version").asDouble());
        assertTrue(tree.get("app").get("ui").get("font_size").isIntegralNumber());
        assertFalse(tree.get("app").get("debug").asBoolean());
        assertEquals(3, tree.get("app").get("features").size());
        assertEquals("Ada", tree.get("app").get("authors").get(0).get("name").asText());
        assertFalse(tree.has("upgrade"));
    }

    @Test
    void keepsKeyOrder() throws Exception {
        var doc = Adf.parse("# z:\nb = 1\na = 2\n");
        var json = AdfJson.toJson(doc);
        assertTrue(json.indexOf("\"b\"") < json.indexOf("\"a\""));
    }

    @Test
    void includesRelativeSectionsOnRequest() throws Exception {
        var doc = Adf.parseFile(Paths.get(CONFIG_FULL));

        var both = mapper.readTree(AdfJson.toJson(doc, true));
        assertEquals("MIT", both.get("absolute").get("app").get("license").asText());
        assertEquals(12, both.get("relative").get("upgrade").get("stats").get("strength").asInt());

        assertEquals(AdfJson.toJson(doc), AdfJson.toJson(doc, false));
    }

    @Test
    void nullLiteralStaysTextAndEmptyDocument() throws Exception {
        var doc = Adf.parse("# a:\nn = null\n");
        assertTrue(mapper.readTree(AdfJson.toJson(doc)).get("a").get("n").isTextual());
        assertEquals("{ }", AdfJson.toJson(Adf.parse("")));
    }
}
