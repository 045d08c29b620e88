package adf;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdfTest {

    private static final String CONFIG_FULL = "src/test/resources/adf/config_full.adf";
    private static final String CONSTRAINTS = "src/test/resources/adf/constraints.adf";

    @TempDir
    Path tempDir;

    @Test
    void parsesFullConfig() throws Exception {
        var doc = Adf.parseFile(Paths.get(CONFIG_FULL));

        assertEquals(Value.of(1), doc.get("schema"));
        assertEquals(Value.of("StoryWeaver"), doc.get("app.name"));
        assertEquals(Value.of(1.1), doc.get("app.version"));
        assertEquals(Value.of(false), doc.get("app.debug"));
        assertEquals(Value.of("MIT"), doc.get("app.license"));
        assertEquals(Value.of("dark"), doc.get("app.ui.theme"));
        assertEquals(Value.of(14), doc.get("app.ui.font_size"));

        var features = doc.get("app.features").asArray();
        assertEquals(3, features.size());
        assertEquals(Value.of("autosave"), features.get(0));

        var authors = doc.get("app.authors").asArray();
        assertEquals(2, authors.size());
        assertEquals(Value.of("Linus"), authors.get(1).asObject().get("name"));

        assertEquals(Value.of("StoryWeaver helps writers plan chapters.\n\nIt keeps \"notes\" next to the draft."),
                doc.get("app.description.text"));

        assertNull(doc.get("upgrade"));
        assertEquals(Value.of(12), doc.getRelativeSections().get("upgrade").asObject()
                .get("stats").asObject().get("strength"));
    }

    @Test
    void constraintsAndQuotingAreStripped() throws Exception {
        var doc = Adf.parseFile(Paths.get(CONSTRAINTS));

        assertEquals(Value.of("Matthew"), doc.get("person.name"));
        assertEquals(Value.of(54), doc.get("person.age"));
        assertEquals(Value.of("matt@example.com"), doc.get("person.email"));
        assertEquals(Value.of("Writes parsers (mostly)."), doc.get("person.bio"));
        assertEquals(Value.of("call (me) later"), doc.get("person.note"));
    }

    @Test
    void optionsReachTheParser() throws Exception {
        var options = ParseOptions.builder().inferTypes(false).build();
        var doc = Adf.parse("# a:\nn = 1\n", options);
        assertEquals(Value.of("1"), doc.get("a.n"));
        assertEquals(Value.of(1), Adf.parse("# a:\nn = 1\n").get("a.n"));
    }

    @Test
    void missingFile() throws Exception {
        assertThrows(NoSuchFileException.class, () -> Adf.parseFile(tempDir.resolve("absent.adf")));
    }

    @Test
    void invalidUtf8IsAParseError() throws Exception {
        var file = tempDir.resolve("bad.adf");
        Files.write(file, new byte[]{'#', ':', '\n', 'a', ' ', '=', ' ', (byte) 0xC3, (byte) 0x28});

        var ex = assertThrows(AdfParseException.class, () -> Adf.parseFile(file));
        assertTrue(ex.getMessage().contains("not valid UTF-8"));
        assertNull(ex.getLineNumber());
    }

    @Test
    void readsUtf8Text() throws Exception {
        var file = tempDir.resolve("utf8.adf");
        Files.writeString(file, "# greeting:\ntext = Grüße\n");
        assertEquals(Value.of("Grüße"), Adf.parseFile(file).get("greeting.text"));
    }

    @Test
    void serializeMatchesDocumentSerialize() throws Exception {
        var doc = Adf.parse("# person:\nname = Matthew\nage = 54\n");
        assertEquals(doc.serialize(), Adf.serialize(doc));
    }

    @Test
    void errorMessages() throws Exception {
        var parse = new AdfParseException("Unexpected line", 3, "??");
        assertEquals("Line 3: Unexpected line\n  ??", parse.getMessage());
        assertEquals("Unexpected line", parse.getReason());
        assertEquals(3, parse.getLineNumber());

        assertEquals("no line", new AdfParseException("no line").getMessage());

        var validation = new AdfValidationException("Array index 1 is missing", "users");
        assertEquals("At 'users': Array index 1 is missing", validation.getMessage());
        assertEquals("users", validation.getPath());
        assertEquals("bare", new AdfValidationException("bare").getMessage());
    }

    @Test
    void parseModeFromString() throws Exception {
        assertEquals(ParseMode.STRICT, ParseMode.fromString("strict"));
        assertEquals(ParseMode.LENIENT, ParseMode.fromString(" Lenient "));
        assertThrows(IllegalArgumentException.class, () -> ParseMode.fromString("loose"));
        assertThrows(IllegalArgumentException.class, () -> ParseMode.fromString(null));
    }

    @Test
    void defaultOptions() throws Exception {
        var options = ParseOptions.defaults();
        assertEquals(ParseMode.LENIENT, options.getMode());
        assertTrue(options.isInferTypes());
        assertTrue(options.toBuilder().mode(ParseMode.STRICT).build().isStrict());
    }
}
