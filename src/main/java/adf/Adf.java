package adf;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class Adf {

    public static final String VERSION = "0.1.0";

    private Adf() {
    }

    public static Document parse(String text) {
        return parse(text, ParseOptions.defaults());
    }

    public static Document parse(String text, ParseOptions options) {
        return new Parser(options).parse(text);
    }

    /**
     * Reads the file as UTF-8 and parses it.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     * @throws AdfParseException if the file is not valid UTF-8
     */
    public static Document parseFile(Path path) throws IOException {
        return parseFile(path, ParseOptions.defaults());
    }

    public static Document parseFile(Path path, ParseOptions options) throws IOException {
        return parse(readFile(path), options);
    }

    public static String serialize(Document document) {
        return new Serializer().serialize(document);
    }

    static String readFile(Path path) throws IOException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException ex) {
            throw new AdfParseException("File " + path + " is not valid UTF-8", ex);
        }
    }
}
