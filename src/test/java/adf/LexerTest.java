package adf;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LexerTest {

    private final Lexer lexer = new Lexer();

    private Token single(String line) {
        List<Token> tokens = lexer.tokenize(line);
        assertEquals(1, tokens.size());
        return tokens.get(0);
    }

    @Test
    void classifiesHeaders() throws Exception {
        var absolute = single("# person.address:");
        assertEquals(TokenType.ABSOLUTE_HEADER, absolute.getType());
        assertEquals("person.address", absolute.getPath());
        assertTrue(absolute.isAbsolute());

        var root = single("#:");
        assertEquals(TokenType.ABSOLUTE_HEADER, root.getType());
        assertEquals("", root.getPath());

        var relative = single("upgrade.stats:");
        assertEquals(TokenType.RELATIVE_HEADER, relative.getType());
        assertEquals("upgrade.stats", relative.getPath());
        assertFalse(relative.isAbsolute());

        var quoted = single("# \"Some Key\".sub:");
        assertEquals(TokenType.ABSOLUTE_HEADER, quoted.getType());
        assertEquals("\"Some Key\".sub", quoted.getPath());
    }

    @Test
    void emptyRelativeHeaderFallsThrough() throws Exception {
        var token = single(":");
        assertEquals(TokenType.SCALAR_VALUE, token.getType());
        assertEquals(":", token.getValue());
    }

    @Test
    void invalidHeaderPathFallsThrough() throws Exception {
        var kv = single("url = http:");
        assertEquals(TokenType.KEY_VALUE, kv.getType());
        assertEquals("url", kv.getKey());
        assertEquals("http:", kv.getValue());

        var scalar = single("two words:");
        assertEquals(TokenType.SCALAR_VALUE, scalar.getType());
        assertEquals("two words:", scalar.getValue());
    }

    @Test
    void blankAndWhitespaceLines() throws Exception {
        List<Token> tokens = lexer.tokenize("\n   \n\t\nx");
        assertEquals(TokenType.BLANK, tokens.get(0).getType());
        assertEquals(TokenType.BLANK, tokens.get(1).getType());
        assertEquals(TokenType.BLANK, tokens.get(2).getType());
        assertEquals(TokenType.SCALAR_VALUE, tokens.get(3).getType());
        assertEquals(4, tokens.get(3).getLineNumber());
    }

    @Test
    void keyValueIsTrimmed() throws Exception {
        var token = single("  name   =   Matthew   ");
        assertEquals(TokenType.KEY_VALUE, token.getType());
        assertEquals("name", token.getKey());
        assertEquals("Matthew", token.getValue());
        assertNull(token.getConstraint());
    }

    @Test
    void extractsTrailingConstraint() throws Exception {
        var token = single("age = 54 (int, min 0)");
        assertEquals("54", token.getValue());
        assertEquals("int, min 0", token.getConstraint());

        var nested = single("f = x (a (b))");
        assertEquals("x", nested.getValue());
        assertEquals("a (b)", nested.getConstraint());

        var inner = single("note = call (me) later");
        assertEquals("call (me) later", inner.getValue());
        assertNull(inner.getConstraint());

        var empty = single("e = value ()");
        assertEquals("value ()", empty.getValue());
        assertNull(empty.getConstraint());
    }

    @Test
    void singleLineQuotedValue() throws Exception {
        var token = single("title = \"Hello = world (really)\"");
        assertEquals(TokenType.KEY_VALUE, token.getType());
        assertEquals("Hello = world (really)", token.getValue());
        assertEquals(1, token.getQuoteCount());
        assertNull(token.getConstraint());

        var triple = single("t = \"\"\"inline\"\"\"");
        assertEquals(TokenType.KEY_VALUE, triple.getType());
        assertEquals("inline", triple.getValue());
    }

    @Test
    void multilineBlock() throws Exception {
        List<Token> tokens = lexer.tokenize("body = \"\"\"\nline one\n\n# not: a header\n\"\"\"\nafter = 1");
        assertEquals(TokenType.MULTILINE_START, tokens.get(0).getType());
        assertEquals("body", tokens.get(0).getKey());
        assertEquals("", tokens.get(0).getValue());
        assertEquals(3, tokens.get(0).getQuoteCount());
        assertEquals(TokenType.MULTILINE_CONTENT, tokens.get(1).getType());
        assertEquals("line one", tokens.get(1).getValue());
        assertEquals(TokenType.MULTILINE_CONTENT, tokens.get(2).getType());
        assertEquals(TokenType.MULTILINE_CONTENT, tokens.get(3).getType());
        assertEquals("# not: a header", tokens.get(3).getValue());
        assertEquals(TokenType.MULTILINE_END, tokens.get(4).getType());
        assertEquals("", tokens.get(4).getValue());
        assertEquals(TokenType.KEY_VALUE, tokens.get(5).getType());
    }

    @Test
    void multilineWithInlineFragments() throws Exception {
        List<Token> tokens = lexer.tokenize("x = \"first\nsecond   \"");
        assertEquals(TokenType.MULTILINE_START, tokens.get(0).getType());
        assertEquals("first", tokens.get(0).getValue());
        assertEquals(1, tokens.get(0).getQuoteCount());
        assertEquals(TokenType.MULTILINE_END, tokens.get(1).getType());
        assertEquals("second", tokens.get(1).getValue());
    }

    @Test
    void shorterQuoteRunDoesNotCloseBlock() throws Exception {
        List<Token> tokens = lexer.tokenize("x = \"\"\"\nsays \"hi\"\n\"\"\"");
        assertEquals(TokenType.MULTILINE_CONTENT, tokens.get(1).getType());
        assertEquals(TokenType.MULTILINE_END, tokens.get(2).getType());
    }

    @Test
    void emptyQuotedValueOpensBlock() throws Exception {
        List<Token> tokens = lexer.tokenize("e = \"\"\nnext = 1\n\"\"");
        assertEquals(TokenType.MULTILINE_START, tokens.get(0).getType());
        assertEquals(2, tokens.get(0).getQuoteCount());
        assertEquals(TokenType.MULTILINE_CONTENT, tokens.get(1).getType());
        assertEquals(TokenType.MULTILINE_END, tokens.get(2).getType());
    }

    @Test
    void normalizesLineEndings() throws Exception {
        List<Token> tokens = lexer.tokenize("# a:\r\nx = 1\ry = 2\n");
        assertEquals(3, tokens.size());
        assertEquals("1", tokens.get(1).getValue());
        assertEquals("2", tokens.get(2).getValue());
    }

    @Test
    void emptyInputHasNoTokens() throws Exception {
        assertTrue(lexer.tokenize("").isEmpty());
        assertTrue(lexer.tokenize(null).isEmpty());
    }
}
