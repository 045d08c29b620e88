package adf;

public enum TokenType {
    BLANK,
    ABSOLUTE_HEADER,
    RELATIVE_HEADER,
    KEY_VALUE,
    SCALAR_VALUE,
    MULTILINE_START,
    MULTILINE_CONTENT,
    MULTILINE_END;

    public boolean isHeader() {
        return this == ABSOLUTE_HEADER || this == RELATIVE_HEADER;
    }

    public boolean opensEntry() {
        return this == KEY_VALUE || this == MULTILINE_START;
    }
}
