package adf;

import lombok.Getter;

/**
 * Input that cannot be turned into a document.
 */
@Getter
public class AdfParseException extends AdfException {

    private final String reason;
    private final Integer lineNumber;
    private final String line;

    public AdfParseException(String reason) {
        this(reason, null, null, null);
    }

    public AdfParseException(String reason, Throwable cause) {
        this(reason, null, null, cause);
    }

    public AdfParseException(String reason, Integer lineNumber, String line) {
        this(reason, lineNumber, line, null);
    }

    public AdfParseException(String reason, Integer lineNumber, String line, Throwable cause) {
        super(format(reason, lineNumber, line), cause);
        this.reason = reason;
        this.lineNumber = lineNumber;
        this.line = line;
    }

    private static String format(String reason, Integer lineNumber, String line) {
        String message = lineNumber == null ? reason : "Line " + lineNumber + ": " + reason;
        if (line != null) {
            message += "\n  " + line;
        }
        return message;
    }
}
