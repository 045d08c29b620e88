package adf;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class Token {
    private final TokenType type;
    private final int lineNumber;
    private final String rawLine;

    private final String path;
    private final boolean absolute;

    private final String key;
    private final String value;
    private final String constraint;

    private final int quoteCount;
}
