package adf;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Builder(toBuilder = true)
@AllArgsConstructor
@Data
public class ParseOptions {
    @Builder.Default
    private ParseMode mode = ParseMode.LENIENT;
    @Builder.Default
    private boolean inferTypes = true;

    public static ParseOptions defaults() {
        return ParseOptions.builder().build();
    }

    public boolean isStrict() {
        return mode == ParseMode.STRICT;
    }
}
