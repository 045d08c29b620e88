package adf;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * A consistency check on parsed or assembled data failed.
 */
@Getter
public class AdfValidationException extends AdfException {

    private final String reason;
    private final String path;

    public AdfValidationException(String reason) {
        this(reason, null);
    }

    public AdfValidationException(String reason, String path) {
        super(StringUtils.isEmpty(path) ? reason : "At '" + path + "': " + reason);
        this.reason = reason;
        this.path = path;
    }
}
