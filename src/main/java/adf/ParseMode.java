package adf;

public enum ParseMode {
    STRICT,
    LENIENT;

    public static ParseMode fromString(String s) {
        if (s != null) {
            for (ParseMode m : values()) {
                if (m.name().equalsIgnoreCase(s.trim())) {
                    return m;
                }
            }
        }
        throw new IllegalArgumentException("Unknown parse mode '" + s + "', expected strict or lenient");
    }
}
