package adf;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Dot-separated paths. A segment wrapped in double quotes may contain dots, spaces and other
 * reserved characters.
 */
public final class DocumentPath {

    private static final Pattern PLAIN_SEGMENT = Pattern.compile("^[A-Za-z0-9_]+$");
    private static final Pattern QUOTED_SEGMENT = Pattern.compile("^\"[^\"]+\"$");

    private DocumentPath() {
    }

    public static List<String> split(String path) {
        List<String> raw = splitRaw(path);
        List<String> parts = new ArrayList<>(raw.size());
        for (String s : raw) {
            if (!s.isEmpty()) {
                parts.add(unquote(s));
            }
        }
        return parts;
    }

    public static boolean isValidHeaderPath(String path) {
        if (StringUtils.isEmpty(path)) {
            return true;
        }
        for (String s : splitRaw(path)) {
            if (!isValidSegment(s)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isValidSegment(String rawSegment) {
        if (rawSegment == null) {
            return false;
        }
        return PLAIN_SEGMENT.matcher(rawSegment).matches() || QUOTED_SEGMENT.matcher(rawSegment).matches();
    }

    public static boolean isPlainSegment(String segment) {
        return segment != null && PLAIN_SEGMENT.matcher(segment).matches();
    }

    public static String quoteSegment(String segment) {
        if (isPlainSegment(segment)) {
            return segment;
        }
        return '"' + StringUtils.defaultString(segment) + '"';
    }

    public static String join(List<String> segments) {
        if (segments == null || segments.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String s : segments) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(quoteSegment(s));
        }
        return sb.toString();
    }

    public static List<String> append(List<String> base, String segment) {
        List<String> out = new ArrayList<>(base == null ? Collections.emptyList() : base);
        out.add(segment);
        return out;
    }

    private static List<String> splitRaw(String path) {
        if (StringUtils.isEmpty(path)) {
            return Collections.emptyList();
        }
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < path.length(); i++) {
            char ch = path.charAt(i);
            if (ch == '"') {
                inQuotes = !inQuotes;
                current.append(ch);
            } else if (ch == '.' && !inQuotes) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    private static String unquote(String segment) {
        if (segment.length() >= 2 && segment.startsWith("\"") && segment.endsWith("\"")) {
            return segment.substring(1, segment.length() - 1);
        }
        return segment;
    }
}
