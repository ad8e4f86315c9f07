package win.ixuni.nimbus.core.signing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Canonical form of the x-goog- extension headers
 */
public final class ExtensionHeaders {

    public static final String PREFIX = "x-goog-";

    /**
     * Customer-supplied encryption key headers travel with the request but are never signed
     */
    private static final Set<String> EXCLUDED = Set.of(
            "x-goog-encryption-key",
            "x-goog-encryption-key-sha256");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ExtensionHeaders() {
    }

    /**
     * Canonicalize headers for signing
     * <p>
     * Names are lower-cased and merged case-insensitively, non-extension headers dropped,
     * values trimmed with inner whitespace collapsed and joined with ','.
     * Lines are sorted by name and each one ends with '\n'.
     *
     * @param headers header name to values, may be null
     * @return concatenated "name:value\n" lines, empty when nothing qualifies
     */
    public static String canonicalize(Map<String, List<String>> headers) {
        if (headers == null || headers.isEmpty()) {
            return "";
        }

        TreeMap<String, List<String>> merged = new TreeMap<>();
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            String name = entry.getKey().trim().toLowerCase(Locale.ROOT);
            if (!name.startsWith(PREFIX) || EXCLUDED.contains(name)) {
                continue;
            }
            List<String> values = merged.computeIfAbsent(name, k -> new ArrayList<>());
            if (entry.getValue() != null) {
                for (String value : entry.getValue()) {
                    if (value != null) {
                        values.add(normalizeValue(value));
                    }
                }
            }
        }

        StringBuilder canonical = new StringBuilder();
        for (Map.Entry<String, List<String>> entry : merged.entrySet()) {
            canonical.append(entry.getKey())
                    .append(':')
                    .append(String.join(",", entry.getValue()))
                    .append('\n');
        }
        return canonical.toString();
    }

    private static String normalizeValue(String value) {
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }
}
