package win.ixuni.nimbus.core.util;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Percent-encoding for signed URL paths and query parameters
 * <p>
 * Only A-Za-z0-9-._~ are left as-is; every other UTF-8 byte is encoded as %XX with upper-case hex.
 * 空格编码为 %20（不是 +）
 */
public final class UriEncodingUtils {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private UriEncodingUtils() {
    }

    /**
     * Encode a single path segment or query component
     *
     * @throws CharacterCodingException if the input holds an unpaired surrogate
     */
    public static String encode(String input) throws CharacterCodingException {
        return encode(input, true);
    }

    /**
     * Encode an object path, keeping '/' so each segment is escaped on its own
     *
     * @throws CharacterCodingException if the input holds an unpaired surrogate
     */
    public static String encodePath(String path) throws CharacterCodingException {
        return encode(path, false);
    }

    private static String encode(String input, boolean encodeSlash) throws CharacterCodingException {
        if (input == null || input.isEmpty()) {
            return "";
        }

        ByteBuffer bytes = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .encode(CharBuffer.wrap(input));

        StringBuilder result = new StringBuilder(bytes.remaining() * 3);
        while (bytes.hasRemaining()) {
            byte b = bytes.get();
            char c = (char) (b & 0xFF);
            if (isUnreservedCharacter(c) || (c == '/' && !encodeSlash)) {
                result.append(c);
            } else {
                result.append('%').append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
            }
        }
        return result.toString();
    }

    /**
     * 检查字符是否是 RFC 3986 中的非保留字符
     * 非保留字符: A-Z a-z 0-9 - . _ ~
     */
    private static boolean isUnreservedCharacter(char c) {
        return (c >= 'A' && c <= 'Z') ||
                (c >= 'a' && c <= 'z') ||
                (c >= '0' && c <= '9') ||
                c == '-' || c == '.' || c == '_' || c == '~';
    }
}
