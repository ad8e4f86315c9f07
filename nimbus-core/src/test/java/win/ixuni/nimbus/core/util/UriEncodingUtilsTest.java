package win.ixuni.nimbus.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.CharacterCodingException;

import static org.junit.jupiter.api.Assertions.*;

class UriEncodingUtilsTest {

    @Test
    @DisplayName("unreserved characters pass through")
    void testUnreserved() throws Exception {
        assertEquals("AZaz09-._~", UriEncodingUtils.encode("AZaz09-._~"));
        assertEquals("", UriEncodingUtils.encode(""));
        assertEquals("", UriEncodingUtils.encode(null));
    }

    @Test
    @DisplayName("reserved characters use upper-case percent escapes, space is %20")
    void testReserved() throws Exception {
        assertEquals("a%20b%2Bc%2Fd%3De%26f%3Fg%25", UriEncodingUtils.encode("a b+c/d=e&f?g%"));
        assertEquals("signer%40example.com", UriEncodingUtils.encode("signer@example.com"));
    }

    @Test
    @DisplayName("non-ASCII characters are escaped as UTF-8 bytes")
    void testUtf8() throws Exception {
        assertEquals("caf%C3%A9", UriEncodingUtils.encode("café"));
        assertEquals("%F0%9F%93%B7", UriEncodingUtils.encode("📷"));
    }

    @Test
    @DisplayName("paths keep '/' and escape each segment")
    void testPath() throws Exception {
        assertEquals("avatars/heidi/400x400.png", UriEncodingUtils.encodePath("avatars/heidi/400x400.png"));
        assertEquals("my%20folder/a%3Fb/c%23d", UriEncodingUtils.encodePath("my folder/a?b/c#d"));
        assertEquals("/leading//double/", UriEncodingUtils.encodePath("/leading//double/"));
    }

    @Test
    @DisplayName("unpaired surrogates cannot be encoded")
    void testUnpairedSurrogate() {
        assertThrows(CharacterCodingException.class, () -> UriEncodingUtils.encodePath("bad\uD800name"));
    }
}
