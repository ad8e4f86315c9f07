package win.ixuni.nimbus.core.signing;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Fixed RSA test key pair under src/test/resources
 */
final class TestKeys {

    static final String ISSUER = "signer@nimbus-test.iam.gserviceaccount.com";

    private TestKeys() {
    }

    static String pkcs8Pem() {
        return resource("/test-key.pem");
    }

    static String pkcs1Pem() {
        return resource("/test-key-pkcs1.pem");
    }

    static PublicKey publicKey() throws Exception {
        String body = resource("/test-key-public.pem")
                .replace("-----BEGIN PUBLIC KEY-----", "")
                .replace("-----END PUBLIC KEY-----", "")
                .replaceAll("\\s", "");
        return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(body)));
    }

    private static String resource(String name) {
        try (InputStream in = TestKeys.class.getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
