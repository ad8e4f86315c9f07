package win.ixuni.nimbus.client;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Fixed RSA test key under src/test/resources
 */
public final class TestKeys {

    public static final String ISSUER = "signer@nimbus-test.iam.gserviceaccount.com";

    private TestKeys() {
    }

    public static String pem() {
        try (InputStream in = TestKeys.class.getResourceAsStream("/test-key.pem")) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource /test-key.pem");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * The PEM with line breaks written as literal "\n", the way JSON and env vars carry it
     */
    public static String escapedPem() {
        return pem().replace("\n", "\\n");
    }
}
