package win.ixuni.nimbus.client.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import win.ixuni.nimbus.client.TestKeys;
import win.ixuni.nimbus.core.auth.SigningCredential;
import win.ixuni.nimbus.core.exception.SigningUnavailableException;
import win.ixuni.nimbus.core.signing.SigningKeys;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class KeyFileCredentialsProviderTest {

    @TempDir
    Path tempDir;

    private final SigningKeys signingKeys = new SigningKeys();

    private Path writeKeyFile(String json) throws Exception {
        Path file = tempDir.resolve("service-account.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    private static String keyFileJson(String clientEmail, String privateKey) {
        return "{\n" +
                "  \"type\": \"service_account\",\n" +
                "  \"project_id\": \"nimbus-test\",\n" +
                "  \"private_key_id\": \"0123456789abcdef\",\n" +
                (privateKey != null ? "  \"private_key\": \"" + privateKey + "\",\n" : "") +
                (clientEmail != null ? "  \"client_email\": \"" + clientEmail + "\",\n" : "") +
                "  \"token_uri\": \"https://oauth2.googleapis.com/token\"\n" +
                "}";
    }

    @Test
    @DisplayName("client_email and private_key are read from the key file")
    void testLoadsKeyFile() throws Exception {
        Path file = writeKeyFile(keyFileJson(TestKeys.ISSUER, TestKeys.escapedPem()));

        SigningCredential credential = new KeyFileCredentialsProvider(file, signingKeys).getCredential().block();

        assertNotNull(credential);
        assertEquals(TestKeys.ISSUER, credential.getIssuer());
        assertArrayEquals(signingKeys.parse(TestKeys.pem()).getEncoded(), credential.getPrivateKey().getEncoded());
    }

    @Test
    @DisplayName("the key file is read once and then cached")
    void testCached() throws Exception {
        Path file = writeKeyFile(keyFileJson(TestKeys.ISSUER, TestKeys.escapedPem()));
        KeyFileCredentialsProvider provider = new KeyFileCredentialsProvider(file, signingKeys);

        SigningCredential first = provider.getCredential().block();
        Files.delete(file);
        SigningCredential second = provider.getCredential().block();

        assertSame(first, second);
    }

    @Test
    @DisplayName("a missing key file yields no credential")
    void testMissingFile() {
        KeyFileCredentialsProvider provider =
                new KeyFileCredentialsProvider(tempDir.resolve("absent.json"), signingKeys);

        assertNull(provider.getCredential().block());
    }

    @Test
    @DisplayName("malformed JSON is signing-unavailable")
    void testMalformedJson() throws Exception {
        Path file = writeKeyFile("{ not json");

        assertThrows(SigningUnavailableException.class,
                () -> new KeyFileCredentialsProvider(file, signingKeys).getCredential().block());
    }

    @Test
    @DisplayName("key files without client_email or private_key are signing-unavailable")
    void testIncompleteKeyFile() throws Exception {
        Path noEmail = writeKeyFile(keyFileJson(null, TestKeys.escapedPem()));
        assertThrows(SigningUnavailableException.class,
                () -> new KeyFileCredentialsProvider(noEmail, signingKeys).getCredential().block());

        Path noKey = writeKeyFile(keyFileJson(TestKeys.ISSUER, null));
        assertThrows(SigningUnavailableException.class,
                () -> new KeyFileCredentialsProvider(noKey, signingKeys).getCredential().block());
    }

    @Test
    @DisplayName("description names the key file")
    void testDescription() {
        Path file = tempDir.resolve("sa.json");

        assertEquals("key-file(" + file + ")", new KeyFileCredentialsProvider(file, signingKeys).getDescription());
    }
}
