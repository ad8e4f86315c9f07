package win.ixuni.nimbus.core.signing;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.nimbus.core.exception.SigningUnavailableException;

import java.io.ByteArrayOutputStream;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PEM private key parser with a bounded cache of parsed keys
 * <p>
 * Accepts PKCS#8 ("BEGIN PRIVATE KEY") and PKCS#1 ("BEGIN RSA PRIVATE KEY") RSA keys.
 * Literal "\n" sequences, as found in JSON key files and environment variables, are treated as line breaks.
 * <p>
 * Parsed keys are immutable and the cache is a concurrent map, so one instance can be shared by all callers.
 */
@Slf4j
public class SigningKeys {

    public static final int DEFAULT_CACHE_SIZE = 64;

    private static final Pattern PEM_PATTERN = Pattern.compile(
            "-----BEGIN ([A-Z ]+)-----([A-Za-z0-9+/=\\s]*)-----END \\1-----");

    // AlgorithmIdentifier for rsaEncryption (1.2.840.113549.1.1.1) with NULL parameters, preceded by version 0
    private static final byte[] PKCS8_RSA_PREFIX = {
            0x02, 0x01, 0x00,
            0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86, (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    private final Map<String, PrivateKey> cache = new ConcurrentHashMap<>();
    private final int maxCacheSize;

    public SigningKeys() {
        this(DEFAULT_CACHE_SIZE);
    }

    public SigningKeys(int maxCacheSize) {
        this.maxCacheSize = Math.max(1, maxCacheSize);
    }

    /**
     * Parse PEM text into an RSA private key
     *
     * @param pem PEM encoded key
     * @return the parsed key, shared with earlier calls for the same text
     * @throws SigningUnavailableException if the text is empty or not a usable RSA key
     */
    public PrivateKey parse(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new SigningUnavailableException("Private key is empty");
        }
        String normalized = pem.replace("\\n", "\n").trim();

        PrivateKey cached = cache.get(normalized);
        if (cached != null) {
            return cached;
        }

        PrivateKey key = decode(normalized);
        return cacheKey(normalized, key);
    }

    // Inserts are serialized so the size check and the put cannot interleave; lookups stay lock-free
    private synchronized PrivateKey cacheKey(String normalized, PrivateKey key) {
        PrivateKey existing = cache.get(normalized);
        if (existing != null) {
            return existing;
        }
        if (cache.size() >= maxCacheSize) {
            log.debug("Signing key cache reached {} entries, clearing", maxCacheSize);
            cache.clear();
        }
        cache.put(normalized, key);
        return key;
    }

    int cachedKeyCount() {
        return cache.size();
    }

    private PrivateKey decode(String pem) {
        Matcher matcher = PEM_PATTERN.matcher(pem);
        if (!matcher.find()) {
            throw new SigningUnavailableException("Private key is not PEM encoded");
        }
        String type = matcher.group(1);

        byte[] der;
        try {
            der = Base64.getMimeDecoder().decode(matcher.group(2));
        } catch (IllegalArgumentException e) {
            throw new SigningUnavailableException("Private key is not valid base64", e);
        }

        byte[] pkcs8;
        switch (type) {
            case "PRIVATE KEY":
                pkcs8 = der;
                break;
            case "RSA PRIVATE KEY":
                pkcs8 = wrapPkcs1(der);
                break;
            default:
                throw new SigningUnavailableException("Unsupported private key type: " + type);
        }

        try {
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
        } catch (GeneralSecurityException e) {
            throw new SigningUnavailableException("Private key is not a valid RSA key", e);
        }
    }

    /**
     * Wrap a PKCS#1 RSAPrivateKey into a PKCS#8 PrivateKeyInfo
     */
    static byte[] wrapPkcs1(byte[] pkcs1) {
        ByteArrayOutputStream octetString = new ByteArrayOutputStream();
        octetString.write(0x04);
        writeLength(octetString, pkcs1.length);
        octetString.writeBytes(pkcs1);

        int bodyLength = PKCS8_RSA_PREFIX.length + octetString.size();
        ByteArrayOutputStream info = new ByteArrayOutputStream();
        info.write(0x30);
        writeLength(info, bodyLength);
        info.writeBytes(PKCS8_RSA_PREFIX);
        info.writeBytes(octetString.toByteArray());
        return info.toByteArray();
    }

    // DER definite length: short form below 128, otherwise 0x80 | byte count followed by big-endian bytes
    private static void writeLength(ByteArrayOutputStream out, int length) {
        if (length < 0x80) {
            out.write(length);
            return;
        }
        int byteCount = 0;
        for (int remaining = length; remaining > 0; remaining >>>= 8) {
            byteCount++;
        }
        out.write(0x80 | byteCount);
        for (int shift = (byteCount - 1) * 8; shift >= 0; shift -= 8) {
            out.write((length >>> shift) & 0xFF);
        }
    }
}
