package win.ixuni.nimbus.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Nimbus main configuration
 */
@Data
@ConfigurationProperties(prefix = "nimbus")
public class NimbusProperties {

    /**
     * Scheme and host that signed URLs point at
     */
    private String endpoint = "https://storage.googleapis.com";

    /**
     * Project the client acts for
     */
    private String projectId;

    /**
     * Signing configuration
     */
    private SigningConfig signing = new SigningConfig();

    /**
     * Signing configuration
     */
    @Data
    public static class SigningConfig {

        /**
         * Default expiration, in seconds from the time the URL is built
         */
        private long defaultExpires = 300;

        /**
         * Static service account email
         */
        private String issuer;

        /**
         * Static PEM encoded private key (PKCS#8 or PKCS#1)
         */
        private String privateKey;

        /**
         * Path to a service account JSON key file
         * <p>
         * Takes precedence over the static issuer/private key when both are set
         */
        private String keyFile;

        /**
         * Maximum number of parsed private keys kept in memory
         */
        private int keyCacheSize = 64;
    }
}
