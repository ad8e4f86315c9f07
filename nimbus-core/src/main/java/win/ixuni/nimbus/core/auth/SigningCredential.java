package win.ixuni.nimbus.core.auth;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.security.PrivateKey;

/**
 * Signing credential
 * <p>
 * Service account identity plus the RSA private key that signs on its behalf.
 */
@Value
@Builder
public class SigningCredential {

    /**
     * Service account email, embedded in the URL as GoogleAccessId
     */
    String issuer;

    /**
     * RSA private key
     */
    @ToString.Exclude
    PrivateKey privateKey;
}
