package win.ixuni.nimbus.core.auth;

import reactor.core.publisher.Mono;

/**
 * Credentials provider interface
 * <p>
 * Provides ambient signing credentials from various sources (configuration, key files, etc.).
 * Consulted only when the caller did not supply an explicit issuer or key.
 */
public interface CredentialsProvider {

    /**
     * Retrieve the signing credential
     *
     * @return the credential, or empty if this provider has none
     */
    Mono<SigningCredential> getCredential();

    /**
     * Short description used in log output
     */
    default String getDescription() {
        return getClass().getSimpleName();
    }
}
