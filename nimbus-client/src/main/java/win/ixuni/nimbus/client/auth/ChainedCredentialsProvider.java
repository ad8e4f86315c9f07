package win.ixuni.nimbus.client.auth;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.auth.CredentialsProvider;
import win.ixuni.nimbus.core.auth.SigningCredential;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tries each provider in order; the first one that yields a credential wins
 */
public class ChainedCredentialsProvider implements CredentialsProvider {

    private final List<CredentialsProvider> providers;

    public ChainedCredentialsProvider(List<CredentialsProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    @Override
    public Mono<SigningCredential> getCredential() {
        return Flux.fromIterable(providers)
                .concatMap(CredentialsProvider::getCredential)
                .next();
    }

    @Override
    public String getDescription() {
        if (providers.isEmpty()) {
            return "none";
        }
        return providers.stream()
                .map(CredentialsProvider::getDescription)
                .collect(Collectors.joining(" -> "));
    }
}
