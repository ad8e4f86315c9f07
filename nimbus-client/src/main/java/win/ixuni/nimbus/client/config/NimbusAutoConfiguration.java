package win.ixuni.nimbus.client.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;
import win.ixuni.nimbus.client.auth.ChainedCredentialsProvider;
import win.ixuni.nimbus.client.auth.KeyFileCredentialsProvider;
import win.ixuni.nimbus.client.auth.StaticCredentialsProvider;
import win.ixuni.nimbus.client.service.SignedUrlService;
import win.ixuni.nimbus.core.auth.CredentialsProvider;
import win.ixuni.nimbus.core.config.NimbusProperties;
import win.ixuni.nimbus.core.signing.SignedUrlBuilder;
import win.ixuni.nimbus.core.signing.SigningKeys;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Nimbus 自动配置
 * <p>
 * Credential chain order: key file, then static issuer/private key.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(NimbusProperties.class)
public class NimbusAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SigningKeys signingKeys(NimbusProperties properties) {
        return new SigningKeys(properties.getSigning().getKeyCacheSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public SignedUrlBuilder signedUrlBuilder(NimbusProperties properties) {
        return new SignedUrlBuilder(properties.getEndpoint(),
                properties.getSigning().getDefaultExpires(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialsProvider credentialsProvider(NimbusProperties properties, SigningKeys signingKeys) {
        NimbusProperties.SigningConfig signing = properties.getSigning();
        List<CredentialsProvider> providers = new ArrayList<>();
        if (StringUtils.hasText(signing.getKeyFile())) {
            providers.add(new KeyFileCredentialsProvider(Path.of(signing.getKeyFile()), signingKeys));
        }
        providers.add(new StaticCredentialsProvider(signing, signingKeys));

        ChainedCredentialsProvider chain = new ChainedCredentialsProvider(providers);
        log.info("Signing credentials chain: {}", chain.getDescription());
        return chain;
    }

    @Bean
    @ConditionalOnMissingBean
    public SignedUrlService signedUrlService(SignedUrlBuilder signedUrlBuilder,
                                             CredentialsProvider credentialsProvider,
                                             SigningKeys signingKeys) {
        return new SignedUrlService(signedUrlBuilder, credentialsProvider, signingKeys);
    }
}
