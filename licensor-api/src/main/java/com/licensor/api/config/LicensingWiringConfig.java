package com.licensor.api.config;

import com.licensor.api.token.LicenseTokenAuthority;
import com.licensor.api.token.RsaKeyStore;
import com.licensor.application.ports.LicenseRepository;
import com.licensor.application.ports.UnitOfWork;
import com.licensor.application.service.LicenseValidationService;
import com.licensor.application.service.SubscriptionLifecycleService;
import com.licensor.domain.license.LicenseKeyCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the framework-free licensing core into Spring.
 * The application services stay plain classes; only this config knows about them.
 */
@Configuration
public class LicensingWiringConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LicenseKeyCodec licenseKeyCodec(LicensingProperties props) {
        return new LicenseKeyCodec(props.license().keyPrefix(), props.license().keySegmentLength());
    }

    /**
     * Loads the RS256 key pair (generating it on first start). Any failure here stops the context.
     */
    @Bean
    public LicenseTokenAuthority licenseTokenAuthority(LicensingProperties props, Clock clock) {
        LicensingProperties.Token token = props.token();
        RsaKeyStore keyStore = new RsaKeyStore(Path.of(token.privateKeyPath()), Path.of(token.publicKeyPath()));
        return LicenseTokenAuthority.fromKeys(keyStore.loadOrCreate(), token.issuer(), token.audience(), token.ttl(), clock);
    }

    @Bean
    public LicenseValidationService licenseValidationService(LicenseRepository repository,
                                                             UnitOfWork unitOfWork,
                                                             LicenseTokenAuthority tokenAuthority,
                                                             LicenseKeyCodec keyCodec,
                                                             Clock clock) {
        return new LicenseValidationService(repository, unitOfWork, tokenAuthority, keyCodec, clock);
    }

    @Bean
    public SubscriptionLifecycleService subscriptionLifecycleService(LicenseRepository repository,
                                                                     UnitOfWork unitOfWork,
                                                                     LicenseKeyCodec keyCodec,
                                                                     Clock clock,
                                                                     LicensingProperties props) {
        return new SubscriptionLifecycleService(repository, unitOfWork, keyCodec, clock,
                props.license().defaultGracePeriodDays());
    }
}
