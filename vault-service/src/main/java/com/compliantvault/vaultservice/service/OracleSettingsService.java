package com.compliantvault.vaultservice.service;

import com.compliantvault.vaultservice.core.exception.MissingOracleSettingsException;
import com.compliantvault.vaultservice.core.exception.NotOwnerException;
import com.compliantvault.vaultservice.model.OracleSettings;
import com.compliantvault.vaultservice.repository.OracleSettingsRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Checker source, encrypted secrets, billing subscription, DON id and gas limit
 * sent with every dispatch. Only the owner can change them.
 */
@Service
@Slf4j
public class OracleSettingsService {

    public static final int MAX_GAS_LIMIT = 300_000;

    private final OracleSettingsRepository repository;
    private final MutationGuard guard;
    private final String owner;
    private final Resource sourceLocation;
    private final String encryptedSecrets;
    private final long subscriptionId;
    private final String donId;
    private final int gasLimit;

    public OracleSettingsService(OracleSettingsRepository repository,
                                 MutationGuard guard,
                                 @Value("${app.vault.owner}") String owner,
                                 @Value("${app.vault.source-location}") Resource sourceLocation,
                                 @Value("${app.vault.secrets:}") String encryptedSecrets,
                                 @Value("${app.vault.subscription-id}") long subscriptionId,
                                 @Value("${app.vault.don-id}") String donId,
                                 @Value("${app.vault.gas-limit}") int gasLimit) {
        this.repository = repository;
        this.guard = guard;
        this.owner = owner;
        this.sourceLocation = sourceLocation;
        this.encryptedSecrets = encryptedSecrets;
        this.subscriptionId = subscriptionId;
        this.donId = donId;
        this.gasLimit = gasLimit;
    }

    @PostConstruct
    public void seed() {
        guard.run(() -> {
            if (repository.existsById(OracleSettings.SINGLETON_ID)) {
                log.info("Oracle settings already present, keeping stored values");
                return;
            }

            repository.save(OracleSettings.builder()
                    .id(OracleSettings.SINGLETON_ID)
                    .owner(owner)
                    .source(readSource())
                    .encryptedSecrets(encryptedSecrets)
                    .subscriptionId(subscriptionId)
                    .donId(donId)
                    .gasLimit(validGasLimit(gasLimit))
                    .build());

            log.info("Seeded oracle settings for owner {} with subscription {}", owner, subscriptionId);
        });
    }

    public OracleSettings current() {
        return repository.findById(OracleSettings.SINGLETON_ID)
                .orElseThrow(MissingOracleSettingsException::new);
    }

    public OracleSettings updateSource(String caller, String source) {
        return update(caller, "source", s -> s.setSource(source));
    }

    public OracleSettings updateSecrets(String caller, String secrets) {
        return update(caller, "secrets", s -> s.setEncryptedSecrets(secrets));
    }

    public OracleSettings updateSubscriptionId(String caller, long subscription) {
        return update(caller, "subscription", s -> s.setSubscriptionId(subscription));
    }

    public OracleSettings updateDonId(String caller, String don) {
        return update(caller, "DON id", s -> s.setDonId(don));
    }

    public OracleSettings updateGasLimit(String caller, int limit) {
        int valid = validGasLimit(limit);
        return update(caller, "gas limit", s -> s.setGasLimit(valid));
    }

    private OracleSettings update(String caller, String field, Consumer<OracleSettings> change) {
        return guard.execute(() -> {
            OracleSettings settings = current();

            if (caller == null || !caller.equals(settings.getOwner())) {
                log.warn("Rejected update of {} by non-owner {}", field, caller);
                throw new NotOwnerException(caller);
            }

            change.accept(settings);
            OracleSettings saved = repository.save(settings);
            log.info("Oracle {} updated by {}", field, caller);
            return saved;
        });
    }

    private static int validGasLimit(int limit) {
        if (limit <= 0 || limit > MAX_GAS_LIMIT) {
            throw new IllegalArgumentException("Gas limit must be between 1 and " + MAX_GAS_LIMIT + ", got " + limit);
        }
        return limit;
    }

    private String readSource() {
        try {
            return StreamUtils.copyToString(sourceLocation.getInputStream(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read checker source from " + sourceLocation, e);
        }
    }
}
