package com.company.podwatch.settings;

import com.company.podwatch.event.SettingsUpdatedEvent;
import com.company.podwatch.exception.SettingsValidationException;
import com.company.podwatch.repository.SettingsRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the runtime configuration. Readers always get a private copy; updates are validated and
 * persisted before they become visible.
 */
@Service
@Slf4j
public class SettingsService {

    private final SettingsRepository repository;
    private final PasswordEncoder passwordEncoder;
    private final ApplicationEventPublisher eventPublisher;
    private final String initialAdminPassword;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private PodWatchSettings settings;
    private String defaultPasswordHash;

    public SettingsService(SettingsRepository repository,
                           PasswordEncoder passwordEncoder,
                           ApplicationEventPublisher eventPublisher,
                           @Value("${podwatch.admin.initial-password:tiesseadm}") String initialAdminPassword) {
        this.repository = repository;
        this.passwordEncoder = passwordEncoder;
        this.eventPublisher = eventPublisher;
        this.initialAdminPassword = initialAdminPassword;
    }

    @PostConstruct
    public void load() {
        lock.writeLock().lock();
        try {
            defaultPasswordHash = passwordEncoder.encode(initialAdminPassword);
            settings = loadOrDefaults();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private PodWatchSettings loadOrDefaults() {
        Optional<PodWatchSettings> stored;
        try {
            stored = repository.load();
        } catch (SettingsValidationException e) {
            log.warn("Stored settings unreadable, falling back to defaults: {}", e.getMessage());
            return persistDefaults();
        }

        if (stored.isEmpty()) {
            log.info("No stored settings, initializing defaults");
            return persistDefaults();
        }

        PodWatchSettings merged = SettingsDefaults.mergeWithDefaults(stored.get(), defaultPasswordHash);
        List<String> errors = SettingsValidator.validate(merged);
        if (!errors.isEmpty()) {
            log.warn("Stored settings invalid ({}), falling back to defaults", errors);
            return persistDefaults();
        }
        if (!merged.equals(stored.get())) {
            repository.save(merged);
        }
        log.info("Settings loaded: {} namespaces, refresh every {}s, {} alert destinations",
                merged.getMonitoring().getNamespaces().size(),
                merged.getMonitoring().getRefreshIntervalSeconds(),
                merged.getDestinations().getTargets().size());
        return merged;
    }

    private PodWatchSettings persistDefaults() {
        PodWatchSettings defaults = SettingsDefaults.defaults(defaultPasswordHash);
        repository.save(defaults);
        return defaults;
    }

    /**
     * Snapshot of the current settings, safe to use for a whole poll cycle
     */
    public PodWatchSettings current() {
        lock.readLock().lock();
        try {
            return SettingsCodec.copy(settings);
        } finally {
            lock.readLock().unlock();
        }
    }

    public PodWatchSettings currentMasked() {
        return SettingsMasking.mask(current());
    }

    /**
     * Merges {@code incoming} with defaults, keeps masked secrets, validates and persists it, then makes it
     * current. On any failure the previous settings stay in effect.
     *
     * @param newAdminPassword optional plain-text password replacing the admin credential
     */
    public PodWatchSettings update(PodWatchSettings incoming, String newAdminPassword) {
        lock.writeLock().lock();
        try {
            PodWatchSettings candidate = SettingsCodec.copy(incoming);
            SettingsMasking.retainSecrets(candidate, settings);
            candidate = SettingsDefaults.mergeWithDefaults(candidate, settings.getMonitoring().getAdminPasswordHash());
            if (newAdminPassword != null && !newAdminPassword.isBlank()) {
                candidate.getMonitoring().setAdminPasswordHash(passwordEncoder.encode(newAdminPassword));
            }
            SettingsValidator.requireValid(candidate);

            repository.save(candidate);
            settings = candidate;
            log.info("Settings updated: {} namespaces, refresh every {}s",
                    candidate.getMonitoring().getNamespaces().size(),
                    candidate.getMonitoring().getRefreshIntervalSeconds());
        } finally {
            lock.writeLock().unlock();
        }
        PodWatchSettings published = current();
        eventPublisher.publishEvent(new SettingsUpdatedEvent(published));
        return published;
    }

    public boolean verifyCredential(String credential) {
        if (credential == null || credential.isEmpty()) {
            return false;
        }
        String hash;
        lock.readLock().lock();
        try {
            hash = settings.getMonitoring().getAdminPasswordHash();
        } finally {
            lock.readLock().unlock();
        }
        try {
            return passwordEncoder.matches(credential, hash);
        } catch (IllegalArgumentException e) {
            log.warn("Stored admin credential hash is malformed");
            return false;
        }
    }
}
