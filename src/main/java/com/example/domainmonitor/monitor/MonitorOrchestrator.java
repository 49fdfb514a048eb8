package com.example.domainmonitor.monitor;

import com.example.domainmonitor.config.MonitorProperties;
import com.example.domainmonitor.domain.Domain;
import com.example.domainmonitor.domain.MonitorRegistration;
import com.example.domainmonitor.provider.ProviderClient;
import com.example.domainmonitor.provider.ProviderException;
import com.example.domainmonitor.region.ResolvedRegion;
import com.example.domainmonitor.repository.MonitorRegistrationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps the remote monitors of every provider in step with local domains.
 *
 * Remote failures are logged and never fail the local operation. Creation and region
 * changes run on the monitor executor; deletion runs on the caller's thread so remote
 * monitors are released before the local rows disappear.
 *
 * Background work for one domain is serialized by a striped lock, and every creation pass
 * re-reads the stored domain first: a pass queued for a region the domain no longer has is
 * dropped, so at most one set of live monitors exists per domain whatever order the
 * workers pick tasks up in.
 */
@Slf4j
@Service
public class MonitorOrchestrator {

    private static final int LOCK_STRIPES = 64;

    private final Executor executor;
    private final List<ProviderClient> providers;
    private final Map<String, ProviderClient> providersByName;
    private final MonitorRegistrationRepository registrationRepository;
    private final MonitorRegistrationStore registrationStore;
    private final Duration creationDelay;
    private final Lock[] domainLocks = new Lock[LOCK_STRIPES];

    @Autowired
    public MonitorOrchestrator(@Qualifier("monitorExecutor") Executor executor,
                               ObjectProvider<ProviderClient> providers,
                               MonitorRegistrationRepository registrationRepository,
                               MonitorRegistrationStore registrationStore,
                               MonitorProperties properties) {
        this(executor, providers.orderedStream().toList(), registrationRepository, registrationStore,
                Duration.ofSeconds(properties.getOrchestrator().getCreationDelaySeconds()));
    }

    MonitorOrchestrator(Executor executor, List<ProviderClient> providers,
                        MonitorRegistrationRepository registrationRepository,
                        MonitorRegistrationStore registrationStore, Duration creationDelay) {
        this.executor = executor;
        this.providers = List.copyOf(providers);
        this.providersByName = this.providers.stream()
                .collect(Collectors.toMap(ProviderClient::name, Function.identity()));
        this.registrationRepository = registrationRepository;
        this.registrationStore = registrationStore;
        this.creationDelay = creationDelay;
        for (int i = 0; i < domainLocks.length; i++) {
            domainLocks[i] = new ReentrantLock();
        }
        log.info("Monitor orchestrator using providers {}", this.providers.stream().map(ProviderClient::name).toList());
    }

    public List<ProviderClient> getProviders() {
        return providers;
    }

    public Optional<ProviderClient> provider(String name) {
        return Optional.ofNullable(providersByName.get(name));
    }

    /**
     * Schedules monitor creation on every provider. Returns immediately.
     */
    public void onDomainCreated(Domain domain) {
        MonitorTarget target = MonitorTarget.of(domain);
        executor.execute(() -> {
            if (pause()) {
                syncMonitors(target);
            }
        });
    }

    /**
     * Releases the live monitors of the old region, then re-creates them for the new one.
     * The domain is not checked between the two steps.
     */
    public void onRegionChanged(Domain domain, String oldRegion, String newRegion) {
        MonitorTarget target = MonitorTarget.of(domain).withRegion(newRegion);
        log.info("Region of domain {} changed from {} to {}, re-creating monitors",
                target.domainId(), oldRegion, newRegion);
        executor.execute(() -> {
            if (pause()) {
                syncMonitors(target);
            }
        });
    }

    /**
     * Propagates the active flag to every live remote monitor.
     */
    public void onActiveChanged(Domain domain, boolean active) {
        String domainId = domain.getId();
        executor.execute(() -> withDomainLock(domainId, () -> {
            // TODO: add a periodic re-sync of remote active flags; a failed update here leaves the
            //  remote monitor checking (or paused) until the owner toggles the domain again.
            for (MonitorRegistration registration : registrationRepository.findByDomainIdAndState(
                    domainId, MonitorRegistration.State.ACTIVE)) {
                ProviderClient provider = providersByName.get(registration.getProvider());
                if (provider == null || registration.getExternalId() == null) {
                    continue;
                }
                try {
                    provider.updateMonitorStatus(registration.getExternalId(), active);
                } catch (ProviderException e) {
                    log.error("[{}] Failed to set monitor {} of domain {} active={}: {}",
                            provider.name(), registration.getExternalId(), domainId, active, e.getMessage());
                }
            }
        }));
    }

    /**
     * Deletes every remote monitor the domain may still hold. Runs synchronously so the
     * caller can remove local rows afterwards; failures are logged as orphans.
     */
    public void onDomainDeleted(Domain domain) {
        List<MonitorRegistration> held = registrationRepository.findByDomainIdAndStateIn(domain.getId(),
                List.of(MonitorRegistration.State.ACTIVE, MonitorRegistration.State.ORPHANED_PENDING_DELETE));
        for (MonitorRegistration registration : held) {
            if (registration.holdsRemoteMonitor()) {
                deleteRemote(registration.getProvider(), registration.getExternalId(), domain.getId());
            }
        }
    }

    /**
     * Replaces the domain's monitors with a fresh set for the target region, unless the
     * stored domain is gone or has moved to another region since the pass was queued.
     */
    void syncMonitors(MonitorTarget target) {
        withDomainLock(target.domainId(), () -> {
            Optional<Domain> stored = registrationStore.findDomain(target.domainId());
            if (stored.isEmpty()) {
                log.info("Domain {} was deleted, skipping monitor creation", target.domainId());
                return;
            }
            if (!target.region().equals(stored.get().getRegion())) {
                log.info("Skipping monitor creation for domain {} in {}: region is now {}",
                        target.domainId(), target.region(), stored.get().getRegion());
                return;
            }
            retireRegistrations(target.domainId());
            createMonitors(target.withActive(stored.get().isActive()));
        });
    }

    /**
     * Creates a monitor on every provider and persists all outcomes together. If that write
     * fails every monitor created in this pass is deleted again.
     */
    void createMonitors(MonitorTarget target) {
        List<MonitorRegistration> outcomes = new ArrayList<>(providers.size());
        for (ProviderClient provider : providers) {
            ResolvedRegion resolved = provider.regions().resolve(target.region());
            List<String> submitted = resolved.submittedRegions();
            MonitorRegistration registration = MonitorRegistration.builder()
                    .domainId(target.domainId())
                    .provider(provider.name())
                    .regions(String.join(",", submitted))
                    .state(MonitorRegistration.State.PENDING)
                    .build();
            try {
                registration.setExternalId(provider.createMonitor(target.url(), target.name(), submitted));
                registration.setState(MonitorRegistration.State.ACTIVE);
            } catch (ProviderException e) {
                log.error("[{}] Failed to create monitor for domain {} ({}): {}",
                        provider.name(), target.domainId(), target.name(), e.getMessage());
            }
            if (registration.getExternalId() != null && !target.active()) {
                try {
                    provider.updateMonitorStatus(registration.getExternalId(), false);
                } catch (ProviderException e) {
                    log.error("[{}] Failed to pause new monitor {} of inactive domain {}: {}",
                            provider.name(), registration.getExternalId(), target.domainId(), e.getMessage());
                }
            }
            outcomes.add(registration);
        }

        try {
            registrationStore.recordCreated(target.domainId(), target.region(), outcomes);
            log.info("Recorded {} monitor registrations for domain {}", outcomes.size(), target.domainId());
        } catch (RuntimeException e) {
            log.error("Could not record monitors of domain {}, deleting the created ones: {}",
                    target.domainId(), e.getMessage());
            for (MonitorRegistration registration : outcomes) {
                if (registration.getExternalId() != null) {
                    deleteRemote(registration.getProvider(), registration.getExternalId(), target.domainId());
                }
            }
        }
    }

    /**
     * Deletes the remote monitors of a domain before new ones are created. Monitors that
     * could not be deleted stay recorded as orphans so domain deletion retries them.
     */
    void retireRegistrations(String domainId) {
        List<MonitorRegistration> current = registrationRepository.findByDomainIdAndStateIn(domainId,
                List.of(MonitorRegistration.State.ACTIVE, MonitorRegistration.State.PENDING));
        for (MonitorRegistration registration : current) {
            if (registration.getExternalId() == null
                    || deleteRemote(registration.getProvider(), registration.getExternalId(), domainId)) {
                registrationStore.updateState(registration, MonitorRegistration.State.DELETED);
            } else {
                registrationStore.updateState(registration, MonitorRegistration.State.ORPHANED_PENDING_DELETE);
            }
        }
    }

    private boolean deleteRemote(String providerName, String externalId, String domainId) {
        ProviderClient provider = providersByName.get(providerName);
        if (provider == null) {
            log.warn("orphaned remote monitor: provider={} externalId={} domain={} (provider not configured)",
                    providerName, externalId, domainId);
            return false;
        }
        try {
            provider.deleteMonitor(externalId);
            return true;
        } catch (ProviderException e) {
            log.warn("orphaned remote monitor: provider={} externalId={} domain={} error={}",
                    providerName, externalId, domainId, e.getMessage());
            return false;
        }
    }

    private void withDomainLock(String domainId, Runnable work) {
        Lock lock = domainLocks[Math.floorMod(domainId.hashCode(), domainLocks.length)];
        lock.lock();
        try {
            work.run();
        } finally {
            lock.unlock();
        }
    }

    private boolean pause() {
        if (creationDelay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(creationDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Monitor creation interrupted before it started");
            return false;
        }
    }

    /**
     * Snapshot of the domain fields creation needs, taken before the task is queued.
     */
    record MonitorTarget(String domainId, String name, String url, String region, boolean active) {

        static MonitorTarget of(Domain domain) {
            return new MonitorTarget(domain.getId(), domain.getName(), domain.getUrl(), domain.getRegion(),
                    domain.isActive());
        }

        MonitorTarget withRegion(String newRegion) {
            return new MonitorTarget(domainId, name, url, newRegion, active);
        }

        MonitorTarget withActive(boolean nowActive) {
            return new MonitorTarget(domainId, name, url, region, nowActive);
        }
    }
}
