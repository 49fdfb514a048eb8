package com.example.domainmonitor.monitor;

import com.example.domainmonitor.config.MonitorProperties;
import com.example.domainmonitor.domain.Domain;
import com.example.domainmonitor.monitor.DomainOperationException.Reason;
import com.example.domainmonitor.region.RegionTables;
import com.example.domainmonitor.repository.DomainRepository;
import com.example.domainmonitor.repository.MonitorRegistrationRepository;
import com.example.domainmonitor.repository.NotificationHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Local authority for the domains a user monitors.
 *
 * Every change is persisted first; the orchestrator then brings the remote monitors in
 * line. Deletion releases remote monitors before the local rows are removed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DomainService {

    private final DomainRepository domainRepository;
    private final MonitorRegistrationRepository registrationRepository;
    private final NotificationHistoryRepository historyRepository;
    private final MonitorOrchestrator orchestrator;
    private final MonitorProperties properties;
    private final TransactionTemplate transactionTemplate;

    public List<Domain> listDomains(String userId) {
        return domainRepository.findByUserId(userId);
    }

    public Domain getDomain(String userId, String domainId) {
        return domainRepository.findByIdAndUserId(domainId, userId)
                .orElseThrow(() -> notFound(domainId));
    }

    /**
     * Validates and stores a new domain, then schedules its remote monitors.
     *
     * @throws DomainOperationException if the name, region or interval is invalid, the owner
     *                                  already monitors the host in that region, or the limit is reached
     */
    public Domain addDomain(String userId, DomainRequest request) {
        Domain domain = validateNew(userId, request, existingKeys(userId), domainRepository.countByUserId(userId));
        Domain saved = domainRepository.save(domain);
        log.info("Added domain {} ({}, region {}) for user {}", saved.getName(), saved.getId(), saved.getRegion(), userId);
        orchestrator.onDomainCreated(saved);
        return saved;
    }

    /**
     * Adds up to {@code maxBatchSize} domains. Each item succeeds or fails on its own,
     * including when storing it fails; repeats of an earlier item in the same batch fail as
     * duplicates.
     */
    public BatchAddResult addDomains(String userId, List<DomainRequest> requests) {
        int maxBatch = properties.getDomains().getMaxBatchSize();
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("No domains provided");
        }
        if (requests.size() > maxBatch) {
            throw new IllegalArgumentException("Too many domains in batch. Maximum allowed is " + maxBatch);
        }

        Set<String> knownKeys = existingKeys(userId);
        long count = domainRepository.countByUserId(userId);
        List<BatchAddResult.Item> succeeded = new ArrayList<>();
        List<BatchAddResult.Item> failed = new ArrayList<>();

        for (DomainRequest request : requests) {
            try {
                Domain saved = domainRepository.save(validateNew(userId, request, knownKeys, count));
                knownKeys.add(DomainNames.key(saved.getName(), saved.getRegion()));
                count++;
                succeeded.add(BatchAddResult.Item.success(request.name(), saved.getRegion(), saved.getId()));
                orchestrator.onDomainCreated(saved);
            } catch (DomainOperationException e) {
                failed.add(BatchAddResult.Item.failure(request.name(), request.region(), e.getReason(), e.getMessage()));
            } catch (DataAccessException e) {
                log.error("Failed to store domain {} for user {}: {}", request.name(), userId, e.getMessage());
                failed.add(BatchAddResult.Item.failure(request.name(), request.region(), Reason.PERSISTENCE,
                        "Could not store domain"));
            }
        }

        log.info("Batch add for user {}: {} of {} domains added", userId, succeeded.size(), requests.size());
        return new BatchAddResult(requests.size(), succeeded.size(), succeeded, failed);
    }

    /**
     * Applies the non-null fields of the update and propagates active and region changes
     * to the providers.
     */
    public Domain updateDomain(String userId, String domainId, DomainUpdate update) {
        Domain domain = getDomain(userId, domainId);
        String oldRegion = domain.getRegion();
        boolean oldActive = domain.isActive();

        if (update.interval() != null) {
            domain.setInterval(validInterval(update.interval()));
        }
        if (update.region() != null) {
            domain.setRegion(validRegion(update.region()));
        }
        if (update.active() != null) {
            domain.setActive(update.active());
        }

        boolean regionChanged = !Objects.equals(oldRegion, domain.getRegion());
        if (regionChanged && existingKeys(userId, domainId).contains(DomainNames.key(domain.getName(), domain.getRegion()))) {
            throw new DomainOperationException(Reason.DUPLICATE,
                    domain.getName() + " is already monitored in region " + domain.getRegion());
        }

        Domain saved = domainRepository.save(domain);
        if (regionChanged) {
            orchestrator.onRegionChanged(saved, oldRegion, saved.getRegion());
        } else if (oldActive != saved.isActive()) {
            orchestrator.onActiveChanged(saved, saved.isActive());
        }
        return saved;
    }

    /**
     * Sets the active flag on all of the owner's domains.
     *
     * @return number of domains whose flag changed
     */
    public int updateAllDomains(String userId, boolean active) {
        List<Domain> changed = domainRepository.findByUserId(userId).stream()
                .filter(d -> d.isActive() != active)
                .toList();
        changed.forEach(d -> d.setActive(active));
        domainRepository.saveAll(changed);
        changed.forEach(d -> orchestrator.onActiveChanged(d, active));
        log.info("Set active={} on {} domains of user {}", active, changed.size(), userId);
        return changed.size();
    }

    public void deleteDomain(String userId, String domainId) {
        Domain domain = getDomain(userId, domainId);
        orchestrator.onDomainDeleted(domain);
        removeLocally(List.of(domain.getId()));
        log.info("Deleted domain {} ({}) of user {}", domain.getName(), domainId, userId);
    }

    /**
     * Deletes up to {@code maxBatchSize} domains by id. Repeated ids count once.
     */
    public BatchDeleteResult deleteDomains(String userId, Collection<String> domainIds) {
        int maxBatch = properties.getDomains().getMaxBatchSize();
        Set<String> requested = new LinkedHashSet<>(domainIds);
        if (requested.isEmpty()) {
            throw new IllegalArgumentException("No domain ids provided");
        }
        if (requested.size() > maxBatch) {
            throw new IllegalArgumentException("Too many domain ids. Maximum allowed is " + maxBatch);
        }

        List<Domain> found = domainRepository.findByUserIdAndIdIn(userId, requested);
        found.forEach(orchestrator::onDomainDeleted);
        List<String> foundIds = found.stream().map(Domain::getId).toList();
        if (!foundIds.isEmpty()) {
            removeLocally(foundIds);
        }

        List<String> failed = requested.stream().filter(id -> !foundIds.contains(id)).toList();
        log.info("Batch delete for user {}: {} deleted, {} not found", userId, foundIds.size(), failed.size());
        return new BatchDeleteResult(foundIds.size(), failed);
    }

    public int deleteAllDomains(String userId) {
        List<Domain> domains = domainRepository.findByUserId(userId);
        domains.forEach(orchestrator::onDomainDeleted);
        if (!domains.isEmpty()) {
            removeLocally(domains.stream().map(Domain::getId).toList());
        }
        log.info("Deleted all {} domains of user {}", domains.size(), userId);
        return domains.size();
    }

    private void removeLocally(List<String> domainIds) {
        transactionTemplate.executeWithoutResult(status -> {
            historyRepository.deleteByDomainIdIn(domainIds);
            registrationRepository.deleteByDomainIdIn(domainIds);
            domainRepository.deleteByIdIn(domainIds);
        });
    }

    private Domain validateNew(String userId, DomainRequest request, Set<String> knownKeys, long currentCount) {
        String hostname = DomainNames.hostname(request.name());
        if (!DomainNames.isValid(hostname)) {
            throw new DomainOperationException(Reason.INVALID_NAME, "Invalid domain name: " + request.name());
        }
        String region = validRegion(request.region());
        int interval = request.interval() == null || request.interval() == 0
                ? properties.getDomains().getDefaultInterval()
                : validInterval(request.interval());

        int limit = properties.getDomains().getLimitPerUser();
        if (currentCount >= limit) {
            throw new DomainOperationException(Reason.LIMIT_REACHED, "Domain limit of " + limit + " reached");
        }
        if (knownKeys.contains(DomainNames.key(hostname, region))) {
            throw new DomainOperationException(Reason.DUPLICATE,
                    hostname + " is already monitored in region " + region);
        }

        return Domain.builder()
                .userId(userId)
                .name(hostname)
                .url(DomainNames.url(request.name(), hostname))
                .region(region)
                .interval(interval)
                .active(true)
                .build();
    }

    private String validRegion(String region) {
        return RegionTables.canonicalCode(region)
                .orElseThrow(() -> new DomainOperationException(Reason.INVALID_REGION,
                        "Unsupported region: " + region + ". Supported: " + RegionTables.supportedCodes()));
    }

    private int validInterval(int interval) {
        List<Integer> allowed = properties.getDomains().getAllowedIntervals();
        if (!allowed.contains(interval)) {
            throw new DomainOperationException(Reason.INVALID_INTERVAL,
                    "Interval must be one of " + allowed + " minutes");
        }
        return interval;
    }

    private Set<String> existingKeys(String userId) {
        return existingKeys(userId, null);
    }

    private Set<String> existingKeys(String userId, String excludedDomainId) {
        Set<String> keys = new HashSet<>();
        for (Domain domain : domainRepository.findByUserId(userId)) {
            if (!domain.getId().equals(excludedDomainId)) {
                keys.add(DomainNames.key(domain.getName(), domain.getRegion()));
            }
        }
        return keys;
    }

    private static DomainOperationException notFound(String domainId) {
        return new DomainOperationException(Reason.NOT_FOUND, "Domain not found: " + domainId);
    }
}
