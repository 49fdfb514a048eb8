package com.example.domainmonitor.monitor;

import com.example.domainmonitor.config.MonitorProperties;
import com.example.domainmonitor.domain.Domain;
import com.example.domainmonitor.domain.MonitorRegistration;
import com.example.domainmonitor.notification.NotificationService;
import com.example.domainmonitor.provider.CheckResult;
import com.example.domainmonitor.provider.ProviderClient;
import com.example.domainmonitor.provider.ProviderException;
import com.example.domainmonitor.repository.DomainRepository;
import com.example.domainmonitor.repository.MonitorRegistrationRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Periodically pulls the latest check of every active, registered domain, stores it and
 * hands the observation to the notification layer.
 *
 * Providers are asked in registration order; the first one with a result for the domain's
 * region wins. A pass that overruns simply delays the next one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatusReconciler {

    private final DomainRepository domainRepository;
    private final MonitorRegistrationRepository registrationRepository;
    private final MonitorOrchestrator orchestrator;
    private final NotificationService notificationService;
    private final MonitorProperties properties;
    private final MeterRegistry meterRegistry;

    @Scheduled(fixedDelayString = "${domain-monitor.reconciler.period-millis:60000}",
            initialDelayString = "${domain-monitor.reconciler.period-millis:60000}")
    public void reconcileAll() {
        if (!properties.getReconciler().isEnabled()) return;

        List<Domain> domains = domainRepository.findActiveWithLiveRegistrations();
        if (domains.isEmpty()) return;

        int observed = 0;
        for (Domain domain : domains) {
            try {
                if (reconcile(domain)) {
                    observed++;
                }
            } catch (Exception e) {
                log.error("Status reconciliation failed for domain {} ({}): {}",
                        domain.getName(), domain.getId(), e.getMessage(), e);
            }
        }
        log.info("Reconciled {} of {} monitored domains", observed, domains.size());
    }

    /**
     * Observes one domain.
     *
     * @return false when no provider had a usable result
     */
    boolean reconcile(Domain domain) {
        Optional<CheckResult> latest = latestCheck(domain);
        if (latest.isEmpty()) {
            log.error("No check result for domain {} in region {} from any provider", domain.getName(), domain.getRegion());
            return false;
        }
        CheckResult result = latest.get();

        boolean checkedBefore = domain.getLastCheckAt() != null;
        boolean wasAvailable = domain.isAvailable();
        domain.recordStatus(result.statusCode(), result.errorCode(), result.errorDescription(),
                result.totalTimeMs(), result.checkedAt());
        Domain saved = domainRepository.save(domain);

        boolean transitioned = checkedBefore && wasAvailable != saved.isAvailable();
        if (transitioned) {
            log.info("Domain {} changed availability: {} -> {}", saved.getName(), wasAvailable, saved.isAvailable());
        }
        notificationService.notifyStatus(saved, transitioned);
        return true;
    }

    private Optional<CheckResult> latestCheck(Domain domain) {
        List<ProviderClient> order = orchestrator.getProviders();
        List<MonitorRegistration> live = registrationRepository
                .findByDomainIdAndState(domain.getId(), MonitorRegistration.State.ACTIVE).stream()
                .filter(MonitorRegistration::isLive)
                .sorted(Comparator.comparingInt(r -> providerRank(order, r.getProvider())))
                .toList();

        for (MonitorRegistration registration : live) {
            Optional<ProviderClient> provider = orchestrator.provider(registration.getProvider());
            if (provider.isEmpty()) {
                continue;
            }
            try {
                Optional<CheckResult> result = provider.get().getLatestCheck(registration.getExternalId(), domain.getRegion());
                count(registration.getProvider(), result.isPresent() ? "result" : "no_result");
                if (result.isPresent()) {
                    return result;
                }
            } catch (ProviderException e) {
                count(registration.getProvider(), "error");
                log.error("[{}] Latest check of monitor {} for domain {} failed: {}",
                        registration.getProvider(), registration.getExternalId(), domain.getName(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static int providerRank(List<ProviderClient> order, String name) {
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i).name().equals(name)) {
                return i;
            }
        }
        return order.size();
    }

    private void count(String provider, String outcome) {
        Counter.builder("domain_monitor.checks.total")
                .tag("provider", provider)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
