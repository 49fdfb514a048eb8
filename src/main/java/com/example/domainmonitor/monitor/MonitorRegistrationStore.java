package com.example.domainmonitor.monitor;

import com.example.domainmonitor.domain.Domain;
import com.example.domainmonitor.domain.MonitorRegistration;
import com.example.domainmonitor.repository.DomainRepository;
import com.example.domainmonitor.repository.MonitorRegistrationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Transactional writes of registration rows.
 */
@Component
@RequiredArgsConstructor
public class MonitorRegistrationStore {

    private final DomainRepository domainRepository;
    private final MonitorRegistrationRepository registrationRepository;

    public Optional<Domain> findDomain(String domainId) {
        return domainRepository.findById(domainId);
    }

    /**
     * Persists the outcome of one creation pass, all rows or none.
     *
     * @param region region the monitors were created for
     * @throws IllegalStateException if the domain was deleted or moved to another region while
     *                               its monitors were being created
     */
    @Transactional
    public List<MonitorRegistration> recordCreated(String domainId, String region,
                                                   List<MonitorRegistration> registrations) {
        Domain domain = domainRepository.findById(domainId)
                .orElseThrow(() -> new IllegalStateException("Domain " + domainId + " no longer exists"));
        if (!region.equals(domain.getRegion())) {
            throw new IllegalStateException("Domain " + domainId + " moved from " + region + " to "
                    + domain.getRegion() + " while its monitors were created");
        }
        return registrationRepository.saveAll(registrations);
    }

    @Transactional
    public void updateState(MonitorRegistration registration, MonitorRegistration.State state) {
        registration.setState(state);
        registrationRepository.save(registration);
    }
}
