package com.example.domainmonitor.repository;

import com.example.domainmonitor.domain.Domain;
import com.example.domainmonitor.domain.MonitorRegistration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface DomainRepository extends JpaRepository<Domain, String> {

    List<Domain> findByUserId(String userId);

    Optional<Domain> findByIdAndUserId(String id, String userId);

    List<Domain> findByUserIdAndIdIn(String userId, Collection<String> ids);

    long countByUserId(String userId);

    @Query("SELECT d FROM Domain d WHERE d.active = true AND EXISTS ("
            + "SELECT r.id FROM MonitorRegistration r WHERE r.domainId = d.id "
            + "AND r.state = :state AND r.externalId IS NOT NULL)")
    List<Domain> findActiveWithRegistrationState(MonitorRegistration.State state);

    /** Active domains with at least one live provider registration. */
    default List<Domain> findActiveWithLiveRegistrations() {
        return findActiveWithRegistrationState(MonitorRegistration.State.ACTIVE);
    }

    @Modifying
    @Transactional
    @Query("DELETE FROM Domain d WHERE d.id IN :ids")
    int deleteByIdIn(Collection<String> ids);
}
