package com.example.domainmonitor.repository;

import com.example.domainmonitor.domain.MonitorRegistration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public interface MonitorRegistrationRepository extends JpaRepository<MonitorRegistration, String> {

    List<MonitorRegistration> findByDomainId(String domainId);

    List<MonitorRegistration> findByDomainIdAndState(String domainId, MonitorRegistration.State state);

    List<MonitorRegistration> findByDomainIdAndStateIn(String domainId, Collection<MonitorRegistration.State> states);

    List<MonitorRegistration> findByState(MonitorRegistration.State state);

    @Modifying
    @Transactional
    @Query("DELETE FROM MonitorRegistration r WHERE r.domainId IN :domainIds")
    int deleteByDomainIdIn(Collection<String> domainIds);
}
