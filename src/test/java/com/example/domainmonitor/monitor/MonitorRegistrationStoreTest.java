package com.example.domainmonitor.monitor;

import com.example.domainmonitor.domain.Domain;
import com.example.domainmonitor.domain.MonitorRegistration;
import com.example.domainmonitor.repository.DomainRepository;
import com.example.domainmonitor.repository.MonitorRegistrationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
class MonitorRegistrationStoreTest {

    @Mock
    private DomainRepository domainRepository;

    @Mock
    private MonitorRegistrationRepository registrationRepository;

    @InjectMocks
    private MonitorRegistrationStore store;

    @Test
    void recordsRegistrationsWhileTheRegionIsUnchanged() {
        // given
        List<MonitorRegistration> registrations = List.of(registration());
        given(domainRepository.findById("d1")).willReturn(Optional.of(domain("KR")));
        given(registrationRepository.saveAll(registrations)).willReturn(registrations);

        // when
        List<MonitorRegistration> saved = store.recordCreated("d1", "KR", registrations);

        // then
        assertThat(saved).isSameAs(registrations);
    }

    @Test
    void rejectsRegistrationsForARegionTheDomainLeft() {
        // given
        given(domainRepository.findById("d1")).willReturn(Optional.of(domain("KR")));

        // when / then
        assertThatThrownBy(() -> store.recordCreated("d1", "CN", List.of(registration())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("moved from CN to KR");
        then(registrationRepository).should(never()).saveAll(anyList());
    }

    @Test
    void rejectsRegistrationsForADeletedDomain() {
        // given
        given(domainRepository.findById("d1")).willReturn(Optional.empty());

        // when / then
        assertThatThrownBy(() -> store.recordCreated("d1", "CN", List.of(registration())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no longer exists");
        then(registrationRepository).should(never()).saveAll(anyList());
    }

    private static Domain domain(String region) {
        return Domain.builder()
                .id("d1")
                .userId("u1")
                .name("example.com")
                .url("https://example.com")
                .region(region)
                .active(true)
                .interval(20)
                .build();
    }

    private static MonitorRegistration registration() {
        return MonitorRegistration.builder()
                .domainId("d1")
                .provider("uptrends")
                .externalId("uptrends-1")
                .state(MonitorRegistration.State.ACTIVE)
                .build();
    }
}
