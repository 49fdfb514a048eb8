package com.example.domainmonitor.monitor;

import com.example.domainmonitor.config.MonitorProperties;
import com.example.domainmonitor.domain.Domain;
import com.example.domainmonitor.monitor.DomainOperationException.Reason;
import com.example.domainmonitor.repository.DomainRepository;
import com.example.domainmonitor.repository.MonitorRegistrationRepository;
import com.example.domainmonitor.repository.NotificationHistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

@ExtendWith(MockitoExtension.class)
class DomainServiceTest {

    @Mock
    private DomainRepository domainRepository;

    @Mock
    private MonitorRegistrationRepository registrationRepository;

    @Mock
    private NotificationHistoryRepository historyRepository;

    @Mock
    private MonitorOrchestrator orchestrator;

    @Mock
    private PlatformTransactionManager transactionManager;

    private MonitorProperties properties;
    private DomainService domainService;

    @BeforeEach
    void setUp() {
        properties = new MonitorProperties();
        domainService = new DomainService(domainRepository, registrationRepository, historyRepository,
                orchestrator, properties, new TransactionTemplate(transactionManager));
    }

    @Test
    void batchIsolatesInvalidItems() {
        // given
        givenSaveAssignsIds();

        // when
        BatchAddResult result = domainService.addDomains("u1", List.of(
                new DomainRequest("bad-region.com", "XX"),
                new DomainRequest("good.com", "TH")));

        // then
        assertThat(result.total()).isEqualTo(2);
        assertThat(result.added()).isEqualTo(1);
        assertThat(result.succeeded()).hasSize(1);
        assertThat(result.failed()).hasSize(1);
        assertThat(result.failed().get(0).reason()).isEqualTo(Reason.INVALID_REGION);
        assertThat(result.succeeded().get(0).domainId()).isEqualTo("id-good.com");
        then(orchestrator).should(times(1)).onDomainCreated(any(Domain.class));
    }

    @Test
    void storageFailureOfOneItemDoesNotAbortTheBatch() {
        // given
        given(domainRepository.save(any(Domain.class))).willAnswer(invocation -> {
            Domain domain = invocation.getArgument(0);
            if (domain.getName().equals("broken.com")) {
                throw new DataIntegrityViolationException("value too long");
            }
            domain.setId("id-" + domain.getName());
            return domain;
        });

        // when
        BatchAddResult result = domainService.addDomains("u1", List.of(
                new DomainRequest("a.com", "CN"),
                new DomainRequest("broken.com", "CN"),
                new DomainRequest("c.com", "CN")));

        // then
        assertThat(result.total()).isEqualTo(3);
        assertThat(result.added()).isEqualTo(2);
        assertThat(result.succeeded()).extracting(BatchAddResult.Item::name).containsExactly("a.com", "c.com");
        assertThat(result.failed()).singleElement().satisfies(item -> {
            assertThat(item.name()).isEqualTo("broken.com");
            assertThat(item.reason()).isEqualTo(Reason.PERSISTENCE);
        });
        then(orchestrator).should(times(2)).onDomainCreated(any(Domain.class));
    }

    @Test
    void batchRejectsDuplicatesByHostAndRegion() {
        // given
        given(domainRepository.findByUserId("u1")).willReturn(List.of(domain("d0", "example.com", "CN")));
        givenSaveAssignsIds();

        // when
        BatchAddResult result = domainService.addDomains("u1", List.of(
                new DomainRequest("EXAMPLE.com", "CN"),
                new DomainRequest("https://new.com/health", "CN"),
                new DomainRequest("new.com", "cn"),
                new DomainRequest("new.com", "JP")));

        // then
        assertThat(result.added()).isEqualTo(2);
        assertThat(result.failed()).extracting(BatchAddResult.Item::reason)
                .containsExactly(Reason.DUPLICATE, Reason.DUPLICATE);
        assertThat(result.succeeded()).extracting(BatchAddResult.Item::region).containsExactly("CN", "JP");
    }

    @Test
    void batchStopsAddingAtTheLimit() {
        // given
        properties.getDomains().setLimitPerUser(2);
        given(domainRepository.countByUserId("u1")).willReturn(1L);
        givenSaveAssignsIds();

        // when
        BatchAddResult result = domainService.addDomains("u1", List.of(
                new DomainRequest("one.com", "CN"),
                new DomainRequest("two.com", "CN")));

        // then
        assertThat(result.added()).isEqualTo(1);
        assertThat(result.failed().get(0).reason()).isEqualTo(Reason.LIMIT_REACHED);
    }

    @Test
    void oversizedBatchIsRejectedWhole() {
        List<DomainRequest> requests = IntStream.rangeClosed(1, 101)
                .mapToObj(i -> new DomainRequest("site" + i + ".com", "CN"))
                .toList();

        assertThatThrownBy(() -> domainService.addDomains("u1", requests))
                .isInstanceOf(IllegalArgumentException.class);
        then(domainRepository).should(never()).save(any());
    }

    @Test
    void addDomainAppliesDefaultsAndSchedulesMonitors() {
        // given
        givenSaveAssignsIds();

        // when
        Domain saved = domainService.addDomain("u1", new DomainRequest(" Example.org ", "japan"));

        // then
        assertThat(saved.getName()).isEqualTo("Example.org");
        assertThat(saved.getUrl()).isEqualTo("https://Example.org");
        assertThat(saved.getRegion()).isEqualTo("JP");
        assertThat(saved.getInterval()).isEqualTo(20);
        assertThat(saved.isActive()).isTrue();
        then(orchestrator).should().onDomainCreated(saved);
    }

    @Test
    void addDomainValidatesNameAndInterval() {
        assertThatThrownBy(() -> domainService.addDomain("u1", new DomainRequest("not a domain", "CN")))
                .isInstanceOfSatisfying(DomainOperationException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.INVALID_NAME));
        assertThatThrownBy(() -> domainService.addDomain("u1", new DomainRequest("example.com", "CN", 15)))
                .isInstanceOfSatisfying(DomainOperationException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.INVALID_INTERVAL));
        then(orchestrator).shouldHaveNoInteractions();
    }

    @Test
    void regionChangeIsPropagated() {
        // given
        Domain existing = domain("d1", "example.com", "CN");
        given(domainRepository.findByIdAndUserId("d1", "u1")).willReturn(Optional.of(existing));
        givenSaveAssignsIds();

        // when
        Domain updated = domainService.updateDomain("u1", "d1", new DomainUpdate(null, 60, "JP"));

        // then
        assertThat(updated.getInterval()).isEqualTo(60);
        then(orchestrator).should().onRegionChanged(updated, "CN", "JP");
        then(orchestrator).should(never()).onActiveChanged(any(), eq(false));
    }

    @Test
    void activeChangeIsPropagated() {
        // given
        Domain existing = domain("d1", "example.com", "CN");
        given(domainRepository.findByIdAndUserId("d1", "u1")).willReturn(Optional.of(existing));
        givenSaveAssignsIds();

        // when
        domainService.updateDomain("u1", "d1", new DomainUpdate(false, null, null));

        // then
        then(orchestrator).should().onActiveChanged(existing, false);
        then(orchestrator).should(never()).onRegionChanged(any(), any(), any());
    }

    @Test
    void updateAllOnlyTouchesDomainsWhoseFlagChanges() {
        // given
        Domain on = domain("d1", "one.com", "CN");
        Domain off = domain("d2", "two.com", "CN");
        off.setActive(false);
        given(domainRepository.findByUserId("u1")).willReturn(List.of(on, off));

        // when
        int changed = domainService.updateAllDomains("u1", false);

        // then
        assertThat(changed).isEqualTo(1);
        assertThat(on.isActive()).isFalse();
        then(orchestrator).should().onActiveChanged(on, false);
        then(orchestrator).should(never()).onActiveChanged(off, false);
    }

    @Test
    void batchDeleteReleasesRemoteMonitorsAndReportsUnknownIds() {
        // given
        Domain d1 = domain("d1", "one.com", "CN");
        given(domainRepository.findByUserIdAndIdIn(eq("u1"), anyCollection())).willReturn(List.of(d1));

        // when
        BatchDeleteResult result = domainService.deleteDomains("u1", List.of("d1", "d1", "missing"));

        // then
        assertThat(result.deleted()).isEqualTo(1);
        assertThat(result.failedIds()).containsExactly("missing");
        then(orchestrator).should(times(1)).onDomainDeleted(d1);
        then(historyRepository).should().deleteByDomainIdIn(List.of("d1"));
        then(registrationRepository).should().deleteByDomainIdIn(List.of("d1"));
        then(domainRepository).should().deleteByIdIn(List.of("d1"));
    }

    @Test
    void deleteOfUnknownDomainFails() {
        given(domainRepository.findByIdAndUserId("nope", "u1")).willReturn(Optional.empty());

        assertThatThrownBy(() -> domainService.deleteDomain("u1", "nope"))
                .isInstanceOfSatisfying(DomainOperationException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.NOT_FOUND));
        then(orchestrator).shouldHaveNoInteractions();
    }

    @Test
    void emptyDeleteBatchIsRejected() {
        assertThatThrownBy(() -> domainService.deleteDomains("u1", Collections.emptyList()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void givenSaveAssignsIds() {
        given(domainRepository.save(any(Domain.class))).willAnswer(invocation -> {
            Domain domain = invocation.getArgument(0);
            if (domain.getId() == null) {
                domain.setId("id-" + domain.getName());
            }
            return domain;
        });
    }

    private static Domain domain(String id, String name, String region) {
        return Domain.builder()
                .id(id)
                .userId("u1")
                .name(name)
                .url("https://" + name)
                .region(region)
                .interval(20)
                .active(true)
                .build();
    }
}
