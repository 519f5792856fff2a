package com.zonewatch.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.common.concurrent.BoundedChannel;
import com.common.concurrent.Deadline;
import com.common.service.impl.CommonServiceImpl;
import com.zonewatch.config.ZonewatchProperties;
import com.zonewatch.entity.AlertSettings;
import com.zonewatch.entity.EventType;
import com.zonewatch.entity.HostStatus;
import com.zonewatch.entity.MonitoredHost;
import com.zonewatch.entity.RegistrationInfo;
import com.zonewatch.entity.ScanResult;
import com.zonewatch.entity.SyncResult;
import com.zonewatch.notify.TaskSummaryData;
import com.zonewatch.provider.DnsProviderException;
import com.zonewatch.provider.DnsZone;
import com.zonewatch.repository.InMemoryHostRepository;
import com.zonewatch.schedule.RunCoordinator;
import com.zonewatch.service.NotifierService;
import com.zonewatch.service.ProberService;
import com.zonewatch.service.RecordSourceService;
import com.zonewatch.service.RegistrationLookupException;
import com.zonewatch.service.RegistrationLookupService;
import com.zonewatch.service.SettingsService;
import com.zonewatch.service.SkipPolicy;
import com.zonewatch.service.StreamReport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.Test;

class ReconcilerServiceImplTest {

    private static final Instant NOW = Instant.parse("2023-12-01T00:00:00Z");
    private static final Instant JAN_1 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant APR_1 = Instant.parse("2024-04-01T00:00:00Z");

    /** 존별 레코드를 그대로 흘려보내는 소스 */
    static class FakeSource implements RecordSourceService {
        final Map<DnsZone, List<MonitoredHost>> zones = new LinkedHashMap<>();
        final Set<String> failedZones = new HashSet<>();
        RuntimeException failure;

        void add(DnsZone zone, String hostname, String recordId) {
            zones.computeIfAbsent(zone, z -> new ArrayList<>())
                    .add(MonitoredHost.pending(hostname, zone.id(), zone.name(), recordId, "A", "192.0.2.1", false, ""));
        }

        @Override
        public StreamReport stream(BoundedChannel<MonitoredHost> channel, Deadline deadline) {
            try {
                if (failure != null) throw failure;
                List<DnsZone> done = new ArrayList<>();
                for (Map.Entry<DnsZone, List<MonitoredHost>> e : zones.entrySet()) {
                    if (failedZones.contains(e.getKey().name())) continue;
                    for (MonitoredHost h : e.getValue()) {
                        channel.send(h.copy(), deadline);
                    }
                    done.add(e.getKey());
                }
                return new StreamReport(done, failedZones);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DnsProviderException("interrupted", e);
            } finally {
                channel.close();
            }
        }

        @Override
        public Optional<MonitoredHost> fetchRecord(String zoneId, String recordId) {
            return zones.values().stream().flatMap(List::stream)
                    .filter(h -> recordId.equals(h.getProviderRecordId()))
                    .findFirst()
                    .map(MonitoredHost::copy);
        }
    }

    /** 호스트별 인증서 만료일을 돌려주는 점검기. 등록되지 않은 호스트는 notAfter=JAN_1. */
    static class FakeProber implements ProberService {
        final Map<String, Instant> notAfter = new ConcurrentHashMap<>();
        final Set<String> refused = ConcurrentHashMap.newKeySet();
        final Map<String, Integer> ports = new ConcurrentHashMap<>();

        @Override
        public MonitoredHost probe(String hostname, int port, Deadline deadline) {
            ports.put(hostname, port);
            MonitoredHost r = new MonitoredHost();
            r.setHostname(hostname);
            r.setPort(port);
            r.setLastCheckTime(NOW);
            r.setResolvedIps(new ArrayList<>(List.of("192.0.2.1")));
            if (refused.contains(hostname)) {
                r.setStatus(HostStatus.CONNECTION_ERROR);
                r.setErrorMessage("연결 거부 (Connection Refused)");
                r.setHostnameMatch(true);
                r.setIssuer("");
                return r;
            }
            Instant expiry = notAfter.getOrDefault(hostname, JAN_1);
            int days = (int) Duration.between(NOW, expiry).toDays();
            r.setNotAfter(expiry);
            r.setDaysRemaining(days);
            r.setIssuer("R3");
            r.setHostnameMatch(true);
            r.setErrorMessage("");
            r.setStatus(days < 0 ? HostStatus.EXPIRED : HostStatus.ACTIVE);
            return r;
        }
    }

    static class NoRegistration implements RegistrationLookupService {
        @Override
        public String rootDomain(String hostname) {
            return hostname;
        }

        @Override
        public RegistrationInfo lookup(String hostname) throws RegistrationLookupException {
            throw new RegistrationLookupException("offline");
        }

        @Override
        public RegistrationInfo cachedLookup(String hostname, Instant priorExpiry, int priorDaysLeft) {
            return priorExpiry == null ? RegistrationInfo.UNKNOWN : new RegistrationInfo(priorExpiry, priorDaysLeft);
        }
    }

    record Event(EventType type, String domain, String details) {
    }

    static class RecordingNotifier implements NotifierService {
        final List<Event> events = Collections.synchronizedList(new ArrayList<>());
        final List<TaskSummaryData> summaries = Collections.synchronizedList(new ArrayList<>());
        final List<String> alerted = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void notifyOperation(EventType type, String domain, String details) {
            events.add(new Event(type, domain, details));
        }

        @Override
        public void notifyTaskFinish(EventType type, TaskSummaryData summary) {
            summaries.add(summary);
        }

        @Override
        public void notifyTaskDetails(String title, List<String> lines) {
        }

        @Override
        public boolean checkAndNotify(MonitoredHost host) {
            alerted.add(host.getHostname());
            return true;
        }

        @Override
        public Map<String, String> sendTestMessage(AlertSettings settings) {
            return Map.of();
        }

        List<Event> of(EventType type) {
            synchronized (events) {
                return events.stream().filter(e -> e.type() == type).toList();
            }
        }
    }

    private final DnsZone example = new DnsZone("z-example", "example.com", "active");
    private final FakeSource source = new FakeSource();
    private final FakeProber prober = new FakeProber();
    private final RecordingNotifier notifier = new RecordingNotifier();
    private final InMemoryHostRepository repo = new InMemoryHostRepository(Clock.fixed(NOW, ZoneOffset.UTC));
    private final RunCoordinator coordinator = new RunCoordinator();
    private final ReconcilerServiceImpl reconciler;

    ReconcilerServiceImplTest() {
        ZonewatchProperties props = new ZonewatchProperties();
        props.getSync().setConcurrency(4);
        props.getSync().setTimeout(Duration.ofSeconds(30));
        props.getScan().setConcurrency(4);
        props.getScan().setTimeout(Duration.ofSeconds(30));
        reconciler = new ReconcilerServiceImpl(props, source, prober, new NoRegistration(), repo, notifier,
                mock(SettingsService.class), new SkipPolicy(props), coordinator, new CommonServiceImpl(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    /** example.com 에 호스트들을 두고 한 번 동기화해 기존 상태를 만든다 */
    private void baseline(String... hostnames) {
        for (int i = 0; i < hostnames.length; i++) {
            source.add(example, hostnames[i], "r" + i);
        }
        assertThat(reconciler.performSync().success()).isTrue();
        notifier.events.clear();
        notifier.alerted.clear();
    }

    private MonitoredHost stored(String hostname) {
        return repo.findByHostname(hostname).orElseThrow();
    }

    @Test
    void first_sync_adds_hosts_and_announces_the_zone_once() {
        source.add(example, "www.example.com", "r1");
        source.add(example, "api.example.com", "r2");

        SyncResult result = reconciler.performSync();

        assertThat(result.success()).isTrue();
        assertThat(result.stats().getAdded()).isEqualTo(2);
        assertThat(result.stats().getTotal()).isEqualTo(2);
        assertThat(notifier.of(EventType.ZONE_ADD)).singleElement()
                .satisfies(e -> assertThat(e.details()).contains("2개"));
        assertThat(notifier.of(EventType.ADD)).isEmpty();
        assertThat(stored("www.example.com").getStatus()).isEqualTo(HostStatus.ACTIVE);
        assertThat(notifier.summaries).hasSize(1);
    }

    @Test
    void new_zone_with_three_hosts_is_one_zone_add_and_no_add() {
        baseline("www.example.com");
        DnsZone fresh = new DnsZone("z-new", "new.example.com", "active");
        source.add(fresh, "a.new.example.com", "n1");
        source.add(fresh, "b.new.example.com", "n2");
        source.add(fresh, "c.new.example.com", "n3");

        SyncResult result = reconciler.performSync();

        assertThat(result.stats().getAdded()).isEqualTo(3);
        assertThat(notifier.of(EventType.ZONE_ADD)).singleElement().satisfies(e -> {
            assertThat(e.domain()).isEqualTo("new.example.com");
            assertThat(e.details()).contains("3개");
        });
        assertThat(notifier.of(EventType.ADD)).isEmpty();
    }

    @Test
    void new_host_in_known_zone_raises_add() {
        baseline("www.example.com");
        source.add(example, "shop.example.com", "r9");

        reconciler.performSync();

        assertThat(notifier.of(EventType.ADD)).singleElement()
                .satisfies(e -> assertThat(e.domain()).isEqualTo("shop.example.com"));
    }

    @Test
    void renewed_certificate_raises_exactly_one_renew() {
        baseline("api.example.com");
        assertThat(stored("api.example.com").getNotAfter()).isEqualTo(JAN_1);

        prober.notAfter.put("api.example.com", APR_1);
        SyncResult result = reconciler.performSync();

        assertThat(notifier.of(EventType.RENEW)).singleElement().satisfies(e -> {
            assertThat(e.domain()).isEqualTo("api.example.com");
            assertThat(e.details()).contains("2024-04-01");
        });
        assertThat(notifier.of(EventType.UPDATE)).isEmpty();
        assertThat(result.stats().getUpdated()).isZero();

        MonitoredHost after = stored("api.example.com");
        assertThat(after.getStatus()).isEqualTo(HostStatus.ACTIVE);
        assertThat(after.getNotAfter()).isEqualTo(APR_1);
        assertThat(after.getDaysRemaining()).isEqualTo(122);
    }

    @Test
    void renewal_of_an_expired_certificate_is_a_single_renew() {
        prober.notAfter.put("api.example.com", Instant.parse("2023-11-01T00:00:00Z"));
        baseline("api.example.com");
        assertThat(stored("api.example.com").getStatus()).isEqualTo(HostStatus.EXPIRED);

        prober.notAfter.put("api.example.com", APR_1);
        SyncResult result = reconciler.performSync();

        assertThat(notifier.events).extracting(Event::type).containsExactly(EventType.RENEW);
        assertThat(notifier.events.get(0).details())
                .contains("2024-04-01")
                .contains("• 상태: expired → active");
        assertThat(result.stats().getUpdated()).isZero();
        assertThat(stored("api.example.com").getStatus()).isEqualTo(HostStatus.ACTIVE);
    }

    @Test
    void renewal_with_a_record_change_is_one_renew_counted_as_updated() {
        baseline("api.example.com");
        prober.notAfter.put("api.example.com", APR_1);
        source.zones.get(example).get(0).setProxied(true);

        SyncResult result = reconciler.performSync();

        assertThat(notifier.events).extracting(Event::type).containsExactly(EventType.RENEW);
        assertThat(notifier.events.get(0).details()).contains("• 프록시: 꺼짐 → 켜짐");
        assertThat(result.stats().getUpdated()).isEqualTo(1);
        assertThat(result.stats().getUpdatedDetails()).containsExactly("api.example.com: 프록시: 꺼짐 → 켜짐");
    }

    @Test
    void unchanged_upstream_is_idempotent() {
        baseline("www.example.com", "api.example.com");
        List<String> before = repo.findAll().stream().map(MonitoredHost::getId).sorted().toList();

        SyncResult result = reconciler.performSync();

        assertThat(notifier.events).isEmpty();
        assertThat(result.stats().getAdded()).isZero();
        assertThat(result.stats().getUpdated()).isZero();
        assertThat(result.stats().getDeleted()).isZero();
        assertThat(repo.findAll().stream().map(MonitoredHost::getId).sorted().toList()).isEqualTo(before);
    }

    @Test
    void provider_failure_trips_the_safety_valve() {
        String[] names = new String[50];
        for (int i = 0; i < names.length; i++) names[i] = "h" + i + ".example.com";
        baseline(names);

        source.failure = new DnsProviderException("Cloudflare API 오류 (HTTP 401): Invalid access token");
        SyncResult result = reconciler.performSync();

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("Invalid access token");
        assertThat(result.stats().getDeleted()).isZero();
        assertThat(repo.findAll()).hasSize(50);
        assertThat(notifier.events).isEmpty();
    }

    @Test
    void zero_records_with_existing_hosts_trips_the_safety_valve() {
        baseline("www.example.com", "api.example.com");
        source.zones.put(example, new ArrayList<>());

        SyncResult result = reconciler.performSync();

        assertThat(result.success()).isFalse();
        assertThat(repo.findAll()).hasSize(2);
        assertThat(notifier.of(EventType.DELETE)).isEmpty();
    }

    @Test
    void removed_record_is_deleted_and_reported() {
        baseline("www.example.com", "old.example.com");
        source.zones.get(example).removeIf(h -> h.getHostname().equals("old.example.com"));

        SyncResult result = reconciler.performSync();

        assertThat(result.stats().getDeleted()).isEqualTo(1);
        assertThat(result.stats().getDeletedHosts()).containsExactly("old.example.com");
        assertThat(notifier.of(EventType.DELETE)).singleElement()
                .satisfies(e -> assertThat(e.domain()).isEqualTo("old.example.com"));
        assertThat(repo.findByHostname("old.example.com")).isEmpty();
    }

    @Test
    void hosts_in_a_failed_zone_are_kept() {
        baseline("www.example.com");
        DnsZone other = new DnsZone("z-other", "other.org", "active");
        source.add(other, "app.other.org", "o1");
        reconciler.performSync();
        notifier.events.clear();

        source.failedZones.add("other.org");
        SyncResult result = reconciler.performSync();

        assertThat(result.success()).isTrue();
        assertThat(repo.findByHostname("app.other.org")).isPresent();
        assertThat(notifier.of(EventType.ZONE_DELETE)).isEmpty();
        assertThat(notifier.of(EventType.DELETE)).isEmpty();
    }

    @Test
    void vanished_zone_is_one_zone_delete_without_per_host_deletes() {
        baseline("www.example.com");
        DnsZone other = new DnsZone("z-other", "other.org", "active");
        source.add(other, "app.other.org", "o1");
        source.add(other, "api.other.org", "o2");
        reconciler.performSync();
        notifier.events.clear();

        source.zones.remove(other);
        reconciler.performSync();

        assertThat(notifier.of(EventType.ZONE_DELETE)).singleElement().satisfies(e -> {
            assertThat(e.domain()).isEqualTo("other.org");
            assertThat(e.details()).contains("2개");
        });
        assertThat(notifier.of(EventType.DELETE)).isEmpty();
        assertThat(repo.findByHostname("app.other.org")).isEmpty();
    }

    @Test
    void skipped_records_are_counted_but_never_stored() {
        source.add(example, "www.example.com", "r1");
        source.add(example, "_acme-challenge.example.com", "r2");
        source.add(example, "s1._domainkey.example.com", "r3");

        SyncResult result = reconciler.performSync();

        assertThat(result.stats().getSkipped()).isEqualTo(2);
        assertThat(result.stats().getTotal()).isEqualTo(3);
        assertThat(repo.findAll()).extracting(MonitoredHost::getHostname).containsExactly("www.example.com");
        assertThat(prober.ports).containsOnlyKeys("www.example.com");
    }

    @Test
    void empty_zone_gets_a_placeholder_until_it_has_records() {
        baseline("www.example.com");
        DnsZone empty = new DnsZone("z-empty", "empty.io", "active");
        source.zones.put(empty, new ArrayList<>());

        reconciler.performSync();
        MonitoredHost placeholder = stored("empty.io");
        assertThat(placeholder.isPlaceholder()).isTrue();
        assertThat(placeholder.isIgnored()).isTrue();
        assertThat(placeholder.getStatus()).isEqualTo(HostStatus.SKIPPED_ZONE);

        // 다시 돌려도 하나만 유지
        reconciler.performSync();
        assertThat(repo.findAll().stream().filter(MonitoredHost::isPlaceholder)).hasSize(1);

        source.add(empty, "www.empty.io", "e1");
        reconciler.performSync();
        assertThat(repo.findAll().stream().filter(MonitoredHost::isPlaceholder)).isEmpty();
        assertThat(repo.findByHostname("www.empty.io")).isPresent();
    }

    @Test
    void user_fields_survive_a_sync() {
        baseline("www.example.com");
        MonitoredHost host = stored("www.example.com");
        repo.updateUserSettings(host.getId(), null, 8443, true);

        reconciler.performSync();

        MonitoredHost after = stored("www.example.com");
        assertThat(after.getPort()).isEqualTo(8443);
        assertThat(after.isAutoRenew()).isTrue();
        assertThat(prober.ports).containsEntry("www.example.com", 8443);
    }

    @Test
    void ignored_hosts_are_not_probed() {
        baseline("www.example.com");
        repo.batchUpdateIgnored(List.of(stored("www.example.com").getId()), true);
        prober.ports.clear();

        reconciler.performSync();

        assertThat(prober.ports).isEmpty();
        assertThat(stored("www.example.com").isIgnored()).isTrue();
    }

    @Test
    void fresh_connection_error_alerts_once_and_recovery_is_an_update() {
        baseline("www.example.com");
        prober.refused.add("www.example.com");

        reconciler.performSync();
        assertThat(notifier.alerted).containsExactly("www.example.com");
        assertThat(notifier.of(EventType.UPDATE)).isEmpty();

        reconciler.performSync();
        assertThat(notifier.alerted).hasSize(1);

        prober.refused.clear();
        SyncResult recovered = reconciler.performSync();
        assertThat(notifier.of(EventType.UPDATE)).singleElement()
                .satisfies(e -> assertThat(e.details()).contains("연결 복구"));
        // 상태만 바뀐 것은 변경 집계에 넣지 않는다
        assertThat(recovered.stats().getUpdated()).isZero();
    }

    @Test
    void changed_record_target_is_an_update() {
        baseline("www.example.com");
        source.zones.get(example).get(0).setUpstreamTarget("198.51.100.7");

        SyncResult result = reconciler.performSync();

        assertThat(notifier.of(EventType.UPDATE)).singleElement()
                .satisfies(e -> assertThat(e.details()).contains("192.0.2.1 → 198.51.100.7"));
        assertThat(result.stats().getUpdatedDetails()).singleElement()
                .satisfies(line -> assertThat(line).startsWith("www.example.com: "));
    }

    @Test
    void overlapping_sync_is_refused() {
        assertThat(coordinator.tryAcquire(RunCoordinator.SYNC)).isTrue();
        try {
            SyncResult result = reconciler.performSync();
            assertThat(result.success()).isFalse();
            assertThat(result.error()).contains("이미 실행 중");
        } finally {
            coordinator.release(RunCoordinator.SYNC);
        }
    }

    @Test
    void scan_tallies_active_warning_and_expired() {
        prober.notAfter.put("ok.example.com", APR_1);
        prober.notAfter.put("soon.example.com", Instant.parse("2023-12-11T00:00:00Z"));
        prober.notAfter.put("dead.example.com", Instant.parse("2023-11-01T00:00:00Z"));
        baseline("ok.example.com", "soon.example.com", "dead.example.com");

        ScanResult result = reconciler.performScan();

        assertThat(result.success()).isTrue();
        assertThat(result.total()).isEqualTo(3);
        assertThat(result.active()).isEqualTo(1);
        assertThat(result.warning()).isEqualTo(1);
        assertThat(result.expired()).isEqualTo(1);
        assertThat(notifier.alerted).containsExactlyInAnyOrder("ok.example.com", "soon.example.com", "dead.example.com");
    }

    @Test
    void rescan_refreshes_provider_fields_and_probes() {
        baseline("www.example.com");
        source.zones.get(example).get(0).setProxied(true);
        MonitoredHost host = stored("www.example.com");

        MonitoredHost result = reconciler.rescan(host.getId());

        assertThat(result.isProxied()).isTrue();
        assertThat(stored("www.example.com").isProxied()).isTrue();
        assertThat(notifier.alerted).containsExactly("www.example.com");
        assertThatThrownBy(() -> reconciler.rescan("missing")).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void inspect_does_not_persist() {
        MonitoredHost result = reconciler.inspect("adhoc.example.net", 443);
        assertThat(result.getStatus()).isEqualTo(HostStatus.ACTIVE);
        assertThat(repo.findAll()).isEmpty();
    }
}
