package com.zonewatch.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.common.concurrent.BoundedChannel;
import com.common.concurrent.Deadline;
import com.zonewatch.config.ZonewatchProperties;
import com.zonewatch.entity.HostStatus;
import com.zonewatch.entity.MonitoredHost;
import com.zonewatch.entity.RegistrationInfo;
import com.zonewatch.provider.DnsProviderClient;
import com.zonewatch.provider.DnsProviderException;
import com.zonewatch.provider.DnsRecord;
import com.zonewatch.provider.DnsZone;
import com.zonewatch.provider.RecordPage;
import com.zonewatch.repository.InMemoryHostRepository;
import com.zonewatch.service.RegistrationLookupException;
import com.zonewatch.service.RegistrationLookupService;
import com.zonewatch.service.SkipPolicy;
import com.zonewatch.service.StreamReport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CloudflareRecordSourceServiceImplTest {

    private static final Instant DOMAIN_EXPIRY = Instant.parse("2030-01-01T00:00:00Z");

    static class FakeProvider implements DnsProviderClient {
        final Map<DnsZone, List<List<DnsRecord>>> pages = new LinkedHashMap<>();
        final List<String> brokenZones = new ArrayList<>();
        boolean zoneListingFails;

        @Override
        public List<DnsZone> listZones() {
            if (zoneListingFails) throw new DnsProviderException("Cloudflare API 오류 (HTTP 401): Invalid access token");
            return new ArrayList<>(pages.keySet());
        }

        @Override
        public DnsZone getZone(String zoneId) {
            return pages.keySet().stream().filter(z -> z.id().equals(zoneId)).findFirst().orElseThrow();
        }

        @Override
        public RecordPage listRecords(String zoneId, int page, int perPage) {
            if (brokenZones.contains(zoneId)) throw new DnsProviderException("zone " + zoneId + " unavailable");
            List<List<DnsRecord>> zonePages = pages.get(getZone(zoneId));
            return new RecordPage(zonePages.get(page - 1), page, zonePages.size());
        }

        @Override
        public DnsRecord getRecord(String zoneId, String recordId) {
            return pages.get(getZone(zoneId)).stream()
                    .flatMap(List::stream)
                    .filter(r -> r.id().equals(recordId))
                    .findFirst()
                    .orElse(null);
        }
    }

    static class FixedRegistration implements RegistrationLookupService {
        @Override
        public String rootDomain(String hostname) {
            return hostname;
        }

        @Override
        public RegistrationInfo lookup(String hostname) throws RegistrationLookupException {
            if (hostname.startsWith("noreg")) throw new RegistrationLookupException("whois down");
            return new RegistrationInfo(DOMAIN_EXPIRY, 1000);
        }

        @Override
        public RegistrationInfo cachedLookup(String hostname, Instant priorExpiry, int priorDaysLeft) {
            return RegistrationInfo.UNKNOWN;
        }
    }

    private final FakeProvider provider = new FakeProvider();
    private final InMemoryHostRepository repo = new InMemoryHostRepository(Clock.systemUTC());
    private final ZonewatchProperties props = new ZonewatchProperties();
    private final CloudflareRecordSourceServiceImpl source;

    CloudflareRecordSourceServiceImplTest() {
        props.getCloudflare().setPageDelay(Duration.ZERO);
        props.getCloudflare().setZoneDelay(Duration.ZERO);
        source = new CloudflareRecordSourceServiceImpl(props, provider, repo, new FixedRegistration(),
                new SkipPolicy(props));
    }

    private static DnsRecord record(DnsZone zone, String id, String name, String type) {
        return new DnsRecord(id, zone.id(), zone.name(), name, type, "192.0.2.1", false, "");
    }

    private List<MonitoredHost> drain(BoundedChannel<MonitoredHost> channel) throws InterruptedException {
        List<MonitoredHost> out = new ArrayList<>();
        Optional<MonitoredHost> next;
        while ((next = channel.receive(Deadline.after(Duration.ofSeconds(1)))).isPresent()) {
            out.add(next.get());
        }
        return out;
    }

    @Test
    void streams_a_and_cname_across_pages_and_persists_pending() throws Exception {
        DnsZone zone = new DnsZone("z1", "example.com", "active");
        provider.pages.put(zone, List.of(
                List.of(record(zone, "1", "www.example.com", "A"), record(zone, "2", "example.com", "MX")),
                List.of(record(zone, "3", "shop.example.com", "CNAME"), record(zone, "4", "_dmarc.example.com", "CNAME"))));

        BoundedChannel<MonitoredHost> channel = new BoundedChannel<>(10);
        StreamReport report = source.stream(channel, Deadline.after(Duration.ofSeconds(10)));

        assertThat(channel.isClosed()).isTrue();
        assertThat(report.zones()).containsExactly(zone);
        assertThat(report.failedZones()).isEmpty();

        List<MonitoredHost> sent = drain(channel);
        assertThat(sent).extracting(MonitoredHost::getHostname)
                .containsExactly("www.example.com", "shop.example.com", "_dmarc.example.com");
        assertThat(sent.get(0).getDomainExpiryDate()).isEqualTo(DOMAIN_EXPIRY);
        assertThat(sent.get(0).getStatus()).isEqualTo(HostStatus.PENDING);

        // 제외 대상은 흘려보내되 저장하지 않는다
        assertThat(repo.findAll()).extracting(MonitoredHost::getHostname)
                .containsExactlyInAnyOrder("www.example.com", "shop.example.com");
    }

    @Test
    void failing_zone_is_reported_and_others_continue() throws Exception {
        DnsZone bad = new DnsZone("z-bad", "broken.io", "active");
        DnsZone good = new DnsZone("z-good", "noreg.io", "active");
        provider.pages.put(bad, List.of(List.of()));
        provider.pages.put(good, List.of(List.of(record(good, "9", "app.noreg.io", "A"))));
        provider.brokenZones.add("z-bad");

        BoundedChannel<MonitoredHost> channel = new BoundedChannel<>(10);
        StreamReport report = source.stream(channel, Deadline.after(Duration.ofSeconds(10)));

        assertThat(report.failedZones()).containsExactly("broken.io");
        assertThat(report.zones()).containsExactly(good);
        List<MonitoredHost> sent = drain(channel);
        assertThat(sent).singleElement().satisfies(h -> assertThat(h.getDomainExpiryDate()).isNull());
    }

    @Test
    void zone_listing_failure_fails_the_stream_and_closes_channel() {
        provider.zoneListingFails = true;
        BoundedChannel<MonitoredHost> channel = new BoundedChannel<>(10);

        assertThatThrownBy(() -> source.stream(channel, Deadline.after(Duration.ofSeconds(10))))
                .isInstanceOf(DnsProviderException.class)
                .hasMessageContaining("401");
        assertThat(channel.isClosed()).isTrue();
    }

    @Test
    void expired_deadline_is_a_hard_failure() {
        DnsZone zone = new DnsZone("z1", "example.com", "active");
        provider.pages.put(zone, List.of(List.of(record(zone, "1", "www.example.com", "A"))));
        Deadline expired = Deadline.after(Duration.ofMinutes(1));
        expired.cancel();

        assertThatThrownBy(() -> source.stream(new BoundedChannel<>(10), expired))
                .isInstanceOf(DnsProviderException.class);
    }

    @Test
    void fetch_record_returns_provider_fields() {
        DnsZone zone = new DnsZone("z1", "example.com", "active");
        provider.pages.put(zone, List.of(List.of(record(zone, "1", "www.example.com", "A"))));

        assertThat(source.fetchRecord("z1", "1")).get()
                .extracting(MonitoredHost::getUpstreamTarget).isEqualTo("192.0.2.1");
        assertThat(source.fetchRecord("z1", "missing")).isEmpty();
    }
}
