package com.zonewatch.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.zonewatch.entity.DashboardStats;
import com.zonewatch.entity.HostQuery;
import com.zonewatch.entity.HostStatus;
import com.zonewatch.entity.MonitoredHost;
import com.zonewatch.entity.PageResult;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryHostRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");

    private final InMemoryHostRepository repo = new InMemoryHostRepository(Clock.fixed(NOW, ZoneOffset.UTC));

    private MonitoredHost add(String hostname, String zone, HostStatus status, Instant notAfter, boolean match) {
        MonitoredHost stored = repo.upsert(MonitoredHost.pending(hostname, "z-" + zone, zone, "r-" + hostname,
                "A", "192.0.2.1", false, ""));
        stored.setStatus(status);
        stored.setNotAfter(notAfter);
        stored.setHostnameMatch(match);
        stored.setIssuer(notAfter == null ? null : "R3");
        repo.updateProbeFields(stored);
        return stored;
    }

    @Test
    void upsert_keeps_user_fields_and_creation_time() {
        MonitoredHost first = add("www.example.com", "example.com", HostStatus.ACTIVE, NOW.plusSeconds(86400 * 40), true);
        repo.updateUserSettings(first.getId(), true, 8443, true);

        MonitoredHost again = MonitoredHost.pending("www.example.com", "z-example.com", "example.com",
                "r-www.example.com", "CNAME", "edge.example.net", true, "moved");
        MonitoredHost stored = repo.upsert(again);

        assertThat(stored.getId()).isEqualTo(first.getId());
        assertThat(stored.isIgnored()).isTrue();
        assertThat(stored.getPort()).isEqualTo(8443);
        assertThat(stored.isAutoRenew()).isTrue();
        assertThat(stored.getCreatedAt()).isEqualTo(NOW);
        assertThat(stored.getRecordType()).isEqualTo("CNAME");
        assertThat(stored.isProxied()).isTrue();
    }

    @Test
    void same_hostname_with_new_record_id_is_a_new_row() {
        add("www.example.com", "example.com", HostStatus.ACTIVE, null, true);
        repo.upsert(MonitoredHost.pending("www.example.com", "z", "example.com", "other-id", "A", "192.0.2.2", false, ""));
        assertThat(repo.findAll()).hasSize(2);
    }

    @Test
    void create_rejects_duplicate_key() {
        repo.create(MonitoredHost.placeholder("empty.example", "z1"));
        assertThatThrownBy(() -> repo.create(MonitoredHost.placeholder("empty.example", "z1")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void returned_objects_are_copies() {
        MonitoredHost h = add("www.example.com", "example.com", HostStatus.ACTIVE, null, true);
        h.setIgnored(true);
        assertThat(repo.findById(h.getId())).get().extracting(MonitoredHost::isIgnored).isEqualTo(false);
    }

    @Test
    void default_listing_hides_ignored_and_all_shows_them() {
        MonitoredHost a = add("a.example.com", "example.com", HostStatus.ACTIVE, null, true);
        add("b.example.com", "example.com", HostStatus.ACTIVE, null, true);
        repo.batchUpdateIgnored(List.of(a.getId()), true);

        assertThat(repo.list(new HostQuery()).total()).isEqualTo(1);
        HostQuery all = new HostQuery();
        all.setIgnored("all");
        assertThat(repo.list(all).total()).isEqualTo(2);
        HostQuery onlyIgnored = new HostQuery();
        onlyIgnored.setIgnored("true");
        assertThat(repo.list(onlyIgnored).items()).extracting(MonitoredHost::getHostname).containsExactly("a.example.com");
    }

    @Test
    void search_status_and_zone_filters() {
        add("api.example.com", "example.com", HostStatus.ACTIVE, NOW.plusSeconds(86400 * 10), false);
        add("shop.other.org", "other.org", HostStatus.UNRESOLVABLE, null, false);
        add("mail.other.org", "other.org", HostStatus.PENDING, null, false);

        HostQuery search = new HostQuery();
        search.setSearch("OTHER");
        assertThat(repo.list(search).total()).isEqualTo(2);

        HostQuery zone = new HostQuery();
        zone.setZone("example.com");
        assertThat(repo.list(zone).items()).extracting(MonitoredHost::getHostname).containsExactly("api.example.com");

        HostQuery activeOnly = new HostQuery();
        activeOnly.setStatus("active_only");
        assertThat(repo.list(activeOnly).total()).isEqualTo(2);

        // 해석 불가와 미점검은 불일치로 세지 않는다
        HostQuery mismatch = new HostQuery();
        mismatch.setStatus("mismatch");
        assertThat(repo.list(mismatch).items()).extracting(MonitoredHost::getHostname).containsExactly("api.example.com");

        HostQuery exact = new HostQuery();
        exact.setStatus("unresolvable");
        assertThat(repo.list(exact).items()).extracting(MonitoredHost::getHostname).containsExactly("shop.other.org");
    }

    @Test
    void expiry_sort_drops_unknown_dates_and_pages() {
        add("late.example.com", "example.com", HostStatus.ACTIVE, NOW.plusSeconds(86400 * 90), true);
        add("soon.example.com", "example.com", HostStatus.ACTIVE, NOW.plusSeconds(86400 * 5), true);
        add("unknown.example.com", "example.com", HostStatus.PENDING, null, true);

        HostQuery q = new HostQuery();
        q.setSort("expiry_asc");
        q.setPageSize(1);
        PageResult<MonitoredHost> first = repo.list(q);
        assertThat(first.total()).isEqualTo(2);
        assertThat(first.items()).extracting(MonitoredHost::getHostname).containsExactly("soon.example.com");

        q.setPage(2);
        assertThat(repo.list(q).items()).extracting(MonitoredHost::getHostname).containsExactly("late.example.com");

        HostQuery desc = new HostQuery();
        desc.setSort("expiry_desc");
        assertThat(repo.list(desc).items()).extracting(MonitoredHost::getHostname)
                .containsExactly("late.example.com", "soon.example.com", "unknown.example.com");
    }

    @Test
    void statistics_skip_placeholders_and_count_ignored_separately() {
        add("api.example.com", "example.com", HostStatus.ACTIVE, NOW.plusSeconds(86400 * 10), false);
        add("www.example.com", "example.com", HostStatus.CONNECTION_ERROR, null, true);
        MonitoredHost hidden = add("old.example.com", "example.com", HostStatus.ACTIVE, null, true);
        repo.batchUpdateIgnored(List.of(hidden.getId()), true);
        repo.create(MonitoredHost.placeholder("empty.example", "z9"));

        DashboardStats stats = repo.getStatistics();
        assertThat(stats.getTotal()).isEqualTo(2);
        assertThat(stats.getIgnored()).isEqualTo(2);
        assertThat(stats.getZones()).isEqualTo(2);
        assertThat(stats.getConnectionErrors()).isEqualTo(1);
        assertThat(stats.getMismatched()).isEqualTo(1);
        assertThat(stats.getExpiringWithin15Days()).isEqualTo(1);
        assertThat(stats.getStatusCounts()).containsEntry("active", 1L).containsEntry("connection_error", 1L);
        assertThat(stats.getIssuerCounts()).containsEntry("R3", 1L);
    }

    @Test
    void probe_update_on_deleted_row_is_reported() {
        MonitoredHost h = add("gone.example.com", "example.com", HostStatus.ACTIVE, null, true);
        repo.delete(h.getId());
        assertThat(repo.updateProbeFields(h)).isFalse();
    }

    @Test
    void zone_names_are_sorted_and_exclude_ignored() {
        add("a.zeta.io", "zeta.io", HostStatus.ACTIVE, null, true);
        add("a.alpha.io", "alpha.io", HostStatus.ACTIVE, null, true);
        repo.create(MonitoredHost.placeholder("hidden.io", "z"));
        assertThat(repo.findZoneNames()).containsExactly("alpha.io", "zeta.io");
    }
}
