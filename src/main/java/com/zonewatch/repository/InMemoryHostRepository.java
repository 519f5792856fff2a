package com.zonewatch.repository;

import com.zonewatch.entity.DashboardStats;
import com.zonewatch.entity.HostQuery;
import com.zonewatch.entity.HostStatus;
import com.zonewatch.entity.MonitoredHost;
import com.zonewatch.entity.PageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 메모리 기반 호스트 저장소.
 * 쓰기는 모두 synchronized 로 직렬화하고, 읽기는 복사본을 만들어 돌려준다.
 */
@Slf4j
@Repository
public class InMemoryHostRepository implements HostRepository {

    private final Map<String, MonitoredHost> byId = new LinkedHashMap<>();
    private final Clock clock;

    public InMemoryHostRepository(Clock clock) {
        this.clock = clock;
    }

    private static String key(String hostname, String recordId) {
        return hostname + "|" + (recordId == null ? "" : recordId);
    }

    private MonitoredHost findByKey(String hostname, String recordId) {
        String k = key(hostname, recordId);
        for (MonitoredHost h : byId.values()) {
            if (key(h.getHostname(), h.getProviderRecordId()).equals(k)) return h;
        }
        return null;
    }

    @Override
    public synchronized MonitoredHost upsert(MonitoredHost host) {
        MonitoredHost stored = findByKey(host.getHostname(), host.getProviderRecordId());
        if (stored == null) {
            // 최초 삽입
            stored = host.copy();
            stored.setId(UUID.randomUUID().toString());
            stored.setCreatedAt(clock.instant());
            stored.setIgnored(false);
            if (stored.getPort() <= 0) stored.setPort(MonitoredHost.DEFAULT_PORT);
            byId.put(stored.getId(), stored);
        } else {
            stored.copyProviderFieldsFrom(host);
            stored.copyObservedFieldsFrom(host);
            stored.setDomainExpiryDate(host.getDomainExpiryDate());
            stored.setDomainDaysLeft(host.getDomainDaysLeft());
        }
        return stored.copy();
    }

    @Override
    public synchronized MonitoredHost create(MonitoredHost host) {
        if (findByKey(host.getHostname(), host.getProviderRecordId()) != null) {
            throw new IllegalStateException("이미 존재하는 레코드: " + host.getHostname());
        }
        MonitoredHost stored = host.copy();
        stored.setId(UUID.randomUUID().toString());
        stored.setCreatedAt(clock.instant());
        byId.put(stored.getId(), stored);
        return stored.copy();
    }

    @Override
    public synchronized PageResult<MonitoredHost> list(HostQuery query) {
        List<MonitoredHost> filtered = byId.values().stream()
                .filter(h -> matches(h, query))
                .map(MonitoredHost::copy)
                .collect(Collectors.toCollection(ArrayList::new));

        // 만료일 오름차순은 만료일이 없는 레코드를 목록에서 뺀다 (검색/상태 필터가 없을 때)
        if ("expiry_asc".equals(query.getSort()) && isBlank(query.getSearch()) && isBlank(query.getStatus())
                && !"true".equals(query.getIgnored())) {
            filtered.removeIf(h -> h.getNotAfter() == null);
        }
        filtered.sort(comparator(query.getSort()));

        int pageSize = Math.max(1, query.getPageSize());
        int page = Math.max(1, query.getPage());
        long from = (long) (page - 1) * pageSize;
        List<MonitoredHost> items = filtered.stream()
                .skip(from)
                .limit(pageSize)
                .collect(Collectors.toList());
        return new PageResult<>(items, filtered.size(), page, pageSize);
    }

    private static boolean matches(MonitoredHost h, HostQuery q) {
        // 1) 무시 여부 (기본: 무시되지 않은 것만)
        String ignored = q.getIgnored();
        if (isBlank(ignored) || "false".equalsIgnoreCase(ignored)) {
            if (h.isIgnored()) return false;
        } else if ("true".equalsIgnoreCase(ignored)) {
            if (!h.isIgnored()) return false;
        }

        // 2) 검색어
        if (!isBlank(q.getSearch())) {
            String needle = q.getSearch().trim().toLowerCase(Locale.ROOT);
            boolean hit = contains(h.getHostname(), needle)
                    || contains(h.getResolvedRecord(), needle)
                    || contains(h.getZoneName(), needle);
            if (!hit) return false;
        }

        // 3) 존
        if (!isBlank(q.getZone()) && !q.getZone().equalsIgnoreCase(h.getZoneName())) return false;

        // 4) 상태
        if (!isBlank(q.getStatus())) {
            switch (q.getStatus()) {
                case "active_only" -> {
                    if (h.getStatus() == HostStatus.UNRESOLVABLE) return false;
                }
                case "mismatch" -> {
                    if (!isMismatched(h) || h.isIgnored()) return false;
                }
                default -> {
                    if (h.getStatus() == null || !h.getStatus().code().equals(q.getStatus())) return false;
                }
            }
        }

        // 5) 프록시
        if (!isBlank(q.getProxied())) {
            if (Boolean.parseBoolean(q.getProxied()) != h.isProxied()) return false;
        }
        return true;
    }

    private static Comparator<MonitoredHost> comparator(String sort) {
        if (sort == null) sort = "";
        return switch (sort) {
            case "expiry_asc" -> nullsLast(MonitoredHost::getNotAfter, false);
            case "expiry_desc" -> nullsLast(MonitoredHost::getNotAfter, true);
            case "domain_expiry_asc" -> nullsLast(MonitoredHost::getDomainExpiryDate, false);
            case "domain_expiry_desc" -> nullsLast(MonitoredHost::getDomainExpiryDate, true);
            case "days_remaining_asc" -> Comparator.comparingInt(MonitoredHost::getDaysRemaining);
            case "days_remaining_desc" -> Comparator.comparingInt(MonitoredHost::getDaysRemaining).reversed();
            case "check_time_asc" -> nullsLast(MonitoredHost::getLastCheckTime, false);
            case "check_time_desc" -> nullsLast(MonitoredHost::getLastCheckTime, true);
            default -> nullsLast(MonitoredHost::getCreatedAt, true);
        };
    }

    private static <U extends Comparable<? super U>> Comparator<MonitoredHost> nullsLast(
            Function<MonitoredHost, U> key, boolean descending) {
        Comparator<U> order = descending ? Comparator.<U>naturalOrder().reversed() : Comparator.<U>naturalOrder();
        return Comparator.comparing(key, Comparator.nullsLast(order));
    }

    @Override
    public synchronized List<MonitoredHost> findAll() {
        return byId.values().stream().map(MonitoredHost::copy).collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<MonitoredHost> findById(String id) {
        return Optional.ofNullable(byId.get(id)).map(MonitoredHost::copy);
    }

    @Override
    public synchronized Optional<MonitoredHost> findByHostname(String hostname) {
        return byId.values().stream()
                .filter(h -> h.getHostname().equalsIgnoreCase(hostname))
                .findFirst()
                .map(MonitoredHost::copy);
    }

    @Override
    public synchronized boolean delete(String id) {
        return byId.remove(id) != null;
    }

    @Override
    public synchronized int batchUpdateIgnored(Collection<String> ids, boolean ignored) {
        int changed = 0;
        for (String id : ids) {
            MonitoredHost h = byId.get(id);
            if (h != null) {
                h.setIgnored(ignored);
                changed++;
            }
        }
        return changed;
    }

    @Override
    public synchronized Optional<MonitoredHost> updateUserSettings(String id, Boolean ignored, Integer port, Boolean autoRenew) {
        MonitoredHost h = byId.get(id);
        if (h == null) return Optional.empty();
        if (ignored != null) h.setIgnored(ignored);
        if (port != null) h.setPort(port);
        if (autoRenew != null) h.setAutoRenew(autoRenew);
        return Optional.of(h.copy());
    }

    @Override
    public synchronized boolean updateProbeFields(MonitoredHost host) {
        MonitoredHost h = host.getId() == null ? null : byId.get(host.getId());
        if (h == null) {
            log.debug("점검 결과 반영 대상 없음 (삭제됨): {}", host.getHostname());
            return false;
        }
        h.copyProviderFieldsFrom(host);
        h.copyObservedFieldsFrom(host);
        h.setDomainExpiryDate(host.getDomainExpiryDate());
        h.setDomainDaysLeft(host.getDomainDaysLeft());
        return true;
    }

    @Override
    public synchronized void updateLastAlertTime(String id, Instant time) {
        MonitoredHost h = byId.get(id);
        if (h != null) h.setLastAlertTime(time);
    }

    @Override
    public synchronized List<String> findZoneNames() {
        return byId.values().stream()
                .filter(h -> !h.isIgnored())
                .map(MonitoredHost::getZoneName)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new))
                .stream().toList();
    }

    @Override
    public synchronized DashboardStats getStatistics() {
        DashboardStats stats = new DashboardStats();
        Instant now = clock.instant();
        Instant d15 = now.plusSeconds(15L * 86400);
        Instant d30 = now.plusSeconds(30L * 86400);
        TreeSet<String> zones = new TreeSet<>();

        for (MonitoredHost h : byId.values()) {
            if (h.getZoneName() != null) zones.add(h.getZoneName());
            if (h.isIgnored()) {
                stats.setIgnored(stats.getIgnored() + 1);
                continue;
            }
            if (h.isPlaceholder()) continue;

            stats.setTotal(stats.getTotal() + 1);
            String status = h.getStatus() == null ? "unknown" : h.getStatus().code();
            stats.getStatusCounts().merge(status, 1L, Long::sum);
            if (h.getStatus() == HostStatus.CONNECTION_ERROR) {
                stats.setConnectionErrors(stats.getConnectionErrors() + 1);
            }
            if (h.getIssuer() != null && !h.getIssuer().isBlank()) {
                stats.getIssuerCounts().merge(h.getIssuer(), 1L, Long::sum);
            }
            if (isMismatched(h)) {
                stats.setMismatched(stats.getMismatched() + 1);
            }
            if (h.getNotAfter() != null && h.getNotAfter().isBefore(d15)) {
                stats.setExpiringWithin15Days(stats.getExpiringWithin15Days() + 1);
            }
            if (h.getDomainExpiryDate() != null && h.getDomainExpiryDate().isBefore(d30)) {
                stats.setDomainExpiringWithin30Days(stats.getDomainExpiringWithin30Days() + 1);
            }
        }
        stats.setZones(zones.size());
        return stats;
    }

    /** 해석 불가/미점검 상태는 호스트명 검증을 하지 않았으므로 불일치로 보지 않는다 */
    private static boolean isMismatched(MonitoredHost h) {
        return !h.isHostnameMatch() && !h.isPlaceholder()
                && h.getStatus() != HostStatus.UNRESOLVABLE && h.getStatus() != HostStatus.PENDING;
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
