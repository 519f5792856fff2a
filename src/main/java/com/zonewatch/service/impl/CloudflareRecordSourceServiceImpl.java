package com.zonewatch.service.impl;

import com.common.concurrent.BoundedChannel;
import com.common.concurrent.Deadline;
import com.zonewatch.config.ZonewatchProperties;
import com.zonewatch.entity.MonitoredHost;
import com.zonewatch.entity.RegistrationInfo;
import com.zonewatch.provider.DnsProviderClient;
import com.zonewatch.provider.DnsProviderException;
import com.zonewatch.provider.DnsRecord;
import com.zonewatch.provider.DnsZone;
import com.zonewatch.provider.RecordPage;
import com.zonewatch.repository.HostRepository;
import com.zonewatch.service.RecordSourceService;
import com.zonewatch.service.RegistrationLookupException;
import com.zonewatch.service.RegistrationLookupService;
import com.zonewatch.service.SkipPolicy;
import com.zonewatch.service.StreamReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service("RecordSourceService")
public class CloudflareRecordSourceServiceImpl implements RecordSourceService {

    private static final Set<String> MONITORED_TYPES = Set.of("A", "CNAME");

    private final ZonewatchProperties props;
    private final DnsProviderClient provider;
    private final HostRepository hostRepository;
    private final RegistrationLookupService registrationLookup;
    private final SkipPolicy skipPolicy;

    public CloudflareRecordSourceServiceImpl(ZonewatchProperties props, DnsProviderClient provider,
                                             HostRepository hostRepository, RegistrationLookupService registrationLookup,
                                             SkipPolicy skipPolicy) {
        this.props = props;
        this.provider = provider;
        this.hostRepository = hostRepository;
        this.registrationLookup = registrationLookup;
        this.skipPolicy = skipPolicy;
    }

    @Override
    public StreamReport stream(BoundedChannel<MonitoredHost> channel, Deadline deadline) {
        ZonewatchProperties.Cloudflare cfg = props.getCloudflare();
        List<DnsZone> completed = new ArrayList<>();
        Set<String> failed = new LinkedHashSet<>();

        try {
            // 1) 존 목록 (실패하면 실행 전체 실패)
            List<DnsZone> zones = resolveZones();
            log.info("Cloudflare 존 {}개 조회", zones.size());

            // 2) 존별 레코드
            for (int i = 0; i < zones.size(); i++) {
                DnsZone zone = zones.get(i);
                if (i > 0) Thread.sleep(cfg.getZoneDelay().toMillis());
                checkDeadline(deadline);

                try {
                    streamZone(zone, channel, deadline);
                    completed.add(zone);
                } catch (DnsProviderException e) {
                    log.error("존 {} 레코드 조회 실패, 건너뜀: {}", zone.name(), e.getMessage());
                    failed.add(zone.name());
                }
            }
            // 마지막 존에서 시간이 다 된 경우도 실패로 본다
            checkDeadline(deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DnsProviderException("레코드 수집이 중단되었습니다.", e);
        } finally {
            channel.close();
        }
        return new StreamReport(completed, failed);
    }

    private List<DnsZone> resolveZones() {
        List<String> ids = props.getCloudflare().getZoneIds();
        if (ids == null || ids.isEmpty()) {
            return provider.listZones();
        }
        List<DnsZone> zones = new ArrayList<>();
        for (String id : ids) {
            zones.add(provider.getZone(id.trim()));
        }
        return zones;
    }

    private void streamZone(DnsZone zone, BoundedChannel<MonitoredHost> channel, Deadline deadline)
            throws InterruptedException {
        ZonewatchProperties.Cloudflare cfg = props.getCloudflare();

        // 존 단위 등록 만료일 (실패해도 계속)
        RegistrationInfo registration = zoneRegistration(zone);

        int page = 1;
        while (true) {
            RecordPage result = provider.listRecords(zone.id(), page, cfg.getPageSize());
            for (DnsRecord record : result.records()) {
                if (!MONITORED_TYPES.contains(record.type())) continue;

                MonitoredHost host = toHost(zone, record);
                host.setDomainExpiryDate(registration.expiryDate());
                host.setDomainDaysLeft(registration.daysLeft());

                if (!skipPolicy.shouldSkip(host.getHostname())) {
                    persistPending(host);
                }
                if (!channel.send(host, deadline)) {
                    throw new DnsProviderException("실행 시간이 초과되어 레코드 전송을 포기합니다.");
                }
            }
            if (!result.hasNext()) break;
            page++;
            Thread.sleep(cfg.getPageDelay().toMillis());
            checkDeadline(deadline);
        }
    }

    private RegistrationInfo zoneRegistration(DnsZone zone) {
        try {
            return registrationLookup.lookup(zone.name());
        } catch (RegistrationLookupException e) {
            log.warn("존 {} 등록 만료일 조회 실패: {}", zone.name(), e.getMessage());
            return RegistrationInfo.UNKNOWN;
        }
    }

    /** 처음 보는 호스트는 점검 전에 pending 으로 먼저 기록해 둔다 */
    private void persistPending(MonitoredHost host) {
        if (hostRepository.findByHostname(host.getHostname()).isPresent()) return;
        try {
            hostRepository.upsert(host);
        } catch (RuntimeException e) {
            log.error("pending 기록 실패 {}: {}", host.getHostname(), e.getMessage());
        }
    }

    private static void checkDeadline(Deadline deadline) {
        if (deadline.isExpired()) {
            throw new DnsProviderException("실행 시간이 초과되어 레코드 수집을 중단합니다.");
        }
    }

    @Override
    public Optional<MonitoredHost> fetchRecord(String zoneId, String recordId) {
        DnsRecord record = provider.getRecord(zoneId, recordId);
        if (record == null || record.id() == null || record.id().isEmpty()) return Optional.empty();
        DnsZone zone = new DnsZone(zoneId, record.zoneName(), "");
        return Optional.of(toHost(zone, record));
    }

    private MonitoredHost toHost(DnsZone zone, DnsRecord record) {
        MonitoredHost host = MonitoredHost.pending(
                record.name(), zone.id(), zone.name(), record.id(),
                record.type(), record.content(), record.proxied(), record.comment());
        host.setPort(props.getProbe().getDefaultPort());
        return host;
    }
}
