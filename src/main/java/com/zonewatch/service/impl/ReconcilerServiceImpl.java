package com.zonewatch.service.impl;

import com.common.concurrent.BoundedChannel;
import com.common.concurrent.Deadline;
import com.common.service.CommonService;
import com.zonewatch.config.ZonewatchProperties;
import com.zonewatch.entity.EventType;
import com.zonewatch.entity.HostStatus;
import com.zonewatch.entity.MonitoredHost;
import com.zonewatch.entity.RegistrationInfo;
import com.zonewatch.entity.ScanResult;
import com.zonewatch.entity.SyncResult;
import com.zonewatch.entity.SyncStats;
import com.zonewatch.notify.TaskSummaryData;
import com.zonewatch.provider.DnsProviderException;
import com.zonewatch.provider.DnsZone;
import com.zonewatch.repository.HostRepository;
import com.zonewatch.schedule.RunCoordinator;
import com.zonewatch.service.NotifierService;
import com.zonewatch.service.ProberService;
import com.zonewatch.service.ReconcilerService;
import com.zonewatch.service.RecordSourceService;
import com.zonewatch.service.RegistrationLookupException;
import com.zonewatch.service.RegistrationLookupService;
import com.zonewatch.service.SettingsService;
import com.zonewatch.service.SkipPolicy;
import com.zonewatch.service.StreamReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

@Slf4j
@Service("ReconcilerService")
public class ReconcilerServiceImpl implements ReconcilerService {

    private static final Duration RENEWAL_MARGIN = Duration.ofHours(24);

    private final ZonewatchProperties props;
    private final RecordSourceService recordSource;
    private final ProberService prober;
    private final RegistrationLookupService registrationLookup;
    private final HostRepository hostRepository;
    private final NotifierService notifier;
    private final SettingsService settingsService;
    private final SkipPolicy skipPolicy;
    private final RunCoordinator runCoordinator;
    private final CommonService commonService;
    private final Clock clock;

    public ReconcilerServiceImpl(ZonewatchProperties props, RecordSourceService recordSource, ProberService prober,
                                 RegistrationLookupService registrationLookup, HostRepository hostRepository,
                                 NotifierService notifier, SettingsService settingsService, SkipPolicy skipPolicy,
                                 RunCoordinator runCoordinator, CommonService commonService, Clock clock) {
        this.props = props;
        this.recordSource = recordSource;
        this.prober = prober;
        this.registrationLookup = registrationLookup;
        this.hostRepository = hostRepository;
        this.notifier = notifier;
        this.settingsService = settingsService;
        this.skipPolicy = skipPolicy;
        this.runCoordinator = runCoordinator;
        this.commonService = commonService;
        this.clock = clock;
    }

    private static String key(String hostname, String recordId) {
        return hostname + "|" + (recordId == null ? "" : recordId);
    }

    /**
     * 동기화 1회의 상태. 워커들이 동시에 갱신하므로 모든 접근은 lock 으로 감싼다.
     */
    private static final class SyncRun {
        final Object lock = new Object();
        final SyncStats stats = new SyncStats();

        final Map<String, MonitoredHost> priorByKey = new HashMap<>();
        final Map<String, MonitoredHost> priorByHostname = new HashMap<>();
        final Set<String> priorZones = new HashSet<>();
        final List<MonitoredHost> prior;

        final Set<String> observedKeys = new HashSet<>();
        final Set<String> observedHostnames = new HashSet<>();
        /** 존 이름 → 점검 대상(제외되지 않은) 레코드 수 */
        final Map<String, Integer> eligibleByZone = new HashMap<>();

        SyncRun(List<MonitoredHost> prior) {
            this.prior = prior;
            for (MonitoredHost h : prior) {
                if (h.getZoneName() != null) priorZones.add(h.getZoneName());
                if (h.isPlaceholder()) continue;
                priorByKey.put(key(h.getHostname(), h.getProviderRecordId()), h);
                priorByHostname.putIfAbsent(h.getHostname().toLowerCase(), h);
            }
        }

        void observe(MonitoredHost record, boolean skipped) {
            synchronized (lock) {
                stats.incrementTotal();
                observedKeys.add(key(record.getHostname(), record.getProviderRecordId()));
                observedHostnames.add(record.getHostname().toLowerCase());
                if (skipped) {
                    stats.incrementSkipped();
                } else {
                    eligibleByZone.merge(record.getZoneName(), 1, Integer::sum);
                }
            }
        }

        int observedCount() {
            synchronized (lock) {
                return observedKeys.size();
            }
        }
    }

    // ------------------------------------------------------------------
    // 동기화
    // ------------------------------------------------------------------

    @Override
    public SyncResult performSync() {
        if (!runCoordinator.tryAcquire(RunCoordinator.SYNC)) {
            return SyncResult.failed("동기화가 이미 실행 중입니다.", new SyncStats());
        }
        try {
            return doSync();
        } finally {
            runCoordinator.release(RunCoordinator.SYNC);
        }
    }

    private SyncResult doSync() {
        long started = System.nanoTime();
        settingsService.reload();

        ZonewatchProperties.Sync cfg = props.getSync();
        Deadline deadline = Deadline.after(cfg.getTimeout());
        SyncRun run = new SyncRun(hostRepository.findAll());
        log.info("동기화 시작 (기존 레코드 {}건)", run.prior.size());

        // 1) 레코드 수집 스레드
        BoundedChannel<MonitoredHost> channel = new BoundedChannel<>(cfg.getChannelCapacity());
        ExecutorService producer = Executors.newSingleThreadExecutor(r -> daemon(r, "sync-source"));
        Future<StreamReport> source = producer.submit(() -> recordSource.stream(channel, deadline));
        producer.shutdown();

        // 2) 수신 → 워커 풀 (세마포어로 동시 점검 수 제한)
        ExecutorService pool = Executors.newFixedThreadPool(cfg.getConcurrency(), r -> daemon(r, "sync-worker"));
        Semaphore permits = new Semaphore(cfg.getConcurrency());
        try {
            while (true) {
                Optional<MonitoredHost> next = channel.receive(deadline);
                if (next.isEmpty()) break;
                MonitoredHost record = next.get();

                boolean skipped = skipPolicy.shouldSkip(record.getHostname());
                run.observe(record, skipped);
                if (skipped) continue;

                permits.acquire();
                pool.submit(() -> {
                    try {
                        processRecord(run, record, deadline);
                    } catch (RuntimeException e) {
                        log.error("레코드 처리 실패 {}: {}", record.getHostname(), e.getMessage(), e);
                    } finally {
                        permits.release();
                    }
                });
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deadline.cancel();
        } finally {
            // 3) 모든 워커 종료 대기
            pool.shutdown();
            awaitPool(pool, deadline, "동기화");
        }

        // 4) 수집 결과 확인 (실패면 삭제 단계로 가지 않음)
        StreamReport report;
        try {
            report = source.get(Math.max(1, deadline.remaining().toMillis()), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("레코드 수집 실패, 삭제 단계를 건너뜁니다: {}", cause.getMessage());
            return SyncResult.failed("레코드 수집 실패: " + cause.getMessage(), run.stats);
        } catch (TimeoutException e) {
            deadline.cancel();
            source.cancel(true);
            return SyncResult.failed("레코드 수집 시간 초과", run.stats);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deadline.cancel();
            source.cancel(true);
            return SyncResult.failed("동기화가 중단되었습니다.", run.stats);
        }

        // 5) 안전 밸브: 아무것도 못 받았는데 기존 데이터가 있으면 삭제하지 않는다
        if (run.observedCount() == 0 && !run.prior.isEmpty()) {
            String message = "프로바이더에서 레코드를 하나도 받지 못했습니다. 기존 " + run.prior.size() + "건 삭제를 건너뜁니다.";
            log.error(message);
            return SyncResult.failed(message, run.stats);
        }

        Set<String> currentZones = report.zones().stream().map(DnsZone::name).collect(Collectors.toSet());

        // 6) 존 변화, 7) 삭제, 8) 플레이스홀더
        Set<String> vanishedZones = detectZoneChanges(run, currentZones, report.failedZones());
        deletionPass(run, currentZones, vanishedZones, report.failedZones());
        cleanupPlaceholders(run, report.zones());

        // 9) 요약 알림
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        SyncStats stats = run.stats;
        log.info("동기화 완료: 추가 {}, 변경 {}, 삭제 {}, 제외 {}, 전체 {} ({})",
                stats.getAdded(), stats.getUpdated(), stats.getDeleted(), stats.getSkipped(), stats.getTotal(), formatDuration(elapsed));
        notifier.notifyTaskFinish(EventType.SYNC_FINISH, new TaskSummaryData(
                stats.getAdded(), stats.getUpdated(), stats.getDeleted(), stats.getSkipped(), stats.getTotal(),
                0, 0, 0, formatDuration(elapsed), commonService.formatDateTime(clock.instant()), ""));
        notifier.notifyTaskDetails("삭제된 도메인", stats.getDeletedHosts());
        notifier.notifyTaskDetails("변경된 도메인", stats.getUpdatedDetails());
        return SyncResult.ok(stats);
    }

    /** 워커 1건: 기존 값과 병합 → 점검 → 저장 → 이벤트 */
    private void processRecord(SyncRun run, MonitoredHost record, Deadline deadline) {
        if (deadline.isExpired()) return;

        String hostname = record.getHostname();
        MonitoredHost prior = run.priorByKey.get(key(hostname, record.getProviderRecordId()));
        MonitoredHost sameName = prior == null ? run.priorByHostname.get(hostname.toLowerCase()) : null;
        boolean zoneIsNew = !run.priorZones.contains(record.getZoneName());

        // 1) 기준 상태 만들기
        MonitoredHost base;
        if (prior != null) {
            // 기존 식별/사용자/관측 값 위에 프로바이더 값만 덮어쓴다
            base = prior.copy();
            base.copyProviderFieldsFrom(record);
        } else {
            base = hostRepository.upsert(record);
            if (sameName != null) {
                // 레코드 id 만 바뀐 경우: 사용자 설정을 이어받는다
                hostRepository.updateUserSettings(base.getId(), sameName.isIgnored(), sameName.getPort(), sameName.isAutoRenew());
                base.copyUserFieldsFrom(sameName);
            }
        }

        // 2) 무시된 호스트는 프로바이더 값만 반영
        if (base.isIgnored()) {
            hostRepository.updateProbeFields(base);
            return;
        }

        // 3) 점검 + 저장
        MonitoredHost result = probeAndPersist(base, deadline);

        // 4) 이벤트
        if (prior == null) {
            if (sameName == null) {
                synchronized (run.lock) {
                    run.stats.incrementAdded();
                }
                // 새 존의 하위 도메인은 ZONE_ADD 한 건으로 갈음
                if (!zoneIsNew) {
                    notifier.notifyOperation(EventType.ADD, hostname, addDetails(result));
                }
            }
        } else {
            String change = emitChangeEvents(prior, result);
            if (change != null) {
                synchronized (run.lock) {
                    run.stats.recordUpdated(change);
                }
            }
        }

        // 5) 새로 생긴 연결 오류만 즉시 경고 (만료 경고는 전체 점검에서)
        if (isFreshConnectionError(prior, result)) {
            notifier.checkAndNotify(result);
        }
    }

    /** @return 이번에 새로 나타난 존은 ZONE_ADD, 사라진 존은 ZONE_DELETE. 사라진 존 이름을 돌려준다. */
    private Set<String> detectZoneChanges(SyncRun run, Set<String> currentZones, Set<String> failedZones) {
        for (String zone : currentZones) {
            if (run.priorZones.contains(zone)) continue;
            int count;
            synchronized (run.lock) {
                count = run.eligibleByZone.getOrDefault(zone, 0);
            }
            log.info("새 존 발견: {} (하위 도메인 {}개)", zone, count);
            notifier.notifyOperation(EventType.ZONE_ADD, zone, "• 하위 도메인: " + count + "개");
        }

        Set<String> vanished = new HashSet<>();
        for (String zone : run.priorZones) {
            if (currentZones.contains(zone) || failedZones.contains(zone)) continue;
            vanished.add(zone);
            long affected = run.prior.stream()
                    .filter(h -> zone.equals(h.getZoneName()) && !h.isPlaceholder())
                    .count();
            log.info("존 제거: {} (영향 받는 도메인 {}개)", zone, affected);
            notifier.notifyOperation(EventType.ZONE_DELETE, zone, "• 영향 받는 도메인: " + affected + "개");
        }
        return vanished;
    }

    private void deletionPass(SyncRun run, Set<String> currentZones, Set<String> vanishedZones, Set<String> failedZones) {
        for (MonitoredHost h : run.prior) {
            String zone = h.getZoneName();

            if (h.isPlaceholder()) {
                // 존이 남아 있으면 플레이스홀더 정리 단계에서 판단
                if (!currentZones.contains(zone) && !failedZones.contains(zone)) {
                    hostRepository.delete(h.getId());
                }
                continue;
            }
            if (run.observedKeys.contains(key(h.getHostname(), h.getProviderRecordId()))) continue;
            if (skipPolicy.shouldSkip(h.getHostname())) continue;
            if (zone != null && failedZones.contains(zone)) continue;

            if (run.observedHostnames.contains(h.getHostname().toLowerCase())) {
                // 같은 이름의 새 레코드로 대체됨
                hostRepository.delete(h.getId());
                log.debug("대체된 레코드 삭제: {} ({})", h.getHostname(), h.getProviderRecordId());
                continue;
            }

            if (hostRepository.delete(h.getId())) {
                synchronized (run.lock) {
                    run.stats.recordDeleted(h.getHostname());
                }
                log.info("삭제: {}", h.getHostname());
                if (!vanishedZones.contains(zone)) {
                    notifier.notifyOperation(EventType.DELETE, h.getHostname(),
                            "• 레코드: " + nullToDash(h.getRecordType()) + " → " + nullToDash(h.getUpstreamTarget()));
                }
            }
        }
    }

    private void cleanupPlaceholders(SyncRun run, List<DnsZone> zones) {
        for (DnsZone zone : zones) {
            int real;
            synchronized (run.lock) {
                real = run.eligibleByZone.getOrDefault(zone.name(), 0);
            }
            if (real > 0) {
                // 실제 레코드가 생긴 존의 플레이스홀더는 지운다
                for (MonitoredHost h : run.prior) {
                    if (h.isPlaceholder() && zone.name().equals(h.getZoneName())) {
                        hostRepository.delete(h.getId());
                    }
                }
            } else if (hostRepository.findByHostname(zone.name()).isEmpty()) {
                hostRepository.create(MonitoredHost.placeholder(zone.name(), zone.id()));
                log.info("레코드가 없는 존 플레이스홀더 생성: {}", zone.name());
            }
        }
    }

    // ------------------------------------------------------------------
    // 전체 점검
    // ------------------------------------------------------------------

    @Override
    public ScanResult performScan() {
        if (!runCoordinator.tryAcquire(RunCoordinator.SCAN)) {
            return ScanResult.failed("전체 점검이 이미 실행 중입니다.");
        }
        try {
            return doScan();
        } finally {
            runCoordinator.release(RunCoordinator.SCAN);
        }
    }

    private ScanResult doScan() {
        long started = System.nanoTime();
        settingsService.reload();

        ZonewatchProperties.Scan cfg = props.getScan();
        Deadline deadline = Deadline.after(cfg.getTimeout());
        int threshold = props.getNotify().getExpiryThresholdDays();

        List<MonitoredHost> targets = hostRepository.findAll().stream()
                .filter(h -> !h.isIgnored() && !h.isPlaceholder())
                .toList();
        log.info("전체 점검 시작 ({}건)", targets.size());

        Object lock = new Object();
        int[] counts = new int[4];   // total, active, expired, warning

        ExecutorService pool = Executors.newFixedThreadPool(cfg.getConcurrency(), r -> daemon(r, "scan-worker"));
        for (MonitoredHost host : targets) {
            pool.submit(() -> {
                if (deadline.isExpired()) return;
                try {
                    MonitoredHost r = scanOne(host, true, deadline);
                    synchronized (lock) {
                        counts[0]++;
                        if (r.getStatus() == HostStatus.EXPIRED) counts[2]++;
                        else if (r.getStatus() == HostStatus.ACTIVE && r.getDaysRemaining() < threshold) counts[3]++;
                        else if (r.getStatus() == HostStatus.ACTIVE) counts[1]++;
                    }
                } catch (RuntimeException e) {
                    log.error("점검 실패 {}: {}", host.getHostname(), e.getMessage(), e);
                }
            });
        }
        pool.shutdown();
        awaitPool(pool, deadline, "전체 점검");

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        ScanResult result;
        synchronized (lock) {
            result = new ScanResult(true, null, counts[0], counts[1], counts[2], counts[3], elapsed);
        }
        log.info("전체 점검 완료: 전체 {}, 정상 {}, 만료 {}, 임박 {} ({})",
                result.total(), result.active(), result.expired(), result.warning(), formatDuration(elapsed));
        notifier.notifyTaskFinish(EventType.SCAN_FINISH, new TaskSummaryData(
                0, 0, 0, 0, result.total(), result.active(), result.expired(), result.warning(),
                formatDuration(elapsed), commonService.formatDateTime(clock.instant()), ""));
        return result;
    }

    @Override
    public MonitoredHost scanOne(MonitoredHost host, boolean checkExpiry) {
        return scanOne(host, checkExpiry, Deadline.after(props.getProbe().getHostTimeout()));
    }

    private MonitoredHost scanOne(MonitoredHost host, boolean checkExpiry, Deadline deadline) {
        MonitoredHost result = probeAndPersist(host, deadline);
        emitChangeEvents(host, result);
        if (checkExpiry || isFreshConnectionError(host, result)) {
            notifier.checkAndNotify(result);
        }
        return result;
    }

    @Override
    public MonitoredHost rescan(String id) {
        MonitoredHost host = hostRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("호스트를 찾을 수 없습니다: " + id));
        if (host.isPlaceholder()) {
            throw new IllegalArgumentException("플레이스홀더는 점검할 수 없습니다: " + host.getHostname());
        }

        // 프로바이더 값 새로고침 (실패해도 저장된 값으로 점검)
        if (host.getProviderZoneId() != null && host.getProviderRecordId() != null && !host.getProviderRecordId().isEmpty()) {
            try {
                recordSource.fetchRecord(host.getProviderZoneId(), host.getProviderRecordId())
                        .ifPresent(host::copyProviderFieldsFrom);
            } catch (DnsProviderException e) {
                log.warn("레코드 새로고침 실패 {}: {}", host.getHostname(), e.getMessage());
            }
        }
        return scanOne(host, true);
    }

    @Override
    public MonitoredHost inspect(String hostname, int port) {
        MonitoredHost result = prober.probe(hostname, port, Deadline.after(props.getProbe().getHostTimeout()));
        try {
            RegistrationInfo reg = registrationLookup.lookup(hostname);
            result.setDomainExpiryDate(reg.expiryDate());
            result.setDomainDaysLeft(reg.daysLeft());
        } catch (RegistrationLookupException e) {
            log.info("도메인 만료일 조회 실패 ({}): {}", hostname, e.getMessage());
        }
        return result;
    }

    // ------------------------------------------------------------------
    // 공통
    // ------------------------------------------------------------------

    /** 점검 결과를 base 에 덮어쓰고(식별/프로바이더/사용자 값은 유지) 등록 만료일을 채워 저장한다 */
    private MonitoredHost probeAndPersist(MonitoredHost base, Deadline deadline) {
        MonitoredHost fresh = prober.probe(base.getHostname(), base.getPort(), deadline);

        MonitoredHost result = base.copy();
        result.copyObservedFieldsFrom(fresh);

        RegistrationInfo reg = registrationLookup.cachedLookup(
                base.getHostname(), base.getDomainExpiryDate(), base.getDomainDaysLeft());
        result.setDomainExpiryDate(reg.expiryDate());
        result.setDomainDaysLeft(reg.daysLeft());

        hostRepository.updateProbeFields(result);
        return result;
    }

    /**
     * 이전 상태와 비교해 RENEW 또는 UPDATE 알림을 한 건 보낸다. 이전 상태가 pending 이면 조용히 넘어간다.
     * 인증서가 갱신됐으면 다른 변경 내용도 RENEW 에 함께 싣는다.
     *
     * @return 레코드 설정(값/유형/프록시) 변경 요약 한 줄, 설정 변경이 없으면 null
     */
    private String emitChangeEvents(MonitoredHost old, MonitoredHost now) {
        if (old.getStatus() == HostStatus.PENDING) return null;

        String hostname = now.getHostname();
        List<String> configChanges = configDiff(old, now);
        List<String> changes = new ArrayList<>(configChanges);
        changes.addAll(statusDiff(old, now));

        if (isRenewal(old, now)) {
            List<String> lines = new ArrayList<>();
            lines.add("• 이전 만료일: " + commonService.formatDate(old.getNotAfter()));
            lines.add("• 새 만료일: " + commonService.formatDate(now.getNotAfter()));
            lines.add("• 남은 일수: " + now.getDaysRemaining() + "일");
            lines.addAll(changes);
            notifier.notifyOperation(EventType.RENEW, hostname, String.join("\n", lines));
        } else if (!changes.isEmpty()) {
            notifier.notifyOperation(EventType.UPDATE, hostname, String.join("\n", changes));
        }

        // 집계의 "변경" 은 프로바이더 레코드 설정이 바뀐 경우만
        if (configChanges.isEmpty()) return null;
        return hostname + ": " + configChanges.stream().map(c -> c.replace("• ", "")).collect(Collectors.joining(", "));
    }

    static boolean isRenewal(MonitoredHost old, MonitoredHost now) {
        return old.getNotAfter() != null && now.getNotAfter() != null
                && now.getNotAfter().isAfter(old.getNotAfter().plus(RENEWAL_MARGIN));
    }

    /** 레코드 값/유형, 프록시 */
    static List<String> configDiff(MonitoredHost old, MonitoredHost now) {
        List<String> lines = new ArrayList<>();
        if (!Objects.equals(old.getUpstreamTarget(), now.getUpstreamTarget())) {
            lines.add("• 레코드 값: " + nullToDash(old.getUpstreamTarget()) + " → " + nullToDash(now.getUpstreamTarget()));
        }
        if (!Objects.equals(old.getRecordType(), now.getRecordType())) {
            lines.add("• 레코드 유형: " + nullToDash(old.getRecordType()) + " → " + nullToDash(now.getRecordType()));
        }
        if (old.isProxied() != now.isProxied()) {
            lines.add("• 프록시: " + onOff(old.isProxied()) + " → " + onOff(now.isProxied()));
        }
        return lines;
    }

    /** 상태 전이와 새 오류 메시지 */
    static List<String> statusDiff(MonitoredHost old, MonitoredHost now) {
        List<String> lines = new ArrayList<>();
        // 연결 오류로 바뀐 것은 경고 알림이 따로 나간다
        if (old.getStatus() != now.getStatus() && now.getStatus() != HostStatus.CONNECTION_ERROR) {
            if (old.getStatus() == HostStatus.CONNECTION_ERROR && now.getStatus() == HostStatus.ACTIVE) {
                lines.add("• 연결 복구: connection_error → active");
            } else {
                lines.add("• 상태: " + code(old.getStatus()) + " → " + code(now.getStatus()));
            }
        }
        if (now.getStatus() != HostStatus.CONNECTION_ERROR && now.getErrorMessage() != null
                && !now.getErrorMessage().isEmpty() && !now.getErrorMessage().equals(old.getErrorMessage())) {
            lines.add("• 오류: " + now.getErrorMessage());
        }
        return lines;
    }

    private String addDetails(MonitoredHost h) {
        return "• 레코드: " + nullToDash(h.getRecordType()) + " → " + nullToDash(h.getUpstreamTarget()) + "\n"
                + "• 프록시: " + onOff(h.isProxied()) + "\n"
                + "• 상태: " + code(h.getStatus()) + "\n"
                + "• 도메인 만료일: " + (h.getDomainExpiryDate() == null ? "-" : commonService.formatDate(h.getDomainExpiryDate()));
    }

    private static boolean isFreshConnectionError(MonitoredHost old, MonitoredHost now) {
        return now.getStatus() == HostStatus.CONNECTION_ERROR
                && (old == null || old.getStatus() != HostStatus.CONNECTION_ERROR);
    }

    private static void awaitPool(ExecutorService pool, Deadline deadline, String label) {
        try {
            if (!pool.awaitTermination(Math.max(1, deadline.remaining().toMillis()), TimeUnit.MILLISECONDS)) {
                log.warn("{} 시간 초과, 남은 작업을 취소합니다.", label);
                deadline.cancel();
                pool.shutdownNow();
                pool.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deadline.cancel();
            pool.shutdownNow();
        }
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    static String formatDuration(Duration d) {
        long seconds = d.getSeconds();
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String code(HostStatus status) {
        return status == null ? "-" : status.code();
    }

    private static String onOff(boolean on) {
        return on ? "켜짐" : "꺼짐";
    }

    private static String nullToDash(String s) {
        return s == null || s.isEmpty() ? "-" : s;
    }
}
