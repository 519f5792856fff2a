package com.zonewatch.web;

import com.common.service.CommonService;
import com.zonewatch.config.ZonewatchProperties;
import com.zonewatch.entity.AlertSettings;
import com.zonewatch.entity.DashboardStats;
import com.zonewatch.entity.HostQuery;
import com.zonewatch.entity.HostSettingsRequest;
import com.zonewatch.entity.IgnoreRequest;
import com.zonewatch.entity.MonitoredHost;
import com.zonewatch.entity.PageResult;
import com.zonewatch.repository.HostRepository;
import com.zonewatch.schedule.RunCoordinator;
import com.zonewatch.service.NotifierService;
import com.zonewatch.service.ReconcilerService;
import com.zonewatch.service.SettingsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * HTTP API 엔드포인트를 제공하는 컨트롤러 계층입니다.
 * - 동기화 / 전체 재점검 실행 (비동기, 202)
 * - 호스트 목록 조회와 사용자 설정 변경
 * - 알림 설정 조회/저장/테스트
 * - 저장하지 않는 단건 점검 (inspect)
 */
@Slf4j
@Tag(name = "ZoneWatch", description = "DNS 레코드 / 인증서 / 도메인 만료 모니터링 API")
@RestController
@RequestMapping("/api")
public class ZonewatchController {

    private final ReconcilerService reconciler;
    private final HostRepository hostRepository;
    private final SettingsService settingsService;
    private final NotifierService notifier;
    private final RunCoordinator runCoordinator;
    private final CommonService commonService;
    private final ZonewatchProperties props;
    private final ThreadPoolTaskExecutor jobExecutor;

    /** 생성자 주입 */
    public ZonewatchController(ReconcilerService reconciler, HostRepository hostRepository,
                               SettingsService settingsService, NotifierService notifier,
                               RunCoordinator runCoordinator, CommonService commonService,
                               ZonewatchProperties props, ThreadPoolTaskExecutor zonewatchJobExecutor) {
        this.reconciler = reconciler;
        this.hostRepository = hostRepository;
        this.settingsService = settingsService;
        this.notifier = notifier;
        this.runCoordinator = runCoordinator;
        this.commonService = commonService;
        this.props = props;
        this.jobExecutor = zonewatchJobExecutor;
    }

    // ---- 작업 실행 ----

    @Operation(summary = "동기화 실행", description = "Cloudflare 레코드를 읽어 저장소와 맞추고 새/변경 호스트를 점검합니다. 백그라운드에서 실행됩니다.")
    @PostMapping("/sync")
    public ResponseEntity<Map<String, String>> sync() {
        if (runCoordinator.isRunning(RunCoordinator.SYNC)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("message", "동기화가 이미 실행 중입니다."));
        }
        jobExecutor.execute(() -> {
            var result = reconciler.performSync();
            if (!result.success()) log.warn("동기화 실패: {}", result.error());
        });
        return ResponseEntity.accepted().body(Map.of("message", "동기화를 시작했습니다."));
    }

    @Operation(summary = "전체 재점검 실행", description = "무시되지 않은 모든 호스트의 인증서를 다시 점검하고 만료 경고를 보냅니다.")
    @PostMapping("/scan")
    public ResponseEntity<Map<String, String>> scan() {
        if (runCoordinator.isRunning(RunCoordinator.SCAN)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("message", "전체 재점검이 이미 실행 중입니다."));
        }
        jobExecutor.execute(() -> {
            var result = reconciler.performScan();
            if (!result.success()) log.warn("전체 재점검 실패: {}", result.error());
        });
        return ResponseEntity.accepted().body(Map.of("message", "전체 재점검을 시작했습니다."));
    }

    // ---- 호스트 ----

    @Operation(summary = "호스트 목록", description = "검색/상태/프록시/존 필터와 정렬, 페이지 단위 조회")
    @GetMapping("/hosts")
    public ResponseEntity<PageResult<MonitoredHost>> listHosts(@ModelAttribute HostQuery query) {
        return ResponseEntity.ok(hostRepository.list(query));
    }

    @Operation(summary = "대시보드 통계")
    @GetMapping("/hosts/stats")
    public ResponseEntity<DashboardStats> stats() {
        return ResponseEntity.ok(hostRepository.getStatistics());
    }

    @Operation(summary = "존 이름 목록")
    @GetMapping("/hosts/zones")
    public ResponseEntity<List<String>> zones() {
        return ResponseEntity.ok(hostRepository.findZoneNames());
    }

    @Operation(summary = "호스트 사용자 설정 변경", description = "ignored / port / autoRenew 중 보낸 값만 바꿉니다.")
    @PutMapping("/hosts/{id}/settings")
    public ResponseEntity<MonitoredHost> updateHostSettings(@PathVariable String id, @RequestBody HostSettingsRequest request) {
        if (request.port() != null && (request.port() < 1 || request.port() > 65535)) {
            throw new IllegalArgumentException("포트 범위가 올바르지 않습니다: " + request.port());
        }
        MonitoredHost updated = hostRepository.updateUserSettings(id, request.ignored(), request.port(), request.autoRenew())
                .orElseThrow(() -> new NoSuchElementException("호스트를 찾을 수 없습니다: " + id));
        return ResponseEntity.ok(updated);
    }

    @Operation(summary = "여러 호스트 무시 설정")
    @PostMapping("/hosts/ignore")
    public ResponseEntity<Map<String, Integer>> batchIgnore(@RequestBody IgnoreRequest request) {
        if (request.ids() == null || request.ids().isEmpty()) {
            throw new IllegalArgumentException("ids 가 비어 있습니다.");
        }
        int changed = hostRepository.batchUpdateIgnored(request.ids(), request.ignored());
        return ResponseEntity.ok(Map.of("updated", changed));
    }

    @Operation(summary = "호스트 삭제", description = "다음 동기화에서 레코드가 남아 있으면 다시 추가됩니다.")
    @DeleteMapping("/hosts/{id}")
    public ResponseEntity<Void> deleteHost(@PathVariable String id) {
        if (!hostRepository.delete(id)) {
            throw new NoSuchElementException("호스트를 찾을 수 없습니다: " + id);
        }
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "호스트 단건 재점검", description = "레코드를 새로 읽고 즉시 점검한 뒤 결과를 반환합니다.")
    @PostMapping("/hosts/{id}/scan")
    public ResponseEntity<MonitoredHost> rescan(@PathVariable String id) {
        return ResponseEntity.ok(reconciler.rescan(id));
    }

    // ---- 설정 ----

    @Operation(summary = "알림 설정 조회", description = "저장된 설정을 돌려줍니다. 토큰과 비밀번호는 가려집니다.")
    @GetMapping("/settings")
    public ResponseEntity<AlertSettings> getSettings() {
        return ResponseEntity.ok(settingsService.stored().masked());
    }

    @Operation(summary = "알림 설정 저장", description = "보낸 필드만 병합 저장합니다. 템플릿과 크론 식을 검증하며, 다음 작업부터 적용됩니다.")
    @PutMapping("/settings")
    public ResponseEntity<AlertSettings> saveSettings(@RequestBody AlertSettings patch) {
        return ResponseEntity.ok(settingsService.save(patch).masked());
    }

    @Operation(summary = "테스트 알림 전송", description = "저장하지 않은 설정으로 켜진 채널에 즉시 보냅니다.")
    @PostMapping("/settings/test")
    public ResponseEntity<Map<String, String>> testSettings(@RequestBody AlertSettings candidate) {
        return ResponseEntity.ok(notifier.sendTestMessage(candidate));
    }

    // ---- 단건 점검 ----

    @Operation(summary = "임의 대상 점검", description = "host 또는 host:port 를 저장하지 않고 점검합니다.")
    @GetMapping("/inspect")
    public ResponseEntity<MonitoredHost> inspect(@RequestParam String target) {
        String[] parsed = commonService.parseTarget(target, props.getProbe().getDefaultPort());
        if (parsed == null) {
            throw new IllegalArgumentException("점검 대상 형식이 올바르지 않습니다: " + target);
        }
        return ResponseEntity.ok(reconciler.inspect(parsed[0], Integer.parseInt(parsed[1])));
    }
}
