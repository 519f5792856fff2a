package com.zonewatch.service.impl;

import com.common.service.CommonService;
import com.google.common.collect.Lists;
import com.google.common.html.HtmlEscapers;
import com.google.common.util.concurrent.Striped;
import com.zonewatch.config.ZonewatchProperties;
import com.zonewatch.entity.AlertSettings;
import com.zonewatch.entity.EventType;
import com.zonewatch.entity.HostStatus;
import com.zonewatch.entity.MonitoredHost;
import com.zonewatch.notify.DefaultTemplates;
import com.zonewatch.notify.DeliveryWorker;
import com.zonewatch.notify.ExpiryTemplateData;
import com.zonewatch.notify.NotificationChannel;
import com.zonewatch.notify.OperationTemplateData;
import com.zonewatch.notify.TaskSummaryData;
import com.zonewatch.notify.TemplateRenderException;
import com.zonewatch.notify.TemplateRenderer;
import com.zonewatch.repository.HostRepository;
import com.zonewatch.service.NotifierService;
import com.zonewatch.service.SettingsService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;

@Slf4j
@Service("NotifierService")
public class NotifierServiceImpl implements NotifierService {

    static final String MISMATCH_LINE = "⚠️ 인증서가 호스트명과 일치하지 않습니다.";

    private final SettingsService settingsService;
    private final HostRepository hostRepository;
    private final TemplateRenderer renderer;
    private final CommonService commonService;
    private final ZonewatchProperties props;
    private final Clock clock;
    private final List<DeliveryWorker> workers = new ArrayList<>();
    /** 호스트별 중복 방지 검사와 기록을 묶는 락 */
    private final Striped<Lock> alertLocks = Striped.lock(64);

    public NotifierServiceImpl(SettingsService settingsService, HostRepository hostRepository,
                               TemplateRenderer renderer, CommonService commonService,
                               ZonewatchProperties props, Clock clock, List<NotificationChannel> channels) {
        this.settingsService = settingsService;
        this.hostRepository = hostRepository;
        this.renderer = renderer;
        this.commonService = commonService;
        this.props = props;
        this.clock = clock;
        for (NotificationChannel channel : channels) {
            workers.add(new DeliveryWorker(channel, props.getNotify().getQueueCapacity(), props.getNotify().getSendInterval()));
        }
    }

    @PostConstruct
    public void start() {
        workers.forEach(DeliveryWorker::start);
        log.info("알림 채널 {}개 전송 스레드 시작", workers.size());
    }

    @PreDestroy
    public void stop() {
        workers.forEach(DeliveryWorker::shutdown);
    }

    @Override
    public void notifyOperation(EventType type, String domain, String details) {
        // 만료일을 모르는 상태의 갱신 알림은 잘못된 데이터
        if (type == EventType.RENEW && details != null && details.contains(CommonService.ZERO_DATE)) {
            log.warn("잘못된 갱신 알림을 버립니다 ({}): {}", domain, details);
            return;
        }
        AlertSettings settings = settingsService.current();
        if (!settings.isNotifyEnabled(type)) return;

        OperationTemplateData data = new OperationTemplateData(
                type.name(), escape(domain), details == null ? "" : details, commonService.formatDateTime(clock.instant()));
        try {
            dispatch(settings, renderer.render(templateFor(settings, type), data));
        } catch (TemplateRenderException e) {
            log.error("{} 템플릿 렌더링 실패, 알림을 보내지 않습니다: {}", type, e.getMessage());
        }
    }

    @Override
    public void notifyTaskFinish(EventType type, TaskSummaryData summary) {
        AlertSettings settings = settingsService.current();
        if (!settings.isNotifyEnabled(type)) return;
        try {
            dispatch(settings, renderer.render(templateFor(settings, type), summary));
        } catch (TemplateRenderException e) {
            log.error("{} 템플릿 렌더링 실패, 알림을 보내지 않습니다: {}", type, e.getMessage());
        }
    }

    @Override
    public void notifyTaskDetails(String title, List<String> lines) {
        if (lines == null || lines.isEmpty()) return;
        AlertSettings settings = settingsService.current();
        if (!settings.isNotifyEnabled(EventType.SYNC_FINISH)) return;

        List<List<String>> batches = Lists.partition(lines, Math.max(1, props.getSync().getDetailsBatchSize()));
        for (int i = 0; i < batches.size(); i++) {
            String message = "📋 <b>" + title + " (" + (i + 1) + "/" + batches.size() + ")</b>\n"
                    + String.join("\n", batches.get(i));
            dispatch(settings, message);
        }
    }

    @Override
    public boolean checkAndNotify(MonitoredHost host) {
        if (host.isIgnored() || host.isPlaceholder()) return false;
        boolean connectionError = host.getStatus() == HostStatus.CONNECTION_ERROR;
        if (host.getNotAfter() == null && !connectionError) return false;

        // 1) 경고 사유 수집
        List<String> reasons = collectReasons(host, connectionError);
        if (reasons.isEmpty()) return false;

        AlertSettings settings = settingsService.current();
        if (!settings.isNotifyEnabled(EventType.EXPIRY)) return false;

        // 2) 같은 호스트에 대한 검사와 기록은 한 번에 하나씩
        Lock lock = alertLocks.get(host.getId() != null ? host.getId() : host.getHostname());
        lock.lock();
        try {
            // 24시간 중복 방지 (저장된 마지막 알림 시각 기준)
            Instant now = clock.instant();
            Instant last = host.getLastAlertTime();
            if (host.getId() != null) {
                last = hostRepository.findById(host.getId()).map(MonitoredHost::getLastAlertTime).orElse(last);
            }
            if (last != null && Duration.between(last, now).compareTo(props.getNotify().getAntiSpamWindow()) < 0) {
                log.debug("최근 알림이 있어 건너뜀: {} (마지막 {})", host.getHostname(), last);
                return false;
            }

            // 3) 메시지 작성
            String reason = escape(String.join(", ", reasons));
            String message;
            try {
                message = renderer.render(templateFor(settings, EventType.EXPIRY), expiryData(host, reason));
            } catch (TemplateRenderException e) {
                log.error("만료 템플릿 렌더링 실패, 기본 형식으로 보냅니다: {}", e.getMessage());
                message = fallbackMessage(host, reason);
            }
            if (!message.contains(reason)) {
                message += "\n• 원인: " + reason;
            }
            if (!host.isHostnameMatch() && !connectionError && !message.contains(MISMATCH_LINE)) {
                message += "\n" + MISMATCH_LINE;
            }

            // 4) 전송 후 알림 시각 기록
            dispatch(settings, message);
            host.setLastAlertTime(now);
            if (host.getId() != null) {
                hostRepository.updateLastAlertTime(host.getId(), now);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private List<String> collectReasons(MonitoredHost host, boolean connectionError) {
        int threshold = props.getNotify().getExpiryThresholdDays();
        List<String> reasons = new ArrayList<>();

        if (connectionError) {
            reasons.add("연결 실패 (" + host.getErrorMessage() + ")");
        } else {
            if (host.getDaysRemaining() < 0) {
                reasons.add("SSL 인증서 만료됨");
            } else if (host.getDaysRemaining() < threshold) {
                reasons.add("SSL 인증서 만료 임박 (" + host.getDaysRemaining() + "일)");
            }
            if (!host.isHostnameMatch()) {
                reasons.add("호스트명 불일치");
            }
        }
        if (host.getDomainExpiryDate() != null) {
            if (host.getDomainDaysLeft() < 0) {
                reasons.add("도메인 등록 만료됨");
            } else if (host.getDomainDaysLeft() < threshold) {
                reasons.add("도메인 등록 만료 임박 (" + host.getDomainDaysLeft() + "일)");
            }
        }
        return reasons;
    }

    private ExpiryTemplateData expiryData(MonitoredHost host, String reason) {
        return new ExpiryTemplateData(
                escape(host.getHostname()),
                host.getStatus() == null ? "" : host.getStatus().code(),
                host.getDaysRemaining(),
                host.getDomainDaysLeft(),
                host.getNotAfter() == null ? "-" : commonService.formatDateTime(host.getNotAfter()),
                escape(host.getIssuer()),
                String.join(", ", host.getResolvedIps()),
                host.getTlsVersion(),
                host.getHttpStatusCode(),
                escape(host.getUpstreamTarget()),
                reason);
    }

    private String fallbackMessage(MonitoredHost host, String reason) {
        return "⚠️ <b>인증서/도메인 경고</b>\n"
                + "• 대상: <code>" + escape(host.getHostname()) + "</code>\n"
                + "• 원인: " + reason + "\n"
                + "• SSL 남은 일수: <b>" + host.getDaysRemaining() + "일</b>";
    }

    @Override
    public Map<String, String> sendTestMessage(AlertSettings candidate) {
        AlertSettings settings = settingsService.current().copy();
        settings.mergeFrom(candidate);

        String message = "🔔 <b>테스트 알림</b>\n• 시각: " + commonService.formatDateTime(clock.instant());
        Map<String, String> results = new LinkedHashMap<>();
        for (DeliveryWorker worker : workers) {
            NotificationChannel channel = worker.channel();
            if (!channel.isEnabled(settings)) continue;
            try {
                channel.send(settings, message);
                results.put(channel.name(), "ok");
            } catch (IOException e) {
                log.warn("[{}] 테스트 알림 실패: {}", channel.name(), e.getMessage());
                results.put(channel.name(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.put(channel.name(), "중단됨");
            }
        }
        if (results.isEmpty()) {
            throw new IllegalArgumentException("활성화된 알림 채널이 없습니다.");
        }
        return results;
    }

    int pendingDeliveries() {
        return workers.stream().mapToInt(DeliveryWorker::pending).sum();
    }

    private void dispatch(AlertSettings settings, String message) {
        for (DeliveryWorker worker : workers) {
            if (worker.channel().isEnabled(settings)) {
                worker.offer(settings, message);
            }
        }
    }

    private String templateFor(AlertSettings settings, EventType type) {
        String custom = settings.templateFor(type);
        return commonService.stringNullCheck(custom) ? custom : DefaultTemplates.of(type);
    }

    private static String escape(String s) {
        return s == null ? "" : HtmlEscapers.htmlEscaper().escape(s);
    }
}
