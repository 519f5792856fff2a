package com;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 애플리케이션의 진입점(메인 클래스)입니다.
 * - @SpringBootApplication : 컴포넌트 스캔(com 이하), 자동 설정, 설정 바인딩
 * - @EnableScheduling     : 크론 작업용 TaskScheduler 를 켭니다.
 *   (실제 동기화/재점검 주기는 저장된 알림 설정의 syncSchedule / scanSchedule 로 제어)
 */
@SpringBootApplication
@EnableScheduling
public class ZonewatchApplication {

    /** 자바 애플리케이션 시작 진입점 (내장 톰캣을 띄워 HTTP 서버가 구동됩니다) */
    public static void main(String[] args) {
        SpringApplication.run(ZonewatchApplication.class, args);
    }
}
