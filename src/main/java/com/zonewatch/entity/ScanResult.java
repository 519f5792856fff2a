package com.zonewatch.entity;

import java.time.Duration;

/**
 * 전체 재점검 결과.
 *
 * @param active  만료 임계치보다 여유가 있는 정상 호스트
 * @param warning 정상이지만 임계치 안쪽으로 만료가 다가온 호스트
 */
public record ScanResult(boolean success, String error, int total, int active, int expired, int warning,
                         Duration duration) {

    public static ScanResult failed(String error) {
        return new ScanResult(false, error, 0, 0, 0, 0, Duration.ZERO);
    }
}
