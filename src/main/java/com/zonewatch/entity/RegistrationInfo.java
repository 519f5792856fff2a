package com.zonewatch.entity;

import java.time.Instant;

/**
 * 도메인 등록 만료 정보.
 *
 * @param expiryDate 알 수 없으면 null
 * @param daysLeft   expiryDate 가 null 이면 0
 */
public record RegistrationInfo(Instant expiryDate, int daysLeft) {

    public static final RegistrationInfo UNKNOWN = new RegistrationInfo(null, 0);
}
