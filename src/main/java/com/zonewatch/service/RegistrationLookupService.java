package com.zonewatch.service;

import com.zonewatch.entity.RegistrationInfo;

import java.time.Instant;

public interface RegistrationLookupService {

    /** 공개 접미사 규칙으로 구한 등록 도메인 (sub.example.co.uk → example.co.uk) */
    String rootDomain(String hostname);

    /** 캐시 없이 바로 조회 */
    RegistrationInfo lookup(String hostname) throws RegistrationLookupException;

    /**
     * 이전 값이 충분히 남아 있으면 남은 일수만 다시 계산하고, 아니면 조회합니다.
     * 조회에 실패하면 이전 값을 그대로 돌려줍니다.
     */
    RegistrationInfo cachedLookup(String hostname, Instant priorExpiry, int priorDaysLeft);
}
