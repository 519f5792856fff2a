package com.zonewatch.entity;

/**
 * PUT /api/hosts/{id}/settings 요청 본문. null 인 필드는 바꾸지 않는다.
 */
public record HostSettingsRequest(Boolean ignored, Integer port, Boolean autoRenew) {
}
