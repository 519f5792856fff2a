package com.zonewatch.entity;

import java.util.List;

/** POST /api/hosts/ignore 요청 본문 */
public record IgnoreRequest(List<String> ids, boolean ignored) {
}
