package com.common.service;

import java.time.Instant;

public interface CommonService {

    /** 값이 없는 날짜를 표시할 때 쓰는 문자열 (알림 본문에 이 값이 섞이면 잘못된 데이터로 본다) */
    String ZERO_DATE = "0001-01-01";

    String[] parseTarget(String line, int defaultPort);

    boolean stringNullCheck(String obj);

    Instant parseFlexibleDate(String raw);

    int daysUntil(Instant now, Instant target);

    String formatDate(Instant instant);

    String formatDateTime(Instant instant);
}
