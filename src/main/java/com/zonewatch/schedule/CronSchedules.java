package com.zonewatch.schedule;

import org.springframework.scheduling.support.CronExpression;

/** 5필드(분 시 일 월 요일) / 6필드(초 포함) 크론 식을 Spring 형식으로 맞춘다 */
public final class CronSchedules {

    private CronSchedules() {
    }

    public static String normalize(String expression) {
        if (expression == null) return null;
        String trimmed = expression.trim().replaceAll("\\s+", " ");
        return trimmed.split(" ").length == 5 ? "0 " + trimmed : trimmed;
    }

    public static boolean isValid(String expression) {
        String normalized = normalize(expression);
        return normalized != null && !normalized.isEmpty() && CronExpression.isValidExpression(normalized);
    }
}
