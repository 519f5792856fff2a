package com.zonewatch.entity;

/**
 * 동기화 실행 결과.
 *
 * @param success 실패(프로바이더 오류, 안전 밸브 작동, 중복 실행)면 false
 * @param error   실패 사유
 */
public record SyncResult(boolean success, String error, SyncStats stats) {

    public static SyncResult ok(SyncStats stats) {
        return new SyncResult(true, null, stats);
    }

    public static SyncResult failed(String error, SyncStats stats) {
        return new SyncResult(false, error, stats);
    }
}
