package com.zonewatch.entity;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * 동기화 1회의 집계. 여러 워커가 갱신하므로 호출 측이 하나의 락으로 감싸서 사용한다.
 */
@Getter
@ToString
public class SyncStats {

    private int added;
    private int updated;
    private int deleted;
    private int skipped;
    /** 프로바이더에서 받은 레코드 수 (스킵 포함) */
    private int total;

    /** 삭제된 호스트 이름 */
    private final List<String> deletedHosts = new ArrayList<>();
    /** 변경 내역 한 줄 요약 */
    private final List<String> updatedDetails = new ArrayList<>();

    public void incrementTotal() { total++; }

    public void incrementAdded() { added++; }

    public void incrementSkipped() { skipped++; }

    public void recordUpdated(String detail) {
        updated++;
        updatedDetails.add(detail);
    }

    public void recordDeleted(String hostname) {
        deleted++;
        deletedHosts.add(hostname);
    }
}
