package com.zonewatch.probe;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.xbill.DNS.CNAMERecord;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.Record;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 호스트명 해석.
 * 주소는 OS 리졸버(InetAddress)로, CNAME 은 dnsjava 로 직접 질의한다.
 */
@Slf4j
@Component
public class DnsResolver {

    /**
     * A/AAAA 주소 목록 (문자열 정렬).
     *
     * @throws UnknownHostException 해석 실패
     */
    public List<String> resolveAddresses(String hostname) throws UnknownHostException {
        InetAddress[] addrs = InetAddress.getAllByName(hostname);
        return Arrays.stream(addrs)
                .map(InetAddress::getHostAddress)
                .distinct()
                .sorted()
                .toList();
    }

    /** CNAME 대상 (끝의 점 제거). 없거나 조회 실패면 empty. */
    public Optional<String> lookupCname(String hostname) {
        try {
            Lookup lookup = new Lookup(hostname, Type.CNAME);
            Record[] records = lookup.run();
            if (lookup.getResult() != Lookup.SUCCESSFUL || records == null) {
                return Optional.empty();
            }
            for (Record r : records) {
                if (r instanceof CNAMERecord) {
                    return Optional.of(((CNAMERecord) r).getTarget().toString(true));
                }
            }
        } catch (TextParseException e) {
            log.debug("CNAME 조회 불가 호스트명: {} ({})", hostname, e.getMessage());
        }
        return Optional.empty();
    }
}
