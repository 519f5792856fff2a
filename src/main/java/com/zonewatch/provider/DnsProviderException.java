package com.zonewatch.provider;

/** DNS 프로바이더 API 호출 실패 (인증, 네트워크, 응답 오류) */
public class DnsProviderException extends RuntimeException {

    public DnsProviderException(String message) {
        super(message);
    }

    public DnsProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
