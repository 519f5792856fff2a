package com.zonewatch.service;

/** WHOIS / RDAP 로 등록 만료일을 얻지 못함 */
public class RegistrationLookupException extends Exception {

    public RegistrationLookupException(String message) {
        super(message);
    }

    public RegistrationLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
