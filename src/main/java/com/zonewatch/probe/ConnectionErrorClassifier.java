package com.zonewatch.probe;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;

/** TLS 연결 실패 예외를 사용자에게 보여줄 짧은 메시지로 바꾼다 */
public final class ConnectionErrorClassifier {

    public static final String TIMEOUT = "연결 시간 초과 (Timeout)";
    public static final String REFUSED = "연결 거부 (Connection Refused)";
    public static final String RESET = "연결 재설정 (Connection Reset)";
    public static final String HANDSHAKE_PREFIX = "TLS 핸드셰이크 실패: ";
    public static final String DNS_FAILURE = "DNS 해석 실패 (No Such Host)";

    private ConnectionErrorClassifier() {
    }

    public static String classify(Throwable e) {
        Throwable root = rootCause(e);
        String msg = root.getMessage() == null ? "" : root.getMessage();
        String lower = msg.toLowerCase(Locale.ROOT);

        if (root instanceof UnknownHostException) return DNS_FAILURE;
        if (root instanceof SocketTimeoutException || root instanceof HttpTimeoutException
                || lower.contains("timed out")) return TIMEOUT;
        if (root instanceof ConnectException || lower.contains("connection refused")) return REFUSED;
        if (lower.contains("connection reset")) return RESET;

        // 소켓 수준 원인이 아니면 가장 바깥의 SSLException 메시지를 쓴다
        SSLException ssl = findSsl(e);
        if (ssl != null) return HANDSHAKE_PREFIX + ssl.getMessage();
        if (root instanceof SocketException) return root.getClass().getSimpleName() + ": " + msg;
        return root.getClass().getSimpleName() + (msg.isEmpty() ? "" : ": " + msg);
    }

    /** DNS 단계에서 난 실패인지 (해석 불가 상태로 기록해야 하는지) */
    public static boolean isUnresolvable(Throwable e) {
        return rootCause(e) instanceof UnknownHostException;
    }

    private static SSLException findSsl(Throwable e) {
        for (Throwable cur = e; cur != null; cur = cur.getCause() == cur ? null : cur.getCause()) {
            if (cur instanceof SSLException) return (SSLException) cur;
        }
        return null;
    }

    private static Throwable rootCause(Throwable e) {
        Throwable cur = e;
        while (cur.getCause() != null && cur.getCause() != cur) {
            cur = cur.getCause();
        }
        return cur;
    }
}
