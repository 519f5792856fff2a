package com.zonewatch.probe;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;

/**
 * 모든 서버 인증서를 "신뢰"하는 TrustManager.
 * 만료/자체서명/호스트명 불일치 인증서라도 내용을 읽어야 하므로 검증은 따로 한다.
 */
public class TrustAllTrustManager implements X509TrustManager {

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
        // 클라이언트 인증은 사용하지 않음
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
        // 모두 허용
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return new X509Certificate[0];
    }

    public static SSLContext sslContext() {
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, new TrustManager[]{new TrustAllTrustManager()}, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS 컨텍스트를 만들 수 없습니다.", e);
        }
    }
}
