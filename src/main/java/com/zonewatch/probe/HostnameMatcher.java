package com.zonewatch.probe;

import com.google.common.net.InetAddresses;

import java.net.InetAddress;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * 인증서가 접속한 호스트명을 커버하는지 검사한다.
 * <ul>
 *   <li>DNS SAN 은 가장 왼쪽 라벨의 와일드카드(*.example.com)만 허용하며, 와일드카드는 라벨 하나만 대신한다.</li>
 *   <li>대상이 IP 주소면 IP SAN 과 비교한다.</li>
 *   <li>CN 은 DNS SAN 이 하나도 없을 때만 본다.</li>
 * </ul>
 */
public final class HostnameMatcher {

    private static final int SAN_DNS = 2;
    private static final int SAN_IP = 7;

    private HostnameMatcher() {
    }

    public static boolean matches(X509Certificate cert, String host) {
        List<String> dns = dnsNames(cert);
        List<String> ips = ipAddresses(cert);
        String cn = CertificateNames.subjectCommonName(cert);
        return matches(dns, ips, cn, host);
    }

    public static boolean matches(List<String> dnsSans, List<String> ipSans, String commonName, String host) {
        if (host == null || host.isBlank()) return false;
        String target = normalize(host);

        if (InetAddresses.isInetAddress(target)) {
            InetAddress addr = InetAddresses.forString(target);
            for (String ip : ipSans) {
                if (InetAddresses.isInetAddress(ip) && InetAddresses.forString(ip).equals(addr)) return true;
            }
            return false;
        }

        if (!dnsSans.isEmpty()) {
            for (String pattern : dnsSans) {
                if (matchesPattern(normalize(pattern), target)) return true;
            }
            return false;
        }
        return commonName != null && matchesPattern(normalize(commonName), target);
    }

    static boolean matchesPattern(String pattern, String host) {
        if (pattern.isEmpty()) return false;
        if (!pattern.startsWith("*.")) return pattern.equals(host);

        // *.example.com -> 첫 라벨 하나만 대체
        String suffix = pattern.substring(1);          // ".example.com"
        if (!host.endsWith(suffix)) return false;
        String first = host.substring(0, host.length() - suffix.length());
        return !first.isEmpty() && !first.contains(".");
    }

    public static List<String> dnsNames(X509Certificate cert) {
        return sanOfType(cert, SAN_DNS);
    }

    public static List<String> ipAddresses(X509Certificate cert) {
        return sanOfType(cert, SAN_IP);
    }

    private static List<String> sanOfType(X509Certificate cert, int type) {
        List<String> out = new ArrayList<>();
        try {
            Collection<List<?>> sans = cert.getSubjectAlternativeNames();
            if (sans == null) return out;
            for (List<?> entry : sans) {
                if (entry.size() < 2 || !(entry.get(1) instanceof String)) continue;
                if (Integer.valueOf(type).equals(entry.get(0))) {
                    out.add((String) entry.get(1));
                }
            }
        } catch (CertificateParsingException e) {
            // SAN 확장이 깨진 인증서는 SAN 이 없는 것으로 취급
            return out;
        }
        return out;
    }

    private static String normalize(String name) {
        String s = name.trim().toLowerCase(Locale.ROOT);
        return s.endsWith(".") ? s.substring(0, s.length() - 1) : s;
    }
}
