package com.zonewatch.probe;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.security.auth.x500.X500Principal;
import java.security.cert.X509Certificate;

/** 인증서 주체/발급자 DN 에서 이름 속성을 꺼내는 도우미 */
public final class CertificateNames {

    private CertificateNames() {
    }

    public static String subjectCommonName(X509Certificate cert) {
        return attribute(cert.getSubjectX500Principal(), "CN");
    }

    /** 발급자 표시명: CN, 없으면 O, 둘 다 없으면 빈 문자열 */
    public static String issuerDisplayName(X509Certificate cert) {
        X500Principal issuer = cert.getIssuerX500Principal();
        String cn = attribute(issuer, "CN");
        if (cn != null && !cn.isBlank()) return cn;
        String org = attribute(issuer, "O");
        return org == null ? "" : org;
    }

    static String attribute(X500Principal principal, String type) {
        if (principal == null) return null;
        try {
            LdapName name = new LdapName(principal.getName(X500Principal.RFC2253));
            for (Rdn rdn : name.getRdns()) {
                if (rdn.getType().equalsIgnoreCase(type)) {
                    return String.valueOf(rdn.getValue());
                }
            }
        } catch (InvalidNameException e) {
            throw new IllegalStateException("인증서 DN 을 해석할 수 없습니다: " + principal, e);
        }
        return null;
    }
}
