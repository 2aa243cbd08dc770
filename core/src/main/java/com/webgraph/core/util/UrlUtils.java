package com.webgraph.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** 도메인 추출 + (옵션) 노드 id 정규화 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * URL의 authority(host[:port]) 부분을 도메인으로 반환.
     * scheme 없는 문자열, 파싱 실패, null 은 모두 "" (예외 없음).
     */
    public static String domainOf(String url) {
        if (url == null || url.isBlank()) return "";
        try {
            String authority = new URI(url.trim()).getRawAuthority();
            return authority == null ? "" : authority;
        } catch (URISyntaxException e) {
            return "";
        }
    }

    /**
     * 노드 id 정규화 규칙 (canonicalizeUrls=true 일 때만 사용):
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - fragment 제거
     * - 빈 경로를 "/"로, 중복 슬래시 축소
     * 파싱할 수 없는 문자열은 원본 그대로 둔다.
     */
    public static String canonicalize(String url) {
        if (url == null) return null;
        URI u;
        try {
            u = new URI(url.trim());
        } catch (URISyntaxException e) {
            return url;
        }
        if (u.getScheme() == null || u.getHost() == null) return url;

        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        String host = u.getHost().toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        // 인코딩 보존: raw 경로/쿼리로 조립 (%2F, %26 을 디코딩하면 다른 URL이 같은 id가 됨)
        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        path = path.replaceAll("/{2,}", "/");

        StringBuilder sb = new StringBuilder(url.length()).append(scheme).append("://");
        if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
        sb.append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        return sb.toString();
    }

    /** http/https 만 크롤 대상 */
    public static boolean isHttpLike(String url) {
        if (url == null) return false;
        String s = url.trim().toLowerCase(Locale.ROOT);
        return s.startsWith("http://") || s.startsWith("https://");
    }
}
