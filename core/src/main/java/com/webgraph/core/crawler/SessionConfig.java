package com.webgraph.core.crawler;

import java.util.ArrayList;
import java.util.List;

/**
 * 크롤 세션 하나의 불변 도메인 컨텍스트.
 * 유효 허용 목록 = base ++ session. 비어 있으면 무제한(전부 허용).
 * null 항목만 버린다. "" 항목은 모든 URL의 부분문자열이므로 와일드카드로 동작한다
 * (도메인 없는 시작 노드로 제한 세션을 열면 base 목록과 무관하게 전부 허용).
 */
public record SessionConfig(List<String> baseAllowedDomains, List<String> sessionAllowedDomains) {

    public SessionConfig {
        baseAllowedDomains = clean(baseAllowedDomains);
        sessionAllowedDomains = clean(sessionAllowedDomains);
    }

    /** 세션 제한 없는 컨텍스트 */
    public static SessionConfig unrestricted(List<String> baseAllowedDomains) {
        return new SessionConfig(baseAllowedDomains, List.of());
    }

    public List<String> allAllowedDomains() {
        List<String> all = new ArrayList<>(baseAllowedDomains.size() + sessionAllowedDomains.size());
        all.addAll(baseAllowedDomains);
        all.addAll(sessionAllowedDomains);
        return all;
    }

    /** 목록이 비었거나 "" 항목이 있으면 모든 URL 허용 */
    public boolean isUnrestricted() {
        if (baseAllowedDomains.isEmpty() && sessionAllowedDomains.isEmpty()) return true;
        return baseAllowedDomains.contains("") || sessionAllowedDomains.contains("");
    }

    /**
     * 부분문자열 포함 판정. "example.com" 허용 시 "http://example.com.evil.com" 도 통과한다(의도된 단순 규칙).
     * null url 은 "" 로 취급: 제한이 하나라도 있으면 거부.
     */
    public boolean admits(String url) {
        if (isUnrestricted()) return true;
        String s = (url == null ? "" : url);
        for (String d : baseAllowedDomains) if (s.contains(d)) return true;
        for (String d : sessionAllowedDomains) if (s.contains(d)) return true;
        return false;
    }

    private static List<String> clean(List<String> in) {
        if (in == null || in.isEmpty()) return List.of();
        List<String> out = new ArrayList<>(in.size());
        for (String d : in) if (d != null) out.add(d);
        return List.copyOf(out);
    }
}
