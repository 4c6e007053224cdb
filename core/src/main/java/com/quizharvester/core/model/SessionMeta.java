package com.quizharvester.core.model;

import java.util.Objects;

/**
 * 수집 대상 회차(세션) 메타.
 *
 * @param label     화면 표기 라벨(예: 令和6年春期)
 * @param year      파티션 키로 쓰는 서기 연도
 * @param timesCode 사이트의 회차 코드(times[] 값)
 * @param baseUrl   랜딩/POST 대상 URL
 */
public record SessionMeta(String label, int year, String timesCode, String baseUrl) {
    public SessionMeta {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(timesCode, "timesCode");
        Objects.requireNonNull(baseUrl, "baseUrl");
    }
}
