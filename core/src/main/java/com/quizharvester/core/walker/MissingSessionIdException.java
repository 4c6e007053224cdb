package com.quizharvester.core.walker;

import java.io.IOException;

/** 랜딩 페이지에 sid가 없음 → 해당 세션(실행) 중단. 재시도 대상 아님. */
public class MissingSessionIdException extends IOException {
    private final String sessionLabel;

    public MissingSessionIdException(String sessionLabel, String url) {
        super("session id (sid) not found in landing page: " + url + " [session=" + sessionLabel + "]");
        this.sessionLabel = sessionLabel;
    }

    public String getSessionLabel() {
        return sessionLabel;
    }
}
