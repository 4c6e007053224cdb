package com.quizharvester.core.http;

import java.io.IOException;

/**
 * 페치 최종 실패. statusCode=-1 이면 연결/타임아웃 등 전송 계층 실패.
 * 재시도 소진 후 또는 재시도 불가 상태코드에서 던진다.
 */
public class FetchException extends IOException {
    private final int statusCode;
    private final String url;
    private final int attempts;

    public FetchException(String message, String url, int statusCode, int attempts, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    public int getStatusCode() { return statusCode; }
    public String getUrl() { return url; }
    public int getAttempts() { return attempts; }

    public boolean isTransport() { return statusCode == -1; }
}
