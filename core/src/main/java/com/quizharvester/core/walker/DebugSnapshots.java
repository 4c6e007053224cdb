package com.quizharvester.core.walker;

import java.io.IOException;

/**
 * 스텝별 원본 요청/응답 보관용 싱크(진단 전용).
 * kind 예: request.txt, response.html, stalled.html, empty.html
 */
public interface DebugSnapshots {

    void save(String sessionLabel, int qno, String kind, String content) throws IOException;

    DebugSnapshots NONE = (label, qno, kind, content) -> {};
}
