package com.quizharvester.core.walker;

import com.quizharvester.core.http.FetchRequest;
import com.quizharvester.core.model.CarrySet;
import com.quizharvester.core.model.SessionMeta;

/**
 * 스텝 POST 폼 조립기. 필드 순서는 사이트가 받는 그대로 유지한다.
 * 분야 선택은 고정(テクノロジ 1-13, マネジメント 14-16, ストラテジ 17-23).
 */
final class StepRequestBuilder {

    private final int examCount;

    StepRequestBuilder(int examCount) {
        this.examCount = examCount;
    }

    FetchRequest build(SessionMeta session, String sid, int qno, String startTime, CarrySet carry, int attempt) {
        FetchRequest.Builder b = FetchRequest.post(session.baseUrl())
                .header("Referer", session.baseUrl())
                .cacheKey(cacheKey(sid, session.timesCode(), qno, attempt))
                .rawResponse(true);

        b.form("times[]", session.timesCode());
        field(b, "te_all", 1, 13);
        field(b, "ma_all", 14, 16);
        field(b, "st_all", 17, 23);
        b.form("options[]", "timesFilter")
                .form("moshi", "mix_all")
                .form("moshi_cnt", String.valueOf(examCount))
                .form("addition", "0")
                .form("mode", "1")
                .form("qno", String.valueOf(qno))
                .form("sid", sid)
                .form("result", carry.result())
                .form("checkflag", "-1")
                .form("startTime", startTime)
                .form("_q", carry.q())
                .form("_r", carry.r())
                .form("_c", carry.c());
        return b.build();
    }

    /** 첫 시도는 sid-회차-qno, 정체 재시도는 -r<n>을 붙여 캐시된 정체 페이지를 재사용하지 않는다 */
    static String cacheKey(String sid, String timesCode, int qno, int attempt) {
        String base = sid + "-" + timesCode + "-" + qno;
        return attempt <= 1 ? base : base + "-r" + attempt;
    }

    private static void field(FetchRequest.Builder b, String field, int from, int to) {
        b.form("fields[]", field);
        for (int cat = from; cat <= to; cat++) {
            b.form("categories[]", String.valueOf(cat));
        }
    }
}
