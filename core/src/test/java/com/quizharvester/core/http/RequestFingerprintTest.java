package com.quizharvester.core.http;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequestFingerprintTest {

    private static final String URL = "https://quiz.example/q";

    @Test
    void parameterOrder_doesNotChangeFingerprint() {
        String a = RequestFingerprint.of(FetchRequest.post(URL).form("qno", "1").form("sid", "abc").build());
        String b = RequestFingerprint.of(FetchRequest.post(URL).form("sid", "abc").form("qno", "1").build());

        String qa = RequestFingerprint.of(FetchRequest.get(URL).query("x", "1").query("y", "2").build());
        String qb = RequestFingerprint.of(FetchRequest.get(URL).query("y", "2").query("x", "1").build());

        assertThat(a).isEqualTo(b);
        assertThat(qa).isEqualTo(qb);
    }

    @Test
    void jsonBody_keyOrder_doesNotChangeFingerprint() {
        Map<String, Object> m1 = new LinkedHashMap<>();
        m1.put("a", 1);
        m1.put("b", "two");
        Map<String, Object> m2 = new LinkedHashMap<>();
        m2.put("b", "two");
        m2.put("a", 1);

        assertThat(RequestFingerprint.of(FetchRequest.post(URL).jsonBody(m1).build()))
                .isEqualTo(RequestFingerprint.of(FetchRequest.post(URL).jsonBody(m2).build()));
    }

    @Test
    void content_changesFingerprint() {
        String base = RequestFingerprint.of(FetchRequest.post(URL).form("qno", "1").build());

        assertThat(RequestFingerprint.of(FetchRequest.post(URL).form("qno", "2").build())).isNotEqualTo(base);
        assertThat(RequestFingerprint.of(FetchRequest.post(URL + "?v=2").form("qno", "1").build())).isNotEqualTo(base);
        assertThat(RequestFingerprint.of(FetchRequest.get(URL).query("qno", "1").build())).isNotEqualTo(base);
        // 같은 키 안의 값 순서는 의미가 있다
        assertThat(RequestFingerprint.of(FetchRequest.post(URL).form("c", "1").form("c", "2").build()))
                .isNotEqualTo(RequestFingerprint.of(FetchRequest.post(URL).form("c", "2").form("c", "1").build()));
    }

    @Test
    void explicitKey_isUsedVerbatim() {
        assertThat(RequestFingerprint.of(FetchRequest.post(URL).form("qno", "1").cacheKey("sid-06-1").build()))
                .isEqualTo("sid-06-1");
        assertThat(RequestFingerprint.of(FetchRequest.get(URL).build())).hasSize(64);
    }
}
