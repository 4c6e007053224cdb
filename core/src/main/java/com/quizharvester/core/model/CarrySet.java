package com.quizharvester.core.model;

/**
 * 스텝 간에 릴레이되는 hidden 토큰 묶음(_q, _r, _c + result).
 * 성공한 스텝 응답마다 통째로 교체한다. 부분 갱신 금지.
 */
public record CarrySet(String q, String r, String c, String result) {

    /** 다음 요청에 실어 보낼 때 result는 항상 이 값으로 고정 */
    public static final String RESULT_CONTINUE = "0";
    /** 응답에 result 필드가 없을 때의 값 */
    public static final String RESULT_ABSENT = "-1";

    public CarrySet {
        q = (q == null) ? "" : q;
        r = (r == null) ? "" : r;
        c = (c == null) ? "" : c;
        result = (result == null || result.isEmpty()) ? RESULT_ABSENT : result;
    }

    /** 첫 스텝용 초기값 */
    public static CarrySet initial() {
        return new CarrySet("", "", "", RESULT_CONTINUE);
    }

    public CarrySet forContinue() {
        return RESULT_CONTINUE.equals(result) ? this : new CarrySet(q, r, c, RESULT_CONTINUE);
    }
}
