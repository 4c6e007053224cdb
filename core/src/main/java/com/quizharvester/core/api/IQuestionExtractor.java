// IQuestionExtractor.java
package com.quizharvester.core.api;

import com.quizharvester.core.model.QuestionRecord;
import com.quizharvester.core.model.SessionMeta;

import java.util.List;

/**
 * 추출기 경계: 페이지 내용 1건 → 후보 레코드 0건 이상.
 * 필드가 없으면 null/빈 값으로 채워 돌려주고 예외를 던지지 않는 것이 원칙.
 * choices는 구조적으로 항상 채운다(최종 검증은 Store가 한다).
 */
@FunctionalInterface
public interface IQuestionExtractor {
    List<QuestionRecord> extract(String pageContent, SessionMeta session);
}
