package com.quizharvester.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 코퍼스의 단위 레코드(문제 1건). 불변.
 * <p>
 * 추출기가 돌려준 후보도 같은 타입을 쓰므로 id가 비어 있을 수 있다.
 * 불변식 검사는 {@link com.quizharvester.core.store.RecordValidator} 한 곳에서만 한다.
 * 구 버전 코퍼스의 {@code year} 키는 읽을 때 {@code partitionKey}로 받는다.
 */
@JsonPropertyOrder({"id", "partitionKey", "category", "categoryPath", "text",
        "choices", "answerIndex", "explanation", "sourceUrl"})
public record QuestionRecord(
        @JsonProperty("id") String id,
        @JsonProperty(value = "partitionKey", required = true) @JsonAlias("year") int partitionKey,
        @JsonProperty("category") String category,
        @JsonProperty("categoryPath") List<String> categoryPath,
        @JsonProperty("text") String text,
        @JsonProperty(value = "choices", required = true) List<String> choices,
        @JsonProperty(value = "answerIndex", required = true) int answerIndex,
        @JsonProperty("explanation") String explanation,
        @JsonProperty("sourceUrl") String sourceUrl) {

    /** 정답 미상 표식 */
    public static final int UNKNOWN_ANSWER = -1;

    public QuestionRecord {
        categoryPath = (categoryPath == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(categoryPath));
        // choices는 null 항목이 올 수 있어 List.copyOf 대신 래핑(검증기가 걸러낸다)
        choices = (choices == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(choices));
        explanation = (explanation == null) ? "" : explanation;
    }

    @JsonIgnore
    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    @JsonIgnore
    public boolean isAnswerUnknown() {
        return answerIndex == UNKNOWN_ANSWER;
    }

    public QuestionRecord withId(String newId) {
        return new QuestionRecord(newId, partitionKey, category, categoryPath, text,
                choices, answerIndex, explanation, sourceUrl);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).partitionKey(partitionKey).category(category).categoryPath(categoryPath)
                .text(text).choices(choices).answerIndex(answerIndex)
                .explanation(explanation).sourceUrl(sourceUrl);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String id;
        private int partitionKey;
        private String category;
        private List<String> categoryPath = List.of();
        private String text;
        private List<String> choices = List.of();
        private int answerIndex = UNKNOWN_ANSWER;
        private String explanation = "";
        private String sourceUrl;

        public Builder id(String id) { this.id = id; return this; }
        public Builder partitionKey(int partitionKey) { this.partitionKey = partitionKey; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder categoryPath(List<String> categoryPath) { this.categoryPath = categoryPath; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder choices(List<String> choices) { this.choices = choices; return this; }
        public Builder choices(String... choices) { this.choices = Arrays.asList(choices); return this; }
        public Builder answerIndex(int answerIndex) { this.answerIndex = answerIndex; return this; }
        public Builder explanation(String explanation) { this.explanation = explanation; return this; }
        public Builder sourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; return this; }

        public QuestionRecord build() {
            return new QuestionRecord(id, partitionKey, category, categoryPath, text,
                    choices, answerIndex, explanation, sourceUrl);
        }
    }
}
