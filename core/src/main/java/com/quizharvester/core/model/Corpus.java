package com.quizharvester.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * 디스크에 저장되는 코퍼스 파일 포맷.
 * 키: version, questions, (옵션) generatedAt, sourceSessions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"version", "questions", "generatedAt", "sourceSessions"})
public record Corpus(
        @JsonProperty("version") int version,
        @JsonProperty("questions") List<QuestionRecord> questions,
        @JsonProperty("generatedAt") String generatedAt,
        @JsonProperty("sourceSessions") List<String> sourceSessions) {

    public static final int CURRENT_VERSION = 1;

    public Corpus {
        questions = (questions == null) ? List.of() : List.copyOf(questions);
        sourceSessions = (sourceSessions == null) ? null : List.copyOf(sourceSessions);
    }

    public static Corpus empty() {
        return new Corpus(CURRENT_VERSION, List.of(), null, null);
    }

    public static Corpus of(List<QuestionRecord> questions) {
        return new Corpus(CURRENT_VERSION, questions, null, null);
    }

    public Corpus withQuestions(List<QuestionRecord> replacement) {
        return new Corpus(version, replacement, generatedAt, sourceSessions);
    }

    public Corpus withMetadata(String generatedAt, List<String> sourceSessions) {
        return new Corpus(version, questions, generatedAt, sourceSessions);
    }

    public int size() { return questions.size(); }
}
