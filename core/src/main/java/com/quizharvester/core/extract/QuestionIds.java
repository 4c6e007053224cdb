package com.quizharvester.core.extract;

import java.util.Locale;

/** 레코드 id 규칙: &lt;prefix&gt;&lt;partition&gt;-q&lt;3자리 시퀀스&gt; (예: ap-2024-q007, p2024-q001) */
public final class QuestionIds {
    private QuestionIds() {}

    public static String format(String prefix, int partitionKey, int sequence) {
        return String.format(Locale.ROOT, "%s%d-q%03d", prefix == null ? "" : prefix, partitionKey, sequence);
    }
}
