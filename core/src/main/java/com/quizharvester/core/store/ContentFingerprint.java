package com.quizharvester.core.store;

import com.quizharvester.core.model.QuestionRecord;
import com.quizharvester.core.util.Fingerprints;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 내용 기반 지문: 정규화한 text + choices.
 * 정규화 = NFKC, 공백 연속 축약, 앞뒤 공백 제거, 소문자화.
 * 본문이 비어 있으면 선택지만으로는 판정하지 않는다(null 반환).
 */
final class ContentFingerprint {
    private ContentFingerprint() {}

    static String of(QuestionRecord r) {
        String text = normalize(r.text());
        if (text.isEmpty()) return null;
        List<String> parts = new ArrayList<>(r.choices().size() + 1);
        parts.add(text);
        for (String c : r.choices()) parts.add(normalize(c));
        return Fingerprints.sha256Hex(parts.toArray(new String[0]));
    }

    static String normalize(String s) {
        if (s == null) return "";
        String n = Normalizer.normalize(s, Normalizer.Form.NFKC);
        return n.replaceAll("\\s+", " ").strip().toLowerCase(Locale.ROOT);
    }
}
