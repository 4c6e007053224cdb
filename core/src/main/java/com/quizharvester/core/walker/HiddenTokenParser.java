package com.quizharvester.core.walker;

import com.quizharvester.core.model.CarrySet;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 응답 HTML에서 hidden input(sid, _q/_r/_c/result)과 문항 수 힌트를 뽑는다. */
public final class HiddenTokenParser {

    private static final Pattern TOTAL_HINT = Pattern.compile("選択中の問題(\\d+)問");

    private HiddenTokenParser() {}

    /** input[name=sid]의 value. 없거나 비어 있으면 empty */
    public static Optional<String> sessionId(String html) {
        if (html == null || html.isEmpty()) return Optional.empty();
        String v = inputValue(Jsoup.parse(html), "sid");
        return (v == null || v.isBlank()) ? Optional.empty() : Optional.of(v.trim());
    }

    /** 다음 스텝으로 넘길 carry set. 없는 토큰은 "" / result는 "-1" */
    public static CarrySet carrySet(String html) {
        Document doc = Jsoup.parse(html == null ? "" : html);
        return new CarrySet(
                inputValue(doc, "_q"),
                inputValue(doc, "_r"),
                inputValue(doc, "_c"),
                inputValue(doc, "result"));
    }

    /** "選択中の問題N問" → N (진단용). 없거나 int 범위를 넘으면 null */
    public static Integer totalQuestionHint(String html) {
        if (html == null) return null;
        Matcher m = TOTAL_HINT.matcher(html);
        if (!m.find()) return null;
        try {
            return Integer.valueOf(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String inputValue(Document doc, String name) {
        Element el = doc.selectFirst("input[name=" + name + "]");
        return (el != null && el.hasAttr("value")) ? el.attr("value") : null;
    }
}
