package com.quizharvester.core.extract;

import com.quizharvester.core.api.IQuestionExtractor;
import com.quizharvester.core.model.QuestionRecord;
import com.quizharvester.core.model.SessionMeta;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 기본 JSoup 기반 문제 추출기(문제 페이지 1장 → 레코드 1건).
 * - .selectList 없으면 문제 페이지가 아님 → 빈 목록
 * - 본문: h3.qno + div / 선택지: #select_a,#select_i,#select_u,#select_e
 * - 정답: #answerChar(ア/イ/ウ/エ) → 0..3, 그 외 -1
 * - 해설: #kaisetsu / 출처: og:url, 없으면 세션 baseUrl
 * - 분류: "分類" h3 다음 div를 » 기준 분할
 * - id: hidden _q 값의 숫자 접미사가 있으면 그 번호로
 */
public class JsoupQuestionExtractor implements IQuestionExtractor {

    private static final String[] CHOICE_IDS = {"select_a", "select_i", "select_u", "select_e"};
    private static final Map<String, Integer> ANSWER_CHARS = Map.of("ア", 0, "イ", 1, "ウ", 2, "エ", 3);
    private static final Pattern PATH_SPLIT = Pattern.compile("\\s*»\\s*");
    static final String UNKNOWN_CATEGORY = "unknown";

    private final String idPrefix;

    public JsoupQuestionExtractor(String idPrefix) {
        this.idPrefix = (idPrefix == null) ? "" : idPrefix;
    }

    @Override
    public List<QuestionRecord> extract(String pageContent, SessionMeta session) {
        if (pageContent == null || pageContent.isBlank()) return List.of();
        Document doc = Jsoup.parse(pageContent);
        if (doc.selectFirst(".selectList") == null) return List.of();

        Element textDiv = doc.selectFirst("h3.qno + div");
        String text = (textDiv != null) ? textDiv.text() : null;

        List<String> choices = new ArrayList<>(CHOICE_IDS.length);
        for (String cid : CHOICE_IDS) {
            Element el = doc.getElementById(cid);
            choices.add(el != null ? el.text() : "");
        }

        Element answerEl = doc.getElementById("answerChar");
        String answerChar = (answerEl != null) ? answerEl.text().trim() : "";
        int answerIndex = ANSWER_CHARS.getOrDefault(answerChar, QuestionRecord.UNKNOWN_ANSWER);

        Element expl = doc.getElementById("kaisetsu");
        String explanation = (expl != null) ? expl.text() : "";

        Element og = doc.selectFirst("meta[property=og:url]");
        String sourceUrl = (og != null && og.hasAttr("content")) ? og.attr("content") : session.baseUrl();

        List<String> categoryPath = categoryPath(doc);
        String category = categoryPath.isEmpty() ? UNKNOWN_CATEGORY : String.join(" » ", categoryPath);

        return List.of(QuestionRecord.builder()
                .id(idFromHidden(doc, session.year()))
                .partitionKey(session.year())
                .category(category)
                .categoryPath(categoryPath)
                .text(text)
                .choices(choices)
                .answerIndex(answerIndex)
                .explanation(explanation)
                .sourceUrl(sourceUrl)
                .build());
    }

    static List<String> categoryPath(Document doc) {
        Element heading = null;
        for (Element h3 : doc.select("h3")) {
            if (h3.text().contains("分類")) { heading = h3; break; }
        }
        if (heading == null) return List.of();
        Element div = heading.nextElementSibling();
        while (div != null && !div.tagName().equals("div")) div = div.nextElementSibling();
        if (div == null) return List.of();

        String raw = div.text().replace("＞", "»").replace("&raquo;", "»");
        List<String> parts = new ArrayList<>();
        for (String p : PATH_SPLIT.split(raw)) {
            if (!p.isBlank()) parts.add(p.strip());
        }
        return parts;
    }

    private String idFromHidden(Document doc, int year) {
        Element q = doc.selectFirst("input[name=_q]");
        if (q == null || !q.hasAttr("value")) return null;
        String v = q.attr("value");
        String last = v.substring(v.lastIndexOf('_') + 1);
        if (last.isEmpty() || !last.chars().allMatch(Character::isDigit)) return null;
        try {
            return QuestionIds.format(idPrefix, year, Integer.parseInt(last));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
