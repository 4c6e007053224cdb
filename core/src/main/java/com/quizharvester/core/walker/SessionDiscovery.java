package com.quizharvester.core.walker;

import com.quizharvester.core.api.IFetcher;
import com.quizharvester.core.http.FetchRequest;
import com.quizharvester.core.model.SessionMeta;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * 랜딩 페이지의 times[] 체크박스에서 회차 목록을 만든다.
 * 라벨은 감싸는 &lt;label&gt; 텍스트, 없으면 바로 뒤 텍스트 노드.
 * 연도로 환산할 수 없는 라벨은 건너뛴다.
 */
public final class SessionDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(SessionDiscovery.class);

    private final IFetcher fetcher;
    private final String baseUrl;

    public SessionDiscovery(IFetcher fetcher, String baseUrl) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    }

    /** 라벨 → 회차, 페이지 등장 순서 유지 */
    public Map<String, SessionMeta> discover() throws IOException, InterruptedException {
        String html = fetcher.fetch(FetchRequest.get(baseUrl).build()).text();
        return parse(html, baseUrl);
    }

    static Map<String, SessionMeta> parse(String html, String baseUrl) {
        Document doc = Jsoup.parse(html == null ? "" : html);
        Map<String, SessionMeta> out = new LinkedHashMap<>();
        for (Element input : doc.getElementsByAttributeValue("name", "times[]")) {
            if (!"input".equals(input.tagName())) continue;
            String code = input.attr("value");
            if (code.isBlank()) continue;
            String label = labelOf(input);
            OptionalInt year = EraYears.toGregorian(label);
            if (year.isEmpty()) {
                LOG.debug("skip session label without year: '{}' ({})", label, code);
                continue;
            }
            out.putIfAbsent(label, new SessionMeta(label, year.getAsInt(), code, baseUrl));
        }
        return out;
    }

    private static String labelOf(Element input) {
        Element parent = input.parent();
        if (parent != null && "label".equals(parent.tagName())) {
            return parent.text().strip();
        }
        Node next = input.nextSibling();
        if (next instanceof TextNode t) return t.text().strip();
        if (next instanceof Element e) return e.text().strip();
        return "";
    }

    /**
     * "all"이면 발견된 전 회차, 아니면 라벨 목록(쉼표 구분 허용)을 그대로의 순서로.
     * @throws IllegalArgumentException 모르는 라벨이 있을 때
     */
    public static List<SessionMeta> resolve(List<String> requested, Map<String, SessionMeta> discovered) {
        List<String> labels = new ArrayList<>();
        for (String r : requested) {
            for (String s : r.split(",")) {
                if (!s.isBlank()) labels.add(s.strip());
            }
        }
        if (labels.size() == 1 && "all".equalsIgnoreCase(labels.get(0))) {
            return List.copyOf(discovered.values());
        }
        List<String> missing = new ArrayList<>();
        List<SessionMeta> out = new ArrayList<>();
        for (String l : labels) {
            SessionMeta m = discovered.get(l);
            if (m == null) missing.add(l); else out.add(m);
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Unknown sessions: " + String.join(", ", missing));
        }
        return out;
    }
}
