package com.quizharvester.core.extract;

import com.quizharvester.core.model.QuestionRecord;
import com.quizharvester.core.model.SessionMeta;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupQuestionExtractorTest {

    private static final SessionMeta SESSION =
            new SessionMeta("令和6年春期", 2024, "06_haru", "https://quiz.example/kakomon.php");

    private static final String PAGE = """
            <html><head><meta property="og:url" content="https://quiz.example/06_haru/q12.html"></head>
            <body>
              <h2>第12問</h2>
              <h3 class="qno">問12</h3>
              <div>TCP/IPの  <b>トランスポート層</b>に属するプロトコルはどれか。</div>
              <div class="selectList">
                <div id="select_a">HTTP</div><div id="select_i">IP</div>
                <div id="select_u">TCP</div><div id="select_e">ARP</div>
              </div>
              <span id="answerChar">ウ</span>
              <div id="kaisetsu">TCPはトランスポート層のプロトコルです。</div>
              <h3>分類</h3>
              <div>テクノロジ系 » 技術要素 ＞ ネットワーク</div>
              <input type="hidden" name="_q" value="x9_12">
            </body></html>
            """;

    private final JsoupQuestionExtractor extractor = new JsoupQuestionExtractor("ap-");

    @Test
    void extractsAllFields() {
        List<QuestionRecord> out = extractor.extract(PAGE, SESSION);

        assertThat(out).singleElement().satisfies(r -> {
            assertThat(r.id()).isEqualTo("ap-2024-q012");
            assertThat(r.partitionKey()).isEqualTo(2024);
            assertThat(r.text()).isEqualTo("TCP/IPの トランスポート層に属するプロトコルはどれか。");
            assertThat(r.choices()).containsExactly("HTTP", "IP", "TCP", "ARP");
            assertThat(r.answerIndex()).isEqualTo(2);
            assertThat(r.explanation()).startsWith("TCPは");
            assertThat(r.sourceUrl()).isEqualTo("https://quiz.example/06_haru/q12.html");
            assertThat(r.categoryPath()).containsExactly("テクノロジ系", "技術要素", "ネットワーク");
            assertThat(r.category()).isEqualTo("テクノロジ系 » 技術要素 » ネットワーク");
        });
    }

    @Test
    void notAQuestionPage_yieldsNothing() {
        assertThat(extractor.extract("<html><body>第1問 出題設定</body></html>", SESSION)).isEmpty();
        assertThat(extractor.extract("", SESSION)).isEmpty();
        assertThat(extractor.extract(null, SESSION)).isEmpty();
    }

    @Test
    void missingFields_fallBackInsteadOfFailing() {
        String sparse = "<div class=\"selectList\"><div id=\"select_a\">only a</div></div>"
                + "<span id=\"answerChar\">?</span><input type=hidden name=_q value=\"abc\">";

        QuestionRecord r = extractor.extract(sparse, SESSION).get(0);

        assertThat(r.id()).isNull();                       // 번호 접미사 없음 → 워커가 시퀀스로 부여
        assertThat(r.text()).isNull();
        assertThat(r.choices()).containsExactly("only a", "", "", "");
        assertThat(r.answerIndex()).isEqualTo(QuestionRecord.UNKNOWN_ANSWER);
        assertThat(r.explanation()).isEmpty();
        assertThat(r.sourceUrl()).isEqualTo(SESSION.baseUrl());
        assertThat(r.category()).isEqualTo("unknown");
        assertThat(r.categoryPath()).isEmpty();
    }

    @Test
    void idPrefix_isConfigurable() {
        assertThat(new JsoupQuestionExtractor("p").extract(PAGE, SESSION).get(0).id()).isEqualTo("p2024-q012");
        assertThat(QuestionIds.format("ap-", 2024, 7)).isEqualTo("ap-2024-q007");
        assertThat(QuestionIds.format("ap-", 2024, 1234)).isEqualTo("ap-2024-q1234");
    }
}
