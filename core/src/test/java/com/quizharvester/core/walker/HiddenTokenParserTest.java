package com.quizharvester.core.walker;

import com.quizharvester.core.model.CarrySet;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HiddenTokenParserTest {

    @Test
    void sessionId_fromHiddenInput() {
        assertThat(HiddenTokenParser.sessionId("<form><input type=hidden name=sid value=\"f00d\"></form>"))
                .hasValue("f00d");
        assertThat(HiddenTokenParser.sessionId("<form><input name=sid value=\"\"></form>")).isEmpty();
        assertThat(HiddenTokenParser.sessionId("<p>no form</p>")).isEmpty();
        assertThat(HiddenTokenParser.sessionId(null)).isEmpty();
    }

    @Test
    void carrySet_readsAllTokens_thenForcedToContinue() {
        String html = "<input name=_q value=\"q1\"><input name=_r value=\"r1\">"
                + "<input name=_c value=\"c1\"><input name=result value=\"1\">";

        CarrySet parsed = HiddenTokenParser.carrySet(html);

        assertThat(parsed).isEqualTo(new CarrySet("q1", "r1", "c1", "1"));
        assertThat(parsed.forContinue()).isEqualTo(new CarrySet("q1", "r1", "c1", CarrySet.RESULT_CONTINUE));
    }

    @Test
    void carrySet_missingTokens_defaultToEmpty_andResultAbsent() {
        CarrySet parsed = HiddenTokenParser.carrySet("<input name=_q value=\"only-q\">");

        assertThat(parsed.q()).isEqualTo("only-q");
        assertThat(parsed.r()).isEmpty();
        assertThat(parsed.c()).isEmpty();
        assertThat(parsed.result()).isEqualTo(CarrySet.RESULT_ABSENT);
    }

    @Test
    void totalQuestionHint() {
        assertThat(HiddenTokenParser.totalQuestionHint("<p>選択中の問題80問</p>")).isEqualTo(80);
        assertThat(HiddenTokenParser.totalQuestionHint("<p>none</p>")).isNull();
    }

    @Test
    void totalQuestionHint_oversizedCount_isIgnored() {
        assertThat(HiddenTokenParser.totalQuestionHint("<p>選択中の問題99999999999問</p>")).isNull();
    }
}
