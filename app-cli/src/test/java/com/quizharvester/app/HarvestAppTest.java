package com.quizharvester.app;

import com.quizharvester.core.api.IFetcher;
import com.quizharvester.core.config.HarvestConfig;
import com.quizharvester.core.http.FetchRequest;
import com.quizharvester.core.http.FetchResult;
import com.quizharvester.core.model.QuestionRecord;
import com.quizharvester.core.service.HarvestService;
import com.quizharvester.core.store.CorpusIO;
import com.quizharvester.core.store.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HarvestAppTest {

    private static final String LANDING = "<html><body><form>"
            + "<input type=hidden name=sid value=\"s1\">"
            + "<label><input type=checkbox name=\"times[]\" value=\"06_haru\">令和6年春期</label>"
            + "<label><input type=checkbox name=\"times[]\" value=\"05_aki\">令和5年秋期</label>"
            + "</form></body></html>";

    @TempDir Path tmp;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private final List<FetchRequest> requests = new ArrayList<>();
    private final List<HarvestConfig> seenConfigs = new ArrayList<>();
    private Path yml;

    @BeforeEach
    void writeConfig() throws Exception {
        yml = tmp.resolve("harvest.yml");
        Files.writeString(yml, String.join("\n",
                "baseUrl: \"https://quiz.example/kakomon.php\"",
                "output: \"" + tmp.resolve("seed.json").toString().replace("\\", "/") + "\"",
                "throttleMs: 0",
                "maxSteps: 3",
                "cache:",
                "  enabled: false",
                ""), StandardCharsets.UTF_8);
    }

    /** GET → 랜딩, POST → qno+1 표식이 있는 문항 페이지 */
    private final IFetcher site = req -> {
        requests.add(req);
        if ("GET".equals(req.getMethod())) return FetchResult.ofText(200, LANDING, null);
        String qno = req.getForm().stream().filter(p -> p.name().equals("qno"))
                .map(FetchRequest.Param::value).findFirst().orElse("?");
        String times = req.getForm().stream().filter(p -> p.name().equals("times[]"))
                .map(FetchRequest.Param::value).findFirst().orElse("?");
        int n = Integer.parseInt(qno) + 1;
        return FetchResult.ofText(200, "<p>第" + n + "問</p><p>" + times + "-" + n + "</p>", "qno=" + qno);
    };

    private HarvestApp app() {
        HarvestApp.ServiceFactory factory = cfg -> {
            seenConfigs.add(cfg);
            return new HarvestService(cfg, site,
                    (html, session) -> List.of(QuestionRecord.builder()
                            .partitionKey(session.year())
                            .category("network")
                            .text(html)
                            .choices("ア", "イ", "ウ", "エ")
                            .answerIndex(1)
                            .sourceUrl(session.baseUrl())
                            .build()),
                    d -> {}, () -> 1_700_000_000L,
                    Clock.fixed(Instant.parse("2024-06-01T09:00:00Z"), ZoneOffset.UTC));
        };
        return new HarvestApp(factory,
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8),
                false);
    }

    private String out() { return outBuf.toString(StandardCharsets.UTF_8); }
    private String err() { return errBuf.toString(StandardCharsets.UTF_8); }

    @Test
    @DisplayName("YAML + 명령행 덮어쓰기 → 수집 후 요약 출력")
    void harvest_writesCorpus_andPrintsSummary() throws Exception {
        int code = app().run("--config", yml.toString(), "--sessions", "令和6年春期", "--max-qno", "2");

        assertThat(code).isEqualTo(HarvestApp.EXIT_OK);
        assertThat(seenConfigs).singleElement().satisfies(c -> {
            assertThat(c.getMaxSteps()).isEqualTo(2);
            assertThat(c.getCache().isEnabled()).isFalse();
        });
        assertThat(new CorpusIO().readStrict(tmp.resolve("seed.json")).questions())
                .extracting(QuestionRecord::id)
                .containsExactly("ap-2024-q001", "ap-2024-q002");
        assertThat(out())
                .contains("Scrape complete.")
                .contains("令和6年春期: accepted=2, abandoned=[]")
                .contains("Added: 2, Replaced: 0")
                .contains("Total questions: 2")
                .contains("2024: 2")
                .contains("network: 2");
    }

    @Test
    void listSessions_printsDiscoveredSessions_andDoesNotWalk() {
        int code = app().run("--config", yml.toString(), "--list-sessions");

        assertThat(code).isEqualTo(HarvestApp.EXIT_OK);
        assertThat(out()).contains("令和6年春期\t2024\t06_haru").contains("令和5年秋期\t2023\t05_aki");
        assertThat(requests).extracting(FetchRequest::getMethod).containsOnly("GET");
        assertThat(tmp.resolve("seed.json")).doesNotExist();
    }

    @Test
    void help_printsUsage() {
        assertThat(app().run("--help")).isEqualTo(HarvestApp.EXIT_OK);
        assertThat(out()).contains("Usage: harvest").contains("--list-sessions");
        assertThat(seenConfigs).isEmpty();
    }

    @Test
    void badOption_exitsWithUsage() {
        assertThat(app().run("--nope")).isEqualTo(HarvestApp.EXIT_USAGE);
        assertThat(err()).contains("Unknown option: --nope").contains("Usage: harvest");
    }

    @Test
    void unknownSession_exitsWithUsageError() {
        int code = app().run("--config", yml.toString(), "--sessions", "平成元年春期");

        assertThat(code).isEqualTo(HarvestApp.EXIT_USAGE);
        assertThat(err()).contains("Unknown sessions: 平成元年春期");
        assertThat(tmp.resolve("seed.json")).doesNotExist();
    }

    @Test
    void validationFailure_exitsWithFailure_notUsage() {
        HarvestApp app = new HarvestApp(cfg -> {
            throw new ValidationException("ap-2024-q001", "choices must have 4 entries");
        },
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8),
                false);

        int code = app.run("--config", yml.toString());

        assertThat(code).isEqualTo(HarvestApp.EXIT_FAILURE);
        assertThat(err()).contains("Harvest failed: choices must have 4 entries (id=ap-2024-q001)")
                .doesNotContain("Usage: harvest");
    }

    @Test
    void missingConfigFile_fails() {
        int code = app().run("--config", tmp.resolve("nope.yml").toString());

        assertThat(code).isEqualTo(HarvestApp.EXIT_FAILURE);
        assertThat(err()).contains("harvest.yml not found");
    }
}
