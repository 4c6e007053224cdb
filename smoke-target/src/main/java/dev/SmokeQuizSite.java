package dev;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 로컬 가짜 문제 사이트. hidden 토큰 릴레이 프로토콜을 그대로 흉내 낸다.
 * <ul>
 *   <li>GET  /kakomon.php : 랜딩(sid + times[] 체크박스 + 選択中の問題N問)</li>
 *   <li>POST /kakomon.php : qno 문항 페이지. sid/토큰이 어긋나면 출제 설정 페이지(정체)</li>
 * </ul>
 * 토큰: 문항 qno 페이지는 _q=&lt;times&gt;_&lt;qno+1&gt;, _r=r&lt;qno&gt;, _c=c&lt;qno&gt; 를 싣고,
 * 다음 요청(qno+1)은 이 값을 그대로 돌려보내야 진행된다.
 */
public class SmokeQuizSite {

  static final String PATH = "/kakomon.php";
  private static final String[] KANA = {"ア", "イ", "ウ", "エ"};

  private final String sid;
  private final int questionsPerSession;
  private final Map<String, String> sessions = new LinkedHashMap<>();  // times → label
  private final Set<Integer> stallOnce = new HashSet<>();
  private final Set<Integer> failOnce = new HashSet<>();
  private final Map<String, AtomicInteger> served = new ConcurrentHashMap<>();
  private final List<String> log = new ArrayList<>();

  private HttpServer server;

  public SmokeQuizSite(String sid, int questionsPerSession) {
    this.sid = Objects.requireNonNull(sid, "sid");
    this.questionsPerSession = questionsPerSession;
  }

  public SmokeQuizSite session(String timesCode, String label) {
    sessions.put(timesCode, label);
    return this;
  }

  /** 해당 qno 첫 요청은 출제 설정 페이지로 응답(정체) */
  public SmokeQuizSite stallOnce(int qno) { stallOnce.add(qno); return this; }

  /** 해당 qno 첫 요청은 503 */
  public SmokeQuizSite failOnce(int qno) { failOnce.add(qno); return this; }

  public static void main(String[] args) throws Exception {
    int port = args.length > 0 ? Integer.parseInt(args[0]) : 8080;
    SmokeQuizSite site = new SmokeQuizSite("smoke-sid", 5)
        .session("06_haru", "令和6年春期")
        .session("05_aki", "令和5年秋期")
        .stallOnce(2);
    site.start(port);
    System.out.println("[QH] quiz site on " + site.baseUrl());
  }

  /** @return 실제 바인딩된 포트(0이면 임의 포트) */
  public synchronized int start(int port) throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", port), 0);
    server.createContext(PATH, handler());
    server.setExecutor(Executors.newFixedThreadPool(2));
    server.start();
    return server.getAddress().getPort();
  }

  public synchronized void stop() {
    if (server != null) {
      server.stop(0);
      server = null;
    }
  }

  public String baseUrl() {
    return "http://127.0.0.1:" + server.getAddress().getPort() + PATH;
  }

  /** 처리한 요청 요약("GET" / "POST times qno") */
  public synchronized List<String> requestLog() {
    return List.copyOf(log);
  }

  private HttpHandler handler() {
    return ex -> {
      try {
        if ("GET".equalsIgnoreCase(ex.getRequestMethod())) {
          record("GET");
          resp(ex, 200, landing());
          return;
        }
        if (!"POST".equalsIgnoreCase(ex.getRequestMethod())) {
          resp(ex, 405, "method not allowed");
          return;
        }
        Map<String, String> form = parseForm(readBody(ex));
        String times = form.getOrDefault("times[]", "");
        int qno = parseInt(form.get("qno"));
        record("POST " + times + " " + qno);
        int n = served.computeIfAbsent(times + "#" + qno, k -> new AtomicInteger()).incrementAndGet();

        if (n == 1 && failOnce.contains(qno)) {
          resp(ex, 503, "busy");
          return;
        }
        int attempt = failOnce.contains(qno) ? n - 1 : n;
        if (!sid.equals(form.get("sid"))
            || !sessions.containsKey(times)
            || qno < 0 || qno >= questionsPerSession
            || !carryMatches(form, times, qno)
            || (attempt == 1 && stallOnce.contains(qno))) {
          resp(ex, 200, configPage());
          return;
        }
        resp(ex, 200, questionPage(times, qno));
      } catch (RuntimeException e) {
        resp(ex, 500, String.valueOf(e.getMessage()));
      }
    };
  }

  private synchronized void record(String line) {
    log.add(line);
  }

  /** qno=0은 빈 토큰, 이후는 직전 문항 페이지의 토큰 그대로여야 함 */
  private static boolean carryMatches(Map<String, String> form, String times, int qno) {
    String q = form.getOrDefault("_q", "");
    String r = form.getOrDefault("_r", "");
    String c = form.getOrDefault("_c", "");
    if (qno == 0) return q.isEmpty() && r.isEmpty() && c.isEmpty();
    return q.equals(times + "_" + qno)
        && r.equals("r" + (qno - 1))
        && c.equals("c" + (qno - 1));
  }

  private String landing() {
    StringBuilder sb = new StringBuilder("<html><body><form method=\"post\" action=\"" + PATH + "\">");
    sb.append("<input type=\"hidden\" name=\"sid\" value=\"").append(sid).append("\">");
    for (Map.Entry<String, String> e : sessions.entrySet()) {
      sb.append("<label><input type=\"checkbox\" name=\"times[]\" value=\"").append(e.getKey()).append("\">")
          .append(e.getValue()).append("</label>");
    }
    sb.append("<p>選択中の問題").append(questionsPerSession * sessions.size()).append("問</p>");
    return sb.append("</form></body></html>").toString();
  }

  private String configPage() {
    return "<html><body><form><input type=\"hidden\" name=\"sid\" value=\"" + sid + "\">"
        + "<h2>出題設定</h2></form></body></html>";
  }

  private String questionPage(String times, int qno) {
    int no = qno + 1;
    String label = sessions.get(times);
    return "<html><head><meta property=\"og:url\" content=\"" + baseUrl() + "?t=" + times + "&amp;q=" + no + "\"></head>"
        + "<body><h2>" + label + " 第" + no + "問</h2>"
        + "<h3 class=\"qno\">問" + no + "</h3><div>" + label + " question " + no + "</div>"
        + "<div class=\"selectList\">"
        + "<div id=\"select_a\">" + times + " a" + no + "</div>"
        + "<div id=\"select_i\">" + times + " i" + no + "</div>"
        + "<div id=\"select_u\">" + times + " u" + no + "</div>"
        + "<div id=\"select_e\">" + times + " e" + no + "</div>"
        + "</div>"
        + "<span id=\"answerChar\">" + KANA[qno % KANA.length] + "</span>"
        + "<div id=\"kaisetsu\">explanation " + no + "</div>"
        + "<h3>分類</h3><div>" + (qno % 2 == 0 ? "テクノロジ系 ＞ ネットワーク" : "ストラテジ系 &raquo; 法務") + "</div>"
        + "<input type=\"hidden\" name=\"_q\" value=\"" + times + "_" + no + "\">"
        + "<input type=\"hidden\" name=\"_r\" value=\"r" + qno + "\">"
        + "<input type=\"hidden\" name=\"_c\" value=\"c" + qno + "\">"
        + "<input type=\"hidden\" name=\"result\" value=\"1\">"
        + "</body></html>";
  }

  // ===== HTTP 유틸 =====
  static String readBody(HttpExchange ex) throws IOException {
    try (InputStream in = ex.getRequestBody()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  /** 같은 이름이 여러 번이면 첫 값 */
  static Map<String, String> parseForm(String body) {
    Map<String, String> m = new LinkedHashMap<>();
    if (body == null || body.isEmpty()) return m;
    for (String kv : body.split("&")) {
      if (kv.isEmpty()) continue;
      int i = kv.indexOf('=');
      String k = URLDecoder.decode(i >= 0 ? kv.substring(0, i) : kv, StandardCharsets.UTF_8);
      String v = i >= 0 ? URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8) : "";
      m.putIfAbsent(k, v);
    }
    return m;
  }

  private static int parseInt(String s) {
    try { return s == null ? -1 : Integer.parseInt(s.trim()); }
    catch (NumberFormatException e) { return -1; }
  }

  static void resp(HttpExchange ex, int code, String body) throws IOException {
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
