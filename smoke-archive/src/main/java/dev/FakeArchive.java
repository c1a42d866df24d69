package dev;

import com.sun.net.httpserver.*;

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.Executors;

/**
 * CLI 수동 점검용 가짜 아카이브 (example.com 고정 데이터).
 *   java dev.FakeArchive [port]
 *   waybackminer -d example.com --archive-url http://localhost:8090 --parse-robots --parse-source
 */
public class FakeArchive {

  static final String UNAVAILABLE =
      "<html><body><p>This page can't be displayed. Please use the correct URL address to access this page.</p></body></html>";

  // 인덱스 (urlkey collapse 결과 흉내: 순서 보장 없음)
  static final List<String> INDEX = List.of(
      "http://example.com/",
      "http://example.com/robots.txt",
      "http://example.com/about",
      "http://example.com/logo.png",
      "https://example.com/app.js",
      "http://blog.example.com/",
      "http://blog.example.com/2019/hello",
      "http://cdn.other.net/x.js");

  // original -> [timestamp...]
  static final Map<String, List<String>> SNAPSHOTS = Map.of(
      "http://example.com/robots.txt", List.of("20100101000000", "20150601000000", "20200101000000"),
      "http://example.com/", List.of("20120101000000", "20180101000000"),
      "http://example.com/about", List.of("20160101000000"),
      "https://example.com/app.js", List.of("20190101000000"));

  // timestamp|original -> 본문
  static final Map<String, String> CAPTURES = new HashMap<>();
  static {
    CAPTURES.put("20100101000000|http://example.com/robots.txt",
        "User-agent: *\nDisallow: /cgi-bin/\nDisallow: /tmp/*\n");
    CAPTURES.put("20150601000000|http://example.com/robots.txt", UNAVAILABLE);
    CAPTURES.put("20200101000000|http://example.com/robots.txt",
        "User-agent: *\nDisallow: /admin/ # staff only\nAllow: /public$\nSitemap: https://example.com/sitemap.xml\n"
            + "Sitemap: https://cdn.other.net/sitemap.xml\n");
    CAPTURES.put("20120101000000|http://example.com/",
        "<html><body><a href=\"/about\">About</a> <a href=\"/contact\">Contact</a>"
            + "<img src=\"/logo.png\"><a href=\"http://blog.example.com/\">Blog</a></body></html>");
    CAPTURES.put("20180101000000|http://example.com/",
        "<html><head><script src=\"//static.example.com/v2/main.js\"></script></head>"
            + "<body><a href='/shop'>Shop</a><a href=\"https://twitter.com/example\">t</a></body></html>");
    CAPTURES.put("20160101000000|http://example.com/about", "");
    CAPTURES.put("20190101000000|https://example.com/app.js",
        "var api = \"https:\\/\\/api.example.com\\/v1\\/items\"; fetch('/internal/health');");
  }

  public static void main(String[] args) throws Exception {
    int port = args.length > 0 ? Integer.parseInt(args[0]) : 8090;
    HttpServer http = HttpServer.create(new InetSocketAddress(port), 0);
    wireEndpoints(http);
    http.setExecutor(Executors.newFixedThreadPool(8));
    http.start();
    System.out.println("[WM] fake archive on http://localhost:" + port);
  }

  static void wireEndpoints(HttpServer s) {
    // CDX: output=txt 면 인덱스, output=json 이면 캡처 목록
    s.createContext("/cdx/search/cdx", ex -> {
      Map<String, String> q = query(ex.getRequestURI());
      String url = q.getOrDefault("url", "");
      if ("txt".equals(q.get("output"))) {
        boolean subs = url.startsWith("*.");
        StringBuilder sb = new StringBuilder();
        for (String u : INDEX) {
          if (subs || !u.contains("blog.")) sb.append(u).append('\n');
        }
        resp(ex, 200, "text/plain", sb.toString());
        return;
      }
      List<String> stamps = SNAPSHOTS.get(url);
      if (stamps == null) { resp(ex, 200, "application/json", "[]"); return; }
      StringBuilder sb = new StringBuilder("[[\"timestamp\",\"original\"]");
      for (String ts : stamps) sb.append(",[\"").append(ts).append("\",\"").append(url).append("\"]");
      resp(ex, 200, "application/json", sb.append(']').toString());
    });

    // 재생: /web/<ts>if_/<original>
    s.createContext("/web/", ex -> {
      String rest = ex.getRequestURI().getRawPath().substring("/web/".length());
      String raw = ex.getRequestURI().getRawQuery();
      int cut = rest.indexOf("if_/");
      if (cut < 0) { resp(ex, 404, "text/plain", "not found"); return; }
      String ts = rest.substring(0, cut);
      String original = urlDecode(rest.substring(cut + 4)) + (raw != null ? "?" + raw : "");
      String body = CAPTURES.get(ts + "|" + original);
      if (body == null) { resp(ex, 404, "text/plain", "not found"); return; }
      resp(ex, 200, original.endsWith(".txt") ? "text/plain" : "text/html", body);
    });
  }

  // ===== 공통 유틸 =====
  static Map<String,String> query(URI u){
    Map<String,String> m = new LinkedHashMap<>();
    String q = u.getRawQuery(); if (q==null) return m;
    for (String p: q.split("&")) {
      int i = p.indexOf('=');
      String k = i<0? p : p.substring(0,i);
      String v = i<0? "" : p.substring(i+1);
      m.put(urlDecode(k), urlDecode(v));
    }
    return m;
  }
  static String urlDecode(String s){
    try { return URLDecoder.decode(s, StandardCharsets.UTF_8); } catch(IllegalArgumentException e){ return s; }
  }
  static void resp(HttpExchange ex, int code, String ct, String body) throws IOException {
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", ct+"; charset=utf-8");
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
