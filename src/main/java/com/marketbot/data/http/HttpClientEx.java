package com.marketbot.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * 模块说明：HttpClientEx（class）。
 * 主要职责：封装 JDK HttpClient 的 GET 调用，非 2xx 状态统一抛出带状态码的异常，便于上层分类重试。
 */
public class HttpClientEx {
    private final HttpClient client;
    private final String userAgent;

    public HttpClientEx(int connectTimeoutSec, String userAgent) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(Math.max(1, connectTimeoutSec)))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.userAgent = userAgent == null || userAgent.isBlank() ? "marketbot/1.0" : userAgent.trim();
    }

    public String getText(String url, int timeoutSeconds) throws IOException, InterruptedException {
        HttpResponse<String> resp = client.send(request(url, timeoutSeconds), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
            return resp.body();
        }
        throw new IOException("http status=" + resp.statusCode() + " url=" + url);
    }

    /**
     * Raw body, for payloads whose charset is declared inside the document.
     */
    public byte[] getBytes(String url, int timeoutSeconds) throws IOException, InterruptedException {
        HttpResponse<byte[]> resp = client.send(request(url, timeoutSeconds), HttpResponse.BodyHandlers.ofByteArray());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
            return resp.body();
        }
        throw new IOException("http status=" + resp.statusCode() + " url=" + url);
    }

    private HttpRequest request(String url, int timeoutSeconds) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .header("User-Agent", userAgent)
                .GET()
                .build();
    }
}
