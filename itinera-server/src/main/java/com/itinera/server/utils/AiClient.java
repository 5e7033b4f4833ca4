package com.itinera.server.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itinera.common.properties.AiProperties;
import com.itinera.server.metrics.MetricsRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * OpenAI 兼容 Chat Completion 接口的轻量客户端。
 * Thin client for an OpenAI-compatible chat completion API.
 *
 * 只负责 HTTP 往返与传输层重试（429 / 5xx / 超时），返回模型回复的原始文本；
 * 结构化结果的解析与校验交给上层。
 */
@Component
@Slf4j
public class AiClient {

    private final AiProperties aiProperties;
    private final ObjectMapper objectMapper;
    private final HttpClient aiHttpClient;
    private final MetricsRecorder metricsRecorder;

    public AiClient(AiProperties aiProperties,
                    ObjectMapper objectMapper,
                    HttpClient aiHttpClient,
                    MetricsRecorder metricsRecorder) {
        this.aiProperties = aiProperties;
        this.objectMapper = objectMapper;
        this.aiHttpClient = aiHttpClient;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * 普通文本对话。
     * 若配置不完整或调用失败，返回 null。
     */
    public String chat(String systemPrompt, String userPrompt) {
        return call(systemPrompt, userPrompt, false);
    }

    /**
     * 要求模型只输出一个 JSON 对象（response_format = json_object）。
     * 若配置不完整或调用失败，返回 null。
     */
    public String chatJson(String systemPrompt, String userPrompt) {
        return call(systemPrompt, userPrompt, true);
    }

    private String call(String systemPrompt, String userPrompt, boolean jsonMode) {
        String model = aiProperties.getModel();
        if (!StringUtils.hasText(aiProperties.getBaseUrl())
                || !StringUtils.hasText(aiProperties.getApiKey())
                || !StringUtils.hasText(model)) {
            log.warn("AI 配置不完整，跳过外部 LLM 调用");
            metricsRecorder.recordAiChatCall("skipped", "config_missing", model);
            return null;
        }

        long startNs = System.nanoTime();
        int promptBytes = safeBytes(systemPrompt) + safeBytes(userPrompt);
        int maxAttempts = 1 + Math.max(0, aiProperties.getMaxRetries());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            AiHttpResult r = doHttpCall(systemPrompt, userPrompt, jsonMode);
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            if (r.success) {
                metricsRecorder.recordAiChatLatencyMs(latencyMs, "success", model);
                metricsRecorder.recordAiChatCall("success", "ok", model);
                log.info("AI chat success: model={}, jsonMode={}, latencyMs={}, attempts={}, promptBytes={}, respBytes={}",
                        model, jsonMode, latencyMs, attempt, promptBytes, r.responseBytes);
                return r.content;
            }
            if (!isRetriable(r.statusCode, r.errorType) || attempt == maxAttempts) {
                metricsRecorder.recordAiChatLatencyMs(latencyMs, "fail", model);
                metricsRecorder.recordAiChatCall("fail", r.errorType, model);
                log.warn("AI chat fail: model={}, jsonMode={}, latencyMs={}, attempts={}, statusCode={}, errorType={}, promptBytes={}",
                        model, jsonMode, latencyMs, attempt, r.statusCode, r.errorType, promptBytes);
                return null;
            }
            log.debug("AI chat 第 {} 次尝试失败，准备重试: statusCode={}, errorType={}", attempt, r.statusCode, r.errorType);
        }
        return null;
    }

    private AiHttpResult doHttpCall(String systemPrompt, String userPrompt, boolean jsonMode) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", aiProperties.getModel());
            body.put("temperature", aiProperties.getTemperature());
            body.put("messages", List.of(
                    Map.of("role", "system", "content", systemPrompt == null ? "" : systemPrompt),
                    Map.of("role", "user", "content", userPrompt == null ? "" : userPrompt)));
            if (jsonMode) {
                body.put("response_format", Map.of("type", "json_object"));
            }
            String json = objectMapper.writeValueAsString(body);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(aiProperties.getBaseUrl()))
                    .timeout(Duration.ofMillis(Math.max(1, aiProperties.getRequestTimeoutMs())))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + aiProperties.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build();

            HttpResponse<String> response = aiHttpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int code = response.statusCode();
            String respBody = response.body();
            int respBytes = safeBytes(respBody);

            if (code / 100 != 2 || !StringUtils.hasText(respBody)) {
                return AiHttpResult.fail(code, "http_" + code, respBytes);
            }

            JsonNode content = objectMapper.readTree(respBody).path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || !StringUtils.hasText(content.asText())) {
                return AiHttpResult.fail(code, "bad_response_empty_content", respBytes);
            }
            return AiHttpResult.ok(content.asText().trim(), respBytes);
        } catch (HttpTimeoutException te) {
            return AiHttpResult.fail(0, "timeout", 0);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return AiHttpResult.fail(0, "interrupted", 0);
        } catch (Exception e) {
            log.warn("调用外部 LLM 异常: {}", e.getMessage());
            return AiHttpResult.fail(0, "exception", 0);
        }
    }

    private boolean isRetriable(int statusCode, String errorType) {
        if ("timeout".equals(errorType)) {
            return true;
        }
        return statusCode == 429 || statusCode / 100 == 5;
    }

    private int safeBytes(String s) {
        if (!StringUtils.hasText(s)) {
            return 0;
        }
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    private static class AiHttpResult {
        private final boolean success;
        private final String content;
        private final int statusCode;
        private final String errorType;
        private final int responseBytes;

        private AiHttpResult(boolean success, String content, int statusCode, String errorType, int responseBytes) {
            this.success = success;
            this.content = content;
            this.statusCode = statusCode;
            this.errorType = errorType;
            this.responseBytes = responseBytes;
        }

        static AiHttpResult ok(String content, int responseBytes) {
            return new AiHttpResult(true, content, 200, "ok", responseBytes);
        }

        static AiHttpResult fail(int statusCode, String errorType, int responseBytes) {
            return new AiHttpResult(false, null, statusCode, errorType, responseBytes);
        }
    }
}
