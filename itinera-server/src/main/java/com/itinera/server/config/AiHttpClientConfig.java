package com.itinera.server.config;

import com.itinera.common.properties.AiProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 内容生成服务使用的 HTTP 客户端：JDK 自带 HttpClient，连接超时取自 {@link AiProperties}。
 * 单次请求超时在 AiClient 里按请求设置。
 */
@Configuration
@RequiredArgsConstructor
public class AiHttpClientConfig {

    private final AiProperties aiProperties;

    @Bean
    public HttpClient aiHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1, aiProperties.getConnectTimeoutMs())))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }
}
