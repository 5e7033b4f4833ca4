package com.itinera.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 内容生成服务配置（OpenAI 兼容接口的地址、密钥、模型等）。
 * Content generation provider configuration (OpenAI compatible API).
 */
@Data
@ConfigurationProperties(prefix = "itinera.ai")
public class AiProperties {

    /**
     * Chat Completion 接口的完整 URL，例如：https://api.openai.com/v1/chat/completions
     * Chat completion endpoint, e.g. https://api.openai.com/v1/chat/completions
     */
    private String baseUrl;

    /**
     * API Key。
     */
    private String apiKey;

    /**
     * 模型名称，例如：gpt-4.1-mini。
     */
    private String model;

    /**
     * 采样温度；结构化输出场景建议偏低。
     */
    private double temperature = 0.3;

    /**
     * 连接超时（毫秒）。
     */
    private int connectTimeoutMs = 1000;

    /**
     * 单次请求超时（毫秒）。生成一天的活动安排通常比闲聊慢，默认给足时间。
     */
    private int requestTimeoutMs = 30000;

    /**
     * HTTP 层最大重试次数（不含首次请求），仅对 429/5xx/超时 生效。
     * 结构化结果不合法时的重试由 itinera.planner.generation-max-attempts 控制。
     */
    private int maxRetries = 1;
}
