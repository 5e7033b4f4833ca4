package com.itinera.server.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itinera.common.exception.ContentGenerationException;
import com.itinera.pojo.dto.DailyActivitiesDTO;
import com.itinera.pojo.dto.DailyThemesDTO;
import com.itinera.pojo.dto.TravelSegmentOptions;
import com.itinera.server.utils.AiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 基于 {@link AiClient} 的内容生成实现：要求模型只输出 JSON，再用 Jackson 解析成目标结构。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AiContentGenerationService implements ContentGenerationService {

    private static final String SYSTEM_PROMPT = "You are a meticulous travel planning assistant. "
            + "Answer with exactly one JSON object and nothing else: no markdown, no code fences, no comments. "
            + "The JSON object must have this shape: %s. "
            + "Only use ids, names and values that appear in the user's input.";

    private final AiClient aiClient;
    private final ObjectMapper objectMapper;

    @Override
    public <T> T generate(String contextPayload, Class<T> outputSchema) {
        String systemPrompt = String.format(SYSTEM_PROMPT, describeShape(outputSchema));
        String content = aiClient.chatJson(systemPrompt, contextPayload);
        if (!StringUtils.hasText(content)) {
            throw new ContentGenerationException("内容生成服务没有返回内容: schema=" + outputSchema.getSimpleName());
        }
        try {
            T result = objectMapper.readValue(stripCodeFence(content), outputSchema);
            if (result == null) {
                throw new ContentGenerationException("内容生成服务返回了 null: schema=" + outputSchema.getSimpleName());
            }
            return result;
        } catch (JsonProcessingException e) {
            log.warn("解析生成结果失败: schema={}, error={}", outputSchema.getSimpleName(), e.getOriginalMessage());
            throw new ContentGenerationException("生成结果不是合法的 " + outputSchema.getSimpleName(), e);
        }
    }

    /**
     * 每种输出结构对应一段写死的 JSON 示例，字段名必须与 DTO 一致。
     */
    static String describeShape(Class<?> outputSchema) {
        if (outputSchema == DailyActivitiesDTO.class) {
            return DailyActivitiesDTO.JSON_SHAPE;
        }
        if (outputSchema == DailyThemesDTO.class) {
            return DailyThemesDTO.JSON_SHAPE;
        }
        if (outputSchema == TravelSegmentOptions.class) {
            return TravelSegmentOptions.JSON_SHAPE;
        }
        throw new IllegalArgumentException("没有为该输出结构定义 JSON 示例: " + outputSchema.getName());
    }

    /**
     * 部分模型即使被要求也会包一层 ```json ... ```，这里去掉。
     */
    static String stripCodeFence(String content) {
        String text = content.trim();
        if (text.startsWith("```")) {
            int firstBreak = text.indexOf('\n');
            int lastFence = text.lastIndexOf("```");
            if (firstBreak > 0 && lastFence > firstBreak) {
                text = text.substring(firstBreak + 1, lastFence).trim();
            }
        }
        return text;
    }
}
