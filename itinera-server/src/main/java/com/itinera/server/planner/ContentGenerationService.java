package com.itinera.server.planner;

import com.itinera.common.exception.ContentGenerationException;

/**
 * 外部内容生成服务：给定上下文，返回指定结构的结果。
 * <p>实现方只负责单次调用，不做结果重试；重试由 {@link GenerationRetryPolicy} 统一处理。</p>
 */
public interface ContentGenerationService {

    /**
     * @param contextPayload 给生成服务的完整上下文（说明文字 + JSON 数据）
     * @param outputSchema   期望的输出结构，需可由 Jackson 反序列化
     * @throws ContentGenerationException 无返回或返回内容无法解析为 outputSchema
     */
    <T> T generate(String contextPayload, Class<T> outputSchema);
}
