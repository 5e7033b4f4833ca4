package com.itinera.common.exception;

import com.itinera.common.result.ErrorCode;

/**
 * 内容生成服务没有返回可用的结构化结果。
 * <p>单次失败由调用方按固定次数重试，重试耗尽后向编排器抛出。</p>
 */
public class ContentGenerationException extends BaseException {

    public ContentGenerationException(String message) {
        super(ErrorCode.CONTENT_GENERATION_FAILED, message);
    }

    public ContentGenerationException(String message, Throwable cause) {
        super(ErrorCode.CONTENT_GENERATION_FAILED, message, cause);
    }
}
