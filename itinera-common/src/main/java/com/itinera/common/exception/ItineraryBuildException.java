package com.itinera.common.exception;

import com.itinera.common.result.ErrorCode;

/**
 * 行程构建在某个阶段失败。stage 为编排器状态名，例如 FILTER_PLACES、BUILD_SCHEDULES。
 */
public class ItineraryBuildException extends BaseException {

    private final String stage;

    public ItineraryBuildException(String stage, ErrorCode errorCode) {
        super(errorCode, errorCode.getMsg() + " (stage=" + stage + ")");
        this.stage = stage;
    }

    public ItineraryBuildException(String stage, ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.stage = stage;
    }

    public ItineraryBuildException(String stage, ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
