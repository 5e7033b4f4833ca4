package com.itinera.server.handler;

import com.itinera.common.exception.BaseException;
import com.itinera.common.result.ErrorCode;
import com.itinera.common.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BaseException.class)
    public Result<Void> handleBaseException(BaseException ex) {
        log.error("业务异常: code={}, msg={}", ex.getCode(), ex.getMessage());
        int code = ex.getCode() == null ? ErrorCode.COMMON_ERROR.getCode() : ex.getCode();
        return Result.error(code, ex.getMessage());
    }

    /**
     * 请求体不是合法 JSON，或字段取值不合法（如未知的 kind、越界的坐标）。
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public Result<Void> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("请求体解析失败: {}", ex.getMostSpecificCause().getMessage());
        return Result.error(ErrorCode.TRIP_INVALID_REQUEST.getCode(),
                ErrorCode.TRIP_INVALID_REQUEST.getMsg() + ": " + ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Result<Void> handleOtherException(Exception ex) {
        log.error("系统异常", ex);
        return Result.error("系统异常，请稍后重试");
    }
}
