package com.itinera.common.exception;

import com.itinera.common.result.ErrorCode;

/**
 * 行程请求不合法（日期顺序、预算、人数、兴趣为空等），在流水线开始前抛出。
 */
public class InvalidTripRequestException extends BaseException {

    public InvalidTripRequestException(String message) {
        super(ErrorCode.TRIP_INVALID_REQUEST, message);
    }
}
