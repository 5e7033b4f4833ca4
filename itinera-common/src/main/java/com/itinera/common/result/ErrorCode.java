package com.itinera.common.result;

/**
 * 错误码枚举。
 * <p>1xxx 为请求参数类错误，2xxx 为行程构建各阶段的失败，3xxx 为外部内容生成服务相关错误。</p>
 */
public enum ErrorCode {

    SUCCESS(0, "ok"),

    /** 通用业务错误（未细分场景时的兜底） */
    COMMON_ERROR(1, "error"),

    /** 行程请求参数不合法（日期、预算、人数、兴趣等） */
    TRIP_INVALID_REQUEST(1001, "行程请求参数不合法"),

    /** 请求过于频繁 */
    TOO_MANY_REQUESTS(1002, "行程规划请求过于频繁，请稍后再试"),

    /** 候选地点为空，无法筛选出工作集 */
    PLACE_POOL_EMPTY(2001, "没有可用的候选地点"),

    /** 没有可选的住宿 */
    NO_ACCOMMODATION(2002, "没有可用的住宿"),

    /** 某一天未能排出任何活动 */
    EMPTY_DAY_SCHEDULE(2003, "某一天没有可安排的活动"),

    /** 多轮重排后仍超出预算，且策略要求直接失败 */
    BUDGET_NOT_SATISFIED(2004, "多轮重排后行程仍超出预算"),

    /** 行程构建失败（兜底） */
    ITINERARY_BUILD_FAILED(2099, "行程构建失败"),

    /** 内容生成服务多次返回不可用结果 */
    CONTENT_GENERATION_FAILED(3001, "内容生成服务暂不可用");

    private final int code;
    private final String msg;

    ErrorCode(int code, String msg) {
        this.code = code;
        this.msg = msg;
    }

    public int getCode() {
        return code;
    }

    public String getMsg() {
        return msg;
    }
}
