package com.wangbin.alerting.common.web.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 统一API响应结果
 *
 * 告警接口的"未找到"与"操作未生效"都以 200 返回，通过 code 区分。
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResult<T> {

    private final int code;
    private final String message;
    private final T data;
    private final long timestamp;
    private Map<String, Object> extra;

    private ApiResult(int code, String message, T data) {
        this.code = code;
        this.message = message;
        this.data = data;
        this.timestamp = System.currentTimeMillis();
    }

    public static <T> ApiResult<T> success() {
        return success(null);
    }

    public static <T> ApiResult<T> success(T data) {
        return new ApiResult<>(ResultCode.SUCCESS.getCode(), ResultCode.SUCCESS.getMessage(), data);
    }

    /**
     * 有值返回成功，否则返回 DATA_NOT_FOUND
     */
    public static <T> ApiResult<T> found(Optional<T> value, String notFoundMessage) {
        return value.map(ApiResult::success)
                .orElseGet(() -> error(ResultCode.DATA_NOT_FOUND, notFoundMessage));
    }

    /**
     * 无返回数据的操作：done 为 false 时返回 failure 错误码
     */
    public static ApiResult<Void> outcome(boolean done, ResultCode failure, String failureMessage) {
        return done ? success() : error(failure, failureMessage);
    }

    public static <T> ApiResult<T> error(int code, String message) {
        return new ApiResult<>(code, message, null);
    }

    public static <T> ApiResult<T> error(ResultCode resultCode) {
        return error(resultCode.getCode(), resultCode.getMessage());
    }

    public static <T> ApiResult<T> error(ResultCode resultCode, String message) {
        return error(resultCode.getCode(), message);
    }

    public boolean isSuccess() {
        return code == ResultCode.SUCCESS.getCode();
    }

    public ApiResult<T> withExtra(String key, Object value) {
        if (extra == null) {
            extra = new LinkedHashMap<>();
        }
        extra.put(key, value);
        return this;
    }
}
