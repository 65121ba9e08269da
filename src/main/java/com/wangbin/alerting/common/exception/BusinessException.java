package com.wangbin.alerting.common.exception;

import com.wangbin.alerting.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 业务异常，携带返回给调用方的错误码
 */
@Getter
public class BusinessException extends RuntimeException {

    private final int code;

    public BusinessException(int code, String message) {
        super(message);
        this.code = code;
    }

    public BusinessException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public BusinessException(ResultCode resultCode, String message) {
        this(resultCode.getCode(), message);
    }
}
