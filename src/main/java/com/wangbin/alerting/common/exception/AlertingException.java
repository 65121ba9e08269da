package com.wangbin.alerting.common.exception;

import com.wangbin.alerting.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 告警引擎异常，按错误分类携带来源信息
 */
@Getter
public class AlertingException extends BusinessException {

    public enum ErrorKind {
        DATA_UNAVAILABLE(ResultCode.DATA_UNAVAILABLE),
        PERSISTENCE_FAILURE(ResultCode.PERSISTENCE_ERROR),
        NOTIFICATION_FAILURE(ResultCode.NOTIFICATION_ERROR),
        CONFIGURATION_INVALID(ResultCode.CONFIG_INVALID),
        SCHEDULER_FAILURE(ResultCode.SCHEDULER_ERROR);

        private final ResultCode resultCode;

        ErrorKind(ResultCode resultCode) {
            this.resultCode = resultCode;
        }

        public ResultCode getResultCode() {
            return resultCode;
        }
    }

    private final ErrorKind kind;

    /**
     * 出错的组件（采集器、渠道、仓储等）
     */
    private final String component;

    public AlertingException(ErrorKind kind, String component, String message) {
        super(kind.getResultCode(), message);
        this.kind = kind;
        this.component = component;
    }

    public AlertingException(ErrorKind kind, String component, String message, Throwable cause) {
        super(kind.getResultCode().getCode(), message, cause);
        this.kind = kind;
        this.component = component;
    }

    // 数据源不可用
    public static AlertingException dataUnavailable(String source, String message, Throwable cause) {
        return new AlertingException(ErrorKind.DATA_UNAVAILABLE, source, message, cause);
    }

    // 持久化失败
    public static AlertingException persistenceFailure(String repository, String message, Throwable cause) {
        return new AlertingException(ErrorKind.PERSISTENCE_FAILURE, repository, message, cause);
    }

    // 通知发送失败
    public static AlertingException notificationFailure(String channel, String message) {
        return new AlertingException(ErrorKind.NOTIFICATION_FAILURE, channel, message);
    }

    // 配置无效
    public static AlertingException configInvalid(String component, String message) {
        return new AlertingException(ErrorKind.CONFIGURATION_INVALID, component, message);
    }

    // 调度器启动失败
    public static AlertingException schedulerFailure(String message, Throwable cause) {
        return new AlertingException(ErrorKind.SCHEDULER_FAILURE, "scheduler", message, cause);
    }
}
