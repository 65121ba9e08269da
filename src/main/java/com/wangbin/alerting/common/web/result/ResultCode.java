package com.wangbin.alerting.common.web.result;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 响应码
 *
 * 1xxx 请求与告警操作，2xxx 引擎运行期故障，3xxx 配置。
 */
@Getter
@RequiredArgsConstructor
public enum ResultCode {

    SUCCESS(200, "成功"),
    BAD_REQUEST(400, "无法识别的请求"),

    PARAM_ERROR(1000, "请求参数校验失败"),
    DATA_NOT_FOUND(1001, "告警不存在或已恢复"),
    DATA_INVALID(1003, "指标未注册或阈值不合法"),
    OPERATION_FAILED(1004, "操作未生效"),

    DATA_UNAVAILABLE(2000, "指标数据不可用"),
    PERSISTENCE_ERROR(2002, "告警持久化失败"),
    NOTIFICATION_ERROR(2003, "通知发送失败"),
    SCHEDULER_ERROR(2004, "告警调度器启动失败"),

    CONFIG_INVALID(3002, "告警配置无效"),

    SYSTEM_ERROR(5000, "告警服务内部错误");

    private final int code;
    private final String message;
}
