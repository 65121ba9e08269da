package com.wangbin.alerting.core.lifecycle;

import com.wangbin.alerting.common.domain.entity.Alert;

import java.time.Instant;
import java.util.List;

/**
 * 告警升级扩展点
 *
 * 在引擎锁内调用，只负责挑选需要升级的告警，不得执行 I/O；
 * 标记与重新投递由 {@link AlertLifecycleManager} 完成。
 */
public interface EscalationHandler {

    /**
     * @param activeAlerts 当前活动告警（内部对象，只读）
     * @param now          当前时间
     * @return 本轮需要升级的告警
     */
    List<Alert> select(List<Alert> activeAlerts, Instant now);
}
