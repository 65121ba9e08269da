package com.wangbin.alerting.common.utils;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * JSON工具类
 */
@Slf4j
public class JsonUtil {

    private JsonUtil() {
        // 工具类，防止实例化
    }

    /**
     * 对象转JSON字符串
     */
    public static String toJsonString(Object object) {
        try {
            return JSON.toJSONString(object);
        } catch (Exception e) {
            log.error("对象转JSON字符串失败", e);
            return null;
        }
    }

    /**
     * 解析对象数组，非数组或解析失败时抛出 IllegalArgumentException
     */
    public static List<Map<String, Object>> parseObjectList(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        JSONArray array;
        try {
            array = JSON.parseArray(json);
        } catch (Exception e) {
            throw new IllegalArgumentException("JSON数组解析失败: " + e.getMessage(), e);
        }
        if (array == null) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> rows = new ArrayList<>(array.size());
        for (Object item : array) {
            if (item instanceof JSONObject jsonObject) {
                rows.add(jsonObject);
            }
        }
        return rows;
    }
}
