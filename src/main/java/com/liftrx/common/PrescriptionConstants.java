package com.liftrx.common;

import java.util.*;

/**
 * 训练处方常量定义
 * 求解器、数据层与接口层共用同一套编码与阈值
 */
public class PrescriptionConstants {

    // ===================== 训练场地 Locations =====================
    public static final String LOCATION_GYM = "gym"; // 健身房（视为器械齐全）
    public static final String LOCATION_HOME = "home"; // 居家
    public static final String LOCATION_PARK = "park"; // 公园/户外
    public static final String LOCATION_HOTEL = "hotel"; // 酒店
    public static final String LOCATION_OFFICE = "office"; // 办公室
    public static final String LOCATION_TRAVEL = "travel"; // 出差途中

    /**
     * 所有有效的训练场地
     */
    public static final Set<String> VALID_LOCATIONS = Set.of(
            LOCATION_GYM, LOCATION_HOME, LOCATION_PARK,
            LOCATION_HOTEL, LOCATION_OFFICE, LOCATION_TRAVEL);

    // ===================== 肌肉激活阈值 =====================
    /**
     * 激活度达到该值即视为主练肌群
     */
    public static final int PRIMARY_ACTIVATION_THRESHOLD = 60;

    /**
     * 排除肌群时，激活度超过该值的动作一律剔除
     */
    public static final int EXCLUDED_MUSCLE_ACTIVATION_LIMIT = 40;

    // ===================== 时间预算 (秒) =====================
    public static final int REP_DURATION_SECONDS = 3; // 每次动作固定耗时
    public static final int EQUIPMENT_SETUP_SECONDS = 30; // 需要器械时的准备时间
    public static final int LONG_SESSION_MINUTES = 30; // 长时训练阈值
    public static final int LONG_SESSION_OVERHEAD_SECONDS = 300; // 长时训练热身+放松
    public static final int SHORT_SESSION_OVERHEAD_SECONDS = 120; // 短时训练热身+放松
    public static final int MIN_REMAINING_SECONDS = 60; // 剩余时间不超过此值即停止装箱

    // ===================== 默认容量 =====================
    public static final int DEFAULT_SETS = 3;
    public static final int DEFAULT_REPS = 10;
    public static final double DEFAULT_REST_MULTIPLIER = 1.0;
    public static final int DEFAULT_SUBSTITUTION_LIMIT = 3;

    /**
     * 平衡诊断：一侧动作数超过另一侧的倍数即提示
     */
    public static final double BALANCE_RATIO_LIMIT = 2.0;

    /**
     * 平衡诊断至少需要的已选动作数
     */
    public static final int BALANCE_MIN_EXERCISES = 3;

    private static final Map<String, String> LOCATION_CN_MAP = new HashMap<>();

    static {
        LOCATION_CN_MAP.put(LOCATION_GYM, "健身房");
        LOCATION_CN_MAP.put(LOCATION_HOME, "居家");
        LOCATION_CN_MAP.put(LOCATION_PARK, "公园");
        LOCATION_CN_MAP.put(LOCATION_HOTEL, "酒店");
        LOCATION_CN_MAP.put(LOCATION_OFFICE, "办公室");
        LOCATION_CN_MAP.put(LOCATION_TRAVEL, "出差");
    }

    /**
     * 判断场地编码是否有效
     */
    public static boolean isValidLocation(String location) {
        return location != null && VALID_LOCATIONS.contains(location);
    }

    /**
     * 获取场地中文名
     */
    public static String getLocationCnName(String location) {
        return LOCATION_CN_MAP.getOrDefault(location, location);
    }

    /**
     * 健身房视为全器械场地，跳过器械校验
     */
    public static boolean isFullEquipmentLocation(String location) {
        return LOCATION_GYM.equals(location);
    }
}
