package com.liftrx.service.catalog;

import com.liftrx.model.domain.Exercise;

import java.util.List;
import java.util.Map;

/**
 * 动作库数据来源
 */
public interface ExerciseCatalogLoader {

    /**
     * 加载全部动作 (含激活度)，保持数据源顺序
     */
    List<Exercise> getAllExercises();

    /**
     * 肌群ID -> 展示名称
     */
    Map<String, String> getMuscleNames();
}
