package com.liftrx.mapper;

import com.liftrx.model.entity.ExerciseActivation;
import com.liftrx.model.entity.ExerciseEntity;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

@Mapper
public interface ExerciseMapper {

    List<ExerciseEntity> selectAll();

    /**
     * 全部激活记录，按动作分组、激活度降序
     */
    List<ExerciseActivation> selectAllActivations();
}
