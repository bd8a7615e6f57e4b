package com.liftrx.mapper;

import com.liftrx.model.entity.WorkoutActivation;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface WorkoutActivationMapper {

    List<WorkoutActivation> selectByWorkoutIds(@Param("workoutIds") List<String> workoutIds);
}
