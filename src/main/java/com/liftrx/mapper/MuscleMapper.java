package com.liftrx.mapper;

import com.liftrx.model.entity.MuscleEntity;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

@Mapper
public interface MuscleMapper {
    List<MuscleEntity> selectAll();
}
