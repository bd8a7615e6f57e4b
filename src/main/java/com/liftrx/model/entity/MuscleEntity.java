package com.liftrx.model.entity;

import lombok.Data;

@Data
public class MuscleEntity {
    private String id;
    private String name;
    private String muscleGroup;
}
