package com.liftrx.controller;

import com.liftrx.common.Result;
import com.liftrx.model.dto.PrescriptionRequestDTO;
import com.liftrx.model.vo.PrescriptionResultVO;
import com.liftrx.service.PrescriptionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/prescription")
@RequiredArgsConstructor
public class PrescriptionController {

    private final PrescriptionService prescriptionService;

    /**
     * 生成训练处方
     */
    @PostMapping
    public Result<PrescriptionResultVO> prescribe(@Valid @RequestBody PrescriptionRequestDTO dto) {
        log.info("收到处方请求: {}", dto);
        PrescriptionResultVO vo = prescriptionService.prescribe(dto);
        if (vo.getExercises() == null || vo.getExercises().isEmpty()) {
            return Result.success("当前条件下没有可用动作", vo);
        }
        return Result.success("生成成功", vo);
    }

    /**
     * 动作库变更后清除缓存
     */
    @PostMapping("/catalog/invalidate")
    public Result<Void> invalidateCatalog() {
        prescriptionService.invalidateCatalog();
        return Result.success("动作库缓存已清除", null);
    }
}
