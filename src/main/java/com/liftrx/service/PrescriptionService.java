package com.liftrx.service;

import com.liftrx.model.dto.PrescriptionRequestDTO;
import com.liftrx.model.vo.PrescriptionResultVO;

public interface PrescriptionService {

    /**
     * 生成训练处方
     *
     * @param dto 已通过参数校验的请求
     * @return 处方结果，没有可用动作时 exercises 为空
     */
    PrescriptionResultVO prescribe(PrescriptionRequestDTO dto);

    /**
     * 清除动作库缓存
     */
    void invalidateCatalog();
}
