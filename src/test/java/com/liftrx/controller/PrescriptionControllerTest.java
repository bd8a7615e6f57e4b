package com.liftrx.controller;

import com.liftrx.model.vo.PrescriptionResultVO;
import com.liftrx.service.PrescriptionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PrescriptionController.class)
class PrescriptionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PrescriptionService prescriptionService;

    private PrescriptionResultVO resultWith(String exerciseId) {
        PrescriptionResultVO.ExerciseItem item = new PrescriptionResultVO.ExerciseItem();
        item.setExerciseId(exerciseId);
        item.setSets(4);
        item.setReps("10");
        item.setMovementPattern("squat");
        PrescriptionResultVO vo = new PrescriptionResultVO();
        vo.setExercises(List.of(item));
        vo.setCoverage(Map.of());
        vo.setSubstitutions(Map.of());
        vo.setActualDurationSeconds(600);
        vo.setBackend("greedy");
        return vo;
    }

    @Test
    void returnsPrescription() throws Exception {
        when(prescriptionService.prescribe(any())).thenReturn(resultWith("back_squat"));

        mockMvc.perform(post("/api/prescription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeAvailable\": 45, \"location\": \"gym\", \"goals\": [\"strength\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.message").value("生成成功"))
                .andExpect(jsonPath("$.data.exercises[0].exerciseId").value("back_squat"))
                .andExpect(jsonPath("$.data.exercises[0].movementPattern").value("squat"))
                .andExpect(jsonPath("$.data.actualDurationSeconds").value(600));
    }

    @Test
    void emptyPrescriptionIsStillSuccess() throws Exception {
        PrescriptionResultVO empty = resultWith("x");
        empty.setExercises(List.of());
        when(prescriptionService.prescribe(any())).thenReturn(empty);

        mockMvc.perform(post("/api/prescription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeAvailable\": 15, \"location\": \"hotel\"}"))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.exercises").isEmpty());
    }

    @Test
    void rejectsTimeOutOfRange() throws Exception {
        mockMvc.perform(post("/api/prescription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeAvailable\": 10, \"location\": \"gym\"}"))
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.message").value("训练时长不能少于15分钟"));

        mockMvc.perform(post("/api/prescription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeAvailable\": 121, \"location\": \"gym\"}"))
                .andExpect(jsonPath("$.code").value(400));

        verifyNoInteractions(prescriptionService);
    }

    @Test
    void rejectsMissingLocation() throws Exception {
        mockMvc.perform(post("/api/prescription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeAvailable\": 30}"))
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.message").value("训练场地不能为空"));
    }

    @Test
    void rejectsMalformedBody() throws Exception {
        mockMvc.perform(post("/api/prescription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeAvailable\": "))
                .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    void serviceArgumentErrorMapsTo400() throws Exception {
        when(prescriptionService.prescribe(any())).thenThrow(new IllegalArgumentException("不支持的训练场地: moon"));

        mockMvc.perform(post("/api/prescription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeAvailable\": 30, \"location\": \"moon\"}"))
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.message").value("不支持的训练场地: moon"));
    }

    @Test
    void unexpectedFailureMapsTo500() throws Exception {
        when(prescriptionService.prescribe(any())).thenThrow(new RuntimeException("connection refused"));

        mockMvc.perform(post("/api/prescription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeAvailable\": 30, \"location\": \"gym\"}"))
                .andExpect(jsonPath("$.code").value(500));
    }

    @Test
    void dataAccessFailureMapsTo500WithoutLeakingDetails() throws Exception {
        when(prescriptionService.prescribe(any())).thenThrow(new DataAccessResourceFailureException("Communications link failure"));

        mockMvc.perform(post("/api/prescription")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeAvailable\": 30, \"location\": \"gym\"}"))
                .andExpect(jsonPath("$.code").value(500))
                .andExpect(jsonPath("$.message").value("数据访问失败，请稍后重试"));
    }

    @Test
    void invalidatesCatalog() throws Exception {
        mockMvc.perform(post("/api/prescription/catalog/invalidate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200));

        verify(prescriptionService).invalidateCatalog();
    }
}
