package com.tony.betCalibration.controller;

import com.tony.betCalibration.exception.CalibratorNotFoundException;
import com.tony.betCalibration.exception.InsufficientDataException;
import com.tony.betCalibration.model.CalibratorRecord;
import com.tony.betCalibration.model.dto.CalibrationFitResult;
import com.tony.betCalibration.service.calibration.CalibrationService;
import com.tony.betCalibration.service.registry.CalibratorRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CalibrationController.class)
class CalibrationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CalibrationService calibrationService;

    @MockBean
    private CalibratorRegistry registry;

    @Test
    @DisplayName("POST /{name} : 201 avec la version enregistrée")
    void fitShouldReturnCreated() throws Exception {
        CalibrationFitResult result = CalibrationFitResult.builder()
                .record(CalibratorRecord.builder().name("nba").versionId("abc123def456").build())
                .method("platt")
                .sampleCount(3)
                .build();
        when(calibrationService.fitAndRegister(eq("nba"), any(), any(), eq("platt"), anyBoolean(), isNull(), isNull()))
                .thenReturn(result);

        mockMvc.perform(post("/api/v1/calibrators/nba")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"probabilities\":[0.2,0.5,0.8],\"outcomes\":[0,1,1],\"method\":\"platt\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.record.version_id").value("abc123def456"));
    }

    @Test
    @DisplayName("Méthode inconnue : 400 par la validation")
    void invalidMethodShouldBeBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/calibrators/nba")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"probabilities\":[0.2],\"outcomes\":[0],\"method\":\"beta\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Données insuffisantes : 400 avec le message métier")
    void insufficientDataShouldBeBadRequest() throws Exception {
        when(calibrationService.fitAndRegister(eq("nba"), any(), any(), eq("platt"), anyBoolean(), isNull(), isNull()))
                .thenThrow(new InsufficientDataException(1, 3));

        mockMvc.perform(post("/api/v1/calibrators/nba")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"probabilities\":[0.2],\"outcomes\":[0]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("InsufficientDataException"));
    }

    @Test
    void unknownCalibratorShouldBeNotFound() throws Exception {
        when(calibrationService.calibrateAll(eq("ghost"), isNull(), any()))
                .thenThrow(new CalibratorNotFoundException("ghost"));

        mockMvc.perform(post("/api/v1/calibrators/ghost/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"probabilities\":[0.4]}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void listShouldReturnNames() throws Exception {
        when(registry.listNames()).thenReturn(List.of("nba", "nfl"));

        mockMvc.perform(get("/api/v1/calibrators"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1]").value("nfl"));
    }
}
