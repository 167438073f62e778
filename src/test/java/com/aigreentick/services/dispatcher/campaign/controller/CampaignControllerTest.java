package com.aigreentick.services.dispatcher.campaign.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.aigreentick.services.dispatcher.campaign.dto.CreateCampaignRequest;
import com.aigreentick.services.dispatcher.campaign.dto.LaunchResult;
import com.aigreentick.services.dispatcher.campaign.exception.CampaignNotFoundException;
import com.aigreentick.services.dispatcher.campaign.exception.CampaignValidationException;
import com.aigreentick.services.dispatcher.campaign.repository.CampaignRepository;
import com.aigreentick.services.dispatcher.campaign.service.impl.CampaignLaunchService;
import com.aigreentick.services.dispatcher.event.dto.CampaignAnalytics;
import com.aigreentick.services.dispatcher.event.service.impl.CampaignAnalyticsService;
import com.fasterxml.jackson.databind.ObjectMapper;

@WebMvcTest(CampaignController.class)
class CampaignControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private CampaignLaunchService launchService;

    @MockBean
    private CampaignAnalyticsService analyticsService;

    @MockBean
    private CampaignRepository campaignRepository;

    @Test
    void testStartCampaign_Success() throws Exception {
        CreateCampaignRequest request = new CreateCampaignRequest();
        request.setOwnerId(9L);
        request.setText("hello");
        request.setIncludeIds(List.of(1L));
        when(launchService.launch(any(CreateCampaignRequest.class))).thenReturn(new LaunchResult(100L, "running", 2));

        mockMvc.perform(post("/api/v1/campaigns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.data.campaignId").value(100))
                .andExpect(jsonPath("$.data.senderAccounts").value(2));
    }

    @Test
    void testStartCampaign_WhenOwnerMissing_ReturnsBadRequest() throws Exception {
        CreateCampaignRequest request = new CreateCampaignRequest();
        request.setText("hello");

        mockMvc.perform(post("/api/v1/campaigns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("ERROR"))
                .andExpect(jsonPath("$.data.ownerId").exists());

        verifyNoInteractions(launchService);
    }

    @Test
    void testStartCampaign_WhenRateNotPositive_ReturnsBadRequest() throws Exception {
        CreateCampaignRequest request = new CreateCampaignRequest();
        request.setOwnerId(9L);
        request.setText("hello");
        request.setRatePerMin(0);

        mockMvc.perform(post("/api/v1/campaigns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data.ratePerMin").exists());
    }

    @Test
    void testStartCampaign_WhenValidationFails_ReturnsErrors() throws Exception {
        CreateCampaignRequest request = new CreateCampaignRequest();
        request.setOwnerId(9L);
        when(launchService.launch(any(CreateCampaignRequest.class))).thenThrow(
                new CampaignValidationException(List.of("Owner has no active sender accounts")));

        mockMvc.perform(post("/api/v1/campaigns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("ERROR"))
                .andExpect(jsonPath("$.data[0]").value("Owner has no active sender accounts"));
    }

    @Test
    void testStopCampaign_Success() throws Exception {
        mockMvc.perform(post("/api/v1/campaigns/4/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"));

        verify(launchService).stop(4L);
    }

    @Test
    void testStopCampaign_WhenMissing_ReturnsNotFound() throws Exception {
        doThrow(new CampaignNotFoundException(4L)).when(launchService).stop(4L);

        mockMvc.perform(post("/api/v1/campaigns/4/stop"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testAnalytics_UsesDefaultsAndReturnsSummary() throws Exception {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("sent", 3L);
        when(campaignRepository.existsById(4L)).thenReturn(true);
        when(analyticsService.summarize(4L, 5, 20)).thenReturn(new CampaignAnalytics(
                4L, counts, 3L, 2L, List.of(), List.of(), Map.of(), List.of()));

        mockMvc.perform(get("/api/v1/campaigns/4/analytics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sent").value(3))
                .andExpect(jsonPath("$.data.uniqueDestinationsReached").value(2));
    }

    @Test
    void testAnalytics_WhenCampaignMissing_ReturnsNotFound() throws Exception {
        when(campaignRepository.existsById(4L)).thenReturn(false);

        mockMvc.perform(get("/api/v1/campaigns/4/analytics"))
                .andExpect(status().isNotFound());

        verifyNoInteractions(analyticsService);
    }

    @Test
    void testCheck_ReturnsRunning() throws Exception {
        mockMvc.perform(get("/api/v1/campaigns/check"))
                .andExpect(status().isOk());
    }
}
