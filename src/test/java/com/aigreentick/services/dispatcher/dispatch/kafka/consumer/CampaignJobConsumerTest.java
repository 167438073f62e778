package com.aigreentick.services.dispatcher.dispatch.kafka.consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import com.aigreentick.services.dispatcher.dispatch.kafka.event.CampaignJobEvent;
import com.aigreentick.services.dispatcher.dispatch.model.DispatchRunResult;
import com.aigreentick.services.dispatcher.dispatch.service.CampaignDispatcher;

@ExtendWith(MockitoExtension.class)
class CampaignJobConsumerTest {

    @Mock
    private CampaignDispatcher campaignDispatcher;

    @Mock
    private ExecutorService campaignExecutor;

    @Mock
    private Acknowledgment acknowledgment;

    private CampaignJobConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new CampaignJobConsumer(campaignDispatcher, campaignExecutor);
    }

    @Test
    void testConsume_AcknowledgesBeforeHandingOffRun() {
        CampaignJobEvent event = CampaignJobEvent.createForCampaign(42L, 9L);
        when(campaignDispatcher.dispatch(42L)).thenReturn(DispatchRunResult.completed(42L, 3, 1));

        consumer.consumeCampaignJob(event, 0, 10L, acknowledgment);

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        InOrder inOrder = inOrder(acknowledgment, campaignExecutor);
        inOrder.verify(acknowledgment).acknowledge();
        inOrder.verify(campaignExecutor).execute(task.capture());
        verifyNoInteractions(campaignDispatcher);

        task.getValue().run();

        verify(campaignDispatcher).dispatch(42L);
    }

    @Test
    void testConsume_WhenRunThrows_DoesNotPropagate() {
        CampaignJobEvent event = CampaignJobEvent.createForCampaign(42L, 9L);
        when(campaignDispatcher.dispatch(42L)).thenThrow(new IllegalStateException("boom"));

        consumer.consumeCampaignJob(event, 0, 10L, acknowledgment);

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(campaignExecutor).execute(task.capture());
        assertDoesNotThrow(() -> task.getValue().run());
    }

    @Test
    void testConsume_WhenExecutorRejects_StillAcknowledged() {
        CampaignJobEvent event = CampaignJobEvent.createForCampaign(42L, 9L);
        doThrow(new RejectedExecutionException("full")).when(campaignExecutor).execute(any(Runnable.class));

        assertDoesNotThrow(() -> consumer.consumeCampaignJob(event, 0, 10L, acknowledgment));

        verify(acknowledgment).acknowledge();
        verifyNoInteractions(campaignDispatcher);
    }

    @Test
    void testConsume_WhenCampaignIdMissing_AcknowledgesAndDrops() {
        CampaignJobEvent event = CampaignJobEvent.builder().jobId("j-1").build();

        consumer.consumeCampaignJob(event, 0, 10L, acknowledgment);

        verify(acknowledgment).acknowledge();
        verifyNoInteractions(campaignExecutor, campaignDispatcher);
    }
}
