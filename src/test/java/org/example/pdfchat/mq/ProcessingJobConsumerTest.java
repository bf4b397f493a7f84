package org.example.pdfchat.mq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import org.example.pdfchat.entity.dto.ProcessingJobMessage;
import org.example.pdfchat.model.ProcessingOutcome;
import org.example.pdfchat.model.ProcessingStage;
import org.example.pdfchat.service.DocumentProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ProcessingJobConsumerTest {

    private static final long TAG = 42L;
    private static final String VALID_BODY = """
            {"jobId":"job-1","documentId":"p-1","fileId":"f-1","storageKey":"uploads/1_p-1.pdf",
             "metadata":{"originalName":"manual.pdf","mimeType":"application/pdf","size":1024}}
            """;

    private DocumentProcessor documentProcessor;
    private JobLockManager jobLockManager;
    private Channel channel;
    private ProcessingJobConsumer consumer;

    @BeforeEach
    void setUp() {
        documentProcessor = mock(DocumentProcessor.class);
        jobLockManager = mock(JobLockManager.class);
        channel = mock(Channel.class);
        consumer = new ProcessingJobConsumer(new ObjectMapper(), documentProcessor, jobLockManager);
        when(jobLockManager.tryAcquire(any(), anyBoolean())).thenReturn("token-1");
    }

    @Test
    void acksAfterSuccessfulProcessing() throws Exception {
        when(documentProcessor.process(any())).thenReturn(ProcessingOutcome.completed("job-1", 3));

        consumer.onMessage(message(VALID_BODY, false), channel, TAG);

        ArgumentCaptor<ProcessingJobMessage> captor = ArgumentCaptor.forClass(ProcessingJobMessage.class);
        verify(documentProcessor).process(captor.capture());
        assertThat(captor.getValue().getStorageKey()).isEqualTo("uploads/1_p-1.pdf");
        assertThat(captor.getValue().originalName()).isEqualTo("manual.pdf");
        verify(channel).basicAck(TAG, false);
        verify(jobLockManager).release("job-1", "token-1");
    }

    @Test
    void acksWhenFailureWasRecorded() throws Exception {
        when(documentProcessor.process(any()))
                .thenReturn(ProcessingOutcome.failed("job-1", ProcessingStage.FETCH, "FETCH: 对象不存在"));

        consumer.onMessage(message(VALID_BODY, false), channel, TAG);

        verify(channel).basicAck(TAG, false);
        verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
    }

    @Test
    void rejectsMalformedJsonToDeadLetter() throws Exception {
        consumer.onMessage(message("not json at all", false), channel, TAG);

        verify(channel).basicReject(TAG, false);
        verifyNoInteractions(documentProcessor);
    }

    @Test
    void rejectsPayloadMissingRequiredField() throws Exception {
        consumer.onMessage(message("{\"jobId\":\"job-1\",\"fileId\":\"f-1\"}", false), channel, TAG);

        verify(channel).basicReject(TAG, false);
        verifyNoInteractions(documentProcessor, jobLockManager);
    }

    @Test
    void acceptsLegacyFieldNames() throws Exception {
        when(documentProcessor.process(any())).thenReturn(ProcessingOutcome.completed("job-1", 1));
        String legacy = "{\"jobId\":\"job-1\",\"projectId\":\"p-1\",\"fileId\":\"f-1\",\"minioPath\":\"uploads/a.pdf\"}";

        consumer.onMessage(message(legacy, false), channel, TAG);

        ArgumentCaptor<ProcessingJobMessage> captor = ArgumentCaptor.forClass(ProcessingJobMessage.class);
        verify(documentProcessor).process(captor.capture());
        assertThat(captor.getValue().getDocumentId()).isEqualTo("p-1");
        assertThat(captor.getValue().getStorageKey()).isEqualTo("uploads/a.pdf");
    }

    @Test
    void requeuesWhenTerminalStatusCannotBeRecorded() throws Exception {
        when(documentProcessor.process(any())).thenThrow(new DataAccessResourceFailureException("数据库不可用"));

        consumer.onMessage(message(VALID_BODY, false), channel, TAG);

        verify(channel).basicNack(TAG, false, true);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
        verify(jobLockManager).release("job-1", "token-1");
    }

    @Test
    void dropsConcurrentDuplicateDelivery() throws Exception {
        when(jobLockManager.tryAcquire("job-1", false)).thenReturn(null);

        consumer.onMessage(message(VALID_BODY, false), channel, TAG);

        verify(channel).basicAck(TAG, false);
        verifyNoInteractions(documentProcessor);
        verify(jobLockManager, never()).release(any(), any());
    }

    @Test
    void redeliveredMessageTakesOverLock() throws Exception {
        when(documentProcessor.process(any())).thenReturn(ProcessingOutcome.completed("job-1", 2));

        consumer.onMessage(message(VALID_BODY, true), channel, TAG);

        verify(jobLockManager).tryAcquire(eq("job-1"), eq(true));
        verify(channel).basicAck(TAG, false);
        verify(jobLockManager).release("job-1", "token-1");
    }

    private static Message message(String body, boolean redelivered) {
        MessageProperties properties = new MessageProperties();
        properties.setRedelivered(redelivered);
        return new Message(body.getBytes(StandardCharsets.UTF_8), properties);
    }
}
