package com.flamingo.inboundmail.service.attachment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.flamingo.inboundmail.api.dto.response.AttachmentResponse;
import com.flamingo.inboundmail.domain.entity.Attachment;
import com.flamingo.inboundmail.domain.entity.ExtractionJob;
import com.flamingo.inboundmail.domain.entity.ExtractionResult;
import com.flamingo.inboundmail.domain.enums.ErrorKind;
import com.flamingo.inboundmail.domain.enums.JobState;
import com.flamingo.inboundmail.domain.repository.AttachmentRepository;
import com.flamingo.inboundmail.domain.repository.ExtractionJobRepository;
import com.flamingo.inboundmail.domain.repository.ExtractionResultRepository;
import com.flamingo.inboundmail.exception.AttachmentNotFoundException;
import com.flamingo.inboundmail.exception.ExtractionNotAvailableException;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AttachmentServiceImplTest {

  @Mock private AttachmentRepository attachmentRepository;

  @Mock private ExtractionJobRepository jobRepository;

  @Mock private ExtractionResultRepository resultRepository;

  private AttachmentServiceImpl attachmentService;
  private UUID attachmentId;
  private UUID jobId;

  @BeforeEach
  void setUp() {
    attachmentService =
        new AttachmentServiceImpl(attachmentRepository, jobRepository, resultRepository);
    attachmentId = UUID.randomUUID();
    jobId = UUID.randomUUID();
    Attachment attachment =
        Attachment.builder()
            .id(attachmentId)
            .eventId(UUID.randomUUID())
            .ordinal(0)
            .filename("invoice.pdf")
            .mediaType("application/pdf")
            .sizeBytes(1024)
            .storageRef("file:x/0_invoice.pdf")
            .build();
    when(attachmentRepository.findById(attachmentId)).thenReturn(Optional.of(attachment));
  }

  @Test
  void shouldDescribeAttachmentWithJobState() {
    // Given
    ExtractionJob job =
        ExtractionJob.builder()
            .id(jobId)
            .attachmentId(attachmentId)
            .state(JobState.PENDING)
            .attemptCount(1)
            .lastErrorKind(ErrorKind.TIMEOUT)
            .build();
    when(jobRepository.findByAttachmentId(attachmentId)).thenReturn(Optional.of(job));

    // When
    AttachmentResponse response = attachmentService.getAttachment(attachmentId);

    // Then
    assertThat(response.getFilename()).isEqualTo("invoice.pdf");
    assertThat(response.getJobId()).isEqualTo(jobId);
    assertThat(response.getJobState()).isEqualTo(JobState.PENDING);
    assertThat(response.getLastErrorKind()).isEqualTo(ErrorKind.TIMEOUT);
  }

  @Test
  void shouldReturnExtractedText_whenResultSuccessful() {
    ExtractionResult result =
        ExtractionResult.success(jobId, attachmentId, "hello", 1, LocalDateTime.now());
    when(resultRepository.findByAttachmentId(attachmentId)).thenReturn(Optional.of(result));

    assertThat(attachmentService.getExtractedText(attachmentId).getText()).isEqualTo("hello");
  }

  @Test
  void shouldReportFailedExtraction() {
    ExtractionResult result =
        ExtractionResult.failure(jobId, attachmentId, ErrorKind.DECODE_ERROR, LocalDateTime.now());
    when(resultRepository.findByAttachmentId(attachmentId)).thenReturn(Optional.of(result));

    assertThatThrownBy(() -> attachmentService.getExtractedText(attachmentId))
        .isInstanceOfSatisfying(
            ExtractionNotAvailableException.class,
            e -> assertThat(e.getUserMessage()).contains("DECODE_ERROR"));
  }

  @Test
  void shouldReportPendingExtraction() {
    when(resultRepository.findByAttachmentId(attachmentId)).thenReturn(Optional.empty());
    when(jobRepository.findByAttachmentId(attachmentId))
        .thenReturn(Optional.of(ExtractionJob.builder().id(jobId).build()));

    assertThatThrownBy(() -> attachmentService.getExtractedText(attachmentId))
        .isInstanceOfSatisfying(
            ExtractionNotAvailableException.class,
            e -> assertThat(e.getUserMessage()).contains("not finished"));
  }

  @Test
  void shouldThrowNotFound_whenAttachmentMissing() {
    UUID unknown = UUID.randomUUID();
    when(attachmentRepository.findById(unknown)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> attachmentService.getAttachment(unknown))
        .isInstanceOf(AttachmentNotFoundException.class);
  }
}
