package org.gc.socialpublisher.controller;

import org.gc.socialpublisher.domain.QueueEntry;
import org.gc.socialpublisher.domain.ScheduleConfig;
import org.gc.socialpublisher.domain.dto.AutoFillRequest;
import org.gc.socialpublisher.domain.dto.AutoFillResult;
import org.gc.socialpublisher.domain.dto.QueueAddResult;
import org.gc.socialpublisher.domain.dto.QueueEntryRequest;
import org.gc.socialpublisher.domain.dto.ScheduleConfigRequest;
import org.gc.socialpublisher.domain.dto.SchedulerState;
import org.gc.socialpublisher.domain.dto.StatusResponse;
import org.gc.socialpublisher.exception.QueueConflictException;
import org.gc.socialpublisher.service.SchedulerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchedulerControllerTest {

    @Mock
    private SchedulerService schedulerService;

    private SchedulerController controller;

    @BeforeEach
    void setUp() {
        controller = new SchedulerController(schedulerService);
    }

    @Test
    void getStateReturnsSnapshot() {
        SchedulerState state = SchedulerState.builder().timezone("Europe/Madrid").build();
        when(schedulerService.state()).thenReturn(Mono.just(state));

        StepVerifier.create(controller.getState())
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(response.getBody()).isSameAs(state);
                })
                .verifyComplete();
    }

    @Test
    void saveConfigReturnsStoredConfig() {
        ScheduleConfigRequest request = new ScheduleConfigRequest();
        request.setEnabled(true);
        ScheduleConfig saved = ScheduleConfig.defaults(Instant.EPOCH);
        when(schedulerService.saveConfig(request)).thenReturn(Mono.just(saved));

        StepVerifier.create(controller.saveConfig(request))
                .assertNext(response -> assertThat(response.getBody()).isSameAs(saved))
                .verifyComplete();
    }

    @Test
    @DisplayName("Adding an entry answers 201 and passes the duplicate warning through")
    void addEntryReturnsCreated() {
        QueueEntry entry = QueueEntry.create(4L, LocalDate.of(2026, 10, 21), "20:00", null, null, 1, Instant.EPOCH);
        when(schedulerService.addEntry(any(QueueEntryRequest.class)))
                .thenReturn(Mono.just(new QueueAddResult(entry, "An entry already exists for 2026-10-21 20:00")));

        StepVerifier.create(controller.addEntry(new QueueEntryRequest()))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
                    assertThat(response.getBody()).containsEntry("entry", entry)
                            .containsEntry("warning", "An entry already exists for 2026-10-21 20:00");
                })
                .verifyComplete();
    }

    @Test
    void addEntryWithoutWarningOmitsIt() {
        QueueEntry entry = QueueEntry.create(5L, LocalDate.of(2026, 10, 21), null, null, null, 2, Instant.EPOCH);
        when(schedulerService.addEntry(any(QueueEntryRequest.class))).thenReturn(Mono.just(new QueueAddResult(entry, null)));

        StepVerifier.create(controller.addEntry(new QueueEntryRequest()))
                .assertNext(response -> assertThat(response.getBody()).containsOnlyKeys("entry"))
                .verifyComplete();
    }

    @Test
    void removeEntryConfirms() {
        when(schedulerService.removeEntry(4L)).thenReturn(Mono.empty());

        StepVerifier.create(controller.removeEntry(4L))
                .assertNext(response -> assertThat(response.getBody().getMessage()).isEqualTo("Queue entry 4 removed"))
                .verifyComplete();
    }

    @Test
    void removeEntryPropagatesConflict() {
        when(schedulerService.removeEntry(4L)).thenReturn(Mono.error(new QueueConflictException("Only pending entries can be removed")));

        StepVerifier.create(controller.removeEntry(4L))
                .expectError(QueueConflictException.class)
                .verify();
    }

    @Test
    void autoFillDefaultsWithoutBody() {
        AutoFillResult result = AutoFillResult.builder().days(7).build();
        when(schedulerService.autoFill(isNull())).thenReturn(Mono.just(result));

        StepVerifier.create(controller.autoFill(null))
                .assertNext(response -> assertThat(response.getBody().getDays()).isEqualTo(7))
                .verifyComplete();
    }

    @Test
    void autoFillPassesRequestedDays() {
        AutoFillRequest request = new AutoFillRequest();
        request.setDays(14);
        when(schedulerService.autoFill(14)).thenReturn(Mono.just(AutoFillResult.builder().days(14).build()));

        StepVerifier.create(controller.autoFill(request))
                .assertNext(response -> assertThat(response.getBody().getDays()).isEqualTo(14))
                .verifyComplete();
    }

    @Test
    @DisplayName("Run-due answers 202 and starts a tick")
    void runDueStartsTick() {
        when(schedulerService.tick()).thenReturn(Mono.empty());

        ResponseEntity<StatusResponse> response = controller.runDue();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(response.getBody().getMessage()).isEqualTo("Scheduler tick started");
        verify(schedulerService).tick();
    }
}
