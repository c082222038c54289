package com.quillvault.export.scheduler.controller;

import com.quillvault.export.scheduler.dto.CreateScheduleRequest;
import com.quillvault.export.scheduler.dto.ExecuteScheduleRequest;
import com.quillvault.export.scheduler.dto.ScheduleResponse;
import com.quillvault.export.scheduler.dto.UpdateScheduleRequest;
import com.quillvault.export.scheduler.security.CallerContext;
import com.quillvault.export.scheduler.service.ScheduleService;
import com.quillvault.export.scheduler.service.ScheduleStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/schedules")
@Tag(name = "Schedules", description = "Delayed encrypted journal exports")
@SecurityRequirement(name = "api-key")
@RequiredArgsConstructor
public class ScheduleController {

  private final ScheduleService scheduleService;

  @PostMapping
  @Operation(
      summary = "Create a schedule",
      description =
          "Encrypts the submitted entries and schedules a PDF export to the recipients once the"
              + " delay elapses")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "201", description = "Schedule created"),
        @ApiResponse(responseCode = "400", description = "Invalid request data"),
        @ApiResponse(responseCode = "401", description = "Missing or invalid API key")
      })
  public ResponseEntity<ScheduleResponse> createSchedule(
      @Parameter(hidden = true) @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
      @Valid @RequestBody CreateScheduleRequest request) {
    ScheduleResponse response = scheduleService.create(caller.ownerId(), request);
    return ResponseEntity.created(URI.create("/api/schedules/" + response.id())).body(response);
  }

  @GetMapping
  @Operation(summary = "List the caller's schedules", description = "Newest first")
  public ResponseEntity<List<ScheduleResponse>> listSchedules(
      @Parameter(hidden = true) @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
    return ResponseEntity.ok(scheduleService.list(caller.ownerId()));
  }

  @GetMapping("/{id}")
  @Operation(
      summary = "Get schedule by ID",
      description = "Includes the ten most recent execution logs")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Schedule found"),
        @ApiResponse(responseCode = "404", description = "Schedule not found")
      })
  public ResponseEntity<ScheduleResponse> getSchedule(
      @Parameter(hidden = true) @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
      @Parameter(description = "Schedule ID", required = true) @PathVariable UUID id) {
    return ResponseEntity.ok(scheduleService.get(caller.ownerId(), id));
  }

  @PutMapping("/{id}")
  @Operation(summary = "Update a pending schedule")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Schedule updated"),
        @ApiResponse(responseCode = "400", description = "Invalid request data"),
        @ApiResponse(responseCode = "404", description = "Schedule not found"),
        @ApiResponse(responseCode = "409", description = "Schedule is executing")
      })
  public ResponseEntity<ScheduleResponse> updateSchedule(
      @Parameter(hidden = true) @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
      @PathVariable UUID id,
      @Valid @RequestBody UpdateScheduleRequest request) {
    return ResponseEntity.ok(scheduleService.update(caller.ownerId(), id, request));
  }

  @DeleteMapping("/{id}")
  @Operation(
      summary = "Delete a schedule",
      description = "Deletion of an executing schedule is deferred until the attempt finishes")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Schedule deleted"),
        @ApiResponse(responseCode = "202", description = "Deletion pending"),
        @ApiResponse(responseCode = "404", description = "Schedule not found")
      })
  public ResponseEntity<Map<String, Object>> deleteSchedule(
      @Parameter(hidden = true) @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
      @PathVariable UUID id) {
    ScheduleStore.DeletionResult result = scheduleService.delete(caller.ownerId(), id);
    Map<String, Object> body = new HashMap<>();
    body.put("id", id);
    if (result == ScheduleStore.DeletionResult.DEFERRED) {
      body.put("deletion_pending", true);
      return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }
    body.put("deleted", true);
    return ResponseEntity.ok(body);
  }

  @PostMapping("/{id}/execute")
  @Operation(
      summary = "Execute a schedule now",
      description =
          "Queues an immediate run. The optional passphrase takes precedence over the server-held"
              + " key")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "202", description = "Execution accepted"),
        @ApiResponse(responseCode = "404", description = "Schedule not found"),
        @ApiResponse(responseCode = "409", description = "Already running or executed"),
        @ApiResponse(responseCode = "503", description = "Worker pool saturated")
      })
  public ResponseEntity<ScheduleResponse> executeSchedule(
      @Parameter(hidden = true) @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
      @PathVariable UUID id,
      @RequestBody(required = false) ExecuteScheduleRequest request) {
    String passphrase = request == null ? null : request.passphrase();
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(scheduleService.executeNow(caller.ownerId(), id, passphrase));
  }

  @PostMapping("/{id}/reset")
  @Operation(
      summary = "Reset the timer",
      description = "Re-arms the schedule for now plus its original delay; history is kept")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Schedule re-armed"),
        @ApiResponse(responseCode = "404", description = "Schedule not found"),
        @ApiResponse(responseCode = "409", description = "Schedule is executing")
      })
  public ResponseEntity<ScheduleResponse> resetSchedule(
      @Parameter(hidden = true) @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
      @PathVariable UUID id) {
    return ResponseEntity.ok(scheduleService.reset(caller.ownerId(), id));
  }
}
