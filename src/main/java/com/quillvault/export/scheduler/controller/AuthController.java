package com.quillvault.export.scheduler.controller;

import com.quillvault.export.scheduler.dto.RegisterResponse;
import com.quillvault.export.scheduler.dto.VerifyResponse;
import com.quillvault.export.scheduler.security.CallerContext;
import com.quillvault.export.scheduler.security.CredentialService;
import com.quillvault.export.scheduler.security.IssuedCredential;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@Tag(name = "Auth", description = "API key registration and verification")
@RequiredArgsConstructor
public class AuthController {

  private final CredentialService credentialService;

  @PostMapping("/register")
  @Operation(
      summary = "Register a new API key",
      description = "Creates an anonymous owner identity and returns its API key exactly once")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "201", description = "Key issued"),
        @ApiResponse(responseCode = "429", description = "Rate limit exceeded")
      })
  public ResponseEntity<RegisterResponse> register() {
    IssuedCredential credential = credentialService.issue();
    return ResponseEntity.status(HttpStatus.CREATED).body(RegisterResponse.from(credential));
  }

  @GetMapping("/verify")
  @Operation(summary = "Verify the presented API key")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Key is valid"),
        @ApiResponse(responseCode = "401", description = "Missing or invalid key")
      })
  public ResponseEntity<VerifyResponse> verify(
      @Parameter(hidden = true) @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
    return ResponseEntity.ok(VerifyResponse.from(caller));
  }
}
