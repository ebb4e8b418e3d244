package com.example.resourceapi.security.controller;

import com.example.resourceapi.common.exception.NotFoundException;
import com.example.resourceapi.security.dto.DevLoginRequest;
import com.example.resourceapi.security.dto.DevLoginResponse;
import com.example.resourceapi.security.service.DevTokenService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequiredArgsConstructor
public class DevLoginController {

    private final DevTokenService devTokenService;

    // Disabled unless app.auth.dev-login-enabled=true
    @PostMapping("/dev-login")
    public Mono<DevLoginResponse> devLogin(@Valid @RequestBody DevLoginRequest request) {
        if (!devTokenService.isEnabled()) {
            return Mono.error(new NotFoundException("Not found"));
        }
        log.debug("POST /dev-login - subject: {}", request.subject());
        return Mono.fromCallable(() -> devTokenService.issue(request.subject(), request.roles()));
    }
}
