package me.golemcore.hub.adapter.inbound.web;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.hub.domain.exception.HubException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.NoSuchElementException;

/**
 * Centralized exception handler for hub controllers. Hub errors keep their
 * failure kind in the response body so clients can render them without
 * parsing the message.
 */
@ControllerAdvice(basePackages = "me.golemcore.hub.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(HubException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleHub(HubException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        } else {
            log.warn("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        }
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .kind(ex.getKind().name())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return error(status, ex.getReason());
    }

    @ExceptionHandler(NoSuchElementException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(NoSuchElementException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    static HttpStatus statusFor(HubException ex) {
        return switch (ex.getKind()) {
        case SNAPSHOT_NOT_FOUND -> HttpStatus.NOT_FOUND;
        case SNAPSHOT_CONFLICT -> HttpStatus.CONFLICT;
        case CONTEXT_BUDGET_EXCEEDED, CAPABILITY_MISMATCH -> HttpStatus.UNPROCESSABLE_ENTITY;
        case CONNECTION_ERROR -> HttpStatus.BAD_GATEWAY;
        default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> error(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
