package com.newsdesk.curation.controller;

import com.newsdesk.curation.dto.ActionDtos;
import com.newsdesk.curation.model.Newspaper;
import com.newsdesk.curation.service.NewspaperGenerator;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@RestController
@RequestMapping("/newspapers")
public class NewspaperController {
    private final NewspaperGenerator generator;
    private final AdminAccess access;

    public NewspaperController(NewspaperGenerator generator, AdminAccess access) {
        this.generator = generator;
        this.access = access;
    }

    @GetMapping(path = "/today", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Newspaper>> today(@RequestHeader(value = "x-user-id", required = false) Long userId) {
        return byDate(access.resolveUser(userId), generator.today());
    }

    @GetMapping(path = "/date/{date}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Newspaper>> forDate(
            @RequestHeader(value = "x-user-id", required = false) Long userId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return byDate(access.resolveUser(userId), date);
    }

    @PostMapping(path = "/regenerate", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ActionDtos.RegenerateResponse>> regenerate(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @RequestHeader(value = "x-user-id", required = false) Long userId,
            @RequestBody(required = false) ActionDtos.RegenerateRequest body) {
        if (!access.isAdmin(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        LocalDate date = body != null && body.getDate() != null ? body.getDate() : generator.today();
        return generator.regenerate(access.resolveUser(userId), date).map(ResponseEntity::ok);
    }

    private Mono<ResponseEntity<Newspaper>> byDate(long userId, LocalDate date) {
        return generator.find(userId, date)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
