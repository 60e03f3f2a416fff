package com.portsyncro.api.controller;

import com.portsyncro.domain.PortfolioSnapshot;
import com.portsyncro.snapshot.SnapshotService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * POST captures (or replaces) today's snapshot; GET lists snapshots newest first.
 */
@RestController
@RequestMapping("/api/v1/portfolios/{userId}/snapshots")
@RequiredArgsConstructor
public class SnapshotController {

    private final SnapshotService snapshotService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<PortfolioSnapshot> capture(@PathVariable String userId) {
        return Mono.fromCallable(() -> snapshotService.capture(userId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping
    public Mono<List<PortfolioSnapshot>> history(@PathVariable String userId) {
        return Mono.fromCallable(() -> snapshotService.history(userId))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
