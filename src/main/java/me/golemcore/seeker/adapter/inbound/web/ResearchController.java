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

package me.golemcore.seeker.adapter.inbound.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.adapter.inbound.web.dto.PlanRequest;
import me.golemcore.seeker.adapter.inbound.web.dto.ResearchRequest;
import me.golemcore.seeker.adapter.inbound.web.dto.SearchRequest;
import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.domain.model.PlanPreview;
import me.golemcore.seeker.domain.model.ResearchResult;
import me.golemcore.seeker.domain.service.ResearchService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Research endpoints. Runs are blocking, so they are moved off the event loop
 * onto the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/research")
@RequiredArgsConstructor
@Slf4j
public class ResearchController {

    private final ResearchService researchService;

    @PostMapping
    public Mono<ResponseEntity<ResearchResult>> research(@RequestBody(required = false) ResearchRequest request) {
        if (request == null || request.getQuestion() == null || request.getQuestion().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "question is required");
        }
        return Mono.fromCallable(() -> researchService.research(request.getQuestion(), request.getRoundCap(),
                request.getConcurrencyCap(), request.getPerRoundResultCap(), request.getPerRoundSelectionCap()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/plan")
    public Mono<ResponseEntity<PlanPreview>> plan(@RequestBody(required = false) PlanRequest request) {
        if (request == null || request.getQuestion() == null || request.getQuestion().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "question is required");
        }
        return Mono.fromCallable(() -> researchService.plan(request.getQuestion()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/search")
    public Mono<ResponseEntity<List<CandidateDocument>>> search(
            @RequestBody(required = false) SearchRequest request) {
        if (request == null || request.getQuery() == null || request.getQuery().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "query is required");
        }
        return Mono.fromCallable(() -> researchService.search(request.toQuery()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
