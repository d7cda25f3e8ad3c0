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

package me.golemcore.seeker.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.domain.protocol.ProtocolCodec;
import me.golemcore.seeker.domain.service.PlannerStage;
import me.golemcore.seeker.domain.service.ReaderDispatcher;
import me.golemcore.seeker.domain.service.ResearchLoopController;
import me.golemcore.seeker.domain.service.StructuredAgentInvoker;
import me.golemcore.seeker.port.outbound.DocumentFetchPort;
import me.golemcore.seeker.port.outbound.LlmPort;
import me.golemcore.seeker.port.outbound.SearchGatewayPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring wiring for the research loop. Domain services are plain classes that
 * take only the slice of {@link SeekerProperties} they need.
 */
@Configuration
@Slf4j
public class ResearchConfiguration {

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public StructuredAgentInvoker structuredAgentInvoker(LlmPort llmPort, ProtocolCodec codec,
            SeekerProperties properties) {
        return new StructuredAgentInvoker(llmPort, codec, properties.getLlm());
    }

    @Bean
    public PlannerStage plannerStage(StructuredAgentInvoker invoker, ObjectMapper objectMapper,
            SeekerProperties properties) {
        return new PlannerStage(invoker, objectMapper, properties.getSearch().getDefaultWhen());
    }

    @Bean
    public ReaderDispatcher readerDispatcher(DocumentFetchPort documentFetchPort, StructuredAgentInvoker invoker,
            ObjectMapper objectMapper, SeekerProperties properties) {
        return new ReaderDispatcher(documentFetchPort, invoker, objectMapper,
                properties.getResearch().getFetchTimeout());
    }

    @Bean
    public ResearchLoopController researchLoopController(PlannerStage plannerStage,
            SearchGatewayPort searchGateway, ReaderDispatcher readerDispatcher, SeekerProperties properties) {
        SeekerProperties.ResearchProperties research = properties.getResearch();
        log.info("[Research] Limits: rounds={}, concurrency={}, results/round={}, selection/round={}, deadline={}",
                research.getMaxRounds(), research.getConcurrency(), research.getPerRoundResultCap(),
                research.getPerRoundSelectionCap(), research.getRunDeadline());
        return new ResearchLoopController(plannerStage, searchGateway, readerDispatcher);
    }
}
