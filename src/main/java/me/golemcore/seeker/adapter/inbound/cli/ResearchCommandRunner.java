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

package me.golemcore.seeker.adapter.inbound.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.domain.model.Freshness;
import me.golemcore.seeker.domain.model.PlanPreview;
import me.golemcore.seeker.domain.model.ResearchResult;
import me.golemcore.seeker.domain.model.SearchQuery;
import me.golemcore.seeker.domain.service.ResearchService;
import me.golemcore.seeker.port.outbound.SearchException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Command-line entry point, active under the {@code cli} profile.
 *
 * <pre>
 * run    --question=...
 * plan   --question=...
 * search --query=... [--when=day|week|month|any] [--max-results=N]
 * </pre>
 *
 * Output is printed as JSON. The exit code is 0 on success and 1 on failure.
 */
@Component
@ConditionalOnProperty(prefix = "seeker.cli", name = "enabled", havingValue = "true")
@Slf4j
public class ResearchCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final String USAGE = """
            Usage:
              run    --question=<text>
              plan   --question=<text>
              search --query=<text> [--when=day|week|month|any] [--max-results=N]
            """;

    private final ResearchService researchService;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private int exitCode = EXIT_OK;

    @Autowired
    public ResearchCommandRunner(ResearchService researchService, ObjectMapper objectMapper) {
        this(researchService, objectMapper, System.out);
    }

    ResearchCommandRunner(ResearchService researchService, ObjectMapper objectMapper, PrintStream out) {
        this.researchService = researchService;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            fail(USAGE);
            return;
        }
        String command = commands.get(0);
        try {
            switch (command) {
            case "run" -> runResearch(args);
            case "plan" -> runPlan(args);
            case "search" -> runSearch(args);
            default -> fail("Unknown command: " + command + "\n" + USAGE);
            }
        } catch (IllegalArgumentException | SearchException e) {
            fail(e.getMessage());
        } catch (JsonProcessingException e) {
            log.error("[CLI] Failed to render output", e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void runResearch(ApplicationArguments args) throws JsonProcessingException {
        ResearchResult result = researchService.research(requireOption(args, "question"));
        print(result);
        exitCode = result.isSuccessful() ? EXIT_OK : EXIT_FAILURE;
    }

    private void runPlan(ApplicationArguments args) throws JsonProcessingException {
        PlanPreview preview = researchService.plan(requireOption(args, "question"));
        print(preview);
        exitCode = preview.success() ? EXIT_OK : EXIT_FAILURE;
    }

    private void runSearch(ApplicationArguments args) throws JsonProcessingException {
        String when = option(args, "when");
        Freshness freshness = null;
        if (when != null) {
            freshness = Freshness.fromWire(when);
            if (freshness == null) {
                throw new IllegalArgumentException("--when must be one of day, week, month, any");
            }
        }
        Integer maxResults = null;
        String max = option(args, "max-results");
        if (max != null) {
            try {
                maxResults = Integer.valueOf(max.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--max-results must be a positive integer", e);
            }
            if (maxResults <= 0) {
                throw new IllegalArgumentException("--max-results must be a positive integer");
            }
        }
        SearchQuery query = SearchQuery.of(requireOption(args, "query"))
                .withWhen(freshness)
                .withMaxResults(maxResults);
        List<CandidateDocument> candidates = researchService.search(query);
        print(candidates);
        exitCode = EXIT_OK;
    }

    private void print(Object value) throws JsonProcessingException {
        out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    private void fail(String message) {
        log.warn("[CLI] {}", message);
        out.println(message);
        exitCode = EXIT_FAILURE;
    }

    private static String requireOption(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + name + " is required");
        }
        return value;
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }
}
