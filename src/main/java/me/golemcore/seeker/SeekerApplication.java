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

package me.golemcore.seeker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Main application class for golemcore-seeker.
 *
 * <p>
 * golemcore-seeker answers a natural-language question, optionally after
 * several rounds of web research. A planning agent decides whether research is
 * needed, a fleet of reader agents summarizes candidate documents in parallel,
 * and the planner reflects on the accumulated evidence before composing the
 * final answer.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters) around a round-based state
 * machine:
 *
 * <pre>
 * Input Layer        → ResearchController (HTTP), ResearchCommandRunner (CLI)
 * Domain Layer       → ResearchLoopController, PlannerStage, ReaderDispatcher, ProtocolCodec
 * Infrastructure     → LLM / Search / Fetch adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code seeker.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SeekerApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(SeekerApplication.class, args);
        if (context.getEnvironment().getProperty("seeker.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }

}
