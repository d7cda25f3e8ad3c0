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

package me.golemcore.seeker.domain.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.seeker.domain.model.Freshness;
import me.golemcore.seeker.domain.model.Plan;
import me.golemcore.seeker.domain.model.PlanAction;
import me.golemcore.seeker.domain.model.ReaderFindings;
import me.golemcore.seeker.domain.model.SearchQuery;
import me.golemcore.seeker.domain.model.Selection;
import me.golemcore.seeker.domain.model.Synthesis;

import java.util.function.Function;

import static me.golemcore.seeker.domain.protocol.JsonFields.optionalPositiveInt;
import static me.golemcore.seeker.domain.protocol.JsonFields.optionalString;
import static me.golemcore.seeker.domain.protocol.JsonFields.optionalStringArray;
import static me.golemcore.seeker.domain.protocol.JsonFields.requireNonBlankString;
import static me.golemcore.seeker.domain.protocol.JsonFields.requireNumberInRange;
import static me.golemcore.seeker.domain.protocol.JsonFields.requireObject;
import static me.golemcore.seeker.domain.protocol.JsonFields.requireString;
import static me.golemcore.seeker.domain.protocol.JsonFields.requireStringArray;

/**
 * A structured message shape exchanged with an agent, paired with the decoder
 * that turns a parsed JSON object into its typed form.
 *
 * @param <T>
 *            typed message
 */
public final class MessageSchema<T> {

    /** Initial planner decision. A direct answer must carry its text. */
    public static final MessageSchema<Plan> PLAN = new MessageSchema<>("plan", node -> decodePlan(node, true));

    /** Planner decision after a round; {@code direct_answer} means conclude. */
    public static final MessageSchema<Plan> REFLECTION = new MessageSchema<>("reflection",
            node -> decodePlan(node, false));

    public static final MessageSchema<Selection> SELECTION = new MessageSchema<>("selection",
            node -> new Selection(requireStringArray(node, "selected_ids"), optionalString(node, "notes")));

    public static final MessageSchema<ReaderFindings> READER_REPORT = new MessageSchema<>("reader_report",
            node -> new ReaderFindings(
                    requireString(node, "title"),
                    requireString(node, "summary"),
                    requireStringArray(node, "key_points"),
                    requireNumberInRange(node, "relevance_score", 0.0, 1.0),
                    optionalString(node, "notes")));

    public static final MessageSchema<Synthesis> SYNTHESIS = new MessageSchema<>("synthesis",
            node -> new Synthesis(
                    requireNonBlankString(node, "answer"),
                    requireStringArray(node, "key_points"),
                    requireStringArray(node, "used_results"),
                    optionalString(node, "notes")));

    private final String name;
    private final Function<JsonNode, T> decoder;

    private MessageSchema(String name, Function<JsonNode, T> decoder) {
        this.name = name;
        this.decoder = decoder;
    }

    public String getName() {
        return name;
    }

    /**
     * Decodes a parsed JSON object.
     *
     * @throws SchemaViolation
     *             if the object does not satisfy the schema
     */
    T decode(JsonNode node) {
        return decoder.apply(node);
    }

    @Override
    public String toString() {
        return name;
    }

    private static Plan decodePlan(JsonNode node, boolean directTextRequired) {
        String actionValue = requireString(node, "action");
        PlanAction action = PlanAction.fromWire(actionValue);
        if (action == null) {
            throw new SchemaViolation(DecodeFailureReason.INVALID_VALUE,
                    "action must be one of direct_answer, search_then_answer; got '" + actionValue + "'");
        }
        String notes = optionalString(node, "notes");
        switch (action) {
        case DIRECT_ANSWER -> {
            String text = directTextRequired
                    ? requireNonBlankString(node, "direct_answer")
                    : optionalString(node, "direct_answer");
            return Plan.directAnswer(text, notes);
        }
        case SEARCH_THEN_ANSWER -> {
            return Plan.search(decodeSearch(requireObject(node, "search")), notes);
        }
        default -> throw new IllegalStateException("Unhandled action: " + action);
        }
    }

    private static SearchQuery decodeSearch(JsonNode search) {
        String query = requireNonBlankString(search, "query");
        String whenValue = optionalString(search, "when");
        Freshness when = null;
        if (whenValue != null) {
            when = Freshness.fromWire(whenValue);
            if (when == null) {
                throw new SchemaViolation(DecodeFailureReason.INVALID_VALUE,
                        "search.when must be one of day, week, month, any; got '" + whenValue + "'");
            }
        }
        return new SearchQuery(query.strip(), when,
                optionalStringArray(search, "include"),
                optionalStringArray(search, "exclude"),
                optionalStringArray(search, "allow_domains"),
                optionalStringArray(search, "deny_domains"),
                optionalPositiveInt(search, "max_results"));
    }
}
