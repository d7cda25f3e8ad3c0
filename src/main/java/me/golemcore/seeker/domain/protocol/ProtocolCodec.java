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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single parse-and-validate boundary between raw agent text and typed
 * messages.
 *
 * <p>
 * A structured block is a fenced code block labelled {@code json},
 * {@code seeker} or left unlabelled whose body is a JSON object. When no fence
 * is present, output that is itself a bare JSON object is accepted. Anything
 * else fails with an explicit {@link DecodeError}; the codec never substitutes
 * a default payload.
 *
 * <p>
 * Decoding is a pure function of its inputs and has no side effects.
 */
@Component
public class ProtocolCodec {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```([A-Za-z0-9_-]*)[ \\t]*\\r?\\n?(.*?)```",
            Pattern.DOTALL);
    private static final List<String> ACCEPTED_LABELS = List.of("", "json", "seeker");

    private final ObjectMapper objectMapper = new ObjectMapper();

    public <T> DecodeResult<T> decode(String rawText, MessageSchema<T> schema) {
        if (rawText == null || rawText.isBlank()) {
            return failure(DecodeFailureReason.NO_BLOCK, "output is empty", rawText);
        }

        List<String> blocks = extractBlocks(rawText);
        String block;
        if (blocks.size() > 1) {
            return failure(DecodeFailureReason.MULTIPLE_BLOCKS,
                    "expected exactly one " + schema.getName() + " block, found " + blocks.size(), rawText);
        } else if (blocks.size() == 1) {
            block = blocks.get(0);
        } else {
            String trimmed = rawText.strip();
            if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
                return failure(DecodeFailureReason.NO_BLOCK,
                        "expected a fenced ```json block containing a " + schema.getName() + " object", rawText);
            }
            block = trimmed;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(block);
        } catch (JsonProcessingException e) {
            return failure(DecodeFailureReason.INVALID_JSON, e.getOriginalMessage(), rawText);
        }
        if (node == null || !node.isObject()) {
            return failure(DecodeFailureReason.INVALID_JSON, "block is not a JSON object", rawText);
        }

        try {
            return DecodeResult.success(schema.decode(node));
        } catch (SchemaViolation e) {
            return failure(e.getReason(), e.getMessage(), rawText);
        }
    }

    private List<String> extractBlocks(String rawText) {
        List<String> blocks = new ArrayList<>();
        Matcher matcher = FENCED_BLOCK.matcher(rawText);
        while (matcher.find()) {
            String label = matcher.group(1).toLowerCase(Locale.ROOT);
            String body = matcher.group(2).strip();
            if (!ACCEPTED_LABELS.contains(label)) {
                continue;
            }
            // unlabelled fences count only when they hold an object
            if (label.isEmpty() && !body.startsWith("{")) {
                continue;
            }
            blocks.add(body);
        }
        return blocks;
    }

    private static <T> DecodeResult<T> failure(DecodeFailureReason reason, String detail, String rawText) {
        return DecodeResult.failure(new DecodeError(reason, detail, rawText));
    }
}
