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

package me.golemcore.seeker.port.outbound;

import me.golemcore.seeker.domain.model.CandidateDocument;

import java.util.concurrent.CompletableFuture;

/**
 * Port for retrieving the readable text of a candidate document.
 */
public interface DocumentFetchPort {

    /**
     * Fetches the document and extracts its text, already cleaned of markup.
     *
     * @return extracted text, possibly blank, or a future completed
     *         exceptionally with {@link FetchException}
     */
    CompletableFuture<String> fetchAndExtract(CandidateDocument document);
}
