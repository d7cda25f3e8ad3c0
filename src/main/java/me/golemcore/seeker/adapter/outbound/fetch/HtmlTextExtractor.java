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

package me.golemcore.seeker.adapter.outbound.fetch;

import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns fetched HTML into compact plain text for the reader agents.
 *
 * <p>
 * The page is parsed with jsoup and stripped of scripts and page chrome.
 * Content elements (paragraphs, headings, list items, quotes, preformatted
 * blocks) are preferred; when they yield too little text the whole body is
 * used instead. The result has boilerplate phrases removed, near-duplicate
 * sentences dropped and is cut at a sentence boundary within the configured
 * character limit.
 */
@Component
public class HtmlTextExtractor {

    static final int MIN_CONTENT_LENGTH = 50;
    private static final double DUPLICATE_SIMILARITY = 0.8;
    private static final int BOUNDARY_WINDOW = 100;

    private static final String STRIPPED = "script, style, noscript, template, nav, header, footer, aside";
    private static final String CONTENT = "p, h1, h2, h3, h4, h5, h6, li, blockquote, pre";
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00a0]+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?。！？]+");

    private static final List<Pattern> NOISE = List.of(
            Pattern.compile("All rights reserved", Pattern.CASE_INSENSITIVE),
            Pattern.compile("©\\s*\\d{4}"),
            Pattern.compile("Back to top", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(Sign in|Sign up|Log in|Logout)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(Published|Updated):\\s*[\\d\\-:\\s]*", Pattern.CASE_INSENSITIVE));

    private final int maxChars;

    @Autowired
    public HtmlTextExtractor(SeekerProperties properties) {
        this(properties.getFetch().getMaxChars());
    }

    public HtmlTextExtractor(int maxChars) {
        this.maxChars = maxChars;
    }

    public String extract(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parse(html);
        document.select(STRIPPED).remove();

        String content = contentText(document);
        if (content.length() < MIN_CONTENT_LENGTH) {
            content = clean(document.body().text());
        }
        return truncate(removeDuplicateSentences(content));
    }

    /**
     * Plain-text variant for sources that are already text, such as a
     * browser's rendered {@code innerText}.
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return truncate(removeDuplicateSentences(clean(text)));
    }

    private String contentText(Document document) {
        StringBuilder sb = new StringBuilder();
        for (Element element : document.select(CONTENT)) {
            String text = element.text();
            if (text.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(text);
        }
        return clean(sb.toString());
    }

    private String clean(String text) {
        String result = collapse(text);
        for (Pattern noise : NOISE) {
            result = noise.matcher(result).replaceAll("");
        }
        return collapse(result);
    }

    private String removeDuplicateSentences(String text) {
        if (text.isEmpty()) {
            return text;
        }
        List<String> unique = new ArrayList<>();
        List<Set<String>> seenWords = new ArrayList<>();
        for (String raw : SENTENCE_END.split(text)) {
            String sentence = raw.strip();
            if (sentence.isEmpty()) {
                continue;
            }
            Set<String> words = new HashSet<>(List.of(sentence.toLowerCase(Locale.ROOT).split(" ")));
            boolean duplicate = false;
            for (Set<String> seen : seenWords) {
                if (similarity(seen, words) > DUPLICATE_SIMILARITY) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                seenWords.add(words);
                unique.add(sentence);
            }
        }
        if (unique.isEmpty()) {
            return text;
        }
        return String.join(". ", unique) + ".";
    }

    private String truncate(String text) {
        if (text.length() <= maxChars) {
            return text;
        }
        int cut = -1;
        for (char punct : new char[] { '.', '!', '?', '。', '！', '？' }) {
            int idx = text.lastIndexOf(punct, maxChars - 1);
            if (idx > maxChars - BOUNDARY_WINDOW && idx > cut) {
                cut = idx + 1;
            }
        }
        if (cut < 0) {
            int space = text.lastIndexOf(' ', maxChars);
            cut = space > 0 ? space : maxChars;
        }
        return text.substring(0, cut).strip();
    }

    private static double similarity(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new LinkedHashSet<>(a);
        union.addAll(b);
        long shared = a.stream().filter(b::contains).count();
        return (double) shared / union.size();
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }
}
