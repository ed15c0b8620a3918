package org.lite.ai.service;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import opennlp.tools.sentdetect.SentenceDetectorME;
import opennlp.tools.sentdetect.SentenceModel;
import opennlp.tools.util.Span;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits source text into bounded, overlapping spans for embedding. Sizes are in characters and every span
 * carries its offset into the original text. Output depends only on (text, maxSize, overlap).
 */
@Service
@Slf4j
public class ChunkingService {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

    private static final Object MODEL_LOCK = new Object();
    private static volatile SentenceModel sentenceModel;
    private static volatile boolean modelLookupDone;

    /**
     * Get OpenNLP sentence detector model (loaded lazily)
     */
    private SentenceModel getSentenceModel() {
        if (!modelLookupDone) {
            synchronized (MODEL_LOCK) {
                if (!modelLookupDone) {
                    try (InputStream modelStream = getClass().getClassLoader().getResourceAsStream("models/en-sent.bin")) {
                        if (modelStream != null) {
                            sentenceModel = new SentenceModel(modelStream);
                            log.info("Loaded OpenNLP sentence detection model");
                        } else {
                            log.warn("OpenNLP sentence model not found, using simple regex fallback");
                        }
                    } catch (Exception e) {
                        log.error("Failed to load OpenNLP sentence model", e);
                    }
                    modelLookupDone = true;
                }
            }
        }
        return sentenceModel;
    }

    /**
     * Chunk text on paragraph, then sentence boundaries, hard-cutting only units longer than {@code maxSize}.
     * A chunk starts with the trailing whole units of its predecessor that fit in {@code overlap}; hard-cut
     * pieces overlap their neighbours by {@code overlap} characters.
     *
     * @param text The text to chunk
     * @param maxSize Maximum characters per chunk
     * @param overlap Characters of context shared with the previous chunk
     * @return Ordered chunks, empty for blank text
     */
    public List<ChunkResult> chunk(String text, int maxSize, int overlap) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        if (overlap < 0 || overlap >= maxSize) {
            throw new IllegalArgumentException("overlap must be >= 0 and smaller than maxSize");
        }
        if (text == null || text.isBlank()) {
            return new ArrayList<>();
        }

        List<int[]> units = splitUnits(text, maxSize, overlap);
        List<ChunkResult> chunks = new ArrayList<>();
        int start = 0;
        while (start < units.size()) {
            int end = start;
            while (end + 1 < units.size() && units.get(end + 1)[1] - units.get(start)[0] <= maxSize) {
                end++;
            }
            int from = units.get(start)[0];
            int to = units.get(end)[1];
            chunks.add(ChunkResult.builder()
                    .chunkIndex(chunks.size())
                    .startPosition(from)
                    .endPosition(to)
                    .text(text.substring(from, to))
                    .build());
            if (end + 1 >= units.size()) {
                break;
            }
            start = nextStart(units, start, end, maxSize, overlap);
        }

        log.debug("Chunked {} chars into {} chunks (maxSize: {}, overlap: {})",
                text.length(), chunks.size(), maxSize, overlap);
        return chunks;
    }

    /**
     * First unit of the next chunk: the earliest unit after {@code start} such that the carried tail fits in
     * {@code overlap} and still leaves room for the next new unit; otherwise the unit after {@code end}.
     */
    private int nextStart(List<int[]> units, int start, int end, int maxSize, int overlap) {
        int nextNew = end + 1;
        for (int k = start + 1; k <= end; k++) {
            int carried = units.get(end)[1] - units.get(k)[0];
            int withNext = units.get(nextNew)[1] - units.get(k)[0];
            if (carried <= overlap && withNext <= maxSize) {
                return k;
            }
        }
        return nextNew;
    }

    /**
     * Units as [start, end) offsets: paragraphs that fit, else their sentences, else hard-cut pieces.
     */
    private List<int[]> splitUnits(String text, int maxSize, int overlap) {
        List<int[]> units = new ArrayList<>();
        for (int[] paragraph : split(text, 0, text.length(), PARAGRAPH_BREAK)) {
            if (paragraph[1] - paragraph[0] <= maxSize) {
                units.add(paragraph);
                continue;
            }
            for (int[] sentence : detectSentences(text, paragraph[0], paragraph[1])) {
                if (sentence[1] - sentence[0] <= maxSize) {
                    units.add(sentence);
                } else {
                    hardCut(sentence, maxSize, overlap, units);
                }
            }
        }
        return units;
    }

    private void hardCut(int[] span, int maxSize, int overlap, List<int[]> units) {
        int step = maxSize - overlap;
        int position = span[0];
        while (true) {
            int end = Math.min(position + maxSize, span[1]);
            units.add(new int[]{position, end});
            if (end >= span[1]) {
                return;
            }
            position += step;
        }
    }

    /**
     * Detect sentences using OpenNLP or fall back to regex
     */
    private List<int[]> detectSentences(String text, int from, int to) {
        SentenceModel model = getSentenceModel();
        String paragraph = text.substring(from, to);

        if (model != null) {
            try {
                SentenceDetectorME detector = new SentenceDetectorME(model);
                List<int[]> sentences = new ArrayList<>();
                for (Span span : detector.sentPosDetect(paragraph)) {
                    addTrimmed(text, from + span.getStart(), from + span.getEnd(), sentences);
                }
                if (!sentences.isEmpty()) {
                    return sentences;
                }
            } catch (Exception e) {
                log.warn("Failed to use OpenNLP sentence detector, falling back to regex", e);
            }
        }

        return split(text, from, to, SENTENCE_BREAK);
    }

    private static List<int[]> split(String text, int from, int to, Pattern separator) {
        List<int[]> parts = new ArrayList<>();
        Matcher matcher = separator.matcher(text).region(from, to);
        int position = from;
        while (matcher.find()) {
            addTrimmed(text, position, matcher.start(), parts);
            position = matcher.end();
        }
        addTrimmed(text, position, to, parts);
        return parts;
    }

    private static void addTrimmed(String text, int start, int end, List<int[]> target) {
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        if (end > start) {
            target.add(new int[]{start, end});
        }
    }

    @Data
    @lombok.Builder
    @lombok.NoArgsConstructor
    @lombok.AllArgsConstructor
    public static class ChunkResult {
        private Integer chunkIndex;
        private Integer startPosition; // offset into the source text
        private Integer endPosition; // exclusive
        private String text;
    }
}
