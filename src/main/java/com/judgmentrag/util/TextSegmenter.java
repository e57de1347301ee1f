package com.judgmentrag.util;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.judgmentrag.model.CaseRecord;
import com.judgmentrag.model.ChunkingSettings;
import com.judgmentrag.model.Segment;

/**
 * Splits a case's text into overlapping character windows.
 * <p>
 * Window {@code i} starts at {@code i * (chunkSize - overlap)} and spans {@code chunkSize}
 * characters, except the last which ends at the end of the text. Consecutive windows share
 * exactly {@code overlap} characters, so the windows cover the text without gaps. The same
 * input always produces the same segment ids.
 */
@Component
public class TextSegmenter {

    public List<Segment> segment(CaseRecord caseRecord, ChunkingSettings settings) {
        String text = caseRecord.fullText();
        int length = text.length();
        int step = settings.step();

        List<Segment> segments = new ArrayList<>();
        int start = 0;
        int sequence = 0;

        while (true) {
            int end = Math.min(start + settings.chunkSize(), length);
            segments.add(new Segment(
                    Segment.idFor(caseRecord.caseId(), sequence),
                    caseRecord.caseId(),
                    text.substring(start, end),
                    start,
                    end,
                    sequence
            ));

            if (end >= length) {
                break;
            }
            start += step;
            sequence++;
        }

        return segments;
    }

    public String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }

        return text.substring(0, maxLength) + "...";
    }
}
