package com.ai.concierge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;

@Getter
@ToString
@AllArgsConstructor
public class SourceInfo {

    private static final int PREVIEW_LENGTH = 200;

    private final String document;

    private final String score;

    @JsonProperty("content_preview")
    private final String contentPreview;

    public static SourceInfo from(RetrievedDocument doc) {
        String content = doc.content();
        String preview = content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) + "..." : content;
        return new SourceInfo(doc.source(), String.format(Locale.ROOT, "%.3f", doc.score()), preview);
    }
}
