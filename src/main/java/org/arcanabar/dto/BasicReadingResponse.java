package org.arcanabar.dto;

import org.arcanabar.model.BasicReading;

public record BasicReadingResponse(
        String readingId,
        BasicReading reading,
        UsageResponse usage
) {}
