package com.homepage.api.model;

import lombok.Data;

@Data
public class SanitizeResult {

    private final long linesTotal;
    private final long linesFiltered;
}
