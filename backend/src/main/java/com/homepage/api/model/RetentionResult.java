package com.homepage.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Set;

@Getter
@Builder
public class RetentionResult {

    private final Set<String> kept;

    @Singular("deletedFile")
    private final List<String> deleted;

    @Singular
    private final List<BackupWarning> warnings;

    public static RetentionResult empty() {
        return RetentionResult.builder().kept(Set.of()).build();
    }
}
