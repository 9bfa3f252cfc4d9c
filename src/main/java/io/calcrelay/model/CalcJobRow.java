package io.calcrelay.model;

import java.util.List;
import java.util.Map;

public record CalcJobRow(
        long pk,
        String label,
        String uuid,
        long codePk,
        Map<String, Object> parameters,
        Map<String, String> uploadPaths,
        List<String> downloadGlobs,
        long createdAtMs
) {
}
