package io.calcrelay.model;

import java.util.Map;

public record CodeRow(
        long pk,
        String label,
        long clientPk,
        String script,
        Map<String, String> uploadPaths,
        long createdAtMs
) {
}
