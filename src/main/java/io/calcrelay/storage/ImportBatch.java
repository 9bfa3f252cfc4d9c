package io.calcrelay.storage;

import java.util.List;
import java.util.Map;

/**
 * Rows to insert together. Codes reference clients and calcjobs reference
 * codes by label; labels may point at rows of the same batch or at rows that
 * already exist.
 */
public record ImportBatch(
        List<NewClient> clients,
        List<NewCode> codes,
        List<NewCalcJob> calcjobs
) {
    public ImportBatch {
        clients = clients == null ? List.of() : List.copyOf(clients);
        codes = codes == null ? List.of() : List.copyOf(codes);
        calcjobs = calcjobs == null ? List.of() : List.copyOf(calcjobs);
    }

    public record NewClient(
            String label,
            String clientUrl,
            String clientId,
            String clientSecret,
            String tokenUri,
            String machineName,
            String workDir,
            int smallFileSizeMb
    ) {
    }

    public record NewCode(
            String label,
            String clientLabel,
            String script,
            Map<String, String> uploadPaths
    ) {
    }

    public record NewCalcJob(
            String label,
            String uuid,
            String codeLabel,
            Map<String, Object> parameters,
            Map<String, String> uploadPaths,
            List<String> downloadGlobs
    ) {
    }

    public record Result(List<Long> clientPks, List<Long> codePks, List<Long> calcjobPks) {
    }
}
