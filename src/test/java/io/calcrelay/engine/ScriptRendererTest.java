package io.calcrelay.engine;

import io.calcrelay.error.TemplateException;
import io.calcrelay.model.CalcJobRow;
import io.calcrelay.model.ClientRow;
import io.calcrelay.model.CodeRow;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ScriptRendererTest {
    private final ScriptRenderer renderer = new ScriptRenderer();

    @Test
    void fillsPlaceholdersAndAddsShebang() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("echo_string", "Hello world!");
        params.put("steps", 3);
        params.put("grid", List.of(1, 2));
        CalcJobContext ctx = context("echo '{{parameters.echo_string}}' > output.txt\n"
                + "run --steps {{ parameters.steps }} --grid '{{parameters.grid}}' --id {{calcjob.uuid}}\n"
                + "cd {{client.work_dir}} # {{client.machine_name}} {{code.label}} {{calcjob.label}}", params);

        String script = renderer.render(ctx);

        Assertions.assertEquals("#!/bin/bash\n"
                + "echo 'Hello world!' > output.txt\n"
                + "run --steps 3 --grid '[1,2]' --id 7f1c2a9e-0000-4000-8000-000000000001\n"
                + "cd /scratch/calc # daint echo hello\n", script);
    }

    @Test
    void keepsAnExistingInterpreterLine() {
        String script = renderer.render(context("#!/bin/sh\nexit 0\n", Map.of()));
        Assertions.assertEquals("#!/bin/sh\nexit 0\n", script);
    }

    @Test
    void unknownPlaceholderIsATerminalTemplateError() {
        TemplateException missingParam = Assertions.assertThrows(TemplateException.class,
                () -> renderer.render(context("echo {{parameters.nope}}", Map.of())));
        Assertions.assertFalse(missingParam.retryable());
        Assertions.assertTrue(missingParam.getMessage().contains("nope"));

        Assertions.assertThrows(TemplateException.class,
                () -> renderer.render(context("echo {{client.client_secret}}", Map.of())));
    }

    private static CalcJobContext context(String script, Map<String, Object> params) {
        ClientRow client = new ClientRow(1L, "cluster", "https://firecrest.example/", "id", "secret",
                "https://auth.example/token", "daint", "/scratch/calc", 5, 0L);
        CodeRow code = new CodeRow(2L, "echo", 1L, script, Map.of(), 0L);
        CalcJobRow calcjob = new CalcJobRow(3L, "hello", "7f1c2a9e-0000-4000-8000-000000000001", 2L,
                params, Map.of(), List.of(), 0L);
        return new CalcJobContext(calcjob, code, client);
    }
}
