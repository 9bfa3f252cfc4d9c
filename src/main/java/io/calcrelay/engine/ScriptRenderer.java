package io.calcrelay.engine;

import io.calcrelay.error.TemplateException;
import io.calcrelay.util.Jsons;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {{name}}} placeholders in a Code's job script.
 *
 * <p>Known names: {@code calcjob.uuid}, {@code calcjob.label}, {@code calcjob.pk},
 * {@code parameters.<name>}, {@code code.label}, {@code client.label},
 * {@code client.work_dir} and {@code client.machine_name}. Non-scalar
 * parameters render as compact JSON.
 */
public final class ScriptRenderer {
    public static final String DEFAULT_SHEBANG = "#!/bin/bash";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.\\-]+)\\s*}}");
    private static final String PARAMETER_PREFIX = "parameters.";

    public String render(CalcJobContext ctx) {
        String template = ctx.code().script() == null ? "" : ctx.code().script();
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(resolve(m.group(1), ctx)));
        }
        m.appendTail(out);
        String rendered = out.toString();
        if (!rendered.startsWith("#!")) {
            rendered = DEFAULT_SHEBANG + "\n" + rendered;
        }
        if (!rendered.endsWith("\n")) {
            rendered = rendered + "\n";
        }
        return rendered;
    }

    private String resolve(String name, CalcJobContext ctx) {
        switch (name) {
            case "calcjob.uuid":
                return ctx.calcjob().uuid();
            case "calcjob.label":
                return ctx.calcjob().label();
            case "calcjob.pk":
                return Long.toString(ctx.calcjob().pk());
            case "code.label":
                return ctx.code().label();
            case "client.label":
                return ctx.client().label();
            case "client.work_dir":
                return ctx.client().workDir();
            case "client.machine_name":
                return ctx.client().machineName();
            default:
                break;
        }
        if (name.startsWith(PARAMETER_PREFIX)) {
            String key = name.substring(PARAMETER_PREFIX.length());
            Map<String, Object> params = ctx.calcjob().parameters();
            if (params != null && params.containsKey(key)) {
                return stringify(params.get(key));
            }
            throw new TemplateException("Unknown parameter in script template: " + key);
        }
        throw new TemplateException("Unknown placeholder in script template: " + name);
    }

    private static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map || value instanceof Iterable) {
            return Jsons.toCompactJson(value);
        }
        return String.valueOf(value);
    }
}
