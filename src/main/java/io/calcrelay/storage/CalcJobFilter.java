package io.calcrelay.storage;

import io.calcrelay.model.ProcessState;
import io.calcrelay.model.ProcessStep;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Predicate over calcjobs, rendered to a parameterised SQL fragment.
 *
 * <p>Fragments refer to the aliases used by {@link MetadataStore}:
 * {@code c} (calcjobs), {@code p} (processing), {@code co} (codes) and
 * {@code cl} (clients).
 */
public final class CalcJobFilter {
    private final String sql;
    private final List<Object> params;

    private CalcJobFilter(String sql, List<Object> params) {
        this.sql = sql;
        this.params = List.copyOf(params);
    }

    public static CalcJobFilter all() {
        return new CalcJobFilter("1=1", List.of());
    }

    public static CalcJobFilter stateIs(ProcessState state) {
        return new CalcJobFilter("p.state=?", List.of(state.dbValue()));
    }

    public static CalcJobFilter stepIs(ProcessStep step) {
        return new CalcJobFilter("p.step=?", List.of(step.dbValue()));
    }

    public static CalcJobFilter codeLabelIs(String label) {
        return new CalcJobFilter("co.label=?", List.of(label));
    }

    public static CalcJobFilter clientLabelIs(String label) {
        return new CalcJobFilter("cl.label=?", List.of(label));
    }

    /**
     * SQL LIKE pattern on the calcjob label, {@code %} and {@code _} as wildcards.
     */
    public static CalcJobFilter labelLike(String pattern) {
        return new CalcJobFilter("c.label LIKE ?", List.of(pattern));
    }

    public static CalcJobFilter pkIn(Collection<Long> pks) {
        if (pks == null || pks.isEmpty()) {
            return new CalcJobFilter("1=0", List.of());
        }
        StringBuilder sb = new StringBuilder("c.pk IN (");
        List<Object> values = new ArrayList<>();
        for (Long pk : pks) {
            if (!values.isEmpty()) {
                sb.append(',');
            }
            sb.append('?');
            values.add(pk);
        }
        sb.append(')');
        return new CalcJobFilter(sb.toString(), values);
    }

    public static CalcJobFilter and(CalcJobFilter... parts) {
        return combine(" AND ", "1=1", parts);
    }

    public static CalcJobFilter or(CalcJobFilter... parts) {
        return combine(" OR ", "1=0", parts);
    }

    public static CalcJobFilter not(CalcJobFilter inner) {
        return new CalcJobFilter("NOT (" + inner.sql + ")", inner.params);
    }

    public String sql() {
        return sql;
    }

    public List<Object> params() {
        return params;
    }

    private static CalcJobFilter combine(String op, String empty, CalcJobFilter... parts) {
        if (parts == null || parts.length == 0) {
            return new CalcJobFilter(empty, List.of());
        }
        StringBuilder sb = new StringBuilder();
        List<Object> values = new ArrayList<>();
        for (CalcJobFilter part : parts) {
            if (sb.length() > 0) {
                sb.append(op);
            }
            sb.append('(').append(part.sql).append(')');
            values.addAll(part.params);
        }
        return new CalcJobFilter(sb.toString(), values);
    }

    @Override
    public String toString() {
        return sql + " " + params;
    }
}
