package com.urlguardian.scanner.collector;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.urlguardian.scanner.signal.RiskSignal;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-form risk on one page. The page's sub-score is that of its riskiest form.
 *
 * @author URL Guardian Team
 */
public record FormInspection(List<FormRisk> forms, int riskScore) implements RiskSignal {

    public FormInspection {
        forms = List.copyOf(forms);
    }

    @Override
    @JsonIgnore
    public List<String> redFlags() {
        Set<String> flags = new LinkedHashSet<>();
        forms.forEach(form -> flags.addAll(form.flags()));
        return RiskSignal.describeAll(List.copyOf(flags));
    }

    public record FormRisk(int formIndex, String action, String method, List<Field> fields,
            List<String> flags, int riskScore) {

        public FormRisk {
            fields = List.copyOf(fields);
            flags = List.copyOf(flags);
        }
    }

    public record Field(String name, String type, boolean suspicious) {
    }
}
