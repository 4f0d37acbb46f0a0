package com.questrail.mixer.protocol.osc.profile;

import java.util.List;
import java.util.Objects;

/**
 * Wire address template, index rules and encoding of one logical operation on
 * one family. Each {@code {}} in the template is replaced, in order, by the
 * formatted index.
 */
public record OperationBinding<H>(String template, List<IndexRule> indices, EncodingRule<H> rule) {

    private static final String SLOT = "{}";

    public OperationBinding {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(rule, "rule");
        indices = List.copyOf(indices);
        if (slotCount(template) != indices.size()) {
            throw new IllegalArgumentException(
                    "Template " + template + " does not have " + indices.size() + " index slots");
        }
    }

    /**
     * @throws IllegalArgumentException if the number of indices is wrong or any
     *         index is outside its range
     */
    public String address(int... humanIndices) {
        if (humanIndices.length != indices.size()) {
            throw new IllegalArgumentException(
                    template + " takes " + indices.size() + " indices, got " + humanIndices.length);
        }

        StringBuilder out = new StringBuilder(template.length() + 8);
        int from = 0;
        for (int i = 0; i < humanIndices.length; i++) {
            int slot = template.indexOf(SLOT, from);
            out.append(template, from, slot).append(indices.get(i).format(humanIndices[i]));
            from = slot + SLOT.length();
        }
        return out.append(template, from, template.length()).toString();
    }

    private static int slotCount(String template) {
        int count = 0;
        for (int i = template.indexOf(SLOT); i >= 0; i = template.indexOf(SLOT, i + SLOT.length())) {
            count++;
        }
        return count;
    }
}
