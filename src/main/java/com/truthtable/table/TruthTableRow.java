package com.truthtable.table;

import java.util.List;

public record TruthTableRow(List<Boolean> values, boolean result) {

    public TruthTableRow {
        values = List.copyOf(values);
    }

    static TruthTableRow copyOf(boolean[] assignment, boolean result) {
        Boolean[] boxed = new Boolean[assignment.length];
        for (int index = 0; index < assignment.length; index++) {
            boxed[index] = assignment[index];
        }
        return new TruthTableRow(List.of(boxed), result);
    }
}
