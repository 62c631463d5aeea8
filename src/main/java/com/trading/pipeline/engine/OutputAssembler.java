package com.trading.pipeline.engine;

import com.trading.pipeline.data.BooleanMatrix;
import com.trading.pipeline.data.DoubleMatrix;
import com.trading.pipeline.data.LabelMatrix;
import com.trading.pipeline.data.Matrix;
import com.trading.pipeline.term.TermKind;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Flattens a {@link RunResult} into a {@link ResultTable}, dropping screened-out rows. */
public final class OutputAssembler {

    public ResultTable assemble(RunResult result) {
        int sessions = result.sessions().size();
        int cols = result.assets().size();
        BooleanMatrix screen = result.screen();

        int count = 0;
        for (int r = 0; r < sessions; r++)
            for (int c = 0; c < cols; c++)
                if (screen == null || screen.get(r, c))
                    count++;

        LocalDate[] dates = new LocalDate[count];
        long[] sids = new long[count];
        LinkedHashMap<String, TermKind> kinds = new LinkedHashMap<>();
        Map<String, Object> columns = new HashMap<>();
        for (var e : result.outputs().entrySet()) {
            TermKind kind = e.getValue().kind();
            kinds.put(e.getKey(), kind);
            columns.put(e.getKey(), switch (kind) {
                case FACTOR -> new double[count];
                case FILTER -> new boolean[count];
                case CLASSIFIER -> new int[count];
            });
        }

        int row = 0;
        for (int r = 0; r < sessions; r++) {
            for (int c = 0; c < cols; c++) {
                if (screen != null && !screen.get(r, c))
                    continue;
                dates[row] = result.sessions().get(r);
                sids[row] = result.assets().sid(c);
                for (var e : result.outputs().entrySet()) {
                    Matrix m = e.getValue();
                    Object dst = columns.get(e.getKey());
                    switch (m.kind()) {
                        case FACTOR -> ((double[]) dst)[row] = ((DoubleMatrix) m).get(r, c);
                        case FILTER -> ((boolean[]) dst)[row] = ((BooleanMatrix) m).get(r, c);
                        case CLASSIFIER -> ((int[]) dst)[row] = ((LabelMatrix) m).get(r, c);
                    }
                }
                row++;
            }
        }
        return new ResultTable(dates, sids, kinds, columns);
    }
}
