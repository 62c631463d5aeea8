package com.trading.pipeline.loader;

import com.trading.pipeline.api.LoadRequest;
import com.trading.pipeline.api.Loader;
import com.trading.pipeline.calendar.TradingCalendar;
import com.trading.pipeline.calendar.WeekdayCalendar;
import com.trading.pipeline.data.AssetUniverse;
import com.trading.pipeline.data.BooleanMatrix;
import com.trading.pipeline.data.DoubleMatrix;
import com.trading.pipeline.data.LabelMatrix;
import com.trading.pipeline.data.Matrix;
import com.trading.pipeline.errors.LoaderFailureException;
import com.trading.pipeline.term.Term;
import com.trading.pipeline.term.TermKind;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.log4j.Log4j2;

/**
 * Loader backed by values held in memory, keyed by column term, session and sid.
 *
 * <p>
 * Sessions with no stored value come back as the column's missing value.
 * Requests for a column that was never registered, or for a sid the loader has
 * never heard of, fail with {@link LoaderFailureException}. Immutable once built
 * and safe for concurrent use.
 */
@Log4j2
public final class InMemoryLoader implements Loader {
    private final TradingCalendar calendar;
    private final Map<Term, Map<LocalDate, Map<Long, Object>>> columns;
    private final Set<Long> knownAssets;
    private final AtomicInteger calls = new AtomicInteger();
    private final List<LoadRequest> requests = Collections.synchronizedList(new ArrayList<>());

    private InMemoryLoader(TradingCalendar calendar, Map<Term, Map<LocalDate, Map<Long, Object>>> columns,
            Set<Long> knownAssets) {
        this.calendar = calendar;
        this.columns = columns;
        this.knownAssets = knownAssets;
    }

    public static Builder builder() {
        return new Builder(new WeekdayCalendar());
    }

    public static Builder builder(TradingCalendar calendar) {
        return new Builder(calendar);
    }

    @Override
    public Matrix getWindow(Term term, LocalDate start, LocalDate end, AssetUniverse assets) {
        LoadRequest request = new LoadRequest(term, start, end, assets);
        calls.incrementAndGet();
        requests.add(request);

        Map<LocalDate, Map<Long, Object>> byDate = columns.get(term);
        if (byDate == null)
            throw new LoaderFailureException(request, "unknown column " + term.name());
        for (int c = 0; c < assets.size(); c++)
            if (!knownAssets.contains(assets.sid(c)))
                throw new LoaderFailureException(request, "unknown asset " + assets.sid(c));

        List<LocalDate> sessions = calendar.sessions(start, end);
        Matrix out = term.kind().allocate(sessions.size(), assets.size());
        for (int r = 0; r < sessions.size(); r++) {
            Map<Long, Object> row = byDate.get(sessions.get(r));
            if (row == null)
                continue;
            for (int c = 0; c < assets.size(); c++) {
                Object v = row.get(assets.sid(c));
                if (v == null)
                    continue;
                switch (term.kind()) {
                    case FACTOR -> ((DoubleMatrix) out).set(r, c, (Double) v);
                    case FILTER -> ((BooleanMatrix) out).set(r, c, (Boolean) v);
                    case CLASSIFIER -> ((LabelMatrix) out).set(r, c, (Integer) v);
                }
            }
        }
        log.debug("Loaded {} -> {}x{}", request, out.rows(), out.columns());
        return out;
    }

    /** Number of {@link #getWindow} calls served so far. */
    public int callCount() {
        return calls.get();
    }

    /** Every request served so far, in arrival order. */
    public List<LoadRequest> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public static final class Builder {
        private final TradingCalendar calendar;
        private final Map<Term, Map<LocalDate, Map<Long, Object>>> columns = new HashMap<>();
        private final Set<Long> knownAssets = new HashSet<>();

        private Builder(TradingCalendar calendar) {
            this.calendar = calendar;
        }

        /** Declares sids that exist even if they have no stored values. */
        public Builder assets(long... sids) {
            for (long sid : sids)
                knownAssets.add(sid);
            return this;
        }

        /** Registers a column with no values yet; every load returns all missing. */
        public Builder column(Term column) {
            checkColumn(column, column.kind());
            columns.computeIfAbsent(column, k -> new HashMap<>());
            return this;
        }

        public Builder put(Term column, LocalDate date, long sid, double value) {
            return store(column, TermKind.FACTOR, date, sid, value);
        }

        public Builder put(Term column, LocalDate date, long sid, boolean value) {
            return store(column, TermKind.FILTER, date, sid, value);
        }

        public Builder putLabel(Term column, LocalDate date, long sid, int label) {
            if (label < LabelMatrix.MISSING)
                throw new IllegalArgumentException("Label must be >= -1, got " + label);
            return store(column, TermKind.CLASSIFIER, date, sid, label);
        }

        /**
         * Stores {@code values} on consecutive sessions starting at the first
         * session on or after {@code firstDate}. NaN entries are left missing.
         */
        public Builder series(Term column, long sid, LocalDate firstDate, double... values) {
            LocalDate d = calendar.sessionsBefore(firstDate, 0);
            for (double v : values) {
                if (!Double.isNaN(v))
                    put(column, d, sid, v);
                else
                    knownAssets.add(sid);
                d = calendar.sessionsBefore(d.plusDays(1), 0);
            }
            checkColumn(column, TermKind.FACTOR);
            columns.computeIfAbsent(column, k -> new HashMap<>());
            return this;
        }

        private Builder store(Term column, TermKind kind, LocalDate date, long sid, Object value) {
            checkColumn(column, kind);
            columns.computeIfAbsent(column, k -> new HashMap<>())
                    .computeIfAbsent(date, k -> new HashMap<>())
                    .put(sid, value);
            knownAssets.add(sid);
            return this;
        }

        private static void checkColumn(Term column, TermKind kind) {
            if (!column.isLoadable() || !column.definition().isLoadable())
                throw new IllegalArgumentException("Not a column: " + column.name());
            if (column.hasMask())
                throw new IllegalArgumentException("Store values on the unmasked column: " + column.name());
            if (column.kind() != kind)
                throw new IllegalArgumentException("Column " + column.name() + " is " + column.kind()
                        + ", cannot store " + kind + " values");
        }

        public InMemoryLoader build() {
            Map<Term, Map<LocalDate, Map<Long, Object>>> frozen = new HashMap<>();
            columns.forEach((col, byDate) -> {
                Map<LocalDate, Map<Long, Object>> copy = new HashMap<>();
                byDate.forEach((d, row) -> copy.put(d, Map.copyOf(row)));
                frozen.put(col, Map.copyOf(copy));
            });
            return new InMemoryLoader(calendar, Map.copyOf(frozen), Set.copyOf(knownAssets));
        }
    }
}
