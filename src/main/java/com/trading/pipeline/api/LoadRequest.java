package com.trading.pipeline.api;

import com.trading.pipeline.data.AssetUniverse;
import com.trading.pipeline.term.Term;

import java.time.LocalDate;
import java.util.Objects;

/** One loader call: the (term, date range, asset set) key used for coalescing and error reporting. */
public record LoadRequest(Term term, LocalDate start, LocalDate end, AssetUniverse assets) {

    public LoadRequest {
        Objects.requireNonNull(term, "term");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(assets, "assets");
    }

    @Override
    public String toString() {
        return term.name() + " [" + start + " .. " + end + "] assets=" + assets;
    }
}
