package com.trading.pipeline.data;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Ordered set of asset ids (sids). Column {@code i} of every array in a run is
 * asset {@code sid(i)}.
 */
public final class AssetUniverse {
    private final long[] sids;
    private final Map<Long, Integer> indexBySid;

    private AssetUniverse(long[] sids) {
        this.sids = sids;
        this.indexBySid = new HashMap<>(sids.length * 2);
        for (int i = 0; i < sids.length; i++) {
            if (indexBySid.put(sids[i], i) != null)
                throw new IllegalArgumentException("Duplicate asset: " + sids[i]);
        }
    }

    public static AssetUniverse of(long... sids) {
        return new AssetUniverse(sids.clone());
    }

    public int size() {
        return sids.length;
    }

    public long sid(int index) {
        return sids[index];
    }

    /** Column index of {@code sid}, or -1 when not in the universe. */
    public int indexOf(long sid) {
        Integer idx = indexBySid.get(sid);
        return idx == null ? -1 : idx;
    }

    public boolean contains(long sid) {
        return indexBySid.containsKey(sid);
    }

    public long[] toArray() {
        return sids.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AssetUniverse u && Arrays.equals(sids, u.sids);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(sids);
    }

    @Override
    public String toString() {
        if (sids.length <= 10)
            return Arrays.toString(sids);
        return "[" + sids[0] + ", " + sids[1] + ", ... " + sids[sids.length - 1] + "] (" + sids.length + " assets)";
    }
}
