package com.starscape.mediavault.features.library.infra;

import com.starscape.mediavault.features.library.domain.MediaAsset;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.LongFunction;

/**
 * Iterates over media rows page by page, each page starting after the last id
 * seen. Rows inserted or updated during iteration never cause skips or repeats.
 */
class KeysetPagedIterable implements Iterable<MediaAsset> {
    
    private final LongFunction<List<MediaAsset>> pageAfter;
    
    KeysetPagedIterable(LongFunction<List<MediaAsset>> pageAfter) {
        this.pageAfter = pageAfter;
    }
    
    @Override
    public Iterator<MediaAsset> iterator() {
        return new Iterator<>() {
            private long lastId = 0L;
            private Iterator<MediaAsset> page = List.<MediaAsset>of().iterator();
            private boolean exhausted = false;
            
            @Override
            public boolean hasNext() {
                if (page.hasNext()) {
                    return true;
                }
                if (exhausted) {
                    return false;
                }
                List<MediaAsset> next = pageAfter.apply(lastId);
                if (next.isEmpty()) {
                    exhausted = true;
                    return false;
                }
                page = next.iterator();
                return true;
            }
            
            @Override
            public MediaAsset next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                MediaAsset asset = page.next();
                lastId = asset.getId();
                return asset;
            }
        };
    }
}
