package com.guno.drawimport.api.explore;

import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * Parameter Space Explorer - enumerates candidate request shapes.
 *
 * <p>The sequence is the cartesian product of the dimension lists in the order endpoint,
 * date key, date format, page key, method, page-size key, page origin; the last one varies
 * fastest. It is computed lazily from an index, so callers can stop early, and every call to
 * {@code iterator()} starts over from the first candidate.
 */
@Component
public class ParameterSpaceExplorer {

    public Iterable<CandidateRequestShape> candidates(SearchDimensions dimensions) {
        return () -> new CandidateIterator(dimensions);
    }

    private static final class CandidateIterator implements Iterator<CandidateRequestShape> {

        private final SearchDimensions d;
        private final long total;
        private long next;

        CandidateIterator(SearchDimensions dimensions) {
            this.d = dimensions;
            this.total = dimensions.size();
        }

        @Override
        public boolean hasNext() {
            return next < total;
        }

        @Override
        public CandidateRequestShape next() {
            if (!hasNext()) throw new NoSuchElementException();

            long i = next;
            int origin = (int) (i % d.getPageIndexOrigins().size());
            i /= d.getPageIndexOrigins().size();
            int sizeKey = (int) (i % d.getPageSizeKeys().size());
            i /= d.getPageSizeKeys().size();
            int method = (int) (i % d.getMethods().size());
            i /= d.getMethods().size();
            int pageKey = (int) (i % d.getPageKeys().size());
            i /= d.getPageKeys().size();
            int format = (int) (i % d.getDateFormats().size());
            i /= d.getDateFormats().size();
            int dateKey = (int) (i % d.getDateKeys().size());
            i /= d.getDateKeys().size();
            int endpoint = (int) i;

            CandidateRequestShape shape = CandidateRequestShape.builder()
                    .ordinal((int) next)
                    .endpoint(d.getEndpoints().get(endpoint))
                    .dateKey(d.getDateKeys().get(dateKey))
                    .dateFormat(d.getDateFormats().get(format))
                    .pageKey(d.getPageKeys().get(pageKey))
                    .method(HttpMethod.valueOf(d.getMethods().get(method).trim().toUpperCase(Locale.ROOT)))
                    .pageSizeKey(d.getPageSizeKeys().get(sizeKey))
                    .pageIndexOrigin(d.getPageIndexOrigins().get(origin))
                    .build();

            next++;
            return shape;
        }
    }
}
