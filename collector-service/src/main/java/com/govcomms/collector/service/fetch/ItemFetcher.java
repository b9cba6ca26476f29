package com.govcomms.collector.service.fetch;

import com.govcomms.collector.dto.CandidateItem;
import com.govcomms.collector.entity.Source;
import com.govcomms.collector.entity.SourceKind;

import java.util.stream.Stream;

/**
 * Kind-specific retrieval of candidate items for one source.
 *
 * The returned stream is lazy and ordered newest to oldest. It ends at the natural end of
 * pagination or at the first already-known item. Fetchers never write to the item store.
 * A failed request surfaces as {@link com.govcomms.collector.exception.SourceCycleFailedException}
 * while the stream is consumed.
 */
public interface ItemFetcher {

    SourceKind kind();

    Stream<CandidateItem> fetchCandidates(Source source, FetchContext context);
}
