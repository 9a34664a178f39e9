package com.notegraph.storage.index;

import com.notegraph.common.model.BacklinksIndex;
import com.notegraph.common.model.ClustersIndex;
import com.notegraph.common.model.DecayIndex;
import com.notegraph.common.model.EmbeddingsIndex;
import com.notegraph.common.model.ExplorationsIndex;
import com.notegraph.common.model.RefinementsIndex;
import com.notegraph.common.model.RelationsIndex;
import com.notegraph.common.model.SnapshotsIndex;
import com.notegraph.common.model.TensionsIndex;

import java.util.function.Supplier;

/**
 * One self-contained JSON index document: its file name under the index directory, its schema and its empty value.
 */
public record IndexDocument<T>(String fileName, Class<T> type, Supplier<T> emptySupplier) {

    public static final IndexDocument<EmbeddingsIndex> EMBEDDINGS =
            new IndexDocument<>("embeddings.json", EmbeddingsIndex.class, EmbeddingsIndex::empty);
    public static final IndexDocument<BacklinksIndex> BACKLINKS =
            new IndexDocument<>("backlinks.json", BacklinksIndex.class, BacklinksIndex::empty);
    public static final IndexDocument<ClustersIndex> CLUSTERS =
            new IndexDocument<>("clusters.json", ClustersIndex.class, ClustersIndex::empty);
    public static final IndexDocument<TensionsIndex> TENSIONS =
            new IndexDocument<>("tensions.json", TensionsIndex.class, TensionsIndex::empty);
    public static final IndexDocument<DecayIndex> DECAY =
            new IndexDocument<>("decay.json", DecayIndex.class, DecayIndex::empty);
    public static final IndexDocument<RelationsIndex> RELATIONS =
            new IndexDocument<>("relations.json", RelationsIndex.class, RelationsIndex::empty);
    public static final IndexDocument<RefinementsIndex> REFINEMENTS =
            new IndexDocument<>("refinements.json", RefinementsIndex.class, RefinementsIndex::empty);
    public static final IndexDocument<ExplorationsIndex> EXPLORATIONS =
            new IndexDocument<>("explorations.json", ExplorationsIndex.class, ExplorationsIndex::empty);
    public static final IndexDocument<SnapshotsIndex> SNAPSHOTS =
            new IndexDocument<>("snapshots.json", SnapshotsIndex.class, SnapshotsIndex::empty);

    public T empty() {
        return emptySupplier.get();
    }
}
