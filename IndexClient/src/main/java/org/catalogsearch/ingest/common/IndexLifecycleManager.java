package org.catalogsearch.ingest.common;

import java.util.List;
import java.util.Set;

import org.catalogsearch.ingest.common.model.AliasInfo;
import org.catalogsearch.ingest.common.model.ClusterInfo;
import org.catalogsearch.ingest.common.model.IndexInfo;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Administration of the indices an ingest run produces.
 *
 * <p>A run writes into a fresh index. Once it looks right, {@link #promote} moves the serving
 * alias onto it in a single request; the index it replaces keeps its own name until it is
 * deleted.
 */
@Slf4j
@RequiredArgsConstructor
public class IndexLifecycleManager {
    private final SearchClient client;

    public record Promotion(String alias, String index, Set<String> previousIndices) {}

    public ClusterInfo ping() {
        return client.ping();
    }

    public List<IndexInfo> listIndices() {
        return client.listIndices();
    }

    public List<AliasInfo> listAliases() {
        return client.listAliases();
    }

    public void delete(String indexName) {
        client.deleteIndex(indexName);
        log.atInfo().setMessage("Deleted index {}").addArgument(indexName).log();
    }

    public Promotion promote(String indexName, String alias) {
        if (!client.hasIndex(indexName)) {
            throw new IndexNotFoundException(indexName);
        }
        var previousIndices = client.aliasTargets(alias);
        client.swapAlias(alias, previousIndices, indexName);
        log.atInfo().setMessage("Alias {} now points at {}, previously {}")
            .addArgument(alias)
            .addArgument(indexName)
            .addArgument(previousIndices)
            .log();
        return new Promotion(alias, indexName, previousIndices);
    }

    public long reindex(String sourceIndex, String destinationIndex) {
        if (!client.hasIndex(sourceIndex)) {
            throw new IndexNotFoundException(sourceIndex);
        }
        var copied = client.reindex(sourceIndex, destinationIndex);
        log.atInfo().setMessage("Reindexed {} documents from {} into {}")
            .addArgument(copied)
            .addArgument(sourceIndex)
            .addArgument(destinationIndex)
            .log();
        return copied;
    }
}
