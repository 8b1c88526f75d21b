package org.catalogsearch.ingest.common.model;

public record ClusterInfo(
    String nodeName,
    String clusterName,
    String versionNumber,
    String luceneVersion
) {}
