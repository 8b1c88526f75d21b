package org.catalogsearch.ingest.commands;

import java.util.ArrayList;
import java.util.List;

import org.catalogsearch.ingest.pipeline.BulkIndexer;
import org.catalogsearch.ingest.pipeline.HandoffQueue;
import org.catalogsearch.ingest.pipeline.IngestConfig;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "ingest", commandDescription = "Parse a MARC record dump and index the records")
public class IngestArgs extends CommandArgs {
    @Parameter(description = "<record file, or s3://bucket/key>")
    public List<String> locations = new ArrayList<>();

    @Parameter(names = { "--rules" }, description = "Path to a JSON ruleset; the bundled MARC rules are used when not given")
    public String rules;

    @Parameter(names = { "--languages" }, description = "Path to a language code list; the bundled list is used when not given")
    public String languages;

    @Parameter(names = { "--countries" }, description = "Path to a country code list; the bundled list is used when not given")
    public String countries;

    @Parameter(names = { "--consumer", "-c" }, description = "Consumer to use (es, json or title)",
        converter = ConsumerConverter.class)
    public IngestConfig.Consumer consumer = IngestConfig.Consumer.ES;

    @Parameter(names = { "--prefix", "-p" }, description = "Index prefix to use: default is aleph")
    public String prefix = IngestConfig.DEFAULT_PREFIX;

    @Parameter(names = { "--auto" }, description = "Automatically promote the new index on completion")
    public boolean auto;

    @Parameter(names = { "--debug" }, description = "Print the number of records ingested")
    public boolean debug;

    @Parameter(names = { "--documents-per-bulk-request" }, description = "Optional. The number of documents to send in each bulk request")
    public int numDocsPerBulkRequest = BulkIndexer.DEFAULT_MAX_DOCS_PER_BATCH;

    @Parameter(names = { "--queue-capacity" }, description = "Optional. How many parsed documents may wait to be indexed")
    public int queueCapacity = HandoffQueue.DEFAULT_CAPACITY;

    @Parameter(names = { "--max-consecutive-decode-failures" },
        description = "Optional. Stop reading after this many undecodable records in a row; 0 never stops")
    public int maxConsecutiveDecodeFailures = 0;

    @Parameter(names = { "--s3-region" }, description = "The AWS Region the S3 bucket is in, like: us-east-2")
    public String s3Region;

    @Parameter(names = { "--index-mappings" }, description = "Path to a JSON file with settings and mappings for a newly created index")
    public String indexMappings;

    public String getLocation() {
        if (locations.size() != 1) {
            throw new ParameterException("Expected exactly one record location, got " + locations.size());
        }
        return locations.get(0);
    }

    public static class ConsumerConverter implements IStringConverter<IngestConfig.Consumer> {
        @Override
        public IngestConfig.Consumer convert(String value) {
            try {
                return IngestConfig.Consumer.fromName(value);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(e.getMessage());
            }
        }
    }
}
