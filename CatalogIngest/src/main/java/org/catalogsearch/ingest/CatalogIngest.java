package org.catalogsearch.ingest;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.catalogsearch.ingest.commands.AliasesArgs;
import org.catalogsearch.ingest.commands.DeleteArgs;
import org.catalogsearch.ingest.commands.IndexesArgs;
import org.catalogsearch.ingest.commands.IngestArgs;
import org.catalogsearch.ingest.commands.PingArgs;
import org.catalogsearch.ingest.commands.PromoteArgs;
import org.catalogsearch.ingest.commands.ReindexArgs;
import org.catalogsearch.ingest.common.IndexLifecycleManager;
import org.catalogsearch.ingest.common.SearchClient;
import org.catalogsearch.ingest.io.RecordLocation;
import org.catalogsearch.ingest.mapping.RecordMapper;
import org.catalogsearch.ingest.mapping.codes.CodeTable;
import org.catalogsearch.ingest.mapping.rules.Ruleset;
import org.catalogsearch.ingest.pipeline.IngestConfig;
import org.catalogsearch.ingest.pipeline.IngestFailedException;
import org.catalogsearch.ingest.pipeline.Ingester;
import org.catalogsearch.ingest.pipeline.ir.IngestResult;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Command line entry point: ingests MARC record dumps and administers the indices they go to.
 */
@Slf4j
public class CatalogIngest {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final PrintStream out;

    final CatalogArgs catalogArgs = new CatalogArgs();
    final IngestArgs ingestArgs = new IngestArgs();
    final IndexesArgs indexesArgs = new IndexesArgs();
    final AliasesArgs aliasesArgs = new AliasesArgs();
    final PingArgs pingArgs = new PingArgs();
    final DeleteArgs deleteArgs = new DeleteArgs();
    final PromoteArgs promoteArgs = new PromoteArgs();
    final ReindexArgs reindexArgs = new ReindexArgs();

    public CatalogIngest(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        var exitCode = new CatalogIngest(System.out).run(args);
        exitWithCode(exitCode);
    }

    protected static void exitWithCode(int code) {
        System.exit(code);
    }

    public int run(String[] args) {
        var jCommander = JCommander.newBuilder()
            .programName("catalog-ingest")
            .addObject(catalogArgs)
            .addCommand(ingestArgs)
            .addCommand(indexesArgs)
            .addCommand(aliasesArgs)
            .addCommand(pingArgs)
            .addCommand(deleteArgs)
            .addCommand(promoteArgs)
            .addCommand(reindexArgs)
            .build();
        try {
            jCommander.parse(args);
        } catch (ParameterException e) {
            log.atError().setMessage("{}").addArgument(e::getMessage).log();
            printUsage(jCommander);
            return EXIT_USAGE;
        }

        if (catalogArgs.help || jCommander.getParsedCommand() == null) {
            printUsage(jCommander);
            return catalogArgs.help ? EXIT_OK : EXIT_USAGE;
        }
        var command = CatalogCommands.fromString(jCommander.getParsedCommand());
        if (commandHelpRequested(command)) {
            printCommandUsage(jCommander);
            return EXIT_OK;
        }

        try {
            runCommand(command);
            return EXIT_OK;
        } catch (ParameterException e) {
            log.atError().setMessage("{}").addArgument(e::getMessage).log();
            printCommandUsage(jCommander);
            return EXIT_USAGE;
        } catch (IngestFailedException e) {
            var partial = e.getPartialResult();
            log.atError().setMessage("Ingest failed after {} documents").addArgument(partial::documentsIndexed).setCause(e).log();
            return EXIT_FAILURE;
        } catch (RuntimeException | IOException e) {
            log.atError().setMessage("{} failed: {}").addArgument(command).addArgument(e::getMessage).setCause(e).log();
            return EXIT_FAILURE;
        }
    }

    private void printUsage(JCommander jCommander) {
        var sb = new StringBuilder();
        jCommander.getUsageFormatter().usage(sb);
        out.print(sb);
    }

    private void printCommandUsage(JCommander jCommander) {
        var sb = new StringBuilder();
        jCommander.getUsageFormatter().usage(jCommander.getParsedCommand(), sb);
        out.print(sb);
    }

    private boolean commandHelpRequested(CatalogCommands command) {
        switch (command) {
            case INGEST: return ingestArgs.help;
            case INDEXES: return indexesArgs.help;
            case ALIASES: return aliasesArgs.help;
            case PING: return pingArgs.help;
            case DELETE: return deleteArgs.help;
            case PROMOTE: return promoteArgs.help;
            case REINDEX: return reindexArgs.help;
            default: return false;
        }
    }

    private void runCommand(CatalogCommands command) throws IOException {
        switch (command) {
            case INGEST:
                ingest();
                break;
            case INDEXES:
                for (var index : lifecycleManager().listIndices()) {
                    out.printf("%nName: %s%n  Documents: %s%n  Health: %s%n  Status: %s%n  UUID: %s%n  Size: %s%n",
                        index.name(), index.docsCount(), index.health(), index.status(), index.uuid(), index.storeSize());
                }
                break;
            case ALIASES:
                for (var alias : lifecycleManager().listAliases()) {
                    out.printf("%nAlias: %s%n  Index: %s%n", alias.alias(), alias.index());
                }
                break;
            case PING:
                var info = lifecycleManager().ping();
                out.printf("%nName: %s%nCluster: %s%nVersion: %s%nLucene version: %s%n",
                    info.nodeName(), info.clusterName(), info.versionNumber(), info.luceneVersion());
                break;
            case DELETE:
                lifecycleManager().delete(requireIndex());
                break;
            case PROMOTE:
                lifecycleManager().promote(requireIndex(), promoteArgs.prefix);
                break;
            case REINDEX:
                var count = lifecycleManager().reindex(requireIndex(), reindexArgs.destination);
                out.printf("%d documents reindexed%n", count);
                break;
            default:
                throw new IllegalArgumentException("Unsupported command " + command);
        }
    }

    private void ingest() throws IOException {
        var location = RecordLocation.parse(ingestArgs.getLocation());
        var config = IngestConfig.builder()
            .consumer(ingestArgs.consumer)
            .indexName(catalogArgs.index)
            .prefix(ingestArgs.prefix)
            .promote(ingestArgs.auto)
            .indexSettings(readIndexSettings(ingestArgs.indexMappings))
            .maxDocsPerBatch(ingestArgs.numDocsPerBulkRequest)
            .queueCapacity(ingestArgs.queueCapacity)
            .maxConsecutiveDecodeFailures(ingestArgs.maxConsecutiveDecodeFailures)
            .build();
        var client = config.getConsumer() == IngestConfig.Consumer.ES ? createClient() : null;
        var ingester = new Ingester(createMapper(), client, out);

        IngestResult result;
        try (var records = location.open(ingestArgs.s3Region)) {
            result = ingester.ingest(records, config);
        }
        if (ingestArgs.debug) {
            out.printf("Total records ingested: %d%n", result.documentsIndexed());
        }
    }

    RecordMapper createMapper() {
        var ruleset = Optional.ofNullable(ingestArgs.rules)
            .map(rules -> Ruleset.load(Path.of(rules)))
            .orElseGet(Ruleset::loadDefault);
        var languages = Optional.ofNullable(ingestArgs.languages)
            .map(path -> CodeTable.load(CodeTable.LANGUAGE, Path.of(path)))
            .orElseGet(() -> CodeTable.loadResource(CodeTable.LANGUAGE, CodeTable.DEFAULT_LANGUAGES_RESOURCE));
        var countries = Optional.ofNullable(ingestArgs.countries)
            .map(path -> CodeTable.load(CodeTable.COUNTRY, Path.of(path)))
            .orElseGet(() -> CodeTable.loadResource(CodeTable.COUNTRY, CodeTable.DEFAULT_COUNTRIES_RESOURCE));
        return new RecordMapper(ruleset, languages, countries);
    }

    private static ObjectNode readIndexSettings(String path) throws IOException {
        if (path == null) {
            return null;
        }
        var node = OBJECT_MAPPER.readTree(Files.readString(Path.of(path)));
        if (!node.isObject()) {
            throw new ParameterException("Index mappings in " + path + " must be a JSON object");
        }
        return (ObjectNode) node;
    }

    private String requireIndex() {
        if (catalogArgs.index == null || catalogArgs.index.isBlank()) {
            throw new ParameterException("--index is required for this command");
        }
        return catalogArgs.index;
    }

    private IndexLifecycleManager lifecycleManager() {
        return new IndexLifecycleManager(createClient());
    }

    protected SearchClient createClient() {
        var clusterArgs = catalogArgs.clusterArgs;
        return new SearchClient(clusterArgs.toConnectionContext(), clusterArgs.getMaxConnections());
    }
}
