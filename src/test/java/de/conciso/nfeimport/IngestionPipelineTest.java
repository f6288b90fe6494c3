package de.conciso.nfeimport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import java.util.stream.Stream;

import de.conciso.nfeimport.IngestionException.Stage;
import de.conciso.nfeimport.extraction.NfeExtractor;
import de.conciso.nfeimport.parser.DocumentParser;
import de.conciso.nfeimport.routing.FileRouter;
import de.conciso.nfeimport.routing.RoutingException;
import de.conciso.nfeimport.store.DocumentStoreException;
import de.conciso.nfeimport.store.NfeDocumentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

class IngestionPipelineTest {

    private static final long TIMEOUT_MS = 15_000;

    @TempDir
    Path tempDir;

    private Path inbox;
    private Path processed;
    private Path errors;
    private Path rejectionLogFile;
    private ProcessorSettings settings;
    private NfeDocumentStore store;
    private FileRouter router;
    private RejectionLogWriter rejectionLog;
    private IngestionPipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        inbox = Files.createDirectories(tempDir.resolve("xml_nfe"));
        processed = Files.createDirectories(tempDir.resolve("processados"));
        errors = Files.createDirectories(tempDir.resolve("erros"));
        rejectionLogFile = tempDir.resolve("logs/rejections.log");
        settings = new ProcessorSettings(inbox, processed, errors, tempDir.resolve("nfe.db"),
                true, Duration.ofMillis(100), 2, 16);

        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + settings.databaseFile());
        store = new NfeDocumentStore(new JdbcTemplate(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
        store.initializeSchema();

        router = new FileRouter(settings);
        rejectionLog = new RejectionLogWriter(rejectionLogFile.toString(), 1024);
        pipeline = newPipeline(store, router);
    }

    @AfterEach
    void tearDown() {
        pipeline.shutdown();
    }

    private IngestionPipeline newPipeline(NfeDocumentStore store, FileRouter router) {
        return new IngestionPipeline(settings, new DocumentParser(), new NfeExtractor(), store, router, rejectionLog);
    }

    private static List<Path> filesIn(Path folder) throws Exception {
        try (Stream<Path> files = Files.walk(folder)) {
            return files.filter(Files::isRegularFile).toList();
        }
    }

    private static boolean waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return condition.getAsBoolean();
    }

    @Test
    void importsSingleItemDocument() throws Exception {
        Path file = NfeXml.write(inbox, "nota.xml", NfeXml.resource("nfe-single-item.xml"));

        IngestionOutcome outcome = pipeline.ingest(file);

        assertThat(outcome.isCommitted()).isTrue();
        assertThat(outcome.accessKey()).isEqualTo(NfeXml.SINGLE_ITEM_KEY);
        assertThat(outcome.destination()).isEqualTo(processed.resolve("nota.xml"));
        assertThat(file).doesNotExist();
        assertThat(processed.resolve("nota.xml")).exists();

        NfeDocumentStore.HeaderRow row = store.findHeader(NfeXml.SINGLE_ITEM_KEY).orElseThrow();
        assertThat(row.header().invoiceNumber()).isEqualTo("46");
        assertThat(row.fileName()).isEqualTo("nota.xml");
        assertThat(row.relativePath()).isEqualTo("nota.xml");
        assertThat(store.findItems(NfeXml.SINGLE_ITEM_KEY)).hasSize(1);
    }

    @Test
    void importsEveryLineItem() {
        Path file = NfeXml.write(inbox.resolve("2019/08"), "lote.xml", NfeXml.resource("nfe-three-items.xml"));

        IngestionOutcome outcome = pipeline.ingest(file);

        assertThat(outcome.isCommitted()).isTrue();
        assertThat(store.findItems(NfeXml.THREE_ITEMS_KEY)).hasSize(3);
        assertThat(store.findHeader(NfeXml.THREE_ITEMS_KEY).orElseThrow().relativePath())
                .isEqualTo(Path.of("2019", "08", "lote.xml").toString());
    }

    @Test
    void reimportReplacesItems() {
        String key = "35240300000000000000550010000001231000001234";
        pipeline.ingest(NfeXml.write(inbox, "v1.xml", NfeXml.document(key, "123", 3)));
        pipeline.ingest(NfeXml.write(inbox, "v2.xml", NfeXml.document(key, "123", 2)));

        assertThat(store.countHeaders()).isEqualTo(1);
        assertThat(store.findItems(key)).hasSize(2);
        assertThat(store.findHeader(key).orElseThrow().fileName()).isEqualTo("v2.xml");
    }

    @Test
    void malformedFileGoesToErrorFolder() throws Exception {
        Path file = NfeXml.write(inbox, "quebrado.xml", NfeXml.resource("malformed.xml"));

        IngestionOutcome outcome = pipeline.ingest(file);

        assertThat(outcome.isCommitted()).isFalse();
        assertThat(outcome.stage()).isEqualTo(Stage.PARSE);
        assertThat(outcome.destination()).isEqualTo(errors.resolve("quebrado.xml"));
        assertThat(file).doesNotExist();
        assertThat(store.countHeaders()).isZero();
        assertThat(filesIn(processed)).isEmpty();
    }

    @Test
    void rejectionIsLogged() throws Exception {
        pipeline.ingest(NfeXml.write(inbox, "quebrado.xml", NfeXml.resource("malformed.xml")));

        String log = Files.readString(rejectionLogFile);
        assertThat(log)
                .contains("file=quebrado.xml")
                .contains("stage=PARSE")
                .contains("destination=" + errors.resolve("quebrado.xml"));
    }

    @Test
    void emptyAccessKeyIsRejected() {
        Path file = NfeXml.write(inbox, "semchave.xml", NfeXml.document("", "1", 1));

        IngestionOutcome outcome = pipeline.ingest(file);

        assertThat(outcome.isCommitted()).isFalse();
        assertThat(outcome.stage()).isEqualTo(Stage.PERSISTENCE);
        assertThat(errors.resolve("semchave.xml")).exists();
        assertThat(store.countHeaders()).isZero();
        assertThat(store.countItems()).isZero();
    }

    @Test
    void nonNumericAmountIsRejectedAtExtraction() {
        String xml = NfeXml.document("35240300000000000000550010000001231000001234", "1", 1)
                .replace("<vNF>10.00</vNF>", "<vNF>dez</vNF>");

        IngestionOutcome outcome = pipeline.ingest(NfeXml.write(inbox, "texto.xml", xml));

        assertThat(outcome.stage()).isEqualTo(Stage.EXTRACTION);
        assertThat(errors.resolve("texto.xml")).exists();
    }

    @Test
    void sameNameTwiceIsDisambiguated() {
        String key1 = "35240300000000000000550010000000011000000011";
        String key2 = "35240300000000000000550010000000021000000022";

        IngestionOutcome first = pipeline.ingest(NfeXml.write(inbox, "nota.xml", NfeXml.document(key1, "1", 1)));
        IngestionOutcome second = pipeline.ingest(NfeXml.write(inbox, "nota.xml", NfeXml.document(key2, "2", 1)));

        assertThat(first.destination()).isEqualTo(processed.resolve("nota.xml"));
        assertThat(second.destination()).isEqualTo(processed.resolve("nota_001.xml"));
        assertThat(store.countHeaders()).isEqualTo(2);
    }

    @Test
    void backlogSweepImportsEveryExistingFile() throws Exception {
        for (int i = 1; i <= 5; i++) {
            String key = String.format("352403000000000000005500100000000%02d10000000%02d", i, i);
            Path folder = i % 2 == 0 ? inbox.resolve("sub") : inbox;
            NfeXml.write(folder, "nota" + i + ".xml", NfeXml.document(key, String.valueOf(i), i));
        }
        NfeXml.write(inbox, "ignorar.txt", "not xml");

        int count = pipeline.runBacklogSweep();

        assertThat(count).isEqualTo(5);
        assertThat(store.countHeaders()).isEqualTo(5);
        assertThat(store.countItems()).isEqualTo(15);
        assertThat(filesIn(inbox)).containsExactly(inbox.resolve("ignorar.txt"));
        assertThat(filesIn(processed)).hasSize(5);
    }

    @Test
    void liveEventIsImportedAfterStart() throws Exception {
        pipeline.start();

        NfeXml.write(inbox, "nova.xml", NfeXml.resource("nfe-single-item.xml"));

        assertThat(waitFor(() -> Files.exists(processed.resolve("nova.xml")))).isTrue();
        assertThat(waitFor(() -> store.countHeaders() == 1)).isTrue();
        assertThat(inbox.resolve("nova.xml")).doesNotExist();
    }

    @Test
    void startSweepsBacklogBeforeWatching() throws Exception {
        NfeXml.write(inbox, "antiga.xml", NfeXml.resource("nfe-single-item.xml"));

        pipeline.start();

        assertThat(processed.resolve("antiga.xml")).exists();
        NfeXml.write(inbox, "nova.xml", NfeXml.resource("nfe-three-items.xml"));
        assertThat(waitFor(() -> store.countHeaders() == 2)).isTrue();
    }

    @Test
    void vanishedFileIsSkipped() throws Exception {
        Path file = NfeXml.write(inbox, "efemero.xml", NfeXml.resource("nfe-single-item.xml"));

        pipeline.onFileCreated(file);
        Files.delete(file);

        Thread.sleep(settings.settleInterval().toMillis() * 5);
        assertThat(filesIn(processed)).isEmpty();
        assertThat(filesIn(errors)).isEmpty();
        assertThat(rejectionLogFile).doesNotExist();
    }

    @Test
    void nonXmlEventIsIgnored() throws Exception {
        Path file = NfeXml.write(inbox, "leia.txt", "x");

        pipeline.onFileCreated(file);

        Thread.sleep(settings.settleInterval().toMillis() * 5);
        assertThat(file).exists();
    }

    @Test
    void fileStaysWhenErrorMoveFails() throws Exception {
        FileRouter brokenRouter = mock(FileRouter.class);
        when(brokenRouter.placeInError(any())).thenThrow(new RoutingException("read-only", null));
        pipeline.shutdown();
        pipeline = newPipeline(store, brokenRouter);
        Path file = NfeXml.write(inbox, "quebrado.xml", NfeXml.resource("malformed.xml"));

        IngestionOutcome outcome = pipeline.ingest(file);

        assertThat(outcome.isCommitted()).isFalse();
        assertThat(outcome.destination()).isNull();
        assertThat(file).exists();
        assertThat(Files.readString(rejectionLogFile)).contains("(left in place)");
    }

    @Test
    void failedProcessedMoveRollsBackAndRoutesToError() throws Exception {
        FileRouter spyRouter = mock(FileRouter.class);
        when(spyRouter.placeInProcessed(any())).thenThrow(new RoutingException("disk full", null));
        when(spyRouter.placeInError(any())).thenAnswer(inv -> router.placeInError(inv.getArgument(0)));
        pipeline.shutdown();
        pipeline = newPipeline(store, spyRouter);
        Path file = NfeXml.write(inbox, "nota.xml", NfeXml.resource("nfe-single-item.xml"));

        IngestionOutcome outcome = pipeline.ingest(file);

        assertThat(outcome.stage()).isEqualTo(Stage.ROUTING);
        assertThat(errors.resolve("nota.xml")).exists();
        assertThat(store.countHeaders()).isZero();
    }

    @Test
    @SuppressWarnings("unchecked")
    void commitFailureAfterMoveRelocatesFileToErrorFolder() throws Exception {
        NfeDocumentStore failingStore = mock(NfeDocumentStore.class);
        doAnswer(inv -> {
            ((Supplier<Object>) inv.getArgument(2)).get();
            throw new DocumentStoreException("commit failed", null);
        }).when(failingStore).upsertDocument(any(), any(), any());
        pipeline.shutdown();
        pipeline = newPipeline(failingStore, router);
        Path file = NfeXml.write(inbox, "nota.xml", NfeXml.resource("nfe-single-item.xml"));

        IngestionOutcome outcome = pipeline.ingest(file);

        assertThat(outcome.stage()).isEqualTo(Stage.PERSISTENCE);
        assertThat(outcome.destination()).isEqualTo(errors.resolve("nota.xml"));
        assertThat(filesIn(processed)).isEmpty();
        assertThat(file).doesNotExist();
    }

    @Test
    void shutdownWaitsForRunningSweepImport() throws Exception {
        CountDownLatch moving = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        FileRouter slowRouter = mock(FileRouter.class);
        when(slowRouter.placeInProcessed(any())).thenAnswer(inv -> {
            moving.countDown();
            proceed.await(10, TimeUnit.SECONDS);
            return router.placeInProcessed(inv.getArgument(0));
        });
        pipeline.shutdown();
        pipeline = newPipeline(store, slowRouter);
        NfeXml.write(inbox, "a.xml", NfeXml.document("35240300000000000000550010000000011000000011", "1", 1));
        NfeXml.write(inbox, "b.xml", NfeXml.document("35240300000000000000550010000000021000000022", "2", 1));

        Thread sweep = new Thread(pipeline::runBacklogSweep);
        sweep.start();
        assertThat(moving.await(10, TimeUnit.SECONDS)).isTrue();

        Thread stopper = new Thread(pipeline::shutdown);
        stopper.start();
        stopper.join(300);
        assertThat(stopper.isAlive()).as("shutdown waits while an import is mid-transaction").isTrue();

        proceed.countDown();
        stopper.join(10_000);
        sweep.join(10_000);

        assertThat(stopper.isAlive()).isFalse();
        assertThat(store.countHeaders()).isEqualTo(1);
        assertThat(filesIn(processed)).hasSize(1);
        assertThat(filesIn(inbox)).hasSize(1);
    }

    @Test
    void noImportStartsAfterShutdown() throws Exception {
        NfeXml.write(inbox, "nota.xml", NfeXml.resource("nfe-single-item.xml"));
        pipeline.shutdown();

        assertThat(pipeline.runBacklogSweep()).isZero();
        assertThat(inbox.resolve("nota.xml")).exists();
        assertThat(store.countHeaders()).isZero();
    }

    @Test
    void eventAfterShutdownLeavesFileInPlace() throws Exception {
        Path file = NfeXml.write(inbox, "tarde.xml", NfeXml.resource("nfe-single-item.xml"));
        pipeline.shutdown();

        pipeline.onFileCreated(file);

        Thread.sleep(settings.settleInterval().toMillis() * 3);
        assertThat(file).exists();
        assertThat(store.countHeaders()).isZero();
    }
}
