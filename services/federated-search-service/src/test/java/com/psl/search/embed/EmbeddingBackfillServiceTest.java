package com.psl.search.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.psl.search.store.PaperRecord;
import com.psl.search.store.PaperRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

class EmbeddingBackfillServiceTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private PaperRepository repository;
    private EmbeddingProvider embeddingProvider;
    private EmbeddingProperties properties;
    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        repository = mock(PaperRepository.class);
        embeddingProvider = mock(EmbeddingProvider.class);
        properties = new EmbeddingProperties();
        properties.getBackfill().setBatchSize(2);
        transactionTemplate = new TransactionTemplate(mock(PlatformTransactionManager.class));
        when(embeddingProvider.embedBatch(anyList())).thenAnswer(invocation -> {
            List<String> texts = invocation.getArgument(0);
            List<List<Double>> vectors = new ArrayList<>();
            for (int i = 0; i < texts.size(); i++) {
                vectors.add(List.of(0.5, 0.25));
            }
            return vectors;
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void embedsSelectedRecordsInCommittedBatches() {
        when(repository.findUnembeddedIds(List.of(1L, 2L, 3L), 500)).thenReturn(List.of(1L, 2L, 3L));
        when(repository.findByIds(List.of(1L, 2L))).thenReturn(List.of(record(1L), record(2L)));
        when(repository.findByIds(List.of(3L))).thenReturn(List.of(record(3L)));

        EmbeddingBackfillService.BackfillReport report = service(unusedExecutor()).run(List.of(1L, 2L, 3L));

        assertEquals(3, report.getSelected());
        assertEquals(3, report.getEmbedded());
        assertEquals(0, report.getFailed());
        ArgumentCaptor<Map<Long, String>> batches = ArgumentCaptor.forClass(Map.class);
        verify(repository, times(2)).updateEmbeddings(batches.capture());
        assertThat(batches.getAllValues().get(0)).containsOnlyKeys(1L, 2L).containsValue("[0.5,0.25]");
        assertThat(batches.getAllValues().get(1)).containsOnlyKeys(3L);
    }

    @Test
    void modelFailureSkipsBatchButKeepsGoing() {
        when(repository.findUnembeddedIds(List.of(), 500)).thenReturn(List.of(1L, 2L, 3L));
        when(repository.findByIds(List.of(1L, 2L))).thenReturn(List.of(record(1L), record(2L)));
        when(repository.findByIds(List.of(3L))).thenReturn(List.of(record(3L)));
        when(embeddingProvider.embedBatch(anyList()))
            .thenThrow(new EmbeddingUnavailableException("embed_timeout"))
            .thenReturn(List.of(List.of(1.0, 0.0)));

        EmbeddingBackfillService.BackfillReport report = service(unusedExecutor()).run(List.of());

        assertEquals(1, report.getEmbedded());
        assertEquals(2, report.getFailed());
        assertEquals(2.0, meterRegistry.counter(
            "search.embedding.backfill.records.total", "result", "failed").count());
    }

    @Test
    void commitFailureCountsBatchAsFailed() {
        when(repository.findUnembeddedIds(List.of(7L), 500)).thenReturn(List.of(7L));
        when(repository.findByIds(List.of(7L))).thenReturn(List.of(record(7L)));
        doThrow(new DataAccessResourceFailureException("db down")).when(repository).updateEmbeddings(anyMap());

        EmbeddingBackfillService.BackfillReport report = service(unusedExecutor()).run(List.of(7L));

        assertEquals(0, report.getEmbedded());
        assertEquals(1, report.getFailed());
    }

    @Test
    void nothingToEmbedIsANoOp() {
        when(repository.findUnembeddedIds(List.of(), 500)).thenReturn(List.of());

        EmbeddingBackfillService.BackfillReport report = service(unusedExecutor()).run(List.of());

        assertEquals(0, report.getSelected());
        verify(embeddingProvider, never()).embedBatch(anyList());
    }

    @Test
    void scheduleRunsOnWorkerAndReturnsImmediately() {
        when(repository.findUnembeddedIds(List.of(4L), 500)).thenReturn(List.of(4L));
        when(repository.findByIds(List.of(4L))).thenReturn(List.of(record(4L)));
        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            assertTrue(service(worker).schedule(List.of(4L)));
            verify(repository, timeout(2000)).updateEmbeddings(anyMap());
        } finally {
            worker.shutdownNow();
        }
    }

    @Test
    void fullQueueRejectsWithoutThrowing() {
        ExecutorService saturated = mock(ExecutorService.class);
        doThrow(new RejectedExecutionException("full")).when(saturated).execute(any(Runnable.class));

        assertFalse(service(saturated).schedule(List.of(1L)));
        assertEquals(1.0, meterRegistry.counter(
            "search.embedding.backfill.scheduled.total", "result", "rejected").count());
    }

    @Test
    void disabledBackfillNeverSchedules() {
        properties.getBackfill().setEnabled(false);
        ExecutorService executor = mock(ExecutorService.class);

        assertFalse(service(executor).schedule(List.of(1L)));
        verify(executor, never()).execute(any(Runnable.class));
    }

    private EmbeddingBackfillService service(ExecutorService executor) {
        return new EmbeddingBackfillService(
            executor,
            repository,
            embeddingProvider,
            properties,
            transactionTemplate,
            meterRegistry
        );
    }

    private static ExecutorService unusedExecutor() {
        return mock(ExecutorService.class);
    }

    private static PaperRecord record(long id) {
        PaperRecord record = new PaperRecord();
        record.setId(id);
        record.setTitle("Paper number " + id);
        record.setAuthors(List.of("A. Author"));
        return record;
    }
}
