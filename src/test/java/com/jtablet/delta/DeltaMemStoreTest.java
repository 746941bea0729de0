package com.jtablet.delta;

import com.jtablet.columnar.ColumnBlock;
import com.jtablet.common.memory.Arena;
import com.jtablet.common.memory.ArenaExhaustedException;
import com.jtablet.common.memory.Slice;
import com.jtablet.common.schema.ColumnSchema;
import com.jtablet.common.schema.Schema;
import com.jtablet.common.schema.Type;
import com.jtablet.mvcc.MvccManager;
import com.jtablet.mvcc.MvccSnapshot;
import com.jtablet.mvcc.ScopedTransaction;
import com.jtablet.mvcc.TxId;
import com.jtablet.rowchange.RowChangeList;
import com.jtablet.rowchange.RowChangeListEncoder;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class DeltaMemStoreTest {
    private static final long MARKER = 0xDEADBEEFL;

    private final Schema uint32Schema = new Schema.Builder().addColumn("col1", Type.UINT32).build();
    private final MvccManager mvcc = new MvccManager();

    @Test
    void shouldApplySparseUpdatesOnly() throws IOException {
        DeltaMemStore dms = new DeltaMemStore(uint32Schema);
        RowChangeListEncoder update = new RowChangeListEncoder(uint32Schema);

        // Update 100 random rows out of the 1000.
        Random random = new Random(12345);
        Set<Integer> indexesToUpdate = new HashSet<>();
        while (indexesToUpdate.size() < 100) {
            indexesToUpdate.add(random.nextInt(1000));
        }
        for (int idx : indexesToUpdate) {
            try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
                update.reset();
                update.addColumnUpdate(0, (long) idx);
                dms.update(tx.getTxId(), idx, update.toRowChangeList());
            }
        }
        assertThat(dms.count()).isEqualTo(100);

        ColumnBlock readBack = markedUInt32Block(1000);
        applyUpdates(dms, mvcc.takeSnapshot(), 0, 0, readBack);

        for (int i = 0; i < 1000; i++) {
            if (indexesToUpdate.contains(i)) {
                assertThat(readBack.getUInt32(i)).as("row %d", i).isEqualTo(i);
            } else {
                assertThat(readBack.getUInt32(i)).as("row %d", i).isEqualTo(MARKER);
            }
        }
    }

    @Test
    void shouldKeepOldValueOfReUpdatedSliceForOldSnapshot() throws IOException {
        Schema schema = new Schema.Builder().addColumn("col1", Type.STRING).build();
        DeltaMemStore dms = new DeltaMemStore(schema);
        RowChangeListEncoder update = new RowChangeListEncoder(schema);

        // The caller's buffer is trashed right after each update, so the values
        // read back below can only come from the store's own copies.
        try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
            byte[] buf = update.addColumnUpdate(0, "update 1").toByteArray();
            dms.update(tx.getTxId(), 123, new RowChangeList(Slice.wrap(buf)));
            Arrays.fill(buf, (byte) 0xFF);
        }
        MvccSnapshot snapshotAfterFirstUpdate = mvcc.takeSnapshot();

        try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
            update.reset();
            byte[] buf = update.addColumnUpdate(0, "update 2").toByteArray();
            dms.update(tx.getTxId(), 123, new RowChangeList(Slice.wrap(buf)));
            Arrays.fill(buf, (byte) 0xFF);
        }
        MvccSnapshot snapshotAfterSecondUpdate = mvcc.takeSnapshot();

        assertThat(dms.count()).isEqualTo(2);

        ColumnBlock readBack = new ColumnBlock(Type.STRING, 1, new Arena(64, 1024));
        applyUpdates(dms, snapshotAfterFirstUpdate, 123, 0, readBack);
        assertThat(readBack.getString(0)).isEqualTo("update 1");

        applyUpdates(dms, snapshotAfterSecondUpdate, 123, 0, readBack);
        assertThat(readBack.getString(0)).isEqualTo("update 2");
    }

    @Test
    void shouldStoreEveryUpdateAsSeparateEntry() throws IOException {
        Schema schema = new Schema.Builder()
            .addColumn("col1", Type.STRING)
            .addColumn("col2", Type.STRING)
            .addColumn("col3", Type.UINT32)
            .build();
        DeltaMemStore dms = new DeltaMemStore(schema);
        RowChangeListEncoder update = new RowChangeListEncoder(schema);

        for (int i = 0; i < 1000; i++) {
            try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
                update.reset();
                update.addColumnUpdate(2, i * 10L);
                update.addColumnUpdate(0, "hello " + i);
                dms.update(tx.getTxId(), i, update.toRowChangeList());
            }
        }
        assertThat(dms.count()).isEqualTo(1000);

        MvccSnapshot snapshot = mvcc.takeSnapshot();
        Arena scanArena = new Arena(1024, 64 * 1024);
        ColumnBlock readBack = new ColumnBlock(Type.UINT32, 1000, scanArena);
        ColumnBlock readBackSlices = new ColumnBlock(Type.STRING, 1000, scanArena);
        applyUpdates(dms, snapshot, 0, 2, readBack);
        applyUpdates(dms, snapshot, 0, 0, readBackSlices);

        for (int i = 0; i < 1000; i++) {
            assertThat(readBack.getUInt32(i)).as("row %d", i).isEqualTo(i * 10L);
            assertThat(readBackSlices.getString(i)).as("row %d", i).isEqualTo("hello " + i);
        }

        // Same rows again in new transactions: the old entries must stay for
        // older snapshots, so the count doubles.
        for (int i = 0; i < 1000; i++) {
            try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
                update.reset();
                update.addColumnUpdate(2, i * 20L);
                dms.update(tx.getTxId(), i, update.toRowChangeList());
            }
        }
        assertThat(dms.count()).isEqualTo(2000);

        ColumnBlock old = new ColumnBlock(Type.UINT32, 1000, scanArena);
        applyUpdates(dms, snapshot, 0, 2, old);
        ColumnBlock latest = new ColumnBlock(Type.UINT32, 1000, scanArena);
        applyUpdates(dms, mvcc.takeSnapshot(), 0, 2, latest);
        for (int i = 0; i < 1000; i++) {
            assertThat(old.getUInt32(i)).isEqualTo(i * 10L);
            assertThat(latest.getUInt32(i)).isEqualTo(i * 20L);
        }
    }

    @Test
    void shouldReadValueAsOfEachSnapshot() throws IOException {
        DeltaMemStore dms = new DeltaMemStore(uint32Schema);

        TxId t1 = updateUInt32(dms, 0, 0L);
        MvccSnapshot s1 = mvcc.takeSnapshot();
        TxId t2 = updateUInt32(dms, 0, 10L);
        MvccSnapshot s2 = mvcc.takeSnapshot();

        assertThat(t2).isGreaterThan(t1);
        ColumnBlock block = markedUInt32Block(1);
        applyUpdates(dms, s1, 0, 0, block);
        assertThat(block.getUInt32(0)).isEqualTo(0L);

        block = markedUInt32Block(1);
        applyUpdates(dms, s2, 0, 0, block);
        assertThat(block.getUInt32(0)).isEqualTo(10L);
    }

    @Test
    void shouldHideUpdatesOfTransactionsInFlight() throws IOException {
        DeltaMemStore dms = new DeltaMemStore(uint32Schema);
        RowChangeListEncoder update = new RowChangeListEncoder(uint32Schema);
        updateUInt32(dms, 5, 1L);

        try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
            dms.update(tx.getTxId(), 5, update.addColumnUpdate(0, 2L).toRowChangeList());

            ColumnBlock block = markedUInt32Block(10);
            applyUpdates(dms, mvcc.takeSnapshot(), 0, 0, block);
            assertThat(block.getUInt32(5)).isEqualTo(1L);
        }

        ColumnBlock block = markedUInt32Block(10);
        applyUpdates(dms, mvcc.takeSnapshot(), 0, 0, block);
        assertThat(block.getUInt32(5)).isEqualTo(2L);
    }

    @Test
    void shouldApplyNothingForEmptySnapshot() throws IOException {
        DeltaMemStore dms = new DeltaMemStore(uint32Schema);
        updateUInt32(dms, 0, 1L);

        ColumnBlock block = markedUInt32Block(1);
        applyUpdates(dms, MvccSnapshot.includingNoTransactions(), 0, 0, block);

        assertThat(block.getUInt32(0)).isEqualTo(MARKER);
    }

    @Test
    void shouldRejectSecondChangeToSameRowInSameTransaction() throws IOException {
        DeltaMemStore dms = new DeltaMemStore(uint32Schema);
        RowChangeListEncoder update = new RowChangeListEncoder(uint32Schema);
        RowChangeList change = update.addColumnUpdate(0, 1L).toRowChangeList();

        try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
            dms.update(tx.getTxId(), 7, change);
            assertThatThrownBy(() -> dms.update(tx.getTxId(), 7, change))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already changed");
        }
        assertThat(dms.count()).isEqualTo(1);
    }

    @Test
    void shouldNotChargeRejectedChangeToMemoryLimit() throws IOException {
        DeltaStoreConfig config = new DeltaStoreConfig.Builder()
            .setArenaInitialBlockSize(16)
            .setArenaMaxBlockSize(16)
            .setMemoryLimitBytes(32)
            .build();
        Schema schema = new Schema.Builder().addColumn("s", Type.STRING).build();
        DeltaMemStore dms = new DeltaMemStore(schema, config);
        RowChangeListEncoder update = new RowChangeListEncoder(schema);
        // Header, column index and length plus 13 bytes fill a whole block.
        RowChangeList change = update.addColumnUpdate(0, "thirteen char").toRowChangeList();
        assertThat(change.size()).isEqualTo(16);

        try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
            dms.update(tx.getTxId(), 0, change);
            long footprint = dms.getMemoryFootprint();

            assertThatThrownBy(() -> dms.update(tx.getTxId(), 0, change))
                .isInstanceOf(IllegalStateException.class);
            assertThat(dms.getMemoryFootprint()).isEqualTo(footprint);

            dms.update(tx.getTxId(), 1, change);
        }
        assertThat(dms.count()).isEqualTo(2);
    }

    @Test
    void shouldFailUpdateWhenMemoryLimitIsReached() throws IOException {
        DeltaStoreConfig config = new DeltaStoreConfig.Builder()
            .setArenaInitialBlockSize(16)
            .setArenaMaxBlockSize(16)
            .setMemoryLimitBytes(16)
            .build();
        Schema schema = new Schema.Builder().addColumn("s", Type.STRING).build();
        DeltaMemStore dms = new DeltaMemStore(schema, config);
        RowChangeListEncoder update = new RowChangeListEncoder(schema);

        try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
            RowChangeList big = update.addColumnUpdate(0, "a value longer than sixteen bytes").toRowChangeList();
            assertThatThrownBy(() -> dms.update(tx.getTxId(), 0, big))
                .isInstanceOf(ArenaExhaustedException.class);
        }
        assertThat(dms.count()).isZero();
        assertThat(dms.isEmpty()).isTrue();
    }

    @Test
    void shouldDumpEntriesInKeyOrder() throws IOException {
        DeltaMemStore dms = new DeltaMemStore(uint32Schema);
        TxId t1 = updateUInt32(dms, 9, 1L);
        TxId t2 = updateUInt32(dms, 3, 2L);
        TxId t3;
        try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
            t3 = tx.getTxId();
            dms.update(t3, 3, RowChangeList.createDelete());
        }

        assertThat(dms.debugDump()).isEqualTo(
            "(row 3, " + t2 + "): SET col1=2\n"
                + "(row 3, " + t3 + "): DELETE\n"
                + "(row 9, " + t1 + "): SET col1=1\n");
        assertThat(dms.getMemoryFootprint()).isPositive();
    }

    @Test
    void shouldSupportConcurrentWritersAndReaders() throws Exception {
        DeltaMemStore dms = new DeltaMemStore(uint32Schema);
        int writers = 4;
        int rowsPerWriter = 1000;
        int totalRows = writers * rowsPerWriter;
        AtomicBoolean writersDone = new AtomicBoolean();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(writers + 2);
        try {
            List<Future<?>> writerFutures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                writerFutures.add(executor.submit(() -> {
                    start.await();
                    RowChangeListEncoder update = new RowChangeListEncoder(uint32Schema);
                    for (int i = 0; i < rowsPerWriter; i++) {
                        // Interleave the writers' rows so they insert next to each other.
                        int row = i * writers + writer;
                        try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
                            update.reset();
                            dms.update(tx.getTxId(), row, update.addColumnUpdate(0, (long) row).toRowChangeList());
                        }
                    }
                    return null;
                }));
            }
            List<Future<?>> readerFutures = new ArrayList<>();
            for (int r = 0; r < 2; r++) {
                readerFutures.add(executor.submit(() -> {
                    start.await();
                    while (!writersDone.get()) {
                        ColumnBlock block = markedUInt32Block(totalRows);
                        applyUpdates(dms, mvcc.takeSnapshot(), 0, 0, block);
                        for (int row = 0; row < totalRows; row++) {
                            long value = block.getUInt32(row);
                            if (value != MARKER && value != row) {
                                throw new AssertionError("row " + row + " read back as " + value);
                            }
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : writerFutures) {
                future.get(60, TimeUnit.SECONDS);
            }
            writersDone.set(true);
            for (Future<?> future : readerFutures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(dms.count()).isEqualTo(totalRows);
        ColumnBlock block = markedUInt32Block(totalRows);
        applyUpdates(dms, mvcc.takeSnapshot(), 0, 0, block);
        for (int row = 0; row < totalRows; row++) {
            assertThat(block.getUInt32(row)).isEqualTo(row);
        }
    }

    @Test
    void shouldKeepHighestTransactionWhenThreadsUpdateSameRow() throws Exception {
        DeltaMemStore dms = new DeltaMemStore(uint32Schema);
        Map<TxId, Long> written = new ConcurrentHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    RowChangeListEncoder update = new RowChangeListEncoder(uint32Schema);
                    for (int i = 0; i < 250; i++) {
                        long value = thread * 1000L + i;
                        try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
                            update.reset();
                            dms.update(tx.getTxId(), 0, update.addColumnUpdate(0, value).toRowChangeList());
                            written.put(tx.getTxId(), value);
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(dms.count()).isEqualTo(1000);
        TxId newest = written.keySet().stream().max(TxId::compareTo).orElseThrow();
        ColumnBlock block = markedUInt32Block(1);
        applyUpdates(dms, mvcc.takeSnapshot(), 0, 0, block);
        assertThat(block.getUInt32(0)).isEqualTo(written.get(newest));
    }

    private TxId updateUInt32(DeltaMemStore dms, int row, long value) throws IOException {
        RowChangeListEncoder update = new RowChangeListEncoder(dms.getSchema());
        try (ScopedTransaction tx = new ScopedTransaction(mvcc)) {
            dms.update(tx.getTxId(), row, update.addColumnUpdate(0, value).toRowChangeList());
            return tx.getTxId();
        }
    }

    private static ColumnBlock markedUInt32Block(int nrows) {
        ColumnBlock block = new ColumnBlock(Type.UINT32, nrows, new Arena(64, 1024));
        for (int i = 0; i < nrows; i++) {
            block.setUInt32(i, MARKER);
        }
        return block;
    }

    private static void applyUpdates(DeltaMemStore dms, MvccSnapshot snapshot, int rowIdx, int colIdx,
                                     ColumnBlock block) throws IOException {
        ColumnSchema column = dms.getSchema().getColumn(colIdx);
        Schema singleColumnProjection = new Schema(List.of(column), 0);

        DeltaIterator iter = dms.newDeltaIterator(singleColumnProjection, snapshot);
        iter.init();
        iter.seekToOrdinal(rowIdx);
        iter.prepareBatch(block.nrows());
        iter.applyUpdates(0, block);
    }
}
