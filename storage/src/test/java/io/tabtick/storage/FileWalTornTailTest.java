package io.tabtick.storage;

import io.tabtick.core.RestorationMode;
import io.tabtick.core.SnoozedItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private static byte[] snoozedRecord(String id) {
        var item = new SnoozedItem(id, "https://example.com/" + id, id, null, false, 5_000L, null, null, null,
                RestorationMode.NEW, null, 1_000L, null, null);
        return RecordCodec.encode(RecordKind.SNOOZED, id, RecordJson.encode(item));
    }

    private DurableRecordStore open() {
        return new DurableRecordStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir),
                new SnapshotPolicy(10_000));
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() throws Exception {
        var wal = new FileWal(walDir, 1L << 60); // huge rotate threshold so single segment
        wal.append(snoozedRecord("snz_1"));
        wal.append(snoozedRecord("snz_2"));
        // Third record only partially written (simulated crash mid-append)
        byte[] r3 = snoozedRecord("snz_3");
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(r3, 0, r3.length - 5);
            out.flush();
        }
        wal.close();

        var store = open();

        assertTrue(store.getSnoozed("snz_1").isPresent());
        assertTrue(store.getSnoozed("snz_2").isPresent());
        assertTrue(store.getSnoozed("snz_3").isEmpty());
        store.close();
    }

    @Test
    void writes_after_recovering_from_torn_tail_are_durable() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(snoozedRecord("snz_1"));
        byte[] torn = snoozedRecord("snz_2");
        try (OutputStream out = Files.newOutputStream(walDir.resolve("00000001.log"), APPEND)) {
            out.write(torn, 0, torn.length / 2);
        }
        wal.close();

        var store1 = open();
        store1.saveSnoozed(store1.getSnoozed("snz_1").orElseThrow().rescheduled(7_000L));
        store1.close();

        var store2 = open();

        assertEquals(7_000L, store2.getSnoozed("snz_1").orElseThrow().wakeAt());
        store2.close();
    }

    @Test
    void reader_walks_rotated_segments_in_order() throws Exception {
        var wal = new FileWal(walDir, 1); // rotate after every record
        wal.append(snoozedRecord("snz_1"));
        wal.rotateIfNeeded();
        wal.append(snoozedRecord("snz_2"));
        wal.rotateIfNeeded();
        wal.close();

        try (var reopened = new FileWal(walDir, 1); var reader = reopened.openReader()) {
            assertEquals("snz_1", RecordCodec.decode(reader.next()).key());
            assertEquals("snz_2", RecordCodec.decode(reader.next()).key());
            assertNull(reader.next());
        }
    }
}
