package com.geoledger.service.admin;

import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.core.model.ReviewPriority;
import com.geoledger.stages.api.RecordQuery;
import com.geoledger.stages.api.RecordStore;
import com.geoledger.stages.api.StorageException;
import com.geoledger.stages.api.StoreStatistics;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Operator surface over a record store: statistics, CSV export and import, clearing and the
 * review queue.
 */
public class RecordAdministration {
    private static final Logger LOGGER = Logger.getLogger(RecordAdministration.class.getName());

    public static final String CLEAR_CONFIRMATION = "yes";
    public static final Set<ReviewPriority> DEFAULT_REVIEW_PRIORITIES =
            Set.copyOf(EnumSet.range(ReviewPriority.LOW, ReviewPriority.CRITICAL));

    static final String[] REVIEW_HEADERS = {
            "ticket_key", "review_priority", "quality_tier", "confidence", "validation_flags",
            "latitude", "longitude", "street", "cross_street", "city", "county",
            "technique", "approach", "error_message", "created_at"
    };

    private static final Comparator<GeocodeRecord> REVIEW_ORDER =
            Comparator.comparing(GeocodeRecord::reviewPriority, ReviewPriority.MOST_URGENT_FIRST)
                    .thenComparing(GeocodeRecord::recordId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final RecordStore store;

    public RecordAdministration(RecordStore store) {
        this.store = Objects.requireNonNull(store, "store is required");
    }

    public StoreStatistics statistics() {
        return store.statistics();
    }

    /** Writes the current version of every ticket and returns the number of rows. */
    public int exportCurrent(Path target) {
        return writeRecords(target, store.query(RecordQuery.all()));
    }

    /** Writes every stored version, the form {@link #importCsv(Path)} expects. */
    public int exportAllVersions(Path target) {
        return writeRecords(target, store.allVersions());
    }

    /**
     * Restores the records of a full-history export in record id order. Returns the number of
     * versions restored. The whole file is checked against the store's chains first, so a rejected
     * import restores nothing.
     *
     * @throws StorageException if any version would break a ticket's chain or reuse a record id
     */
    public int importCsv(Path source) {
        List<GeocodeRecord> records = new ArrayList<>();
        try (CSVReader reader = new CSVReader(Files.newBufferedReader(source, StandardCharsets.UTF_8))) {
            String[] header = reader.readNext();
            if (header == null) {
                return 0;
            }
            Map<String, Integer> index = RecordCsv.columnIndex(header);
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) {
                    continue;
                }
                try {
                    records.add(RecordCsv.fromRow(row, index));
                } catch (RuntimeException e) {
                    throw new IllegalArgumentException("Invalid record on line " + reader.getLinesRead() + " of " + source, e);
                }
            }
        } catch (IOException | CsvValidationException e) {
            throw new IllegalStateException("Failed reading CSV " + source, e);
        }
        records.sort(Comparator.comparing(GeocodeRecord::recordId, Comparator.nullsLast(Comparator.naturalOrder())));
        checkChains(records);
        for (GeocodeRecord record : records) {
            store.restore(record);
        }
        LOGGER.info("Imported " + records.size() + " record versions from " + source);
        return records.size();
    }

    /**
     * Removes every record. Returns the number of versions removed.
     *
     * @throws IllegalArgumentException unless the confirmation is exactly {@value #CLEAR_CONFIRMATION}
     */
    public long clear(String confirmation) {
        if (!CLEAR_CONFIRMATION.equals(confirmation)) {
            throw new IllegalArgumentException("Clearing requires the confirmation token '" + CLEAR_CONFIRMATION + "'");
        }
        long removed = store.statistics().totalVersions();
        store.clear();
        LOGGER.warning("Cleared " + removed + " record versions");
        return removed;
    }

    /** Current records with one of the priorities, most urgent first then in write order. */
    public List<GeocodeRecord> reviewQueue(Set<ReviewPriority> priorities) {
        Set<ReviewPriority> selected = priorities == null || priorities.isEmpty() ? DEFAULT_REVIEW_PRIORITIES : priorities;
        List<GeocodeRecord> queue = new ArrayList<>(store.query(RecordQuery.all().withPriorities(selected)));
        queue.sort(REVIEW_ORDER);
        return queue;
    }

    public int writeReviewQueue(Path target, Set<ReviewPriority> priorities) {
        List<GeocodeRecord> queue = reviewQueue(priorities);
        try (CSVWriter writer = new CSVWriter(openWriter(target))) {
            writer.writeNext(REVIEW_HEADERS);
            for (GeocodeRecord r : queue) {
                writer.writeNext(new String[]{
                        r.ticketKey(),
                        r.reviewPriority().name(),
                        r.qualityTier().name(),
                        r.confidence() == null ? "" : String.format(Locale.ROOT, "%.2f%%", r.confidence() * 100.0),
                        String.join(",", r.validationFlags()),
                        r.hasCoordinates() ? Double.toString(r.coordinates().latitude()) : "",
                        r.hasCoordinates() ? Double.toString(r.coordinates().longitude()) : "",
                        nullToEmpty(r.location().street()),
                        nullToEmpty(r.location().crossStreet()),
                        nullToEmpty(r.location().city()),
                        nullToEmpty(r.location().county()),
                        nullToEmpty(r.technique()),
                        nullToEmpty(r.approach()),
                        nullToEmpty(r.errorMessage()),
                        r.createdAt() == null ? "" : r.createdAt().toString()
                });
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing review queue " + target, e);
        }
        LOGGER.info("Wrote " + queue.size() + " review queue entries to " + target);
        return queue.size();
    }

    private void checkChains(List<GeocodeRecord> records) {
        Set<Long> usedIds = new HashSet<>();
        for (GeocodeRecord stored : store.allVersions()) {
            usedIds.add(stored.recordId());
        }
        Map<String, GeocodeRecord> tails = new HashMap<>();
        for (GeocodeRecord record : records) {
            if (record.recordId() == null) {
                throw new StorageException("Imported record for " + record.ticketKey() + " has no record id");
            }
            if (!usedIds.add(record.recordId())) {
                throw new StorageException("Duplicate record id " + record.recordId());
            }
            GeocodeRecord tail = tails.containsKey(record.ticketKey())
                    ? tails.get(record.ticketKey())
                    : store.getHistory(record.ticketKey()).stream().findFirst().orElse(null);
            int expectedVersion = tail == null ? 1 : tail.version() + 1;
            Long expectedSupersedes = tail == null ? null : tail.recordId();
            if (record.version() != expectedVersion || !Objects.equals(expectedSupersedes, record.supersedesRecordId())) {
                throw new StorageException("Version chain break for " + record.ticketKey()
                        + ": expected v" + expectedVersion + " superseding " + expectedSupersedes
                        + " but got v" + record.version() + " superseding " + record.supersedesRecordId());
            }
            tails.put(record.ticketKey(), record);
        }
    }

    private int writeRecords(Path target, List<GeocodeRecord> records) {
        try (CSVWriter writer = new CSVWriter(openWriter(target))) {
            writer.writeNext(RecordCsv.HEADERS);
            for (GeocodeRecord record : records) {
                writer.writeNext(RecordCsv.toRow(record));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing CSV " + target, e);
        }
        LOGGER.info("Exported " + records.size() + " records to " + target);
        return records.size();
    }

    private static Writer openWriter(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newBufferedWriter(target, StandardCharsets.UTF_8);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
