package io.holdings.ownership.store;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.holdings.ownership.model.Bracket;
import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.model.StoreKey;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a stored snapshot. Output is deterministic (fixed field order, LF line ends) so
 * storing the same snapshot twice yields identical bytes.
 */
final class SnapshotCodec {
    static final int FORMAT_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES);
    private static final ObjectWriter WRITER = MAPPER.writer(
            new DefaultPrettyPrinter().withObjectIndenter(new DefaultIndenter("  ", "\n")));
    private static final ObjectReader READER = MAPPER.readerFor(StoredSnapshot.class);

    private SnapshotCodec() {}

    static byte[] encode(OwnershipSnapshot s) throws IOException {
        List<StoredBracket> brackets = new ArrayList<>(s.brackets().size());
        for (Bracket b : s.brackets()) {
            brackets.add(new StoredBracket(b.bracketId(), b.holderCount(), b.shareCount()));
        }
        return WRITER.writeValueAsBytes(new StoredSnapshot(FORMAT_VERSION, s.security().value(), s.date(), s.totalShares(), brackets));
    }

    /** Decode and validate a record read from {@code key}'s location. */
    static OwnershipSnapshot decode(StoreKey key, byte[] bytes) throws CorruptRecordException {
        StoredSnapshot stored;
        try {
            stored = READER.readValue(bytes);
        } catch (IOException e) {
            throw new CorruptRecordException(key, "unreadable JSON (" + e.getMessage() + ")", e);
        }
        if (stored.format() != FORMAT_VERSION) {
            throw new CorruptRecordException(key, "unsupported format version " + stored.format(), null);
        }
        OwnershipSnapshot snapshot;
        try {
            List<Bracket> brackets = new ArrayList<>();
            for (StoredBracket b : stored.brackets()) {
                brackets.add(new Bracket(b.id(), b.holders(), b.shares()));
            }
            snapshot = new OwnershipSnapshot(SecurityId.of(stored.security()), stored.date(), stored.totalShares(), brackets);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new CorruptRecordException(key, e.getMessage(), e);
        }
        if (!snapshot.key().equals(key)) {
            throw new CorruptRecordException(key, "record belongs to " + snapshot.key(), null);
        }
        return snapshot;
    }

    @JsonPropertyOrder({"format", "security", "date", "totalShares", "brackets"})
    record StoredSnapshot(int format, String security, LocalDate date, long totalShares, List<StoredBracket> brackets) {}

    @JsonPropertyOrder({"id", "holders", "shares"})
    record StoredBracket(String id, long holders, long shares) {}
}
