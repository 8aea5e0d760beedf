package dao.fhe.mystery.model;

import lombok.Data;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Data
public class Batch {

    private long id;
    private boolean open;
    private int submissionCount;
    private long openedAt; // unix seconds
    private long closedAt; // unix seconds, 0 while open

    /**
     * Running opaque sums. A field without an entry is still uninitialized.
     */
    private Map<Field, CipherHandle> aggregates = new EnumMap<>(Field.class);

    private Set<String> submittedAddresses = new LinkedHashSet<>();
    private Set<String> requestedAddresses = new LinkedHashSet<>();
    private Set<String> accusedAddresses = new LinkedHashSet<>();

    /**
     * Guess of each accuser, kept so the equality can be recomputed at settlement time.
     */
    private Map<String, SealedTriple> guesses = new LinkedHashMap<>();

    /**
     * Detached copy; mutating it does not touch this batch.
     */
    public Batch copy() {
        Batch copy = new Batch();
        copy.setId(id);
        copy.setOpen(open);
        copy.setSubmissionCount(submissionCount);
        copy.setOpenedAt(openedAt);
        copy.setClosedAt(closedAt);
        copy.getAggregates().putAll(aggregates);
        copy.setSubmittedAddresses(new LinkedHashSet<>(submittedAddresses));
        copy.setRequestedAddresses(new LinkedHashSet<>(requestedAddresses));
        copy.setAccusedAddresses(new LinkedHashSet<>(accusedAddresses));
        copy.setGuesses(new LinkedHashMap<>(guesses));
        return copy;
    }
}
