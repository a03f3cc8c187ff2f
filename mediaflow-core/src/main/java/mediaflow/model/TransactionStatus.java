package mediaflow.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a {@link Transaction}, persisted as an integer code.
 *
 * <pre>
 * CREATED -> PROCESSING -> RESPONSE_GENERATED -> DELIVERED*
 * CREATED|PROCESSING|RESPONSE_GENERATED -> FAILURE_TEMPORARY -> DELIVERED* | FAILURE_PERMANENT*
 * (any non-terminal) -> RECOVERY_IN_PROGRESS -> PROCESSING
 * </pre>
 *
 * {@code PROCESSING -> DELIVERED} occurs only while replaying a recovered transaction.
 */
public enum TransactionStatus {
    CREATED(0),
    PROCESSING(1),
    RESPONSE_GENERATED(2),
    DELIVERED(3),
    FAILURE_TEMPORARY(4),
    FAILURE_PERMANENT(5),
    RECOVERY_IN_PROGRESS(6);

    private final int code;

    TransactionStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == FAILURE_PERMANENT;
    }

    /**
     * Whether the ledger may move a transaction from this status to {@code next}.
     * {@code FAILURE_TEMPORARY} may repeat while attempts accumulate.
     *
     * @param next the target status
     * @return {@code true} if the edge exists in the state machine
     */
    public boolean canTransitionTo(TransactionStatus next) {
        return switch (this) {
            case CREATED -> next == PROCESSING || next == FAILURE_TEMPORARY
                    || next == RECOVERY_IN_PROGRESS;
            case PROCESSING -> next == RESPONSE_GENERATED || next == FAILURE_TEMPORARY
                    || next == RECOVERY_IN_PROGRESS || next == DELIVERED;
            case RESPONSE_GENERATED -> next == DELIVERED || next == FAILURE_TEMPORARY
                    || next == RECOVERY_IN_PROGRESS;
            case FAILURE_TEMPORARY -> next == DELIVERED || next == FAILURE_PERMANENT
                    || next == FAILURE_TEMPORARY || next == RECOVERY_IN_PROGRESS;
            case RECOVERY_IN_PROGRESS -> next == PROCESSING;
            case DELIVERED, FAILURE_PERMANENT -> false;
        };
    }

    /**
     * Statuses from which {@code target} is reachable in one step.
     *
     * @param target the target status
     * @return the source statuses, possibly empty
     */
    public static Set<TransactionStatus> sourcesOf(TransactionStatus target) {
        Set<TransactionStatus> sources = EnumSet.noneOf(TransactionStatus.class);
        for (TransactionStatus candidate : values()) {
            if (candidate.canTransitionTo(target)) {
                sources.add(candidate);
            }
        }
        return sources;
    }

    /**
     * Statuses eligible for startup replay when the transaction also carries a response
     * and recovery data.
     *
     * @return processing, response generated and temporary failure
     */
    public static Set<TransactionStatus> resumable() {
        return EnumSet.of(PROCESSING, RESPONSE_GENERATED, FAILURE_TEMPORARY);
    }

    /**
     * Statuses picked up by startup recovery: the resumable ones plus
     * {@code RECOVERY_IN_PROGRESS}, left behind when a previous recovery pass was interrupted.
     *
     * @return resumable statuses and recovery in progress
     */
    public static Set<TransactionStatus> recoverable() {
        Set<TransactionStatus> statuses = EnumSet.copyOf(resumable());
        statuses.add(RECOVERY_IN_PROGRESS);
        return statuses;
    }

    /** Statuses with no outgoing transition; only these are eligible for retention purges. */
    public static Set<TransactionStatus> terminal() {
        return EnumSet.of(DELIVERED, FAILURE_PERMANENT);
    }

    public static TransactionStatus fromCode(int code) {
        for (TransactionStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown transaction status code: " + code);
    }
}
