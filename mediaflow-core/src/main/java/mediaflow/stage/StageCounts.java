package mediaflow.stage;

/**
 * Point-in-time job counts of one stage queue.
 *
 * @param waiting   jobs queued and ready
 * @param active    jobs being handled
 * @param completed jobs finished since start
 * @param failed    jobs failed terminally since start
 * @param delayed   jobs scheduled for later (retries and status polls)
 */
public record StageCounts(int waiting, int active, long completed, long failed, int delayed) {
}
