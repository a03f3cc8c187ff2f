package mediaflow.stage;

/**
 * Work done by one stage for one job.
 *
 * <p>Handlers classify their own failures and return a {@link StageResult}; a runtime
 * exception escaping a handler is treated by the queue as an unclassified failure.
 *
 * @param <J> the job variant the stage accepts
 */
@FunctionalInterface
public interface StageHandler<J extends StageJob> {

    StageResult handle(J job, StageContext<J> context);
}
